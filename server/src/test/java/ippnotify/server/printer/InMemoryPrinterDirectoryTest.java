package ippnotify.server.printer;

import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import ippnotify.api.model.EventKind;
import ippnotify.api.model.IppAttribute;
import ippnotify.common.configuration.SubscriptionProperties;
import ippnotify.server.subscription.NotificationRecord;
import ippnotify.server.subscription.Subscription;
import ippnotify.server.subscription.SubscriptionRegistry;
import ippnotify.server.subscription.SubscriptionScope;
import ippnotify.server.subscription.SubscriptionTemplate;
import ippnotify.server.test.TestClock;

public class InMemoryPrinterDirectoryTest {

    private SubscriptionRegistry registry;
    private InMemoryPrinterDirectory directory;

    @Before
    public void setup() {
        registry = new SubscriptionRegistry(new SubscriptionProperties(), new TestClock(Instant.parse("2024-01-01T00:00:00Z")));
        directory = new InMemoryPrinterDirectory(registry, Arrays.asList("lobby", "lab"));
    }

    @Test
    public void testLookup() {
        Printer lobby = directory.findPrinter("lobby");
        Assert.assertEquals(1, lobby.getId());
        Assert.assertSame(lobby, directory.findPrinter(1));
        Assert.assertSame(lobby, directory.addPrinter("lobby"));
        Assert.assertNull(directory.findPrinter("nowhere"));
        Assert.assertNull(directory.findPrinter(null));

        Job job = directory.addJob("lab", "report", "alice");
        Assert.assertSame(job, directory.findJob(2, job.getId()));
        Assert.assertNull(directory.findJob(1, job.getId()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testJobOnUnknownPrinter() {
        directory.addJob("nowhere", "report", "alice");
    }

    @Test
    public void testStateChangesPublishEvents() throws Exception {
        Subscription s = registry.create(SubscriptionScope.system(), new SubscriptionTemplate(
                        EnumSet.of(EventKind.PRINTER_CREATED, EventKind.PRINTER_STOPPED, EventKind.JOB_COMPLETED), "en", null, 0, 0), "alice");
        directory.addPrinter("annex");
        directory.setPrinterState("annex", PrinterState.STOPPED);
        Job job = directory.addJob("annex", "report", "alice");
        directory.setJobState(job, JobState.PROCESSING);
        directory.setJobState(job, JobState.ABORTED);

        List<NotificationRecord> records = s.retrieve(0, 0);
        Assert.assertEquals(3, records.size());
        Assert.assertEquals(EventKind.PRINTER_CREATED, records.get(0).getEvent().getKind());
        Assert.assertEquals(EventKind.PRINTER_STOPPED, records.get(1).getEvent().getKind());
        Assert.assertTrue(records.get(1).getEvent().getSnapshot().contains(IppAttribute.enumValue("printer-state", PrinterState.STOPPED.getValue())));
        Assert.assertEquals(EventKind.JOB_COMPLETED, records.get(2).getEvent().getKind());
        Assert.assertEquals(Integer.valueOf(job.getId()), records.get(2).getEvent().getJobId());
    }
}
