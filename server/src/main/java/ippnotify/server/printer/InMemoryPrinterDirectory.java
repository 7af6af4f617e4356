package ippnotify.server.printer;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ippnotify.api.model.EventKind;
import ippnotify.server.subscription.NotificationEvent;
import ippnotify.server.subscription.SubscriptionRegistry;

/**
 * Printers and jobs held in memory. Every change is published to the subscription registry as the matching event.
 */
public class InMemoryPrinterDirectory implements PrinterDirectory {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPrinterDirectory.class);

    private final SubscriptionRegistry registry;
    private final Map<String,Printer> printersByName = new ConcurrentHashMap<>();
    private final Map<Integer,Printer> printersById = new ConcurrentHashMap<>();
    private final Map<Integer,Job> jobs = new ConcurrentHashMap<>();
    private final AtomicInteger nextPrinterId = new AtomicInteger(1);
    private final AtomicInteger nextJobId = new AtomicInteger(1);

    public InMemoryPrinterDirectory(SubscriptionRegistry registry, List<String> printerNames) {
        this.registry = registry;
        printerNames.forEach(this::addPrinter);
    }

    @Override
    public Printer findPrinter(String name) {
        return (name == null) ? null : printersByName.get(name);
    }

    @Override
    public Printer findPrinter(int printerId) {
        return printersById.get(printerId);
    }

    @Override
    public Job findJob(int printerId, int jobId) {
        Job job = jobs.get(jobId);
        if (job == null || job.getPrinter().getId() != printerId) {
            return null;
        }
        return job;
    }

    /**
     * Adds a printer, or returns the existing one with that name.
     */
    public Printer addPrinter(String name) {
        Printer printer;
        synchronized (printersByName) {
            Printer existing = printersByName.get(name);
            if (existing != null) {
                return existing;
            }
            printer = new Printer(nextPrinterId.getAndIncrement(), name);
            printersByName.put(name, printer);
            printersById.put(printer.getId(), printer);
        }
        log.info("Added printer {}", printer);
        publish(EventKind.PRINTER_CREATED, printer, null, "Printer " + name + " created.");
        return printer;
    }

    public Job addJob(String printerName, String jobName, String username) {
        Printer printer = requirePrinter(printerName);
        Job job = new Job(nextJobId.getAndIncrement(), printer, jobName, username);
        jobs.put(job.getId(), job);
        log.debug("Added job {}", job);
        publish(EventKind.JOB_CREATED, printer, job, "Job #" + job.getId() + " created.");
        return job;
    }

    public void setJobState(Job job, JobState state) {
        job.setState(state);
        publish(EventKind.JOB_STATE_CHANGED, job.getPrinter(), job, "Job #" + job.getId() + " is " + state.getKeyword() + ".");
        if (state.isTerminal()) {
            publish(EventKind.JOB_COMPLETED, job.getPrinter(), job, "Job #" + job.getId() + " " + state.getKeyword() + ".");
        }
    }

    public void setPrinterState(String printerName, PrinterState state) {
        Printer printer = requirePrinter(printerName);
        printer.setState(state);
        publish(EventKind.PRINTER_STATE_CHANGED, printer, null, "Printer " + printerName + " is " + state.getKeyword() + ".");
        if (state == PrinterState.STOPPED) {
            publish(EventKind.PRINTER_STOPPED, printer, null, "Printer " + printerName + " stopped.");
        }
    }

    private Printer requirePrinter(String printerName) {
        Printer printer = findPrinter(printerName);
        if (printer == null) {
            throw new IllegalArgumentException("No printer named " + printerName);
        }
        return printer;
    }

    private void publish(EventKind kind, Printer printer, Job job, String text) {
        NotificationEvent event = new NotificationEvent(kind, registry.getClock().instant(), printer.getId(), (job == null) ? null : job.getId(), text,
                        (job == null) ? printer.describe() : job.describe());
        registry.publish(event);
    }
}
