package ippnotify.server.netty.http.subscription;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ippnotify.api.model.AttributeGroup;
import ippnotify.api.model.GroupTag;
import ippnotify.api.model.IppAttribute;
import ippnotify.api.model.IppResponse;
import ippnotify.api.model.ValueTag;
import ippnotify.api.request.subscription.GetNotificationsRequest;
import ippnotify.api.response.IppException;
import ippnotify.common.configuration.SubscriptionProperties;
import ippnotify.server.printer.Printer;
import ippnotify.server.printer.PrinterDirectory;
import ippnotify.server.subscription.NotificationEvent;
import ippnotify.server.subscription.NotificationRecord;
import ippnotify.server.subscription.Subscription;
import ippnotify.server.subscription.SubscriptionRegistry;

/**
 * Returns buffered events of one or more subscriptions. Reading acknowledges the events before the requested sequence numbers. The
 * call never waits for new events, notify-wait is accepted and answered at once.
 */
public class GetNotificationsRequestHandler extends IppOperationHandler<GetNotificationsRequest> {

    private static final Logger log = LoggerFactory.getLogger(GetNotificationsRequestHandler.class);
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(ZoneOffset.UTC);

    private final int batchSize;
    private final int getInterval;

    public GetNotificationsRequestHandler(SubscriptionRegistry registry, PrinterDirectory printerDirectory, SubscriptionProperties subscriptionProperties) {
        super(registry, printerDirectory);
        this.batchSize = subscriptionProperties.getNotificationBatchSize();
        this.getInterval = subscriptionProperties.getGetIntervalSeconds();
    }

    @Override
    protected IppResponse handle(GetNotificationsRequest request) throws IppException {
        Printer printer = resolvePrinter(request);
        List<Subscription> subscriptions = new ArrayList<>();
        for (Integer id : request.getSubscriptionIds()) {
            subscriptions.add(findSubscription(id, printer));
        }
        int limit = (request.getLimit() == 0) ? batchSize : Math.min(request.getLimit(), batchSize);

        IppResponse response = new IppResponse(request.getRequestId());
        response.getOperationGroup().add(IppAttribute.integer("notify-get-interval", getInterval));
        String now = format(registry.getClock().instant());
        response.getOperationGroup().add(new IppAttribute("printer-current-time", ValueTag.DATE_TIME, List.of(now)));

        for (int i = 0; i < subscriptions.size(); i++) {
            Subscription s = subscriptions.get(i);
            List<NotificationRecord> records = s.retrieve(request.getLastSeen(i), limit);
            log.trace("[{}] Returning {} notifications", s.getId(), records.size());
            for (NotificationRecord r : records) {
                addNotification(response.addGroup(GroupTag.EVENT_NOTIFICATION), s, r);
            }
        }
        return response;
    }

    private static void addNotification(AttributeGroup group, Subscription s, NotificationRecord record) {
        group.add(IppAttribute.integer("notify-subscription-id", s.getId()));
        group.add(IppAttribute.integer("notify-sequence-number", record.getSequenceNumber()));
        group.add(IppAttribute.charset("notify-charset", IppResponse.CHARSET));
        group.add(IppAttribute.naturalLanguage("notify-natural-language", s.getLanguage()));
        if (s.getUserData() != null) {
            group.add(IppAttribute.octetString("notify-user-data", s.getUserData()));
        }
        if (record.isDropMarker()) {
            group.add(IppAttribute.keyword("notify-subscribed-event", NotificationRecord.EVENTS_DROPPED));
            group.add(IppAttribute.text("notify-text", record.getDroppedCount() + " events were dropped."));
            return;
        }
        NotificationEvent event = record.getEvent();
        group.add(IppAttribute.keyword("notify-subscribed-event", event.getKind().getKeyword()));
        group.add(IppAttribute.text("notify-text", event.getText()));
        group.add(new IppAttribute("notify-time", ValueTag.DATE_TIME, List.of(format(event.getTime()))));
        if (event.getPrinterId() != null) {
            group.add(IppAttribute.integer("notify-printer-id", event.getPrinterId()));
        }
        if (event.getJobId() != null) {
            group.add(IppAttribute.integer("notify-job-id", event.getJobId()));
        }
        event.getSnapshot().forEach(a -> group.add(a.copy()));
    }

    private static String format(Instant time) {
        return DATE_TIME.format(time);
    }
}
