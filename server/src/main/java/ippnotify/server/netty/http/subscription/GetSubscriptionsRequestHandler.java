package ippnotify.server.netty.http.subscription;

import java.util.List;

import ippnotify.api.model.AttributeGroup;
import ippnotify.api.model.GroupTag;
import ippnotify.api.model.IppResponse;
import ippnotify.api.request.subscription.GetSubscriptionsRequest;
import ippnotify.api.response.IppException;
import ippnotify.server.printer.PrinterDirectory;
import ippnotify.server.subscription.RequestedAttributes;
import ippnotify.server.subscription.Subscription;
import ippnotify.server.subscription.SubscriptionFilter;
import ippnotify.server.subscription.SubscriptionRegistry;

/**
 * Lists subscriptions across the system and every printer. A printer target must still exist.
 */
public class GetSubscriptionsRequestHandler extends IppOperationHandler<GetSubscriptionsRequest> {

    public GetSubscriptionsRequestHandler(SubscriptionRegistry registry, PrinterDirectory printerDirectory) {
        super(registry, printerDirectory);
    }

    @Override
    protected IppResponse handle(GetSubscriptionsRequest request) throws IppException {
        resolvePrinter(request);
        SubscriptionFilter filter = new SubscriptionFilter().setJobId(request.getJobId())
                        .setOwner(request.isMySubscriptions() ? request.getUsername() : null).setLimit(request.getLimit());
        List<Subscription> subscriptions = registry.list(filter);

        RequestedAttributes requested = RequestedAttributes.of(request.getRequestedAttributes());
        IppResponse response = new IppResponse(request.getRequestId());
        for (Subscription s : subscriptions) {
            AttributeGroup group = response.addGroup(GroupTag.SUBSCRIPTION);
            s.getAttributes(requested).forEach(group::add);
        }
        return response;
    }
}
