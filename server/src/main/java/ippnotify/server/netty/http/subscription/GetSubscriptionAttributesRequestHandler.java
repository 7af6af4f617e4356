package ippnotify.server.netty.http.subscription;

import ippnotify.api.model.AttributeGroup;
import ippnotify.api.model.GroupTag;
import ippnotify.api.model.IppResponse;
import ippnotify.api.request.subscription.GetSubscriptionAttributesRequest;
import ippnotify.api.response.IppException;
import ippnotify.server.printer.PrinterDirectory;
import ippnotify.server.subscription.RequestedAttributes;
import ippnotify.server.subscription.Subscription;
import ippnotify.server.subscription.SubscriptionRegistry;

public class GetSubscriptionAttributesRequestHandler extends IppOperationHandler<GetSubscriptionAttributesRequest> {

    public GetSubscriptionAttributesRequestHandler(SubscriptionRegistry registry, PrinterDirectory printerDirectory) {
        super(registry, printerDirectory);
    }

    @Override
    protected IppResponse handle(GetSubscriptionAttributesRequest request) throws IppException {
        Subscription s = findSubscription(request.getSubscriptionId(), resolvePrinter(request));
        IppResponse response = new IppResponse(request.getRequestId());
        AttributeGroup group = response.addGroup(GroupTag.SUBSCRIPTION);
        s.getAttributes(RequestedAttributes.of(request.getRequestedAttributes())).forEach(group::add);
        return response;
    }
}
