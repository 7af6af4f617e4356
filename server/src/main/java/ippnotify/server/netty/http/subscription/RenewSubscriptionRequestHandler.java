package ippnotify.server.netty.http.subscription;

import ippnotify.api.model.IppResponse;
import ippnotify.api.request.subscription.RenewSubscriptionRequest;
import ippnotify.api.response.IppException;
import ippnotify.common.configuration.SubscriptionProperties;
import ippnotify.server.printer.PrinterDirectory;
import ippnotify.server.subscription.Subscription;
import ippnotify.server.subscription.SubscriptionRegistry;

public class RenewSubscriptionRequestHandler extends IppOperationHandler<RenewSubscriptionRequest> {

    private final int defaultLeaseSeconds;

    public RenewSubscriptionRequestHandler(SubscriptionRegistry registry, PrinterDirectory printerDirectory, SubscriptionProperties subscriptionProperties) {
        super(registry, printerDirectory);
        this.defaultLeaseSeconds = subscriptionProperties.getDefaultLeaseSeconds();
    }

    @Override
    protected IppResponse handle(RenewSubscriptionRequest request) throws IppException {
        Subscription s = findSubscription(request.getSubscriptionId(), resolvePrinter(request));
        Integer lease = request.getLeaseDuration();
        registry.renew(s, (lease == null) ? defaultLeaseSeconds : lease);
        return new IppResponse(request.getRequestId());
    }
}
