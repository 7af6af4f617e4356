package ippnotify.server.netty.http.subscription;

import ippnotify.api.model.IppResponse;
import ippnotify.api.model.IppStatus;
import ippnotify.api.request.subscription.CancelSubscriptionRequest;
import ippnotify.api.response.IppException;
import ippnotify.server.printer.PrinterDirectory;
import ippnotify.server.subscription.Subscription;
import ippnotify.server.subscription.SubscriptionRegistry;

public class CancelSubscriptionRequestHandler extends IppOperationHandler<CancelSubscriptionRequest> {

    public CancelSubscriptionRequestHandler(SubscriptionRegistry registry, PrinterDirectory printerDirectory) {
        super(registry, printerDirectory);
    }

    @Override
    protected IppResponse handle(CancelSubscriptionRequest request) throws IppException {
        Subscription s = findSubscription(request.getSubscriptionId(), resolvePrinter(request));
        if (!registry.cancel(s.getId())) {
            // cancelled or expired since the lookup
            throw new IppException(IppStatus.CLIENT_ERROR_NOT_FOUND, "Subscription #" + s.getId() + " was not found.");
        }
        return new IppResponse(request.getRequestId());
    }
}
