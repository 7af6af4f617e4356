package ippnotify.server.netty.http.subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import ippnotify.api.model.IppResponse;
import ippnotify.api.model.IppStatus;
import ippnotify.api.request.IppRequest;
import ippnotify.api.response.IppException;
import ippnotify.netty.http.IppHttpHandler;
import ippnotify.server.printer.Printer;
import ippnotify.server.printer.PrinterDirectory;
import ippnotify.server.subscription.Subscription;
import ippnotify.server.subscription.SubscriptionRegistry;

/**
 * Base of the handlers that answer one kind of subscription request. A failure raised as {@link IppException} becomes an IPP response
 * carrying its status.
 */
public abstract class IppOperationHandler<T extends IppRequest> extends SimpleChannelInboundHandler<T> implements IppHttpHandler {

    private static final Logger log = LoggerFactory.getLogger(IppOperationHandler.class);

    protected final SubscriptionRegistry registry;
    protected final PrinterDirectory printerDirectory;

    protected IppOperationHandler(SubscriptionRegistry registry, PrinterDirectory printerDirectory) {
        this.registry = registry;
        this.printerDirectory = printerDirectory;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, T request) throws Exception {
        IppResponse response;
        try {
            response = handle(request);
        } catch (IppException e) {
            log.debug("{} failed with {}: {}", request.getOperation(), e.getStatus(), e.getMessage());
            sendIppError(ctx, e.setRequestId(request.getRequestId()));
            return;
        }
        response.setRequestId(request.getRequestId());
        sendIppResponse(ctx, response);
    }

    /**
     * Performs the operation.
     *
     * @throws IppException
     *             when the whole request fails
     */
    protected abstract IppResponse handle(T request) throws IppException;

    /**
     * @return the printer the request was posted to, null for the system
     * @throws IppException
     *             with client-error-not-found for an unknown printer
     */
    protected Printer resolvePrinter(IppRequest request) throws IppException {
        if (request.getPrinterName() == null) {
            return null;
        }
        Printer printer = printerDirectory.findPrinter(request.getPrinterName());
        if (printer == null) {
            throw new IppException(IppStatus.CLIENT_ERROR_NOT_FOUND, "Printer " + request.getPrinterName() + " was not found.");
        }
        return printer;
    }

    /**
     * Looks up the subscription a request names.
     *
     * @param printer
     *            the printer the request targets, null for the system
     * @throws IppException
     *             with client-error-not-found when no such subscription exists, client-error-not-possible when it belongs to another
     *             printer
     */
    protected Subscription findSubscription(int subscriptionId, Printer printer) throws IppException {
        Subscription s = registry.findById(subscriptionId);
        if (s == null) {
            throw new IppException(IppStatus.CLIENT_ERROR_NOT_FOUND, "Subscription #" + subscriptionId + " was not found.");
        }
        if (printer != null && !Integer.valueOf(printer.getId()).equals(s.getScope().getPrinterId())) {
            throw new IppException(IppStatus.CLIENT_ERROR_NOT_POSSIBLE,
                            "Subscription #" + subscriptionId + " is not assigned to the specified printer.");
        }
        return s;
    }
}
