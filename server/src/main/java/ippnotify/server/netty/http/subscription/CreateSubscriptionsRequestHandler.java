package ippnotify.server.netty.http.subscription;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ippnotify.api.model.AttributeGroup;
import ippnotify.api.model.GroupTag;
import ippnotify.api.model.IppAttribute;
import ippnotify.api.model.IppResponse;
import ippnotify.api.model.IppStatus;
import ippnotify.api.request.subscription.CreateSubscriptionsRequest;
import ippnotify.api.response.IppException;
import ippnotify.server.printer.Job;
import ippnotify.server.printer.Printer;
import ippnotify.server.printer.PrinterDirectory;
import ippnotify.server.subscription.Subscription;
import ippnotify.server.subscription.SubscriptionAttributeValidator;
import ippnotify.server.subscription.SubscriptionRegistry;
import ippnotify.server.subscription.SubscriptionScope;
import ippnotify.server.subscription.ValidationResult;

/**
 * Create-System-Subscriptions, Create-Printer-Subscriptions and Create-Job-Subscriptions. Each subscription group is validated and
 * created on its own; the response has one subscription group per request group, in order.
 */
public class CreateSubscriptionsRequestHandler extends IppOperationHandler<CreateSubscriptionsRequest> {

    private static final Logger log = LoggerFactory.getLogger(CreateSubscriptionsRequestHandler.class);

    private final SubscriptionAttributeValidator validator;

    public CreateSubscriptionsRequestHandler(SubscriptionRegistry registry, PrinterDirectory printerDirectory, SubscriptionAttributeValidator validator) {
        super(registry, printerDirectory);
        this.validator = validator;
    }

    @Override
    protected IppResponse handle(CreateSubscriptionsRequest request) throws IppException {
        SubscriptionScope scope = resolveScope(request);
        String username = request.getUsername();
        IppResponse response = new IppResponse(request.getRequestId());

        List<AttributeGroup> groups = request.getSubscriptionGroups();
        int ok = 0;
        for (AttributeGroup group : groups) {
            AttributeGroup result = response.addGroup(GroupTag.SUBSCRIPTION);
            ValidationResult validation = validator.validate(group);
            validation.getUnsupported().forEach(result::add);
            if (!validation.isValid()) {
                result.add(IppAttribute.enumValue("notify-status-code", validation.getStatus().getCode()));
                continue;
            }
            try {
                Subscription s = registry.create(scope, validation.getTemplate(), username);
                result.add(IppAttribute.integer("notify-subscription-id", s.getId()));
                ok++;
            } catch (IppException e) {
                log.warn("Unable to create subscription for {}: {}", username, e.getMessage());
                result.add(IppAttribute.enumValue("notify-status-code", e.getStatus().getCode()));
            }
        }

        if (ok == 0 && !groups.isEmpty()) {
            response.setStatus(IppStatus.CLIENT_ERROR_IGNORED_ALL_SUBSCRIPTIONS, null);
        } else if (ok != groups.size()) {
            response.setStatus(IppStatus.SUCCESSFUL_OK_IGNORED_SUBSCRIPTIONS, null);
        }
        log.debug("{} created {} of {} subscriptions for {}", request.getOperation(), ok, groups.size(), username);
        return response;
    }

    private SubscriptionScope resolveScope(CreateSubscriptionsRequest request) throws IppException {
        Printer printer = resolvePrinter(request);
        switch (request.getScopeType()) {
            case JOB:
                requirePrinter(request, printer);
                int jobId = request.getJobId();
                Job job = printerDirectory.findJob(printer.getId(), jobId);
                if (job == null) {
                    throw new IppException(IppStatus.CLIENT_ERROR_NOT_FOUND, "Job #" + jobId + " not found.");
                }
                return SubscriptionScope.job(printer.getId(), printer.getName(), job.getId());
            case PRINTER:
                requirePrinter(request, printer);
                return SubscriptionScope.printer(printer.getId(), printer.getName());
            default:
                if (printer != null) {
                    throw new IppException(IppStatus.CLIENT_ERROR_NOT_POSSIBLE, request.getOperation() + " must be sent to the system.");
                }
                return SubscriptionScope.system();
        }
    }

    private static void requirePrinter(CreateSubscriptionsRequest request, Printer printer) throws IppException {
        if (printer == null) {
            throw new IppException(IppStatus.CLIENT_ERROR_BAD_REQUEST, request.getOperation() + " must be sent to a printer.");
        }
    }
}
