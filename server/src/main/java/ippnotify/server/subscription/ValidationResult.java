package ippnotify.server.subscription;

import java.util.Collections;
import java.util.List;

import ippnotify.api.model.IppAttribute;
import ippnotify.api.model.IppStatus;

/**
 * Outcome of validating one subscription group: a template when the group is acceptable, otherwise the failure status and the
 * offending attributes to echo back.
 */
public class ValidationResult {

    private final IppStatus status;
    private final SubscriptionTemplate template;
    private final List<IppAttribute> unsupported;

    private ValidationResult(IppStatus status, SubscriptionTemplate template, List<IppAttribute> unsupported) {
        this.status = status;
        this.template = template;
        this.unsupported = Collections.unmodifiableList(unsupported);
    }

    public static ValidationResult ok(SubscriptionTemplate template, List<IppAttribute> unsupported) {
        return new ValidationResult(IppStatus.SUCCESSFUL_OK, template, unsupported);
    }

    public static ValidationResult failed(IppStatus status, List<IppAttribute> unsupported) {
        return new ValidationResult(status, null, unsupported);
    }

    public boolean isValid() {
        return template != null;
    }

    public IppStatus getStatus() {
        return status;
    }

    public SubscriptionTemplate getTemplate() {
        return template;
    }

    public List<IppAttribute> getUnsupported() {
        return unsupported;
    }
}
