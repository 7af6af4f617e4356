package ippnotify.server.subscription;

import java.util.Objects;

import ippnotify.api.model.ScopeType;

/**
 * What a subscription watches. Printer and job are identities resolved when the subscription is created; they are compared, never
 * looked up again.
 */
public final class SubscriptionScope {

    private static final SubscriptionScope SYSTEM = new SubscriptionScope(ScopeType.SYSTEM, null, null, null);

    private final ScopeType type;
    private final Integer printerId;
    private final String printerName;
    private final Integer jobId;

    private SubscriptionScope(ScopeType type, Integer printerId, String printerName, Integer jobId) {
        this.type = type;
        this.printerId = printerId;
        this.printerName = printerName;
        this.jobId = jobId;
    }

    public static SubscriptionScope system() {
        return SYSTEM;
    }

    public static SubscriptionScope printer(int printerId, String printerName) {
        return new SubscriptionScope(ScopeType.PRINTER, printerId, printerName, null);
    }

    public static SubscriptionScope job(int printerId, String printerName, int jobId) {
        return new SubscriptionScope(ScopeType.JOB, printerId, printerName, jobId);
    }

    public ScopeType getType() {
        return type;
    }

    /**
     * @return the printer, null for system scope
     */
    public Integer getPrinterId() {
        return printerId;
    }

    public String getPrinterName() {
        return printerName;
    }

    /**
     * @return the job, null unless job scope
     */
    public Integer getJobId() {
        return jobId;
    }

    /**
     * System events reach every scope, printer events reach that printer and the system, job events reach that job, its printer and
     * the system.
     */
    public boolean matches(NotificationEvent event) {
        if (event.getPrinterId() == null) {
            return true;
        }
        if (printerId != null && !printerId.equals(event.getPrinterId())) {
            return false;
        }
        return jobId == null || jobId.equals(event.getJobId());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SubscriptionScope)) {
            return false;
        }
        SubscriptionScope that = (SubscriptionScope) o;
        return type == that.type && Objects.equals(printerId, that.printerId) && Objects.equals(jobId, that.jobId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, printerId, jobId);
    }

    @Override
    public String toString() {
        switch (type) {
            case JOB:
                return "job " + jobId + " on " + printerName;
            case PRINTER:
                return "printer " + printerName;
            default:
                return "system";
        }
    }
}
