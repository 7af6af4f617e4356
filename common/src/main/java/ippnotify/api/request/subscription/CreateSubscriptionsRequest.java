package ippnotify.api.request.subscription;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

import ippnotify.api.annotation.IppOperation;
import ippnotify.api.model.AttributeGroup;
import ippnotify.api.model.GroupTag;
import ippnotify.api.model.ScopeType;
import ippnotify.api.request.IppRequest;

@IppOperation({CreateSubscriptionsRequest.CREATE_SYSTEM, CreateSubscriptionsRequest.CREATE_PRINTER, CreateSubscriptionsRequest.CREATE_JOB})
public class CreateSubscriptionsRequest extends IppRequest {

    public static final String CREATE_SYSTEM = "Create-System-Subscriptions";
    public static final String CREATE_PRINTER = "Create-Printer-Subscriptions";
    public static final String CREATE_JOB = "Create-Job-Subscriptions";

    @JsonIgnore
    public ScopeType getScopeType() {
        if (CREATE_JOB.equals(getOperation())) {
            return ScopeType.JOB;
        } else if (CREATE_PRINTER.equals(getOperation())) {
            return ScopeType.PRINTER;
        }
        return ScopeType.SYSTEM;
    }

    /**
     * @return the notify-job-id operation attribute, or null for non-job requests
     */
    @JsonIgnore
    public Integer getJobId() {
        return getOperationInteger("notify-job-id", 1);
    }

    @JsonIgnore
    public List<AttributeGroup> getSubscriptionGroups() {
        return getGroups(GroupTag.SUBSCRIPTION);
    }

    @Override
    public void validate() {
        if (getScopeType() == ScopeType.JOB) {
            if (findAttribute("notify-job-id") == null) {
                throw new IllegalArgumentException("Missing notify-job-id attribute.");
            }
            getOperationInteger("notify-job-id", 1);
        }
    }
}
