package ippnotify.api.request.subscription;

import com.fasterxml.jackson.annotation.JsonIgnore;

import ippnotify.api.annotation.IppOperation;
import ippnotify.api.request.SubscriptionIdRequest;

@IppOperation(RenewSubscriptionRequest.OPERATION)
public class RenewSubscriptionRequest extends SubscriptionIdRequest {

    public static final String OPERATION = "Renew-Subscription";

    /**
     * @return the requested lease in seconds, or null to use the configured default
     */
    @JsonIgnore
    public Integer getLeaseDuration() {
        return getOperationInteger("notify-lease-duration", 0);
    }

    @Override
    public void validate() {
        super.validate();
        getOperationInteger("notify-lease-duration", 0);
    }
}
