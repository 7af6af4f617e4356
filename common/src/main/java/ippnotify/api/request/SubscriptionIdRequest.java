package ippnotify.api.request;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Base for operations that act on one subscription named by the {@code subscription-id} operation attribute.
 */
public abstract class SubscriptionIdRequest extends IppRequest {

    @JsonIgnore
    public int getSubscriptionId() {
        return getOperationInteger("subscription-id", 1);
    }

    @Override
    public void validate() {
        if (findAttribute("subscription-id") == null) {
            throw new IllegalArgumentException("Missing subscription-id attribute in request.");
        }
        getOperationInteger("subscription-id", 1);
    }
}
