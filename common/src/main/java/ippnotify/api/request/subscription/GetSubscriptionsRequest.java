package ippnotify.api.request.subscription;

import com.fasterxml.jackson.annotation.JsonIgnore;

import ippnotify.api.annotation.IppOperation;
import ippnotify.api.request.IppRequest;

@IppOperation(GetSubscriptionsRequest.OPERATION)
public class GetSubscriptionsRequest extends IppRequest {

    public static final String OPERATION = "Get-Subscriptions";

    /**
     * @return notify-job-id, 0 when absent
     */
    @JsonIgnore
    public int getJobId() {
        Integer id = getOperationInteger("notify-job-id", 1);
        return (id == null) ? 0 : id;
    }

    /**
     * @return limit, 0 when absent
     */
    @JsonIgnore
    public int getLimit() {
        Integer limit = getOperationInteger("limit", 1);
        return (limit == null) ? 0 : limit;
    }

    @JsonIgnore
    public boolean isMySubscriptions() {
        return getOperationBoolean("my-subscriptions");
    }

    @Override
    public void validate() {
        getJobId();
        getLimit();
        isMySubscriptions();
    }
}
