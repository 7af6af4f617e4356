package ippnotify.api.request.subscription;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

import ippnotify.api.annotation.IppOperation;
import ippnotify.api.request.IppRequest;

@IppOperation(GetNotificationsRequest.OPERATION)
public class GetNotificationsRequest extends IppRequest {

    public static final String OPERATION = "Get-Notifications";

    /**
     * The subscriptions to read, from notify-subscription-ids or else subscription-id.
     */
    @JsonIgnore
    public List<Integer> getSubscriptionIds() {
        List<Integer> ids = getOperationIntegers("notify-subscription-ids", 1);
        if (ids == null) {
            Integer id = getOperationInteger("subscription-id", 1);
            ids = (id == null) ? Collections.emptyList() : Collections.singletonList(id);
        }
        return ids;
    }

    /**
     * Highest sequence number the client has already seen for the subscription at index. notify-sequence-numbers names the lowest
     * number wanted, so the value is one less; 0 when absent.
     */
    public int getLastSeen(int index) {
        List<Integer> wanted = getOperationIntegers("notify-sequence-numbers", 1);
        if (wanted == null || index >= wanted.size()) {
            return 0;
        }
        return wanted.get(index) - 1;
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
    public boolean isNotifyWait() {
        return getOperationBoolean("notify-wait");
    }

    @Override
    public void validate() {
        if (getSubscriptionIds().isEmpty()) {
            throw new IllegalArgumentException("Missing notify-subscription-ids attribute in request.");
        }
        getLastSeen(0);
        getLimit();
        isNotifyWait();
    }
}
