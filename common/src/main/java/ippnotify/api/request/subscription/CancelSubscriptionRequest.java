package ippnotify.api.request.subscription;

import ippnotify.api.annotation.IppOperation;
import ippnotify.api.request.SubscriptionIdRequest;

@IppOperation(CancelSubscriptionRequest.OPERATION)
public class CancelSubscriptionRequest extends SubscriptionIdRequest {

    public static final String OPERATION = "Cancel-Subscription";

}
