package ippnotify.api.request.subscription;

import ippnotify.api.annotation.IppOperation;
import ippnotify.api.request.SubscriptionIdRequest;

@IppOperation(GetSubscriptionAttributesRequest.OPERATION)
public class GetSubscriptionAttributesRequest extends SubscriptionIdRequest {

    public static final String OPERATION = "Get-Subscription-Attributes";

}
