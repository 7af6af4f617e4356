package ippnotify.api.request;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;

import ippnotify.api.model.GroupTag;
import ippnotify.api.model.IppAttribute;
import ippnotify.api.model.IppResponse;
import ippnotify.api.model.IppStatus;
import ippnotify.api.model.ScopeType;
import ippnotify.api.model.ValueTag;
import ippnotify.api.request.subscription.CancelSubscriptionRequest;
import ippnotify.api.request.subscription.CreateSubscriptionsRequest;
import ippnotify.api.request.subscription.GetNotificationsRequest;
import ippnotify.api.request.subscription.GetSubscriptionsRequest;
import ippnotify.api.request.subscription.RenewSubscriptionRequest;
import ippnotify.util.JsonUtil;

public class IppRequestDeserializationTest {

    private static IppRequest parse(String json) throws Exception {
        return JsonUtil.getObjectMapper().readValue(json, IppRequest.class);
    }

    @Test
    public void testCreatePrinterSubscriptions() throws Exception {
        // @formatter:off
        String json = "{ \"operation\": \"Create-Printer-Subscriptions\", \"request-id\": 7, \"groups\": [" +
                "{ \"tag\": \"operation\", \"attributes\": [" +
                    "{ \"name\": \"requesting-user-name\", \"value-tag\": \"name\", \"values\": [\"bob\"] } ] }," +
                "{ \"tag\": \"subscription\", \"attributes\": [" +
                    "{ \"name\": \"notify-pull-method\", \"value-tag\": \"keyword\", \"values\": [\"ippget\"] }," +
                    "{ \"name\": \"notify-events\", \"value-tag\": \"keyword\", \"values\": [\"job-completed\", \"job-created\"] }," +
                    "{ \"name\": \"notify-lease-duration\", \"value-tag\": \"integer\", \"values\": [60] } ] } ] }";
        // @formatter:on
        IppRequest request = parse(json);
        Assert.assertEquals(CreateSubscriptionsRequest.class, request.getClass());
        CreateSubscriptionsRequest create = (CreateSubscriptionsRequest) request;
        Assert.assertEquals(7, create.getRequestId());
        Assert.assertEquals(ScopeType.PRINTER, create.getScopeType());
        Assert.assertEquals("bob", create.getUsername());
        Assert.assertEquals(1, create.getSubscriptionGroups().size());
        IppAttribute events = create.getSubscriptionGroups().get(0).find("notify-events");
        Assert.assertEquals(GroupTag.SUBSCRIPTION, events.getGroupTag());
        Assert.assertEquals(Arrays.asList("job-completed", "job-created"), events.getStrings());
        Assert.assertEquals(Integer.valueOf(60), create.getSubscriptionGroups().get(0).find("notify-lease-duration").getInteger(0));
        create.validate();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCreateJobSubscriptionsRequiresJobId() throws Exception {
        parse("{ \"operation\": \"Create-Job-Subscriptions\", \"request-id\": 1, \"groups\": [] }").validate();
    }

    @Test
    public void testCreateJobSubscriptionsJobId() throws Exception {
        // @formatter:off
        CreateSubscriptionsRequest create = (CreateSubscriptionsRequest) parse("{ \"operation\": \"Create-Job-Subscriptions\", \"groups\": [" +
                "{ \"tag\": \"operation\", \"attributes\": [" +
                    "{ \"name\": \"notify-job-id\", \"value-tag\": \"integer\", \"values\": [12] } ] } ] }");
        // @formatter:on
        create.validate();
        Assert.assertEquals(ScopeType.JOB, create.getScopeType());
        Assert.assertEquals(Integer.valueOf(12), create.getJobId());
    }

    @Test
    public void testSubscriptionIdValidation() throws Exception {
        String template = "{ \"operation\": \"Cancel-Subscription\", \"groups\": [ { \"tag\": \"%s\", \"attributes\": ["
                        + "{ \"name\": \"subscription-id\", \"value-tag\": \"%s\", \"values\": [%s] } ] } ] }";
        IppRequest good = parse(String.format(template, "operation", "integer", "3"));
        Assert.assertEquals(CancelSubscriptionRequest.class, good.getClass());
        good.validate();
        Assert.assertEquals(3, ((CancelSubscriptionRequest) good).getSubscriptionId());

        String[][] bad = { {"operation", "integer", "0"}, {"operation", "integer", "-4"}, {"operation", "integer", "1, 2"},
                {"subscription", "integer", "3"}, {"operation", "keyword", "\"3\""}, {"operation", "integer", "4294967299"},
                {"operation", "integer", "3.5"}, {"operation", "integer", "null"}};
        for (String[] b : bad) {
            IppRequest request = parse(String.format(template, b[0], b[1], b[2]));
            try {
                request.validate();
                Assert.fail("Expected rejection of " + Arrays.toString(b));
            } catch (IllegalArgumentException e) {
                // expected
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingSubscriptionId() throws Exception {
        parse("{ \"operation\": \"Get-Subscription-Attributes\", \"groups\": [] }").validate();
    }

    @Test
    public void testRenewLeaseDuration() throws Exception {
        // @formatter:off
        String json = "{ \"operation\": \"Renew-Subscription\", \"groups\": [ { \"tag\": \"operation\", \"attributes\": [" +
                "{ \"name\": \"subscription-id\", \"value-tag\": \"integer\", \"values\": [5] }%s ] } ] }";
        // @formatter:on
        RenewSubscriptionRequest noLease = (RenewSubscriptionRequest) parse(String.format(json, ""));
        noLease.validate();
        Assert.assertNull(noLease.getLeaseDuration());

        RenewSubscriptionRequest zero = (RenewSubscriptionRequest) parse(
                        String.format(json, ", { \"name\": \"notify-lease-duration\", \"value-tag\": \"integer\", \"values\": [0] }"));
        zero.validate();
        Assert.assertEquals(Integer.valueOf(0), zero.getLeaseDuration());

        RenewSubscriptionRequest negative = (RenewSubscriptionRequest) parse(
                        String.format(json, ", { \"name\": \"notify-lease-duration\", \"value-tag\": \"integer\", \"values\": [-1] }"));
        try {
            negative.validate();
            Assert.fail("negative lease accepted");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testGetSubscriptionsDefaults() throws Exception {
        GetSubscriptionsRequest list = (GetSubscriptionsRequest) parse("{ \"operation\": \"Get-Subscriptions\" }");
        list.validate();
        Assert.assertEquals(0, list.getJobId());
        Assert.assertEquals(0, list.getLimit());
        Assert.assertFalse(list.isMySubscriptions());
        Assert.assertEquals(IppRequest.ANONYMOUS, list.getUsername());
        Assert.assertTrue(list.getRequestedAttributes().isEmpty());
    }

    @Test
    public void testGetNotifications() throws Exception {
        // @formatter:off
        GetNotificationsRequest get = (GetNotificationsRequest) parse("{ \"operation\": \"Get-Notifications\", \"groups\": [" +
                "{ \"tag\": \"operation\", \"attributes\": [" +
                    "{ \"name\": \"notify-subscription-ids\", \"value-tag\": \"integer\", \"values\": [4, 9] }," +
                    "{ \"name\": \"notify-sequence-numbers\", \"value-tag\": \"integer\", \"values\": [3] }," +
                    "{ \"name\": \"notify-wait\", \"value-tag\": \"boolean\", \"values\": [true] } ] } ] }");
        // @formatter:on
        get.validate();
        Assert.assertEquals(Arrays.asList(4, 9), get.getSubscriptionIds());
        Assert.assertEquals(2, get.getLastSeen(0));
        Assert.assertEquals(0, get.getLastSeen(1));
        Assert.assertTrue(get.isNotifyWait());
    }

    @Test
    public void testGetNotificationsValidation() throws Exception {
        String template = "{ \"operation\": \"Get-Notifications\", \"groups\": [ { \"tag\": \"operation\", \"attributes\": ["
                        + "{ \"name\": \"notify-subscription-ids\", \"value-tag\": \"integer\", \"values\": [4] } ] },"
                        + "{ \"tag\": \"%s\", \"attributes\": [ { \"name\": \"%s\", \"value-tag\": \"%s\", \"values\": [%s] } ] } ] }";
        GetNotificationsRequest good = (GetNotificationsRequest) parse(String.format(template, "operation", "limit", "integer", "2"));
        good.validate();
        Assert.assertEquals(2, good.getLimit());

        String[][] bad = { {"subscription", "notify-sequence-numbers", "integer", "2"}, {"operation", "notify-sequence-numbers", "keyword", "\"2\""},
                {"operation", "notify-sequence-numbers", "integer", "0"}, {"operation", "limit", "integer", "0"},
                {"subscription", "limit", "integer", "2"}, {"operation", "notify-wait", "keyword", "\"true\""},
                {"operation", "notify-wait", "boolean", "true, false"}, {"operation", "limit", "integer", "2147483648"}};
        for (String[] b : bad) {
            IppRequest request = parse(String.format(template, b[0], b[1], b[2], b[3]));
            try {
                request.validate();
                Assert.fail("Expected rejection of " + Arrays.toString(b));
            } catch (IllegalArgumentException e) {
                // expected
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testGetNotificationsIdsOutsideOperationGroup() throws Exception {
        parse("{ \"operation\": \"Get-Notifications\", \"groups\": [ { \"tag\": \"subscription\", \"attributes\": ["
                        + "{ \"name\": \"subscription-id\", \"value-tag\": \"integer\", \"values\": [4] } ] } ] }").validate();
    }

    @Test
    public void testAuthenticatedUserWinsOverRequestingUserName() throws Exception {
        IppRequest request = parse("{ \"operation\": \"Get-Subscriptions\", \"groups\": [ { \"tag\": \"operation\", \"attributes\": ["
                        + "{ \"name\": \"requesting-user-name\", \"value-tag\": \"name\", \"values\": [\"mallory\"] } ] } ] }");
        Assert.assertEquals("mallory", request.getUsername());
        request.setAuthenticatedUser("alice");
        Assert.assertEquals("alice", request.getUsername());
    }

    @Test
    public void testResponseSerialization() throws Exception {
        IppResponse response = new IppResponse(11);
        response.setStatus(IppStatus.CLIENT_ERROR_NOT_FOUND, "Subscription #3 was not found.");
        response.addGroup(GroupTag.SUBSCRIPTION).add(IppAttribute.octetString("notify-user-data", new byte[] {1, 2, 3}));
        JsonNode json = JsonUtil.getObjectMapper().readTree(JsonUtil.getObjectMapper().writeValueAsString(response));
        Assert.assertEquals("client-error-not-found", json.get("status-code").asText());
        Assert.assertEquals(11, json.get("request-id").asInt());
        JsonNode operation = json.get("groups").get(0);
        Assert.assertEquals("operation", operation.get("tag").asText());
        Assert.assertEquals("attributes-charset", operation.get("attributes").get(0).get("name").asText());
        Assert.assertEquals("status-message", operation.get("attributes").get(2).get("name").asText());
        JsonNode userData = json.get("groups").get(1).get("attributes").get(0);
        Assert.assertEquals(ValueTag.OCTET_STRING.getKeyword(), userData.get("value-tag").asText());
        Assert.assertEquals("AQID", userData.get("values").get(0).asText());
    }
}
