package ippnotify.server.netty.http.subscription;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import ippnotify.api.model.IppStatus;
import ippnotify.common.component.AuthenticationService;
import ippnotify.common.component.IppAuthenticationManager;
import ippnotify.common.configuration.HttpProperties;
import ippnotify.common.configuration.SecurityProperties;
import ippnotify.common.configuration.ServerProperties;
import ippnotify.common.configuration.SubscriptionProperties;
import ippnotify.common.configuration.UserDetailsConfiguration;
import ippnotify.server.Server;
import ippnotify.server.printer.InMemoryPrinterDirectory;
import ippnotify.server.printer.Job;
import ippnotify.server.printer.JobState;
import ippnotify.server.subscription.SubscriptionRegistry;
import ippnotify.server.test.IppMessageBuilder;
import ippnotify.server.test.TestClock;
import ippnotify.util.JsonUtil;

/**
 * Drives the subscription operations through the server's channel pipeline.
 */
public class SubscriptionPipelineTest {

    private static final String SYSTEM = "/ipp/system";
    private static final String LOBBY = "/ipp/print/lobby";
    private static final String LAB = "/ipp/print/lab";

    private TestClock clock;
    private SubscriptionProperties subscriptionProperties;
    private SubscriptionRegistry registry;
    private InMemoryPrinterDirectory directory;
    private EmbeddedChannel channel;
    private int requestId = 0;

    @Before
    public void setup() {
        clock = new TestClock(Instant.parse("2024-01-01T00:00:00Z"));
        subscriptionProperties = new SubscriptionProperties();
        subscriptionProperties.setDefaultLeaseSeconds(600);
        subscriptionProperties.setMaxEvents(3);
        registry = new SubscriptionRegistry(subscriptionProperties, clock);
        directory = new InMemoryPrinterDirectory(registry, Arrays.asList("lobby", "lab"));

        SecurityProperties securityProperties = new SecurityProperties();
        UserDetailsConfiguration userDetails = new UserDetailsConfiguration();
        AuthenticationService authenticationService = new AuthenticationService(securityProperties,
                        new IppAuthenticationManager(userDetails.daoAuthenticationProvider(userDetails.userDetailsService(securityProperties))));
        Server server = new Server(null, authenticationService, registry, directory, new ServerProperties(), new HttpProperties(),
                        subscriptionProperties);
        channel = new EmbeddedChannel();
        server.setupHttpPipeline(channel);
        // exchange whole HTTP messages with the pipeline
        channel.pipeline().remove("http");
    }

    @After
    public void tearDown() {
        channel.finishAndReleaseAll();
        registry.shutdown();
    }

    private FullHttpResponse exchange(HttpMethod method, String path, String body) {
        DefaultFullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, method, path,
                        Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
        channel.writeInbound(request);
        FullHttpResponse response = channel.readOutbound();
        Assert.assertNotNull("no response", response);
        return response;
    }

    private JsonNode post(String path, IppMessageBuilder message) throws Exception {
        FullHttpResponse response = exchange(HttpMethod.POST, path, message.build());
        try {
            Assert.assertEquals(HttpResponseStatus.OK, response.status());
            return JsonUtil.getObjectMapper().readTree(response.content().toString(StandardCharsets.UTF_8));
        } finally {
            response.release();
        }
    }

    private IppMessageBuilder request(String operation) {
        return new IppMessageBuilder(operation, ++requestId).string("requesting-user-name", "name", "alice");
    }

    private static IppMessageBuilder subscriptionGroup(IppMessageBuilder message, String... events) {
        return message.group("subscription").keyword("notify-pull-method", "ippget").keyword("notify-events", events);
    }

    private static void assertStatus(IppStatus expected, JsonNode response) {
        Assert.assertEquals(response.toString(), expected.getKeyword(), response.get("status-code").asText());
    }

    private static JsonNode find(JsonNode group, String name) {
        for (JsonNode attr : group.get("attributes")) {
            if (name.equals(attr.get("name").asText())) {
                return attr.get("values");
            }
        }
        return null;
    }

    private int subscribe(String path, String operation, String... events) throws Exception {
        JsonNode response = post(path, subscriptionGroup(request(operation), events));
        assertStatus(IppStatus.SUCCESSFUL_OK, response);
        return find(response.get("groups").get(1), "notify-subscription-id").get(0).asInt();
    }

    @Test
    public void testCreateWithMixedGroups() throws Exception {
        IppMessageBuilder message = request("Create-Printer-Subscriptions");
        message.group("subscription").keyword("notify-events", "job-created");
        subscriptionGroup(message, "job-completed");
        subscriptionGroup(message, "job-created").string("notify-recipient-uri", "uri", "ipps://elsewhere/");
        JsonNode response = post(LOBBY, message);

        assertStatus(IppStatus.SUCCESSFUL_OK_IGNORED_SUBSCRIPTIONS, response);
        Assert.assertEquals(requestId, response.get("request-id").asInt());
        JsonNode groups = response.get("groups");
        Assert.assertEquals(4, groups.size());
        Assert.assertEquals("subscription", groups.get(1).get("tag").asText());
        Assert.assertEquals(IppStatus.CLIENT_ERROR_BAD_REQUEST.getCode(), find(groups.get(1), "notify-status-code").get(0).asInt());
        Assert.assertEquals(1, find(groups.get(2), "notify-subscription-id").get(0).asInt());
        Assert.assertEquals("ipps://elsewhere/", find(groups.get(3), "notify-recipient-uri").get(0).asText());
        Assert.assertEquals(IppStatus.CLIENT_ERROR_ATTRIBUTES_OR_VALUES_NOT_SUPPORTED.getCode(),
                        find(groups.get(3), "notify-status-code").get(0).asInt());
        Assert.assertEquals(1, registry.size());
    }

    @Test
    public void testCreateWithOnlyInvalidGroups() throws Exception {
        IppMessageBuilder message = request("Create-System-Subscriptions");
        message.group("subscription").keyword("notify-events", "printer-created");
        assertStatus(IppStatus.CLIENT_ERROR_IGNORED_ALL_SUBSCRIPTIONS, post(SYSTEM, message));
        Assert.assertEquals(0, registry.size());
    }

    @Test
    public void testCreateScopeErrors() throws Exception {
        assertStatus(IppStatus.CLIENT_ERROR_NOT_POSSIBLE, post(LOBBY, subscriptionGroup(request("Create-System-Subscriptions"), "printer-created")));
        assertStatus(IppStatus.CLIENT_ERROR_BAD_REQUEST, post(SYSTEM, subscriptionGroup(request("Create-Printer-Subscriptions"), "job-created")));
        assertStatus(IppStatus.CLIENT_ERROR_NOT_FOUND,
                        post("/ipp/print/nowhere", subscriptionGroup(request("Create-Printer-Subscriptions"), "job-created")));
        assertStatus(IppStatus.CLIENT_ERROR_NOT_FOUND,
                        post(LOBBY, subscriptionGroup(request("Create-Job-Subscriptions").integer("notify-job-id", 99), "job-completed")));
        assertStatus(IppStatus.CLIENT_ERROR_BAD_REQUEST, post(LOBBY, subscriptionGroup(request("Create-Job-Subscriptions"), "job-completed")));
        Assert.assertEquals(0, registry.size());
    }

    @Test
    public void testJobSubscriptionReceivesJobEvents() throws Exception {
        Job job = directory.addJob("lobby", "report.pdf", "alice");
        Job other = directory.addJob("lobby", "other.pdf", "bob");
        JsonNode response = post(LOBBY,
                        subscriptionGroup(request("Create-Job-Subscriptions").integer("notify-job-id", job.getId()), "job-state-changed", "job-completed"));
        assertStatus(IppStatus.SUCCESSFUL_OK, response);
        int id = find(response.get("groups").get(1), "notify-subscription-id").get(0).asInt();

        directory.setJobState(other, JobState.PROCESSING);
        directory.setJobState(job, JobState.COMPLETED);

        JsonNode notifications = post(LOBBY, request("Get-Notifications").integer("notify-subscription-ids", id));
        assertStatus(IppStatus.SUCCESSFUL_OK, notifications);
        JsonNode groups = notifications.get("groups");
        Assert.assertEquals(3, groups.size());
        Assert.assertEquals("event-notification", groups.get(1).get("tag").asText());
        Assert.assertEquals("job-state-changed", find(groups.get(1), "notify-subscribed-event").get(0).asText());
        Assert.assertEquals("job-completed", find(groups.get(2), "notify-subscribed-event").get(0).asText());
        Assert.assertEquals(job.getId(), find(groups.get(2), "notify-job-id").get(0).asInt());
        Assert.assertEquals(JobState.COMPLETED.getValue(), find(groups.get(2), "job-state").get(0).asInt());
    }

    @Test
    public void testGetNotificationsAcknowledges() throws Exception {
        int id = subscribe(LOBBY, "Create-Printer-Subscriptions", "job-created");
        directory.addJob("lobby", "a", "alice");
        directory.addJob("lab", "b", "alice");
        directory.addJob("lobby", "c", "alice");

        JsonNode first = post(LOBBY, request("Get-Notifications").integer("notify-subscription-ids", id));
        JsonNode operation = first.get("groups").get(0);
        Assert.assertEquals(30, find(operation, "notify-get-interval").get(0).asInt());
        Assert.assertEquals("2024-01-01T00:00:00Z", find(operation, "printer-current-time").get(0).asText());
        Assert.assertEquals(3, first.get("groups").size());
        Assert.assertEquals(1, find(first.get("groups").get(1), "notify-sequence-number").get(0).asInt());
        Assert.assertEquals(2, find(first.get("groups").get(2), "notify-sequence-number").get(0).asInt());

        JsonNode second = post(LOBBY, request("Get-Notifications").integer("notify-subscription-ids", id).integer("notify-sequence-numbers", 2)
                        .bool("notify-wait", true));
        Assert.assertEquals(2, second.get("groups").size());
        Assert.assertEquals(2, find(second.get("groups").get(1), "notify-sequence-number").get(0).asInt());

        JsonNode third = post(LOBBY, request("Get-Notifications").integer("notify-subscription-ids", id).integer("notify-sequence-numbers", 3));
        Assert.assertEquals(1, third.get("groups").size());
    }

    @Test
    public void testDroppedEventsAreReported() throws Exception {
        int id = subscribe(LOBBY, "Create-Printer-Subscriptions", "job-created");
        for (int i = 0; i < 5; i++) {
            directory.addJob("lobby", "job" + i, "alice");
        }
        JsonNode groups = post(SYSTEM, request("Get-Notifications").integer("notify-subscription-ids", id)).get("groups");
        Assert.assertEquals(5, groups.size());
        Assert.assertEquals("events-dropped", find(groups.get(1), "notify-subscribed-event").get(0).asText());
        Assert.assertEquals(2, find(groups.get(1), "notify-sequence-number").get(0).asInt());
        Assert.assertEquals(3, find(groups.get(2), "notify-sequence-number").get(0).asInt());
    }

    @Test
    public void testGetNotificationsUnknownSubscription() throws Exception {
        int id = subscribe(LOBBY, "Create-Printer-Subscriptions", "job-created");
        assertStatus(IppStatus.CLIENT_ERROR_NOT_FOUND, post(SYSTEM, request("Get-Notifications").integer("notify-subscription-ids", id, 42)));
        assertStatus(IppStatus.CLIENT_ERROR_NOT_POSSIBLE, post(LAB, request("Get-Notifications").integer("notify-subscription-ids", id)));
    }

    @Test
    public void testGetNotificationsRejectsMisplacedAttributes() throws Exception {
        int id = subscribe(LOBBY, "Create-Printer-Subscriptions", "job-created");
        assertStatus(IppStatus.CLIENT_ERROR_BAD_REQUEST,
                        post(LOBBY, request("Get-Notifications").group("subscription").integer("subscription-id", id)));
        assertStatus(IppStatus.CLIENT_ERROR_BAD_REQUEST,
                        post(LOBBY, request("Get-Notifications").group("subscription").integer("notify-subscription-ids", id)));
        assertStatus(IppStatus.CLIENT_ERROR_BAD_REQUEST,
                        post(LOBBY, request("Get-Notifications").integer("notify-subscription-ids", id).keyword("notify-sequence-numbers", "2")));
        assertStatus(IppStatus.CLIENT_ERROR_BAD_REQUEST,
                        post(LOBBY, request("Get-Notifications").integer("notify-subscription-ids", id).integer("limit", 0)));
        assertStatus(IppStatus.CLIENT_ERROR_BAD_REQUEST,
                        post(LOBBY, request("Get-Notifications").integer("notify-subscription-ids", id).keyword("notify-wait", "yes")));
        assertStatus(IppStatus.SUCCESSFUL_OK, post(LOBBY, request("Get-Notifications").integer("subscription-id", id)));
    }

    @Test
    public void testSubscriptionIdOutsideIntRange() throws Exception {
        int id = subscribe(LOBBY, "Create-Printer-Subscriptions", "job-created");
        // 2^32 + id must not wrap around to id
        assertStatus(IppStatus.CLIENT_ERROR_BAD_REQUEST,
                        post(LOBBY, request("Cancel-Subscription").number("subscription-id", 4294967296L + id)));
        assertStatus(IppStatus.CLIENT_ERROR_BAD_REQUEST, post(LOBBY, request("Cancel-Subscription").number("subscription-id", id + 0.9)));
        Assert.assertNotNull(registry.findById(id));
    }

    @Test
    public void testGetSubscriptionAttributes() throws Exception {
        int id = subscribe(LOBBY, "Create-Printer-Subscriptions", "job-created");
        JsonNode response = post(LOBBY, request("Get-Subscription-Attributes").integer("subscription-id", id));
        assertStatus(IppStatus.SUCCESSFUL_OK, response);
        JsonNode group = response.get("groups").get(1);
        Assert.assertEquals("alice", find(group, "notify-subscriber-user-name").get(0).asText());
        Assert.assertEquals("lobby", find(group, "notify-printer-name").get(0).asText());
        Assert.assertEquals(600, find(group, "notify-lease-duration").get(0).asInt());

        JsonNode restricted = post(SYSTEM,
                        request("Get-Subscription-Attributes").integer("subscription-id", id).keyword("requested-attributes", "notify-events"));
        Assert.assertEquals(1, restricted.get("groups").get(1).get("attributes").size());

        assertStatus(IppStatus.CLIENT_ERROR_NOT_POSSIBLE, post(LAB, request("Get-Subscription-Attributes").integer("subscription-id", id)));
        assertStatus(IppStatus.CLIENT_ERROR_NOT_FOUND, post(SYSTEM, request("Get-Subscription-Attributes").integer("subscription-id", id + 1)));
        assertStatus(IppStatus.CLIENT_ERROR_BAD_REQUEST, post(SYSTEM, request("Get-Subscription-Attributes").integer("subscription-id", 0)));
    }

    @Test
    public void testGetSubscriptions() throws Exception {
        subscribe(SYSTEM, "Create-System-Subscriptions", "printer-created");
        subscribe(LOBBY, "Create-Printer-Subscriptions", "job-created");
        post(LAB, subscriptionGroup(new IppMessageBuilder("Create-Printer-Subscriptions", 99).string("requesting-user-name", "name", "bob"),
                        "job-created"));

        Assert.assertEquals(4, post(SYSTEM, request("Get-Subscriptions")).get("groups").size());
        // a printer target lists subscriptions on other targets too
        Assert.assertEquals(4, post(LOBBY, request("Get-Subscriptions")).get("groups").size());
        Assert.assertEquals(3, post(SYSTEM, request("Get-Subscriptions").bool("my-subscriptions", true)).get("groups").size());
        Assert.assertEquals(2, post(SYSTEM, request("Get-Subscriptions").integer("limit", 1)).get("groups").size());
        Assert.assertEquals(2, post(LAB, request("Get-Subscriptions").integer("limit", 1)).get("groups").size());
        assertStatus(IppStatus.CLIENT_ERROR_NOT_FOUND, post("/ipp/print/attic", request("Get-Subscriptions")));
    }

    @Test
    public void testRenewAndCancel() throws Exception {
        int id = subscribe(LOBBY, "Create-Printer-Subscriptions", "job-created");
        clock.advance(Duration.ofSeconds(300));

        assertStatus(IppStatus.SUCCESSFUL_OK, post(LOBBY, request("Renew-Subscription").integer("subscription-id", id)));
        Assert.assertEquals(clock.instant().plusSeconds(600), registry.findById(id).getExpiresAt());

        assertStatus(IppStatus.SUCCESSFUL_OK, post(LOBBY, request("Renew-Subscription").integer("subscription-id", id).integer("notify-lease-duration", 0)));
        Assert.assertNull(registry.findById(id).getExpiresAt());

        assertStatus(IppStatus.CLIENT_ERROR_NOT_POSSIBLE, post(LAB, request("Cancel-Subscription").integer("subscription-id", id)));
        assertStatus(IppStatus.SUCCESSFUL_OK, post(LOBBY, request("Cancel-Subscription").integer("subscription-id", id)));
        assertStatus(IppStatus.CLIENT_ERROR_NOT_FOUND, post(LOBBY, request("Cancel-Subscription").integer("subscription-id", id)));
        assertStatus(IppStatus.CLIENT_ERROR_NOT_FOUND, post(LOBBY, request("Renew-Subscription").integer("subscription-id", id)));
    }

    @Test
    public void testTransportErrors() throws Exception {
        FullHttpResponse response = exchange(HttpMethod.GET, SYSTEM, "");
        Assert.assertEquals(HttpResponseStatus.METHOD_NOT_ALLOWED, response.status());
        Assert.assertEquals("POST", response.headers().get(HttpHeaderNames.ALLOW));
        response.release();

        response = exchange(HttpMethod.POST, "/other", request("Get-Subscriptions").build());
        Assert.assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
        response.release();

        assertStatus(IppStatus.SERVER_ERROR_OPERATION_NOT_SUPPORTED, post(SYSTEM, request("Print-Job")));
    }
}
