package org.hypertrace.alert.router.notification.notifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.typesafe.config.ConfigFactory;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.hypertrace.alert.router.datamodel.Alert;
import org.hypertrace.alert.router.datamodel.Fingerprints;
import org.hypertrace.alert.router.datamodel.json.ObjectMapperProvider;
import org.hypertrace.alert.router.notification.notifier.ReceiverConfig.WebhookReceiverConfig;
import org.hypertrace.alert.router.notification.pipeline.NotificationContext;
import org.hypertrace.alert.router.notification.route.RouteOptions;
import org.hypertrace.alert.router.notification.transport.NotificationSenderConfig;
import org.hypertrace.alert.router.notification.transport.WebhookSender;
import org.hypertrace.alert.router.notification.transport.http.HttpWithJsonSender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebhookNotifierTest {
  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

  private MockWebServer mockWebServer;
  private WebhookSender webhookSender;
  private NotificationContext context;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    webhookSender =
        new WebhookSender(
            HttpWithJsonSender.create(NotificationSenderConfig.from(ConfigFactory.empty())));
    context =
        NotificationContext.builder()
            .receiver("ops")
            .groupKey("{}:{alertname=\"Down\"}")
            .groupLabels(Map.of("alertname", "Down"))
            .routeOptions(RouteOptions.defaults("ops"))
            .build();
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void testPostsMessage() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));
    Alert firing = alert("X", null);
    Alert resolved = alert("Y", NOW.minusSeconds(5));

    notifier(0, "secret-token").notify(context, List.of(firing, resolved));

    RecordedRequest request = mockWebServer.takeRequest();
    Assertions.assertEquals("POST", request.getMethod());
    Assertions.assertEquals("Bearer secret-token", request.getHeader("Authorization"));
    JsonNode body = ObjectMapperProvider.get().readTree(request.getBody().readUtf8());
    Assertions.assertEquals("ops", body.get("receiver").asText());
    Assertions.assertEquals("firing", body.get("status").asText());
    Assertions.assertEquals("{}:{alertname=\"Down\"}", body.get("groupKey").asText());
    Assertions.assertEquals("Down", body.get("groupLabels").get("alertname").asText());
    Assertions.assertEquals("Down", body.get("commonLabels").get("alertname").asText());
    Assertions.assertFalse(body.get("commonLabels").has("service"));
    Assertions.assertEquals(2, body.get("alerts").size());
    Assertions.assertEquals("firing", body.get("alerts").get(0).get("status").asText());
    Assertions.assertEquals(
        Fingerprints.toHex(firing.getFingerprint()),
        body.get("alerts").get(0).get("fingerprint").asText());
    Assertions.assertEquals("resolved", body.get("alerts").get(1).get("status").asText());
    Assertions.assertEquals(
        "2024-03-01T09:59:55Z", body.get("alerts").get(1).get("endsAt").asText());
    Assertions.assertEquals(0, body.get("truncatedAlerts").asInt());
  }

  @Test
  void testNoAuthorizationWithoutToken() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(204));

    notifier(0, null).notify(context, List.of(alert("X", null)));

    Assertions.assertNull(mockWebServer.takeRequest().getHeader("Authorization"));
  }

  @Test
  void testTruncatesToMaxAlerts() {
    WebhookMessage message =
        notifier(2, null)
            .convert(context, List.of(alert("X", null), alert("Y", null), alert("Z", null)));

    Assertions.assertEquals(2, message.getAlerts().size());
    Assertions.assertEquals(1, message.getTruncatedAlerts());
    Assertions.assertEquals(
        Map.of("alertname", "Down", "team", "core"), message.getCommonLabels());
    Assertions.assertTrue(message.getCommonAnnotations().isEmpty());
  }

  @Test
  void testAllResolvedStatus() {
    WebhookMessage message =
        notifier(0, null).convert(context, List.of(alert("X", NOW.minusSeconds(1))));
    Assertions.assertEquals("resolved", message.getStatus());
  }

  @Test
  void testServerErrorIsRetryable() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(503));
    NotifierException exception =
        Assertions.assertThrows(
            NotifierException.class,
            () -> notifier(0, null).notify(context, List.of(alert("X", null))));
    Assertions.assertTrue(exception.isRetryable());
  }

  @Test
  void testClientErrorIsPermanent() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(400));
    NotifierException exception =
        Assertions.assertThrows(
            NotifierException.class,
            () -> notifier(0, null).notify(context, List.of(alert("X", null))));
    Assertions.assertFalse(exception.isRetryable());
  }

  private WebhookNotifier notifier(int maxAlerts, String token) {
    return new WebhookNotifier(
        WebhookReceiverConfig.builder()
            .name("ops")
            .type(ReceiverConfigReader.RECEIVER_TYPE_WEBHOOK)
            .sendResolved(true)
            .url(mockWebServer.url("/hooks/ops").toString())
            .maxAlerts(maxAlerts)
            .build(),
        token,
        webhookSender);
  }

  private static Alert alert(String service, Instant endsAt) {
    return Alert.builder()
        .labels(Map.of("alertname", "Down", "service", service, "team", "core"))
        .startsAt(NOW.minusSeconds(60))
        .endsAt(endsAt)
        .build();
  }
}
