package org.hypertrace.alert.router.notification.transport;

import com.typesafe.config.ConfigFactory;
import java.io.IOException;
import java.util.Map;
import java.util.stream.Stream;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.hypertrace.alert.router.notification.transport.http.HttpWithJsonSender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class WebhookSenderTest {
  private MockWebServer mockWebServer;
  private WebhookSender webhookSender;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    webhookSender =
        new WebhookSender(
            HttpWithJsonSender.create(NotificationSenderConfig.from(ConfigFactory.empty())));
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @ParameterizedTest
  @MethodSource("responseCodes")
  void testResponseCodeClassification(int code, DeliveryStatus expected) {
    mockWebServer.enqueue(new MockResponse().setResponseCode(code));
    Assertions.assertEquals(
        expected,
        webhookSender.send(mockWebServer.url("/").toString(), Map.of("a", "b"), Map.of()));
  }

  static Stream<Arguments> responseCodes() {
    return Stream.of(
        Arguments.of(200, DeliveryStatus.DELIVERED),
        Arguments.of(204, DeliveryStatus.DELIVERED),
        Arguments.of(400, DeliveryStatus.PERMANENT_FAILURE),
        Arguments.of(404, DeliveryStatus.PERMANENT_FAILURE),
        Arguments.of(429, DeliveryStatus.RETRYABLE_FAILURE),
        Arguments.of(500, DeliveryStatus.RETRYABLE_FAILURE),
        Arguments.of(503, DeliveryStatus.RETRYABLE_FAILURE));
  }

  @Test
  void testSerializesPayload() throws InterruptedException {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));
    webhookSender.send(mockWebServer.url("/").toString(), Map.of("status", "resolved"), Map.of());

    Assertions.assertEquals(
        "{\"status\":\"resolved\"}", mockWebServer.takeRequest().getBody().readUtf8());
  }

  @Test
  void testUnreachableEndpointIsRetryable() throws IOException {
    String url = mockWebServer.url("/").toString();
    mockWebServer.shutdown();
    Assertions.assertEquals(
        DeliveryStatus.RETRYABLE_FAILURE, webhookSender.send(url, Map.of(), Map.of()));
  }

  @Test
  void testMissingUrlIsRejected() {
    Assertions.assertThrows(
        IllegalArgumentException.class, () -> webhookSender.send(null, Map.of(), Map.of()));
  }
}
