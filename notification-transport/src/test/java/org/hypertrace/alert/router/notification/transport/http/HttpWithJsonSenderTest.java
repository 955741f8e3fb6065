package org.hypertrace.alert.router.notification.transport.http;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import okhttp3.OkHttpClient;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpWithJsonSenderTest {
  private MockWebServer mockWebServer;
  private HttpWithJsonSender httpWithJsonSender;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    httpWithJsonSender = new HttpWithJsonSender(new OkHttpClient(), "alert-router-test");
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void testPostsJsonWithHeaders() throws InterruptedException {
    mockWebServer.enqueue(new MockResponse().setResponseCode(202));

    Optional<Response> response =
        httpWithJsonSender.send(
            mockWebServer.url("/hook").toString(),
            "{\"status\":\"firing\"}",
            Map.of("Authorization", "Bearer abc"));

    Assertions.assertEquals(202, response.orElseThrow().code());
    RecordedRequest request = mockWebServer.takeRequest();
    Assertions.assertEquals("POST", request.getMethod());
    Assertions.assertEquals("/hook", request.getPath());
    Assertions.assertEquals("{\"status\":\"firing\"}", request.getBody().readUtf8());
    Assertions.assertEquals("Bearer abc", request.getHeader("Authorization"));
    Assertions.assertEquals("alert-router-test", request.getHeader("User-Agent"));
    Assertions.assertTrue(request.getHeader("Content-Type").startsWith("application/json"));
  }

  @Test
  void testConnectionFailureReturnsEmpty() throws IOException {
    String url = mockWebServer.url("/hook").toString();
    mockWebServer.shutdown();

    Assertions.assertTrue(httpWithJsonSender.send(url, "{}", Map.of()).isEmpty());
  }
}
