package org.hypertrace.alert.router.notification.transport.http;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.hypertrace.alert.router.notification.transport.NotificationSenderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generic sender that posts a JSON string to a URL. It holds no state besides the HTTP client and
 * can be shared between receivers.
 */
public class HttpWithJsonSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpWithJsonSender.class);
  public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final String USER_AGENT_HEADER = "User-Agent";

  private final OkHttpClient client;
  private final String userAgent;

  @VisibleForTesting
  HttpWithJsonSender(OkHttpClient client, String userAgent) {
    this.client = client;
    this.userAgent = userAgent;
  }

  public static HttpWithJsonSender create(NotificationSenderConfig config) {
    return new HttpWithJsonSender(
        new OkHttpClient.Builder()
            .connectTimeout(config.getConnectTimeout())
            .readTimeout(config.getReadTimeout())
            .build(),
        config.getUserAgent());
  }

  /**
   * Posts the JSON body with the given extra headers. Returns the (already closed) response, or
   * empty when the request failed before a response was received.
   */
  public Optional<Response> send(String url, String jsonString, Map<String, String> headers) {
    LOGGER.debug("Sending json string to URL: {}, body: {}", url, jsonString);
    RequestBody body = RequestBody.create(jsonString, JSON);
    Request.Builder requestBuilder =
        new Request.Builder().url(url).post(body).header(USER_AGENT_HEADER, userAgent);
    headers.forEach(requestBuilder::header);
    try (Response response = client.newCall(requestBuilder.build()).execute()) {
      return Optional.of(response);
    } catch (IOException ioe) {
      LOGGER.warn("Unable to send json string to URL: {}", url, ioe);
    }
    return Optional.empty();
  }
}
