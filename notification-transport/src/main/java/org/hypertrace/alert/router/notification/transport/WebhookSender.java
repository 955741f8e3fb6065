package org.hypertrace.alert.router.notification.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import okhttp3.Response;
import org.hypertrace.alert.router.datamodel.json.ObjectMapperProvider;
import org.hypertrace.alert.router.notification.transport.http.HttpWithJsonSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Serializes a payload to JSON, posts it and classifies the response. */
public class WebhookSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookSender.class);
  private final HttpWithJsonSender sender;

  public WebhookSender(HttpWithJsonSender sender) {
    this.sender = sender;
  }

  public DeliveryStatus send(String url, Object payload, Map<String, String> headers) {
    Preconditions.checkArgument(url != null, "webhook url must be set");
    ObjectMapper objectMapper = ObjectMapperProvider.get();
    String jsonString;
    try {
      jsonString = objectMapper.writeValueAsString(payload);
    } catch (IOException e) {
      LOGGER.error("Failed to serialize webhook payload: {}", payload, e);
      // retrying would fail the same way
      return DeliveryStatus.PERMANENT_FAILURE;
    }

    Optional<Response> responseOptional = sender.send(url, jsonString, headers);
    if (responseOptional.isEmpty()) {
      return DeliveryStatus.RETRYABLE_FAILURE;
    }
    Response response = responseOptional.get();
    DeliveryStatus status = DeliveryStatus.fromResponseCode(response.code());
    if (status != DeliveryStatus.DELIVERED) {
      LOGGER.warn(
          "Error response from webhook: {}, response code: {}, response message: {}",
          url,
          response.code(),
          response.message());
    }
    return status;
  }
}
