package org.hypertrace.alert.router.notification.notifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** JSON body posted to webhook receivers. */
@Builder
@Getter
public class WebhookMessage {
  private final String receiver;
  private final String status;
  private final String groupKey;
  private final Map<String, String> groupLabels;
  private final Map<String, String> commonLabels;
  private final Map<String, String> commonAnnotations;
  private final List<WebhookAlert> alerts;
  private final int truncatedAlerts;

  @Builder
  @Getter
  public static class WebhookAlert {
    private final String status;
    private final Map<String, String> labels;
    private final Map<String, String> annotations;
    private final Instant startsAt;
    private final Instant endsAt;
    private final String fingerprint;
  }
}
