package org.hypertrace.alert.router.notification.notifier;

import lombok.Getter;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@Getter
public abstract class ReceiverConfig {
  private final String name;
  private final String type;
  private final boolean sendResolved;

  @SuperBuilder
  @Getter
  public static class WebhookReceiverConfig extends ReceiverConfig {
    private final String url;
    private final int maxAlerts;
    private final String tokenSecret;
  }

  @SuperBuilder
  @Getter
  public static class LogReceiverConfig extends ReceiverConfig {}
}
