package org.hypertrace.alert.router.notification.notifier;

import com.typesafe.config.Config;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.hypertrace.alert.router.notification.notifier.ReceiverConfig.LogReceiverConfig;
import org.hypertrace.alert.router.notification.notifier.ReceiverConfig.WebhookReceiverConfig;

/** Reads the {@code receivers} section. */
public class ReceiverConfigReader {
  static final String NAME = "name";
  static final String TYPE = "type";
  static final String SEND_RESOLVED = "sendResolved";
  static final String WEBHOOK_URL = "url";
  static final String WEBHOOK_MAX_ALERTS = "maxAlerts";
  static final String WEBHOOK_TOKEN_SECRET = "tokenSecret";
  public static final String RECEIVER_TYPE_WEBHOOK = "webhook";
  public static final String RECEIVER_TYPE_LOG = "log";

  private ReceiverConfigReader() {}

  public static List<ReceiverConfig> fromConfig(List<? extends Config> receiverConfigs) {
    List<ReceiverConfig> receivers = new ArrayList<>();
    Set<String> names = new HashSet<>();
    for (Config receiverConfig : receiverConfigs) {
      ReceiverConfig receiver = fromConfig(receiverConfig);
      if (!names.add(receiver.getName())) {
        throw new IllegalArgumentException(
            String.format("Duplicate receiver name:%s", receiver.getName()));
      }
      receivers.add(receiver);
    }
    return receivers;
  }

  static ReceiverConfig fromConfig(Config receiverConfig) {
    String name = receiverConfig.getString(NAME);
    String type = receiverConfig.getString(TYPE);
    switch (type) {
      case RECEIVER_TYPE_WEBHOOK:
        return WebhookReceiverConfig.builder()
            .name(name)
            .type(type)
            .sendResolved(readSendResolved(receiverConfig, true))
            .url(receiverConfig.getString(WEBHOOK_URL))
            .maxAlerts(
                receiverConfig.hasPath(WEBHOOK_MAX_ALERTS)
                    ? receiverConfig.getInt(WEBHOOK_MAX_ALERTS)
                    : 0)
            .tokenSecret(
                receiverConfig.hasPath(WEBHOOK_TOKEN_SECRET)
                    ? receiverConfig.getString(WEBHOOK_TOKEN_SECRET)
                    : null)
            .build();
      case RECEIVER_TYPE_LOG:
        return LogReceiverConfig.builder()
            .name(name)
            .type(type)
            .sendResolved(readSendResolved(receiverConfig, false))
            .build();
      default:
        throw new RuntimeException(String.format("Invalid receiver type:%s", type));
    }
  }

  private static boolean readSendResolved(Config receiverConfig, boolean defaultValue) {
    return receiverConfig.hasPath(SEND_RESOLVED)
        ? receiverConfig.getBoolean(SEND_RESOLVED)
        : defaultValue;
  }
}
