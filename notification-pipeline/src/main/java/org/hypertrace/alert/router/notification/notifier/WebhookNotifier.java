package org.hypertrace.alert.router.notification.notifier;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.hypertrace.alert.router.datamodel.Alert;
import org.hypertrace.alert.router.datamodel.Fingerprints;
import org.hypertrace.alert.router.notification.notifier.ReceiverConfig.WebhookReceiverConfig;
import org.hypertrace.alert.router.notification.notifier.WebhookMessage.WebhookAlert;
import org.hypertrace.alert.router.notification.pipeline.NotificationContext;
import org.hypertrace.alert.router.notification.transport.DeliveryStatus;
import org.hypertrace.alert.router.notification.transport.WebhookSender;

public class WebhookNotifier implements Notifier {
  static final String STATUS_FIRING = "firing";
  static final String STATUS_RESOLVED = "resolved";
  private static final String AUTHORIZATION_HEADER = "Authorization";

  private final WebhookReceiverConfig receiverConfig;
  private final String token;
  private final WebhookSender webhookSender;

  public WebhookNotifier(
      WebhookReceiverConfig receiverConfig, String token, WebhookSender webhookSender) {
    this.receiverConfig = receiverConfig;
    this.token = token;
    this.webhookSender = webhookSender;
  }

  @Override
  public String getIntegration() {
    return ReceiverConfigReader.RECEIVER_TYPE_WEBHOOK;
  }

  @Override
  public boolean isSendResolved() {
    return receiverConfig.isSendResolved();
  }

  @Override
  public void notify(NotificationContext context, List<Alert> alerts) throws NotifierException {
    Map<String, String> headers = new HashMap<>();
    if (token != null) {
      headers.put(AUTHORIZATION_HEADER, "Bearer " + token);
    }
    DeliveryStatus status =
        webhookSender.send(receiverConfig.getUrl(), convert(context, alerts), headers);
    switch (status) {
      case DELIVERED:
        return;
      case RETRYABLE_FAILURE:
        throw new NotifierException(
            String.format("Webhook %s is unavailable", receiverConfig.getName()), true);
      default:
        throw new NotifierException(
            String.format("Webhook %s rejected the notification", receiverConfig.getName()),
            false);
    }
  }

  WebhookMessage convert(NotificationContext context, List<Alert> alerts) {
    int maxAlerts = receiverConfig.getMaxAlerts();
    List<Alert> included =
        maxAlerts > 0 && alerts.size() > maxAlerts ? alerts.subList(0, maxAlerts) : alerts;
    return WebhookMessage.builder()
        .receiver(receiverConfig.getName())
        .status(
            alerts.stream().anyMatch(WebhookNotifier::isFiring) ? STATUS_FIRING : STATUS_RESOLVED)
        .groupKey(context.getGroupKey())
        .groupLabels(context.getGroupLabels())
        .commonLabels(common(alerts.stream().map(Alert::getLabels).collect(Collectors.toList())))
        .commonAnnotations(
            common(alerts.stream().map(Alert::getAnnotations).collect(Collectors.toList())))
        .alerts(included.stream().map(WebhookNotifier::convert).collect(Collectors.toList()))
        .truncatedAlerts(alerts.size() - included.size())
        .build();
  }

  private static WebhookAlert convert(Alert alert) {
    return WebhookAlert.builder()
        .status(isFiring(alert) ? STATUS_FIRING : STATUS_RESOLVED)
        .labels(alert.getLabels())
        .annotations(alert.getAnnotations())
        .startsAt(alert.getStartsAt())
        .endsAt(alert.getEndsAt())
        .fingerprint(Fingerprints.toHex(alert.getFingerprint()))
        .build();
  }

  // batches are snapshots taken at flush time, only resolved alerts carry an end time
  private static boolean isFiring(Alert alert) {
    return alert.getEndsAt() == null;
  }

  /** Pairs present with the same value in every map. */
  private static Map<String, String> common(List<Map<String, String>> maps) {
    if (maps.isEmpty()) {
      return Map.of();
    }
    Map<String, String> common = new TreeMap<>(maps.get(0));
    for (Map<String, String> map : maps.subList(1, maps.size())) {
      common.entrySet().removeIf(entry -> !entry.getValue().equals(map.get(entry.getKey())));
    }
    return common;
  }
}
