package org.hypertrace.alert.router.notification.notifier;

import org.hypertrace.alert.router.notification.notifier.ReceiverConfig.LogReceiverConfig;
import org.hypertrace.alert.router.notification.notifier.ReceiverConfig.WebhookReceiverConfig;
import org.hypertrace.alert.router.notification.transport.NotificationSecretFinder;
import org.hypertrace.alert.router.notification.transport.WebhookSender;

public class NotifierFactory {
  private final WebhookSender webhookSender;

  public NotifierFactory(WebhookSender webhookSender) {
    this.webhookSender = webhookSender;
  }

  public Notifier create(ReceiverConfig receiverConfig) {
    if (receiverConfig instanceof WebhookReceiverConfig) {
      WebhookReceiverConfig webhookConfig = (WebhookReceiverConfig) receiverConfig;
      String token = null;
      if (webhookConfig.getTokenSecret() != null) {
        token =
            NotificationSecretFinder.findSecret(webhookConfig.getTokenSecret())
                .orElseThrow(
                    () ->
                        new IllegalArgumentException(
                            String.format(
                                "Secret %s of receiver %s not found",
                                webhookConfig.getTokenSecret(), webhookConfig.getName())));
      }
      return new WebhookNotifier(webhookConfig, token, webhookSender);
    }
    if (receiverConfig instanceof LogReceiverConfig) {
      return new LoggingNotifier(receiverConfig.getName(), receiverConfig.isSendResolved());
    }
    throw new RuntimeException(
        String.format("Invalid receiver type:%s", receiverConfig.getType()));
  }
}
