package org.hypertrace.alert.router.notification.notifier;

import java.util.List;
import org.hypertrace.alert.router.datamodel.Alert;
import org.hypertrace.alert.router.datamodel.Fingerprints;
import org.hypertrace.alert.router.notification.pipeline.NotificationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs batches instead of sending them, useful for dry runs of a routing tree. */
public class LoggingNotifier implements Notifier {
  private static final Logger LOGGER = LoggerFactory.getLogger(LoggingNotifier.class);

  private final String receiver;
  private final boolean sendResolved;

  public LoggingNotifier(String receiver, boolean sendResolved) {
    this.receiver = receiver;
    this.sendResolved = sendResolved;
  }

  @Override
  public String getIntegration() {
    return ReceiverConfigReader.RECEIVER_TYPE_LOG;
  }

  @Override
  public boolean isSendResolved() {
    return sendResolved;
  }

  @Override
  public void notify(NotificationContext context, List<Alert> alerts) {
    LOGGER.info(
        "Receiver: {}, group: {}, alerts: {}", receiver, context.getGroupKey(), alerts.size());
    for (Alert alert : alerts) {
      LOGGER.info(
          "  [{}] {} {}",
          alert.getEndsAt() == null ? "firing" : "resolved",
          Fingerprints.toHex(alert.getFingerprint()),
          alert.getLabels());
    }
  }
}
