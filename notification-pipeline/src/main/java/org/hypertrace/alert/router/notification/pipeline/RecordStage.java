package org.hypertrace.alert.router.notification.pipeline;

import org.hypertrace.alert.router.state.nflog.NotificationLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the firing and resolved sets of the whole batch to the notification log. A superseded
 * flush still records a notification it already delivered; a flush of a deleted group never
 * records.
 */
public class RecordStage implements Stage {
  private static final Logger LOGGER = LoggerFactory.getLogger(RecordStage.class);

  private final NotificationLog notificationLog;

  public RecordStage(NotificationLog notificationLog) {
    this.notificationLog = notificationLog;
  }

  @Override
  public StageResult execute(NotificationContext context, AlertBatch batch) {
    boolean delivered = context.getOutcome() == NotificationOutcome.SENT;
    if (context.isGroupDeleted() || (context.isCancelled() && !delivered)) {
      LOGGER.debug("Skipping notification log update for detached flush: {}", context);
      return StageResult.STOP;
    }
    notificationLog.log(
        context.getReceiver(),
        context.getGroupKey(),
        batch.firingFingerprints(),
        batch.resolvedFingerprints());
    return StageResult.CONTINUE;
  }
}
