package org.hypertrace.alert.router.notification.pipeline;

/** One step of the notification pipeline. */
public interface Stage {

  /**
   * Narrows the batch or acts on it. Returning {@link StageResult#STOP} ends the pipeline for this
   * flush.
   */
  StageResult execute(NotificationContext context, AlertBatch batch) throws InterruptedException;
}
