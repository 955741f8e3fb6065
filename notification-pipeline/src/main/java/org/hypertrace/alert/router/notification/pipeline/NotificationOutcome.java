package org.hypertrace.alert.router.notification.pipeline;

public enum NotificationOutcome {
  PENDING,
  /** The notification log already covers the batch. */
  SUPPRESSED,
  /** Every alert was excluded, nothing went out but the batch was recorded. */
  NOTHING_TO_SEND,
  SENT,
  /** Retries were exhausted or the receiver rejected the batch. */
  FAILED,
  CANCELLED
}
