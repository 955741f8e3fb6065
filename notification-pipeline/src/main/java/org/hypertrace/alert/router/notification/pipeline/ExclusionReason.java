package org.hypertrace.alert.router.notification.pipeline;

public enum ExclusionReason {
  SILENCED,
  INHIBITED,
  MUTED
}
