package org.hypertrace.alert.router.notification.pipeline;

public enum StageResult {
  CONTINUE,
  STOP
}
