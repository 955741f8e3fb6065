package org.hypertrace.alert.router.state.silence;

public enum SilenceState {
  PENDING,
  ACTIVE,
  EXPIRED
}
