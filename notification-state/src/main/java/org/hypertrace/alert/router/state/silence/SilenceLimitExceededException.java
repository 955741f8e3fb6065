package org.hypertrace.alert.router.state.silence;

public class SilenceLimitExceededException extends RuntimeException {
  public SilenceLimitExceededException(int current, int limit) {
    super(String.format("Exceeded maximum number of silences: %d (limit: %d)", current, limit));
  }
}
