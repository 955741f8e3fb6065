package org.hypertrace.alert.router.state.silence;

public class SilenceNotFoundException extends RuntimeException {
  public SilenceNotFoundException(String id) {
    super(String.format("Silence not found: %s", id));
  }
}
