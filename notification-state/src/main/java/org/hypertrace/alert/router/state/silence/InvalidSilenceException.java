package org.hypertrace.alert.router.state.silence;

public class InvalidSilenceException extends RuntimeException {
  public InvalidSilenceException(String message) {
    super(message);
  }
}
