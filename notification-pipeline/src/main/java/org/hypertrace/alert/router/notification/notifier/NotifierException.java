package org.hypertrace.alert.router.notification.notifier;

public class NotifierException extends Exception {
  private final boolean retryable;

  public NotifierException(String message, boolean retryable) {
    super(message);
    this.retryable = retryable;
  }

  public NotifierException(String message, boolean retryable, Throwable cause) {
    super(message, cause);
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
