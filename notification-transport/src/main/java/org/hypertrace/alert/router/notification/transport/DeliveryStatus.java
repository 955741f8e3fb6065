package org.hypertrace.alert.router.notification.transport;

/** Outcome of one delivery attempt, as far as the transport can tell. */
public enum DeliveryStatus {
  DELIVERED,
  RETRYABLE_FAILURE,
  PERMANENT_FAILURE;

  /** IO failures, 5xx and 429 can succeed later, any other non-2xx code will not. */
  public static DeliveryStatus fromResponseCode(int code) {
    if (code >= 200 && code < 300) {
      return DELIVERED;
    }
    if (code >= 500 || code == 429) {
      return RETRYABLE_FAILURE;
    }
    return PERMANENT_FAILURE;
  }
}
