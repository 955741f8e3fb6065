package org.hypertrace.alert.router.notification.notifier;

import java.util.List;
import org.hypertrace.alert.router.datamodel.Alert;
import org.hypertrace.alert.router.notification.pipeline.NotificationContext;

/** Delivers a batch of alerts to one receiver. */
public interface Notifier {

  /** Integration name used to tag metrics, e.g. {@code webhook}. */
  String getIntegration();

  boolean isSendResolved();

  /**
   * Sends the alerts. Throws a {@link NotifierException} whose {@code retryable} flag tells whether
   * another attempt can succeed.
   */
  void notify(NotificationContext context, List<Alert> alerts) throws NotifierException;
}
