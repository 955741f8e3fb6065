package org.hypertrace.alert.router.notification.pipeline;

import java.time.Duration;

/** Waits inside a pipeline stage. */
@FunctionalInterface
public interface Sleeper {
  Sleeper CANCELLABLE = (duration, context) -> !context.awaitCancellation(duration);

  /** Returns false when the context was cancelled before the duration elapsed. */
  boolean sleep(Duration duration, NotificationContext context) throws InterruptedException;
}
