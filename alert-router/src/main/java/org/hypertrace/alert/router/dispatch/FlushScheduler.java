package org.hypertrace.alert.router.dispatch;

import java.time.Duration;

/** Runs the recurring flush of aggregation groups. */
public interface FlushScheduler {

  /** Runs {@code flush} once after {@code initialDelay} and then every {@code period}. */
  Cancellable schedule(Runnable flush, Duration initialDelay, Duration period);

  void shutdown();

  interface Cancellable {
    void cancel();
  }
}
