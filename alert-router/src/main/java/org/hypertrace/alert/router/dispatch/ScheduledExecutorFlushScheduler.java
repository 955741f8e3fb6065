package org.hypertrace.alert.router.dispatch;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed rate timers on a small scheduled pool. Timer threads only hand flushes over to the
 * pipeline executor, so a slow flush never delays other groups' timers.
 */
public class ScheduledExecutorFlushScheduler implements FlushScheduler {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ScheduledExecutorFlushScheduler.class);

  private final ScheduledExecutorService executorService;

  public ScheduledExecutorFlushScheduler(int threads) {
    this.executorService =
        Executors.newScheduledThreadPool(
            threads,
            new ThreadFactoryBuilder().setNameFormat("flush-timer-%d").setDaemon(true).build());
  }

  @Override
  public Cancellable schedule(Runnable flush, Duration initialDelay, Duration period) {
    ScheduledFuture<?> future =
        executorService.scheduleAtFixedRate(
            () -> {
              try {
                flush.run();
              } catch (RuntimeException e) {
                // an escaping exception cancels the fixed rate schedule
                LOGGER.error("Flush failed", e);
              }
            },
            initialDelay.toMillis(),
            period.toMillis(),
            TimeUnit.MILLISECONDS);
    return () -> future.cancel(false);
  }

  @Override
  public void shutdown() {
    executorService.shutdownNow();
  }
}
