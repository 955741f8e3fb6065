package org.hypertrace.alert.router.dispatch;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** Runs timers on the calling thread while moving a test clock forward. */
class ManualFlushScheduler implements FlushScheduler {
  private final AtomicReference<Instant> now;
  private final List<Timer> timers = new ArrayList<>();

  ManualFlushScheduler(AtomicReference<Instant> now) {
    this.now = now;
  }

  @Override
  public synchronized Cancellable schedule(
      Runnable flush, Duration initialDelay, Duration period) {
    Timer timer = new Timer(flush, now.get().plus(initialDelay), period);
    timers.add(timer);
    return () -> timer.cancelled = true;
  }

  @Override
  public void shutdown() {
    timers.forEach(timer -> timer.cancelled = true);
  }

  /** Fires every timer due up to {@code target} in time order, then sets the clock to it. */
  void advanceTo(Instant target) {
    while (true) {
      Optional<Timer> next =
          timers.stream()
              .filter(timer -> !timer.cancelled && !timer.nextFire.isAfter(target))
              .min(Comparator.comparing((Timer timer) -> timer.nextFire));
      if (next.isEmpty()) {
        break;
      }
      Timer timer = next.get();
      now.set(timer.nextFire);
      timer.nextFire = timer.nextFire.plus(timer.period);
      timer.flush.run();
    }
    now.set(target);
  }

  long activeTimers() {
    return timers.stream().filter(timer -> !timer.cancelled).count();
  }

  private static class Timer {
    private final Runnable flush;
    private final Duration period;
    private Instant nextFire;
    private volatile boolean cancelled;

    private Timer(Runnable flush, Instant nextFire, Duration period) {
      this.flush = flush;
      this.nextFire = nextFire;
      this.period = period;
    }
  }
}
