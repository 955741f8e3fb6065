package org.hypertrace.alert.router.notification.pipeline;

import com.google.common.collect.ImmutableSortedMap;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import org.hypertrace.alert.router.notification.route.RouteOptions;

/**
 * One flush of an aggregation group towards one receiver. A context is cancelled when a newer
 * flush of the same group supersedes it; it is marked detached when its group was deleted while
 * the flush was in flight.
 */
@Getter
public class NotificationContext {
  private final String receiver;
  private final String groupKey;
  private final Map<String, String> groupLabels;
  private final RouteOptions routeOptions;

  @Getter(AccessLevel.NONE)
  private final CountDownLatch cancelled = new CountDownLatch(1);

  private volatile boolean groupDeleted;

  @Getter(AccessLevel.NONE)
  private final AtomicReference<NotificationOutcome> outcome =
      new AtomicReference<>(NotificationOutcome.PENDING);

  @Builder
  public NotificationContext(
      String receiver,
      String groupKey,
      Map<String, String> groupLabels,
      RouteOptions routeOptions) {
    this.receiver = receiver;
    this.groupKey = groupKey;
    this.groupLabels =
        groupLabels == null ? ImmutableSortedMap.of() : ImmutableSortedMap.copyOf(groupLabels);
    this.routeOptions = routeOptions;
  }

  public void cancel() {
    cancelled.countDown();
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }

  /** Blocks up to {@code timeout} and returns true when the context got cancelled meanwhile. */
  public boolean awaitCancellation(Duration timeout) throws InterruptedException {
    return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  public void markGroupDeleted() {
    groupDeleted = true;
  }

  public NotificationOutcome getOutcome() {
    return outcome.get();
  }

  void setOutcome(NotificationOutcome notificationOutcome) {
    outcome.set(notificationOutcome);
  }

  @Override
  public String toString() {
    return "NotificationContext{receiver=" + receiver + ", groupKey=" + groupKey + "}";
  }
}
