package org.hypertrace.alert.router.dispatch;

import com.google.common.collect.ImmutableSortedMap;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.hypertrace.alert.router.datamodel.Alert;
import org.hypertrace.alert.router.notification.pipeline.NotificationContext;
import org.hypertrace.alert.router.notification.route.Route;

/**
 * Alerts of one route sharing the same grouping label values. Flushes of a group are serialized
 * by its flush lock; starting a flush cancels the one still in flight. Adding members and deleting
 * the group synchronize on the group itself, so no alert is added to a deleted group.
 */
public class AggregationGroup {
  private final Route route;
  private final String groupKey;
  private final SortedMap<String, String> groupLabels;
  private final Instant createdAt;
  private final ConcurrentMap<Long, Alert> alerts = new ConcurrentHashMap<>();
  private final Lock flushLock = new ReentrantLock();
  private final AtomicReference<NotificationContext> currentFlush = new AtomicReference<>();
  private volatile FlushScheduler.Cancellable timer;
  private volatile boolean deleted;

  AggregationGroup(
      Route route, String groupKey, Map<String, String> groupLabels, Instant createdAt) {
    this.route = route;
    this.groupKey = groupKey;
    this.groupLabels = ImmutableSortedMap.copyOf(groupLabels);
    this.createdAt = createdAt;
  }

  public Route getRoute() {
    return route;
  }

  public String getReceiver() {
    return route.getOptions().getReceiver();
  }

  public String getGroupKey() {
    return groupKey;
  }

  public SortedMap<String, String> getGroupLabels() {
    return groupLabels;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  /** Current version of every member, oldest first. */
  public List<Alert> getAlerts() {
    return alerts.values().stream()
        .sorted(
            Comparator.comparing(Alert::getStartsAt).thenComparingLong(Alert::getFingerprint))
        .collect(Collectors.toList());
  }

  public boolean isEmpty() {
    return alerts.isEmpty();
  }

  public boolean isDeleted() {
    return deleted;
  }

  public boolean contains(long fingerprint) {
    return alerts.containsKey(fingerprint);
  }

  /** Merges the alert into the held version and returns the result, empty once deleted. */
  synchronized Optional<Alert> add(Alert alert, Instant now) {
    if (deleted) {
      return Optional.empty();
    }
    return Optional.of(
        alerts.merge(
            alert.getFingerprint(), alert, (existing, incoming) -> existing.merge(incoming, now)));
  }

  /** Removes the alert unless a newer version arrived since {@code version} was read. */
  boolean removeIfUnchanged(Alert version) {
    return alerts.remove(version.getFingerprint(), version);
  }

  void setTimer(FlushScheduler.Cancellable timer) {
    this.timer = timer;
  }

  /** Registers a new flush, cancelling the previous one if it is still running. */
  NotificationContext startFlush() {
    NotificationContext context =
        NotificationContext.builder()
            .receiver(getReceiver())
            .groupKey(groupKey)
            .groupLabels(groupLabels)
            .routeOptions(route.getOptions())
            .build();
    NotificationContext stale = currentFlush.getAndSet(context);
    if (stale != null) {
      stale.cancel();
    }
    return context;
  }

  Lock getFlushLock() {
    return flushLock;
  }

  /** Deletes the group if it has no members and returns whether it did. */
  synchronized boolean deleteIfEmpty() {
    if (deleted || !alerts.isEmpty()) {
      return false;
    }
    delete();
    return true;
  }

  /** Stops the timer and detaches the flush in flight, which then skips its log update. */
  synchronized void delete() {
    deleted = true;
    FlushScheduler.Cancellable cancellable = timer;
    if (cancellable != null) {
      cancellable.cancel();
    }
    NotificationContext inFlight = currentFlush.get();
    if (inFlight != null) {
      inFlight.markGroupDeleted();
    }
  }

  @Override
  public String toString() {
    return "AggregationGroup{receiver=" + getReceiver() + ", groupKey=" + groupKey + "}";
  }
}
