package org.hypertrace.alert.router.dispatch;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Lock;
import lombok.Builder;
import org.hypertrace.alert.router.datamodel.Alert;
import org.hypertrace.alert.router.notification.inhibit.Inhibitor;
import org.hypertrace.alert.router.notification.pipeline.AlertBatch;
import org.hypertrace.alert.router.notification.pipeline.AlertMarker;
import org.hypertrace.alert.router.notification.pipeline.NotificationContext;
import org.hypertrace.alert.router.notification.pipeline.NotificationOutcome;
import org.hypertrace.alert.router.notification.pipeline.NotificationPipeline;
import org.hypertrace.alert.router.notification.route.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns incoming alerts to aggregation groups and flushes every group on its own timer: first
 * after the route's group wait, then every group interval. New members never reset the timer.
 *
 * <p>After a flush that did not fail, resolved alerts that were not updated meanwhile leave the
 * group, and their status is forgotten once no group holds them. An empty group is deleted
 * together with its timer.
 */
public class Dispatcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(Dispatcher.class);
  private static final String GROUPS_LIMITED_COUNTER =
      "hypertrace.alert.router.dispatcher.groups.limited";
  private static final Counter groupsLimitedCounter = Metrics.counter(GROUPS_LIMITED_COUNTER);

  private final Route root;
  private final Map<String, NotificationPipeline> pipelines;
  private final Inhibitor inhibitor;
  private final AlertMarker alertMarker;
  private final FlushScheduler flushScheduler;
  private final Executor pipelineExecutor;
  private final Clock clock;
  private final int maxAggregationGroups;
  private final ConcurrentMap<String, AggregationGroup> groups = new ConcurrentHashMap<>();
  private volatile boolean stopped;

  @Builder
  public Dispatcher(
      Route root,
      Map<String, NotificationPipeline> pipelines,
      Inhibitor inhibitor,
      AlertMarker alertMarker,
      FlushScheduler flushScheduler,
      Executor pipelineExecutor,
      Clock clock,
      int maxAggregationGroups) {
    this.root = root;
    this.pipelines = ImmutableMap.copyOf(pipelines);
    this.inhibitor = inhibitor;
    this.alertMarker = alertMarker;
    this.flushScheduler = flushScheduler;
    this.pipelineExecutor = pipelineExecutor;
    this.clock = clock;
    this.maxAggregationGroups = maxAggregationGroups;
    root.walk(
        route ->
            Preconditions.checkArgument(
                pipelines.containsKey(route.getOptions().getReceiver()),
                "no pipeline for receiver %s",
                route.getOptions().getReceiver()));
  }

  /**
   * Adds a version of an alert to every group its route targets select. A version identical to
   * the held one changes nothing.
   */
  public void submit(Alert alert) {
    Preconditions.checkState(!stopped, "dispatcher is stopped");
    Instant now = clock.instant();
    Alert incoming = alert.withDefaults(now);
    Alert latest = incoming;
    for (Route route : root.match(incoming.getLabels())) {
      SortedMap<String, String> groupLabels = route.groupLabels(incoming.getLabels());
      String groupKey = route.groupKey(groupLabels);
      Optional<Alert> merged = addToGroup(route, groupKey, groupLabels, incoming, now);
      if (merged.isPresent()) {
        latest = merged.get();
      }
    }
    inhibitor.observe(latest);
  }

  private Optional<Alert> addToGroup(
      Route route,
      String groupKey,
      SortedMap<String, String> groupLabels,
      Alert alert,
      Instant now) {
    while (true) {
      AggregationGroup group =
          groups.computeIfAbsent(groupKey, key -> createGroup(route, key, groupLabels, now));
      if (group == null) {
        groupsLimitedCounter.increment();
        LOGGER.warn(
            "Too many aggregation groups ({}), dropping alert {} for group {}",
            groups.size(),
            alert.getLabels(),
            groupKey);
        return Optional.empty();
      }
      Optional<Alert> merged = group.add(alert, now);
      if (merged.isPresent()) {
        return merged;
      }
      // deleted after the lookup
      groups.remove(groupKey, group);
    }
  }

  /** Runs inside the map's compute, so it only creates and schedules. Null when over the limit. */
  private AggregationGroup createGroup(
      Route route, String groupKey, Map<String, String> groupLabels, Instant now) {
    if (maxAggregationGroups > 0 && groups.size() >= maxAggregationGroups) {
      return null;
    }
    AggregationGroup group = new AggregationGroup(route, groupKey, groupLabels, now);
    group.setTimer(
        flushScheduler.schedule(
            () -> dispatchFlush(group),
            route.getOptions().getGroupWait(),
            route.getOptions().getGroupInterval()));
    LOGGER.debug("Created aggregation group {}", group);
    return group;
  }

  private void dispatchFlush(AggregationGroup group) {
    try {
      pipelineExecutor.execute(() -> flush(group));
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Pipeline executor rejected the flush of {}", group, e);
    }
  }

  /** Runs the receiver's pipeline over the group's current members. */
  NotificationOutcome flush(AggregationGroup group) {
    NotificationContext context = group.startFlush();
    Lock flushLock = group.getFlushLock();
    flushLock.lock();
    try {
      if (context.isCancelled() || group.isDeleted()) {
        return NotificationOutcome.CANCELLED;
      }
      List<Alert> members = group.getAlerts();
      if (members.isEmpty()) {
        deleteIfEmpty(group);
        return NotificationOutcome.NOTHING_TO_SEND;
      }
      Instant flushTime = clock.instant();
      NotificationOutcome outcome =
          pipelines.get(group.getReceiver()).execute(context, new AlertBatch(members, flushTime));
      LOGGER.debug("Flushed {} with {} alerts: {}", group, members.size(), outcome);
      if (outcome == NotificationOutcome.SENT
          || outcome == NotificationOutcome.NOTHING_TO_SEND
          || outcome == NotificationOutcome.SUPPRESSED) {
        members.stream()
            .filter(alert -> alert.isResolved(flushTime))
            .filter(group::removeIfUnchanged)
            .forEach(this::forgetIfUngrouped);
        deleteIfEmpty(group);
      }
      return outcome;
    } finally {
      flushLock.unlock();
    }
  }

  private void forgetIfUngrouped(Alert alert) {
    long fingerprint = alert.getFingerprint();
    if (groups.values().stream().noneMatch(group -> group.contains(fingerprint))) {
      alertMarker.delete(fingerprint);
    }
  }

  private void deleteIfEmpty(AggregationGroup group) {
    if (group.deleteIfEmpty()) {
      groups.remove(group.getGroupKey(), group);
      LOGGER.debug("Deleted empty aggregation group {}", group);
    }
  }

  public List<AggregationGroup> groups() {
    return ImmutableList.copyOf(groups.values());
  }

  /** Cancels every timer. Flushes in flight finish without updating the notification log. */
  public void stop() {
    stopped = true;
    groups.values().forEach(AggregationGroup::delete);
    groups.clear();
    flushScheduler.shutdown();
    LOGGER.info("Dispatcher stopped");
  }
}
