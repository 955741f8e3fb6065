package org.hypertrace.alert.router.notification.pipeline;

import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.hypertrace.alert.router.datamodel.Alert;

/**
 * Alerts of a group as seen by one flush. Stages exclude alerts from sending but never remove
 * them: the notification log is written from the complete batch.
 */
public class AlertBatch {
  private final List<Alert> alerts;
  private final Instant flushTime;
  private final Map<Long, ExclusionReason> exclusions = new ConcurrentHashMap<>();

  public AlertBatch(List<Alert> alerts, Instant flushTime) {
    this.alerts =
        alerts.stream()
            .map(alert -> alert.snapshotAt(flushTime))
            .collect(ImmutableList.toImmutableList());
    this.flushTime = flushTime;
  }

  public List<Alert> getAlerts() {
    return alerts;
  }

  public Instant getFlushTime() {
    return flushTime;
  }

  /** Excludes the alert from sending. The first reason given for an alert is kept. */
  public void exclude(Alert alert, ExclusionReason reason) {
    exclusions.putIfAbsent(alert.getFingerprint(), reason);
  }

  public boolean isExcluded(Alert alert) {
    return exclusions.containsKey(alert.getFingerprint());
  }

  public Optional<ExclusionReason> getExclusionReason(Alert alert) {
    return Optional.ofNullable(exclusions.get(alert.getFingerprint()));
  }

  /** Alerts not excluded by any stage. */
  public List<Alert> getCandidates() {
    return alerts.stream().filter(alert -> !isExcluded(alert)).collect(Collectors.toList());
  }

  public Set<Long> firingFingerprints() {
    return alerts.stream()
        .filter(alert -> !alert.isResolved(flushTime))
        .map(Alert::getFingerprint)
        .collect(Collectors.toSet());
  }

  public Set<Long> resolvedFingerprints() {
    return alerts.stream()
        .filter(alert -> alert.isResolved(flushTime))
        .map(Alert::getFingerprint)
        .collect(Collectors.toSet());
  }
}
