package org.hypertrace.alert.router.notification.inhibit;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.Getter;
import org.hypertrace.alert.router.datamodel.Alert;
import org.hypertrace.alert.router.datamodel.Fingerprints;
import org.hypertrace.alert.router.datamodel.LabelMatcher;
import org.hypertrace.alert.router.datamodel.LabelMatchers;

/**
 * Source alerts inhibit target alerts when all {@code equal} labels have the same value on both.
 * Alerts matching the source side are cached by the fingerprint of their {@code equal} label
 * values, so a lookup only visits sources that can inhibit the target.
 */
public class InhibitRule {
  @Getter private final List<LabelMatcher> sourceMatchers;
  @Getter private final List<LabelMatcher> targetMatchers;
  @Getter private final Set<String> equal;

  private final ConcurrentMap<Long, ConcurrentMap<Long, CachedAlert>> cache =
      new ConcurrentHashMap<>();

  public InhibitRule(
      List<LabelMatcher> sourceMatchers, List<LabelMatcher> targetMatchers, Set<String> equal) {
    this.sourceMatchers = ImmutableList.copyOf(sourceMatchers);
    this.targetMatchers = ImmutableList.copyOf(targetMatchers);
    this.equal = ImmutableSet.copyOf(equal);
  }

  /** Caches the alert when it matches the source side, replacing an older version. */
  void observe(Alert alert) {
    if (!LabelMatchers.matchesAll(sourceMatchers, alert.getLabels())) {
      return;
    }
    cache
        .computeIfAbsent(cacheKey(alert.getLabels()), k -> new ConcurrentHashMap<>())
        .put(
            alert.getFingerprint(),
            new CachedAlert(alert, LabelMatchers.matchesAll(targetMatchers, alert.getLabels())));
  }

  boolean matchesTarget(Map<String, String> labels) {
    return LabelMatchers.matchesAll(targetMatchers, labels);
  }

  /**
   * Fingerprint of a firing source alert inhibiting the label set. A source that also matches the
   * target side does not inhibit a label set that matches the source side itself.
   */
  Optional<Long> findInhibitor(Map<String, String> labels, Instant now) {
    Map<Long, CachedAlert> candidates = cache.get(cacheKey(labels));
    if (candidates == null) {
      return Optional.empty();
    }
    Boolean labelsMatchSource = null;
    for (Map.Entry<Long, CachedAlert> entry : candidates.entrySet()) {
      CachedAlert cachedAlert = entry.getValue();
      if (cachedAlert.alert.isResolved(now)) {
        continue;
      }
      if (cachedAlert.matchesSourceAndTarget) {
        if (labelsMatchSource == null) {
          labelsMatchSource = LabelMatchers.matchesAll(sourceMatchers, labels);
        }
        if (labelsMatchSource) {
          continue;
        }
      }
      return Optional.of(entry.getKey());
    }
    return Optional.empty();
  }

  /** Drops cached alerts that are resolved at {@code now}. Returns how many were dropped. */
  int gc(Instant now) {
    int removed = 0;
    for (Map.Entry<Long, ConcurrentMap<Long, CachedAlert>> cacheEntry : cache.entrySet()) {
      ConcurrentMap<Long, CachedAlert> alerts = cacheEntry.getValue();
      for (Map.Entry<Long, CachedAlert> entry : alerts.entrySet()) {
        CachedAlert cachedAlert = entry.getValue();
        if (cachedAlert.alert.isResolved(now) && alerts.remove(entry.getKey(), cachedAlert)) {
          removed++;
        }
      }
      cache.computeIfPresent(cacheEntry.getKey(), (k, v) -> v.isEmpty() ? null : v);
    }
    return removed;
  }

  int cachedAlerts() {
    return cache.values().stream().mapToInt(Map::size).sum();
  }

  private long cacheKey(Map<String, String> labels) {
    Map<String, String> equalLabels = new HashMap<>();
    for (String name : equal) {
      equalLabels.put(name, labels.getOrDefault(name, ""));
    }
    return Fingerprints.of(equalLabels);
  }

  private static class CachedAlert {
    private final Alert alert;
    private final boolean matchesSourceAndTarget;

    private CachedAlert(Alert alert, boolean matchesSourceAndTarget) {
      this.alert = alert;
      this.matchesSourceAndTarget = matchesSourceAndTarget;
    }
  }
}
