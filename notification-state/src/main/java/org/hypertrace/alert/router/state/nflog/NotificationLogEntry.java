package org.hypertrace.alert.router.state.nflog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.time.Instant;
import java.util.Set;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.hypertrace.alert.router.state.Versioned;

/** Outcome of the last notification for one receiver and aggregation group. */
@Getter
@ToString
@EqualsAndHashCode
public class NotificationLogEntry implements Versioned {
  private final String receiver;
  private final String groupKey;
  private final Instant timestamp;
  private final Set<Long> firingAlerts;
  private final Set<Long> resolvedAlerts;
  private final Instant expiresAt;
  private final String origin;

  /** Set for entries produced by another peer. Derived from the origin when decoding. */
  private final boolean remote;

  @Builder(toBuilder = true)
  @JsonCreator
  public NotificationLogEntry(
      @JsonProperty("receiver") String receiver,
      @JsonProperty("groupKey") String groupKey,
      @JsonProperty("timestamp") Instant timestamp,
      @JsonProperty("firingAlerts") Set<Long> firingAlerts,
      @JsonProperty("resolvedAlerts") Set<Long> resolvedAlerts,
      @JsonProperty("expiresAt") Instant expiresAt,
      @JsonProperty("origin") String origin,
      @JsonProperty("remote") boolean remote) {
    Preconditions.checkArgument(receiver != null, "notification log entry has no receiver");
    Preconditions.checkArgument(groupKey != null, "notification log entry has no group key");
    Preconditions.checkArgument(timestamp != null, "notification log entry has no timestamp");
    Preconditions.checkArgument(expiresAt != null, "notification log entry has no expiry");
    this.receiver = receiver;
    this.groupKey = groupKey;
    this.timestamp = timestamp;
    this.firingAlerts =
        firingAlerts == null ? ImmutableSet.of() : ImmutableSet.copyOf(firingAlerts);
    this.resolvedAlerts =
        resolvedAlerts == null ? ImmutableSet.of() : ImmutableSet.copyOf(resolvedAlerts);
    Preconditions.checkArgument(
        Sets.intersection(this.firingAlerts, this.resolvedAlerts).isEmpty(),
        "alerts cannot be firing and resolved at once: %s",
        Sets.intersection(this.firingAlerts, this.resolvedAlerts));
    this.expiresAt = expiresAt;
    this.origin = origin;
    this.remote = remote;
  }

  /**
   * Whether every fingerprint in {@code subset} was firing at the last notification. For entries
   * from another peer a fingerprint that peer already announced as resolved also counts, so a
   * resolution is not notified twice across the cluster.
   */
  public boolean isFiringSubset(Set<Long> subset) {
    for (Long fingerprint : subset) {
      if (!firingAlerts.contains(fingerprint)
          && !(remote && resolvedAlerts.contains(fingerprint))) {
        return false;
      }
    }
    return true;
  }

  /** Whether every fingerprint in {@code subset} was resolved at the last notification. */
  public boolean isResolvedSubset(Set<Long> subset) {
    return resolvedAlerts.containsAll(subset);
  }

  @JsonIgnore
  @Override
  public String getKey() {
    return NotificationLog.stateKey(receiver, groupKey);
  }

  @JsonIgnore
  @Override
  public Instant getUpdatedAt() {
    return timestamp;
  }
}
