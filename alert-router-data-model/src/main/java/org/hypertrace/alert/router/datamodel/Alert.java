package org.hypertrace.alert.router.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A single version of an alert. Alerts are immutable, a newer version of the same alert has the
 * same label set (hence the same fingerprint) and a later {@code updatedAt}.
 *
 * <p>An alert without {@code endsAt} is firing. An alert whose {@code endsAt} is not after the
 * evaluation time is resolved.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Alert {
  private final Map<String, String> labels;
  private final Map<String, String> annotations;
  private final Instant startsAt;
  private final Instant endsAt;
  private final Instant updatedAt;

  @JsonIgnore @ToString.Exclude @EqualsAndHashCode.Exclude private final long fingerprint;

  @Builder(toBuilder = true)
  @JsonCreator
  public Alert(
      @JsonProperty("labels") Map<String, String> labels,
      @JsonProperty("annotations") Map<String, String> annotations,
      @JsonProperty("startsAt") Instant startsAt,
      @JsonProperty("endsAt") Instant endsAt,
      @JsonProperty("updatedAt") Instant updatedAt) {
    Preconditions.checkArgument(
        labels != null && !labels.isEmpty(), "alert must have at least one label");
    labels.forEach(
        (name, value) ->
            Preconditions.checkArgument(
                name != null && !name.isEmpty() && value != null,
                "invalid label %s=%s",
                name,
                value));
    this.labels = ImmutableSortedMap.copyOf(labels);
    this.annotations =
        annotations == null ? ImmutableSortedMap.of() : ImmutableSortedMap.copyOf(annotations);
    this.startsAt = startsAt;
    this.endsAt = endsAt;
    this.updatedAt = updatedAt;
    this.fingerprint = Fingerprints.of(this.labels);
  }

  public boolean isResolved(Instant now) {
    return endsAt != null && !endsAt.isAfter(now);
  }

  /** Fills in the timestamps a source may omit. */
  public Alert withDefaults(Instant now) {
    if (startsAt != null && updatedAt != null) {
      return this;
    }
    return toBuilder()
        .startsAt(startsAt == null ? now : startsAt)
        .updatedAt(updatedAt == null ? now : updatedAt)
        .build();
  }

  /**
   * The alert as seen by a flush at {@code now}: an end time that has not been reached yet is
   * dropped, so the alert counts as firing.
   */
  public Alert snapshotAt(Instant now) {
    if (endsAt == null || isResolved(now)) {
      return this;
    }
    return toBuilder().endsAt(null).build();
  }

  /**
   * Merges two versions of the same alert. The version with the later {@code updatedAt} wins, the
   * earliest start time is kept and an end time is only moved backwards by an older version that
   * was already resolved.
   */
  public Alert merge(Alert other, Instant now) {
    Preconditions.checkArgument(
        fingerprint == other.fingerprint, "cannot merge alerts with different label sets");
    if (other.updatedAt.isBefore(updatedAt)) {
      return other.merge(this, now);
    }
    // other is the newer version from here on
    Alert.AlertBuilder result = other.toBuilder();
    if (startsAt.isBefore(other.startsAt)) {
      result.startsAt(startsAt);
    }
    if (other.isResolved(now)) {
      if (isResolved(now) && endsAt.isBefore(other.endsAt)) {
        result.endsAt(endsAt);
      }
    } else if (endsAt != null
        && !isResolved(now)
        && (other.endsAt == null || endsAt.isAfter(other.endsAt))) {
      result.endsAt(endsAt);
    }
    return result.build();
  }
}
