package org.hypertrace.alert.router.state.silence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.hypertrace.alert.router.datamodel.LabelMatcher;
import org.hypertrace.alert.router.datamodel.LabelMatchers;

/**
 * A temporary suppression rule. The state is derived from the evaluation time only: pending
 * before {@code startsAt}, active from {@code startsAt} until {@code endsAt}, expired afterwards.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Silence {
  private final String id;
  private final List<LabelMatcher> matchers;
  private final Instant startsAt;
  private final Instant endsAt;
  private final Instant updatedAt;
  private final String createdBy;
  private final String comment;

  @Builder(toBuilder = true)
  @JsonCreator
  public Silence(
      @JsonProperty("id") String id,
      @JsonProperty("matchers") List<LabelMatcher> matchers,
      @JsonProperty("startsAt") Instant startsAt,
      @JsonProperty("endsAt") Instant endsAt,
      @JsonProperty("updatedAt") Instant updatedAt,
      @JsonProperty("createdBy") String createdBy,
      @JsonProperty("comment") String comment) {
    this.id = id;
    this.matchers = matchers == null ? ImmutableList.of() : ImmutableList.copyOf(matchers);
    this.startsAt = startsAt;
    this.endsAt = endsAt;
    this.updatedAt = updatedAt;
    this.createdBy = createdBy;
    this.comment = comment;
  }

  public SilenceState getState(Instant now) {
    if (now.isBefore(startsAt)) {
      return SilenceState.PENDING;
    }
    if (now.isBefore(endsAt)) {
      return SilenceState.ACTIVE;
    }
    return SilenceState.EXPIRED;
  }

  /** True when the silence is active at {@code now} and all its matchers match. */
  public boolean mutes(Map<String, String> labels, Instant now) {
    return getState(now) == SilenceState.ACTIVE && LabelMatchers.matchesAll(matchers, labels);
  }

  @JsonIgnore
  public boolean hasTimestamps() {
    return startsAt != null && endsAt != null;
  }
}
