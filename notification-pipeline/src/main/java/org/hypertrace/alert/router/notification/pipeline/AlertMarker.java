package org.hypertrace.alert.router.notification.pipeline;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Last known suppression status of every alert, keyed by fingerprint. */
public class AlertMarker {
  private final ConcurrentMap<Long, AlertStatus> statuses = new ConcurrentHashMap<>();

  public void setSilenced(long fingerprint, List<String> silenceIds) {
    statuses.compute(
        fingerprint,
        (fp, status) ->
            new AlertStatus(silenceIds, status == null ? List.of() : status.getInhibitedBy()));
  }

  public void setInhibited(long fingerprint, List<Long> inhibitors) {
    statuses.compute(
        fingerprint,
        (fp, status) ->
            new AlertStatus(status == null ? List.of() : status.getSilencedBy(), inhibitors));
  }

  public AlertStatus status(long fingerprint) {
    return statuses.getOrDefault(fingerprint, AlertStatus.UNPROCESSED);
  }

  public void delete(long fingerprint) {
    statuses.remove(fingerprint);
  }

  public int size() {
    return statuses.size();
  }

  public enum AlertState {
    UNPROCESSED,
    ACTIVE,
    SUPPRESSED
  }

  @Getter
  @ToString
  @EqualsAndHashCode
  public static class AlertStatus {
    static final AlertStatus UNPROCESSED =
        new AlertStatus(AlertState.UNPROCESSED, List.of(), List.of());

    private final AlertState state;
    private final List<String> silencedBy;
    private final List<Long> inhibitedBy;

    AlertStatus(List<String> silencedBy, List<Long> inhibitedBy) {
      this(
          silencedBy.isEmpty() && inhibitedBy.isEmpty()
              ? AlertState.ACTIVE
              : AlertState.SUPPRESSED,
          silencedBy,
          inhibitedBy);
    }

    private AlertStatus(AlertState state, List<String> silencedBy, List<Long> inhibitedBy) {
      this.state = state;
      this.silencedBy = ImmutableList.copyOf(silencedBy);
      this.inhibitedBy = ImmutableList.copyOf(inhibitedBy);
    }
  }
}
