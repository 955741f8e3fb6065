package org.hypertrace.alert.router.notification.timeinterval;

import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Named time intervals referenced by routes. */
public class TimeIntervals {
  private final Map<String, List<TimeInterval>> intervals;

  public TimeIntervals(Map<String, List<TimeInterval>> intervals) {
    this.intervals = ImmutableMap.copyOf(intervals);
  }

  public static TimeIntervals empty() {
    return new TimeIntervals(Map.of());
  }

  /** True when any interval of the named time interval contains the instant. */
  public boolean isActive(String name, Instant instant) {
    List<TimeInterval> named = intervals.get(name);
    if (named == null) {
      throw new IllegalArgumentException(String.format("Unknown time interval:%s", name));
    }
    return named.stream().anyMatch(interval -> interval.contains(instant));
  }

  public Set<String> names() {
    return intervals.keySet();
  }
}
