package org.hypertrace.alert.router.notification.timeinterval;

import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A recurring window in time. Every non-empty component has to contain the instant; an interval
 * without any component contains every instant.
 */
@Getter
@ToString
@EqualsAndHashCode
public class TimeInterval {
  private final List<Range> times;
  private final List<Range> weekdays;
  private final List<Range> daysOfMonth;
  private final List<Range> months;
  private final List<Range> years;
  private final ZoneId location;

  @Builder
  public TimeInterval(
      List<Range> times,
      List<Range> weekdays,
      List<Range> daysOfMonth,
      List<Range> months,
      List<Range> years,
      ZoneId location) {
    this.times = times == null ? ImmutableList.of() : ImmutableList.copyOf(times);
    this.weekdays = weekdays == null ? ImmutableList.of() : ImmutableList.copyOf(weekdays);
    this.daysOfMonth = daysOfMonth == null ? ImmutableList.of() : ImmutableList.copyOf(daysOfMonth);
    this.months = months == null ? ImmutableList.of() : ImmutableList.copyOf(months);
    this.years = years == null ? ImmutableList.of() : ImmutableList.copyOf(years);
    this.location = location == null ? ZoneOffset.UTC : location;
  }

  public boolean contains(Instant instant) {
    ZonedDateTime time = instant.atZone(location);
    if (!times.isEmpty()) {
      int minute = time.getHour() * 60 + time.getMinute();
      // end of a time range is exclusive
      if (times.stream().noneMatch(range -> minute >= range.begin && minute < range.end)) {
        return false;
      }
    }
    if (!matchesAny(daysOfMonth, time)) {
      return false;
    }
    if (!weekdays.isEmpty() && !inAny(weekdays, time.getDayOfWeek().getValue())) {
      return false;
    }
    if (!months.isEmpty() && !inAny(months, time.getMonthValue())) {
      return false;
    }
    return years.isEmpty() || inAny(years, time.getYear());
  }

  private static boolean matchesAny(List<Range> daysOfMonth, ZonedDateTime time) {
    if (daysOfMonth.isEmpty()) {
      return true;
    }
    int daysInMonth = time.toLocalDate().lengthOfMonth();
    int day = time.getDayOfMonth();
    for (Range range : daysOfMonth) {
      // negative days count from the end of the month, -1 being the last day
      int begin = range.begin < 0 ? daysInMonth + range.begin + 1 : range.begin;
      int end = range.end < 0 ? daysInMonth + range.end + 1 : range.end;
      if (day >= Math.max(begin, 1) && day <= Math.min(end, daysInMonth)) {
        return true;
      }
    }
    return false;
  }

  private static boolean inAny(List<Range> ranges, int value) {
    return ranges.stream().anyMatch(range -> value >= range.begin && value <= range.end);
  }

  /** Inclusive range, except for times of day where the end minute is exclusive. */
  @Getter
  @ToString
  @EqualsAndHashCode
  public static class Range {
    private final int begin;
    private final int end;

    public Range(int begin, int end) {
      this.begin = begin;
      this.end = end;
    }
  }
}
