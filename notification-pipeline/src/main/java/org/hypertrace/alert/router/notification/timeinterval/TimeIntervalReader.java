package org.hypertrace.alert.router.notification.timeinterval;

import com.typesafe.config.Config;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Month;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.ToIntFunction;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.alert.router.notification.timeinterval.TimeInterval.Range;

/**
 * Reads the {@code timeIntervals} section. Ranges are written as {@code "begin:end"} or a single
 * value; weekdays and months are given by name, months also by number.
 */
public class TimeIntervalReader {
  static final String NAME = "name";
  static final String INTERVALS = "intervals";
  static final String TIMES = "times";
  static final String TIME_START = "start";
  static final String TIME_END = "end";
  static final String WEEKDAYS = "weekdays";
  static final String DAYS_OF_MONTH = "daysOfMonth";
  static final String MONTHS = "months";
  static final String YEARS = "years";
  static final String LOCATION = "location";
  private static final int MINUTES_PER_DAY = 24 * 60;

  private TimeIntervalReader() {}

  public static TimeIntervals fromConfig(List<? extends Config> timeIntervalConfigs) {
    Map<String, List<TimeInterval>> intervals = new HashMap<>();
    for (Config config : timeIntervalConfigs) {
      String name = config.getString(NAME);
      if (intervals.containsKey(name)) {
        throw new IllegalArgumentException(String.format("Duplicate time interval:%s", name));
      }
      intervals.put(
          name,
          config.getConfigList(INTERVALS).stream()
              .map(TimeIntervalReader::readInterval)
              .collect(Collectors.toList()));
    }
    return new TimeIntervals(intervals);
  }

  static TimeInterval readInterval(Config config) {
    TimeInterval.TimeIntervalBuilder builder = TimeInterval.builder();
    if (config.hasPath(TIMES)) {
      builder.times(
          config.getConfigList(TIMES).stream()
              .map(TimeIntervalReader::readTimeRange)
              .collect(Collectors.toList()));
    }
    if (config.hasPath(WEEKDAYS)) {
      builder.weekdays(
          readRanges(config.getStringList(WEEKDAYS), TimeIntervalReader::parseWeekday, 1, 7));
    }
    if (config.hasPath(DAYS_OF_MONTH)) {
      builder.daysOfMonth(readDaysOfMonth(config.getStringList(DAYS_OF_MONTH)));
    }
    if (config.hasPath(MONTHS)) {
      builder.months(
          readRanges(config.getStringList(MONTHS), TimeIntervalReader::parseMonth, 1, 12));
    }
    if (config.hasPath(YEARS)) {
      builder.years(
          readRanges(config.getStringList(YEARS), Integer::parseInt, 0, Integer.MAX_VALUE));
    }
    if (config.hasPath(LOCATION)) {
      try {
        builder.location(ZoneId.of(config.getString(LOCATION)));
      } catch (DateTimeException e) {
        throw new IllegalArgumentException(
            String.format("Invalid location:%s", config.getString(LOCATION)), e);
      }
    }
    return builder.build();
  }

  private static Range readTimeRange(Config config) {
    int start = parseMinuteOfDay(config.getString(TIME_START));
    int end = parseMinuteOfDay(config.getString(TIME_END));
    if (start >= end) {
      throw new IllegalArgumentException(
          String.format(
              "Invalid time range:%s-%s, start must be before end",
              config.getString(TIME_START), config.getString(TIME_END)));
    }
    return new Range(start, end);
  }

  static int parseMinuteOfDay(String value) {
    String[] parts = StringUtils.split(value, ':');
    if (parts.length != 2 || parts[1].length() != 2) {
      throw new IllegalArgumentException(String.format("Invalid time of day:%s", value));
    }
    int hour;
    int minute;
    try {
      hour = Integer.parseInt(parts[0]);
      minute = Integer.parseInt(parts[1]);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format("Invalid time of day:%s", value), e);
    }
    int minuteOfDay = hour * 60 + minute;
    if (hour < 0 || minute < 0 || minute > 59 || minuteOfDay > MINUTES_PER_DAY) {
      throw new IllegalArgumentException(String.format("Invalid time of day:%s", value));
    }
    return minuteOfDay;
  }

  private static List<Range> readDaysOfMonth(List<String> values) {
    List<Range> ranges = readRanges(values, Integer::parseInt, -31, 31);
    for (Range range : ranges) {
      if (range.getBegin() == 0 || range.getEnd() == 0) {
        throw new IllegalArgumentException("Day of month 0 is not valid");
      }
      // a negative begin with a positive end depends on the month length, accept it
      if (Integer.signum(range.getBegin()) == Integer.signum(range.getEnd())
          && range.getBegin() > range.getEnd()) {
        throw new IllegalArgumentException(
            String.format("Invalid day of month range:%s", range));
      }
    }
    return ranges;
  }

  private static List<Range> readRanges(
      List<String> values, ToIntFunction<String> parser, int min, int max) {
    List<Range> ranges = new ArrayList<>();
    for (String value : values) {
      String[] parts = StringUtils.split(value, ':');
      if (parts.length < 1 || parts.length > 2) {
        throw new IllegalArgumentException(String.format("Invalid range:%s", value));
      }
      int begin;
      int end;
      try {
        begin = parser.applyAsInt(parts[0].trim());
        end = parts.length == 2 ? parser.applyAsInt(parts[1].trim()) : begin;
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(String.format("Invalid range:%s", value), e);
      }
      if (begin < min || end > max || end < min || begin > max) {
        throw new IllegalArgumentException(String.format("Range out of bounds:%s", value));
      }
      if (min >= 0 && begin > end) {
        throw new IllegalArgumentException(
            String.format("Invalid range:%s, begin must not be after end", value));
      }
      ranges.add(new Range(begin, end));
    }
    return ranges;
  }

  private static int parseWeekday(String value) {
    return DayOfWeek.valueOf(value.toUpperCase(Locale.ROOT)).getValue();
  }

  private static int parseMonth(String value) {
    if (StringUtils.isNumeric(value)) {
      return Integer.parseInt(value);
    }
    return Month.valueOf(value.toUpperCase(Locale.ROOT)).getValue();
  }
}
