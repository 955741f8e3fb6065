package org.hypertrace.alert.router.notification.timeinterval;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class TimeIntervalTest {

  @ParameterizedTest
  @MethodSource("intervalCases")
  void testContains(String intervalConfig, String instant, boolean expected) {
    TimeInterval interval =
        TimeIntervalReader.readInterval(ConfigFactory.parseString(intervalConfig));
    Assertions.assertEquals(expected, interval.contains(Instant.parse(instant)));
  }

  static Stream<Arguments> intervalCases() {
    String businessHours =
        "times = [{start = \"09:00\", end = \"17:00\"}], weekdays = [\"monday:friday\"]";
    String easter2020 = "daysOfMonth = [\"4:6\"], months = [april], years = [\"2020\"]";
    String lastThreeDays = "daysOfMonth = [\"-3:-1\"]";
    return Stream.of(
        Arguments.of("", "2006-01-02T15:04:00Z", true),
        Arguments.of(businessHours, "2020-05-04T15:04:00Z", true),
        Arguments.of(businessHours, "2020-06-09T09:04:00Z", true),
        Arguments.of(businessHours, "2020-05-03T15:04:00Z", false),
        Arguments.of(businessHours, "2020-05-04T08:59:00Z", false),
        Arguments.of(businessHours, "2020-05-04T17:00:00Z", false),
        Arguments.of(easter2020, "2020-04-04T15:04:00Z", true),
        Arguments.of(easter2020, "2020-04-06T23:05:00Z", true),
        Arguments.of(easter2020, "2020-04-03T23:59:00Z", false),
        Arguments.of(easter2020, "2020-04-07T00:00:00Z", false),
        Arguments.of(easter2020, "2019-04-06T12:00:00Z", false),
        Arguments.of(lastThreeDays, "2020-02-27T12:00:00Z", true),
        Arguments.of(lastThreeDays, "2020-02-29T12:00:00Z", true),
        Arguments.of(lastThreeDays, "2020-02-26T12:00:00Z", false),
        Arguments.of(lastThreeDays, "2021-01-29T12:00:00Z", true),
        Arguments.of(lastThreeDays, "2021-01-28T12:00:00Z", false),
        Arguments.of("daysOfMonth = [\"1:-1\"]", "2021-01-31T12:00:00Z", true),
        Arguments.of("months = [\"1:3\"]", "2021-03-31T12:00:00Z", true),
        Arguments.of("months = [\"1:3\"]", "2021-04-01T00:00:00Z", false),
        Arguments.of(
            "times = [{start = \"00:00\", end = \"24:00\"}]", "2021-04-01T23:59:00Z", true),
        Arguments.of(
            "times = [{start = \"09:00\", end = \"17:00\"}], location = \"Asia/Kolkata\"",
            "2021-04-01T04:00:00Z",
            true),
        Arguments.of(
            "times = [{start = \"09:00\", end = \"17:00\"}], location = \"Asia/Kolkata\"",
            "2021-04-01T12:00:00Z",
            false));
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "times = [{start = \"17:00\", end = \"09:00\"}]",
        "times = [{start = \"24:01\", end = \"24:30\"}]",
        "times = [{start = \"9\", end = \"10:00\"}]",
        "weekdays = [\"funday\"]",
        "weekdays = [\"friday:monday\"]",
        "daysOfMonth = [\"0\"]",
        "daysOfMonth = [\"32\"]",
        "daysOfMonth = [\"-1:-3\"]",
        "months = [\"13\"]",
        "location = \"Mars/Olympus\""
      })
  void testInvalidInterval(String intervalConfig) {
    Config config = ConfigFactory.parseString(intervalConfig);
    Assertions.assertThrows(
        IllegalArgumentException.class, () -> TimeIntervalReader.readInterval(config));
  }

  @Test
  void testNamedIntervals() {
    TimeIntervals timeIntervals =
        TimeIntervalReader.fromConfig(
            ConfigFactory.parseString(
                    "timeIntervals = [{name = weekends, intervals = ["
                        + "{weekdays = [saturday, sunday]}]}]")
                .getConfigList("timeIntervals"));

    Assertions.assertTrue(
        timeIntervals.isActive("weekends", Instant.parse("2024-03-02T10:00:00Z")));
    Assertions.assertFalse(
        timeIntervals.isActive("weekends", Instant.parse("2024-03-04T10:00:00Z")));
    Assertions.assertThrows(
        IllegalArgumentException.class,
        () -> timeIntervals.isActive("holidays", Instant.parse("2024-03-04T10:00:00Z")));
  }

  @Test
  void testDuplicateNamesAreRejected() {
    List<? extends Config> configs =
        ConfigFactory.parseString(
                "timeIntervals = [{name = a, intervals = []}, {name = a, intervals = []}]")
            .getConfigList("timeIntervals");
    Assertions.assertThrows(
        IllegalArgumentException.class, () -> TimeIntervalReader.fromConfig(configs));
  }
}
