package org.hypertrace.alert.router.notification.route;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Receiver and grouping settings of a route node, already merged with its ancestors. */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class RouteOptions {
  public static final Duration DEFAULT_GROUP_WAIT = Duration.ofSeconds(30);
  public static final Duration DEFAULT_GROUP_INTERVAL = Duration.ofMinutes(5);
  public static final Duration DEFAULT_REPEAT_INTERVAL = Duration.ofHours(4);

  private final String receiver;
  private final Set<String> groupBy;
  private final boolean groupByAll;
  private final Duration groupWait;
  private final Duration groupInterval;
  private final Duration repeatInterval;
  private final List<String> muteTimeIntervals;
  private final List<String> activeTimeIntervals;

  public static RouteOptions defaults(String receiver) {
    return RouteOptions.builder()
        .receiver(receiver)
        .groupBy(Set.of())
        .groupByAll(false)
        .groupWait(DEFAULT_GROUP_WAIT)
        .groupInterval(DEFAULT_GROUP_INTERVAL)
        .repeatInterval(DEFAULT_REPEAT_INTERVAL)
        .muteTimeIntervals(List.of())
        .activeTimeIntervals(List.of())
        .build();
  }
}
