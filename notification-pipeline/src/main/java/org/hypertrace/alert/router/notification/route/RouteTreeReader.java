package org.hypertrace.alert.router.notification.route;

import com.typesafe.config.Config;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.hypertrace.alert.router.datamodel.LabelMatcher;
import org.hypertrace.alert.router.datamodel.LabelMatchers;

/** Builds the routing tree from the {@code route} section. */
public class RouteTreeReader {
  static final String RECEIVER = "receiver";
  static final String GROUP_BY = "groupBy";
  static final String GROUP_BY_ALL = "...";
  static final String GROUP_WAIT = "groupWait";
  static final String GROUP_INTERVAL = "groupInterval";
  static final String REPEAT_INTERVAL = "repeatInterval";
  static final String CONTINUE = "continue";
  static final String MATCHERS = "matchers";
  static final String MUTE_TIME_INTERVALS = "muteTimeIntervals";
  static final String ACTIVE_TIME_INTERVALS = "activeTimeIntervals";
  static final String ROUTES = "routes";
  static final String ROOT_ID = "{}";

  private RouteTreeReader() {}

  public static Route fromConfig(Config routeConfig) {
    if (!routeConfig.hasPath(RECEIVER)) {
      throw new IllegalArgumentException("The root route must define a receiver");
    }
    if (routeConfig.hasPath(MATCHERS) && !routeConfig.getConfigList(MATCHERS).isEmpty()) {
      throw new IllegalArgumentException("The root route must not have any matchers");
    }
    if (routeConfig.hasPath(CONTINUE) && routeConfig.getBoolean(CONTINUE)) {
      throw new IllegalArgumentException("The root route must not have continue set");
    }
    return readRoute(
        routeConfig, ROOT_ID, List.of(), RouteOptions.defaults(routeConfig.getString(RECEIVER)));
  }

  /** Fails when a route references a receiver that is not defined. */
  public static void validateReceivers(Route root, Set<String> receivers) {
    root.walk(
        route -> {
          if (!receivers.contains(route.getOptions().getReceiver())) {
            throw new IllegalArgumentException(
                String.format(
                    "Route %s references undefined receiver:%s",
                    route.getId(), route.getOptions().getReceiver()));
          }
        });
  }

  /** Fails when a route references a time interval that is not defined. */
  public static void validateTimeIntervals(Route root, Set<String> timeIntervals) {
    root.walk(
        route -> {
          List<String> referenced = new ArrayList<>(route.getOptions().getMuteTimeIntervals());
          referenced.addAll(route.getOptions().getActiveTimeIntervals());
          for (String name : referenced) {
            if (!timeIntervals.contains(name)) {
              throw new IllegalArgumentException(
                  String.format(
                      "Route %s references undefined time interval:%s", route.getId(), name));
            }
          }
        });
  }

  private static Route readRoute(
      Config config, String id, List<LabelMatcher> matchers, RouteOptions parentOptions) {
    RouteOptions options = readOptions(config, parentOptions);
    List<Route> children = new ArrayList<>();
    if (config.hasPath(ROUTES)) {
      List<? extends Config> childConfigs = config.getConfigList(ROUTES);
      for (int i = 0; i < childConfigs.size(); i++) {
        Config childConfig = childConfigs.get(i);
        List<LabelMatcher> childMatchers =
            childConfig.hasPath(MATCHERS)
                ? LabelMatchers.fromConfig(childConfig.getConfigList(MATCHERS))
                : List.of();
        String childId = id + "/" + LabelMatchers.toString(childMatchers) + "/" + i;
        children.add(readRoute(childConfig, childId, childMatchers, options));
      }
    }
    boolean continueMatching = config.hasPath(CONTINUE) && config.getBoolean(CONTINUE);
    return new Route(id, matchers, continueMatching, options, children);
  }

  private static RouteOptions readOptions(Config config, RouteOptions parent) {
    RouteOptions.RouteOptionsBuilder builder = parent.toBuilder();
    if (config.hasPath(RECEIVER)) {
      builder.receiver(config.getString(RECEIVER));
    }
    if (config.hasPath(GROUP_BY)) {
      List<String> groupBy = config.getStringList(GROUP_BY);
      boolean groupByAll = groupBy.contains(GROUP_BY_ALL);
      if (groupByAll && groupBy.size() > 1) {
        throw new IllegalArgumentException(
            String.format("Invalid groupBy:%s, '...' must be the only label", groupBy));
      }
      builder.groupByAll(groupByAll).groupBy(groupByAll ? Set.of() : new HashSet<>(groupBy));
    }
    if (config.hasPath(GROUP_WAIT)) {
      builder.groupWait(readDuration(config, GROUP_WAIT, false));
    }
    if (config.hasPath(GROUP_INTERVAL)) {
      builder.groupInterval(readDuration(config, GROUP_INTERVAL, true));
    }
    if (config.hasPath(REPEAT_INTERVAL)) {
      builder.repeatInterval(readDuration(config, REPEAT_INTERVAL, true));
    }
    if (config.hasPath(MUTE_TIME_INTERVALS)) {
      builder.muteTimeIntervals(List.copyOf(config.getStringList(MUTE_TIME_INTERVALS)));
    }
    if (config.hasPath(ACTIVE_TIME_INTERVALS)) {
      builder.activeTimeIntervals(List.copyOf(config.getStringList(ACTIVE_TIME_INTERVALS)));
    }
    return builder.build();
  }

  private static Duration readDuration(Config config, String path, boolean positive) {
    Duration duration = config.getDuration(path);
    if (duration.isNegative() || (positive && duration.isZero())) {
      throw new IllegalArgumentException(String.format("Invalid %s:%s", path, duration));
    }
    return duration;
  }
}
