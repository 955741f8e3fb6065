package org.hypertrace.alert.router.notification.route;

import com.google.common.collect.ImmutableList;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import lombok.Getter;
import org.hypertrace.alert.router.datamodel.LabelMatcher;
import org.hypertrace.alert.router.datamodel.LabelMatchers;

/**
 * Node of the routing tree. An alert descends into the first matching child; a child flagged with
 * {@code continue} lets the following siblings be evaluated as well. A node whose children all
 * fail to match is itself a target.
 */
@Getter
public class Route {
  private static final Escaper LABEL_VALUE_ESCAPER =
      Escapers.builder().addEscape('\\', "\\\\").addEscape('"', "\\\"").build();

  private final String id;
  private final List<LabelMatcher> matchers;
  private final boolean continueMatching;
  private final RouteOptions options;
  private final List<Route> routes;

  Route(
      String id,
      List<LabelMatcher> matchers,
      boolean continueMatching,
      RouteOptions options,
      List<Route> routes) {
    this.id = id;
    this.matchers = ImmutableList.copyOf(matchers);
    this.continueMatching = continueMatching;
    this.options = options;
    this.routes = ImmutableList.copyOf(routes);
  }

  /** The routes whose receivers get the alert, in tree order. Empty when this node misses. */
  public List<Route> match(Map<String, String> labels) {
    if (!LabelMatchers.matchesAll(matchers, labels)) {
      return List.of();
    }
    List<Route> matching = new ArrayList<>();
    for (Route child : routes) {
      List<Route> childMatches = child.match(labels);
      matching.addAll(childMatches);
      if (!childMatches.isEmpty() && !child.isContinueMatching()) {
        break;
      }
    }
    if (matching.isEmpty()) {
      matching.add(this);
    }
    return matching;
  }

  /** Values of the labels this route groups by. Labels the alert does not carry are left out. */
  public SortedMap<String, String> groupLabels(Map<String, String> labels) {
    SortedMap<String, String> groupLabels = new TreeMap<>();
    labels.forEach(
        (name, value) -> {
          if (options.isGroupByAll() || options.getGroupBy().contains(name)) {
            groupLabels.put(name, value);
          }
        });
    return groupLabels;
  }

  /** Identifies the aggregation group of an alert on this route. */
  public String groupKey(Map<String, String> groupLabels) {
    String labels =
        new TreeMap<>(groupLabels)
            .entrySet().stream()
                .map(entry -> entry.getKey() + "=\"" + escape(entry.getValue()) + "\"")
                .collect(Collectors.joining(",", "{", "}"));
    return id + ":" + labels;
  }

  private static String escape(String value) {
    return LABEL_VALUE_ESCAPER.escape(value);
  }

  /** Visits this node and all descendants depth first. */
  public void walk(Consumer<Route> visitor) {
    visitor.accept(this);
    routes.forEach(child -> child.walk(visitor));
  }

  @Override
  public String toString() {
    return "Route{id=" + id + ", receiver=" + options.getReceiver() + "}";
  }
}
