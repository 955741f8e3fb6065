package org.hypertrace.alert.router.datamodel;

import com.typesafe.config.Config;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.hypertrace.alert.router.datamodel.LabelMatcher.MatchType;

public class LabelMatchers {
  static final String MATCHER_NAME_CONFIG = "name";
  static final String MATCHER_VALUE_CONFIG = "value";
  static final String MATCHER_TYPE_CONFIG = "type";

  private LabelMatchers() {}

  /** True when every matcher matches. An empty collection matches everything. */
  public static boolean matchesAll(Collection<LabelMatcher> matchers, Map<String, String> labels) {
    for (LabelMatcher matcher : matchers) {
      if (!matcher.matches(labels)) {
        return false;
      }
    }
    return true;
  }

  public static List<LabelMatcher> fromConfig(List<? extends Config> matcherConfigs) {
    return matcherConfigs.stream().map(LabelMatchers::fromConfig).collect(Collectors.toList());
  }

  public static LabelMatcher fromConfig(Config matcherConfig) {
    String type =
        matcherConfig.hasPath(MATCHER_TYPE_CONFIG)
            ? matcherConfig.getString(MATCHER_TYPE_CONFIG)
            : MatchType.EQUAL.name();
    MatchType matchType;
    try {
      matchType = MatchType.valueOf(type);
    } catch (IllegalArgumentException e) {
      throw new RuntimeException(String.format("Invalid matcher type:%s", type), e);
    }
    return new LabelMatcher(
        matcherConfig.getString(MATCHER_NAME_CONFIG),
        matcherConfig.getString(MATCHER_VALUE_CONFIG),
        matchType);
  }

  public static String toString(Collection<LabelMatcher> matchers) {
    return matchers.stream()
        .map(LabelMatcher::toString)
        .collect(Collectors.joining(",", "{", "}"));
  }
}
