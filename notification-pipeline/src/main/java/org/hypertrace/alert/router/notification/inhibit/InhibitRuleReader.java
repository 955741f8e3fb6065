package org.hypertrace.alert.router.notification.inhibit;

import com.typesafe.config.Config;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.hypertrace.alert.router.datamodel.LabelMatcher;
import org.hypertrace.alert.router.datamodel.LabelMatchers;

public class InhibitRuleReader {
  static final String SOURCE_MATCHERS = "sourceMatchers";
  static final String TARGET_MATCHERS = "targetMatchers";
  static final String EQUAL = "equal";

  private InhibitRuleReader() {}

  public static List<InhibitRule> fromConfig(List<? extends Config> ruleConfigs) {
    return ruleConfigs.stream().map(InhibitRuleReader::fromConfig).collect(Collectors.toList());
  }

  static InhibitRule fromConfig(Config ruleConfig) {
    List<LabelMatcher> sourceMatchers = readMatchers(ruleConfig, SOURCE_MATCHERS);
    List<LabelMatcher> targetMatchers = readMatchers(ruleConfig, TARGET_MATCHERS);
    if (sourceMatchers.isEmpty() || targetMatchers.isEmpty()) {
      throw new IllegalArgumentException(
          "Inhibit rules need at least one source and one target matcher");
    }
    Set<String> equal =
        ruleConfig.hasPath(EQUAL) ? new HashSet<>(ruleConfig.getStringList(EQUAL)) : Set.of();
    return new InhibitRule(sourceMatchers, targetMatchers, equal);
  }

  private static List<LabelMatcher> readMatchers(Config ruleConfig, String path) {
    return ruleConfig.hasPath(path)
        ? LabelMatchers.fromConfig(ruleConfig.getConfigList(path))
        : List.of();
  }
}
