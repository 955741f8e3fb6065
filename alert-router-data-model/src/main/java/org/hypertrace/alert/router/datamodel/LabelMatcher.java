package org.hypertrace.alert.router.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Predicate on a single label of an alert's label set. A missing label matches as "". */
@Getter
@EqualsAndHashCode
public class LabelMatcher {

  public enum MatchType {
    EQUAL("="),
    NOT_EQUAL("!="),
    REGEX("=~"),
    NOT_REGEX("!~");

    private final String operator;

    MatchType(String operator) {
      this.operator = operator;
    }

    public String getOperator() {
      return operator;
    }
  }

  private final String name;
  private final String value;
  private final MatchType type;

  @JsonIgnore @EqualsAndHashCode.Exclude private final Pattern pattern;

  @JsonCreator
  public LabelMatcher(
      @JsonProperty("name") String name,
      @JsonProperty("value") String value,
      @JsonProperty("type") MatchType type) {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "matcher name must be set");
    Preconditions.checkArgument(value != null, "matcher value must be set for %s", name);
    Preconditions.checkArgument(type != null, "matcher type must be set for %s", name);
    this.name = name;
    this.value = value;
    this.type = type;
    if (type == MatchType.REGEX || type == MatchType.NOT_REGEX) {
      try {
        this.pattern = Pattern.compile("^(?:" + value + ")$");
      } catch (PatternSyntaxException e) {
        throw new IllegalArgumentException(
            String.format("Invalid regex in matcher %s: %s", name, value), e);
      }
    } else {
      this.pattern = null;
    }
  }

  public static LabelMatcher equal(String name, String value) {
    return new LabelMatcher(name, value, MatchType.EQUAL);
  }

  public static LabelMatcher regex(String name, String value) {
    return new LabelMatcher(name, value, MatchType.REGEX);
  }

  public boolean matches(Map<String, String> labels) {
    return matchesValue(labels.getOrDefault(name, ""));
  }

  /** Whether the matcher also selects alerts that do not carry the label at all. */
  public boolean matchesEmpty() {
    return matchesValue("");
  }

  private boolean matchesValue(String labelValue) {
    switch (type) {
      case EQUAL:
        return value.equals(labelValue);
      case NOT_EQUAL:
        return !value.equals(labelValue);
      case REGEX:
        return pattern.matcher(labelValue).matches();
      case NOT_REGEX:
        return !pattern.matcher(labelValue).matches();
      default:
        throw new IllegalStateException("Unknown match type: " + type);
    }
  }

  @Override
  public String toString() {
    return name + type.getOperator() + "\"" + value + "\"";
  }
}
