package org.hypertrace.alert.router.state.gossip;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Envelope of a gossip message. Records stay undecoded JSON here so each one can be decoded and
 * rejected on its own. The instance changes every time the origin peer starts.
 */
@Getter
@ToString
public class GossipMessage {
  private final String state;
  private final String origin;
  private final String instance;
  private final boolean fullState;
  private final List<JsonNode> records;

  @Builder
  @JsonCreator
  public GossipMessage(
      @JsonProperty("state") String state,
      @JsonProperty("origin") String origin,
      @JsonProperty("instance") String instance,
      @JsonProperty("fullState") boolean fullState,
      @JsonProperty("records") List<JsonNode> records) {
    this.state = state;
    this.origin = origin;
    this.instance = instance;
    this.fullState = fullState;
    this.records = records == null ? ImmutableList.of() : ImmutableList.copyOf(records);
  }
}
