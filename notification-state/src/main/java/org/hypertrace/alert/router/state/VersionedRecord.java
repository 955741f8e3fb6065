package org.hypertrace.alert.router.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import java.time.Instant;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Self contained unit of replication and persistence. The same shape is gossiped between peers
 * and written to snapshot files.
 */
@Getter
@ToString
@EqualsAndHashCode
public class VersionedRecord {
  private final String key;
  private final JsonNode payload;
  private final Instant updatedAt;
  private final Instant expiresAt;
  private final String origin;

  @Builder
  @JsonCreator
  public VersionedRecord(
      @JsonProperty("key") String key,
      @JsonProperty("payload") JsonNode payload,
      @JsonProperty("updatedAt") Instant updatedAt,
      @JsonProperty("expiresAt") Instant expiresAt,
      @JsonProperty("origin") String origin) {
    Preconditions.checkArgument(key != null && !key.isEmpty(), "record key must be set");
    Preconditions.checkArgument(payload != null, "record %s has no payload", key);
    Preconditions.checkArgument(updatedAt != null, "record %s has no update timestamp", key);
    Preconditions.checkArgument(expiresAt != null, "record %s has no expiry", key);
    this.key = key;
    this.payload = payload;
    this.updatedAt = updatedAt;
    this.expiresAt = expiresAt;
    this.origin = origin;
  }
}
