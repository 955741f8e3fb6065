package org.hypertrace.alert.router.state.nflog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import org.hypertrace.alert.router.datamodel.json.ObjectMapperProvider;
import org.hypertrace.alert.router.state.ReplicatedStore;
import org.hypertrace.alert.router.state.VersionedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replicated record of what was last notified per receiver and aggregation group. Entries live
 * for the retention window, independent of any repeat interval.
 */
public class NotificationLog extends ReplicatedStore<NotificationLogEntry> {
  private static final Logger LOGGER = LoggerFactory.getLogger(NotificationLog.class);
  public static final String STATE_NAME = "nflog";

  private final Duration retention;

  public NotificationLog(String peerName, Clock clock, Duration retention) {
    super(STATE_NAME, peerName, clock);
    Preconditions.checkArgument(
        !retention.isNegative() && !retention.isZero(), "retention must be positive");
    this.retention = retention;
  }

  static String stateKey(String receiver, String groupKey) {
    return receiver
        + ":"
        + Hashing.sha256().hashString(groupKey, StandardCharsets.UTF_8).toString();
  }

  public Optional<NotificationLogEntry> query(String receiver, String groupKey) {
    return Optional.ofNullable(entries.get(stateKey(receiver, groupKey)));
  }

  /** Records a notification outcome for the receiver and group and gossips it. */
  public NotificationLogEntry log(
      String receiver, String groupKey, Set<Long> firingAlerts, Set<Long> resolvedAlerts) {
    String key = stateKey(receiver, groupKey);
    Instant timestamp = nextUpdateTimestamp(key, clock.instant());
    NotificationLogEntry entry =
        NotificationLogEntry.builder()
            .receiver(receiver)
            .groupKey(groupKey)
            .timestamp(timestamp)
            .firingAlerts(firingAlerts)
            .resolvedAlerts(resolvedAlerts)
            .expiresAt(timestamp.plus(retention))
            .origin(getPeerName())
            .remote(false)
            .build();
    applyLocal(entry);
    LOGGER.debug(
        "Logged notification for receiver: {}, group: {}, firing: {}, resolved: {}",
        receiver,
        groupKey,
        firingAlerts.size(),
        resolvedAlerts.size());
    return entry;
  }

  @Override
  protected VersionedRecord encode(NotificationLogEntry entry) {
    return VersionedRecord.builder()
        .key(entry.getKey())
        .payload(ObjectMapperProvider.get().valueToTree(entry))
        .updatedAt(entry.getTimestamp())
        .expiresAt(entry.getExpiresAt())
        .origin(entry.getOrigin())
        .build();
  }

  @Override
  protected NotificationLogEntry decode(VersionedRecord record) throws JsonProcessingException {
    ObjectMapper objectMapper = ObjectMapperProvider.get();
    NotificationLogEntry entry =
        objectMapper
            .treeToValue(record.getPayload(), NotificationLogEntry.class)
            .toBuilder()
            .timestamp(record.getUpdatedAt())
            .expiresAt(record.getExpiresAt())
            .origin(record.getOrigin())
            .remote(isRemote(record.getOrigin()))
            .build();
    Preconditions.checkArgument(
        entry.getKey().equals(record.getKey()),
        "record key %s does not match its payload",
        record.getKey());
    return entry;
  }
}
