package org.hypertrace.alert.router.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.hypertrace.alert.router.datamodel.json.ObjectMapperProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last-writer-wins map replicated between peers. Local writes, gossip and snapshot restore all go
 * through {@link #merge(Versioned)}: a version replaces the held one only when its update
 * timestamp is strictly later, on a tie the held version stays. Versions whose expiry has passed
 * are rejected, so a pruned key is not brought back by a stale peer.
 */
public abstract class ReplicatedStore<V extends Versioned> {
  private static final Logger LOGGER = LoggerFactory.getLogger(ReplicatedStore.class);
  private static final ConcurrentMap<String, Counter> gcCounter = new ConcurrentHashMap<>();
  private static final String GC_COUNTER = "hypertrace.alert.router.%s.gc.count";

  protected final ConcurrentMap<String, V> entries = new ConcurrentHashMap<>();
  protected final Clock clock;
  private final String name;
  private final String peerName;
  private volatile Consumer<List<VersionedRecord>> broadcaster = records -> {};

  protected ReplicatedStore(String name, String peerName, Clock clock) {
    this.name = name;
    this.peerName = peerName;
    this.clock = clock;
  }

  /** Identifies this store's messages on the gossip channel. */
  public String getName() {
    return name;
  }

  public String getPeerName() {
    return peerName;
  }

  public void setBroadcaster(Consumer<List<VersionedRecord>> broadcaster) {
    this.broadcaster = broadcaster;
  }

  public int size() {
    return entries.size();
  }

  protected abstract VersionedRecord encode(V value);

  protected abstract V decode(VersionedRecord record) throws JsonProcessingException;

  /** Called after {@code current} replaced {@code previous} (null for a new key). */
  protected void onMerged(V previous, V current) {}

  protected void onRemoved(V removed) {}

  protected boolean merge(V incoming) {
    Instant now = clock.instant();
    if (!incoming.getExpiresAt().isAfter(now)) {
      LOGGER.debug("Rejecting expired {} entry: {}", name, incoming.getKey());
      return false;
    }
    AtomicBoolean accepted = new AtomicBoolean();
    AtomicReference<V> previous = new AtomicReference<>();
    entries.compute(
        incoming.getKey(),
        (key, existing) -> {
          if (existing == null || incoming.getUpdatedAt().isAfter(existing.getUpdatedAt())) {
            accepted.set(true);
            previous.set(existing);
            return incoming;
          }
          return existing;
        });
    if (accepted.get()) {
      onMerged(previous.get(), incoming);
    }
    return accepted.get();
  }

  /** Merges a locally produced version and broadcasts it to peers when it was accepted. */
  protected boolean applyLocal(V value) {
    boolean accepted = merge(value);
    if (accepted) {
      broadcaster.accept(List.of(encode(value)));
    }
    return accepted;
  }

  /**
   * The timestamp for a local write of {@code key}: now, or just past the held version when the
   * clock has not moved beyond it.
   */
  protected Instant nextUpdateTimestamp(String key, Instant now) {
    V existing = entries.get(key);
    if (existing != null && !now.isAfter(existing.getUpdatedAt())) {
      return existing.getUpdatedAt().plusNanos(1);
    }
    return now;
  }

  /** Merges a record received from a peer. Throws when the record cannot be decoded. */
  public boolean mergeRemote(VersionedRecord record) throws JsonProcessingException {
    return merge(decode(record));
  }

  public List<VersionedRecord> fullState() {
    Instant now = clock.instant();
    List<VersionedRecord> records = new ArrayList<>();
    for (V value : entries.values()) {
      if (value.getExpiresAt().isAfter(now)) {
        records.add(encode(value));
      }
    }
    return records;
  }

  /** Removes every entry whose expiry has passed and returns how many were removed. */
  public int gc() {
    Instant now = clock.instant();
    int removed = 0;
    for (Map.Entry<String, V> entry : entries.entrySet()) {
      V value = entry.getValue();
      if (!value.getExpiresAt().isAfter(now) && entries.remove(entry.getKey(), value)) {
        onRemoved(value);
        removed++;
      }
    }
    if (removed > 0) {
      gcCounter
          .computeIfAbsent(name, k -> Metrics.counter(String.format(GC_COUNTER, k)))
          .increment(removed);
      LOGGER.debug("Garbage collected {} {} entries", removed, name);
    }
    return removed;
  }

  /**
   * Writes all live entries as JSON lines to a temporary file next to {@code path} and moves it
   * into place, so a crash never leaves a partial snapshot behind.
   */
  public int snapshot(Path path) throws IOException {
    ObjectMapper objectMapper = ObjectMapperProvider.get();
    Path directory = path.toAbsolutePath().getParent();
    Files.createDirectories(directory);
    Path tempFile = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
    List<VersionedRecord> records = fullState();
    try {
      try (BufferedWriter writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
        for (VersionedRecord record : records) {
          writer.write(objectMapper.writeValueAsString(record));
          writer.newLine();
        }
      }
      try {
        Files.move(
            tempFile, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tempFile, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tempFile);
    }
    LOGGER.debug("Wrote {} {} entries to {}", records.size(), name, path);
    return records.size();
  }

  /** Loads a snapshot written by {@link #snapshot(Path)}. Lines that fail to decode are skipped. */
  public int restore(Path path) throws IOException {
    if (!Files.exists(path)) {
      LOGGER.info("No {} snapshot found at {}", name, path);
      return 0;
    }
    ObjectMapper objectMapper = ObjectMapperProvider.get();
    int restored = 0;
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        try {
          if (mergeRemote(objectMapper.readValue(line, VersionedRecord.class))) {
            restored++;
          }
        } catch (JsonProcessingException | RuntimeException e) {
          LOGGER.warn("Skipping malformed {} snapshot line: {}", name, line, e);
        }
      }
    }
    LOGGER.info("Restored {} {} entries from {}", restored, name, path);
    return restored;
  }

  /** GC followed by a snapshot when a file is configured. Storage failures are only logged. */
  public void maintenance(Optional<Path> snapshotFile) {
    gc();
    snapshotFile.ifPresent(
        path -> {
          try {
            snapshot(path);
          } catch (IOException e) {
            LOGGER.warn(
                "Failed to write {} snapshot to {}, keeping state in memory", name, path, e);
          }
        });
  }

  protected boolean isRemote(String origin) {
    return origin != null && !origin.equals(peerName);
  }
}
