package org.hypertrace.alert.router.state.gossip;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import org.hypertrace.alert.router.datamodel.json.ObjectMapperProvider;
import org.hypertrace.alert.router.state.ReplicatedStore;
import org.hypertrace.alert.router.state.VersionedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects replicated stores to a gossip transport. Local mutations are broadcast as they happen,
 * {@link #fullSync()} sends the complete state of every store. Incoming records are merged one by
 * one; a record that cannot be decoded is dropped without affecting the rest of the message.
 *
 * <p>Received records are not forwarded again: every transport delivers a message to all peers.
 * The first full state received from a newly started peer is answered with a full sync, so a
 * joining peer catches up without waiting for the next periodic sync.
 */
public class GossipCoordinator implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(GossipCoordinator.class);
  private static final ConcurrentMap<String, Counter> receivedCounter = new ConcurrentHashMap<>();
  private static final String RECEIVED_COUNTER =
      "hypertrace.alert.router.gossip.messages.received";
  private static final ConcurrentMap<String, Counter> droppedCounter = new ConcurrentHashMap<>();
  private static final String DROPPED_COUNTER = "hypertrace.alert.router.gossip.records.dropped";
  private static final String STATE_TAG = "state";

  private final String peerName;
  private final String instance = UUID.randomUUID().toString();
  private final GossipTransport transport;
  private final Map<String, ReplicatedStore<?>> stores = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, String> peerInstances = new ConcurrentHashMap<>();

  public GossipCoordinator(String peerName, GossipTransport transport) {
    this.peerName = peerName;
    this.transport = transport;
  }

  public void register(ReplicatedStore<?> store) {
    stores.put(store.getName(), store);
    store.setBroadcaster(records -> publish(store.getName(), records, false));
  }

  /** Starts receiving and announces the local state to the peers. */
  public void start() {
    transport.start(this::receive);
    fullSync();
  }

  public void fullSync() {
    stores.values().forEach(store -> publish(store.getName(), store.fullState(), true));
  }

  private void publish(String state, List<VersionedRecord> records, boolean fullState) {
    if (records.isEmpty() && !fullState) {
      return;
    }
    ObjectMapper objectMapper = ObjectMapperProvider.get();
    GossipMessage message =
        GossipMessage.builder()
            .state(state)
            .origin(peerName)
            .instance(instance)
            .fullState(fullState)
            .records(
                records.stream()
                    .map(record -> (JsonNode) objectMapper.valueToTree(record))
                    .collect(Collectors.toList()))
            .build();
    try {
      transport.publish(objectMapper.writeValueAsBytes(message));
    } catch (JsonProcessingException e) {
      LOGGER.error("Failed to encode gossip message for state: {}", state, e);
    }
  }

  /** Handles one message from a peer and returns the number of records that changed state. */
  int receive(byte[] payload) {
    ObjectMapper objectMapper = ObjectMapperProvider.get();
    GossipMessage message;
    try {
      message = objectMapper.readValue(payload, GossipMessage.class);
    } catch (IOException e) {
      LOGGER.warn("Dropping undecodable gossip message", e);
      countDropped("unknown", 1);
      return 0;
    }
    if (peerName.equals(message.getOrigin())) {
      return 0;
    }
    if (message.isFullState() && isNewPeerInstance(message)) {
      LOGGER.info("Sending full state to joining peer: {}", message.getOrigin());
      fullSync();
    }
    ReplicatedStore<?> store = message.getState() == null ? null : stores.get(message.getState());
    if (store == null) {
      LOGGER.warn("Dropping gossip message for unknown state: {}", message.getState());
      countDropped(String.valueOf(message.getState()), message.getRecords().size());
      return 0;
    }
    receivedCounter
        .computeIfAbsent(store.getName(), k -> Metrics.counter(RECEIVED_COUNTER, STATE_TAG, k))
        .increment();

    int merged = 0;
    for (JsonNode node : message.getRecords()) {
      try {
        if (store.mergeRemote(objectMapper.treeToValue(node, VersionedRecord.class))) {
          merged++;
        }
      } catch (JsonProcessingException | RuntimeException e) {
        LOGGER.warn(
            "Dropping malformed {} record from peer: {}, record: {}",
            store.getName(),
            message.getOrigin(),
            node,
            e);
        countDropped(store.getName(), 1);
      }
    }
    LOGGER.debug(
        "Merged {} of {} {} records from peer: {}",
        merged,
        message.getRecords().size(),
        store.getName(),
        message.getOrigin());
    return merged;
  }

  private boolean isNewPeerInstance(GossipMessage message) {
    if (message.getOrigin() == null || message.getInstance() == null) {
      return false;
    }
    String previous = peerInstances.put(message.getOrigin(), message.getInstance());
    return !Objects.equals(previous, message.getInstance());
  }

  private static void countDropped(String state, int count) {
    droppedCounter
        .computeIfAbsent(state, k -> Metrics.counter(DROPPED_COUNTER, STATE_TAG, k))
        .increment(count);
  }

  @Override
  public void close() {
    transport.close();
  }
}
