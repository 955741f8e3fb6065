package org.hypertrace.alert.router.state.gossip;

import java.util.function.Consumer;

/**
 * Carries gossip messages between peers. Delivery may be delayed, duplicated or reordered; peer
 * membership is the transport's concern.
 */
public interface GossipTransport extends AutoCloseable {
  /** Starts delivering messages from other peers to {@code receiver}. */
  void start(Consumer<byte[]> receiver);

  void publish(byte[] message);

  @Override
  void close();
}
