package org.hypertrace.alert.router.state.gossip;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Transport for peers living in the same process, e.g. a single node deployment or tests.
 * Messages are delivered synchronously to every other joined transport.
 */
public class InMemoryGossipTransport implements GossipTransport {
  private final Network network;
  private volatile Consumer<byte[]> receiver;

  private InMemoryGossipTransport(Network network) {
    this.network = network;
  }

  @Override
  public void start(Consumer<byte[]> receiver) {
    this.receiver = receiver;
    network.members.add(this);
  }

  @Override
  public void publish(byte[] message) {
    for (InMemoryGossipTransport member : network.members) {
      if (member != this && member.receiver != null) {
        member.receiver.accept(message);
      }
    }
  }

  @Override
  public void close() {
    network.members.remove(this);
  }

  public static class Network {
    private final List<InMemoryGossipTransport> members = new CopyOnWriteArrayList<>();

    public InMemoryGossipTransport join() {
      return new InMemoryGossipTransport(this);
    }
  }
}
