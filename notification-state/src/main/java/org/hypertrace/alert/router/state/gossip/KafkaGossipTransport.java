package org.hypertrace.alert.router.state.gossip;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.typesafe.config.Config;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.WakeupException;
import org.hypertrace.alert.router.datamodel.queue.KafkaConfigReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gossip over a shared kafka topic. Every peer consumes the topic with its own consumer group so
 * each message reaches all peers, including the sender which drops its own messages.
 */
public class KafkaGossipTransport implements GossipTransport {
  private static final Logger LOGGER = LoggerFactory.getLogger(KafkaGossipTransport.class);
  private static final int CONSUMER_POLL_TIMEOUT_MS = 100;
  private static final String GROUP_ID_PREFIX = "alert-router-gossip-";

  private final Producer<String, String> producer;
  private final org.apache.kafka.clients.consumer.Consumer<String, String> consumer;
  private final String topic;
  private final String peerName;
  private final ExecutorService pollExecutor;
  private volatile boolean running;
  private volatile Consumer<byte[]> receiver;

  public KafkaGossipTransport(Config kafkaQueueConfig, String peerName) {
    KafkaConfigReader kafkaConfigReader = new KafkaConfigReader(kafkaQueueConfig);
    Properties producerProps = new Properties();
    producerProps.putAll(kafkaConfigReader.getProducerConfig());
    Properties consumerProps = new Properties();
    consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    consumerProps.putAll(kafkaConfigReader.getConsumerConfig());
    // every peer needs to see every message
    consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, GROUP_ID_PREFIX + peerName);
    this.producer = new KafkaProducer<>(producerProps);
    this.consumer = new KafkaConsumer<>(consumerProps);
    this.topic = kafkaConfigReader.getProducerTopicName();
    this.peerName = peerName;
    this.pollExecutor =
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setNameFormat("gossip-poll-%d").setDaemon(true).build());
  }

  @VisibleForTesting
  KafkaGossipTransport(
      Producer<String, String> producer,
      org.apache.kafka.clients.consumer.Consumer<String, String> consumer,
      String topic,
      String peerName) {
    this.producer = producer;
    this.consumer = consumer;
    this.topic = topic;
    this.peerName = peerName;
    this.pollExecutor = null;
  }

  @Override
  public void start(Consumer<byte[]> receiver) {
    this.receiver = receiver;
    consumer.subscribe(Collections.singletonList(topic));
    running = true;
    if (pollExecutor != null) {
      pollExecutor.submit(this::pollLoop);
    }
  }

  @Override
  public void publish(byte[] message) {
    producer.send(
        new ProducerRecord<>(topic, peerName, new String(message, StandardCharsets.UTF_8)),
        (metadata, exception) -> {
          if (exception != null) {
            LOGGER.warn("Failed to publish gossip message to topic: {}", topic, exception);
          }
        });
  }

  private void pollLoop() {
    try {
      while (running) {
        pollOnce();
      }
    } catch (WakeupException e) {
      if (running) {
        throw e;
      }
    } finally {
      consumer.close();
    }
  }

  @VisibleForTesting
  int pollOnce() {
    ConsumerRecords<String, String> records =
        consumer.poll(Duration.ofMillis(CONSUMER_POLL_TIMEOUT_MS));
    int delivered = 0;
    for (ConsumerRecord<String, String> record : records) {
      if (peerName.equals(record.key()) || record.value() == null) {
        continue;
      }
      try {
        receiver.accept(record.value().getBytes(StandardCharsets.UTF_8));
        delivered++;
      } catch (RuntimeException e) {
        LOGGER.error("Failed to process gossip message at offset: {}", record.offset(), e);
      }
    }
    return delivered;
  }

  @Override
  public void close() {
    running = false;
    if (pollExecutor != null) {
      consumer.wakeup();
      pollExecutor.shutdown();
      try {
        if (!pollExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
          LOGGER.warn("Gossip poll loop did not stop in time");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    } else {
      consumer.close();
    }
    producer.close();
  }
}
