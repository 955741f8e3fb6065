package org.hypertrace.alert.router.datamodel.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.annotations.VisibleForTesting;
import com.typesafe.config.Config;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedList;
import java.util.Optional;
import java.util.Properties;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.hypertrace.alert.router.datamodel.Alert;
import org.hypertrace.alert.router.datamodel.json.ObjectMapperProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads JSON encoded alerts from a kafka topic. Undecodable records are logged and skipped. */
public class KafkaAlertConsumer implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(KafkaAlertConsumer.class);
  private static final int CONSUMER_POLL_TIMEOUT_MS = 100;

  private final Consumer<String, String> consumer;
  private final LinkedList<ConsumerRecord<String, String>> linkedList = new LinkedList<>();

  public KafkaAlertConsumer(Config kafkaQueueConfig) {
    KafkaConfigReader kafkaConfigReader = new KafkaConfigReader(kafkaQueueConfig);
    Properties props = new Properties();
    props.putAll(kafkaConfigReader.getConsumerConfig());
    consumer = new KafkaConsumer<>(props);
    consumer.subscribe(Collections.singletonList(kafkaConfigReader.getConsumerTopicName()));
  }

  @VisibleForTesting
  KafkaAlertConsumer(Consumer<String, String> consumer) {
    this.consumer = consumer;
  }

  /** Returns the next decodable alert, or empty when nothing arrived within the poll timeout. */
  public Optional<Alert> dequeue() {
    if (linkedList.isEmpty()) {
      ConsumerRecords<String, String> records =
          consumer.poll(Duration.ofMillis(CONSUMER_POLL_TIMEOUT_MS));
      records.forEach(linkedList::addLast);
    }

    while (!linkedList.isEmpty()) {
      ConsumerRecord<String, String> record = linkedList.remove();
      LOGGER.debug("offset = {}, key = {}", record.offset(), record.key());
      try {
        return Optional.of(ObjectMapperProvider.get().readValue(record.value(), Alert.class));
      } catch (JsonProcessingException | IllegalArgumentException e) {
        LOGGER.warn(
            "Dropping undecodable alert at offset: {}, value: {}",
            record.offset(),
            record.value(),
            e);
      }
    }
    return Optional.empty();
  }

  @Override
  public void close() {
    consumer.close();
  }
}
