package com.github.adamzv.kafkadispatch.adapters.kafka;

import com.github.adamzv.kafkadispatch.domain.Problems;
import com.github.adamzv.kafkadispatch.domain.ReaderSettings;
import com.github.adamzv.kafkadispatch.ports.TopicReader;
import com.github.adamzv.kafkadispatch.ports.TopicReaderFactory;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;

public class KafkaTopicReaderFactory implements TopicReaderFactory {

  @Override
  public TopicReader open(String topic, ReaderSettings settings) {
    try {
      KafkaConsumer<byte[], byte[]> consumer = new KafkaConsumer<>(
          consumerProperties(topic, settings),
          new ByteArrayDeserializer(),
          new ByteArrayDeserializer()
      );
      return new KafkaTopicReader(topic, consumer, settings.bootstrapServers());
    } catch (KafkaException ex) {
      Map<String, Object> details = new HashMap<>();
      details.put("topic", topic);
      details.put("bootstrapServers", settings.bootstrapServers());
      details.put("error", ex.getClass().getSimpleName());
      if (ex.getMessage() != null) {
        details.put("message", ex.getMessage());
      }
      throw Problems.kafkaUnavailable("Kafka reader could not be created", Map.copyOf(details));
    }
  }

  static Properties consumerProperties(String topic, ReaderSettings settings) {
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, settings.bootstrapServers());
    props.put(ConsumerConfig.GROUP_ID_CONFIG, settings.groupId());
    // Client ids must be unique per consumer instance or the JMX registration clashes
    props.put(ConsumerConfig.CLIENT_ID_CONFIG, settings.clientId() + "-" + topic);
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
    props.put(ConsumerConfig.FETCH_MAX_BYTES_CONFIG, settings.batchBytes());
    props.put(ConsumerConfig.MAX_PARTITION_FETCH_BYTES_CONFIG, settings.batchBytes());
    props.put(ConsumerConfig.SOCKET_CONNECTION_SETUP_TIMEOUT_MS_CONFIG, settings.dialTimeout().toMillis());
    props.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, Math.toIntExact(settings.keepAlive().toMillis()));
    return props;
  }
}
