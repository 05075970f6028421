package com.github.adamzv.kafkadispatch.adapters.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import com.github.adamzv.kafkadispatch.domain.ReaderSettings;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.junit.jupiter.api.Test;

class KafkaTopicReaderFactoryTest {

  private static final ReaderSettings SETTINGS = new ReaderSettings(
      List.of("broker-1:9092", "broker-2:9092"),
      "billing",
      "kafka-dispatch-1a2b3c4d",
      Duration.ofSeconds(3),
      Duration.ofSeconds(5),
      10_000_000
  );

  @Test
  void consumerUsesManualCommitsAndReaderSettings() {
    Properties props = KafkaTopicReaderFactory.consumerProperties("orders", SETTINGS);

    assertEquals("broker-1:9092,broker-2:9092", props.get(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG));
    assertEquals("billing", props.get(ConsumerConfig.GROUP_ID_CONFIG));
    assertEquals("kafka-dispatch-1a2b3c4d-orders", props.get(ConsumerConfig.CLIENT_ID_CONFIG));
    assertEquals(false, props.get(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG));
    assertEquals("earliest", props.get(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG));
    assertEquals(10_000_000, props.get(ConsumerConfig.FETCH_MAX_BYTES_CONFIG));
    assertEquals(10_000_000, props.get(ConsumerConfig.MAX_PARTITION_FETCH_BYTES_CONFIG));
    assertEquals(3_000L, props.get(ConsumerConfig.SOCKET_CONNECTION_SETUP_TIMEOUT_MS_CONFIG));
    assertEquals(5_000, props.get(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG));
  }

  @Test
  void pollIntervalIsLeftToTheClientDefault() {
    // saturated fetch loops keep polling through TopicReader.keepAlive()
    Properties props = KafkaTopicReaderFactory.consumerProperties("orders", SETTINGS);

    assertFalse(props.containsKey(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG));
  }
}
