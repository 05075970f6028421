package com.github.adamzv.kafkadispatch.adapters.kafka;

import com.github.adamzv.kafkadispatch.domain.ProblemException;
import com.github.adamzv.kafkadispatch.domain.Problems;
import com.github.adamzv.kafkadispatch.domain.ProduceRequest;
import com.github.adamzv.kafkadispatch.domain.ProduceResult;
import com.github.adamzv.kafkadispatch.ports.KafkaProducerPort;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.header.internals.RecordHeader;

public class KafkaProducerAdapter implements KafkaProducerPort {

  private static final Duration SEND_TIMEOUT = Duration.ofSeconds(10);

  private final Producer<byte[], byte[]> producer;
  private final String bootstrapServers;

  public KafkaProducerAdapter(Producer<byte[], byte[]> producer, String bootstrapServers) {
    this.producer = producer;
    this.bootstrapServers = bootstrapServers;
  }

  @Override
  public ProduceResult produce(ProduceRequest request) {
    byte[] key = request.key() == null || request.key().length == 0 ? null : request.key();
    ProducerRecord<byte[], byte[]> record = new ProducerRecord<>(request.topic(), key, request.value());
    request.headers().forEach((name, value) -> {
      byte[] headerValue = value == null ? null : value.getBytes(StandardCharsets.UTF_8);
      record.headers().add(new RecordHeader(name, headerValue));
    });

    try {
      RecordMetadata metadata = producer.send(record).get(SEND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      return new ProduceResult(
          metadata.topic(),
          metadata.partition(),
          metadata.offset(),
          metadata.timestamp()
      );
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw Problems.operationFailed("Interrupted while producing", Map.of("topic", request.topic()));
    } catch (TimeoutException ex) {
      throw Problems.kafkaUnavailable(
          "Timed out waiting for Kafka produce acknowledgement",
          Map.of("topic", request.topic(), "bootstrapServers", bootstrapServers)
      );
    } catch (ExecutionException ex) {
      throw translateSendFailure(request, ex.getCause());
    } catch (KafkaException ex) {
      // send() itself throws for serialization, metadata timeouts and a closed producer
      throw translateSendFailure(request, ex);
    }
  }

  private ProblemException translateSendFailure(ProduceRequest request, Throwable cause) {
    if (cause instanceof RecordTooLargeException) {
      return Problems.payloadTooLarge(
          "Kafka rejected message because it exceeds broker limits",
          Map.of("topic", request.topic())
      );
    }
    if (cause instanceof KafkaException) {
      return Problems.kafkaUnavailable("Kafka produce failed", errorDetails(request.topic(), cause, true));
    }
    return Problems.operationFailed("Unexpected error during produce", errorDetails(request.topic(), cause, false));
  }

  private Map<String, Object> errorDetails(String topic, Throwable cause, boolean includeBootstrap) {
    Map<String, Object> details = new HashMap<>();
    details.put("topic", topic);
    if (includeBootstrap) {
      details.put("bootstrapServers", bootstrapServers);
    }
    if (cause != null) {
      details.put("error", cause.getClass().getSimpleName());
      if (cause.getMessage() != null) {
        details.put("message", cause.getMessage());
      }
    }
    return Collections.unmodifiableMap(details);
  }
}
