package com.github.adamzv.kafkadispatch.adapters.kafka;

import com.github.adamzv.kafkadispatch.domain.ProblemException;
import com.github.adamzv.kafkadispatch.domain.Problems;
import com.github.adamzv.kafkadispatch.ports.KafkaAdminPort;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.CreateTopicsOptions;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.errors.TopicExistsException;

public class KafkaAdminAdapter implements KafkaAdminPort {

  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

  private final Admin adminClient;
  private final String bootstrapServers;

  public KafkaAdminAdapter(Admin adminClient, String bootstrapServers) {
    this.adminClient = adminClient;
    this.bootstrapServers = bootstrapServers;
  }

  @Override
  public boolean createTopic(String topic, int partitions) {
    NewTopic newTopic = new NewTopic(topic, Optional.of(partitions), Optional.empty());
    CreateTopicsOptions options = new CreateTopicsOptions()
        .timeoutMs(Math.toIntExact(DEFAULT_TIMEOUT.toMillis()));

    Map<String, Object> context = Map.of("topic", topic, "partitions", partitions);
    KafkaFuture<Void> future = adminClient.createTopics(List.of(newTopic), options).all();
    try {
      future.get(DEFAULT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw Problems.operationFailed("Interrupted while executing createTopic", context);
    } catch (TimeoutException ex) {
      throw Problems.kafkaUnavailable("Timed out contacting Kafka during createTopic", mergedContext(context, ex));
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof TopicExistsException) {
        return false;
      }
      throw translate("createTopic", ex.getCause(), context);
    }
  }

  private ProblemException translate(String operation, Throwable cause, Map<String, Object> context) {
    Map<String, Object> details = mergedContext(context, cause);
    if (cause instanceof KafkaException) {
      return Problems.kafkaUnavailable("Kafka operation failed: " + operation, details);
    }
    return Problems.operationFailed("Unexpected failure during " + operation, details);
  }

  private Map<String, Object> mergedContext(Map<String, Object> context, Throwable cause) {
    Map<String, Object> merged = new HashMap<>(context);
    merged.put("bootstrapServers", bootstrapServers);
    if (cause != null) {
      merged.put("error", cause.getClass().getSimpleName());
      if (cause.getMessage() != null) {
        merged.put("message", cause.getMessage());
      }
    }
    return Map.copyOf(merged);
  }
}
