package com.github.adamzv.kafkadispatch.application;

import com.github.adamzv.kafkadispatch.domain.Message;
import com.github.adamzv.kafkadispatch.domain.ProblemException;
import com.github.adamzv.kafkadispatch.domain.Problems;
import com.github.adamzv.kafkadispatch.domain.ProduceRequest;
import com.github.adamzv.kafkadispatch.domain.ProduceResult;
import com.github.adamzv.kafkadispatch.ports.DispatchMetrics;
import com.github.adamzv.kafkadispatch.ports.TraceSpan;
import com.github.adamzv.kafkadispatch.ports.TracingPort;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves messages whose retries are exhausted to the dead-letter topic of their source topic.
 *
 * <p>{@link #route(Message)} publishes first and then commits the original offset whatever the
 * publish outcome was. Both failures are logged and dropped, so a crash between a failed publish
 * and the commit loses the message.
 */
public class DeadLetterRouter {

  private static final Logger log = LoggerFactory.getLogger(DeadLetterRouter.class);

  public static final String ERROR_HEADER = "error";
  static final String DLQ_SPAN = "kafka.dlq.publish";

  private final MessagePublisher publisher;
  private final DeadLetterTopics topics;
  private final TracingPort tracing;
  private final DispatchMetrics metrics;

  public DeadLetterRouter(MessagePublisher publisher,
                          DeadLetterTopics topics,
                          TracingPort tracing,
                          DispatchMetrics metrics) {
    this.publisher = publisher;
    this.topics = topics;
    this.tracing = tracing == null ? TracingPort.NOOP : tracing;
    this.metrics = metrics == null ? DispatchMetrics.NOOP : metrics;
  }

  /**
   * Annotates the message with its last handler error, republishes it and commits the original
   * offset. Never throws.
   */
  public void route(Message message) {
    String deadLetterTopic = topics.deadLetterTopic(message.topic());
    Map<String, String> headers = new LinkedHashMap<>(message.headers());
    headers.put(ERROR_HEADER, message.lastError());

    try (TraceSpan span = tracing.startConsumer(DLQ_SPAN, message.headers())) {
      span.tag("messaging.destination", message.topic())
          .tag("messaging.kafka.partition", message.partition())
          .tag("messaging.kafka.offset", message.offset())
          .tag("messaging.kafka.message_key", message.keyAsString())
          .tag("messaging.retry_count", message.retryCount())
          .tag("messaging.dlq.destination", deadLetterTopic);
      span.error(Problems.handlerFailed(message.lastError(), details(message)));

      boolean published = publish(message, deadLetterTopic, headers);
      metrics.recordDeadLetter(message.topic(), published);
      commit(message, deadLetterTopic);
    }
  }

  /**
   * Republishes key, body and headers unchanged. Failures propagate to the caller.
   */
  public ProduceResult publish(Message message) {
    String deadLetterTopic = topics.deadLetterTopic(message.topic());
    return publisher.publishRaw(new ProduceRequest(
        deadLetterTopic,
        message.key(),
        message.headers(),
        message.body()
    ));
  }

  private boolean publish(Message message, String deadLetterTopic, Map<String, String> headers) {
    try {
      ProduceResult result = publisher.publishRaw(new ProduceRequest(
          deadLetterTopic,
          message.key(),
          Collections.unmodifiableMap(headers),
          message.body()
      ));
      log.info(
          "dead_letter outcome=published topic={} partition={} offset={} key={} retryCount={} dlqTopic={} dlqPartition={} dlqOffset={}",
          message.topic(),
          message.partition(),
          message.offset(),
          message.keyAsString(),
          message.retryCount(),
          result.topic(),
          result.partition(),
          result.offset()
      );
      return true;
    } catch (ProblemException ex) {
      log.error(
          "dead_letter outcome=publish_failed topic={} partition={} offset={} key={} dlqTopic={} code={} message={}",
          message.topic(),
          message.partition(),
          message.offset(),
          message.keyAsString(),
          deadLetterTopic,
          ex.problem() == null ? null : ex.problem().code(),
          ex.getMessage()
      );
      return false;
    } catch (RuntimeException ex) {
      log.error(
          "dead_letter outcome=publish_failed topic={} partition={} offset={} key={} dlqTopic={}",
          message.topic(),
          message.partition(),
          message.offset(),
          message.keyAsString(),
          deadLetterTopic,
          ex
      );
      return false;
    }
  }

  private void commit(Message message, String deadLetterTopic) {
    try {
      message.commit();
    } catch (RuntimeException ex) {
      log.error(
          "dead_letter outcome=commit_failed topic={} partition={} offset={} dlqTopic={} message={}",
          message.topic(),
          message.partition(),
          message.offset(),
          deadLetterTopic,
          ex.getMessage()
      );
    }
  }

  private Map<String, Object> details(Message message) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("topic", message.topic());
    details.put("partition", message.partition());
    details.put("offset", message.offset());
    details.put("retryCount", message.retryCount());
    return Collections.unmodifiableMap(details);
  }
}
