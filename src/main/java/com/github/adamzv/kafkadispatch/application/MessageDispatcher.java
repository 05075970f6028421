package com.github.adamzv.kafkadispatch.application;

import com.github.adamzv.kafkadispatch.domain.DispatchOutcome;
import com.github.adamzv.kafkadispatch.domain.Message;
import com.github.adamzv.kafkadispatch.domain.Problems;
import com.github.adamzv.kafkadispatch.ports.DispatchMetrics;
import com.github.adamzv.kafkadispatch.ports.TraceSpan;
import com.github.adamzv.kafkadispatch.ports.TracingPort;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the retry state machine for one fetched message.
 *
 * <p>Attempt {@code n} starts at 1. A failure of attempt {@code n < maxRetries} waits for the next
 * backoff interval and moves to attempt {@code n + 1}; once the backoff's elapsed-time budget is
 * spent the remaining attempts run back to back. A failure of attempt {@code maxRetries} hands the
 * message to the {@link DeadLetterRouter}. Success is terminal and leaves the commit to the handler.
 *
 * <p>Cancellation during a backoff wait abandons the message without committing it, so it is
 * delivered again after a restart. A handler that is already running is never interrupted.
 */
public class MessageDispatcher {

  private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

  static final String CONSUME_SPAN = "kafka.consume";

  private final int maxRetries;
  private final BackoffPolicy backoffPolicy;
  private final DeadLetterRouter deadLetterRouter;
  private final Cancellation cancellation;
  private final TracingPort tracing;
  private final DispatchMetrics metrics;

  public MessageDispatcher(int maxRetries,
                           BackoffPolicy backoffPolicy,
                           DeadLetterRouter deadLetterRouter,
                           Cancellation cancellation,
                           TracingPort tracing,
                           DispatchMetrics metrics) {
    if (maxRetries < 1) {
      throw Problems.invalidArgument("maxRetries must be >= 1", Map.of("maxRetries", maxRetries));
    }
    this.maxRetries = maxRetries;
    this.backoffPolicy = backoffPolicy;
    this.deadLetterRouter = deadLetterRouter;
    this.cancellation = cancellation;
    this.tracing = tracing == null ? TracingPort.NOOP : tracing;
    this.metrics = metrics == null ? DispatchMetrics.NOOP : metrics;
  }

  public int maxRetries() {
    return maxRetries;
  }

  public DispatchOutcome dispatch(Message message, MessageHandler handler) {
    long startedAt = System.nanoTime();
    DispatchOutcome outcome;
    try (TraceSpan span = tracing.startConsumer(CONSUME_SPAN, message.headers())) {
      span.tag("messaging.destination", message.topic())
          .tag("messaging.kafka.partition", message.partition())
          .tag("messaging.kafka.offset", message.offset())
          .tag("messaging.kafka.consumer_group", message.consumerGroup());
      outcome = runAttempts(message, handler);
      span.tag("messaging.retry_count", message.retryCount());
      span.tag("dispatch.outcome", outcome.name());
    }
    metrics.recordOutcome(message.topic(), outcome, Duration.ofNanos(System.nanoTime() - startedAt));
    return outcome;
  }

  private DispatchOutcome runAttempts(Message message, MessageHandler handler) {
    BackoffPolicy.Sequence backoff = backoffPolicy.start();
    int attempt = 1;
    while (true) {
      message.beginAttempt(attempt);
      metrics.recordAttempt(message.topic());
      try {
        handler.handle(cancellation, message);
        log.debug("dispatch outcome=success topic={} partition={} offset={} attempt={}",
            message.topic(), message.partition(), message.offset(), attempt);
        return DispatchOutcome.SUCCEEDED;
      } catch (Exception ex) {
        message.recordFailure(describe(ex));
        metrics.recordFailure(message.topic());
        log.warn(
            "dispatch outcome=failure topic={} partition={} offset={} key={} attempt={} maxRetries={} error={}",
            message.topic(),
            message.partition(),
            message.offset(),
            message.keyAsString(),
            attempt,
            maxRetries,
            message.lastError()
        );
      }

      if (attempt >= maxRetries) {
        break;
      }
      Optional<Duration> wait = backoff.next();
      if (wait.isEmpty()) {
        log.debug("dispatch outcome=backoff_spent topic={} partition={} offset={} attempt={} maxRetries={}",
            message.topic(), message.partition(), message.offset(), attempt, maxRetries);
      }
      if (!cancellation.pause(wait.orElse(Duration.ZERO))) {
        log.info("dispatch outcome=aborted topic={} partition={} offset={} attempt={}",
            message.topic(), message.partition(), message.offset(), attempt);
        return DispatchOutcome.ABORTED;
      }
      attempt++;
    }

    log.error("dispatch outcome=exhausted topic={} partition={} offset={} key={} attempts={}, moving to dead-letter topic",
        message.topic(), message.partition(), message.offset(), message.keyAsString(), attempt);
    deadLetterRouter.route(message);
    return DispatchOutcome.DEAD_LETTERED;
  }

  private static String describe(Exception ex) {
    String text = ex.getMessage();
    return text == null || text.isBlank() ? ex.getClass().getName() : text;
  }
}
