package com.github.adamzv.kafkadispatch.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.adamzv.kafkadispatch.domain.DispatchOutcome;
import com.github.adamzv.kafkadispatch.domain.Message;
import com.github.adamzv.kafkadispatch.domain.ProblemCodes;
import com.github.adamzv.kafkadispatch.domain.ProblemException;
import com.github.adamzv.kafkadispatch.domain.ProduceRequest;
import com.github.adamzv.kafkadispatch.domain.ProduceResult;
import com.github.adamzv.kafkadispatch.ports.DispatchMetrics;
import com.github.adamzv.kafkadispatch.ports.KafkaProducerPort;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MessageDispatcherTest {

  private final List<ProduceRequest> produced = new CopyOnWriteArrayList<>();
  private final List<Long> commits = new CopyOnWriteArrayList<>();
  private final List<Duration> waits = new ArrayList<>();
  private final RecordingTracing tracing = new RecordingTracing();
  private final Cancellation cancellation = new Cancellation();
  private DeadLetterRouter router;

  @BeforeEach
  void setUp() {
    KafkaProducerPort producerPort = request -> {
      produced.add(request);
      return new ProduceResult(request.topic(), 0, produced.size() - 1L, System.currentTimeMillis());
    };
    MessagePublisher publisher = new MessagePublisher(producerPort, new ObjectMapper(), tracing);
    router = new DeadLetterRouter(publisher, new DeadLetterTopics("-dlq"), tracing, DispatchMetrics.NOOP);
  }

  @Test
  void firstAttemptSuccessInvokesHandlerOnce() {
    AtomicInteger calls = new AtomicInteger();
    Message message = message(7);

    DispatchOutcome outcome = dispatcher(3, recordingBackoff()).dispatch(message, (cancel, msg) -> {
      calls.incrementAndGet();
      msg.commit();
    });

    assertEquals(DispatchOutcome.SUCCEEDED, outcome);
    assertEquals(1, calls.get());
    assertEquals(1, message.retryCount());
    assertEquals(List.of(7L), commits);
    assertTrue(waits.isEmpty());
    assertTrue(produced.isEmpty());
  }

  @Test
  void succeedsOnThirdAttemptAfterTwoBackoffWaits() {
    List<Integer> seenRetryCounts = new ArrayList<>();
    Message message = message(3);

    DispatchOutcome outcome = dispatcher(3, recordingBackoff()).dispatch(message, (cancel, msg) -> {
      seenRetryCounts.add(msg.retryCount());
      if (msg.retryCount() < 3) {
        throw new IllegalStateException("downstream timeout");
      }
      msg.commit();
    });

    assertEquals(DispatchOutcome.SUCCEEDED, outcome);
    assertEquals(List.of(1, 2, 3), seenRetryCounts);
    assertEquals(2, waits.size());
    assertEquals(List.of(3L), commits);
    assertTrue(produced.isEmpty());
  }

  @Test
  void exhaustedRetriesGoToDeadLetterTopicWithErrorHeader() {
    AtomicInteger calls = new AtomicInteger();
    Message message = message(11);

    DispatchOutcome outcome = dispatcher(3, recordingBackoff()).dispatch(message, (cancel, msg) -> {
      calls.incrementAndGet();
      throw new IllegalArgumentException("bad payload");
    });

    assertEquals(DispatchOutcome.DEAD_LETTERED, outcome);
    assertEquals(3, calls.get());
    // no wait after the final failure
    assertEquals(2, waits.size());
    assertEquals(1, produced.size());
    ProduceRequest deadLetter = produced.get(0);
    assertEquals("orders-dlq", deadLetter.topic());
    assertEquals("bad payload", deadLetter.headers().get(DeadLetterRouter.ERROR_HEADER));
    assertEquals("t-11", deadLetter.headers().get("trace-id"));
    assertEquals("k-11", new String(deadLetter.key(), StandardCharsets.UTF_8));
    assertEquals("{\"id\":11}", new String(deadLetter.value(), StandardCharsets.UTF_8));
    assertEquals(List.of(11L), commits);
    assertEquals(3, message.retryCount());
  }

  @Test
  void singleRetryBudgetMeansOneInvocation() {
    AtomicInteger calls = new AtomicInteger();

    DispatchOutcome outcome = dispatcher(1, recordingBackoff()).dispatch(message(0), (cancel, msg) -> {
      calls.incrementAndGet();
      throw new RuntimeException("nope");
    });

    assertEquals(DispatchOutcome.DEAD_LETTERED, outcome);
    assertEquals(1, calls.get());
    assertTrue(waits.isEmpty());
    assertEquals(1, produced.size());
  }

  @Test
  void exceptionWithoutMessageRecordsClassName() {
    Message message = message(2);

    dispatcher(1, recordingBackoff()).dispatch(message, (cancel, msg) -> {
      throw new IllegalStateException();
    });

    assertEquals("java.lang.IllegalStateException", message.lastError());
    assertEquals("java.lang.IllegalStateException", produced.get(0).headers().get(DeadLetterRouter.ERROR_HEADER));
  }

  @Test
  void spentElapsedBudgetStillRunsEveryAttempt() {
    AtomicInteger calls = new AtomicInteger();
    BackoffPolicy exhausted = () -> Optional::empty;

    DispatchOutcome outcome = dispatcher(5, exhausted).dispatch(message(4), (cancel, msg) -> {
      calls.incrementAndGet();
      throw new IllegalStateException("still failing");
    });

    assertEquals(DispatchOutcome.DEAD_LETTERED, outcome);
    assertEquals(5, calls.get());
    assertEquals(1, produced.size());
    assertEquals(List.of(4L), commits);
  }

  @Test
  void shortElapsedBudgetDoesNotCapAttemptCount() {
    AtomicInteger calls = new AtomicInteger();
    ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(
        Duration.ofMillis(10),
        1.5,
        Duration.ofSeconds(1),
        Duration.ofMillis(50),
        0.0,
        null
    );
    Message message = message(5);

    DispatchOutcome outcome = dispatcher(10, policy).dispatch(message, (cancel, msg) -> {
      calls.incrementAndGet();
      throw new IllegalStateException("boom");
    });

    assertEquals(DispatchOutcome.DEAD_LETTERED, outcome);
    assertEquals(10, calls.get());
    assertEquals(10, message.retryCount());
    assertEquals("boom", produced.get(0).headers().get(DeadLetterRouter.ERROR_HEADER));
  }

  @Test
  void cancellationDuringBackoffAbortsWithoutCommitOrDeadLetter() {
    AtomicInteger calls = new AtomicInteger();
    BackoffPolicy slow = () -> () -> Optional.of(Duration.ofMinutes(1));
    Message message = message(9);

    DispatchOutcome outcome = dispatcher(3, slow).dispatch(message, (cancel, msg) -> {
      calls.incrementAndGet();
      cancel.cancel();
      throw new IllegalStateException("shutting down");
    });

    assertEquals(DispatchOutcome.ABORTED, outcome);
    assertEquals(1, calls.get());
    assertFalse(message.isCommitted());
    assertTrue(commits.isEmpty());
    assertTrue(produced.isEmpty());
  }

  @Test
  void handlerSeesSharedCancellation() {
    List<Cancellation> seen = new ArrayList<>();

    dispatcher(1, recordingBackoff()).dispatch(message(0), (cancel, msg) -> {
      seen.add(cancel);
      msg.commit();
    });

    assertEquals(List.of(cancellation), seen);
  }

  @Test
  void consumeSpanCarriesMessageCoordinates() {
    dispatcher(2, recordingBackoff()).dispatch(message(5), (cancel, msg) -> {
      if (msg.retryCount() == 1) {
        throw new IllegalStateException("once");
      }
      msg.commit();
    });

    RecordingTracing.Span span = tracing.only(MessageDispatcher.CONSUME_SPAN);
    assertEquals("consumer", span.kind);
    assertEquals("orders", span.tags.get("messaging.destination"));
    assertEquals(5L, span.tags.get("messaging.kafka.offset"));
    assertEquals(2, span.tags.get("messaging.retry_count"));
    assertEquals("SUCCEEDED", span.tags.get("dispatch.outcome"));
    assertEquals("t-5", span.carrier.get("trace-id"));
    assertTrue(span.closed);
  }

  @Test
  void rejectsNonPositiveMaxRetries() {
    ProblemException ex = assertThrows(ProblemException.class, () -> dispatcher(0, recordingBackoff()));
    assertEquals(ProblemCodes.INVALID_ARGUMENT, ex.problem().code());
  }

  private MessageDispatcher dispatcher(int maxRetries, BackoffPolicy backoffPolicy) {
    return new MessageDispatcher(maxRetries, backoffPolicy, router, cancellation, tracing, DispatchMetrics.NOOP);
  }

  private BackoffPolicy recordingBackoff() {
    return () -> () -> {
      waits.add(Duration.ZERO);
      return Optional.of(Duration.ZERO);
    };
  }

  private Message message(long offset) {
    return new Message(
        FakeTopicReader.record("orders", offset, "k-" + offset, "{\"id\":" + offset + "}"),
        "billing",
        record -> commits.add(record.offset()),
        router::publish
    );
  }
}
