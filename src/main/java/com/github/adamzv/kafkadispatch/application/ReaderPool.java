package com.github.adamzv.kafkadispatch.application;

import com.github.adamzv.kafkadispatch.domain.FetchedRecord;
import com.github.adamzv.kafkadispatch.domain.Message;
import com.github.adamzv.kafkadispatch.domain.ProblemCodes;
import com.github.adamzv.kafkadispatch.domain.ProblemException;
import com.github.adamzv.kafkadispatch.domain.Problems;
import com.github.adamzv.kafkadispatch.domain.ReaderSettings;
import com.github.adamzv.kafkadispatch.ports.DispatchMetrics;
import com.github.adamzv.kafkadispatch.ports.TopicReader;
import com.github.adamzv.kafkadispatch.ports.TopicReaderFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One reader session per configured topic and one fetch loop per listened topic.
 *
 * <p>The reader map is built once in {@link #open} and never changes afterwards. Fetch loops run on
 * their own daemon threads and hand every fetched record to the {@link DispatchWorkerPool}, so a
 * slow handler does not hold back later records until the pool is saturated. A saturated loop
 * keeps calling {@link TopicReader#keepAlive()} until a slot frees up.
 */
public final class ReaderPool implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ReaderPool.class);

  static final Duration FETCH_TIMEOUT = Duration.ofMillis(300);
  static final Duration ERROR_PAUSE = Duration.ofMillis(100);
  static final Duration SATURATION_WAIT = FETCH_TIMEOUT;

  private final Map<String, TopicReader> readers;
  private final String consumerGroup;
  private final MessageDispatcher dispatcher;
  private final DispatchWorkerPool workers;
  private final DeadLetterRouter deadLetterRouter;
  private final Cancellation cancellation;
  private final DispatchMetrics metrics;
  private final ExecutorService fetchers;
  private final Set<String> listening = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean fetchStopped = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private ReaderPool(Map<String, TopicReader> readers,
                     String consumerGroup,
                     MessageDispatcher dispatcher,
                     DispatchWorkerPool workers,
                     DeadLetterRouter deadLetterRouter,
                     Cancellation cancellation,
                     DispatchMetrics metrics) {
    this.readers = readers;
    this.consumerGroup = consumerGroup;
    this.dispatcher = dispatcher;
    this.workers = workers;
    this.deadLetterRouter = deadLetterRouter;
    this.cancellation = cancellation;
    this.metrics = metrics == null ? DispatchMetrics.NOOP : metrics;
    this.fetchers = Executors.newCachedThreadPool(new DaemonThreadFactory("kafka-dispatch-fetch-"));
  }

  /**
   * Opens one reader session per distinct topic. If any session fails to open, the ones already
   * opened are closed and the failure propagates.
   */
  public static ReaderPool open(List<String> topics,
                                ReaderSettings settings,
                                TopicReaderFactory factory,
                                MessageDispatcher dispatcher,
                                DispatchWorkerPool workers,
                                DeadLetterRouter deadLetterRouter,
                                Cancellation cancellation,
                                DispatchMetrics metrics) {
    if (topics == null || topics.isEmpty()) {
      throw Problems.invalidArgument("At least one topic is required", Map.of());
    }
    Set<String> distinct = new LinkedHashSet<>();
    for (String topic : topics) {
      if (topic == null || topic.isBlank()) {
        throw Problems.invalidArgument("Topic must not be blank", Map.of("topics", new ArrayList<>(topics)));
      }
      distinct.add(topic.trim());
    }

    Map<String, TopicReader> readers = new LinkedHashMap<>();
    try {
      for (String topic : distinct) {
        readers.put(topic, factory.open(topic, settings));
      }
    } catch (RuntimeException ex) {
      readers.values().forEach(ReaderPool::closeQuietly);
      throw ex;
    }

    log.info("reader_pool outcome=opened topics={} consumerGroup={} clientId={}",
        readers.keySet(), settings.groupId(), settings.clientId());
    return new ReaderPool(
        Collections.unmodifiableMap(readers),
        settings.groupId(),
        dispatcher,
        workers,
        deadLetterRouter,
        cancellation,
        metrics
    );
  }

  public Set<String> topics() {
    return readers.keySet();
  }

  /**
   * Starts a fetch loop for every topic that is not listened to yet. Returns immediately.
   */
  public void listen(MessageHandler handler) {
    requireHandler(handler);
    ensureOpen();
    for (String topic : readers.keySet()) {
      if (listening.add(topic)) {
        startLoop(readers.get(topic), handler);
      } else {
        log.debug("fetch_loop outcome=already_listening topic={}", topic);
      }
    }
  }

  /**
   * Starts the fetch loop of a single configured topic. Returns immediately.
   */
  public void listenTopic(String topic, MessageHandler handler) {
    requireHandler(handler);
    ensureOpen();
    TopicReader reader = readers.get(topic);
    if (reader == null) {
      throw Problems.notFound("Topic has no reader", Map.of("topic", String.valueOf(topic)));
    }
    if (!listening.add(topic)) {
      throw Problems.invalidArgument("Topic is already being listened to", Map.of("topic", topic));
    }
    startLoop(reader, handler);
  }

  public boolean isListening(String topic) {
    return listening.contains(topic);
  }

  /**
   * True while at least one reader session can still deliver records.
   */
  public boolean isReaderConnected() {
    if (closed.get()) {
      return false;
    }
    return readers.values().stream().anyMatch(TopicReader::isConnected);
  }

  /**
   * Stops starting new fetches and waits for the fetch loops to exit. A loop finishes the fetch
   * in progress and hands its record to the worker pool before it exits, unless the pool is
   * saturated; that record is then left uncommitted.
   *
   * @return {@code true} if every loop exited within the timeout
   */
  public boolean stopFetching(Duration timeout) {
    if (fetchStopped.compareAndSet(false, true)) {
      fetchers.shutdown();
    }
    try {
      boolean terminated = fetchers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!terminated) {
        log.warn("reader_pool outcome=fetch_stop_timeout timeoutMs={}", timeout.toMillis());
        fetchers.shutdownNow();
      }
      return terminated;
    } catch (InterruptedException ex) {
      fetchers.shutdownNow();
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Closes every reader session. Only the first call has an effect.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (!fetchers.isTerminated()) {
      stopFetching(FETCH_TIMEOUT.multipliedBy(5));
    }
    List<String> failed = new ArrayList<>();
    for (TopicReader reader : readers.values()) {
      if (!closeQuietly(reader)) {
        failed.add(reader.topic());
      }
    }
    log.info("reader_pool outcome=closed topics={} closeFailures={}", readers.keySet(), failed);
  }

  private void startLoop(TopicReader reader, MessageHandler handler) {
    try {
      fetchers.execute(() -> fetchLoop(reader, handler));
    } catch (RuntimeException ex) {
      listening.remove(reader.topic());
      throw Problems.operationFailed(
          "Fetch loop could not be started",
          Map.of("topic", reader.topic(), "error", ex.getClass().getSimpleName())
      );
    }
  }

  private void fetchLoop(TopicReader reader, MessageHandler handler) {
    String topic = reader.topic();
    log.info("fetch_loop outcome=started topic={} consumerGroup={}", topic, consumerGroup);
    long dispatched = 0;
    while (!fetchStopped.get() && !cancellation.isCancelled() && !Thread.currentThread().isInterrupted()) {
      Optional<FetchedRecord> fetched;
      try {
        fetched = reader.fetch(FETCH_TIMEOUT);
      } catch (ProblemException ex) {
        if (ex.hasCode(ProblemCodes.STREAM_CLOSED)) {
          log.info("fetch_loop outcome=stream_closed topic={} dispatched={} message={}",
              topic, dispatched, ex.getMessage());
          return;
        }
        onFetchError(topic, ex.problem() == null ? null : ex.problem().code(), ex.getMessage());
        continue;
      } catch (RuntimeException ex) {
        onFetchError(topic, ex.getClass().getSimpleName(), ex.getMessage());
        continue;
      }

      if (fetched.isEmpty()) {
        continue;
      }
      Message message = new Message(fetched.get(), consumerGroup, reader::commit, deadLetterRouter::publish);
      try {
        if (!handOff(reader, message, () -> dispatcher.dispatch(message, handler))) {
          return;
        }
        dispatched++;
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.info("fetch_loop outcome=interrupted topic={} dispatched={}", topic, dispatched);
        return;
      } catch (ProblemException ex) {
        log.info("fetch_loop outcome=pool_closed topic={} offset={} dispatched={}",
            topic, message.offset(), dispatched);
        return;
      }
    }
    log.info("fetch_loop outcome=stopped topic={} dispatched={}", topic, dispatched);
  }

  /**
   * Waits for a free worker slot, keeping the reader session alive while the pool is saturated.
   *
   * @return {@code false} if the loop has to end before the message was handed off; the message
   *     stays uncommitted and is delivered again
   */
  private boolean handOff(TopicReader reader, Message message, Runnable task) throws InterruptedException {
    String topic = reader.topic();
    boolean saturated = false;
    while (!workers.offer(task, SATURATION_WAIT)) {
      if (!saturated) {
        saturated = true;
        log.info("fetch_loop outcome=saturated topic={} offset={} inFlight={}",
            topic, message.offset(), workers.inFlight());
      }
      if (fetchStopped.get() || cancellation.isCancelled()) {
        log.info("fetch_loop outcome=stopped_while_saturated topic={} offset={}", topic, message.offset());
        return false;
      }
      try {
        reader.keepAlive();
      } catch (ProblemException ex) {
        if (ex.hasCode(ProblemCodes.STREAM_CLOSED)) {
          log.info("fetch_loop outcome=stream_closed topic={} offset={} message={}",
              topic, message.offset(), ex.getMessage());
          return false;
        }
        metrics.recordFetchError(topic);
        log.warn("fetch_loop outcome=keep_alive_error topic={} code={} message={}",
            topic, ex.problem() == null ? null : ex.problem().code(), ex.getMessage());
      }
    }
    if (saturated) {
      log.info("fetch_loop outcome=unsaturated topic={} offset={}", topic, message.offset());
    }
    return true;
  }

  private void onFetchError(String topic, String code, String message) {
    metrics.recordFetchError(topic);
    log.warn("fetch_loop outcome=fetch_error topic={} code={} message={}", topic, code, message);
    cancellation.pause(ERROR_PAUSE);
  }

  private void ensureOpen() {
    if (closed.get() || fetchStopped.get() || cancellation.isCancelled()) {
      throw Problems.operationFailed("Reader pool is closed", Map.of());
    }
  }

  private static void requireHandler(MessageHandler handler) {
    if (handler == null) {
      throw Problems.invalidArgument("Message handler is required", Map.of());
    }
  }

  private static boolean closeQuietly(TopicReader reader) {
    try {
      reader.close();
      return true;
    } catch (RuntimeException ex) {
      log.warn("reader outcome=close_failed topic={} message={}", reader.topic(), ex.getMessage());
      return false;
    }
  }
}
