package com.github.adamzv.kafkadispatch.application;

import com.github.adamzv.kafkadispatch.domain.Event;
import com.github.adamzv.kafkadispatch.domain.Problems;
import com.github.adamzv.kafkadispatch.domain.ProduceResult;
import com.github.adamzv.kafkadispatch.ports.KafkaAdminPort;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class KafkaClient implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(KafkaClient.class);

  private final ReaderPool readerPool;
  private final MessagePublisher publisher;
  private final KafkaAdminPort adminPort;
  private final DispatchWorkerPool workers;
  private final Cancellation cancellation;
  private final Duration fetchStopTimeout;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public KafkaClient(ReaderPool readerPool,
                     MessagePublisher publisher,
                     KafkaAdminPort adminPort,
                     DispatchWorkerPool workers,
                     Cancellation cancellation,
                     Duration fetchStopTimeout) {
    this.readerPool = readerPool;
    this.publisher = publisher;
    this.adminPort = adminPort;
    this.workers = workers;
    this.cancellation = cancellation;
    this.fetchStopTimeout = fetchStopTimeout;
  }

  public void listen(MessageHandler handler) {
    readerPool.listen(handler);
  }

  public void listenTopic(String topic, MessageHandler handler) {
    readerPool.listenTopic(topic, handler);
  }

  public ProduceResult publish(String topic, Event event) {
    return publisher.publish(topic, event);
  }

  public ProduceResult publishWithTracer(String topic, Event event) {
    return publisher.publishWithTracer(topic, event);
  }

  public boolean createTopic(String topic, int partitions) {
    if (topic == null || topic.isBlank()) {
      throw Problems.invalidArgument("Topic must not be blank", Map.of());
    }
    if (partitions < 1) {
      throw Problems.invalidArgument("partitions must be >= 1", Map.of("topic", topic, "partitions", partitions));
    }
    boolean created = adminPort.createTopic(topic, partitions);
    log.info("create_topic outcome={} topic={} partitions={}", created ? "created" : "exists", topic, partitions);
    return created;
  }

  public boolean isReaderConnected() {
    return readerPool.isReaderConnected();
  }

  public Cancellation cancellation() {
    return cancellation;
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    long startedAt = System.nanoTime();
    cancellation.cancel();
    readerPool.stopFetching(fetchStopTimeout);
    workers.close();
    readerPool.close();
    log.info("kafka_client outcome=closed durationMs={}", Duration.ofNanos(System.nanoTime() - startedAt).toMillis());
  }
}
