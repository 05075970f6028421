package com.github.adamzv.kafkadispatch.adapters.kafka;

import com.github.adamzv.kafkadispatch.domain.FetchedRecord;
import com.github.adamzv.kafkadispatch.domain.Problems;
import com.github.adamzv.kafkadispatch.ports.TopicReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reader session for one topic backed by a subscribed {@link Consumer}.
 *
 * <p>{@code KafkaConsumer} is not thread-safe, so every call into it goes through a fair lock:
 * commits issued from handling threads queue behind the poll in progress and are served before
 * the next one. Records returned by a poll are buffered and handed out one per {@link #fetch};
 * the next poll, and with it any rebalance, only happens once the buffer is drained. While the
 * caller is saturated, {@link #keepAlive()} keeps polling with every partition paused.
 */
public class KafkaTopicReader implements TopicReader {

  private static final Logger log = LoggerFactory.getLogger(KafkaTopicReader.class);

  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final String topic;
  private final Consumer<byte[], byte[]> consumer;
  private final String bootstrapServers;
  private final ReentrantLock lock = new ReentrantLock(true);
  private final Deque<ConsumerRecord<byte[], byte[]>> buffer = new ArrayDeque<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public KafkaTopicReader(String topic, Consumer<byte[], byte[]> consumer, String bootstrapServers) {
    this.topic = topic;
    this.consumer = consumer;
    this.bootstrapServers = bootstrapServers;
    consumer.subscribe(List.of(topic), new AssignmentLogger());
  }

  @Override
  public String topic() {
    return topic;
  }

  @Override
  public Optional<FetchedRecord> fetch(Duration timeout) {
    if (closed.get()) {
      throw Problems.streamClosed("Reader session is closed", Map.of("topic", topic));
    }
    lock.lock();
    try {
      if (buffer.isEmpty()) {
        Set<TopicPartition> paused = consumer.paused();
        if (!paused.isEmpty()) {
          consumer.resume(paused);
          log.debug("reader outcome=resumed topic={} partitions={}", topic, paused);
        }
        ConsumerRecords<byte[], byte[]> records = consumer.poll(timeout);
        records.forEach(buffer::addLast);
      }
      ConsumerRecord<byte[], byte[]> next = buffer.pollFirst();
      return next == null ? Optional.empty() : Optional.of(toFetchedRecord(next));
    } catch (WakeupException | InterruptException | IllegalStateException ex) {
      throw Problems.streamClosed(
          "Reader session can no longer deliver records",
          details(ex)
      );
    } catch (KafkaException ex) {
      throw Problems.kafkaUnavailable("Kafka fetch failed", details(ex));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Pauses every assigned partition and polls without waiting, which keeps the member inside
   * {@code max.poll.interval.ms}. Partitions assigned by a rebalance during the poll are not paused
   * yet, so their records can arrive here; they are buffered. The next {@link #fetch} that has to
   * poll resumes everything.
   */
  @Override
  public void keepAlive() {
    if (closed.get()) {
      throw Problems.streamClosed("Reader session is closed", Map.of("topic", topic));
    }
    lock.lock();
    try {
      consumer.pause(consumer.assignment());
      consumer.poll(Duration.ZERO).forEach(buffer::addLast);
    } catch (WakeupException | InterruptException | IllegalStateException ex) {
      throw Problems.streamClosed("Reader session can no longer deliver records", details(ex));
    } catch (KafkaException ex) {
      throw Problems.kafkaUnavailable("Kafka keep-alive poll failed", details(ex));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void commit(FetchedRecord record) {
    TopicPartition partition = new TopicPartition(record.topic(), record.partition());
    lock.lock();
    try {
      consumer.commitSync(Map.of(partition, new OffsetAndMetadata(record.offset() + 1)));
    } catch (WakeupException | InterruptException | IllegalStateException ex) {
      throw Problems.streamClosed("Reader session is closed", commitDetails(record, ex));
    } catch (KafkaException ex) {
      throw Problems.kafkaUnavailable("Kafka commit failed", commitDetails(record, ex));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean isConnected() {
    return !closed.get();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    // wakeup() is the only Consumer call that is safe without the lock; it ends a poll in progress
    consumer.wakeup();
    lock.lock();
    try {
      buffer.clear();
      consumer.close(CLOSE_TIMEOUT);
      log.info("reader outcome=closed topic={}", topic);
    } catch (KafkaException ex) {
      log.warn("reader outcome=close_failed topic={} error={} message={}",
          topic, ex.getClass().getSimpleName(), ex.getMessage());
    } finally {
      lock.unlock();
    }
  }

  private static FetchedRecord toFetchedRecord(ConsumerRecord<byte[], byte[]> record) {
    Map<String, String> headers = new LinkedHashMap<>();
    for (Header header : record.headers()) {
      byte[] value = header.value();
      headers.put(header.key(), value == null ? null : new String(value, StandardCharsets.UTF_8));
    }
    return new FetchedRecord(
        record.topic(),
        record.partition(),
        record.offset(),
        record.key(),
        record.value(),
        record.timestamp(),
        Collections.unmodifiableMap(headers)
    );
  }

  private Map<String, Object> details(RuntimeException ex) {
    Map<String, Object> details = new HashMap<>();
    details.put("topic", topic);
    details.put("bootstrapServers", bootstrapServers);
    details.put("error", ex.getClass().getSimpleName());
    if (ex.getMessage() != null) {
      details.put("message", ex.getMessage());
    }
    return Map.copyOf(details);
  }

  private Map<String, Object> commitDetails(FetchedRecord record, RuntimeException ex) {
    Map<String, Object> details = new HashMap<>(details(ex));
    details.put("partition", record.partition());
    details.put("offset", record.offset());
    return Map.copyOf(details);
  }

  private final class AssignmentLogger implements ConsumerRebalanceListener {

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
      log.info("reader outcome=revoked topic={} partitions={}", topic, partitions);
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
      log.info("reader outcome=assigned topic={} partitions={}", topic, partitions);
    }
  }
}
