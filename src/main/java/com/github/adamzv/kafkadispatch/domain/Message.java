package com.github.adamzv.kafkadispatch.domain;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for one fetched record, passed to the message handler.
 *
 * <p>A handle is bound to the reader session that fetched it: {@link #commit()} commits exactly
 * this record's offset on that session and {@link #moveToDLQ()} republishes it to the
 * dead-letter topic of its source topic. Handles are created once per fetch and never reused.
 */
public final class Message {

  private final FetchedRecord record;
  private final String consumerGroup;
  private final Committer committer;
  private final DeadLetterPublisher deadLetterPublisher;
  private final AtomicBoolean committed = new AtomicBoolean(false);

  private volatile int retryCount = 1;
  private volatile String lastError = "";

  public Message(FetchedRecord record,
                 String consumerGroup,
                 Committer committer,
                 DeadLetterPublisher deadLetterPublisher) {
    this.record = Objects.requireNonNull(record, "record");
    this.consumerGroup = consumerGroup;
    this.committer = Objects.requireNonNull(committer, "committer");
    this.deadLetterPublisher = Objects.requireNonNull(deadLetterPublisher, "deadLetterPublisher");
  }

  public String topic() {
    return record.topic();
  }

  public int partition() {
    return record.partition();
  }

  public long offset() {
    return record.offset();
  }

  public byte[] key() {
    return record.key();
  }

  public String keyAsString() {
    return new String(record.key(), StandardCharsets.UTF_8);
  }

  public byte[] body() {
    return record.body();
  }

  public long timestamp() {
    return record.timestamp();
  }

  public Map<String, String> headers() {
    return record.headers();
  }

  public String consumerGroup() {
    return consumerGroup;
  }

  public FetchedRecord record() {
    return record;
  }

  public int retryCount() {
    return retryCount;
  }

  public String lastError() {
    return lastError;
  }

  public boolean isCommitted() {
    return committed.get();
  }

  /**
   * Commits this record's offset on the session that fetched it.
   *
   * @return {@code true} if this call committed, {@code false} if the message was already committed
   * @throws ProblemException if the broker rejects the commit; the message stays uncommitted
   */
  public boolean commit() {
    if (!committed.compareAndSet(false, true)) {
      return false;
    }
    try {
      committer.commit(record);
      return true;
    } catch (RuntimeException ex) {
      committed.set(false);
      throw ex;
    }
  }

  /**
   * Republishes key, body and headers to the dead-letter topic. Does not commit.
   */
  public ProduceResult moveToDLQ() {
    return deadLetterPublisher.publish(this);
  }

  public void beginAttempt(int attempt) {
    if (attempt < retryCount) {
      throw new IllegalArgumentException(
          "retryCount must not decrease: current=" + retryCount + ", requested=" + attempt);
    }
    this.retryCount = attempt;
  }

  public void recordFailure(String error) {
    this.lastError = error == null ? "" : error;
  }

  @Override
  public String toString() {
    return "Message{topic=" + record.topic()
        + ", partition=" + record.partition()
        + ", offset=" + record.offset()
        + ", key=" + keyAsString()
        + ", retryCount=" + retryCount + "}";
  }

  @FunctionalInterface
  public interface Committer {
    void commit(FetchedRecord record);
  }

  @FunctionalInterface
  public interface DeadLetterPublisher {
    ProduceResult publish(Message message);
  }
}
