package com.github.adamzv.kafkadispatch.ports;

import com.github.adamzv.kafkadispatch.domain.FetchedRecord;
import com.github.adamzv.kafkadispatch.domain.ProblemException;
import java.time.Duration;
import java.util.Optional;

/**
 * One consumption session bound to a single topic.
 *
 * <p>{@link #fetch(Duration)} raises a problem with code {@code STREAM_CLOSED} once the session
 * can no longer deliver records; any other problem is transient.
 */
public interface TopicReader extends AutoCloseable {

  String topic();

  Optional<FetchedRecord> fetch(Duration timeout) throws ProblemException;

  void commit(FetchedRecord record) throws ProblemException;

  /**
   * Called while the caller cannot take more records. Sessions with a liveness deadline use it to
   * stay in their group without delivering anything new; records received meanwhile stay buffered
   * for later fetches.
   */
  default void keepAlive() throws ProblemException {
  }

  boolean isConnected();

  @Override
  void close();
}
