package com.github.adamzv.kafkadispatch.application;

import com.github.adamzv.kafkadispatch.domain.Message;

// Handlers commit on success. Throwing schedules a retry; exhausted messages are committed by the
// dead-letter path.
@FunctionalInterface
public interface MessageHandler {

  void handle(Cancellation cancellation, Message message) throws Exception;
}
