package com.github.adamzv.kafkadispatch.ports;

import com.github.adamzv.kafkadispatch.domain.ProblemException;
import com.github.adamzv.kafkadispatch.domain.ReaderSettings;

public interface TopicReaderFactory {

  TopicReader open(String topic, ReaderSettings settings) throws ProblemException;
}
