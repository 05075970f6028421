package com.github.adamzv.kafkadispatch.ports;

import com.github.adamzv.kafkadispatch.domain.ProblemException;

public interface KafkaAdminPort {

  boolean createTopic(String topic, int partitions) throws ProblemException;
}
