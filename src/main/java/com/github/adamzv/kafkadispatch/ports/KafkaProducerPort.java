package com.github.adamzv.kafkadispatch.ports;

import com.github.adamzv.kafkadispatch.domain.ProduceRequest;
import com.github.adamzv.kafkadispatch.domain.ProduceResult;
import com.github.adamzv.kafkadispatch.domain.ProblemException;

public interface KafkaProducerPort {

  ProduceResult produce(ProduceRequest request) throws ProblemException;
}
