package com.github.adamzv.kafkadispatch.domain;

public record ProduceResult(
    String topic,
    int partition,
    long offset,
    long timestamp
) {}
