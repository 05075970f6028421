package com.github.adamzv.kafkadispatch.domain;

import java.time.Duration;
import java.util.List;

public record ReaderSettings(
    List<String> brokers,
    String groupId,
    String clientId,
    Duration dialTimeout,
    Duration keepAlive,
    int batchBytes
) {

  public String bootstrapServers() {
    return String.join(",", brokers);
  }
}
