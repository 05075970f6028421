package com.github.adamzv.kafkadispatch.application;

import com.github.adamzv.kafkadispatch.domain.Problems;
import java.util.Map;

public final class DeadLetterTopics {

  public static final String DEFAULT_SUFFIX = "-dlq";

  private final String suffix;

  public DeadLetterTopics(String suffix) {
    if (suffix == null || suffix.isBlank()) {
      throw Problems.invalidArgument("Dead-letter suffix must not be blank", Map.of());
    }
    this.suffix = suffix;
  }

  public String deadLetterTopic(String topic) {
    return topic + suffix;
  }

  public String suffix() {
    return suffix;
  }
}
