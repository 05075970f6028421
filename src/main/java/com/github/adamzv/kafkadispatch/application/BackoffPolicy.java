package com.github.adamzv.kafkadispatch.application;

import java.time.Duration;
import java.util.Optional;

public interface BackoffPolicy {

  Sequence start();

  interface Sequence {

    Optional<Duration> next();
  }
}
