package com.github.adamzv.kafkadispatch.ports;

import com.github.adamzv.kafkadispatch.domain.DispatchOutcome;
import java.time.Duration;

public interface DispatchMetrics {

  DispatchMetrics NOOP = new DispatchMetrics() {
    @Override
    public void recordAttempt(String topic) {
    }

    @Override
    public void recordFailure(String topic) {
    }

    @Override
    public void recordOutcome(String topic, DispatchOutcome outcome, Duration duration) {
    }

    @Override
    public void recordDeadLetter(String topic, boolean published) {
    }

    @Override
    public void recordFetchError(String topic) {
    }
  };

  void recordAttempt(String topic);

  void recordFailure(String topic);

  void recordOutcome(String topic, DispatchOutcome outcome, Duration duration);

  void recordDeadLetter(String topic, boolean published);

  void recordFetchError(String topic);
}
