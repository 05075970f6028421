package com.github.adamzv.kafkadispatch.adapters.metrics;

import com.github.adamzv.kafkadispatch.domain.DispatchOutcome;
import com.github.adamzv.kafkadispatch.ports.DispatchMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Locale;

public class MicrometerDispatchMetrics implements DispatchMetrics {

  private final MeterRegistry meterRegistry;

  public MicrometerDispatchMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void recordAttempt(String topic) {
    meterRegistry.counter("kafka_dispatch_attempts_total", "topic", topic).increment();
  }

  @Override
  public void recordFailure(String topic) {
    meterRegistry.counter("kafka_dispatch_failures_total", "topic", topic).increment();
  }

  @Override
  public void recordOutcome(String topic, DispatchOutcome outcome, Duration duration) {
    String tag = outcome.name().toLowerCase(Locale.ROOT);
    meterRegistry.timer("kafka_dispatch_duration_seconds", "topic", topic, "outcome", tag)
        .record(duration);
    if (outcome == DispatchOutcome.SUCCEEDED) {
      meterRegistry.counter("kafka_dispatch_success_total", "topic", topic).increment();
    }
  }

  @Override
  public void recordDeadLetter(String topic, boolean published) {
    meterRegistry.counter(
            "kafka_dispatch_dead_letter_total",
            "topic", topic,
            "published", Boolean.toString(published))
        .increment();
  }

  @Override
  public void recordFetchError(String topic) {
    meterRegistry.counter("kafka_dispatch_fetch_errors_total", "topic", topic).increment();
  }
}
