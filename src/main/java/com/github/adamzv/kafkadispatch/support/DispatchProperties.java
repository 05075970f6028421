package com.github.adamzv.kafkadispatch.support;

import com.github.adamzv.kafkadispatch.application.ExponentialBackoffPolicy;
import com.github.adamzv.kafkadispatch.domain.DispatchSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "dispatch")
public record DispatchProperties(
    @DefaultValue("8")
    @Positive(message = "dispatch.workers must be > 0")
    int workers,
    @DefaultValue("256")
    @Positive(message = "dispatch.queueCapacity must be > 0")
    int queueCapacity,
    @DefaultValue("-dlq")
    @NotBlank(message = "dispatch.deadLetterSuffix must not be blank")
    String deadLetterSuffix,
    @DefaultValue("10s")
    Duration drainTimeout,
    @DefaultValue("true")
    boolean tracingEnabled,
    @DefaultValue
    @Valid
    Backoff backoff
) {

  public DispatchSettings toSettings(int maxRetries) {
    return new DispatchSettings(maxRetries, workers, queueCapacity, deadLetterSuffix, drainTimeout);
  }

  @AssertTrue(message = "dispatch.drainTimeout must be >= 0")
  public boolean isDrainTimeoutValid() {
    return drainTimeout != null && !drainTimeout.isNegative();
  }

  public record Backoff(
      @DefaultValue("500ms")
      Duration initialInterval,
      @DefaultValue("1.5")
      double multiplier,
      @DefaultValue("60s")
      Duration maxInterval,
      @DefaultValue("5m")
      Duration maxElapsedTime,
      @DefaultValue("0.0")
      double randomizationFactor
  ) {

    public ExponentialBackoffPolicy toPolicy(Clock clock) {
      return new ExponentialBackoffPolicy(
          initialInterval,
          multiplier,
          maxInterval,
          maxElapsedTime,
          randomizationFactor,
          clock
      );
    }

    @AssertTrue(message = "dispatch.backoff.multiplier must be >= 1.0")
    public boolean isMultiplierValid() {
      return multiplier >= 1.0;
    }

    @AssertTrue(message = "dispatch.backoff.randomizationFactor must be in [0, 1)")
    public boolean isRandomizationFactorValid() {
      return randomizationFactor >= 0.0 && randomizationFactor < 1.0;
    }
  }
}
