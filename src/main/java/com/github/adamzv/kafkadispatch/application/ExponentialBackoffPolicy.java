package com.github.adamzv.kafkadispatch.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff bounded by a maximum interval and a maximum elapsed time.
 *
 * <p>The n-th wait is {@code initialInterval * multiplier^(n-1)}, capped at {@code maxInterval}.
 * With a non-zero randomization factor each wait is drawn from
 * {@code [interval * (1 - factor), interval * (1 + factor)]}. A sequence stops once the time since
 * {@link #start()} plus the next wait would exceed {@code maxElapsedTime}; a zero
 * {@code maxElapsedTime} never stops.
 */
public final class ExponentialBackoffPolicy implements BackoffPolicy {

  public static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofMillis(500);
  public static final double DEFAULT_MULTIPLIER = 1.5;
  public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(60);
  public static final Duration DEFAULT_MAX_ELAPSED_TIME = Duration.ofMinutes(5);

  private final long initialIntervalMs;
  private final double multiplier;
  private final long maxIntervalMs;
  private final long maxElapsedMs;
  private final double randomizationFactor;
  private final Clock clock;

  public ExponentialBackoffPolicy(Duration initialInterval,
                                  double multiplier,
                                  Duration maxInterval,
                                  Duration maxElapsedTime,
                                  double randomizationFactor,
                                  Clock clock) {
    if (initialInterval == null || initialInterval.isNegative() || initialInterval.isZero()) {
      throw new IllegalArgumentException("initialInterval must be > 0, got: " + initialInterval);
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
    }
    if (maxInterval == null || maxInterval.compareTo(initialInterval) < 0) {
      throw new IllegalArgumentException("maxInterval must be >= initialInterval, got: " + maxInterval);
    }
    if (maxElapsedTime == null || maxElapsedTime.isNegative()) {
      throw new IllegalArgumentException("maxElapsedTime must be >= 0, got: " + maxElapsedTime);
    }
    if (randomizationFactor < 0.0 || randomizationFactor >= 1.0) {
      throw new IllegalArgumentException("randomizationFactor must be in [0, 1), got: " + randomizationFactor);
    }
    this.initialIntervalMs = initialInterval.toMillis();
    this.multiplier = multiplier;
    this.maxIntervalMs = maxInterval.toMillis();
    this.maxElapsedMs = maxElapsedTime.toMillis();
    this.randomizationFactor = randomizationFactor;
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  public static ExponentialBackoffPolicy defaults() {
    return new ExponentialBackoffPolicy(
        DEFAULT_INITIAL_INTERVAL,
        DEFAULT_MULTIPLIER,
        DEFAULT_MAX_INTERVAL,
        DEFAULT_MAX_ELAPSED_TIME,
        0.0,
        Clock.systemUTC()
    );
  }

  public Duration maxElapsedTime() {
    return Duration.ofMillis(maxElapsedMs);
  }

  @Override
  public Sequence start() {
    return new ExponentialSequence(clock.instant());
  }

  private final class ExponentialSequence implements Sequence {

    private final Instant startedAt;
    private long currentIntervalMs = initialIntervalMs;

    private ExponentialSequence(Instant startedAt) {
      this.startedAt = startedAt;
    }

    @Override
    public Optional<Duration> next() {
      long waitMs = randomize(currentIntervalMs);
      long elapsedMs = Duration.between(startedAt, clock.instant()).toMillis();
      if (maxElapsedMs > 0 && elapsedMs + waitMs > maxElapsedMs) {
        return Optional.empty();
      }
      advance();
      return Optional.of(Duration.ofMillis(waitMs));
    }

    private void advance() {
      // Compare in double space so a large multiplier cannot overflow the long
      double grown = currentIntervalMs * multiplier;
      currentIntervalMs = grown >= maxIntervalMs ? maxIntervalMs : (long) grown;
    }

    private long randomize(long intervalMs) {
      if (randomizationFactor == 0.0) {
        return intervalMs;
      }
      double delta = randomizationFactor * intervalMs;
      double low = intervalMs - delta;
      double high = intervalMs + delta;
      return (long) ThreadLocalRandom.current().nextDouble(low, high + 1);
    }
  }
}
