package com.github.adamzv.kafkadispatch.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ExponentialBackoffPolicyTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

  @Test
  void growsByMultiplierUntilMaxInterval() {
    ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(
        Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5), Duration.ZERO, 0.0, clock);

    BackoffPolicy.Sequence sequence = policy.start();
    List<Duration> waits = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      waits.add(sequence.next().orElseThrow());
    }

    assertEquals(
        List.of(
            Duration.ofSeconds(1),
            Duration.ofSeconds(2),
            Duration.ofSeconds(4),
            Duration.ofSeconds(5),
            Duration.ofSeconds(5),
            Duration.ofSeconds(5)),
        waits
    );
  }

  @Test
  void defaultSequenceIsNonDecreasing() {
    BackoffPolicy.Sequence sequence = new ExponentialBackoffPolicy(
        ExponentialBackoffPolicy.DEFAULT_INITIAL_INTERVAL,
        ExponentialBackoffPolicy.DEFAULT_MULTIPLIER,
        ExponentialBackoffPolicy.DEFAULT_MAX_INTERVAL,
        Duration.ZERO,
        0.0,
        clock
    ).start();

    Duration previous = sequence.next().orElseThrow();
    assertEquals(Duration.ofMillis(500), previous);
    for (int i = 0; i < 30; i++) {
      Duration current = sequence.next().orElseThrow();
      assertTrue(current.compareTo(previous) >= 0, "wait decreased from " + previous + " to " + current);
      assertTrue(current.compareTo(ExponentialBackoffPolicy.DEFAULT_MAX_INTERVAL) <= 0);
      previous = current;
    }
    assertEquals(ExponentialBackoffPolicy.DEFAULT_MAX_INTERVAL, previous);
  }

  @Test
  void stopsOnceElapsedBudgetWouldBeExceeded() {
    ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(
        Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60), Duration.ofSeconds(10), 0.0, clock);

    BackoffPolicy.Sequence sequence = policy.start();
    assertEquals(Optional.of(Duration.ofSeconds(1)), sequence.next());
    clock.advance(Duration.ofSeconds(1));
    assertEquals(Optional.of(Duration.ofSeconds(2)), sequence.next());
    clock.advance(Duration.ofSeconds(2));
    assertEquals(Optional.of(Duration.ofSeconds(4)), sequence.next());
    clock.advance(Duration.ofSeconds(4));

    // 7s spent, the next 8s wait would end past the 10s budget
    assertEquals(Optional.empty(), sequence.next());
  }

  @Test
  void budgetCountsTimeSpentInHandlers() {
    ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(
        Duration.ofSeconds(1), 1.5, Duration.ofSeconds(60), Duration.ofMinutes(5), 0.0, clock);

    BackoffPolicy.Sequence sequence = policy.start();
    clock.advance(Duration.ofMinutes(5));

    assertEquals(Optional.empty(), sequence.next());
  }

  @Test
  void sequencesAreIndependent() {
    ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(
        Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60), Duration.ZERO, 0.0, clock);

    BackoffPolicy.Sequence first = policy.start();
    first.next();
    first.next();
    BackoffPolicy.Sequence second = policy.start();

    assertNotSame(first, second);
    assertEquals(Optional.of(Duration.ofSeconds(4)), first.next());
    assertEquals(Optional.of(Duration.ofSeconds(1)), second.next());
  }

  @Test
  void randomizedWaitStaysWithinFactor() {
    ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(
        Duration.ofSeconds(1), 1.0, Duration.ofSeconds(1), Duration.ZERO, 0.5, clock);

    BackoffPolicy.Sequence sequence = policy.start();
    for (int i = 0; i < 100; i++) {
      long waitMs = sequence.next().orElseThrow().toMillis();
      assertTrue(waitMs >= 500 && waitMs <= 1500, "wait out of range: " + waitMs);
    }
  }

  @Test
  void defaultsUseFiveMinuteBudget() {
    assertEquals(Duration.ofMinutes(5), ExponentialBackoffPolicy.defaults().maxElapsedTime());
  }

  @Test
  void rejectsInvalidParameters() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffPolicy(
        Duration.ZERO, 1.5, Duration.ofSeconds(1), Duration.ZERO, 0.0, clock));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffPolicy(
        Duration.ofSeconds(1), 0.5, Duration.ofSeconds(1), Duration.ZERO, 0.0, clock));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffPolicy(
        Duration.ofSeconds(2), 1.5, Duration.ofSeconds(1), Duration.ZERO, 0.0, clock));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffPolicy(
        Duration.ofSeconds(1), 1.5, Duration.ofSeconds(1), Duration.ofSeconds(-1), 0.0, clock));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffPolicy(
        Duration.ofSeconds(1), 1.5, Duration.ofSeconds(1), Duration.ZERO, 1.0, clock));
  }

  private static final class MutableClock extends Clock {

    private Instant now;

    private MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
