package com.github.adamzv.kafkadispatch.application;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class Cancellation {

  private final CountDownLatch signal = new CountDownLatch(1);

  public void cancel() {
    signal.countDown();
  }

  public boolean isCancelled() {
    return signal.getCount() == 0;
  }

  public boolean pause(Duration delay) {
    if (delay.isZero() || delay.isNegative()) {
      return !isCancelled();
    }
    try {
      return !signal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
