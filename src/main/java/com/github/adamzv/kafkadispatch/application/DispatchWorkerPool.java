package com.github.adamzv.kafkadispatch.application;

import com.github.adamzv.kafkadispatch.domain.Problems;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DispatchWorkerPool implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(DispatchWorkerPool.class);

  private final ThreadPoolExecutor executor;
  private final Semaphore slots;
  private final Duration drainTimeout;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public DispatchWorkerPool(int workers, int queueCapacity, Duration drainTimeout) {
    if (workers < 1) {
      throw Problems.invalidArgument("workers must be >= 1", Map.of("workers", workers));
    }
    if (queueCapacity < 1) {
      throw Problems.invalidArgument("queueCapacity must be >= 1", Map.of("queueCapacity", queueCapacity));
    }
    this.executor = new ThreadPoolExecutor(
        workers,
        workers,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity),
        new DaemonThreadFactory("kafka-dispatch-worker-")
    );
    this.slots = new Semaphore(workers + queueCapacity);
    this.drainTimeout = drainTimeout;
  }

  public void submit(Runnable task) throws InterruptedException {
    ensureOpen();
    slots.acquire();
    execute(task);
  }

  public boolean offer(Runnable task, Duration timeout) throws InterruptedException {
    ensureOpen();
    if (!slots.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      return false;
    }
    execute(task);
    return true;
  }

  private void execute(Runnable task) {
    try {
      executor.execute(() -> {
        try {
          task.run();
        } catch (RuntimeException ex) {
          log.error("worker outcome=error thread={}", Thread.currentThread().getName(), ex);
        } finally {
          slots.release();
        }
      });
    } catch (RejectedExecutionException ex) {
      slots.release();
      throw Problems.operationFailed("Worker pool rejected task", Map.of("error", ex.getClass().getSimpleName()));
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw Problems.operationFailed("Worker pool is closed", Map.of());
    }
  }

  public int inFlight() {
    return executor.getActiveCount() + executor.getQueue().size();
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("worker_pool outcome=drain_timeout drainTimeoutMs={} remaining={}",
            drainTimeout.toMillis(), executor.getQueue().size());
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
