package com.mk.fx.qa.dbstress.event;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies engine events one at a time, in arrival order, on a single daemon thread.
 *
 * <p>The queue is bounded. When it is full {@link #submit} refuses the event instead of blocking
 * the producer. A handler failure is logged and the loop carries on with the next event.
 */
@Slf4j
public class EngineEventLoop implements AutoCloseable {

  private static final long POLL_MILLIS = 100;

  private final EngineEvent.Visitor<?> handler;
  private final BlockingQueue<EngineEvent> queue;
  private final Thread worker;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicLong processed = new AtomicLong();
  private final AtomicLong rejected = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();

  public EngineEventLoop(EngineEvent.Visitor<?> handler, int queueCapacity) {
    if (queueCapacity <= 0) throw new IllegalArgumentException("Queue capacity must be > 0");
    this.handler = handler;
    this.queue = new LinkedBlockingQueue<>(queueCapacity);
    this.worker = new Thread(this::runLoop, "engine-event-loop");
    this.worker.setDaemon(true);
    this.worker.start();
  }

  /**
   * Queues an event for processing.
   *
   * @return false when the loop is closed or the queue is full
   */
  public boolean submit(EngineEvent event) {
    if (!running.get()) {
      rejected.incrementAndGet();
      return false;
    }
    if (!queue.offer(event)) {
      rejected.incrementAndGet();
      log.warn("Event queue full, dropping {}", event.getClass().getSimpleName());
      return false;
    }
    return true;
  }

  /** Applies an event on the calling thread. */
  public void process(EngineEvent event) {
    try {
      log.debug("Dispatching {}", event.getClass().getSimpleName());
      event.accept(handler);
      processed.incrementAndGet();
    } catch (RuntimeException ex) {
      failed.incrementAndGet();
      log.error("Failed to apply {}: {}", event.getClass().getSimpleName(), ex.getMessage(), ex);
    }
  }

  public int pending() {
    return queue.size();
  }

  public long processedCount() {
    return processed.get();
  }

  public long rejectedCount() {
    return rejected.get();
  }

  public long failedCount() {
    return failed.get();
  }

  private void runLoop() {
    while (running.get() || !queue.isEmpty()) {
      try {
        var event = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (event != null) {
          process(event);
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        break;
      }
    }
    log.debug("Event loop exited with {} event(s) unprocessed", queue.size());
  }

  /** Stops accepting events, drains what is queued and waits briefly for the worker to exit. */
  @Override
  public void close() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    try {
      worker.join(TimeUnit.SECONDS.toMillis(2));
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
    }
    if (worker.isAlive()) {
      worker.interrupt();
    }
  }
}
