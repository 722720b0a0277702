package com.databricks.streaming;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A background task that runs repeatedly until cancelled. Handles task execution, error handling,
 * and cancellation.
 *
 * <p>Each iteration receives the cancellation token. Suspension points inside the task should wait
 * on the token (or be woken by whoever completes it) so that {@link #cancel()} takes effect
 * promptly.
 */
class BackgroundTask {
  private static final Logger logger = LoggerFactory.getLogger(BackgroundTask.class);

  private final Consumer<CompletableFuture<Void>> task;
  private final Consumer<Throwable> taskFailureHandler;
  private final ExecutorService executor;

  private final AtomicBoolean isActive = new AtomicBoolean(false);
  private final CompletableFuture<Void> cancellationToken = new CompletableFuture<>();
  private volatile Thread runner;

  /**
   * Creates a new background task.
   *
   * @param task The task to run repeatedly. Takes the cancellation token as parameter.
   * @param taskFailureHandler Handler for task failures
   * @param executor The executor to run the task on
   */
  BackgroundTask(
      Consumer<CompletableFuture<Void>> task,
      Consumer<Throwable> taskFailureHandler,
      ExecutorService executor) {
    this.task = task;
    this.taskFailureHandler = taskFailureHandler;
    this.executor = executor;
  }

  /**
   * Starts the background task.
   *
   * @throws IllegalStateException if the task is already running or was cancelled
   */
  void start() {
    if (cancellationToken.isDone()) {
      throw new IllegalStateException("Background task was cancelled");
    }
    boolean alreadyRunning = !isActive.compareAndSet(false, true);

    if (alreadyRunning) {
      throw new IllegalStateException("Background task is already running");
    }

    try {
      CompletableFuture.runAsync(this::runLoop, executor);
    } catch (RuntimeException e) {
      markStopped();
      throw e;
    }
  }

  private void runLoop() {
    runner = Thread.currentThread();
    try {
      while (!cancellationToken.isDone()) {
        try {
          task.accept(cancellationToken);
        } catch (Throwable e) {
          taskFailureHandler.accept(e);
        }
      }
    } catch (Throwable e) {
      logger.error("Background task failed", e);
    } finally {
      runner = null;
      markStopped();
    }
  }

  private void markStopped() {
    synchronized (this) {
      isActive.set(false);
      this.notifyAll();
    }
  }

  /** Cancels the background task. */
  void cancel() {
    cancellationToken.complete(null);
  }

  /** Returns whether the task has been cancelled. */
  boolean isCancelled() {
    return cancellationToken.isDone();
  }

  /** Returns whether the calling thread is the one running the task. */
  boolean isCurrentThread() {
    return runner == Thread.currentThread();
  }

  /**
   * Waits until the background task has stopped.
   *
   * @param timeoutMs maximum time to wait in milliseconds
   * @return true if the task stopped, false if the timeout elapsed first
   */
  boolean waitUntilStopped(long timeoutMs) {
    long deadline = System.currentTimeMillis() + timeoutMs;
    synchronized (this) {
      while (isActive.get()) {
        long remaining = deadline - System.currentTimeMillis();
        if (remaining <= 0) {
          return false;
        }
        try {
          this.wait(remaining);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return !isActive.get();
        }
      }
    }
    return true;
  }
}
