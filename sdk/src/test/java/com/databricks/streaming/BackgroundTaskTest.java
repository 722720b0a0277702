package com.databricks.streaming;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class BackgroundTaskTest {

  private final ExecutorService executor = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void testRunsUntilCancelled() throws InterruptedException {
    AtomicInteger iterations = new AtomicInteger(0);
    CountDownLatch running = new CountDownLatch(3);
    BackgroundTask task =
        new BackgroundTask(
            token -> {
              iterations.incrementAndGet();
              running.countDown();
              try {
                token.get(10, TimeUnit.MILLISECONDS);
              } catch (Exception e) {
                // next iteration
              }
            },
            e -> fail("unexpected failure: " + e),
            executor);

    task.start();
    assertTrue(running.await(5, TimeUnit.SECONDS));
    task.cancel();

    assertTrue(task.waitUntilStopped(5000));
    assertTrue(task.isCancelled());
    int count = iterations.get();
    Thread.sleep(30);
    assertEquals(count, iterations.get());
  }

  @Test
  void testFailuresGoToHandlerAndLoopContinues() throws InterruptedException {
    List<Throwable> failures = new CopyOnWriteArrayList<>();
    CountDownLatch failed = new CountDownLatch(2);
    BackgroundTask task =
        new BackgroundTask(
            token -> {
              throw new IllegalStateException("boom");
            },
            e -> {
              failures.add(e);
              failed.countDown();
            },
            executor);

    task.start();
    assertTrue(failed.await(5, TimeUnit.SECONDS));
    task.cancel();

    assertTrue(task.waitUntilStopped(5000));
    assertTrue(failures.get(0) instanceof IllegalStateException);
  }

  @Test
  void testStartTwiceFails() {
    CountDownLatch release = new CountDownLatch(1);
    BackgroundTask task =
        new BackgroundTask(
            token -> {
              try {
                release.await();
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            },
            e -> {},
            executor);

    task.start();
    try {
      assertThrows(IllegalStateException.class, task::start);
    } finally {
      task.cancel();
      release.countDown();
    }
  }

  @Test
  void testStartAfterCancelFails() {
    BackgroundTask task = new BackgroundTask(token -> {}, e -> {}, executor);

    task.cancel();

    assertThrows(IllegalStateException.class, task::start);
    assertTrue(task.waitUntilStopped(0));
  }

  @Test
  void testIsCurrentThread() throws InterruptedException {
    AtomicBoolean seenFromTask = new AtomicBoolean(false);
    CountDownLatch ran = new CountDownLatch(1);
    BackgroundTask[] holder = new BackgroundTask[1];
    holder[0] =
        new BackgroundTask(
            token -> {
              seenFromTask.set(holder[0].isCurrentThread());
              ran.countDown();
              holder[0].cancel();
            },
            e -> {},
            executor);

    holder[0].start();
    assertTrue(ran.await(5, TimeUnit.SECONDS));

    assertTrue(seenFromTask.get());
    assertFalse(holder[0].isCurrentThread());
  }
}
