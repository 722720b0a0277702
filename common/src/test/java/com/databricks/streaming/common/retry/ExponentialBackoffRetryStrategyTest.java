package com.databricks.streaming.common.retry;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Random;
import org.junit.jupiter.api.Test;

/** Tests for ExponentialBackoffRetryStrategy. */
class ExponentialBackoffRetryStrategyTest {

  @Test
  void testDelaysDoubleUpToCap() {
    ExponentialBackoffRetryStrategy strategy =
        ExponentialBackoffRetryStrategy.builder()
            .initialDelay(Duration.ofSeconds(3))
            .maxDelay(Duration.ofSeconds(30))
            .multiplier(2)
            .build();

    assertEquals(Duration.ofSeconds(3), strategy.next().delay());
    assertEquals(Duration.ofSeconds(6), strategy.next().delay());
    assertEquals(Duration.ofSeconds(12), strategy.next().delay());
    assertEquals(Duration.ofSeconds(24), strategy.next().delay());
    assertEquals(Duration.ofSeconds(30), strategy.next().delay());
    assertEquals(Duration.ofSeconds(30), strategy.next().delay());
  }

  @Test
  void testWithLimit() {
    ExponentialBackoffRetryStrategy strategy =
        ExponentialBackoffRetryStrategy.builder()
            .initialDelay(Duration.ofSeconds(3))
            .maxAttempts(3)
            .build();

    assertEquals(Duration.ofSeconds(3), strategy.next().delay());
    assertEquals(Duration.ofSeconds(6), strategy.next().delay());
    assertEquals(Duration.ofSeconds(12), strategy.next().delay());
    assertTrue(strategy.next().isGiveUp());
    assertEquals("(3/3)", strategy.progress());
  }

  @Test
  void testLargeAttemptCountDoesNotOverflow() {
    ExponentialBackoffRetryStrategy strategy =
        ExponentialBackoffRetryStrategy.builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofMinutes(5))
            .build();

    Duration last = Duration.ZERO;
    for (int i = 0; i < 200; i++) {
      last = strategy.next().delay();
    }
    assertEquals(Duration.ofMinutes(5), last);
  }

  @Test
  void testJitterWithinBounds() {
    ExponentialBackoffRetryStrategy strategy =
        ExponentialBackoffRetryStrategy.builder()
            .initialDelay(Duration.ofSeconds(2))
            .maxDelay(Duration.ofSeconds(100))
            .jitter(0.25)
            .random(new Random(1))
            .build();

    for (int attempt = 0; attempt < 5; attempt++) {
      long expected = 2000L << attempt;
      Duration delay = strategy.next().delay();
      assertTrue(delay.toMillis() >= expected * 0.75 - 1, "attempt " + attempt + ": " + delay);
      assertTrue(delay.toMillis() <= expected * 1.25 + 1, "attempt " + attempt + ": " + delay);
    }
  }

  @Test
  void testCopyStartsFresh() {
    ExponentialBackoffRetryStrategy strategy =
        ExponentialBackoffRetryStrategy.builder()
            .initialDelay(Duration.ofSeconds(3))
            .maxDelay(Duration.ofSeconds(30))
            .maxAttempts(2)
            .build();

    ExponentialBackoffRetryStrategy copy1 = strategy.copy();
    assertEquals(Duration.ofSeconds(3), copy1.next().delay());
    assertEquals(Duration.ofSeconds(6), copy1.next().delay());
    assertTrue(copy1.next().isGiveUp());

    ExponentialBackoffRetryStrategy copy2 = copy1.copy();
    assertTrue(copy1.next().isGiveUp());
    assertEquals(Duration.ofSeconds(3), copy2.next().delay());
  }

  @Test
  void testMultiplierBelowOneRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ExponentialBackoffRetryStrategy.builder().multiplier(0.5).build());
  }
}
