package com.databricks.streaming.common.retry;

import java.time.Duration;
import java.util.Random;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Common attempt counting, jitter and capping for the built-in strategies.
 *
 * <p>Subclasses only describe the un-jittered delay for a given attempt. The base class applies
 * the cap, multiplies by a random factor in {@code [1 - jitter, 1 + jitter]} when jitter is
 * enabled, and clamps the result to {@code [0, maxDelay]}.
 */
public abstract class AbstractRetryStrategy implements RetryStrategy {

  /** Value of {@code maxAttempts} meaning "retry forever". */
  public static final int UNLIMITED = -1;

  protected final int maxAttempts;
  @Nullable protected final Duration maxDelay;
  protected final double jitter;
  protected final Random random;

  private int attemptCount = 0;
  private Duration lastDelay;

  protected AbstractRetryStrategy(
      int maxAttempts, @Nullable Duration maxDelay, double jitter, @Nonnull Random random) {
    if (maxAttempts < 0 && maxAttempts != UNLIMITED) {
      throw new IllegalArgumentException("maxAttempts must be >= 0 or UNLIMITED: " + maxAttempts);
    }
    if (maxDelay != null && maxDelay.isNegative()) {
      throw new IllegalArgumentException("maxDelay cannot be negative: " + maxDelay);
    }
    if (jitter < 0.0 || jitter > 1.0 || Double.isNaN(jitter)) {
      throw new IllegalArgumentException("jitter must be within [0, 1]: " + jitter);
    }
    this.maxAttempts = maxAttempts;
    this.maxDelay = maxDelay;
    this.jitter = jitter;
    this.random = random;
  }

  /**
   * Returns the delay for the given attempt before capping and jitter, in nanoseconds.
   *
   * @param attempt zero-based number of retries already granted since the last reset
   */
  protected abstract double delayNanos(int attempt);

  @Override
  @Nonnull
  public final RetryDecision next() {
    if (maxAttempts != UNLIMITED && attemptCount >= maxAttempts) {
      return RetryDecision.giveUp();
    }
    double capNanos = maxDelay == null ? (double) Long.MAX_VALUE : (double) maxDelay.toNanos();
    double nanos = Math.min(delayNanos(attemptCount), capNanos);
    if (jitter > 0.0) {
      nanos *= 1.0 - jitter + 2.0 * jitter * random.nextDouble();
    }
    nanos = Math.max(0.0, Math.min(nanos, capNanos));

    Duration delay = Duration.ofNanos((long) nanos);
    attemptCount++;
    lastDelay = delay;
    return RetryDecision.retry(delay);
  }

  @Override
  public final void reset() {
    attemptCount = 0;
    lastDelay = null;
  }

  @Override
  public final int attemptCount() {
    return attemptCount;
  }

  @Override
  @Nonnull
  public final RetryState state() {
    return new RetryState(attemptCount, lastDelay);
  }

  @Override
  @Nonnull
  public final String progress() {
    if (maxAttempts == UNLIMITED) {
      return "(" + attemptCount + "/∞)";
    }
    return "(" + attemptCount + "/" + maxAttempts + ")";
  }

  /**
   * Returns a generator for a copy of this strategy, seeded from this strategy's generator. Copies
   * of strategies built with equally seeded generators therefore jitter identically, and never
   * share a generator with the original.
   */
  @Nonnull
  protected final Random copyRandom() {
    return new Random(random.nextLong());
  }

  /** Returns the configured attempt limit, or {@link #UNLIMITED}. */
  public int maxAttempts() {
    return maxAttempts;
  }

  /** Returns the configured jitter fraction. */
  public double jitter() {
    return jitter;
  }

  static long toNanos(Duration duration, String name) {
    if (duration == null) {
      throw new IllegalArgumentException(name + " cannot be null");
    }
    if (duration.isNegative()) {
      throw new IllegalArgumentException(name + " cannot be negative: " + duration);
    }
    try {
      return duration.toNanos();
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException(name + " is too large: " + duration, e);
    }
  }
}
