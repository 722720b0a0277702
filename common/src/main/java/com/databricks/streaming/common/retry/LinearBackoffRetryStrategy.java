package com.databricks.streaming.common.retry;

import java.time.Duration;
import java.util.Random;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Retries with a delay that grows linearly with the number of attempts.
 *
 * <p>The delay for attempt {@code n} (zero-based) is {@code min(baseDelay + increment * n,
 * maxDelay)}, optionally jittered. With the default increment of zero this is a fixed interval
 * with jitter, which is the broadcaster's default policy.
 *
 * <p>Defaults:
 *
 * <ul>
 *   <li>baseDelay: 3 seconds
 *   <li>increment: 0
 *   <li>maxDelay: none
 *   <li>jitter: 0.33
 *   <li>maxAttempts: unlimited
 * </ul>
 */
public final class LinearBackoffRetryStrategy extends AbstractRetryStrategy {

  public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(3);
  public static final double DEFAULT_JITTER = 0.33;

  private final Duration baseDelay;
  private final Duration increment;

  private LinearBackoffRetryStrategy(
      Duration baseDelay,
      Duration increment,
      @Nullable Duration maxDelay,
      int maxAttempts,
      double jitter,
      Random random) {
    super(maxAttempts, maxDelay, jitter, random);
    this.baseDelay = baseDelay;
    this.increment = increment;
  }

  /** Returns a strategy with the default configuration. */
  @Nonnull
  public static LinearBackoffRetryStrategy getDefault() {
    return builder().build();
  }

  @Nonnull
  public static Builder builder() {
    return new Builder();
  }

  @Override
  protected double delayNanos(int attempt) {
    return (double) baseDelay.toNanos() + (double) increment.toNanos() * attempt;
  }

  @Override
  @Nonnull
  public LinearBackoffRetryStrategy copy() {
    return new LinearBackoffRetryStrategy(
        baseDelay, increment, maxDelay, maxAttempts, jitter, copyRandom());
  }

  @Nonnull
  public Duration baseDelay() {
    return baseDelay;
  }

  @Nonnull
  public Duration increment() {
    return increment;
  }

  @Override
  public String toString() {
    return "LinearBackoffRetryStrategy{baseDelay="
        + baseDelay
        + ", increment="
        + increment
        + ", maxDelay="
        + maxDelay
        + ", jitter="
        + jitter
        + ", maxAttempts="
        + maxAttempts
        + "}";
  }

  /** Builder for {@link LinearBackoffRetryStrategy}. */
  public static final class Builder {
    private Duration baseDelay = DEFAULT_BASE_DELAY;
    private Duration increment = Duration.ZERO;
    private Duration maxDelay = null;
    private int maxAttempts = UNLIMITED;
    private double jitter = DEFAULT_JITTER;
    private Random random = new Random();

    private Builder() {}

    /** Sets the delay before the first retry. */
    public Builder baseDelay(@Nonnull Duration baseDelay) {
      toNanos(baseDelay, "baseDelay");
      this.baseDelay = baseDelay;
      return this;
    }

    /** Sets how much the delay grows with each further retry. */
    public Builder increment(@Nonnull Duration increment) {
      toNanos(increment, "increment");
      this.increment = increment;
      return this;
    }

    /** Sets the upper bound for any delay, jitter included. */
    public Builder maxDelay(@Nonnull Duration maxDelay) {
      toNanos(maxDelay, "maxDelay");
      this.maxDelay = maxDelay;
      return this;
    }

    /**
     * Sets the maximum number of retries.
     *
     * @param maxAttempts the limit, {@code 0} for no retries, or {@link #UNLIMITED}
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the jitter fraction, {@code 0} to disable. Each delay is multiplied by a random factor in
     * {@code [1 - jitter, 1 + jitter]}.
     */
    public Builder jitter(double jitter) {
      this.jitter = jitter;
      return this;
    }

    public Builder random(@Nonnull Random random) {
      this.random = random;
      return this;
    }

    public LinearBackoffRetryStrategy build() {
      return new LinearBackoffRetryStrategy(
          baseDelay, increment, maxDelay, maxAttempts, jitter, random);
    }
  }
}
