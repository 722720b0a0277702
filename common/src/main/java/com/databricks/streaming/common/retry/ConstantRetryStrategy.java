package com.databricks.streaming.common.retry;

import java.time.Duration;
import java.util.Random;
import javax.annotation.Nonnull;

/**
 * Retries with the same delay every time.
 *
 * <p>Retries forever unless a maximum number of attempts is configured. A zero delay retries
 * immediately.
 */
public final class ConstantRetryStrategy extends AbstractRetryStrategy {

  private final Duration delay;

  private ConstantRetryStrategy(Duration delay, int maxAttempts, double jitter, Random random) {
    super(maxAttempts, null, jitter, random);
    this.delay = delay;
  }

  /**
   * Creates an unlimited strategy with a fixed delay and no jitter.
   *
   * @param delay the delay between attempts
   */
  @Nonnull
  public static ConstantRetryStrategy of(@Nonnull Duration delay) {
    return builder().delay(delay).build();
  }

  @Nonnull
  public static Builder builder() {
    return new Builder();
  }

  @Override
  protected double delayNanos(int attempt) {
    return delay.toNanos();
  }

  @Override
  @Nonnull
  public ConstantRetryStrategy copy() {
    return new ConstantRetryStrategy(delay, maxAttempts, jitter, copyRandom());
  }

  /** Returns the configured delay. */
  @Nonnull
  public Duration delay() {
    return delay;
  }

  @Override
  public String toString() {
    return "ConstantRetryStrategy{delay=" + delay + ", maxAttempts=" + maxAttempts + "}";
  }

  /** Builder for {@link ConstantRetryStrategy}. */
  public static final class Builder {
    private Duration delay = Duration.ofSeconds(3);
    private int maxAttempts = UNLIMITED;
    private double jitter = 0.0;
    private Random random = new Random();

    private Builder() {}

    public Builder delay(@Nonnull Duration delay) {
      toNanos(delay, "delay");
      this.delay = delay;
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
     * Sets the jitter fraction. Each delay is multiplied by a random factor in {@code [1 - jitter,
     * 1 + jitter]}.
     */
    public Builder jitter(double jitter) {
      this.jitter = jitter;
      return this;
    }

    public Builder random(@Nonnull Random random) {
      this.random = random;
      return this;
    }

    public ConstantRetryStrategy build() {
      return new ConstantRetryStrategy(delay, maxAttempts, jitter, random);
    }
  }
}
