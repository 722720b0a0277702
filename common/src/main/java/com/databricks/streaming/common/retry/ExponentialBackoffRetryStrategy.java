package com.databricks.streaming.common.retry;

import java.time.Duration;
import java.util.Random;
import javax.annotation.Nonnull;

/**
 * Retries with a delay that is multiplied on every attempt, up to a maximum.
 *
 * <p>The delay for attempt {@code n} (zero-based) is {@code min(initialDelay * multiplier^n,
 * maxDelay)}, optionally jittered. With the defaults this yields 3s, 6s, 12s, 24s, 48s, 60s, 60s...
 */
public final class ExponentialBackoffRetryStrategy extends AbstractRetryStrategy {

  public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(3);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
  public static final double DEFAULT_MULTIPLIER = 2.0;

  private final Duration initialDelay;
  private final double multiplier;

  private ExponentialBackoffRetryStrategy(
      Duration initialDelay,
      double multiplier,
      Duration maxDelay,
      int maxAttempts,
      double jitter,
      Random random) {
    super(maxAttempts, maxDelay, jitter, random);
    if (multiplier < 1.0 || Double.isNaN(multiplier) || Double.isInfinite(multiplier)) {
      throw new IllegalArgumentException("multiplier must be >= 1: " + multiplier);
    }
    this.initialDelay = initialDelay;
    this.multiplier = multiplier;
  }

  @Nonnull
  public static Builder builder() {
    return new Builder();
  }

  @Override
  protected double delayNanos(int attempt) {
    return initialDelay.toNanos() * Math.pow(multiplier, attempt);
  }

  @Override
  @Nonnull
  public ExponentialBackoffRetryStrategy copy() {
    return new ExponentialBackoffRetryStrategy(
        initialDelay, multiplier, maxDelay, maxAttempts, jitter, copyRandom());
  }

  @Nonnull
  public Duration initialDelay() {
    return initialDelay;
  }

  public double multiplier() {
    return multiplier;
  }

  @Override
  public String toString() {
    return "ExponentialBackoffRetryStrategy{initialDelay="
        + initialDelay
        + ", multiplier="
        + multiplier
        + ", maxDelay="
        + maxDelay
        + ", jitter="
        + jitter
        + ", maxAttempts="
        + maxAttempts
        + "}";
  }

  /** Builder for {@link ExponentialBackoffRetryStrategy}. */
  public static final class Builder {
    private Duration initialDelay = DEFAULT_INITIAL_DELAY;
    private double multiplier = DEFAULT_MULTIPLIER;
    private Duration maxDelay = DEFAULT_MAX_DELAY;
    private int maxAttempts = UNLIMITED;
    private double jitter = 0.0;
    private Random random = new Random();

    private Builder() {}

    public Builder initialDelay(@Nonnull Duration initialDelay) {
      toNanos(initialDelay, "initialDelay");
      this.initialDelay = initialDelay;
      return this;
    }

    public Builder multiplier(double multiplier) {
      this.multiplier = multiplier;
      return this;
    }

    public Builder maxDelay(@Nonnull Duration maxDelay) {
      toNanos(maxDelay, "maxDelay");
      this.maxDelay = maxDelay;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder jitter(double jitter) {
      this.jitter = jitter;
      return this;
    }

    public Builder random(@Nonnull Random random) {
      this.random = random;
      return this;
    }

    public ExponentialBackoffRetryStrategy build() {
      return new ExponentialBackoffRetryStrategy(
          initialDelay, multiplier, maxDelay, maxAttempts, jitter, random);
    }
  }
}
