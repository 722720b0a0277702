package com.databricks.streaming.common.retry;

import java.time.Duration;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Outcome of consulting a {@link RetryStrategy}: either retry after a delay, or give up.
 *
 * <p>A zero delay is a valid decision and means "retry immediately".
 */
public final class RetryDecision {

  private static final RetryDecision GIVE_UP = new RetryDecision(null);

  private final Duration delay;

  private RetryDecision(Duration delay) {
    this.delay = delay;
  }

  /**
   * Creates a decision to retry after the given delay.
   *
   * @param delay the delay before the next attempt, zero or positive
   * @return the retry decision
   */
  @Nonnull
  public static RetryDecision retry(@Nonnull Duration delay) {
    Objects.requireNonNull(delay, "delay cannot be null");
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay cannot be negative: " + delay);
    }
    return new RetryDecision(delay);
  }

  /** Returns the decision to stop retrying. */
  @Nonnull
  public static RetryDecision giveUp() {
    return GIVE_UP;
  }

  /** Returns true if the strategy gave up. */
  public boolean isGiveUp() {
    return delay == null;
  }

  /**
   * Returns the delay to wait before the next attempt.
   *
   * @throws IllegalStateException if this is a give-up decision
   */
  @Nonnull
  public Duration delay() {
    if (delay == null) {
      throw new IllegalStateException("No delay for a give-up decision");
    }
    return delay;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RetryDecision)) return false;
    return Objects.equals(delay, ((RetryDecision) o).delay);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(delay);
  }

  @Override
  public String toString() {
    return isGiveUp() ? "RetryDecision{giveUp}" : "RetryDecision{retry in " + delay + "}";
  }
}
