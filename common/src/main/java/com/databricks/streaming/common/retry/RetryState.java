package com.databricks.streaming.common.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Immutable snapshot of a retry strategy's progress.
 *
 * <p>Snapshots are detached from the strategy that produced them; reading one never affects the
 * strategy's own counter.
 */
public final class RetryState {

  /** The state of a strategy that has not retried yet. */
  public static final RetryState INITIAL = new RetryState(0, null);

  private final int attemptCount;
  private final Duration lastDelay;

  RetryState(int attemptCount, @Nullable Duration lastDelay) {
    if (attemptCount < 0) {
      throw new IllegalArgumentException("attemptCount cannot be negative: " + attemptCount);
    }
    this.attemptCount = attemptCount;
    this.lastDelay = lastDelay;
  }

  /** Returns how many retries have been granted since the last reset. */
  public int attemptCount() {
    return attemptCount;
  }

  /** Returns the delay granted by the most recent retry decision, if any. */
  @Nonnull
  public Optional<Duration> lastDelay() {
    return Optional.ofNullable(lastDelay);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RetryState)) return false;
    RetryState that = (RetryState) o;
    return attemptCount == that.attemptCount && Objects.equals(lastDelay, that.lastDelay);
  }

  @Override
  public int hashCode() {
    return Objects.hash(attemptCount, lastDelay);
  }

  @Override
  public String toString() {
    return "RetryState{attemptCount=" + attemptCount + ", lastDelay=" + lastDelay + "}";
  }
}
