package com.databricks.streaming.common.retry;

import javax.annotation.Nonnull;

/**
 * Policy that decides how long to wait before retrying a failed operation and when to give up.
 *
 * <p>A strategy keeps a mutable attempt counter. The counter only changes through {@link #next()}
 * and {@link #reset()}; callers that want to inspect it from another thread should use {@link
 * #state()}, which returns a detached snapshot.
 *
 * <p>Strategies are not thread-safe. A component that runs a retry loop should work on its own
 * {@link #copy()} so that configuration can be shared while counters are not:
 *
 * <pre>{@code
 * RetryStrategy strategy = LinearBackoffRetryStrategy.builder()
 *     .baseDelay(Duration.ofSeconds(1))
 *     .increment(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofSeconds(5))
 *     .maxAttempts(3)
 *     .build();
 *
 * RetryDecision decision = strategy.next(); // retry in 1s
 * }</pre>
 *
 * @see ConstantRetryStrategy
 * @see LinearBackoffRetryStrategy
 * @see ExponentialBackoffRetryStrategy
 */
public interface RetryStrategy {

  /**
   * Decides what to do after a failure and advances the attempt counter when retrying.
   *
   * @return {@link RetryDecision#retry} with the delay to wait, or {@link RetryDecision#giveUp()}
   *     once the attempt limit has been reached
   */
  @Nonnull
  RetryDecision next();

  /** Resets the attempt counter. To be called once an attempt has proven successful. */
  void reset();

  /**
   * Creates an independent strategy with the same configuration and a fresh state.
   *
   * @return a new strategy whose attempt count is zero
   */
  @Nonnull
  RetryStrategy copy();

  /** Returns the number of retries granted since the last reset. */
  int attemptCount();

  /** Returns a detached snapshot of the current progress. */
  @Nonnull
  RetryState state();

  /**
   * Returns a short progress description for log messages.
   *
   * @return {@code "(count/limit)"}, or {@code "(count/∞)"} when there is no limit
   */
  @Nonnull
  String progress();
}
