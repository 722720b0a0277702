package com.databricks.streaming;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import javax.annotation.Nonnull;

/**
 * Configuration options for {@link ResilientStreamBroadcaster}.
 *
 * <p>This class controls receiver buffering, end-of-stream and error handling, and shutdown.
 *
 * <p>Use the builder pattern to create instances:
 *
 * <pre>{@code
 * BroadcasterOptions options = BroadcasterOptions.builder()
 *     .setReceiverBufferSize(200)
 *     .setOverflowPolicy(OverflowPolicy.BLOCK)
 *     .setCompleteOnEndOfStream(true)
 *     .build();
 * }</pre>
 */
public class BroadcasterOptions {

  /** Default number of values buffered per receiver. */
  public static final int DEFAULT_RECEIVER_BUFFER_SIZE = 50;

  private int receiverBufferSize = DEFAULT_RECEIVER_BUFFER_SIZE;
  private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_OLDEST;
  private long overflowBlockTimeoutMs = 100;
  private boolean completeOnEndOfStream = false;
  private boolean stopOnNonRetriableError = false;
  private long stopTimeoutMs = 5000;
  private Optional<ExecutorService> executor = Optional.empty();

  private BroadcasterOptions() {}

  private BroadcasterOptions(
      int receiverBufferSize,
      OverflowPolicy overflowPolicy,
      long overflowBlockTimeoutMs,
      boolean completeOnEndOfStream,
      boolean stopOnNonRetriableError,
      long stopTimeoutMs,
      Optional<ExecutorService> executor) {
    this.receiverBufferSize = receiverBufferSize;
    this.overflowPolicy = overflowPolicy;
    this.overflowBlockTimeoutMs = overflowBlockTimeoutMs;
    this.completeOnEndOfStream = completeOnEndOfStream;
    this.stopOnNonRetriableError = stopOnNonRetriableError;
    this.stopTimeoutMs = stopTimeoutMs;
    this.executor = executor;
  }

  /**
   * Returns the number of values each receiver buffers by default.
   *
   * <p>Individual receivers may override this through {@link
   * ResilientStreamBroadcaster#newReceiver(int)}.
   *
   * @return the default receiver buffer size
   */
  public int receiverBufferSize() {
    return this.receiverBufferSize;
  }

  /**
   * Returns what a receiver does with a new value when its buffer is full.
   *
   * @return the overflow policy
   */
  public OverflowPolicy overflowPolicy() {
    return this.overflowPolicy;
  }

  /**
   * Returns how long a dispatch may wait for room in a full buffer under {@link
   * OverflowPolicy#BLOCK} before the oldest value is dropped.
   *
   * @return the block timeout in milliseconds
   */
  public long overflowBlockTimeoutMs() {
    return this.overflowBlockTimeoutMs;
  }

  /**
   * Returns whether a normal end of the upstream stream completes the broadcaster.
   *
   * <p>When false (the default), the upstream is expected to be long-lived and an end of stream is
   * handled like a failure: the retry strategy is consulted and the stream is reopened. When true,
   * receivers are completed and the broadcaster stops.
   *
   * @return true if end of stream is terminal
   */
  public boolean completeOnEndOfStream() {
    return this.completeOnEndOfStream;
  }

  /**
   * Returns whether a {@link NonRetriableException} stops the broadcaster without consulting the
   * retry strategy.
   *
   * @return true if non-retriable errors are terminal
   */
  public boolean stopOnNonRetriableError() {
    return this.stopOnNonRetriableError;
  }

  /**
   * Returns how long {@link ResilientStreamBroadcaster#stop()} waits for the background task to
   * exit.
   *
   * @return the stop timeout in milliseconds
   */
  public long stopTimeoutMs() {
    return this.stopTimeoutMs;
  }

  /**
   * Returns the executor that runs the broadcaster's background task.
   *
   * <p>If empty, each broadcaster creates a dedicated daemon thread and shuts it down on stop. A
   * supplied executor is never shut down by the broadcaster.
   *
   * @return the executor, or an empty Optional to use a dedicated thread
   */
  public Optional<ExecutorService> executor() {
    return this.executor;
  }

  /**
   * Returns the default broadcaster options.
   *
   * <p>Default values: - receiverBufferSize: 50 - overflowPolicy: DROP_OLDEST -
   * overflowBlockTimeoutMs: 100 - completeOnEndOfStream: false - stopOnNonRetriableError: false -
   * stopTimeoutMs: 5000 - executor: dedicated thread
   *
   * @return the default broadcaster options
   */
  public static BroadcasterOptions getDefault() {
    return new BroadcasterOptions();
  }

  /**
   * Returns a new builder for creating BroadcasterOptions.
   *
   * @return a new BroadcasterOptionsBuilder
   */
  public static BroadcasterOptionsBuilder builder() {
    return new BroadcasterOptionsBuilder();
  }

  /**
   * Returns a builder initialized with this instance's values.
   *
   * @return a new builder pre-populated with this instance's values
   */
  public BroadcasterOptionsBuilder toBuilder() {
    BroadcasterOptionsBuilder builder =
        new BroadcasterOptionsBuilder()
            .setReceiverBufferSize(this.receiverBufferSize)
            .setOverflowPolicy(this.overflowPolicy)
            .setOverflowBlockTimeoutMs(this.overflowBlockTimeoutMs)
            .setCompleteOnEndOfStream(this.completeOnEndOfStream)
            .setStopOnNonRetriableError(this.stopOnNonRetriableError)
            .setStopTimeoutMs(this.stopTimeoutMs);
    this.executor.ifPresent(builder::setExecutor);
    return builder;
  }

  /**
   * Builder for creating BroadcasterOptions instances.
   *
   * <p>All parameters have sensible defaults if not specified.
   *
   * @see BroadcasterOptions
   */
  public static class BroadcasterOptionsBuilder {
    private BroadcasterOptions defaultOptions = BroadcasterOptions.getDefault();

    private int receiverBufferSize = defaultOptions.receiverBufferSize();
    private OverflowPolicy overflowPolicy = defaultOptions.overflowPolicy();
    private long overflowBlockTimeoutMs = defaultOptions.overflowBlockTimeoutMs();
    private boolean completeOnEndOfStream = defaultOptions.completeOnEndOfStream();
    private boolean stopOnNonRetriableError = defaultOptions.stopOnNonRetriableError();
    private long stopTimeoutMs = defaultOptions.stopTimeoutMs();
    private Optional<ExecutorService> executor = defaultOptions.executor();

    private BroadcasterOptionsBuilder() {}

    /**
     * Sets the number of values each receiver buffers by default.
     *
     * @param receiverBufferSize the buffer size, at least 1
     * @return this builder for method chaining
     * @throws IllegalArgumentException if receiverBufferSize is less than 1
     */
    public BroadcasterOptionsBuilder setReceiverBufferSize(int receiverBufferSize) {
      if (receiverBufferSize < 1) {
        throw new IllegalArgumentException(
            "receiverBufferSize must be at least 1: " + receiverBufferSize);
      }
      this.receiverBufferSize = receiverBufferSize;
      return this;
    }

    /**
     * Sets what a receiver does with a new value when its buffer is full.
     *
     * @param overflowPolicy the overflow policy
     * @return this builder for method chaining
     */
    public BroadcasterOptionsBuilder setOverflowPolicy(@Nonnull OverflowPolicy overflowPolicy) {
      this.overflowPolicy = overflowPolicy;
      return this;
    }

    /**
     * Sets how long a dispatch may wait for room under {@link OverflowPolicy#BLOCK}.
     *
     * @param overflowBlockTimeoutMs the block timeout in milliseconds
     * @return this builder for method chaining
     * @throws IllegalArgumentException if overflowBlockTimeoutMs is negative
     */
    public BroadcasterOptionsBuilder setOverflowBlockTimeoutMs(long overflowBlockTimeoutMs) {
      if (overflowBlockTimeoutMs < 0) {
        throw new IllegalArgumentException(
            "overflowBlockTimeoutMs cannot be negative: " + overflowBlockTimeoutMs);
      }
      this.overflowBlockTimeoutMs = overflowBlockTimeoutMs;
      return this;
    }

    /**
     * Sets whether a normal end of the upstream stream completes the broadcaster.
     *
     * @param completeOnEndOfStream true to complete receivers on end of stream, false to reconnect
     * @return this builder for method chaining
     */
    public BroadcasterOptionsBuilder setCompleteOnEndOfStream(boolean completeOnEndOfStream) {
      this.completeOnEndOfStream = completeOnEndOfStream;
      return this;
    }

    /**
     * Sets whether a {@link NonRetriableException} stops the broadcaster immediately.
     *
     * @param stopOnNonRetriableError true to give up on non-retriable errors
     * @return this builder for method chaining
     */
    public BroadcasterOptionsBuilder setStopOnNonRetriableError(boolean stopOnNonRetriableError) {
      this.stopOnNonRetriableError = stopOnNonRetriableError;
      return this;
    }

    /**
     * Sets how long {@link ResilientStreamBroadcaster#stop()} waits for the background task.
     *
     * @param stopTimeoutMs the stop timeout in milliseconds
     * @return this builder for method chaining
     */
    public BroadcasterOptionsBuilder setStopTimeoutMs(long stopTimeoutMs) {
      this.stopTimeoutMs = stopTimeoutMs;
      return this;
    }

    /**
     * Sets the executor that runs the background task. The broadcaster never shuts it down.
     *
     * @param executor the executor
     * @return this builder for method chaining
     */
    public BroadcasterOptionsBuilder setExecutor(@Nonnull ExecutorService executor) {
      this.executor = Optional.of(executor);
      return this;
    }

    /**
     * Builds a new BroadcasterOptions instance.
     *
     * @return a new BroadcasterOptions with the configured settings
     */
    public BroadcasterOptions build() {
      return new BroadcasterOptions(
          this.receiverBufferSize,
          this.overflowPolicy,
          this.overflowBlockTimeoutMs,
          this.completeOnEndOfStream,
          this.stopOnNonRetriableError,
          this.stopTimeoutMs,
          this.executor);
    }
  }
}
