package com.databricks.streaming;

import com.databricks.streaming.common.retry.LinearBackoffRetryStrategy;
import com.databricks.streaming.common.retry.RetryDecision;
import com.databricks.streaming.common.retry.RetryState;
import com.databricks.streaming.common.retry.RetryStrategy;
import com.databricks.streaming.stream.StreamSession;
import com.databricks.streaming.stream.StreamSessionFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes a single long-lived upstream stream and fans its values out to any number of {@link
 * Receiver}s, reconnecting on failure according to a {@link RetryStrategy}.
 *
 * <p>A background task repeatedly opens a {@link StreamSession} through the factory, reads values
 * from it and pushes each value into the buffer of every open receiver. When the session fails or
 * ends, the retry strategy decides how long to wait before reconnecting, or whether to give up. The
 * strategy's attempt counter is reset once a session delivers its first value.
 *
 * <p>Implements {@link AutoCloseable} to support try-with-resources:
 *
 * <pre>{@code
 * try (ResilientStreamBroadcaster<Reading> broadcaster =
 *     ResilientStreamBroadcaster.start(
 *         "readings",
 *         GrpcStreamSession.factory(observer -> stub.streamReadings(request, observer), Reading::of),
 *         ExponentialBackoffRetryStrategy.builder().maxAttempts(10).build())) {
 *
 *     Receiver<Reading> receiver = broadcaster.newReceiver();
 *     for (Reading reading : receiver) {
 *         process(reading);
 *     }
 * }
 * // Broadcaster is stopped and all receivers are released
 * }</pre>
 *
 * <p>All public methods are thread-safe.
 *
 * @param <T> The value type
 * @see BroadcasterState
 * @see BroadcasterOptions
 */
public final class ResilientStreamBroadcaster<T> implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ResilientStreamBroadcaster.class);
  private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);

  // Configuration (immutable after construction)
  private final String name;
  private final StreamSessionFactory<T> sessionFactory;
  private final BroadcasterOptions options;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final BackgroundTask loopTask;

  // Only touched by the background task
  private final RetryStrategy retryStrategy;

  // Guarded by lock
  private final Object lock = new Object();
  private final Map<Long, Subscription<T>> subscriptions = new LinkedHashMap<>();
  private BroadcasterState state = BroadcasterState.IDLE;
  private StreamSession<T> activeSession;

  private final AtomicLong nextReceiverId = new AtomicLong(0);
  private volatile Throwable lastError;
  private volatile RetryState retryState = RetryState.INITIAL;

  private ResilientStreamBroadcaster(
      String name,
      StreamSessionFactory<T> sessionFactory,
      RetryStrategy retryStrategy,
      BroadcasterOptions options) {
    this.name = name;
    this.sessionFactory = sessionFactory;
    this.retryStrategy = retryStrategy.copy();
    this.options = options;
    this.ownsExecutor = !options.executor().isPresent();
    this.executor = options.executor().orElseGet(() -> createDefaultExecutor(name));
    this.loopTask = new BackgroundTask(this::runCycle, this::handleLoopFailure, executor);
  }

  // ==================== Factory Methods ====================

  /**
   * Creates a broadcaster in the {@link BroadcasterState#IDLE} state. Call {@link #start()} to
   * begin streaming.
   *
   * @param name A name to identify the stream in logs
   * @param sessionFactory Opens a new session on every (re)connection
   * @param retryStrategy The retry policy; the broadcaster works on its own {@link
   *     RetryStrategy#copy()}
   * @param options Broadcaster options
   * @param <T> The value type
   * @return a new, not yet started broadcaster
   */
  @Nonnull
  public static <T> ResilientStreamBroadcaster<T> create(
      @Nonnull String name,
      @Nonnull StreamSessionFactory<T> sessionFactory,
      @Nonnull RetryStrategy retryStrategy,
      @Nonnull BroadcasterOptions options) {
    return new ResilientStreamBroadcaster<>(
        Objects.requireNonNull(name, "name cannot be null"),
        Objects.requireNonNull(sessionFactory, "sessionFactory cannot be null"),
        Objects.requireNonNull(retryStrategy, "retryStrategy cannot be null"),
        Objects.requireNonNull(options, "options cannot be null"));
  }

  /**
   * Creates and starts a broadcaster.
   *
   * @param name A name to identify the stream in logs
   * @param sessionFactory Opens a new session on every (re)connection
   * @param retryStrategy The retry policy; the broadcaster works on its own copy
   * @param options Broadcaster options
   * @param <T> The value type
   * @return a running broadcaster
   */
  @Nonnull
  public static <T> ResilientStreamBroadcaster<T> start(
      @Nonnull String name,
      @Nonnull StreamSessionFactory<T> sessionFactory,
      @Nonnull RetryStrategy retryStrategy,
      @Nonnull BroadcasterOptions options) {
    ResilientStreamBroadcaster<T> broadcaster =
        create(name, sessionFactory, retryStrategy, options);
    broadcaster.start();
    return broadcaster;
  }

  /**
   * Creates and starts a broadcaster with default options.
   *
   * @see #start(String, StreamSessionFactory, RetryStrategy, BroadcasterOptions)
   */
  @Nonnull
  public static <T> ResilientStreamBroadcaster<T> start(
      @Nonnull String name,
      @Nonnull StreamSessionFactory<T> sessionFactory,
      @Nonnull RetryStrategy retryStrategy) {
    return start(name, sessionFactory, retryStrategy, BroadcasterOptions.getDefault());
  }

  /**
   * Creates and starts a broadcaster that retries forever every 3 seconds, with jitter.
   *
   * @see LinearBackoffRetryStrategy#getDefault()
   */
  @Nonnull
  public static <T> ResilientStreamBroadcaster<T> start(
      @Nonnull String name, @Nonnull StreamSessionFactory<T> sessionFactory) {
    return start(name, sessionFactory, LinearBackoffRetryStrategy.getDefault());
  }

  // ==================== Public API ====================

  /**
   * Starts the background task. Does nothing if the broadcaster is already running.
   *
   * @throws BroadcasterStoppedException if the broadcaster has been stopped
   */
  public void start() {
    synchronized (lock) {
      if (state == BroadcasterState.STOPPED) {
        throw new BroadcasterStoppedException("Broadcaster " + name + " has been stopped");
      }
      if (state != BroadcasterState.IDLE) {
        return;
      }
      setStateLocked(BroadcasterState.CONNECTING);
      // terminate() cancels the task and shuts down the executor only after taking the lock
      loopTask.start();
    }
  }

  /**
   * Creates a receiver with the default buffer size.
   *
   * @return a new receiver, registered immediately
   * @throws BroadcasterStoppedException if the broadcaster has been stopped
   */
  @Nonnull
  public Receiver<T> newReceiver() {
    return newReceiver(options.receiverBufferSize());
  }

  /**
   * Creates a receiver. Never waits for the upstream connection.
   *
   * @param bufferSize Maximum number of values the receiver buffers
   * @return a new receiver, registered immediately
   * @throws BroadcasterStoppedException if the broadcaster has been stopped
   */
  @Nonnull
  public Receiver<T> newReceiver(int bufferSize) {
    Subscription<T> subscription =
        new Subscription<>(
            nextReceiverId.incrementAndGet(),
            bufferSize,
            options.overflowPolicy(),
            options.overflowBlockTimeoutMs());
    synchronized (lock) {
      if (state == BroadcasterState.STOPPED) {
        throw new BroadcasterStoppedException("Broadcaster " + name + " has been stopped");
      }
      subscriptions.put(subscription.id(), subscription);
    }
    logger.debug("{}: registered receiver {}", name, subscription.id());
    return new Receiver<>(subscription, () -> deregister(subscription.id()));
  }

  /**
   * Stops the broadcaster.
   *
   * <p>Interrupts a pending backoff wait or session read, delivers {@link
   * StreamCancelledException} to every open receiver, and waits for the background task to exit
   * (at most {@link BroadcasterOptions#stopTimeoutMs()}). Idempotent and safe to call from any
   * thread.
   */
  public void stop() {
    boolean stopped =
        terminate(
            () -> new StreamCancelledException("Broadcaster " + name + " was stopped"), true);
    if (!stopped) {
      return;
    }
    logger.info("{}: stopped", name);
    if (!loopTask.isCurrentThread() && !loopTask.waitUntilStopped(options.stopTimeoutMs())) {
      logger.warn(
          "{}: background task did not exit within {} ms", name, options.stopTimeoutMs());
    }
  }

  /** Same as {@link #stop()}. */
  @Override
  public void close() {
    stop();
  }

  /** Returns the name used to identify this broadcaster in logs. */
  @Nonnull
  public String getName() {
    return name;
  }

  /** Returns the current state. */
  @Nonnull
  public BroadcasterState getState() {
    synchronized (lock) {
      return state;
    }
  }

  /** Returns the most recent connection or stream failure, if any. */
  @Nonnull
  public Optional<Throwable> getLastError() {
    return Optional.ofNullable(lastError);
  }

  /** Returns a snapshot of the retry strategy's progress. */
  @Nonnull
  public RetryState getRetryState() {
    return retryState;
  }

  /** Returns the number of registered receivers. */
  public int getReceiverCount() {
    synchronized (lock) {
      return subscriptions.size();
    }
  }

  // ==================== Background Loop ====================

  /** One Connecting → Streaming → Backoff cycle. */
  private void runCycle(CompletableFuture<Void> token) {
    if (!setState(BroadcasterState.CONNECTING)) {
      return;
    }
    logger.debug("{}: opening stream", name);

    StreamSession<T> session;
    try {
      session = sessionFactory.open();
    } catch (RuntimeException e) {
      if (!token.isDone()) {
        handleFailure(token, e instanceof StreamingException ? e : connectError(e));
      }
      return;
    }

    if (!attachSession(session)) {
      session.close();
      return;
    }

    Optional<RuntimeException> failure = Optional.empty();
    boolean endOfStream = false;
    try {
      logger.info("{}: starting to stream", name);
      boolean delivered = false;
      while (!token.isDone()) {
        Optional<T> value = session.advance();
        if (!value.isPresent()) {
          endOfStream = true;
          break;
        }
        if (!delivered) {
          delivered = true;
          retryStrategy.reset();
          retryState = retryStrategy.state();
        }
        dispatch(value.get());
      }
    } catch (RuntimeException e) {
      failure = Optional.of(e);
    } finally {
      detachSession(session);
      session.close();
    }

    if (token.isDone()) {
      return;
    }
    if (endOfStream && options.completeOnEndOfStream()) {
      logger.info("{}: stream completed", name);
      terminate(
          () -> new StreamCompletedException("Stream " + name + " completed"), false);
      return;
    }
    handleFailure(
        token,
        failure.orElseGet(() -> new StreamReadException("Stream " + name + " ended by the server")));
  }

  private void handleFailure(CompletableFuture<Void> token, RuntimeException error) {
    lastError = error;

    if (error instanceof NonRetriableException && options.stopOnNonRetriableError()) {
      logger.error(
          "{}: non-retriable error, giving up. Error: {}.", name, error.getMessage(), error);
      terminate(() -> exhausted(error), false);
      return;
    }

    RetryDecision decision = retryStrategy.next();
    retryState = retryStrategy.state();
    if (decision.isGiveUp()) {
      logger.error(
          "{}: connection ended, retry limit exceeded {}, giving up. Error: {}.",
          name,
          retryStrategy.progress(),
          error.getMessage());
      terminate(() -> exhausted(error), false);
      return;
    }

    Duration delay = decision.delay();
    logger.warn(
        "{}: connection ended, retrying {} in {} ms. Error: {}.",
        name,
        retryStrategy.progress(),
        delay.toMillis(),
        error.getMessage());
    if (setState(BroadcasterState.BACKOFF)) {
      awaitBackoff(token, delay);
    }
  }

  /** Waits for the delay or until cancelled. A zero delay still yields once. */
  private void awaitBackoff(CompletableFuture<Void> token, Duration delay) {
    if (delay.isZero()) {
      Thread.yield();
      return;
    }
    try {
      token.get(delay.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      // backoff elapsed
    } catch (ExecutionException e) {
      logger.debug("{}: cancellation token failed: {}", name, e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("{}: interrupted during backoff, stopping", name);
      terminate(
          () -> new StreamCancelledException("Broadcaster " + name + " was interrupted", e),
          true);
    }
  }

  private void dispatch(T value) {
    List<Subscription<T>> snapshot;
    synchronized (lock) {
      snapshot = new ArrayList<>(subscriptions.values());
    }
    for (Subscription<T> subscription : snapshot) {
      subscription.offer(value);
    }
  }

  private void handleLoopFailure(Throwable error) {
    logger.error("{}: background task failed", name, error);
    lastError = error;
    terminate(() -> exhausted(error), false);
  }

  // ==================== State & Registry ====================

  /**
   * Moves to STOPPED and delivers a terminal signal to every registered receiver.
   *
   * @return false if the broadcaster was already stopped
   */
  private boolean terminate(Supplier<StreamingException> signal, boolean discardBuffered) {
    List<Subscription<T>> snapshot;
    StreamSession<T> session;
    synchronized (lock) {
      if (state == BroadcasterState.STOPPED) {
        return false;
      }
      setStateLocked(BroadcasterState.STOPPED);
      snapshot = new ArrayList<>(subscriptions.values());
      subscriptions.clear();
      session = activeSession;
      activeSession = null;
    }

    loopTask.cancel();
    if (session != null) {
      session.close();
    }
    for (Subscription<T> subscription : snapshot) {
      subscription.finish(signal.get(), discardBuffered);
    }
    if (ownsExecutor) {
      executor.shutdown();
    }
    return true;
  }

  private boolean attachSession(StreamSession<T> session) {
    synchronized (lock) {
      if (state == BroadcasterState.STOPPED) {
        return false;
      }
      activeSession = session;
      setStateLocked(BroadcasterState.STREAMING);
      return true;
    }
  }

  private void detachSession(StreamSession<T> session) {
    synchronized (lock) {
      if (activeSession == session) {
        activeSession = null;
      }
    }
  }

  private void deregister(long id) {
    boolean removed;
    synchronized (lock) {
      removed = subscriptions.remove(id) != null;
    }
    if (removed) {
      logger.debug("{}: deregistered receiver {}", name, id);
    }
  }

  private boolean setState(BroadcasterState newState) {
    synchronized (lock) {
      if (state == BroadcasterState.STOPPED) {
        return false;
      }
      setStateLocked(newState);
      return true;
    }
  }

  private void setStateLocked(BroadcasterState newState) {
    if (state != newState) {
      logger.debug("{}: state {} -> {}", name, state, newState);
      state = newState;
    }
  }

  // ==================== Utility Methods ====================

  private StreamConnectException connectError(RuntimeException e) {
    return new StreamConnectException("Failed to open stream " + name + ": " + e.getMessage(), e);
  }

  private RetriesExhaustedException exhausted(@Nullable Throwable cause) {
    return new RetriesExhaustedException(
        "Stream " + name + " gave up reconnecting " + retryStrategy.progress(), cause);
  }

  private static ExecutorService createDefaultExecutor(String name) {
    ThreadFactory factory =
        r -> {
          Thread t = new Thread(r);
          t.setDaemon(true);
          t.setName("StreamBroadcaster-" + name + "-" + THREAD_COUNTER.getAndIncrement());
          return t;
        };
    return Executors.newSingleThreadExecutor(factory);
  }
}
