package com.databricks.streaming;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nonnull;

/**
 * A consumer's endpoint on a {@link ResilientStreamBroadcaster}.
 *
 * <p>Each receiver has its own bounded buffer, so a slow receiver never blocks or loses values for
 * another one. Values arrive in the order the upstream produced them, starting with the first value
 * observed after the receiver was created.
 *
 * <p>Implements {@link AutoCloseable} and {@link Iterable}:
 *
 * <pre>{@code
 * try (Receiver<Reading> receiver = broadcaster.newReceiver()) {
 *     for (Reading reading : receiver) {
 *         process(reading);
 *     }
 *     // iteration ends when the broadcaster stops
 *     receiver.getTerminalError().ifPresent(e -> logger.warn("Stream ended", e));
 * }
 * }</pre>
 *
 * @param <T> The value type
 */
public final class Receiver<T> implements Iterable<T>, AutoCloseable {

  private final Subscription<T> subscription;
  private final Runnable deregister;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile StreamingException terminalError;

  Receiver(Subscription<T> subscription, Runnable deregister) {
    this.subscription = subscription;
    this.deregister = deregister;
  }

  /**
   * Waits for the next value.
   *
   * @return the next value
   * @throws RetriesExhaustedException if the broadcaster gave up reconnecting
   * @throws StreamCancelledException if the broadcaster was stopped
   * @throws StreamCompletedException if the upstream completed
   * @throws ReceiverClosedException if this receiver is closed, or already reported one of the above
   * @throws StreamingException if the calling thread was interrupted
   */
  @Nonnull
  public T receive() throws StreamingException {
    return awaitValue(-1L);
  }

  /**
   * Waits at most the given time for the next value.
   *
   * @param timeout the maximum time to wait
   * @param unit the time unit of the timeout
   * @return the next value, or an empty Optional if the timeout elapsed
   * @throws StreamingException as for {@link #receive()}
   */
  @Nonnull
  public Optional<T> receive(long timeout, @Nonnull TimeUnit unit) throws StreamingException {
    return Optional.ofNullable(awaitValue(Math.max(0L, unit.toNanos(timeout))));
  }

  /**
   * Returns the next value if one is buffered, without waiting.
   *
   * @return the next value, or an empty Optional
   * @throws StreamingException as for {@link #receive()}
   */
  @Nonnull
  public Optional<T> tryReceive() throws StreamingException {
    return Optional.ofNullable(awaitValue(0L));
  }

  private T awaitValue(long timeoutNanos) {
    try {
      return subscription.take(timeoutNanos);
    } catch (ReceiverClosedException e) {
      throw e;
    } catch (StreamingException e) {
      terminalError = e;
      close();
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StreamingException("Interrupted while waiting for a value", e);
    }
  }

  /**
   * Closes this receiver and removes it from the broadcaster. Buffered values are discarded.
   * Idempotent.
   */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      subscription.close();
      deregister.run();
    }
  }

  /** Returns whether this receiver is closed, either explicitly or after a terminal signal. */
  public boolean isClosed() {
    return closed.get() || subscription.isClosed();
  }

  /**
   * Returns the terminal signal this receiver observed, if any.
   *
   * @return the exception that ended the stream for this receiver, or an empty Optional
   */
  @Nonnull
  public Optional<StreamingException> getTerminalError() {
    return Optional.ofNullable(terminalError);
  }

  /** Returns the number of values discarded because this receiver's buffer was full. */
  public long droppedCount() {
    return subscription.droppedCount();
  }

  /** Returns the number of values waiting to be received. */
  public int bufferedCount() {
    return subscription.size();
  }

  /** Returns the id of this receiver, unique within its broadcaster. */
  public long getId() {
    return subscription.id();
  }

  /**
   * Returns a lazy iterator over the values of this receiver.
   *
   * <p>{@link Iterator#hasNext()} blocks until a value is available and returns false once the
   * receiver is closed or has observed a terminal signal, which is then available from {@link
   * #getTerminalError()}. Iterators share this receiver's buffer.
   */
  @Override
  @Nonnull
  public Iterator<T> iterator() {
    return new Iterator<T>() {
      private T next;

      @Override
      public boolean hasNext() {
        if (next != null) {
          return true;
        }
        try {
          next = receive();
          return true;
        } catch (ReceiverClosedException
            | StreamCancelledException
            | StreamCompletedException
            | RetriesExhaustedException e) {
          return false;
        }
      }

      @Override
      public T next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        T value = next;
        next = null;
        return value;
      }
    };
  }
}
