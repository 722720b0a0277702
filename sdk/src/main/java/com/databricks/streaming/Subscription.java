package com.databricks.streaming;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded per-receiver buffer: values flow in from the dispatch thread and out to the receiver.
 *
 * <p>This class provides thread-safe coordination between:
 *
 * <ul>
 *   <li>The broadcaster's background task calling {@link #offer} and {@link #finish}
 *   <li>The consumer calling {@link #take} through its {@link Receiver}
 *   <li>Any thread calling {@link #close}
 * </ul>
 *
 * <p>A terminal signal is kept apart from the values so that overflow never discards it. It is
 * handed out once, after the buffered values unless the buffer was discarded.
 *
 * @param <T> The value type
 */
final class Subscription<T> {
  private static final Logger logger = LoggerFactory.getLogger(Subscription.class);

  private final long id;
  private final int capacity;
  private final OverflowPolicy overflowPolicy;
  private final long blockTimeoutNanos;

  private final ArrayDeque<T> buffer = new ArrayDeque<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();

  private StreamingException terminal;
  private boolean closed = false;
  private long droppedCount = 0;

  /**
   * Creates a new subscription.
   *
   * @param id Unique id within the owning broadcaster
   * @param capacity Maximum number of buffered values
   * @param overflowPolicy What to do when a value arrives and the buffer is full
   * @param blockTimeoutMs How long {@link OverflowPolicy#BLOCK} waits for room
   */
  Subscription(long id, int capacity, OverflowPolicy overflowPolicy, long blockTimeoutMs) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be at least 1: " + capacity);
    }
    this.id = id;
    this.capacity = capacity;
    this.overflowPolicy = overflowPolicy;
    this.blockTimeoutNanos = TimeUnit.MILLISECONDS.toNanos(blockTimeoutMs);
  }

  long id() {
    return id;
  }

  /**
   * Adds a value, applying the overflow policy if the buffer is full.
   *
   * @param value The value to add
   * @return false if the subscription no longer accepts values
   */
  boolean offer(T value) {
    lock.lock();
    try {
      if (closed || terminal != null) {
        return false;
      }
      if (buffer.size() >= capacity && overflowPolicy == OverflowPolicy.BLOCK) {
        long nanos = blockTimeoutNanos;
        while (buffer.size() >= capacity && !closed && terminal == null && nanos > 0) {
          nanos = notFull.awaitNanos(nanos);
        }
        if (closed || terminal != null) {
          return false;
        }
      }
      if (buffer.size() >= capacity) {
        buffer.pollFirst();
        droppedCount++;
        if (droppedCount == 1 || droppedCount % 1000 == 0) {
          logger.warn(
              "Receiver {} is too slow, dropped {} value(s) so far (buffer size {})",
              id,
              droppedCount,
              capacity);
        }
      }
      buffer.addLast(value);
      notEmpty.signal();
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Ends the subscription with a terminal signal. Only the first call has an effect.
   *
   * @param signal The exception the receiver observes once the buffer is drained
   * @param discardBuffered Whether values still in the buffer are dropped
   */
  void finish(StreamingException signal, boolean discardBuffered) {
    lock.lock();
    try {
      if (closed || terminal != null) {
        return;
      }
      terminal = signal;
      if (discardBuffered) {
        buffer.clear();
      }
      notEmpty.signalAll();
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Takes the next value, waiting if necessary.
   *
   * @param timeoutNanos Maximum time to wait, or a negative value to wait indefinitely
   * @return The next value, or null if the timeout elapsed
   * @throws ReceiverClosedException if the subscription is closed
   * @throws StreamingException the terminal signal, exactly once, after which the subscription
   *     counts as closed
   * @throws InterruptedException if interrupted while waiting
   */
  @Nullable T take(long timeoutNanos) throws InterruptedException {
    long nanos = timeoutNanos;
    lock.lock();
    try {
      while (true) {
        if (closed) {
          throw new ReceiverClosedException("Receiver " + id + " is closed");
        }
        T value = buffer.pollFirst();
        if (value != null) {
          notFull.signal();
          return value;
        }
        if (terminal != null) {
          closed = true;
          throw terminal;
        }
        if (timeoutNanos < 0) {
          notEmpty.await();
        } else {
          if (nanos <= 0) {
            return null;
          }
          nanos = notEmpty.awaitNanos(nanos);
        }
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes the subscription and releases its buffer, waking up any blocked threads.
   *
   * @return true if this call closed it
   */
  boolean close() {
    lock.lock();
    try {
      if (closed) {
        return false;
      }
      closed = true;
      buffer.clear();
      notEmpty.signalAll();
      notFull.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Returns whether the subscription is closed. */
  boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  /** Returns the number of buffered values. */
  int size() {
    lock.lock();
    try {
      return buffer.size();
    } finally {
      lock.unlock();
    }
  }

  /** Returns the number of values discarded because the buffer was full. */
  long droppedCount() {
    lock.lock();
    try {
      return droppedCount;
    } finally {
      lock.unlock();
    }
  }
}
