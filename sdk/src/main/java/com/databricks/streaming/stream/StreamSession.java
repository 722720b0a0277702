package com.databricks.streaming.stream;

import com.databricks.streaming.StreamCancelledException;
import com.databricks.streaming.StreamReadException;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * One attempt at consuming the upstream stream.
 *
 * <p>A session is single-use: once {@link #advance()} has reported the end of the stream or thrown,
 * the session is closed and discarded. {@link #close()} must release the underlying call on every
 * exit path and may be called from another thread to unblock a pending {@link #advance()}.
 *
 * @param <T> The value type produced by the stream
 */
public interface StreamSession<T> extends AutoCloseable {

  /**
   * Waits for the next value of the stream.
   *
   * @return the next value, or an empty Optional if the stream ended normally
   * @throws StreamReadException if the stream failed
   * @throws StreamCancelledException if the session was closed while waiting
   */
  @Nonnull
  Optional<T> advance() throws StreamReadException, StreamCancelledException;

  /** Releases the underlying call. Idempotent. */
  @Override
  void close();
}
