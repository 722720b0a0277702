package com.databricks.streaming.stream;

import com.databricks.streaming.StreamConnectException;
import javax.annotation.Nonnull;

/**
 * Opens a new {@link StreamSession}. Invoked by the broadcaster every time it (re)connects.
 *
 * <p>Implementations should return quickly; a failure to reach the upstream that is only known
 * later may instead surface from the session's first {@link StreamSession#advance()}.
 *
 * @param <T> The value type produced by the stream
 */
@FunctionalInterface
public interface StreamSessionFactory<T> {

  /**
   * Opens a new session.
   *
   * @return a fresh session
   * @throws StreamConnectException if the session could not be opened
   */
  @Nonnull
  StreamSession<T> open() throws StreamConnectException;
}
