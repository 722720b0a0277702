package com.databricks.streaming;

/**
 * The stream session factory could not open a session.
 *
 * <p>Handled by the broadcaster's retry loop; callers only see it as the cause of a {@link
 * RetriesExhaustedException}.
 */
public class StreamConnectException extends StreamingException {

  public StreamConnectException(String message) {
    super(message);
  }

  public StreamConnectException(String message, Throwable cause) {
    super(message, cause);
  }
}
