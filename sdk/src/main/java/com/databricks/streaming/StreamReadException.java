package com.databricks.streaming;

/**
 * An open stream session failed while values were being read from it.
 *
 * <p>Handled by the broadcaster's retry loop; callers only see it as the cause of a {@link
 * RetriesExhaustedException}.
 */
public class StreamReadException extends StreamingException {

  public StreamReadException(String message) {
    super(message);
  }

  public StreamReadException(String message, Throwable cause) {
    super(message, cause);
  }
}
