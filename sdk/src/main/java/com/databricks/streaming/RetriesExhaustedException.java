package com.databricks.streaming;

/**
 * The retry strategy gave up on reconnecting. The cause is the failure of the last attempt.
 *
 * <p>Delivered to every open receiver, after the values buffered before the failure.
 */
public class RetriesExhaustedException extends StreamingException {

  public RetriesExhaustedException(String message, Throwable cause) {
    super(message, cause);
  }
}
