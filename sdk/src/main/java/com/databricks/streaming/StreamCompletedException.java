package com.databricks.streaming;

/**
 * The upstream stream ended normally and the broadcaster is configured to treat that as
 * completion.
 *
 * <p>Thrown by {@link Receiver#receive()} once all buffered values have been consumed. Iterating a
 * {@link Receiver} ends quietly instead.
 *
 * @see BroadcasterOptions#completeOnEndOfStream()
 */
public class StreamCompletedException extends StreamingException {

  public StreamCompletedException(String message) {
    super(message);
  }
}
