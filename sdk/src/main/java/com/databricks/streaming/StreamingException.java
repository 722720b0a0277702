package com.databricks.streaming;

/**
 * Base exception class for all stream broadcaster errors.
 *
 * <p>This is an unchecked exception (extends {@link RuntimeException}). Callers can catch this
 * exception or let it propagate up the call stack.
 *
 * <p>Connection and stream failures ({@link StreamConnectException}, {@link StreamReadException})
 * are handled by the broadcaster's retry loop and only reach callers as the cause of a {@link
 * RetriesExhaustedException}. The remaining subclasses are terminal signals or local usage errors:
 *
 * <ul>
 *   <li>{@link RetriesExhaustedException} - the retry strategy gave up
 *   <li>{@link StreamCancelledException} - the broadcaster was stopped
 *   <li>{@link StreamCompletedException} - the upstream ended and completion is configured
 *   <li>{@link BroadcasterStoppedException} - a receiver was requested after stop
 *   <li>{@link ReceiverClosedException} - a closed receiver was read from
 * </ul>
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * try {
 *     Reading reading = receiver.receive();
 * } catch (RetriesExhaustedException e) {
 *     logger.error("Upstream is gone for good", e.getCause());
 * } catch (StreamingException e) {
 *     logger.info("Receiver finished: {}", e.getMessage());
 * }
 * }</pre>
 */
public class StreamingException extends RuntimeException {

  /**
   * Constructs a new StreamingException with the specified detail message.
   *
   * @param message the detail message
   */
  public StreamingException(String message) {
    super(message);
  }

  /**
   * Constructs a new StreamingException with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   */
  public StreamingException(String message, Throwable cause) {
    super(message, cause);
  }
}
