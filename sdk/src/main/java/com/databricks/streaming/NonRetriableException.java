package com.databricks.streaming;

/**
 * An exception that indicates a non-retriable error has occurred.
 *
 * <p>Raised by an {@link com.databricks.streaming.stream.ErrorClassifier} when the upstream
 * rejected the call in a way that retrying cannot fix. Common causes include:
 *
 * <ul>
 *   <li>Invalid credentials
 *   <li>Unknown stream or insufficient permissions
 *   <li>Invalid request arguments
 *   <li>A method the server does not implement
 * </ul>
 *
 * <p>By default the broadcaster still retries these errors according to its retry strategy. With
 * {@link BroadcasterOptions#stopOnNonRetriableError()} enabled, it gives up immediately instead.
 *
 * @see StreamingException
 */
public class NonRetriableException extends StreamingException {

  /**
   * Constructs a new NonRetriableException with the specified detail message.
   *
   * @param message the detail message
   */
  public NonRetriableException(String message) {
    super(message);
  }

  /**
   * Constructs a new NonRetriableException with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   */
  public NonRetriableException(String message, Throwable cause) {
    super(message, cause);
  }
}
