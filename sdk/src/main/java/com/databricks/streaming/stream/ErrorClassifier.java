package com.databricks.streaming.stream;

import com.databricks.streaming.StreamingException;
import javax.annotation.Nonnull;

/**
 * Maps transport-specific failures onto the broadcaster's error taxonomy.
 *
 * <p>The result must be one of {@link com.databricks.streaming.StreamConnectException}, {@link
 * com.databricks.streaming.StreamReadException}, {@link
 * com.databricks.streaming.StreamCancelledException} or {@link
 * com.databricks.streaming.NonRetriableException}.
 */
@FunctionalInterface
public interface ErrorClassifier {

  /** When a failure happened relative to the life of a session. */
  enum Phase {
    /** Before the session delivered anything. */
    CONNECT,
    /** After the session delivered at least one value. */
    STREAM
  }

  /**
   * Classifies a failure.
   *
   * @param error the transport failure
   * @param phase when the failure happened
   * @return the classified exception, with {@code error} as its cause
   */
  @Nonnull
  StreamingException classify(@Nonnull Throwable error, @Nonnull Phase phase);
}
