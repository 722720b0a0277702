package com.databricks.streaming;

/** The broadcaster was stopped by a caller. Delivered to every receiver that was still open. */
public class StreamCancelledException extends StreamingException {

  public StreamCancelledException(String message) {
    super(message);
  }

  public StreamCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
