package com.databricks.streaming;

/** A value was requested from a receiver that has been closed. */
public class ReceiverClosedException extends StreamingException {

  public ReceiverClosedException(String message) {
    super(message);
  }
}
