package com.databricks.streaming;

/** A receiver was requested from a broadcaster that has already stopped. */
public class BroadcasterStoppedException extends StreamingException {

  public BroadcasterStoppedException(String message) {
    super(message);
  }
}
