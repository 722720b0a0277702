package com.databricks.streaming;

/**
 * What a receiver's buffer does when a new value arrives and the buffer is full.
 *
 * <p>The upstream is never slowed down for longer than {@link
 * BroadcasterOptions#overflowBlockTimeoutMs()}, whichever policy is chosen.
 */
public enum OverflowPolicy {
  /** Discard the oldest buffered value to make room. Never blocks the dispatching thread. */
  DROP_OLDEST,

  /**
   * Wait for the receiver to make room, at most {@link BroadcasterOptions#overflowBlockTimeoutMs()},
   * then fall back to discarding the oldest value.
   */
  BLOCK
}
