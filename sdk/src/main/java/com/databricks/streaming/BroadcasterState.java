package com.databricks.streaming;

/**
 * Represents the lifecycle state of a {@link ResilientStreamBroadcaster}.
 *
 * <p>State transitions follow this pattern:
 *
 * <pre>
 * IDLE → CONNECTING → STREAMING → STOPPED
 *           ↑   ↓         ↓
 *           BACKOFF ←─────┘
 * </pre>
 *
 * <p>{@code STOPPED} is reachable from every state through {@link ResilientStreamBroadcaster#stop()}.
 */
public enum BroadcasterState {
  /** Broadcaster created but not yet started */
  IDLE,

  /** The stream session factory is being invoked */
  CONNECTING,

  /** A session is open and values are being dispatched to receivers */
  STREAMING,

  /** Waiting for the delay granted by the retry strategy before reconnecting */
  BACKOFF,

  /**
   * Terminal state.
   *
   * <p>Reached when a caller stops the broadcaster, when the retry strategy gives up, or when the
   * upstream ends and completion on end of stream is configured.
   */
  STOPPED
}
