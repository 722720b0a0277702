package com.databricks.streaming;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;

/** Tests for broadcaster configuration and options. */
public class BroadcasterOptionsTest {

  @Test
  public void testDefaults() {
    BroadcasterOptions options = BroadcasterOptions.getDefault();

    assertEquals(50, options.receiverBufferSize());
    assertEquals(OverflowPolicy.DROP_OLDEST, options.overflowPolicy());
    assertEquals(100, options.overflowBlockTimeoutMs());
    assertFalse(options.completeOnEndOfStream());
    assertFalse(options.stopOnNonRetriableError());
    assertEquals(5000, options.stopTimeoutMs());
    assertFalse(options.executor().isPresent());
  }

  @Test
  public void testBuilderOverrides() {
    BroadcasterOptions options =
        BroadcasterOptions.builder()
            .setReceiverBufferSize(200)
            .setOverflowPolicy(OverflowPolicy.BLOCK)
            .setOverflowBlockTimeoutMs(250)
            .setCompleteOnEndOfStream(true)
            .setStopOnNonRetriableError(true)
            .setStopTimeoutMs(1000)
            .build();

    assertEquals(200, options.receiverBufferSize());
    assertEquals(OverflowPolicy.BLOCK, options.overflowPolicy());
    assertEquals(250, options.overflowBlockTimeoutMs());
    assertTrue(options.completeOnEndOfStream());
    assertTrue(options.stopOnNonRetriableError());
    assertEquals(1000, options.stopTimeoutMs());
  }

  @Test
  public void testToBuilderPreservesValues() {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      BroadcasterOptions original =
          BroadcasterOptions.builder()
              .setReceiverBufferSize(7)
              .setCompleteOnEndOfStream(true)
              .setExecutor(executor)
              .build();

      BroadcasterOptions copy = original.toBuilder().setStopTimeoutMs(10).build();

      assertEquals(7, copy.receiverBufferSize());
      assertTrue(copy.completeOnEndOfStream());
      assertSame(executor, copy.executor().get());
      assertEquals(10, copy.stopTimeoutMs());
      assertEquals(5000, original.stopTimeoutMs());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void testInvalidBufferSize() {
    assertThrows(
        IllegalArgumentException.class,
        () -> BroadcasterOptions.builder().setReceiverBufferSize(0));
  }

  @Test
  public void testNegativeBlockTimeout() {
    assertThrows(
        IllegalArgumentException.class,
        () -> BroadcasterOptions.builder().setOverflowBlockTimeoutMs(-1));
  }
}
