package com.databricks.streaming;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Tests for the consumer handle. */
@Timeout(value = 10, unit = TimeUnit.SECONDS)
public class ReceiverTest {

  private final AtomicInteger deregistrations = new AtomicInteger(0);

  private Receiver<String> receiver(Subscription<String> subscription) {
    return new Receiver<>(subscription, deregistrations::incrementAndGet);
  }

  private static Subscription<String> subscription() {
    return new Subscription<>(7, 10, OverflowPolicy.DROP_OLDEST, 0);
  }

  @Test
  public void testReceiveVariants() {
    Subscription<String> subscription = subscription();
    Receiver<String> receiver = receiver(subscription);
    subscription.offer("a");
    subscription.offer("b");

    assertEquals(7, receiver.getId());
    assertEquals(2, receiver.bufferedCount());
    assertEquals("a", receiver.receive());
    assertEquals("b", receiver.tryReceive().get());
    assertFalse(receiver.tryReceive().isPresent());
    assertFalse(receiver.receive(10, TimeUnit.MILLISECONDS).isPresent());
  }

  @Test
  public void testTerminalErrorClosesReceiver() {
    Subscription<String> subscription = subscription();
    Receiver<String> receiver = receiver(subscription);
    RetriesExhaustedException signal =
        new RetriesExhaustedException("gave up", new StreamConnectException("refused"));
    subscription.finish(signal, false);

    assertThrows(RetriesExhaustedException.class, receiver::receive);

    assertSame(signal, receiver.getTerminalError().get());
    assertTrue(receiver.isClosed());
    assertEquals(1, deregistrations.get());
    assertThrows(ReceiverClosedException.class, receiver::receive);
  }

  @Test
  public void testCloseIsIdempotent() {
    Receiver<String> receiver = receiver(subscription());

    receiver.close();
    receiver.close();

    assertEquals(1, deregistrations.get());
    assertTrue(receiver.isClosed());
    assertFalse(receiver.getTerminalError().isPresent());
    assertThrows(ReceiverClosedException.class, receiver::tryReceive);
  }

  @Test
  public void testCloseFromAnotherThreadWakesReceive() throws Exception {
    Receiver<String> receiver = receiver(subscription());

    CompletableFuture<String> pending = CompletableFuture.supplyAsync(receiver::receive);
    Thread.sleep(20);
    receiver.close();

    Exception e = assertThrows(Exception.class, () -> pending.get(5, TimeUnit.SECONDS));
    assertTrue(e.getCause() instanceof ReceiverClosedException);
  }

  @Test
  public void testInterruptedReceive() {
    Receiver<String> receiver = receiver(subscription());

    Thread.currentThread().interrupt();
    try {
      StreamingException e = assertThrows(StreamingException.class, receiver::receive);
      assertTrue(e.getCause() instanceof InterruptedException);
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
    assertFalse(receiver.isClosed());
  }

  // ==================== Iteration ====================

  @Test
  public void testIterationEndsOnTerminalSignal() {
    Subscription<String> subscription = subscription();
    Receiver<String> receiver = receiver(subscription);
    subscription.offer("a");
    subscription.offer("b");
    subscription.finish(new StreamCompletedException("done"), false);

    List<String> values = new ArrayList<>();
    for (String value : receiver) {
      values.add(value);
    }

    assertEquals(Arrays.asList("a", "b"), values);
    assertTrue(receiver.getTerminalError().get() instanceof StreamCompletedException);
  }

  @Test
  public void testIteratorAfterClose() {
    Receiver<String> receiver = receiver(subscription());
    receiver.close();

    Iterator<String> iterator = receiver.iterator();

    assertFalse(iterator.hasNext());
    assertThrows(NoSuchElementException.class, iterator::next);
  }
}
