package com.databricks.streaming.stream;

import static org.junit.jupiter.api.Assertions.*;

import com.databricks.streaming.BroadcasterOptions;
import com.databricks.streaming.NonRetriableException;
import com.databricks.streaming.Receiver;
import com.databricks.streaming.ResilientStreamBroadcaster;
import com.databricks.streaming.RetriesExhaustedException;
import com.databricks.streaming.StreamCompletedException;
import com.databricks.streaming.common.retry.ConstantRetryStrategy;
import com.databricks.streaming.common.retry.RetryStrategy;
import com.google.protobuf.Int64Value;
import io.grpc.CallOptions;
import io.grpc.ManagedChannel;
import io.grpc.MethodDescriptor;
import io.grpc.Server;
import io.grpc.ServerServiceDefinition;
import io.grpc.Status;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.protobuf.ProtoUtils;
import io.grpc.stub.ClientCalls;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.ServerCalls;
import io.grpc.stub.StreamObserver;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/**
 * End-to-end tests against an in-process gRPC server streaming counter values.
 *
 * <p>Each test installs a handler that decides, per connection, what the server sends.
 */
@Timeout(value = 15, unit = TimeUnit.SECONDS)
public class InProcessGrpcBroadcastTest {

  private static final MethodDescriptor<Int64Value, Int64Value> COUNT_METHOD =
      MethodDescriptor.<Int64Value, Int64Value>newBuilder()
          .setType(MethodDescriptor.MethodType.SERVER_STREAMING)
          .setFullMethodName(MethodDescriptor.generateFullMethodName("test.Counter", "Count"))
          .setRequestMarshaller(ProtoUtils.marshaller(Int64Value.getDefaultInstance()))
          .setResponseMarshaller(ProtoUtils.marshaller(Int64Value.getDefaultInstance()))
          .build();

  private static final RetryStrategy NO_DELAY = ConstantRetryStrategy.of(Duration.ZERO);

  private final AtomicInteger connections = new AtomicInteger(0);
  private Server server;
  private ManagedChannel channel;
  private ResilientStreamBroadcaster<Long> broadcaster;

  @AfterEach
  public void tearDown() throws InterruptedException {
    if (broadcaster != null) {
      broadcaster.stop();
    }
    if (channel != null) {
      channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
    }
    if (server != null) {
      server.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
    }
  }

  /** Starts the server; the handler receives the 1-based connection number. */
  private void startServer(BiConsumer<Integer, ServerCallStreamObserver<Int64Value>> handler)
      throws Exception {
    String name = InProcessServerBuilder.generateName();
    ServerServiceDefinition service =
        ServerServiceDefinition.builder("test.Counter")
            .addMethod(
                COUNT_METHOD,
                ServerCalls.asyncServerStreamingCall(
                    (Int64Value request, StreamObserver<Int64Value> responseObserver) ->
                        handler.accept(
                            connections.incrementAndGet(),
                            (ServerCallStreamObserver<Int64Value>) responseObserver)))
            .build();
    server = InProcessServerBuilder.forName(name).addService(service).build().start();
    channel = InProcessChannelBuilder.forName(name).build();
  }

  private StreamSessionFactory<Long> sessionFactory() {
    return GrpcStreamSession.factory(
        observer ->
            ClientCalls.asyncServerStreamingCall(
                channel.newCall(COUNT_METHOD, CallOptions.DEFAULT),
                Int64Value.getDefaultInstance(),
                observer),
        Int64Value::getValue);
  }

  private static void send(StreamObserver<Int64Value> observer, long... values) {
    for (long value : values) {
      observer.onNext(Int64Value.of(value));
    }
  }

  private static Long next(Receiver<Long> receiver) {
    return receiver
        .receive(5, TimeUnit.SECONDS)
        .orElseThrow(() -> new AssertionError("Timed out waiting for a value"));
  }

  @Test
  public void testResumesAfterServerFailure() throws Exception {
    CountDownLatch cancelled = new CountDownLatch(1);
    startServer(
        (connection, observer) -> {
          if (connection == 1) {
            send(observer, 1, 2);
            observer.onError(Status.UNAVAILABLE.withDescription("restarting").asRuntimeException());
          } else {
            observer.setOnCancelHandler(cancelled::countDown);
            send(observer, 3);
          }
        });

    broadcaster =
        ResilientStreamBroadcaster.create(
            "counter", sessionFactory(), NO_DELAY, BroadcasterOptions.getDefault());
    Receiver<Long> receiver = broadcaster.newReceiver();
    broadcaster.start();

    assertEquals(
        Arrays.asList(1L, 2L, 3L), Arrays.asList(next(receiver), next(receiver), next(receiver)));
    assertEquals(2, connections.get());

    broadcaster.stop();
    assertTrue(cancelled.await(5, TimeUnit.SECONDS));
  }

  @Test
  public void testCompletesWhenServerFinishes() throws Exception {
    startServer(
        (connection, observer) -> {
          send(observer, 10, 20, 30);
          observer.onCompleted();
        });

    broadcaster =
        ResilientStreamBroadcaster.create(
            "counter",
            sessionFactory(),
            NO_DELAY,
            BroadcasterOptions.builder().setCompleteOnEndOfStream(true).build());
    Receiver<Long> receiver = broadcaster.newReceiver();
    broadcaster.start();

    List<Long> values = new ArrayList<>();
    for (Long value : receiver) {
      values.add(value);
    }

    assertEquals(Arrays.asList(10L, 20L, 30L), values);
    assertTrue(receiver.getTerminalError().get() instanceof StreamCompletedException);
    assertEquals(1, connections.get());
  }

  @Test
  public void testGivesUpOnPermissionDenied() throws Exception {
    startServer(
        (connection, observer) -> observer.onError(Status.PERMISSION_DENIED.asRuntimeException()));

    broadcaster =
        ResilientStreamBroadcaster.create(
            "counter",
            sessionFactory(),
            NO_DELAY,
            BroadcasterOptions.builder().setStopOnNonRetriableError(true).build());
    Receiver<Long> receiver = broadcaster.newReceiver();
    broadcaster.start();

    RetriesExhaustedException e = assertThrows(RetriesExhaustedException.class, receiver::receive);
    assertTrue(e.getCause() instanceof NonRetriableException);
    assertEquals(1, connections.get());
  }
}
