package com.databricks.streaming.stream;

import com.databricks.streaming.StreamCancelledException;
import com.databricks.streaming.StreamReadException;
import com.databricks.streaming.StreamingException;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;
import io.grpc.stub.StreamObserver;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;
import java.util.function.Function;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StreamSession} over an asynchronous gRPC server-streaming call.
 *
 * <p>Responses are queued by the gRPC callback thread and handed out by {@link #advance()}, which
 * applies the transform on the reading thread. {@link #close()} cancels the call if it is still
 * running and wakes up a blocked reader.
 *
 * <p>Typical use with a generated async stub:
 *
 * <pre>{@code
 * StreamSessionFactory<Reading> factory =
 *     GrpcStreamSession.factory(
 *         observer -> stub.streamReadings(request, observer),
 *         Reading::fromProto);
 * }</pre>
 *
 * @param <R> The gRPC response message type
 * @param <T> The value type handed to receivers
 */
public final class GrpcStreamSession<R, T> implements StreamSession<T> {
  private static final Logger logger = LoggerFactory.getLogger(GrpcStreamSession.class);

  private final Function<? super R, ? extends T> transform;
  private final ErrorClassifier errorClassifier;
  private final BlockingQueue<Event<R>> queue = new LinkedBlockingQueue<>();
  private final ResponseObserver observer = new ResponseObserver();

  private volatile ClientCallStreamObserver<?> call;
  private volatile boolean finished = false;
  private volatile boolean closed = false;
  private boolean delivered = false;
  private Event<R> terminal;

  private GrpcStreamSession(
      Function<? super R, ? extends T> transform, ErrorClassifier errorClassifier) {
    this.transform = transform;
    this.errorClassifier = errorClassifier;
  }

  /**
   * Creates a factory that opens a new gRPC call for every session.
   *
   * @param call starts the server-streaming call with the given response observer
   * @param transform converts each response into the value handed to receivers
   * @param <R> The gRPC response message type
   * @param <T> The value type handed to receivers
   * @return a session factory
   */
  @Nonnull
  public static <R, T> StreamSessionFactory<T> factory(
      @Nonnull Consumer<StreamObserver<R>> call,
      @Nonnull Function<? super R, ? extends T> transform) {
    return factory(call, transform, GrpcErrorClassifier.INSTANCE);
  }

  /**
   * Creates a factory that opens a new gRPC call for every session.
   *
   * @param call starts the server-streaming call with the given response observer
   * @param transform converts each response into the value handed to receivers
   * @param errorClassifier maps gRPC failures onto the broadcaster's error taxonomy
   * @param <R> The gRPC response message type
   * @param <T> The value type handed to receivers
   * @return a session factory
   */
  @Nonnull
  public static <R, T> StreamSessionFactory<T> factory(
      @Nonnull Consumer<StreamObserver<R>> call,
      @Nonnull Function<? super R, ? extends T> transform,
      @Nonnull ErrorClassifier errorClassifier) {
    Objects.requireNonNull(call, "call cannot be null");
    Objects.requireNonNull(transform, "transform cannot be null");
    Objects.requireNonNull(errorClassifier, "errorClassifier cannot be null");
    return () -> {
      GrpcStreamSession<R, T> session = new GrpcStreamSession<>(transform, errorClassifier);
      try {
        call.accept(session.observer());
      } catch (RuntimeException e) {
        session.close();
        throw errorClassifier.classify(e, ErrorClassifier.Phase.CONNECT);
      }
      return session;
    };
  }

  /** Returns the observer to pass to the stub call. */
  @Nonnull
  StreamObserver<R> observer() {
    return observer;
  }

  @Override
  @Nonnull
  public Optional<T> advance() {
    if (terminal == null && closed) {
      terminal = Event.closed();
    }
    if (terminal == null) {
      try {
        Event<R> event = queue.take();
        if (event.kind == Event.Kind.RESPONSE) {
          return Optional.of(apply(event.response));
        }
        terminal = event;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        close();
        throw new StreamCancelledException("Interrupted while waiting for the stream", e);
      }
    }

    switch (terminal.kind) {
      case END_OF_STREAM:
        return Optional.empty();
      case FAILURE:
        throw errorClassifier.classify(
            terminal.cause,
            delivered ? ErrorClassifier.Phase.STREAM : ErrorClassifier.Phase.CONNECT);
      default:
        throw new StreamCancelledException("Stream session closed");
    }
  }

  private T apply(R response) {
    T value;
    try {
      value = transform.apply(response);
    } catch (RuntimeException e) {
      fail();
      if (e instanceof StreamingException) {
        throw e;
      }
      throw new StreamReadException("Failed to transform stream response", e);
    }
    if (value == null) {
      fail();
      throw new StreamReadException("Transform returned null");
    }
    delivered = true;
    return value;
  }

  private void fail() {
    close();
    terminal = Event.closed();
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    ClientCallStreamObserver<?> current = call;
    if (!finished && current != null) {
      try {
        current.cancel("Stream session closed", null);
      } catch (RuntimeException e) {
        logger.debug("Error while cancelling gRPC call: {}", e.getMessage());
      }
    }
    queue.offer(Event.<R>closed());
  }

  /** Returns whether the underlying call has completed or failed. */
  boolean isFinished() {
    return finished;
  }

  /** An item handed from the gRPC callback thread to the reader. */
  private static final class Event<R> {
    enum Kind {
      RESPONSE,
      END_OF_STREAM,
      FAILURE,
      CLOSED
    }

    final Kind kind;
    final R response;
    final Throwable cause;

    private Event(Kind kind, R response, Throwable cause) {
      this.kind = kind;
      this.response = response;
      this.cause = cause;
    }

    static <R> Event<R> response(R response) {
      return new Event<>(Kind.RESPONSE, response, null);
    }

    static <R> Event<R> endOfStream() {
      return new Event<>(Kind.END_OF_STREAM, null, null);
    }

    static <R> Event<R> failure(Throwable cause) {
      return new Event<>(Kind.FAILURE, null, cause);
    }

    static <R> Event<R> closed() {
      return new Event<>(Kind.CLOSED, null, null);
    }
  }

  private final class ResponseObserver implements ClientResponseObserver<Object, R> {

    @Override
    public void beforeStart(ClientCallStreamObserver<Object> requestStream) {
      call = requestStream;
      if (closed) {
        requestStream.cancel("Stream session closed", null);
      }
    }

    @Override
    public void onNext(R response) {
      if (!closed) {
        queue.offer(Event.response(response));
      }
    }

    @Override
    public void onError(Throwable t) {
      finished = true;
      if (closed) {
        logger.debug("Ignoring error on closed session: {}", t.getMessage());
        return;
      }
      queue.offer(Event.<R>failure(t));
    }

    @Override
    public void onCompleted() {
      finished = true;
      queue.offer(Event.<R>endOfStream());
    }
  }
}
