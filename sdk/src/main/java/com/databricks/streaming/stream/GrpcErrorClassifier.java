package com.databricks.streaming.stream;

import com.databricks.streaming.NonRetriableException;
import com.databricks.streaming.StreamCancelledException;
import com.databricks.streaming.StreamConnectException;
import com.databricks.streaming.StreamReadException;
import com.databricks.streaming.StreamingException;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import java.util.HashSet;
import java.util.Set;
import javax.annotation.Nonnull;

/** Classifies gRPC failures by status code. */
public class GrpcErrorClassifier implements ErrorClassifier {

  /** Shared instance; the classifier is stateless. */
  public static final GrpcErrorClassifier INSTANCE = new GrpcErrorClassifier();

  private static final Set<Status.Code> NON_RETRIABLE_CODES = new HashSet<>();

  static {
    NON_RETRIABLE_CODES.add(Status.Code.INVALID_ARGUMENT);
    NON_RETRIABLE_CODES.add(Status.Code.NOT_FOUND);
    NON_RETRIABLE_CODES.add(Status.Code.UNAUTHENTICATED);
    NON_RETRIABLE_CODES.add(Status.Code.PERMISSION_DENIED);
    NON_RETRIABLE_CODES.add(Status.Code.UNIMPLEMENTED);
    NON_RETRIABLE_CODES.add(Status.Code.OUT_OF_RANGE);
  }

  public static boolean isNonRetriable(Status.Code code) {
    return NON_RETRIABLE_CODES.contains(code);
  }

  @Override
  @Nonnull
  public StreamingException classify(@Nonnull Throwable error, @Nonnull Phase phase) {
    if (error instanceof StreamingException) {
      return (StreamingException) error;
    }
    Status status = statusOf(error);
    if (status != null) {
      Status.Code code = status.getCode();
      if (code == Status.Code.CANCELLED) {
        return new StreamCancelledException("gRPC call cancelled: " + error.getMessage(), error);
      }
      if (isNonRetriable(code)) {
        return new NonRetriableException("Non-retriable gRPC error: " + error.getMessage(), error);
      }
    }
    if (phase == Phase.CONNECT) {
      return new StreamConnectException("Failed to open stream: " + error.getMessage(), error);
    }
    return new StreamReadException("Stream failed: " + error.getMessage(), error);
  }

  private static Status statusOf(Throwable error) {
    if (error instanceof StatusRuntimeException) {
      return ((StatusRuntimeException) error).getStatus();
    }
    if (error instanceof StatusException) {
      return ((StatusException) error).getStatus();
    }
    return null;
  }
}
