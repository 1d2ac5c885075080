package com.eliteorm.common.status;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Represents the status of an operation, possibly with additional error details. Field decoding,
 * entity reconstruction and every data access call report their outcome through this type instead
 * of throwing.
 */
public class Status {
  private static final Status OK = new Status(StatusCode.OK, null, null);

  private final StatusCode code;
  private final String message;
  private final Throwable cause;

  private Status(StatusCode code, String message, Throwable cause) {
    this.code = Objects.requireNonNull(code);
    this.message = message;
    this.cause = cause;
  }

  /** Returns the OK status. */
  public static Status ok() {
    return OK;
  }

  /** Creates a new NOT_FOUND status with the given message. */
  public static Status notFound(String message) {
    return new Status(StatusCode.NOT_FOUND, message, null);
  }

  /** Creates a new INTERNAL status with the given message and cause. */
  public static Status internal(String message, Throwable cause) {
    return new Status(StatusCode.INTERNAL, message, cause);
  }

  /** Creates a new INVALID_ARGUMENT status with the given message. */
  public static Status invalidArgument(String message) {
    return new Status(StatusCode.INVALID_ARGUMENT, message, null);
  }

  /** Creates a new FAILED_PRECONDITION status with the given message. */
  public static Status failedPrecondition(String message) {
    return new Status(StatusCode.FAILED_PRECONDITION, message, null);
  }

  /** Creates a new DATA_LOSS status with the given message. */
  public static Status dataLoss(String message) {
    return new Status(StatusCode.DATA_LOSS, message, null);
  }

  /** Creates a new DATA_LOSS status with the given message and cause. */
  public static Status dataLoss(String message, Throwable cause) {
    return new Status(StatusCode.DATA_LOSS, message, cause);
  }

  /**
   * Returns a copy of this status whose message is prefixed with the given context, keeping the
   * code and cause. OK statuses are returned unchanged.
   */
  @Nonnull
  public Status withContext(String context) {
    if (isOk()) {
      return this;
    }
    String combined = message == null ? context : context + ": " + message;
    return new Status(code, combined, cause);
  }

  /** Returns the code for this status. */
  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns the message for this status, or null if there is no message. */
  public String getMessage() {
    return message;
  }

  /** Returns the cause of this status, or null if there is no cause. */
  public Throwable getCause() {
    return cause;
  }

  /** Returns true if this status represents an error (i.e., the code is not OK). */
  public boolean isError() {
    return code.isError();
  }

  /** Returns true if this status is OK. */
  public boolean isOk() {
    return code.isSuccess();
  }

  @Override
  public String toString() {
    if (message == null) {
      return code.toString();
    }
    return code + ": " + message;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Status other = (Status) obj;
    return code == other.code
        && Objects.equals(message, other.message)
        && Objects.equals(cause, other.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, cause);
  }
}
