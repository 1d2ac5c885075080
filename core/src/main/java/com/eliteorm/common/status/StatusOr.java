package com.eliteorm.common.status;

import java.util.Objects;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * The outcome of an operation that yields a value: either an OK status with a non-null value, or
 * an error status with no value. Mapping, DAO and publisher operations return this instead of
 * throwing.
 *
 * @param <T> the value type on success
 */
public final class StatusOr<T> {
  private final Status status;
  private final T value;

  private StatusOr(Status status, T value) {
    this.status = Objects.requireNonNull(status, "status");
    this.value = value;
  }

  /**
   * Wraps a value with an OK status.
   *
   * @throws NullPointerException if value is null
   */
  public static <T> StatusOr<T> ofValue(@Nonnull T value) {
    return new StatusOr<>(Status.ok(), Objects.requireNonNull(value, "value"));
  }

  /**
   * Wraps an error status.
   *
   * @throws IllegalArgumentException if the status is OK
   */
  public static <T> StatusOr<T> ofStatus(@Nonnull Status status) {
    if (status.isOk()) {
      throw new IllegalArgumentException("ofStatus requires an error status");
    }
    return new StatusOr<>(status, null);
  }

  /** Wraps an exception, typically a {@link java.sql.SQLException}, as INTERNAL. */
  public static <T> StatusOr<T> ofException(@Nonnull Throwable throwable) {
    return ofStatus(Status.internal("Exception: " + throwable.getMessage(), throwable));
  }

  /** Returns the status; OK when a value is present. */
  @Nonnull
  public Status getStatus() {
    return status;
  }

  /**
   * Returns the value.
   *
   * @throws IllegalStateException if this holds an error
   */
  @Nonnull
  public T getValue() {
    if (status.isError()) {
      throw new IllegalStateException("Cannot get value from failed StatusOr: " + status);
    }
    return value;
  }

  public boolean isOk() {
    return status.isOk();
  }

  public boolean isNotOk() {
    return status.isError();
  }

  /** Transforms the value, passing an error through unchanged. */
  @Nonnull
  public <U> StatusOr<U> map(@Nonnull Function<T, U> mapper) {
    return status.isOk() ? StatusOr.ofValue(mapper.apply(value)) : StatusOr.ofStatus(status);
  }

  /** Chains a further operation that may fail, passing an error through unchanged. */
  @Nonnull
  public <U> StatusOr<U> flatMap(@Nonnull Function<T, StatusOr<U>> mapper) {
    return status.isOk() ? mapper.apply(value) : StatusOr.ofStatus(status);
  }

  @Override
  public String toString() {
    return status.isOk() ? "StatusOr{value=" + value + "}" : "StatusOr{status=" + status + "}";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof StatusOr)) {
      return false;
    }
    StatusOr<?> other = (StatusOr<?>) obj;
    return status.equals(other.status) && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, value);
  }
}
