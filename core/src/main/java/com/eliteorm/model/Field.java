package com.eliteorm.model;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusOr;
import com.google.common.base.Strings;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One named column of an {@link Entity}: holds the typed value and converts it to and from the
 * representation the store accepts.
 *
 * <p>The set of subclasses is closed (the constructor is package-private); {@link #kind()} names
 * the variant. A field is part of the primary key when it is flagged {@code primary} or when it is
 * the first field of its entity.
 *
 * @param <T> the in-memory value type
 */
public abstract class Field<T> {
  private final String key;
  private final boolean primary;
  private T value;

  Field(String key, T value, boolean primary) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Field key cannot be empty");
    }
    this.key = key;
    this.value = Objects.requireNonNull(value, "value");
    this.primary = primary;
  }

  /** Returns the column name. */
  @Nonnull
  public String key() {
    return key;
  }

  /** Returns the current value. */
  @Nonnull
  public T value() {
    return value;
  }

  /** Replaces the current value. */
  public void setValue(@Nonnull T value) {
    this.value = Objects.requireNonNull(value, "value");
  }

  /** Returns true if this field was explicitly flagged as part of the primary key. */
  public boolean isPrimary() {
    return primary;
  }

  /** Returns the variant of this field. */
  @Nonnull
  public abstract FieldKind kind();

  /** Returns the column type used when describing the table. */
  @Nonnull
  public abstract SqlType sqlType();

  /** Converts the current value into its wire representation. */
  @Nonnull
  public final Object toWire() {
    return encode(value);
  }

  /**
   * Replaces the current value with the decoded form of a stored value. The value is left untouched
   * when decoding fails.
   *
   * @param wire the value read from the store
   * @return OK, or DATA_LOSS naming this column when the value cannot be decoded
   */
  @Nonnull
  public final Status fromWire(@Nullable Object wire) {
    if (wire == null) {
      return Status.dataLoss("Column " + key + " is null");
    }
    StatusOr<T> decodedOr = decode(wire);
    if (decodedOr.isNotOk()) {
      return decodedOr.getStatus().withContext("Column " + key);
    }
    value = decodedOr.getValue();
    return Status.ok();
  }

  /**
   * Encodes a caller-supplied value with this field's codec without changing the field, e.g. a key
   * passed to a delete.
   *
   * @return StatusOr containing the wire value, or INVALID_ARGUMENT if the value has the wrong type
   */
  @Nonnull
  @SuppressWarnings("unchecked")
  public StatusOr<Object> wireValueOf(Object candidate) {
    if (candidate == null) {
      return StatusOr.ofStatus(Status.invalidArgument("Key value for " + key + " is null"));
    }
    Status mismatch =
        Status.invalidArgument(
            "Key value of type "
                + candidate.getClass().getSimpleName()
                + " does not fit column "
                + key);
    if (!accepts(candidate)) {
      return StatusOr.ofStatus(mismatch);
    }
    try {
      return StatusOr.ofValue(encode((T) candidate));
    } catch (ClassCastException e) {
      // a list whose elements have the wrong type
      return StatusOr.ofStatus(mismatch);
    }
  }

  /** Returns true if the candidate has this field's value type. */
  abstract boolean accepts(Object candidate);

  /** Converts a value into its wire representation. */
  @Nonnull
  abstract Object encode(T value);

  /** Converts a non-null wire value into the in-memory representation. */
  @Nonnull
  abstract StatusOr<T> decode(Object wire);

  /** Compares two values of this field. Array-backed kinds override this. */
  boolean valueEquals(T a, T b) {
    return a.equals(b);
  }

  /** Hashes a value of this field consistently with {@link #valueEquals}. */
  int valueHash(T v) {
    return v.hashCode();
  }

  /** Describes a wire value for error messages. */
  static String describe(Object wire) {
    return wire.getClass().getSimpleName() + " " + wire;
  }

  @Override
  @SuppressWarnings("unchecked")
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Field<T> other = (Field<T>) obj;
    return key.equals(other.key)
        && primary == other.primary
        && sqlType() == other.sqlType()
        && valueEquals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, primary, sqlType(), valueHash(value));
  }

  @Override
  public String toString() {
    return key + "=" + value;
  }
}
