package com.eliteorm.model;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusOr;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * The scalar value types a {@link ScalarField} or {@link ScalarListField} can hold, with the
 * conversion applied to values coming back from a store or from JSON. Stores and JSON parsers do
 * not agree on integer widths, so integral wire values are narrowed or widened to the declared type
 * (with a range check); nothing else is converted.
 *
 * @param <T> the boxed Java type
 */
public final class ScalarType<T> {

  public static final ScalarType<Integer> INTEGER =
      new ScalarType<>(Integer.class, SqlType.INTEGER, ScalarType::toInteger);

  public static final ScalarType<Long> BIGINT =
      new ScalarType<>(Long.class, SqlType.BIGINT, ScalarType::toLong);

  public static final ScalarType<Double> DOUBLE =
      new ScalarType<>(Double.class, SqlType.DOUBLE, ScalarType::toDouble);

  public static final ScalarType<String> TEXT =
      new ScalarType<>(String.class, SqlType.TEXT, ScalarType::toText);

  private final Class<T> javaType;
  private final SqlType sqlType;
  private final Function<Object, StatusOr<T>> coercion;

  private ScalarType(Class<T> javaType, SqlType sqlType, Function<Object, StatusOr<T>> coercion) {
    this.javaType = javaType;
    this.sqlType = sqlType;
    this.coercion = coercion;
  }

  /** Returns the boxed Java type. */
  @Nonnull
  public Class<T> javaType() {
    return javaType;
  }

  /** Returns the column type for a single value of this type. */
  @Nonnull
  public SqlType sqlType() {
    return sqlType;
  }

  /** Converts a non-null wire value to this type, or fails with DATA_LOSS. */
  @Nonnull
  StatusOr<T> coerce(Object wire) {
    return coercion.apply(wire);
  }

  private static StatusOr<Integer> toInteger(Object wire) {
    if (wire instanceof Integer) {
      return StatusOr.ofValue((Integer) wire);
    }
    if (wire instanceof Long || wire instanceof Short || wire instanceof Byte) {
      long v = ((Number) wire).longValue();
      if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
        return mismatch(wire, "INTEGER");
      }
      return StatusOr.ofValue((int) v);
    }
    return mismatch(wire, "INTEGER");
  }

  private static StatusOr<Long> toLong(Object wire) {
    if (wire instanceof Long || wire instanceof Integer || wire instanceof Short
        || wire instanceof Byte) {
      return StatusOr.ofValue(((Number) wire).longValue());
    }
    return mismatch(wire, "BIGINT");
  }

  private static StatusOr<Double> toDouble(Object wire) {
    if (wire instanceof Number) {
      return StatusOr.ofValue(((Number) wire).doubleValue());
    }
    return mismatch(wire, "DOUBLE");
  }

  private static StatusOr<String> toText(Object wire) {
    if (wire instanceof String) {
      return StatusOr.ofValue((String) wire);
    }
    return mismatch(wire, "TEXT");
  }

  private static <U> StatusOr<U> mismatch(Object wire, String expected) {
    return StatusOr.ofStatus(
        Status.dataLoss("Expected " + expected + " but found " + Field.describe(wire)));
  }

  @Override
  public String toString() {
    return javaType.getSimpleName();
  }
}
