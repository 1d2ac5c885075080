package com.eliteorm.model;

import com.eliteorm.common.status.StatusOr;
import javax.annotation.Nonnull;

/**
 * An integer, long, double or text column stored as is.
 *
 * @param <T> one of {@code Integer}, {@code Long}, {@code Double}, {@code String}
 */
public final class ScalarField<T> extends Field<T> {
  private final ScalarType<T> type;

  /**
   * Creates a scalar field.
   *
   * @param type the scalar type, which fixes the column type
   * @param key the column name
   * @param value the initial value
   * @param primary true to make this column part of a composite primary key
   */
  public ScalarField(ScalarType<T> type, String key, T value, boolean primary) {
    super(key, value, primary);
    this.type = type;
  }

  public ScalarField(ScalarType<T> type, String key, T value) {
    this(type, key, value, false);
  }

  public static ScalarField<Integer> ofInt(String key, int value) {
    return new ScalarField<>(ScalarType.INTEGER, key, value);
  }

  public static ScalarField<Integer> ofInt(String key, int value, boolean primary) {
    return new ScalarField<>(ScalarType.INTEGER, key, value, primary);
  }

  public static ScalarField<Long> ofLong(String key, long value) {
    return new ScalarField<>(ScalarType.BIGINT, key, value);
  }

  public static ScalarField<Double> ofDouble(String key, double value) {
    return new ScalarField<>(ScalarType.DOUBLE, key, value);
  }

  public static ScalarField<String> ofText(String key, String value) {
    return new ScalarField<>(ScalarType.TEXT, key, value);
  }

  public static ScalarField<String> ofText(String key, String value, boolean primary) {
    return new ScalarField<>(ScalarType.TEXT, key, value, primary);
  }

  /** Returns the scalar type of this field. */
  @Nonnull
  public ScalarType<T> type() {
    return type;
  }

  @Override
  public FieldKind kind() {
    return FieldKind.SCALAR;
  }

  @Override
  public SqlType sqlType() {
    return type.sqlType();
  }

  @Override
  boolean accepts(Object candidate) {
    return type.javaType().isInstance(candidate);
  }

  @Override
  Object encode(T value) {
    return value;
  }

  @Override
  StatusOr<T> decode(Object wire) {
    return type.coerce(wire);
  }
}
