package com.eliteorm.model;

/**
 * The closed set of value kinds a {@link Field} can hold. Each constant corresponds to exactly one
 * {@code Field} subclass in this package.
 */
public enum FieldKind {
  /** {@link ScalarField}: integer, long, double or text. */
  SCALAR,
  /** {@link EnumField}: stored as the constant's ordinal. */
  ENUM,
  /** {@link BoolField}: stored as 0 or 1. */
  BOOLEAN,
  /** {@link BinaryField}: raw bytes. */
  BINARY,
  /** {@link TimestampField}: ISO-8601 text. */
  TIMESTAMP,
  /** {@link DurationField}: microsecond count. */
  DURATION,
  /** {@link ScalarListField}: JSON array of scalars. */
  SCALAR_LIST,
  /** {@link ObjectListField}: JSON array of nested objects. */
  OBJECT_LIST,
  /** {@link ObjectField}: one nested object as a JSON object. */
  OBJECT
}
