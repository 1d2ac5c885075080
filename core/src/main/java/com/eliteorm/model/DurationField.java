package com.eliteorm.model;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusOr;
import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * A time span stored as a 64-bit microsecond count. Sub-microsecond precision is truncated on
 * write.
 */
public final class DurationField extends Field<Duration> {

  public DurationField(String key, Duration value, boolean primary) {
    super(key, value, primary);
  }

  public DurationField(String key, Duration value) {
    this(key, value, false);
  }

  @Override
  public FieldKind kind() {
    return FieldKind.DURATION;
  }

  @Override
  public SqlType sqlType() {
    return SqlType.BIGINT;
  }

  @Override
  boolean accepts(Object candidate) {
    return candidate instanceof Duration;
  }

  @Override
  Object encode(Duration value) {
    return Math.addExact(
        Math.multiplyExact(value.getSeconds(), 1_000_000L), value.getNano() / 1_000L);
  }

  @Override
  StatusOr<Duration> decode(Object wire) {
    if (wire instanceof Long || wire instanceof Integer || wire instanceof Short
        || wire instanceof Byte) {
      return StatusOr.ofValue(Duration.of(((Number) wire).longValue(), ChronoUnit.MICROS));
    }
    return StatusOr.ofStatus(
        Status.dataLoss("Expected a microsecond count but found " + describe(wire)));
  }
}
