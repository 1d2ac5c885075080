package com.eliteorm.model;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusOr;

/**
 * A boolean column stored as the integer 1 (true) or 0 (false). Any nonzero integer reads back as
 * true, so legacy rows holding other values decode without error.
 */
public final class BoolField extends Field<Boolean> {

  public BoolField(String key, boolean value, boolean primary) {
    super(key, value, primary);
  }

  public BoolField(String key, boolean value) {
    this(key, value, false);
  }

  @Override
  public FieldKind kind() {
    return FieldKind.BOOLEAN;
  }

  @Override
  public SqlType sqlType() {
    return SqlType.INTEGER;
  }

  @Override
  boolean accepts(Object candidate) {
    return candidate instanceof Boolean;
  }

  @Override
  Object encode(Boolean value) {
    return value ? 1 : 0;
  }

  @Override
  StatusOr<Boolean> decode(Object wire) {
    if (wire instanceof Boolean) {
      return StatusOr.ofValue((Boolean) wire);
    }
    if (wire instanceof Integer || wire instanceof Long || wire instanceof Short
        || wire instanceof Byte) {
      return StatusOr.ofValue(((Number) wire).longValue() != 0);
    }
    return StatusOr.ofStatus(Status.dataLoss("Expected 0 or 1 but found " + describe(wire)));
  }
}
