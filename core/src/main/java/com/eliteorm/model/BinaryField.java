package com.eliteorm.model;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusOr;
import java.util.Arrays;
import java.util.List;

/**
 * A binary column holding raw bytes. The array is copied on the way in and out so a stored row
 * never aliases the field's value.
 */
public final class BinaryField extends Field<byte[]> {

  public BinaryField(String key, byte[] value, boolean primary) {
    super(key, value.clone(), primary);
  }

  public BinaryField(String key, byte[] value) {
    this(key, value, false);
  }

  @Override
  public byte[] value() {
    return super.value().clone();
  }

  @Override
  public void setValue(byte[] value) {
    super.setValue(value.clone());
  }

  @Override
  public FieldKind kind() {
    return FieldKind.BINARY;
  }

  @Override
  public SqlType sqlType() {
    return SqlType.BINARY;
  }

  @Override
  boolean accepts(Object candidate) {
    return candidate instanceof byte[];
  }

  @Override
  Object encode(byte[] value) {
    return value.clone();
  }

  /**
   * Accepts a byte array, or a list of numbers as produced when the owning entity is nested inside
   * another one and went through JSON.
   */
  @Override
  StatusOr<byte[]> decode(Object wire) {
    if (wire instanceof byte[]) {
      return StatusOr.ofValue(((byte[]) wire).clone());
    }
    if (wire instanceof List) {
      List<?> list = (List<?>) wire;
      byte[] bytes = new byte[list.size()];
      for (int i = 0; i < bytes.length; i++) {
        Object element = list.get(i);
        if (!(element instanceof Number)) {
          return StatusOr.ofStatus(
              Status.dataLoss("Byte " + i + " is not a number: " + element));
        }
        bytes[i] = ((Number) element).byteValue();
      }
      return StatusOr.ofValue(bytes);
    }
    return StatusOr.ofStatus(Status.dataLoss("Expected bytes but found " + describe(wire)));
  }

  @Override
  boolean valueEquals(byte[] a, byte[] b) {
    return Arrays.equals(a, b);
  }

  @Override
  int valueHash(byte[] v) {
    return Arrays.hashCode(v);
  }

  @Override
  public String toString() {
    return key() + "=<" + value().length + " bytes>";
  }
}
