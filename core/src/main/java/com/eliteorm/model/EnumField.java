package com.eliteorm.model;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusOr;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * An enum column stored as the constant's ordinal. The ordered constants are supplied at
 * construction (usually {@code MyEnum.values()}) and used to map the ordinal back to the constant.
 *
 * @param <E> the enum type
 */
public final class EnumField<E extends Enum<E>> extends Field<E> {
  private final List<E> constants;

  /**
   * Creates an enum field.
   *
   * @param constants every constant of the enum in declaration order
   * @param key the column name
   * @param value the initial value
   * @param primary true to make this column part of a composite primary key
   */
  public EnumField(E[] constants, String key, E value, boolean primary) {
    super(key, value, primary);
    if (constants.length == 0) {
      throw new IllegalArgumentException("Enum field " + key + " needs at least one constant");
    }
    this.constants = ImmutableList.copyOf(constants);
  }

  public EnumField(E[] constants, String key, E value) {
    this(constants, key, value, false);
  }

  @Override
  public FieldKind kind() {
    return FieldKind.ENUM;
  }

  @Override
  public SqlType sqlType() {
    return SqlType.INTEGER;
  }

  @Override
  boolean accepts(Object candidate) {
    return constants.get(0).getDeclaringClass().isInstance(candidate);
  }

  @Override
  Object encode(E value) {
    return value.ordinal();
  }

  @Override
  StatusOr<E> decode(Object wire) {
    if (!(wire instanceof Integer || wire instanceof Long || wire instanceof Short
        || wire instanceof Byte)) {
      return StatusOr.ofStatus(Status.dataLoss("Expected an ordinal but found " + describe(wire)));
    }
    long ordinal = ((Number) wire).longValue();
    if (ordinal < 0 || ordinal >= constants.size()) {
      return StatusOr.ofStatus(
          Status.dataLoss(
              "Ordinal " + ordinal + " is out of range for "
                  + constants.get(0).getDeclaringClass().getSimpleName()));
    }
    return StatusOr.ofValue(constants.get((int) ordinal));
  }
}
