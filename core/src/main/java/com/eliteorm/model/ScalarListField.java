package com.eliteorm.model;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusOr;
import com.eliteorm.db.util.DbUtil;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * A list of scalars stored as a JSON array in a text column, e.g. {@code [1983,1985]} or
 * {@code ["Tom Araya","Kerry King"]}. The list is held as an immutable copy.
 *
 * @param <T> one of {@code Integer}, {@code Long}, {@code Double}, {@code String}
 */
public final class ScalarListField<T> extends Field<List<T>> {
  private final ScalarType<T> elementType;

  public ScalarListField(ScalarType<T> elementType, String key, List<T> value, boolean primary) {
    super(key, ImmutableList.copyOf(value), primary);
    this.elementType = elementType;
  }

  public ScalarListField(ScalarType<T> elementType, String key, List<T> value) {
    this(elementType, key, value, false);
  }

  @Override
  public void setValue(List<T> value) {
    super.setValue(ImmutableList.copyOf(value));
  }

  /** Returns the type of the list elements. */
  public ScalarType<T> elementType() {
    return elementType;
  }

  @Override
  public FieldKind kind() {
    return FieldKind.SCALAR_LIST;
  }

  @Override
  public SqlType sqlType() {
    return SqlType.TEXT;
  }

  @Override
  boolean accepts(Object candidate) {
    if (!(candidate instanceof List)) {
      return false;
    }
    for (Object element : (List<?>) candidate) {
      if (!elementType.javaType().isInstance(element)) {
        return false;
      }
    }
    return true;
  }

  @Override
  Object encode(List<T> value) {
    return DbUtil.toJson(value);
  }

  @Override
  StatusOr<List<T>> decode(Object wire) {
    if (!(wire instanceof String)) {
      return StatusOr.ofStatus(Status.dataLoss("Expected JSON text but found " + describe(wire)));
    }
    return DbUtil.parseJsonArray((String) wire).flatMap(this::coerceElements);
  }

  private StatusOr<List<T>> coerceElements(List<Object> raw) {
    List<T> elements = new ArrayList<>(raw.size());
    for (int i = 0; i < raw.size(); i++) {
      Object element = raw.get(i);
      if (element == null) {
        return StatusOr.ofStatus(Status.dataLoss("Element " + i + " is null"));
      }
      StatusOr<T> elementOr = elementType.coerce(element);
      if (elementOr.isNotOk()) {
        return StatusOr.ofStatus(elementOr.getStatus().withContext("Element " + i));
      }
      elements.add(elementOr.getValue());
    }
    return StatusOr.ofValue(ImmutableList.copyOf(elements));
  }
}
