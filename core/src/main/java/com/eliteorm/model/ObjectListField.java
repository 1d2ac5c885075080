package com.eliteorm.model;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusOr;
import com.eliteorm.db.util.DbUtil;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A list of nested objects stored as a JSON array of objects in a text column. The list is held as
 * an immutable copy.
 *
 * <p>When the element type has more than one constructor, {@code ActivePeriod::new} does not pin
 * the type argument, so name it: {@code new ObjectListField<ActivePeriod>(ActivePeriod::new,
 * "active", List.of())}.
 *
 * @param <N> the element type
 */
public final class ObjectListField<N extends Mappable<N>> extends Field<List<N>> {
  private final Supplier<N> factory;

  /**
   * Creates an object list field.
   *
   * @param factory produces a blank element, typically {@code ActivePeriod::new}
   * @param key the column name
   * @param value the initial elements
   * @param primary true to make this column part of a composite primary key
   */
  public ObjectListField(Supplier<N> factory, String key, List<N> value, boolean primary) {
    super(key, ImmutableList.copyOf(value), primary);
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  public ObjectListField(Supplier<N> factory, String key, List<N> value) {
    this(factory, key, value, false);
  }

  @Override
  public void setValue(List<N> value) {
    super.setValue(ImmutableList.copyOf(value));
  }

  @Override
  public FieldKind kind() {
    return FieldKind.OBJECT_LIST;
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
    Class<?> elementClass = factory.get().getClass();
    for (Object element : (List<?>) candidate) {
      if (!elementClass.isInstance(element)) {
        return false;
      }
    }
    return true;
  }

  @Override
  Object encode(List<N> value) {
    List<Map<String, Object>> maps = new ArrayList<>(value.size());
    for (N element : value) {
      maps.add(element.toMap());
    }
    return DbUtil.toJson(maps);
  }

  @Override
  StatusOr<List<N>> decode(Object wire) {
    if (!(wire instanceof String)) {
      return StatusOr.ofStatus(Status.dataLoss("Expected JSON text but found " + describe(wire)));
    }
    return DbUtil.parseJsonArray((String) wire).flatMap(this::rebuildElements);
  }

  private StatusOr<List<N>> rebuildElements(List<Object> raw) {
    List<N> elements = new ArrayList<>(raw.size());
    for (int i = 0; i < raw.size(); i++) {
      if (!(raw.get(i) instanceof Map)) {
        return StatusOr.ofStatus(Status.dataLoss("Element " + i + " is not a JSON object"));
      }
      @SuppressWarnings("unchecked")
      Map<String, ?> map = (Map<String, ?>) raw.get(i);
      StatusOr<N> elementOr = factory.get().fromMap(map);
      if (elementOr.isNotOk()) {
        return StatusOr.ofStatus(elementOr.getStatus().withContext("Element " + i));
      }
      elements.add(elementOr.getValue());
    }
    return StatusOr.ofValue(ImmutableList.copyOf(elements));
  }
}
