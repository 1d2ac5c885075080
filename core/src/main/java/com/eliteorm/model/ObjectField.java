package com.eliteorm.model;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusOr;
import com.eliteorm.db.util.DbUtil;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * One nested object stored as a JSON object in a text column. Decoding asks the factory for a
 * blank instance and rebuilds the value through {@link Mappable#fromMap}.
 *
 * @param <N> the nested type
 */
public final class ObjectField<N extends Mappable<N>> extends Field<N> {
  private final Supplier<N> factory;

  /**
   * Creates an object field.
   *
   * @param factory produces a blank instance of the nested type, typically {@code Album::new}
   * @param key the column name
   * @param value the initial value
   * @param primary true to make this column part of a composite primary key
   */
  public ObjectField(Supplier<N> factory, String key, N value, boolean primary) {
    super(key, value, primary);
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  public ObjectField(Supplier<N> factory, String key, N value) {
    this(factory, key, value, false);
  }

  @Override
  public FieldKind kind() {
    return FieldKind.OBJECT;
  }

  @Override
  public SqlType sqlType() {
    return SqlType.TEXT;
  }

  @Override
  boolean accepts(Object candidate) {
    return value().getClass().isInstance(candidate);
  }

  @Override
  Object encode(N value) {
    return DbUtil.toJson(value.toMap());
  }

  @Override
  StatusOr<N> decode(Object wire) {
    if (!(wire instanceof String)) {
      return StatusOr.ofStatus(Status.dataLoss("Expected JSON text but found " + describe(wire)));
    }
    return DbUtil.parseJsonObject((String) wire).flatMap(map -> factory.get().fromMap(map));
  }
}
