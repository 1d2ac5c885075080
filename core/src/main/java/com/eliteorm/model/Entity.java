package com.eliteorm.model;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusOr;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import javax.annotation.Nonnull;

/**
 * Base class for model types that are persisted as one table row.
 *
 * <p>A subclass registers its fields in its constructor, in column order, and passes a factory
 * that creates a blank instance (typically its no-argument constructor reference):
 *
 * <pre>
 * public final class Album extends Entity&lt;Album&gt; {
 *   private final ScalarField&lt;String&gt; name = add(ScalarField.ofText("name", ""));
 *   private final TimestampField release = add(new TimestampField("release", Instant.EPOCH));
 *
 *   public Album() {
 *     super(Album::new);
 *   }
 * }
 * </pre>
 *
 * <p>The first registered field is always part of the primary key. Further fields join it when
 * created with {@code primary = true}, forming a composite key. The table name is the simple class
 * name.
 *
 * @param <T> the concrete subclass
 */
public abstract class Entity<T extends Entity<T>> implements Mappable<T> {
  private final List<Field<?>> fields = new ArrayList<>();
  private final Supplier<T> factory;

  /**
   * @param factory creates a blank instance of the subclass; used to rebuild rows read from the
   *     store
   */
  protected Entity(Supplier<T> factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Registers the next column. Call only from the subclass constructor or field initializers; the
   * field order is the column order and must not change afterwards.
   *
   * @return the field, for assignment to a subclass member
   */
  protected final <F extends Field<?>> F add(F field) {
    for (Field<?> existing : fields) {
      if (existing.key().equals(field.key())) {
        throw new IllegalArgumentException("Duplicate field key: " + field.key());
      }
    }
    fields.add(field);
    return field;
  }

  /** Returns the fields in column order. */
  @Nonnull
  public final List<Field<?>> fields() {
    return Collections.unmodifiableList(fields);
  }

  /**
   * Returns the table name. Defaults to the simple class name; override if the class name is not
   * stable (e.g. under obfuscation).
   */
  @Nonnull
  public String table() {
    return getClass().getSimpleName();
  }

  /** Returns the key of the first field, which always belongs to the primary key. */
  @Nonnull
  public final String idColumn() {
    return firstField().key();
  }

  /** Returns the first field. */
  @Nonnull
  public final Field<?> firstField() {
    if (fields.isEmpty()) {
      throw new IllegalStateException(table() + " declares no fields");
    }
    return fields.get(0);
  }

  /** Returns the primary key columns: the first field plus every field flagged primary. */
  @Nonnull
  public final List<Field<?>> primaryKey() {
    ImmutableList.Builder<Field<?>> key = ImmutableList.builder();
    key.add(firstField());
    for (Field<?> field : fields.subList(1, fields.size())) {
      if (field.isPrimary()) {
        key.add(field);
      }
    }
    return key.build();
  }

  /**
   * Describes the table, e.g. {@code Album (name TEXT,release TEXT,PRIMARY KEY (name))}. Prefix
   * with {@code CREATE TABLE} to create it.
   */
  @Nonnull
  public String describeTable() {
    StringBuilder description = new StringBuilder(table()).append(" (");
    for (Field<?> field : fields) {
      description.append(field.key()).append(' ').append(field.sqlType().declaration()).append(',');
    }
    description.append("PRIMARY KEY (");
    boolean first = true;
    for (Field<?> field : primaryKey()) {
      if (!first) {
        description.append(',');
      }
      description.append(field.key());
      first = false;
    }
    return description.append("))").toString();
  }

  /** Returns the wire value of every field, keyed by column name, in column order. */
  @Override
  @Nonnull
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    for (Field<?> field : fields) {
      map.put(field.key(), field.toWire());
    }
    return map;
  }

  /**
   * Creates a new instance from a row read from the store. Columns the entity does not declare are
   * ignored.
   *
   * @param map the row, keyed by column name
   * @return StatusOr containing the new instance; FAILED_PRECONDITION when a declared column is
   *     missing from the row, DATA_LOSS when a value cannot be decoded
   */
  @Override
  @Nonnull
  public StatusOr<T> fromMap(Map<String, ?> map) {
    T obj = factory.get();
    for (Field<?> field : obj.fields()) {
      if (!map.containsKey(field.key())) {
        return StatusOr.ofStatus(
            Status.failedPrecondition("Unknown data member key: " + field.key()));
      }
      Status status = field.fromWire(map.get(field.key()));
      if (status.isError()) {
        return StatusOr.ofStatus(status.withContext(table()));
      }
    }
    return StatusOr.ofValue(obj);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Entity<?> other = (Entity<?>) obj;
    if (fields.size() != other.fields.size()) {
      return false;
    }
    for (int i = 0; i < fields.size(); i++) {
      if (!fields.get(i).equals(other.fields.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    MoreObjects.ToStringHelper helper = MoreObjects.toStringHelper(this);
    for (Field<?> field : fields) {
      helper.add(field.key(), field.value());
    }
    return helper.toString();
  }
}
