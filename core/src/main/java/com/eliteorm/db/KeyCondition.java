package com.eliteorm.db;

import com.eliteorm.common.status.StatusOr;
import com.eliteorm.db.util.DbUtil;
import com.eliteorm.model.Entity;
import com.eliteorm.model.Field;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * An equality WHERE clause over key columns, e.g. {@code "name" = ? AND "year" = ?}, with the wire
 * values to bind. Columns appear in field order and are joined with AND.
 *
 * @param where the SQL fragment
 * @param args the values for the placeholders, in order
 */
public record KeyCondition(String where, List<Object> args) {

  public KeyCondition {
    args = ImmutableList.copyOf(args);
  }

  /**
   * Matches the primary key of the given entity: its first field plus every field flagged primary,
   * using their current values. Default values are matched like any other value.
   */
  @Nonnull
  public static KeyCondition forPrimaryKey(Entity<?> entity) {
    StringBuilder where = new StringBuilder();
    ImmutableList.Builder<Object> args = ImmutableList.builder();
    for (Field<?> field : entity.primaryKey()) {
      if (where.length() > 0) {
        where.append(" AND ");
      }
      where.append(DbUtil.quote(field.key())).append(" = ?");
      args.add(field.toWire());
    }
    return new KeyCondition(where.toString(), args.build());
  }

  /**
   * Matches the first column only, against a key value encoded with the first field's codec.
   *
   * @return StatusOr containing the condition, or INVALID_ARGUMENT if the key has the wrong type
   */
  @Nonnull
  public static StatusOr<KeyCondition> forId(Entity<?> prototype, Object id) {
    Field<?> idField = prototype.firstField();
    return idField
        .wireValueOf(id)
        .map(wire -> new KeyCondition(DbUtil.quote(idField.key()) + " = ?", List.of(wire)));
  }
}
