package com.eliteorm.db;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusOr;
import com.eliteorm.model.Entity;
import com.google.common.collect.ImmutableList;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Data access object for one entity type: maps create, read, update and delete calls onto a
 * {@link Store}, converting rows with the entity's {@code toMap}/{@code fromMap}.
 *
 * <p>Update and delete match rows on the primary key (see {@link KeyCondition}) and fail with
 * NOT_FOUND when no row matched. Store failures are returned as INTERNAL with the
 * {@link SQLException} as cause.
 *
 * @param <T> the entity type
 */
public final class Dao<T extends Entity<T>> {
  private final T prototype;
  private final Store store;

  /**
   * @param prototype any instance of the entity type; supplies the table name and the factory
   * @param store the store to run against
   */
  public Dao(T prototype, Store store) {
    this.prototype = Objects.requireNonNull(prototype, "prototype");
    this.store = Objects.requireNonNull(store, "store");
  }

  /** Returns the table this DAO reads and writes. */
  @Nonnull
  public String table() {
    return prototype.table();
  }

  /**
   * Inserts a new row.
   *
   * @return StatusOr containing the row identifier assigned by the store
   */
  @Nonnull
  public StatusOr<Long> create(T obj) {
    try {
      long id = store.insert(table(), obj.toMap());
      Logger.debug("Inserted row {} into {}", id, table());
      return StatusOr.ofValue(id);
    } catch (SQLException e) {
      Logger.error(e, "Insert into {} failed", table());
      return StatusOr.ofException(e);
    }
  }

  /** Loads every row of the table. */
  @Nonnull
  public StatusOr<List<T>> get() {
    return get(null);
  }

  /**
   * Loads every row of the table, in the order the store returns them.
   *
   * @param columns the columns to fetch, or null for all; every declared column must be present
   *     for a row to be rebuilt
   * @return StatusOr containing the entities, or the first row's failure
   */
  @Nonnull
  public StatusOr<List<T>> get(@Nullable List<String> columns) {
    List<Map<String, Object>> rows;
    try {
      rows = store.query(table(), columns);
    } catch (SQLException e) {
      Logger.error(e, "Query of {} failed", table());
      return StatusOr.ofException(e);
    }

    List<T> result = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      StatusOr<T> objOr = prototype.fromMap(row);
      if (objOr.isNotOk()) {
        Logger.warn("Could not rebuild a row of {}: {}", table(), objOr.getStatus());
        return StatusOr.ofStatus(objOr.getStatus());
      }
      result.add(objOr.getValue());
    }
    Logger.debug("Loaded {} rows from {}", result.size(), table());
    return StatusOr.ofValue(ImmutableList.copyOf(result));
  }

  /**
   * Overwrites the row with the same primary key as {@code obj}.
   *
   * @return StatusOr containing the number of rows changed, or NOT_FOUND if none matched
   */
  @Nonnull
  public StatusOr<Integer> update(T obj) {
    KeyCondition condition = KeyCondition.forPrimaryKey(obj);
    try {
      int affected = store.update(table(), obj.toMap(), condition.where(), condition.args());
      return requireAffected(affected, "update", condition);
    } catch (SQLException e) {
      Logger.error(e, "Update of {} failed", table());
      return StatusOr.ofException(e);
    }
  }

  /**
   * Deletes rows. An instance of the entity type deletes the rows matching its whole primary key;
   * any other value is taken as the value of the first column and deletes every row holding it.
   *
   * @return StatusOr containing the number of rows deleted; NOT_FOUND if none matched,
   *     INVALID_ARGUMENT if a key value does not fit the first column
   */
  @Nonnull
  public StatusOr<Integer> delete(Object target) {
    Objects.requireNonNull(target, "target");
    StatusOr<KeyCondition> conditionOr =
        prototype.getClass().isInstance(target)
            ? StatusOr.ofValue(KeyCondition.forPrimaryKey((Entity<?>) target))
            : KeyCondition.forId(prototype, target);
    if (conditionOr.isNotOk()) {
      return StatusOr.ofStatus(conditionOr.getStatus());
    }

    KeyCondition condition = conditionOr.getValue();
    try {
      int affected = store.delete(table(), condition.where(), condition.args());
      return requireAffected(affected, "delete", condition);
    } catch (SQLException e) {
      Logger.error(e, "Delete from {} failed", table());
      return StatusOr.ofException(e);
    }
  }

  /**
   * Deletes every row of the table.
   *
   * @return StatusOr containing the number of rows deleted, zero included
   */
  @Nonnull
  public StatusOr<Integer> deleteAll() {
    try {
      int affected = store.delete(table(), null, List.of());
      Logger.debug("Deleted all {} rows from {}", affected, table());
      return StatusOr.ofValue(affected);
    } catch (SQLException e) {
      Logger.error(e, "Delete from {} failed", table());
      return StatusOr.ofException(e);
    }
  }

  private StatusOr<Integer> requireAffected(int affected, String operation, KeyCondition condition) {
    if (affected == 0) {
      Logger.warn("{} on {} matched no rows for {} {}", operation, table(), condition.where(),
          condition.args());
      return StatusOr.ofStatus(
          Status.notFound(
              "No rows in " + table() + " matched " + condition.where() + " " + condition.args()));
    }
    Logger.debug("{} on {} affected {} rows", operation, table(), affected);
    return StatusOr.ofValue(affected);
  }
}
