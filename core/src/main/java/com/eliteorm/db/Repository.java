package com.eliteorm.db;

import com.eliteorm.common.status.StatusOr;
import com.eliteorm.model.Entity;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Collection-style access to the entities of one table, so that callers add, list, change and
 * remove objects without dealing with rows or key conditions.
 *
 * @param <T> the entity type
 */
public class Repository<T extends Entity<T>> {
  private final Dao<T> dao;

  public Repository(Dao<T> dao) {
    this.dao = Objects.requireNonNull(dao, "dao");
  }

  /** Returns every stored object. */
  @Nonnull
  public StatusOr<List<T>> get() {
    return dao.get();
  }

  /** Stores a new object and returns the store's row identifier. */
  @Nonnull
  public StatusOr<Long> create(T obj) {
    return dao.create(obj);
  }

  /** Overwrites the stored object with the same primary key. */
  @Nonnull
  public StatusOr<Integer> update(T obj) {
    return dao.update(obj);
  }

  /**
   * Removes one or more objects. The target is either an object of type {@code T} or the value of
   * the first column.
   */
  @Nonnull
  public StatusOr<Integer> delete(Object target) {
    return dao.delete(target);
  }

  /** Removes every object. */
  @Nonnull
  public StatusOr<Integer> deleteAll() {
    return dao.deleteAll();
  }
}
