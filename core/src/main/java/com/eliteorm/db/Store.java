package com.eliteorm.db;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The relational engine the data access layer runs against. Rows are flat maps from column name to
 * wire value; WHERE clauses are SQL fragments with {@code ?} placeholders bound, in order, to
 * {@code args}.
 */
public interface Store {

  /**
   * Appends a row.
   *
   * @return an implementation-defined row identifier
   */
  long insert(String table, Map<String, Object> record) throws SQLException;

  /**
   * Returns the rows of a table in the store's natural order.
   *
   * @param columns the columns to return, or null for all of them
   */
  @Nonnull
  List<Map<String, Object>> query(String table, @Nullable List<String> columns)
      throws SQLException;

  /**
   * Overwrites the columns in {@code record} on every row matching the WHERE clause.
   *
   * @return the number of rows changed
   */
  int update(String table, Map<String, Object> record, String where, List<Object> args)
      throws SQLException;

  /**
   * Deletes every row matching the WHERE clause, or every row when {@code where} is null.
   *
   * @return the number of rows deleted
   */
  int delete(String table, @Nullable String where, List<Object> args) throws SQLException;
}
