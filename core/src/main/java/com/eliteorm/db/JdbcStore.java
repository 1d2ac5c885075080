package com.eliteorm.db;

import com.eliteorm.common.status.Status;
import com.eliteorm.db.util.DbUtil;
import com.eliteorm.model.Entity;
import com.eliteorm.model.Field;
import com.google.common.base.Joiner;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.sql.DataSource;
import org.tinylog.Logger;

/**
 * A {@link Store} backed by a JDBC {@link DataSource}. Each call borrows one connection from the
 * source and runs a single prepared statement in auto-commit mode. Table and column names are
 * double-quoted so that their case is preserved.
 *
 * <p>JDBC has no portable row identifier, so {@link #insert} returns the number of rows inserted.
 */
public final class JdbcStore implements Store {
  private static final Joiner COMMA = Joiner.on(", ");

  private final DataSource dataSource;

  public JdbcStore(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  /**
   * Creates the table for an entity unless it already exists, using the column types and primary
   * key of {@link Entity#describeTable()}.
   *
   * @return OK, or INTERNAL with the SQLException as cause
   */
  @Nonnull
  public Status createTable(Entity<?> entity) {
    List<String> definitions = new ArrayList<>();
    for (Field<?> field : entity.fields()) {
      definitions.add(DbUtil.quote(field.key()) + " " + field.sqlType().declaration());
    }
    List<String> keyColumns = new ArrayList<>();
    for (Field<?> field : entity.primaryKey()) {
      keyColumns.add(DbUtil.quote(field.key()));
    }
    String sql =
        "CREATE TABLE IF NOT EXISTS "
            + DbUtil.quote(entity.table())
            + " ("
            + COMMA.join(definitions)
            + ", PRIMARY KEY ("
            + COMMA.join(keyColumns)
            + "))";
    try (Connection conn = dataSource.getConnection();
        Statement stmt = conn.createStatement()) {
      stmt.execute(sql);
      Logger.info("Ensured table {}", entity.describeTable());
      return Status.ok();
    } catch (SQLException e) {
      return Status.internal("Failed to create table " + entity.table() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public long insert(String table, Map<String, Object> record) throws SQLException {
    List<String> columns = new ArrayList<>();
    List<String> placeholders = new ArrayList<>();
    for (String column : record.keySet()) {
      columns.add(DbUtil.quote(column));
      placeholders.add("?");
    }
    String sql =
        "INSERT INTO "
            + DbUtil.quote(table)
            + " ("
            + COMMA.join(columns)
            + ") VALUES ("
            + COMMA.join(placeholders)
            + ")";
    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(sql)) {
      bind(stmt, 1, new ArrayList<>(record.values()));
      return stmt.executeUpdate();
    }
  }

  @Override
  @Nonnull
  public List<Map<String, Object>> query(String table, @Nullable List<String> columns)
      throws SQLException {
    String projection = "*";
    if (columns != null) {
      List<String> quoted = new ArrayList<>();
      for (String column : columns) {
        quoted.add(DbUtil.quote(column));
      }
      projection = COMMA.join(quoted);
    }
    String sql = "SELECT " + projection + " FROM " + DbUtil.quote(table);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(sql);
        ResultSet rs = stmt.executeQuery()) {
      ResultSetMetaData meta = rs.getMetaData();
      List<Map<String, Object>> rows = new ArrayList<>();
      while (rs.next()) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
          row.put(meta.getColumnLabel(i), rs.getObject(i));
        }
        rows.add(row);
      }
      return rows;
    }
  }

  @Override
  public int update(String table, Map<String, Object> record, String where, List<Object> args)
      throws SQLException {
    List<String> assignments = new ArrayList<>();
    for (String column : record.keySet()) {
      assignments.add(DbUtil.quote(column) + " = ?");
    }
    String sql =
        "UPDATE " + DbUtil.quote(table) + " SET " + COMMA.join(assignments) + " WHERE " + where;
    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(sql)) {
      int next = bind(stmt, 1, new ArrayList<>(record.values()));
      bind(stmt, next, args);
      return stmt.executeUpdate();
    }
  }

  @Override
  public int delete(String table, @Nullable String where, List<Object> args) throws SQLException {
    String sql = "DELETE FROM " + DbUtil.quote(table);
    if (where != null) {
      sql += " WHERE " + where;
    }
    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(sql)) {
      bind(stmt, 1, args);
      return stmt.executeUpdate();
    }
  }

  /**
   * Binds values to consecutive parameters.
   *
   * @return the index of the next unbound parameter
   */
  private static int bind(PreparedStatement stmt, int first, List<Object> values)
      throws SQLException {
    int index = first;
    for (Object value : values) {
      if (value instanceof byte[]) {
        stmt.setBytes(index++, (byte[]) value);
      } else {
        stmt.setObject(index++, value);
      }
    }
    return index;
  }
}
