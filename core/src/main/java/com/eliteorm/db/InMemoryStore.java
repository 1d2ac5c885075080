package com.eliteorm.db;

import com.google.common.base.Splitter;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A {@link Store} that keeps rows in memory, for tests and for running without a database.
 *
 * <p>Tables are created on first insert and keep rows in insertion order. Row identifiers are
 * sequential across the store, starting at 1. WHERE clauses are limited to equality conjunctions
 * such as {@code "name" = ? AND year = ?}; anything else is rejected. No schema or key constraints
 * are enforced.
 */
public final class InMemoryStore implements Store {

  private static final Pattern EQUALITY =
      Pattern.compile("^\\s*(?:\"((?:[^\"]|\"\")+)\"|([A-Za-z_][A-Za-z0-9_]*))\\s*=\\s*\\?\\s*$");
  private static final Splitter AND =
      Splitter.on(Pattern.compile("\\s+AND\\s+", Pattern.CASE_INSENSITIVE));

  private final Map<String, List<Map<String, Object>>> tables = new HashMap<>();
  private long nextRowId = 1;

  @Override
  public synchronized long insert(String table, Map<String, Object> record) {
    tables.computeIfAbsent(table, t -> new ArrayList<>()).add(new LinkedHashMap<>(record));
    return nextRowId++;
  }

  @Override
  @Nonnull
  public synchronized List<Map<String, Object>> query(String table, @Nullable List<String> columns)
      throws SQLException {
    List<Map<String, Object>> result = new ArrayList<>();
    for (Map<String, Object> row : rows(table)) {
      if (columns == null) {
        result.add(new LinkedHashMap<>(row));
        continue;
      }
      Map<String, Object> projected = new LinkedHashMap<>();
      for (String column : columns) {
        if (!row.containsKey(column)) {
          throw new SQLException("Column " + column + " does not exist in " + table);
        }
        projected.put(column, row.get(column));
      }
      result.add(projected);
    }
    return result;
  }

  @Override
  public synchronized int update(
      String table, Map<String, Object> record, String where, List<Object> args)
      throws SQLException {
    Map<String, Object> criteria = parseWhere(where, args);
    int affected = 0;
    for (Map<String, Object> row : rows(table)) {
      if (matches(row, criteria)) {
        row.putAll(record);
        affected++;
      }
    }
    return affected;
  }

  @Override
  public synchronized int delete(String table, @Nullable String where, List<Object> args)
      throws SQLException {
    Map<String, Object> criteria = where == null ? Map.of() : parseWhere(where, args);
    int affected = 0;
    for (Iterator<Map<String, Object>> it = rows(table).iterator(); it.hasNext(); ) {
      if (matches(it.next(), criteria)) {
        it.remove();
        affected++;
      }
    }
    return affected;
  }

  /** Returns the number of rows currently held for a table. */
  public synchronized int size(String table) {
    return rows(table).size();
  }

  private List<Map<String, Object>> rows(String table) {
    return tables.getOrDefault(table, new ArrayList<>());
  }

  /** Parses an equality conjunction into column/value pairs. */
  private static Map<String, Object> parseWhere(String where, List<Object> args)
      throws SQLException {
    if (where == null || where.isBlank()) {
      throw new SQLException("Missing WHERE clause");
    }
    Map<String, Object> criteria = new LinkedHashMap<>();
    int index = 0;
    for (String term : AND.split(where)) {
      Matcher matcher = EQUALITY.matcher(term);
      if (!matcher.matches()) {
        throw new SQLException("Unsupported WHERE term: " + term);
      }
      if (index >= args.size()) {
        throw new SQLException("No value bound for placeholder " + (index + 1) + " in: " + where);
      }
      String column =
          matcher.group(1) != null ? matcher.group(1).replace("\"\"", "\"") : matcher.group(2);
      criteria.put(column, args.get(index++));
    }
    if (index != args.size()) {
      throw new SQLException(args.size() + " values bound to " + index + " placeholders");
    }
    return criteria;
  }

  private static boolean matches(Map<String, Object> row, Map<String, Object> criteria) {
    for (Map.Entry<String, Object> criterion : criteria.entrySet()) {
      if (!valuesEqual(row.get(criterion.getKey()), criterion.getValue())) {
        return false;
      }
    }
    return true;
  }

  private static boolean valuesEqual(Object stored, Object wanted) {
    if (isIntegral(stored) && isIntegral(wanted)) {
      return ((Number) stored).longValue() == ((Number) wanted).longValue();
    }
    return Objects.deepEquals(stored, wanted);
  }

  private static boolean isIntegral(Object value) {
    return value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte;
  }
}
