package com.eliteorm.model;

/**
 * Column storage types emitted by {@link Entity#describeTable()}. The declarations use PostgreSQL
 * spelling.
 */
public enum SqlType {
  INTEGER("INTEGER"),
  BIGINT("BIGINT"),
  DOUBLE("DOUBLE PRECISION"),
  TEXT("TEXT"),
  BINARY("BYTEA");

  private final String declaration;

  SqlType(String declaration) {
    this.declaration = declaration;
  }

  /** Returns the type as written in a column definition. */
  public String declaration() {
    return declaration;
  }
}
