package com.eliteorm.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.util.Map;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Configuration record for the JDBC connection pool behind a
 * {@link com.eliteorm.db.JdbcStore}.
 *
 * <p>Read from the environment with {@link #fromEnvironment()}:
 *
 * <ul>
 *   <li>{@code DB_URL} - JDBC URL; when absent the configuration is not usable
 *   <li>{@code DB_USER} - user name
 *   <li>{@code DB_PASSWORD} - password
 *   <li>{@code DB_POOL_SIZE} - maximum pool size, default {@value #DEFAULT_POOL_SIZE}
 * </ul>
 *
 * @param jdbcUrl The JDBC URL of the database, or null when not configured
 * @param username The user to connect as
 * @param password The password of that user
 * @param maximumPoolSize The maximum number of pooled connections
 */
public record StoreConfig(String jdbcUrl, String username, String password, int maximumPoolSize) {

  public static final int DEFAULT_POOL_SIZE = 10;

  public StoreConfig {
    if (maximumPoolSize < 1) {
      throw new IllegalArgumentException("maximumPoolSize must be positive: " + maximumPoolSize);
    }
  }

  /** Reads the configuration from the process environment. */
  @Nonnull
  public static StoreConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Reads the configuration from the given variables.
   *
   * @throws IllegalArgumentException if {@code DB_POOL_SIZE} is not a positive integer
   */
  @Nonnull
  public static StoreConfig fromEnvironment(Map<String, String> env) {
    String poolSize = env.get("DB_POOL_SIZE");
    int maximumPoolSize = DEFAULT_POOL_SIZE;
    if (!Strings.isNullOrEmpty(poolSize)) {
      try {
        maximumPoolSize = Integer.parseInt(poolSize.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("DB_POOL_SIZE is not a number: " + poolSize, e);
      }
    }
    return new StoreConfig(
        Strings.emptyToNull(env.get("DB_URL")),
        env.get("DB_USER"),
        env.get("DB_PASSWORD"),
        maximumPoolSize);
  }

  /** Returns true when a JDBC URL is present. */
  public boolean isConfigured() {
    return jdbcUrl != null;
  }

  /**
   * Builds a HikariCP connection pool for this configuration. The caller owns the pool and must
   * close it.
   *
   * @throws IllegalStateException if no JDBC URL is configured
   */
  @Nonnull
  public HikariDataSource createDataSource() {
    if (!isConfigured()) {
      throw new IllegalStateException("DB_URL is not set");
    }
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(jdbcUrl);
    config.setUsername(username);
    config.setPassword(password);
    config.setMaximumPoolSize(maximumPoolSize);
    config.setMinimumIdle(Math.min(2, maximumPoolSize));
    config.setIdleTimeout(30000);
    config.setMaxLifetime(1800000);
    config.setConnectionTimeout(30000);
    config.setAutoCommit(true);
    config.setPoolName("EliteOrmPool");
    config.addDataSourceProperty("cachePrepStmts", "true");
    config.addDataSourceProperty("prepStmtCacheSize", "250");
    config.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");

    Logger.info("Initializing database connection pool: {}", toSecureString());
    return new HikariDataSource(config);
  }

  /**
   * Returns a string representation of this object without the password, safe to use in logs.
   */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("jdbcUrl", jdbcUrl)
        .add("username", username)
        .add("maximumPoolSize", maximumPoolSize)
        .toString();
  }

  @Override
  public String toString() {
    return toSecureString();
  }
}
