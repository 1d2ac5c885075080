/**
 * The data access layer.
 *
 * <p>The layer follows a consistent pattern:
 *
 * <ul>
 *   <li>{@link com.eliteorm.db.Store} is the relational engine: rows in and out as flat maps, with
 *       {@link com.eliteorm.db.JdbcStore} and {@link com.eliteorm.db.InMemoryStore} as
 *       implementations
 *   <li>{@link com.eliteorm.db.Dao} runs create, read, update and delete for one entity type,
 *       matching rows through a {@link com.eliteorm.db.KeyCondition} built from the primary key
 *   <li>{@link com.eliteorm.db.Repository} exposes the same operations as a collection
 *   <li>Operations return {@code StatusOr<T>} to handle either success with a value or failure with
 *       a status; nothing is retried
 * </ul>
 */
package com.eliteorm.db;
