package com.eliteorm.model;

import com.eliteorm.common.status.StatusOr;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * A value that can be flattened into name/value pairs and rebuilt from them. Nested values held by
 * {@link ObjectField} and {@link ObjectListField} implement this; so does every {@link Entity}.
 *
 * <p>The values in the map must be JSON-friendly: strings, numbers, booleans, lists or maps of
 * those.
 *
 * @param <T> the concrete type produced by {@link #fromMap(Map)}
 */
public interface Mappable<T> {

  /** Converts this object into a map of name/value pairs. */
  @Nonnull
  Map<String, Object> toMap();

  /**
   * Constructs a new object from the given name/value pairs. The receiver is only used as a
   * template; it is not modified.
   *
   * @param map the pairs previously produced by {@link #toMap()}
   * @return StatusOr containing the new object or the reason it could not be built
   */
  @Nonnull
  StatusOr<T> fromMap(Map<String, ?> map);
}
