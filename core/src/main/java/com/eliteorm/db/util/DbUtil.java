package com.eliteorm.db.util;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusOr;
import com.google.common.base.Strings;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;

/** Utility methods shared by the field codecs and the stores. */
public final class DbUtil {

  /**
   * Integral JSON numbers decode to {@code Long}, everything else to {@code Double}, so that
   * nested integer and microsecond columns survive a round trip without widening to double. NaN
   * and the infinities are written as the bare literals {@code NaN}, {@code Infinity} and
   * {@code -Infinity}.
   */
  private static final Gson GSON =
      new GsonBuilder()
          .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
          .serializeSpecialFloatingPointValues()
          .create();

  private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();
  private static final Type LIST_TYPE = new TypeToken<List<Object>>() {}.getType();

  private DbUtil() {
    // Utility class, no instances
  }

  /** Serializes the given value (a list, a map or a scalar) to JSON text. */
  @Nonnull
  public static String toJson(Object value) {
    return GSON.toJson(value);
  }

  /**
   * Parses JSON text holding an object into a map of name/value pairs.
   *
   * @param json the JSON text
   * @return StatusOr containing the parsed map, or DATA_LOSS if the text is not a JSON object
   */
  @Nonnull
  public static StatusOr<Map<String, Object>> parseJsonObject(String json) {
    if (Strings.isNullOrEmpty(json)) {
      return StatusOr.ofStatus(Status.dataLoss("Expected a JSON object but found empty text"));
    }
    try {
      Map<String, Object> map = GSON.fromJson(json, MAP_TYPE);
      if (map == null) {
        return StatusOr.ofStatus(Status.dataLoss("Expected a JSON object but found null"));
      }
      return StatusOr.ofValue(map);
    } catch (JsonParseException | IllegalStateException e) {
      return StatusOr.ofStatus(Status.dataLoss("Failed to parse JSON object: " + e.getMessage(), e));
    }
  }

  /**
   * Parses JSON text holding an array into a list.
   *
   * @param json the JSON text
   * @return StatusOr containing the parsed list, or DATA_LOSS if the text is not a JSON array
   */
  @Nonnull
  public static StatusOr<List<Object>> parseJsonArray(String json) {
    if (Strings.isNullOrEmpty(json)) {
      return StatusOr.ofStatus(Status.dataLoss("Expected a JSON array but found empty text"));
    }
    try {
      List<Object> list = GSON.fromJson(json, LIST_TYPE);
      if (list == null) {
        return StatusOr.ofStatus(Status.dataLoss("Expected a JSON array but found null"));
      }
      return StatusOr.ofValue(list);
    } catch (JsonParseException | IllegalStateException e) {
      return StatusOr.ofStatus(Status.dataLoss("Failed to parse JSON array: " + e.getMessage(), e));
    }
  }

  /**
   * Quotes an SQL identifier so that mixed-case table and column names keep their case. Embedded
   * double quotes are doubled.
   */
  @Nonnull
  public static String quote(String identifier) {
    if (Strings.isNullOrEmpty(identifier)) {
      throw new IllegalArgumentException("Identifier cannot be empty");
    }
    return '"' + identifier.replace("\"", "\"\"") + '"';
  }
}
