package com.eliteorm.model;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusOr;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

/**
 * A point in time stored as ISO-8601 text in UTC, e.g. {@code 1983-12-01T00:00:00Z}.
 *
 * <p>Decoding also accepts text with an offset ({@code 1983-12-01T00:00:00+02:00}), without one
 * ({@code 1983-12-01T00:00:00.000}) and a bare date ({@code 1983-12-01}). Text without an offset
 * is read as UTC; a bare date is midnight UTC.
 */
public final class TimestampField extends Field<Instant> {

  public TimestampField(String key, Instant value, boolean primary) {
    super(key, value, primary);
  }

  public TimestampField(String key, Instant value) {
    this(key, value, false);
  }

  @Override
  public FieldKind kind() {
    return FieldKind.TIMESTAMP;
  }

  @Override
  public SqlType sqlType() {
    return SqlType.TEXT;
  }

  @Override
  boolean accepts(Object candidate) {
    return candidate instanceof Instant;
  }

  @Override
  Object encode(Instant value) {
    return value.toString();
  }

  @Override
  StatusOr<Instant> decode(Object wire) {
    if (!(wire instanceof String)) {
      return StatusOr.ofStatus(
          Status.dataLoss("Expected ISO-8601 text but found " + describe(wire)));
    }
    try {
      return StatusOr.ofValue(parse((String) wire));
    } catch (DateTimeParseException e) {
      return StatusOr.ofStatus(Status.dataLoss("Invalid timestamp '" + wire + "'", e));
    }
  }

  private static Instant parse(String text) {
    if (text.indexOf('T') < 0) {
      return LocalDate.parse(text, DateTimeFormatter.ISO_DATE)
          .atStartOfDay(ZoneOffset.UTC)
          .toInstant();
    }
    TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parse(text);
    if (parsed.isSupported(ChronoField.INSTANT_SECONDS)) {
      return Instant.from(parsed);
    }
    return LocalDateTime.from(parsed).toInstant(ZoneOffset.UTC);
  }
}
