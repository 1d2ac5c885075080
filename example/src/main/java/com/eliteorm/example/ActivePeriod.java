package com.eliteorm.example;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusOr;
import com.eliteorm.model.Mappable;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A span of time during which a band was active. An open period has no end.
 *
 * <p>This type implements {@link Mappable} by hand to show how a value that is not an
 * {@link com.eliteorm.model.Entity} can be nested. Extending {@code Entity} with two
 * {@code TimestampField}s would be simpler.
 */
public final class ActivePeriod implements Mappable<ActivePeriod> {
  private static final String START = "start";
  private static final String END = "end";

  private final Instant start;
  @Nullable private final Instant end;

  /** A blank period, used as the factory for decoding. */
  public ActivePeriod() {
    this(Instant.EPOCH, null);
  }

  public ActivePeriod(Instant start, @Nullable Instant end) {
    this.start = Objects.requireNonNull(start, "start");
    this.end = end;
  }

  /** A period that has not ended. */
  public static ActivePeriod since(Instant start) {
    return new ActivePeriod(start, null);
  }

  public Instant getStart() {
    return start;
  }

  public Optional<Instant> getEnd() {
    return Optional.ofNullable(end);
  }

  /** Encodes both bounds as ISO-8601 text; an open period has no {@code end} entry. */
  @Override
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(START, start.toString());
    if (end != null) {
      map.put(END, end.toString());
    }
    return map;
  }

  @Override
  public StatusOr<ActivePeriod> fromMap(Map<String, ?> map) {
    Object startValue = map.get(START);
    Object endValue = map.get(END);
    if (!(startValue instanceof String)) {
      return StatusOr.ofStatus(Status.failedPrecondition("Unknown data member key: " + START));
    }
    if (endValue != null && !(endValue instanceof String)) {
      return StatusOr.ofStatus(Status.dataLoss("Expected ISO-8601 text for " + END));
    }
    try {
      return StatusOr.ofValue(
          new ActivePeriod(
              Instant.parse((String) startValue),
              endValue == null ? null : Instant.parse((String) endValue)));
    } catch (DateTimeParseException e) {
      return StatusOr.ofStatus(Status.dataLoss("Invalid active period " + map, e));
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ActivePeriod)) {
      return false;
    }
    ActivePeriod other = (ActivePeriod) obj;
    return start.equals(other.start) && Objects.equals(end, other.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return start + "/" + (end == null ? "" : end);
  }
}
