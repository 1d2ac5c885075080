package com.eliteorm.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusCode;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

/** Tests for {@link TimestampField} and {@link DurationField}. */
public class TemporalFieldsTest {

  @Test
  public void testTimestampIsIsoText() {
    TimestampField formed = new TimestampField("formed", Instant.parse("1981-01-01T00:00:00Z"));

    assertEquals("1981-01-01T00:00:00Z", formed.toWire());
    assertEquals(SqlType.TEXT, formed.sqlType());
    assertTrue(formed.fromWire("1983-12-01T10:15:30.250Z").isOk());
    assertEquals(Instant.parse("1983-12-01T10:15:30.250Z"), formed.value());
  }

  @Test
  public void testTimestampAcceptsOffsetLocalAndDateOnlyText() {
    TimestampField formed = new TimestampField("formed", Instant.EPOCH);

    assertTrue(formed.fromWire("1983-12-01T02:00:00+02:00").isOk());
    assertEquals(Instant.parse("1983-12-01T00:00:00Z"), formed.value());

    assertTrue(formed.fromWire("1983-12-01T10:15:30.250").isOk());
    assertEquals(Instant.parse("1983-12-01T10:15:30.250Z"), formed.value());

    assertTrue(formed.fromWire("1981-01-01").isOk());
    assertEquals(Instant.parse("1981-01-01T00:00:00Z"), formed.value());
    assertEquals("1981-01-01T00:00:00Z", formed.toWire());
  }

  @Test
  public void testTimestampRejectsInvalidText() {
    TimestampField formed = new TimestampField("formed", Instant.EPOCH);

    Status status = formed.fromWire("December 1983");

    assertEquals(StatusCode.DATA_LOSS, status.getCode());
    assertTrue(status.getMessage().startsWith("Column formed: Invalid timestamp"));
    assertEquals(StatusCode.DATA_LOSS, formed.fromWire(1983).getCode());
    assertEquals(StatusCode.DATA_LOSS, formed.fromWire("1983-13-01").getCode());
    assertEquals(StatusCode.DATA_LOSS, formed.fromWire("1983-12-01T25:00").getCode());
    assertEquals(Instant.EPOCH, formed.value());
  }

  @Test
  public void testDurationIsMicroseconds() {
    DurationField length = new DurationField("length", Duration.ofMinutes(35).plusSeconds(2));

    assertEquals(2_102_000_000L, length.toWire());
    assertEquals(SqlType.BIGINT, length.sqlType());
  }

  @Test
  public void testDurationDropsSubMicroseconds() {
    DurationField length = new DurationField("length", Duration.ofNanos(1_500));

    assertEquals(1L, length.toWire());
  }

  @Test
  public void testDurationDecodes() {
    DurationField length = new DurationField("length", Duration.ZERO);

    assertTrue(length.fromWire(1_000_001).isOk());
    assertEquals(Duration.ofSeconds(1).plusNanos(1_000), length.value());
    assertEquals(StatusCode.DATA_LOSS, length.fromWire("1s").getCode());
  }
}
