package com.eliteorm.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eliteorm.common.status.Status;
import com.eliteorm.common.status.StatusCode;
import com.eliteorm.fixtures.DateRange;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link ScalarListField} and {@link ObjectListField}. */
public class ListFieldsTest {

  /** A nested entity with a single double column. */
  private static final class Score extends Entity<Score> {
    private final ScalarField<Double> value = add(ScalarField.ofDouble("value", 0.0));

    Score() {
      super(Score::new);
    }

    Score(double value) {
      this();
      this.value.setValue(value);
    }
  }

  private static final DateRange EIGHTIES =
      new DateRange(Instant.parse("1980-01-01T00:00:00Z"), Instant.parse("1989-12-31T00:00:00Z"));

  @Test
  public void testScalarListIsJsonArray() {
    ScalarListField<String> members =
        new ScalarListField<>(ScalarType.TEXT, "members", List.of("Tom Araya", "Kerry \"K\" King"));

    assertEquals("[\"Tom Araya\",\"Kerry \\\"K\\\" King\"]", members.toWire());
    assertEquals(SqlType.TEXT, members.sqlType());
    assertEquals(FieldKind.SCALAR_LIST, members.kind());
    assertEquals(ScalarType.TEXT, members.elementType());
  }

  @Test
  public void testScalarListDecodesWithElementType() {
    ScalarListField<Integer> years =
        new ScalarListField<>(ScalarType.INTEGER, "studioAlbumYears", List.of());

    assertTrue(years.fromWire("[1983,1985,1986]").isOk());
    assertEquals(List.of(1983, 1985, 1986), years.value());
    assertTrue(years.fromWire("[]").isOk());
    assertEquals(List.of(), years.value());
  }

  @Test
  public void testScalarListKeepsNanAndInfinity() {
    ScalarListField<Double> ratings =
        new ScalarListField<>(
            ScalarType.DOUBLE,
            "ratings",
            List.of(Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, 4.5));

    Object wire = ratings.toWire();
    ScalarListField<Double> copy = new ScalarListField<>(ScalarType.DOUBLE, "ratings", List.of());
    Status status = copy.fromWire(wire);

    assertEquals("[NaN,Infinity,-Infinity,4.5]", wire);
    assertTrue(status.isOk(), "Decode should succeed: " + status);
    assertEquals(ratings.value(), copy.value());
  }

  @Test
  public void testNestedDoubleKeepsNanAndInfinity() {
    ObjectListField<Score> scores =
        new ObjectListField<Score>(
            Score::new,
            "scores",
            List.of(new Score(Double.NaN), new Score(Double.NEGATIVE_INFINITY)));

    ObjectListField<Score> copy = new ObjectListField<Score>(Score::new, "scores", List.of());
    Status status = copy.fromWire(scores.toWire());

    assertTrue(status.isOk(), "Decode should succeed: " + status);
    assertEquals(scores.value(), copy.value());
  }

  @Test
  public void testScalarListRejectsWrongElement() {
    ScalarListField<Integer> years =
        new ScalarListField<>(ScalarType.INTEGER, "studioAlbumYears", List.of(1983));

    Status status = years.fromWire("[1983,\"1985\"]");

    assertEquals(StatusCode.DATA_LOSS, status.getCode());
    assertEquals(
        "Column studioAlbumYears: Element 1: Expected INTEGER but found String 1985",
        status.getMessage());
    assertEquals(StatusCode.DATA_LOSS, years.fromWire("[1983,null]").getCode());
    assertEquals(StatusCode.DATA_LOSS, years.fromWire("1983").getCode());
    assertEquals(List.of(1983), years.value());
  }

  @Test
  public void testScalarListHoldsACopy() {
    List<String> names = new ArrayList<>(List.of("Dave Mustaine"));
    ScalarListField<String> members = new ScalarListField<>(ScalarType.TEXT, "members", names);

    names.add("Kirk Hammett");

    assertEquals(List.of("Dave Mustaine"), members.value());
    assertThrows(UnsupportedOperationException.class, () -> members.value().add("x"));
  }

  @Test
  public void testScalarListWireValueOfChecksElements() {
    ScalarListField<Integer> years =
        new ScalarListField<>(ScalarType.INTEGER, "studioAlbumYears", List.of());

    assertEquals("[1983]", years.wireValueOf(List.of(1983)).getValue());
    assertEquals(
        StatusCode.INVALID_ARGUMENT, years.wireValueOf(List.of("1983")).getStatus().getCode());
  }

  @Test
  public void testObjectListRoundTrip() {
    // Given: A list of nested values
    ObjectListField<DateRange> active =
        new ObjectListField<DateRange>(
            DateRange::new, "active", List.of(EIGHTIES, new DateRange()));
    Object wire = active.toWire();

    // When: The wire value is decoded by another field
    ObjectListField<DateRange> copy =
        new ObjectListField<DateRange>(DateRange::new, "active", List.of());
    Status status = copy.fromWire(wire);

    // Then: The elements are equal and in order
    assertTrue(status.isOk(), "Decode should succeed: " + status);
    assertEquals(List.of(EIGHTIES, new DateRange()), copy.value());
    assertEquals(active, copy);
  }

  @Test
  public void testObjectListRejectsNonObjects() {
    ObjectListField<DateRange> active =
        new ObjectListField<DateRange>(DateRange::new, "active", List.of());

    assertEquals(
        "Column active: Element 0 is not a JSON object",
        active.fromWire("[1]").getMessage());
    assertEquals(
        StatusCode.FAILED_PRECONDITION,
        active.fromWire("[{\"start\":\"1980-01-01T00:00:00Z\"}]").getCode());
  }
}
