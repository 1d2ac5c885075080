package com.eliteorm.model;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eliteorm.common.status.StatusCode;
import com.eliteorm.common.status.StatusOr;
import com.eliteorm.fixtures.Album;
import com.eliteorm.fixtures.Band;
import com.eliteorm.fixtures.Genre;
import com.eliteorm.fixtures.Release;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for the mapping behaviour shared by every {@link Entity}. */
public class EntityTest {

  /** An entity that flags its first field primary as well; the key must not repeat it. */
  static final class Tag extends Entity<Tag> {
    final ScalarField<String> label = add(ScalarField.ofText("label", "", true));
    final ScalarField<Integer> weight = add(ScalarField.ofInt("weight", 0));

    Tag() {
      super(Tag::new);
    }
  }

  static final class Duplicate extends Entity<Duplicate> {
    Duplicate() {
      super(Duplicate::new);
      add(ScalarField.ofText("name", ""));
      add(ScalarField.ofInt("name", 0));
    }
  }

  static final class Empty extends Entity<Empty> {
    Empty() {
      super(Empty::new);
    }
  }

  @Test
  public void testDescribeTable() {
    assertEquals(
        "Album (name TEXT,release TEXT,length BIGINT,PRIMARY KEY (name))",
        new Album().describeTable());
    assertEquals(
        "Release (name TEXT,year INTEGER,value INTEGER,PRIMARY KEY (name,year))",
        new Release().describeTable());
    assertEquals(
        "Band (name TEXT,album TEXT,genre INTEGER,defunct INTEGER,formed TEXT,active TEXT,"
            + "members TEXT,studioAlbumYears TEXT,rating DOUBLE PRECISION,listeners BIGINT,"
            + "logo BYTEA,PRIMARY KEY (name))",
        new Band().describeTable());
  }

  @Test
  public void testFirstFieldFlaggedPrimaryIsNotRepeated() {
    Tag tag = new Tag();

    assertEquals(1, tag.primaryKey().size());
    assertEquals("Tag (label TEXT,weight INTEGER,PRIMARY KEY (label))", tag.describeTable());
  }

  @Test
  public void testPrimaryKeyAndTable() {
    Release release = new Release("A", 2000, 1);

    assertEquals("Release", release.table());
    assertEquals("name", release.idColumn());
    assertEquals(List.of("name", "year"), keys(release.primaryKey()));
    assertEquals(List.of("name", "year", "value"), keys(release.fields()));
  }

  @Test
  public void testToMapFollowsFieldOrder() {
    Map<String, Object> map = new Release("A", 2000, 1).toMap();

    assertEquals(List.of("name", "year", "value"), new ArrayList<>(map.keySet()));
    assertEquals("A", map.get("name"));
    assertEquals(2000, map.get("year"));
  }

  @Test
  public void testToMapEncodesEveryKind() {
    Map<String, Object> map = Band.slayer().toMap();

    assertEquals("Slayer", map.get("name"));
    assertEquals(1, map.get("genre"));
    assertEquals(0, map.get("defunct"));
    assertEquals("1981-01-01T00:00:00Z", map.get("formed"));
    assertEquals("[1983,1985,1986,1988,1990]", map.get("studioAlbumYears"));
    assertEquals(
        "[{\"start\":\"1981-01-01T00:00:00Z\",\"end\":\"2019-11-30T00:00:00Z\"}]",
        map.get("active"));
    assertEquals(5_000_000_000L, map.get("listeners"));
    assertArrayEquals(new byte[] {(byte) 0x89, 'P', 'N', 'G', 0, -1}, (byte[]) map.get("logo"));
  }

  @Test
  public void testRoundTripWithEveryKind() {
    // Given: An entity with every field kind populated
    Band slayer = Band.slayer();

    // When: It is rebuilt from its own map
    StatusOr<Band> copy = new Band().fromMap(slayer.toMap());

    // Then: The copy is equal field by field
    assertTrue(copy.isOk(), "Rebuild should succeed: " + copy.getStatus());
    assertEquals(slayer, copy.getValue());
    assertEquals(slayer.hashCode(), copy.getValue().hashCode());
    assertEquals(Genre.THRASH, copy.getValue().genre());
    assertEquals(Duration.ofMinutes(35).plusSeconds(2), copy.getValue().album().length());
  }

  @Test
  public void testRoundTripWithoutCompositeFields() {
    Album album = new Album("Peace Sells", Instant.parse("1986-09-19T00:00:00Z"), Duration.ZERO);

    assertEquals(album, new Album().fromMap(album.toMap()).getValue());
  }

  @Test
  public void testFromMapIgnoresExtraColumns() {
    Map<String, Object> row = new Release("A", 2000, 1).toMap();
    row.put("rowid", 17L);

    assertEquals(new Release("A", 2000, 1), new Release().fromMap(row).getValue());
  }

  @Test
  public void testFromMapRejectsMissingColumn() {
    Map<String, Object> row = new Release("A", 2000, 1).toMap();
    row.remove("value");

    StatusOr<Release> result = new Release().fromMap(row);

    assertEquals(StatusCode.FAILED_PRECONDITION, result.getStatus().getCode());
    assertEquals("Unknown data member key: value", result.getStatus().getMessage());
  }

  @Test
  public void testFromMapReportsDecodeFailure() {
    Map<String, Object> row = Band.slayer().toMap();
    row.put("genre", 99);

    StatusOr<Band> result = new Band().fromMap(row);

    assertEquals(StatusCode.DATA_LOSS, result.getStatus().getCode());
    assertEquals(
        "Band: Column genre: Ordinal 99 is out of range for Genre",
        result.getStatus().getMessage());
  }

  @Test
  public void testChangingAnyFieldBreaksEquality() {
    Band slayer = Band.slayer();

    Band defunct = Band.slayer();
    defunct.setDefunct(true);
    assertNotEquals(slayer, defunct);

    Band doom = Band.slayer();
    doom.setGenre(Genre.DOOM);
    assertNotEquals(slayer, doom);

    Band lineup = Band.slayer();
    lineup.setMembers(List.of("Tom Araya"));
    assertNotEquals(slayer, lineup);

    Band longer = Band.slayer();
    longer.album().setLength(Duration.ofMinutes(40));
    assertNotEquals(slayer, longer);

    assertNotEquals(new Release("A", 2000, 1), new Release("A", 2000, 2));
    assertEquals(new Release("A", 2000, 1), new Release("A", 2000, 1));
  }

  @Test
  public void testToString() {
    assertEquals("Release{name=A, year=2000, value=1}", new Release("A", 2000, 1).toString());
  }

  @Test
  public void testRegistrationErrors() {
    assertThrows(IllegalArgumentException.class, Duplicate::new);
    assertThrows(IllegalStateException.class, () -> new Empty().primaryKey());
  }

  private static List<String> keys(List<Field<?>> fields) {
    List<String> keys = new ArrayList<>();
    for (Field<?> field : fields) {
      keys.add(field.key());
    }
    return keys;
  }
}
