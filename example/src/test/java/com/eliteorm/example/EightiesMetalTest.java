package com.eliteorm.example;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eliteorm.common.status.StatusOr;
import com.eliteorm.db.Dao;
import com.eliteorm.db.InMemoryStore;
import com.eliteorm.reactive.EntityPublisher;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

public class EightiesMetalTest {

  @Test
  public void testDescribeTable() {
    assertEquals(
        "EightiesMetal (name TEXT,album TEXT,type INTEGER,defunct INTEGER,formed TEXT,"
            + "active TEXT,members TEXT,studioAlbumYears TEXT,logo BYTEA,PRIMARY KEY (name))",
        new EightiesMetal().describeTable());
  }

  @Test
  public void testRoundTripOfDemoBands() {
    for (EightiesMetal band : DemoData.all()) {
      StatusOr<EightiesMetal> copy = new EightiesMetal().fromMap(band.toMap());

      assertTrue(copy.isOk(), "Rebuild of " + band.getName() + ": " + copy.getStatus());
      assertEquals(band, copy.getValue());
    }
  }

  @Test
  public void testOpenActivePeriodHasNoEnd() {
    EightiesMetal metallica = DemoData.metallica();

    EightiesMetal copy = new EightiesMetal().fromMap(metallica.toMap()).getValue();

    assertEquals(Optional.empty(), copy.getActive().get(0).getEnd());
    assertEquals("[{\"start\":\"1981-01-01T00:00:00Z\"}]", metallica.toMap().get("active"));
  }

  @Test
  public void testLogosAreLoaded() {
    byte[] logo = DemoData.slayer().getLogo();

    assertTrue(logo.length > 8, "Logo should hold a PNG");
    assertArrayEquals(new byte[] {(byte) 0x89, 'P', 'N', 'G'}, Arrays.copyOf(logo, 4));
  }

  @Test
  public void testPublisherWorkflow() {
    InMemoryStore store = new InMemoryStore();
    EntityPublisher<EightiesMetal> bands =
        new EntityPublisher<>(new Dao<>(new EightiesMetal(), store));
    EightiesMetal slayer = DemoData.slayer();

    StepVerifier.create(bands.all())
        .then(() -> bands.create(slayer))
        .assertNext(list -> assertEquals(List.of(slayer), list))
        .then(
            () -> {
              slayer.setDefunct(false);
              bands.update(slayer);
            })
        .assertNext(list -> assertFalse(list.get(0).isDefunct()))
        .then(() -> bands.delete("Slayer"))
        .expectNext(List.of())
        .then(bands::dispose)
        .expectComplete()
        .verify(Duration.ofSeconds(5));
  }
}
