package com.eliteorm.example;

import com.eliteorm.model.DurationField;
import com.eliteorm.model.Entity;
import com.eliteorm.model.ScalarField;
import com.eliteorm.model.TimestampField;
import java.time.Duration;
import java.time.Instant;

/** A studio album. Stored on its own or nested in an {@link EightiesMetal} row. */
public final class Album extends Entity<Album> {
  private final ScalarField<String> name = add(ScalarField.ofText("name", ""));
  private final TimestampField release = add(new TimestampField("release", Instant.EPOCH));
  private final DurationField length = add(new DurationField("length", Duration.ZERO));

  public Album() {
    super(Album::new);
  }

  public Album(String name, Instant release, Duration length) {
    this();
    this.name.setValue(name);
    this.release.setValue(release);
    this.length.setValue(length);
  }

  /** The name of the album. */
  public String getName() {
    return name.value();
  }

  /** The release date of the album. */
  public Instant getRelease() {
    return release.value();
  }

  /** The running time of the album. */
  public Duration getLength() {
    return length.value();
  }
}
