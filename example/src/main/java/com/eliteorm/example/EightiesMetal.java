package com.eliteorm.example;

import com.eliteorm.model.BinaryField;
import com.eliteorm.model.BoolField;
import com.eliteorm.model.Entity;
import com.eliteorm.model.EnumField;
import com.eliteorm.model.ObjectField;
import com.eliteorm.model.ObjectListField;
import com.eliteorm.model.ScalarField;
import com.eliteorm.model.ScalarListField;
import com.eliteorm.model.ScalarType;
import com.eliteorm.model.TimestampField;
import java.time.Instant;
import java.util.List;

/** Information about an 80s metal band, using every kind of field. */
public final class EightiesMetal extends Entity<EightiesMetal> {
  // First field, so it is the primary key.
  private final ScalarField<String> name = add(ScalarField.ofText("name", ""));
  private final ObjectField<Album> album = add(new ObjectField<>(Album::new, "album", new Album()));
  private final EnumField<MetalSubGenre> genre =
      add(new EnumField<>(MetalSubGenre.values(), "type", MetalSubGenre.THRASH));
  private final BoolField defunct = add(new BoolField("defunct", false));
  private final TimestampField formed = add(new TimestampField("formed", Instant.EPOCH));
  private final ObjectListField<ActivePeriod> active =
      add(new ObjectListField<ActivePeriod>(ActivePeriod::new, "active", List.of()));
  private final ScalarListField<String> bandMembers =
      add(new ScalarListField<>(ScalarType.TEXT, "members", List.of()));
  private final ScalarListField<Integer> studioAlbumYears =
      add(new ScalarListField<>(ScalarType.INTEGER, "studioAlbumYears", List.of()));
  private final BinaryField logo = add(new BinaryField("logo", new byte[0]));

  public EightiesMetal() {
    super(EightiesMetal::new);
  }

  private EightiesMetal(Builder builder) {
    this();
    name.setValue(builder.name);
    album.setValue(builder.album);
    genre.setValue(builder.genre);
    defunct.setValue(builder.defunct);
    formed.setValue(builder.formed);
    active.setValue(builder.active);
    bandMembers.setValue(builder.bandMembers);
    studioAlbumYears.setValue(builder.studioAlbumYears);
    logo.setValue(builder.logo);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** The name of the band. */
  public String getName() {
    return name.value();
  }

  /** The debut album. */
  public Album getAlbum() {
    return album.value();
  }

  public MetalSubGenre getGenre() {
    return genre.value();
  }

  public void setGenre(MetalSubGenre genre) {
    this.genre.setValue(genre);
  }

  /** Has the band broken up? */
  public boolean isDefunct() {
    return defunct.value();
  }

  public void setDefunct(boolean defunct) {
    this.defunct.setValue(defunct);
  }

  public Instant getFormed() {
    return formed.value();
  }

  public List<ActivePeriod> getActive() {
    return active.value();
  }

  public List<String> getBandMembers() {
    return bandMembers.value();
  }

  /** Years in which studio albums came out. */
  public List<Integer> getStudioAlbumYears() {
    return studioAlbumYears.value();
  }

  /** The band logo as PNG bytes; empty when unknown. */
  public byte[] getLogo() {
    return logo.value();
  }

  /** Builder for {@link EightiesMetal}. Unset values keep the column defaults. */
  public static final class Builder {
    private final String name;
    private Album album = new Album();
    private MetalSubGenre genre = MetalSubGenre.THRASH;
    private boolean defunct;
    private Instant formed = Instant.EPOCH;
    private List<ActivePeriod> active = List.of();
    private List<String> bandMembers = List.of();
    private List<Integer> studioAlbumYears = List.of();
    private byte[] logo = new byte[0];

    private Builder(String name) {
      this.name = name;
    }

    public Builder album(Album album) {
      this.album = album;
      return this;
    }

    public Builder genre(MetalSubGenre genre) {
      this.genre = genre;
      return this;
    }

    public Builder defunct(boolean defunct) {
      this.defunct = defunct;
      return this;
    }

    public Builder formed(Instant formed) {
      this.formed = formed;
      return this;
    }

    public Builder active(List<ActivePeriod> active) {
      this.active = active;
      return this;
    }

    public Builder bandMembers(List<String> bandMembers) {
      this.bandMembers = bandMembers;
      return this;
    }

    public Builder studioAlbumYears(List<Integer> studioAlbumYears) {
      this.studioAlbumYears = studioAlbumYears;
      return this;
    }

    public Builder logo(byte[] logo) {
      this.logo = logo;
      return this;
    }

    public EightiesMetal build() {
      return new EightiesMetal(this);
    }
  }
}
