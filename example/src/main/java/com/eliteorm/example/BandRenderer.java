package com.eliteorm.example;

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import javax.annotation.Nonnull;

/** Renders bands as plain text, oldest band first. */
public final class BandRenderer {
  private static final Joiner LINES = Joiner.on('\n');
  private static final Joiner COMMA = Joiner.on(", ");

  private BandRenderer() {}

  /** Renders every band, sorted by formation date; an empty list renders as an empty string. */
  @Nonnull
  public static String render(List<EightiesMetal> bands) {
    List<EightiesMetal> sorted = new ArrayList<>(bands);
    sorted.sort(Comparator.comparing(EightiesMetal::getFormed));
    List<String> cards = new ArrayList<>();
    for (EightiesMetal band : sorted) {
      cards.add(render(band));
    }
    return Joiner.on("\n\n").join(cards);
  }

  @Nonnull
  public static String render(EightiesMetal band) {
    List<String> lines = new ArrayList<>();
    lines.add(band.getName());
    lines.add(Ascii.toLowerCase(band.getGenre().name()) + " metal");
    lines.add("Formed " + date(band.getFormed()) + (band.isDefunct() ? " (disbanded)" : ""));
    lines.add("Active:");
    for (ActivePeriod period : band.getActive()) {
      lines.add(
          "  "
              + year(period.getStart())
              + " - "
              + period.getEnd().map(end -> String.valueOf(year(end))).orElse("present"));
    }
    lines.add("Studio album years: " + COMMA.join(band.getStudioAlbumYears()));
    Album album = band.getAlbum();
    lines.add(album.getName() + " (" + date(album.getRelease()) + ", " + album.getLength() + ")");
    lines.add("Members: " + COMMA.join(band.getBandMembers()));
    if (band.getLogo().length > 0) {
      lines.add("Logo: " + band.getLogo().length + " bytes");
    }
    return LINES.join(lines);
  }

  private static LocalDate date(Instant instant) {
    return instant.atOffset(ZoneOffset.UTC).toLocalDate();
  }

  private static int year(Instant instant) {
    return date(instant).getYear();
  }
}
