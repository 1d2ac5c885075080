package com.eliteorm.example;

import com.google.common.io.Resources;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/** The three bands the demo stores. Logos are small PNGs on the classpath. */
public final class DemoData {

  private DemoData() {}

  public static EightiesMetal slayer() {
    return EightiesMetal.builder("Slayer")
        .album(new Album("Show No Mercy", date(1983, 12, 1), Duration.ofMinutes(35).plusSeconds(2)))
        .genre(MetalSubGenre.THRASH)
        .defunct(true)
        .formed(date(1981, 1, 1))
        .active(List.of(new ActivePeriod(date(1981, 1, 1), date(2019, 1, 1))))
        .bandMembers(List.of("Tom Araya", "Jeff Hanneman", "Kerry King", "Dave Lombardo"))
        .studioAlbumYears(
            List.of(1983, 1985, 1986, 1988, 1990, 1994, 1996, 1998, 2001, 2006, 2009, 2015))
        .logo(logo("slayer"))
        .build();
  }

  public static EightiesMetal metallica() {
    return EightiesMetal.builder("Metallica")
        .album(new Album("Kill 'Em All", date(1983, 7, 25), Duration.ofMinutes(51).plusSeconds(20)))
        .genre(MetalSubGenre.THRASH)
        .formed(date(1981, 10, 28))
        .active(List.of(ActivePeriod.since(date(1981, 1, 1))))
        .bandMembers(List.of("Cliff Burton", "Kirk Hammett", "James Hetfield", "Lars Ulrich"))
        .studioAlbumYears(
            List.of(1983, 1984, 1986, 1988, 1991, 1996, 1997, 2003, 2008, 2016, 2023))
        .logo(logo("metallica"))
        .build();
  }

  public static EightiesMetal megadeth() {
    return EightiesMetal.builder("Megadeth")
        .album(
            new Album(
                "Killing Is My Business... and Business Is Good!",
                date(1985, 6, 12),
                Duration.ofMinutes(31).plusSeconds(10)))
        .genre(MetalSubGenre.SPEED)
        .formed(date(1983, 7, 1))
        .active(
            List.of(
                new ActivePeriod(date(1983, 1, 1), date(2002, 1, 1)),
                ActivePeriod.since(date(2004, 1, 1))))
        .bandMembers(List.of("David Ellefson", "Dave Mustaine", "Chris Poland", "Gar Samuelson"))
        .studioAlbumYears(
            List.of(
                1985, 1986, 1988, 1990, 1992, 1994, 1997, 1999, 2001, 2004, 2007, 2009, 2011,
                2013, 2016, 2022))
        .logo(logo("megadeth"))
        .build();
  }

  public static List<EightiesMetal> all() {
    return List.of(slayer(), metallica(), megadeth());
  }

  static Instant date(int year, int month, int day) {
    return LocalDate.of(year, month, day).atStartOfDay(ZoneOffset.UTC).toInstant();
  }

  /**
   * Loads {@code logos/<name>.png} from the classpath.
   *
   * @throws UncheckedIOException if the resource cannot be read
   */
  static byte[] logo(String name) {
    try {
      return Resources.toByteArray(Resources.getResource("logos/" + name + ".png"));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read logo for " + name, e);
    }
  }
}
