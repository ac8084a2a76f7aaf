package io.localnotification.schedule;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Time units that a tick count can be expressed in, with their length in seconds. */
public enum TickUnit {
  SECOND("second", 1),
  MINUTE("minute", 60),
  HOUR("hour", 3_600),
  DAY("day", 86_400),
  WEEK("week", 604_800),
  /** A twelfth of a 365 day year. */
  MONTH("month", 2_628_000),
  QUARTER("quarter", 7_884_000),
  YEAR("year", 31_536_000);

  private final String displayName;
  private final long seconds;

  TickUnit(String displayName, long seconds) {
    this.displayName = displayName;
    this.seconds = seconds;
  }

  /**
   * Returns the number of seconds in one tick of this unit.
   *
   * @return the multiplier
   */
  public long seconds() {
    return seconds;
  }

  @Override
  public String toString() {
    return displayName;
  }

  private static final Map<String, TickUnit> PARSE_MAP =
      Map.ofEntries(
          Map.entry("second", SECOND), Map.entry("seconds", SECOND),
          Map.entry("minute", MINUTE), Map.entry("minutes", MINUTE),
          Map.entry("hour", HOUR), Map.entry("hours", HOUR),
          Map.entry("day", DAY), Map.entry("days", DAY),
          Map.entry("week", WEEK), Map.entry("weeks", WEEK),
          Map.entry("month", MONTH), Map.entry("months", MONTH),
          Map.entry("quarter", QUARTER), Map.entry("quarters", QUARTER),
          Map.entry("year", YEAR), Map.entry("years", YEAR));

  /**
   * Parses a unit name, singular or plural, case insensitive.
   *
   * @param s the string to parse (may be null)
   * @return the unit if recognized
   */
  public static Optional<TickUnit> parse(String s) {
    if (s == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(PARSE_MAP.get(s.trim().toLowerCase(Locale.ROOT)));
  }

  /**
   * Converts a tick count to seconds. An unknown or absent unit counts ticks as seconds. The
   * result is never negative, and a tick count that is not finite or overflows gives 0.
   *
   * @param ticks the tick count
   * @param unit the unit name (may be null)
   * @return the equivalent number of seconds
   */
  public static double toSeconds(double ticks, String unit) {
    long multiplier = parse(unit).map(TickUnit::seconds).orElse(1L);
    double seconds = ticks * multiplier;
    if (!Double.isFinite(seconds) || seconds < 0) {
      return 0;
    }
    return seconds;
  }
}
