package io.localnotification.schedule;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.WeekFields;
import java.util.Map;
import java.util.Optional;

/**
 * A wall-clock field that a calendar pattern can pin to a value.
 *
 * <p>Week based fields use a calendar whose week starts on Monday with a minimal first week of one
 * day. {@link #WEEKDAY} uses the platform numbering, 1 = Sunday through 7 = Saturday.
 */
public enum CalendarField {
  YEAR("year"),
  QUARTER("quarter"),
  MONTH("month"),
  WEEK("week"),
  WEEK_OF_MONTH("weekOfMonth"),
  DAY("day"),
  WEEKDAY("weekday"),
  WEEKDAY_ORDINAL("weekdayOrdinal"),
  HOUR("hour"),
  MINUTE("minute"),
  SECOND("second");

  /** Monday first, minimal days 1. */
  public static final WeekFields WEEK_FIELDS = WeekFields.of(DayOfWeek.MONDAY, 1);

  private final String key;

  CalendarField(String key) {
    this.key = key;
  }

  /**
   * Returns the option key naming this field.
   *
   * @return the key
   */
  public String key() {
    return key;
  }

  /**
   * Returns whether this field only depends on the date, not the time of day.
   *
   * @return true for date fields
   */
  public boolean isDateField() {
    return this != HOUR && this != MINUTE && this != SECOND;
  }

  /**
   * Reads this field from the wall clock of a zoned date-time.
   *
   * @param dt the date-time
   * @return the field value
   */
  public long extract(ZonedDateTime dt) {
    return extract(dt.toLocalDateTime());
  }

  /**
   * Reads this field from a local date-time.
   *
   * @param dt the date-time
   * @return the field value
   */
  public long extract(LocalDateTime dt) {
    return switch (this) {
      case YEAR -> dt.getYear();
      case QUARTER -> (dt.getMonthValue() - 1) / 3 + 1;
      case MONTH -> dt.getMonthValue();
      case WEEK -> dt.get(WEEK_FIELDS.weekOfYear());
      case WEEK_OF_MONTH -> dt.get(WEEK_FIELDS.weekOfMonth());
      case DAY -> dt.getDayOfMonth();
      case WEEKDAY -> Weekdays.platformNumber(dt.getDayOfWeek());
      case WEEKDAY_ORDINAL -> (dt.getDayOfMonth() - 1) / 7 + 1;
      case HOUR -> dt.getHour();
      case MINUTE -> dt.getMinute();
      case SECOND -> dt.getSecond();
    };
  }

  @Override
  public String toString() {
    return key;
  }

  private static final Map<String, CalendarField> PARSE_MAP =
      Map.ofEntries(
          Map.entry("year", YEAR),
          Map.entry("quarter", QUARTER),
          Map.entry("month", MONTH),
          Map.entry("week", WEEK),
          Map.entry("weekOfMonth", WEEK_OF_MONTH),
          Map.entry("day", DAY),
          Map.entry("weekday", WEEKDAY),
          Map.entry("weekdayOrdinal", WEEKDAY_ORDINAL),
          Map.entry("hour", HOUR),
          Map.entry("minute", MINUTE),
          Map.entry("second", SECOND));

  /**
   * Parses an option key. Keys are case sensitive, as the options object spells them.
   *
   * @param key the key to parse
   * @return the field if recognized
   */
  public static Optional<CalendarField> parse(String key) {
    return Optional.ofNullable(PARSE_MAP.get(key));
  }
}
