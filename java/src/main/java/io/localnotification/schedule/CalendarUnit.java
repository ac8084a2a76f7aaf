package io.localnotification.schedule;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * A calendar unit that a notification can repeat every. Each unit pins the fields finer than
 * itself to the anchor's values, so the pattern matches once per unit.
 */
public enum CalendarUnit {
  MINUTE("minute", EnumSet.of(CalendarField.SECOND)),
  HOUR("hour", EnumSet.of(CalendarField.MINUTE, CalendarField.SECOND)),
  DAY("day", EnumSet.of(CalendarField.HOUR, CalendarField.MINUTE, CalendarField.SECOND)),
  WEEK(
      "week",
      EnumSet.of(
          CalendarField.WEEKDAY, CalendarField.HOUR, CalendarField.MINUTE, CalendarField.SECOND)),
  MONTH(
      "month",
      EnumSet.of(
          CalendarField.DAY, CalendarField.HOUR, CalendarField.MINUTE, CalendarField.SECOND)),
  YEAR(
      "year",
      EnumSet.of(
          CalendarField.MONTH,
          CalendarField.DAY,
          CalendarField.HOUR,
          CalendarField.MINUTE,
          CalendarField.SECOND));

  /** Fields pinned when the unit name is not recognized: an exact date and time. */
  private static final Set<CalendarField> EXACT =
      EnumSet.of(
          CalendarField.YEAR,
          CalendarField.MONTH,
          CalendarField.DAY,
          CalendarField.HOUR,
          CalendarField.MINUTE,
          CalendarField.SECOND);

  private final String displayName;
  private final Set<CalendarField> fixedFields;

  CalendarUnit(String displayName, Set<CalendarField> fixedFields) {
    this.displayName = displayName;
    this.fixedFields = fixedFields;
  }

  /**
   * Returns the fields this unit pins to the anchor.
   *
   * @return an unmodifiable copy of the fields
   */
  public Set<CalendarField> fixedFields() {
    return Set.copyOf(fixedFields);
  }

  @Override
  public String toString() {
    return displayName;
  }

  /**
   * Parses a unit name. Names match exactly, so {@code "Day"} is not a unit.
   *
   * @param s the string to parse (may be null)
   * @return the unit if recognized
   */
  public static Optional<CalendarUnit> parse(String s) {
    for (CalendarUnit unit : values()) {
      if (unit.displayName.equals(s)) {
        return Optional.of(unit);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the fields pinned for a repeat unit name. Unrecognized names pin the full date and
   * time.
   *
   * @param name the unit name
   * @return the fields to copy from the anchor
   */
  public static Set<CalendarField> fieldsFor(String name) {
    return parse(name).map(CalendarUnit::fixedFields).orElseGet(() -> Set.copyOf(EXACT));
  }
}
