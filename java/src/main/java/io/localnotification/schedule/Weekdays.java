package io.localnotification.schedule;

import java.time.DayOfWeek;
import java.util.OptionalInt;

/**
 * Weekday numbering helpers.
 *
 * <p>Callers number weekdays 1 = Monday through 7 = Sunday. The platform calendar numbers them 1 =
 * Sunday through 7 = Saturday. Index 0 of the remap table is a sentinel.
 */
public final class Weekdays {
  private static final int[] REMAP = {0, 2, 3, 4, 5, 6, 7, 1};

  private Weekdays() {}

  /**
   * Maps a caller weekday to the platform numbering.
   *
   * @param weekday the caller weekday (0-7)
   * @return the platform weekday, or empty if the input is out of range
   */
  public static OptionalInt remap(long weekday) {
    if (weekday < 0 || weekday >= REMAP.length) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(REMAP[(int) weekday]);
  }

  /**
   * Returns the platform number of a day of the week.
   *
   * @param dow the day of the week
   * @return 1 for Sunday through 7 for Saturday
   */
  public static int platformNumber(DayOfWeek dow) {
    return dow.getValue() % 7 + 1;
  }
}
