package io.localnotification.eval;

import io.localnotification.schedule.CalendarField;
import io.localnotification.trigger.OneShotAfter;
import io.localnotification.trigger.OneShotAt;
import io.localnotification.trigger.RepeatingCalendarPattern;
import io.localnotification.trigger.RepeatingCustomPattern;
import io.localnotification.trigger.RepeatingInterval;
import io.localnotification.trigger.TriggerResult;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes when a resolved trigger fires next.
 *
 * <h2>Calendar patterns</h2>
 *
 * <p>A pattern fires at every wall-clock time whose pinned fields all equal their values. The
 * search walks forward one day at a time, checks the date fields, and then picks the earliest time
 * of day that is strictly after the reference time. Unpinned time fields match every value.
 *
 * <p>MAX_DAYS (8 years): patterns with no match inside that horizon, such as an exact date in the
 * past or day 31 in a month without one, have no next occurrence.
 *
 * <h2>DST Handling</h2>
 *
 * <p>A wall-clock time inside a DST gap is pushed forward past the gap. An ambiguous time in a fold
 * resolves to the earlier offset.
 *
 * <p>Region triggers have no fire time of their own. Neither has a delay or interval that ends
 * beyond the largest representable date.
 */
public final class NextTrigger {
  /** Maximum days searched ahead for a pattern match. */
  private static final int MAX_DAYS = 8 * 366;

  /** Maximum occurrences returned by {@link #nextNFrom}. */
  private static final int MAX_ITERATIONS = 1000;

  /** Offsets at or beyond this cannot fall inside the supported year range. */
  private static final double MAX_OFFSET_SECONDS = 1e17;

  private NextTrigger() {}

  /**
   * Computes the next fire time strictly after the given time.
   *
   * @param trigger the resolved trigger
   * @param now the reference time, whose zone is used for wall-clock fields
   * @return the next fire time, or empty if none exists
   */
  public static Optional<ZonedDateTime> nextFrom(TriggerResult trigger, ZonedDateTime now) {
    if (trigger instanceof OneShotAt osa) {
      ZonedDateTime at = osa.at().atZone(now.getZone());
      return at.isAfter(now) ? Optional.of(at) : Optional.empty();
    }
    if (trigger instanceof OneShotAfter osa) {
      return plusSeconds(now, osa.seconds());
    }
    if (trigger instanceof RepeatingInterval ri) {
      return plusSeconds(now, ri.seconds());
    }
    if (trigger instanceof RepeatingCalendarPattern cp) {
      return nextMatch(cp.components(), now);
    }
    if (trigger instanceof RepeatingCustomPattern cp) {
      return nextMatch(cp.fields(), now);
    }
    return Optional.empty();
  }

  /**
   * Computes the next n fire times after the given time. A one-shot trigger yields at most one.
   *
   * @param trigger the resolved trigger
   * @param now the reference time
   * @param n the number of fire times to compute
   * @return a list of at most n fire times
   */
  public static List<ZonedDateTime> nextNFrom(TriggerResult trigger, ZonedDateTime now, int n) {
    List<ZonedDateTime> results = new ArrayList<>();
    ZonedDateTime current = now;

    for (int i = 0; i < n && i < MAX_ITERATIONS; i++) {
      Optional<ZonedDateTime> next = nextFrom(trigger, current);
      if (next.isEmpty()) {
        break;
      }
      results.add(next.get());
      if (!trigger.repeats()) {
        break;
      }
      current = next.get();
    }

    return results;
  }

  /**
   * Checks if a date-time matches a calendar pattern, or equals a one-shot fire time.
   *
   * @param trigger the resolved trigger
   * @param dt the date-time to check
   * @return true if the trigger fires at that time; always false for relative and region triggers
   */
  public static boolean matches(TriggerResult trigger, ZonedDateTime dt) {
    if (trigger instanceof OneShotAt osa) {
      return osa.at().equals(dt.toInstant());
    }
    if (trigger instanceof RepeatingCalendarPattern cp) {
      return matchesFields(cp.components(), dt.toLocalDateTime());
    }
    if (trigger instanceof RepeatingCustomPattern cp) {
      return matchesFields(cp.fields(), dt.toLocalDateTime());
    }
    return false;
  }

  private static Optional<ZonedDateTime> nextMatch(
      Map<CalendarField, Long> fields, ZonedDateTime now) {
    ZoneId zone = now.getZone();
    LocalDate start = now.toLocalDate();

    // Jump straight to a pinned future year
    Long year = fields.get(CalendarField.YEAR);
    if (year != null) {
      if (year < start.getYear()) {
        return Optional.empty();
      }
      if (year > start.getYear() + MAX_DAYS / 366) {
        return Optional.empty();
      }
      if (year > start.getYear()) {
        start = LocalDate.of(year.intValue(), 1, 1);
      }
    }

    int[] hours = candidates(fields.get(CalendarField.HOUR), 23);
    int[] minutes = candidates(fields.get(CalendarField.MINUTE), 59);
    int[] seconds = candidates(fields.get(CalendarField.SECOND), 59);
    if (hours.length == 0 || minutes.length == 0 || seconds.length == 0) {
      return Optional.empty();
    }

    for (int i = 0; i < MAX_DAYS; i++) {
      LocalDate date = start.plusDays(i);
      if (!matchesDate(fields, date)) {
        continue;
      }
      Optional<ZonedDateTime> t = firstTimeAfter(date, hours, minutes, seconds, zone, now);
      if (t.isPresent()) {
        return t;
      }
    }

    return Optional.empty();
  }

  private static Optional<ZonedDateTime> firstTimeAfter(
      LocalDate date, int[] hours, int[] minutes, int[] seconds, ZoneId zone, ZonedDateTime now) {
    boolean sameDay = date.equals(now.toLocalDate());
    for (int h : hours) {
      if (sameDay && h < now.getHour()) {
        continue;
      }
      for (int m : minutes) {
        for (int s : seconds) {
          ZonedDateTime candidate = ZonedDateTime.of(date.atTime(h, m, s), zone);
          if (candidate.isAfter(now)) {
            return Optional.of(candidate);
          }
        }
      }
    }
    return Optional.empty();
  }

  /** A pinned value, if in range, or every value from 0 to max. */
  private static int[] candidates(Long pinned, int max) {
    if (pinned != null) {
      return pinned >= 0 && pinned <= max ? new int[] {pinned.intValue()} : new int[0];
    }
    int[] all = new int[max + 1];
    for (int i = 0; i <= max; i++) {
      all[i] = i;
    }
    return all;
  }

  private static boolean matchesDate(Map<CalendarField, Long> fields, LocalDate date) {
    LocalDateTime midnight = date.atStartOfDay();
    for (Map.Entry<CalendarField, Long> entry : fields.entrySet()) {
      CalendarField field = entry.getKey();
      if (field.isDateField() && field.extract(midnight) != entry.getValue()) {
        return false;
      }
    }
    return true;
  }

  private static boolean matchesFields(Map<CalendarField, Long> fields, LocalDateTime dt) {
    for (Map.Entry<CalendarField, Long> entry : fields.entrySet()) {
      if (entry.getKey().extract(dt) != entry.getValue()) {
        return false;
      }
    }
    return true;
  }

  /** Empty when the result lies beyond the range a ZonedDateTime can hold. */
  private static Optional<ZonedDateTime> plusSeconds(ZonedDateTime now, double seconds) {
    if (!Double.isFinite(seconds) || Math.abs(seconds) >= MAX_OFFSET_SECONDS) {
      return Optional.empty();
    }
    long whole = (long) seconds;
    long nanos = Math.round((seconds - whole) * 1_000_000_000L);
    try {
      return Optional.of(now.plus(Duration.ofSeconds(whole, nanos)));
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }
}
