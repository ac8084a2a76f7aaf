package io.localnotification;

import io.localnotification.display.Display;
import io.localnotification.schedule.CalendarField;
import io.localnotification.schedule.CalendarUnit;
import io.localnotification.schedule.EveryFields;
import io.localnotification.schedule.EveryTicks;
import io.localnotification.schedule.EveryUnit;
import io.localnotification.schedule.ScheduleSpec;
import io.localnotification.schedule.TickUnit;
import io.localnotification.schedule.TriggerType;
import io.localnotification.schedule.Weekdays;
import io.localnotification.trigger.OneShotAfter;
import io.localnotification.trigger.OneShotAt;
import io.localnotification.trigger.RegionTrigger;
import io.localnotification.trigger.RepeatingCalendarPattern;
import io.localnotification.trigger.RepeatingCustomPattern;
import io.localnotification.trigger.RepeatingInterval;
import io.localnotification.trigger.TriggerResult;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main entry point for turning notification trigger options into a concrete trigger.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * ScheduleSpec spec = ScheduleSpecReader.read("{\"trigger\": {\"every\": \"day\"}}");
 * TriggerResult trigger = TriggerResolver.resolve(spec, ZonedDateTime.now());
 * }</pre>
 *
 * <p>Resolution never fails. Malformed values have already been coerced by the reader and out of
 * range results are clamped with a warning.
 */
public final class TriggerResolver {
  private static final Logger logger = LoggerFactory.getLogger(TriggerResolver.class);

  /** Shortest delay of a one-shot trigger, in seconds. */
  public static final double MIN_DELAY_SECONDS = 0.01;

  /** Shortest interval the platform accepts for a repeating trigger, in seconds. */
  public static final double MIN_REPEAT_SECONDS = 60;

  private TriggerResolver() {}

  /**
   * Resolves a trigger relative to the current time in the system default time zone, which is the
   * zone the device calendar uses.
   *
   * @param spec the trigger options
   * @return the resolved trigger
   */
  public static TriggerResult resolve(ScheduleSpec spec) {
    return resolve(spec, ZonedDateTime.now(ZoneId.systemDefault()));
  }

  /**
   * Resolves a trigger relative to the given time. Calendar patterns read their fields in the time
   * zone of {@code now}.
   *
   * @param spec the trigger options
   * @param now the reference time
   * @return the resolved trigger
   */
  public static TriggerResult resolve(ScheduleSpec spec, ZonedDateTime now) {
    TriggerResult result = resolveTrigger(spec, now);
    if (logger.isDebugEnabled()) {
      logger.debug("Resolved trigger: {}", Display.render(result));
    }
    return result;
  }

  private static TriggerResult resolveTrigger(ScheduleSpec spec, ZonedDateTime now) {
    if (spec.type() == TriggerType.LOCATION) {
      return regionTrigger(spec);
    }

    if (!TriggerType.isKnown(spec.rawType())) {
      logger.warn("Unknown trigger type '{}', using calendar", spec.rawType());
    }

    if (spec.isRepeating()) {
      return repeatingTrigger(spec, now);
    }
    return nonRepeatingTrigger(spec);
  }

  private static TriggerResult nonRepeatingTrigger(ScheduleSpec spec) {
    if (spec.at() != null) {
      return new OneShotAt(spec.at());
    }
    double ticks = spec.inTicks() == null ? 0 : spec.inTicks();
    double seconds = TickUnit.toSeconds(ticks, spec.unit());
    return new OneShotAfter(Math.max(MIN_DELAY_SECONDS, seconds));
  }

  private static TriggerResult repeatingTrigger(ScheduleSpec spec, ZonedDateTime now) {
    if (spec.every() instanceof EveryUnit eu) {
      ZonedDateTime anchor = spec.at() != null ? spec.at().atZone(now.getZone()) : now;
      return new RepeatingCalendarPattern(CalendarUnit.fieldsFor(eu.name()), anchor);
    }
    if (spec.every() instanceof EveryFields ef) {
      return customPattern(ef);
    }
    return intervalTrigger((EveryTicks) spec.every(), spec.unit());
  }

  private static RepeatingInterval intervalTrigger(EveryTicks every, String unit) {
    double seconds = TickUnit.toSeconds(every.ticks(), unit);
    if (seconds < MIN_REPEAT_SECONDS) {
      logger.warn(
          "Repeating interval of {}s is below {}s, using {}s",
          seconds,
          (long) MIN_REPEAT_SECONDS,
          (long) MIN_REPEAT_SECONDS);
      seconds = MIN_REPEAT_SECONDS;
    }
    return new RepeatingInterval(seconds);
  }

  private static RepeatingCustomPattern customPattern(EveryFields every) {
    Map<CalendarField, Long> fields = new EnumMap<>(CalendarField.class);
    fields.put(CalendarField.SECOND, 0L);

    for (Map.Entry<CalendarField, Long> entry : every.fields().entrySet()) {
      if (entry.getKey() != CalendarField.WEEKDAY) {
        fields.put(entry.getKey(), entry.getValue());
        continue;
      }
      OptionalInt weekday = Weekdays.remap(entry.getValue());
      if (weekday.isPresent()) {
        fields.put(CalendarField.WEEKDAY, (long) weekday.getAsInt());
      } else {
        logger.warn("Ignoring weekday {}, expected 1-7", entry.getValue());
      }
    }
    return new RepeatingCustomPattern(fields);
  }

  private static RegionTrigger regionTrigger(ScheduleSpec spec) {
    return new RegionTrigger(
        spec.center(), spec.radius(), spec.notifyOnEntry(), spec.notifyOnExit(), !spec.single());
  }
}
