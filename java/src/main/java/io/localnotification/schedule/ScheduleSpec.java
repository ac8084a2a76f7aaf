package io.localnotification.schedule;

import java.time.Instant;

/**
 * The trigger options of one notification.
 *
 * @param type the trigger type
 * @param rawType the type option as given (may be null)
 * @param at the absolute fire time (may be null)
 * @param inTicks the relative delay in {@code unit} ticks (may be null)
 * @param unit the tick unit name for {@code inTicks} and numeric {@code every} (may be null)
 * @param every the repeat option (may be null)
 * @param center the region center for location triggers
 * @param radius the region radius in meters
 * @param single whether a location trigger fires only once
 * @param notifyOnEntry whether entering the region fires
 * @param notifyOnExit whether leaving the region fires
 */
public record ScheduleSpec(
    TriggerType type,
    String rawType,
    Instant at,
    Double inTicks,
    String unit,
    Every every,
    Coordinate center,
    double radius,
    boolean single,
    boolean notifyOnEntry,
    boolean notifyOnExit) {
  /** Creates a new ScheduleSpec, filling in the type and center defaults. */
  public ScheduleSpec {
    type = type == null ? TriggerType.fromOption(rawType) : type;
    center = center == null ? Coordinate.ORIGIN : center;
  }

  /**
   * Creates an empty calendar trigger, which fires right away.
   *
   * @return a new ScheduleSpec
   */
  public static ScheduleSpec calendar() {
    return new ScheduleSpec(
        TriggerType.CALENDAR, null, null, null, null, null, null, 0, false, false, false);
  }

  /**
   * Creates a location trigger around a point.
   *
   * @param center the region center
   * @param radius the region radius in meters
   * @return a new ScheduleSpec
   */
  public static ScheduleSpec location(Coordinate center, double radius) {
    return new ScheduleSpec(
        TriggerType.LOCATION,
        TriggerType.LOCATION.value(),
        null,
        null,
        null,
        null,
        center,
        radius,
        false,
        false,
        false);
  }

  /**
   * Returns whether the notification repeats.
   *
   * @return true if {@code every} asks for repetition
   */
  public boolean isRepeating() {
    return every != null && every.isRepeating();
  }

  /**
   * Returns a copy with the specified raw type option.
   *
   * @param rawType the type option
   * @return a new ScheduleSpec with the type resolved from the option
   */
  public ScheduleSpec withType(String rawType) {
    return new ScheduleSpec(
        TriggerType.fromOption(rawType),
        rawType,
        at,
        inTicks,
        unit,
        every,
        center,
        radius,
        single,
        notifyOnEntry,
        notifyOnExit);
  }

  /**
   * Returns a copy with the specified fire time.
   *
   * @param at the fire time
   * @return a new ScheduleSpec with the updated fire time
   */
  public ScheduleSpec withAt(Instant at) {
    return new ScheduleSpec(
        type, rawType, at, inTicks, unit, every, center, radius, single, notifyOnEntry,
        notifyOnExit);
  }

  /**
   * Returns a copy with the specified relative delay.
   *
   * @param ticks the delay in units
   * @param unit the unit name
   * @return a new ScheduleSpec with the updated delay and unit
   */
  public ScheduleSpec withIn(double ticks, String unit) {
    return new ScheduleSpec(
        type, rawType, at, ticks, unit, every, center, radius, single, notifyOnEntry,
        notifyOnExit);
  }

  /**
   * Returns a copy with the specified unit.
   *
   * @param unit the unit name
   * @return a new ScheduleSpec with the updated unit
   */
  public ScheduleSpec withUnit(String unit) {
    return new ScheduleSpec(
        type, rawType, at, inTicks, unit, every, center, radius, single, notifyOnEntry,
        notifyOnExit);
  }

  /**
   * Returns a copy with the specified repeat option.
   *
   * @param every the repeat option
   * @return a new ScheduleSpec with the updated repeat option
   */
  public ScheduleSpec withEvery(Every every) {
    return new ScheduleSpec(
        type, rawType, at, inTicks, unit, every, center, radius, single, notifyOnEntry,
        notifyOnExit);
  }

  /**
   * Returns a copy with the specified region flags.
   *
   * @param single whether the trigger fires only once
   * @param notifyOnEntry whether entering the region fires
   * @param notifyOnExit whether leaving the region fires
   * @return a new ScheduleSpec with the updated flags
   */
  public ScheduleSpec withRegionFlags(boolean single, boolean notifyOnEntry, boolean notifyOnExit) {
    return new ScheduleSpec(
        type, rawType, at, inTicks, unit, every, center, radius, single, notifyOnEntry,
        notifyOnExit);
  }
}
