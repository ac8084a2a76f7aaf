package io.localnotification.schedule;

/**
 * Sealed interface for the {@code every} option of a trigger.
 *
 * <ul>
 *   <li>{@link EveryUnit} - a calendar unit name like {@code "day"}
 *   <li>{@link EveryTicks} - a tick count paired with the trigger's unit
 *   <li>{@link EveryFields} - an explicit field pattern like {@code {hour: 9, minute: 0}}
 * </ul>
 */
public sealed interface Every permits EveryUnit, EveryTicks, EveryFields {
  /**
   * Returns whether this value asks for a repeating trigger.
   *
   * @return true if the notification repeats
   */
  boolean isRepeating();
}
