package io.localnotification.trigger;

/**
 * Sealed interface for resolved notification triggers.
 *
 * <p>There are 6 kinds of trigger:
 *
 * <ul>
 *   <li>{@link OneShotAt} - fire once at an absolute time
 *   <li>{@link OneShotAfter} - fire once after a delay
 *   <li>{@link RepeatingInterval} - fire every N seconds
 *   <li>{@link RepeatingCalendarPattern} - fire when the clock matches fields of an anchor date
 *   <li>{@link RepeatingCustomPattern} - fire when the clock matches caller supplied fields
 *   <li>{@link RegionTrigger} - fire on entering or leaving a region
 * </ul>
 */
public sealed interface TriggerResult
    permits OneShotAt,
        OneShotAfter,
        RepeatingInterval,
        RepeatingCalendarPattern,
        RepeatingCustomPattern,
        RegionTrigger {
  /**
   * Returns whether the trigger fires more than once.
   *
   * @return true for repeating triggers
   */
  boolean repeats();
}
