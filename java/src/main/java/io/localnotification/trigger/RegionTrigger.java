package io.localnotification.trigger;

import io.localnotification.schedule.Coordinate;

/**
 * Fire on entering or leaving a circular region.
 *
 * @param center the region center
 * @param radiusMeters the region radius
 * @param notifyOnEntry whether entering fires
 * @param notifyOnExit whether leaving fires
 * @param repeats whether the trigger stays armed after firing
 */
public record RegionTrigger(
    Coordinate center,
    double radiusMeters,
    boolean notifyOnEntry,
    boolean notifyOnExit,
    boolean repeats)
    implements TriggerResult {}
