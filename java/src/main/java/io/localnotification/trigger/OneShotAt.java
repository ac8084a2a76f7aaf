package io.localnotification.trigger;

import java.time.Instant;

/**
 * Fire once at an absolute time.
 *
 * @param at the fire time
 */
public record OneShotAt(Instant at) implements TriggerResult {
  @Override
  public boolean repeats() {
    return false;
  }
}
