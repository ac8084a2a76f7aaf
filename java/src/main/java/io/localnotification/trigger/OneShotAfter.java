package io.localnotification.trigger;

/**
 * Fire once after a delay.
 *
 * @param seconds the delay, at least 0.01
 */
public record OneShotAfter(double seconds) implements TriggerResult {
  @Override
  public boolean repeats() {
    return false;
  }
}
