package io.localnotification.trigger;

/**
 * Fire every {@code seconds} seconds.
 *
 * @param seconds the interval, at least 60
 */
public record RepeatingInterval(double seconds) implements TriggerResult {
  @Override
  public boolean repeats() {
    return true;
  }
}
