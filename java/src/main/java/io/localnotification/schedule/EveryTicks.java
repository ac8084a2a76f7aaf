package io.localnotification.schedule;

/**
 * Repeat on a fixed interval.
 *
 * @param ticks the interval length in the trigger's unit
 */
public record EveryTicks(double ticks) implements Every {
  @Override
  public boolean isRepeating() {
    return ticks > 0;
  }
}
