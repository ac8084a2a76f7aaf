package io.localnotification.schedule;

/**
 * Repeat once per calendar unit.
 *
 * @param name the unit name as given
 */
public record EveryUnit(String name) implements Every {
  @Override
  public boolean isRepeating() {
    return name != null && !name.isEmpty();
  }
}
