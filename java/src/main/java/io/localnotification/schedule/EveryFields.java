package io.localnotification.schedule;

import java.util.Map;

/**
 * Repeat whenever the wall clock matches the given fields.
 *
 * @param fields the field values, weekday in caller numbering
 */
public record EveryFields(Map<CalendarField, Long> fields) implements Every {
  /** Creates a new EveryFields with a defensive copy of the map. */
  public EveryFields {
    fields = fields == null ? Map.of() : Map.copyOf(fields);
  }

  @Override
  public boolean isRepeating() {
    return !fields.isEmpty();
  }
}
