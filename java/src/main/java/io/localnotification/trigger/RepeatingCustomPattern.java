package io.localnotification.trigger;

import io.localnotification.schedule.CalendarField;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fire whenever the wall clock matches the given fields. The weekday, if present, is in platform
 * numbering.
 *
 * @param fields the pinned components
 */
public record RepeatingCustomPattern(Map<CalendarField, Long> fields) implements TriggerResult {
  /** Creates a new RepeatingCustomPattern with a sorted, unmodifiable copy of the fields. */
  public RepeatingCustomPattern {
    fields = fields.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(fields));
  }

  @Override
  public boolean repeats() {
    return true;
  }
}
