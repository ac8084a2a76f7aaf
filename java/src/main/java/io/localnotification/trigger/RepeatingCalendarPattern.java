package io.localnotification.trigger;

import io.localnotification.schedule.CalendarField;
import java.time.ZonedDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Fire whenever the wall clock matches the anchor on the given fields.
 *
 * @param matchFields the fields pinned to the anchor
 * @param anchor the date-time whose field values are matched
 */
public record RepeatingCalendarPattern(Set<CalendarField> matchFields, ZonedDateTime anchor)
    implements TriggerResult {
  /** Creates a new RepeatingCalendarPattern with a defensive copy of the fields. */
  public RepeatingCalendarPattern {
    matchFields = Set.copyOf(matchFields);
  }

  /**
   * Returns the anchor's value for each matched field, in field order.
   *
   * @return the pinned components
   */
  public Map<CalendarField, Long> components() {
    Map<CalendarField, Long> components = new EnumMap<>(CalendarField.class);
    for (CalendarField field : matchFields) {
      components.put(field, field.extract(anchor));
    }
    return components;
  }

  @Override
  public boolean repeats() {
    return true;
  }
}
