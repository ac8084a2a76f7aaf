package io.localnotification.display;

import io.localnotification.schedule.CalendarField;
import io.localnotification.trigger.OneShotAfter;
import io.localnotification.trigger.OneShotAt;
import io.localnotification.trigger.RegionTrigger;
import io.localnotification.trigger.RepeatingCalendarPattern;
import io.localnotification.trigger.RepeatingCustomPattern;
import io.localnotification.trigger.RepeatingInterval;
import io.localnotification.trigger.TriggerResult;
import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.stream.Collectors;

/** Renders resolved triggers as canonical one-line strings. */
public final class Display {
  private Display() {}

  /**
   * Renders a trigger as a canonical string.
   *
   * @param trigger the trigger to render
   * @return the canonical string representation
   */
  public static String render(TriggerResult trigger) {
    if (trigger instanceof OneShotAt osa) {
      return "at " + osa.at();
    }
    if (trigger instanceof OneShotAfter osa) {
      return "after " + renderSeconds(osa.seconds()) + "s";
    }
    if (trigger instanceof RepeatingInterval ri) {
      return "every " + renderSeconds(ri.seconds()) + "s";
    }
    if (trigger instanceof RepeatingCalendarPattern cp) {
      return "matching "
          + renderFields(cp.components())
          + " from "
          + cp.anchor().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
    if (trigger instanceof RepeatingCustomPattern cp) {
      return "matching " + renderFields(cp.fields());
    }
    return renderRegion((RegionTrigger) trigger);
  }

  private static String renderFields(Map<CalendarField, Long> fields) {
    // Iterate in enum order so the output is stable
    return fields.keySet().stream()
        .sorted()
        .map(f -> f.key() + "=" + fields.get(f))
        .collect(Collectors.joining(" "));
  }

  private static String renderRegion(RegionTrigger rt) {
    StringBuilder sb = new StringBuilder();
    sb.append("region ").append(rt.center());
    sb.append(" r=").append(renderSeconds(rt.radiusMeters())).append("m");
    if (rt.notifyOnEntry()) {
      sb.append(" entry");
    }
    if (rt.notifyOnExit()) {
      sb.append(" exit");
    }
    sb.append(rt.repeats() ? " repeating" : " once");
    return sb.toString();
  }

  /** Whole numbers without a trailing ".0". */
  private static String renderSeconds(double value) {
    if (!Double.isFinite(value)) {
      return Double.toString(value);
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
