package io.localnotification.reader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.localnotification.TriggerException;
import io.localnotification.schedule.CalendarField;
import io.localnotification.schedule.Coordinate;
import io.localnotification.schedule.Every;
import io.localnotification.schedule.EveryFields;
import io.localnotification.schedule.EveryTicks;
import io.localnotification.schedule.EveryUnit;
import io.localnotification.schedule.ScheduleSpec;
import io.localnotification.schedule.TriggerType;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads notification options into a {@link ScheduleSpec}.
 *
 * <p>The options object carries its trigger under a {@code trigger} key:
 *
 * <pre>{@code
 * {"id": 1, "trigger": {"every": {"weekday": 1, "hour": 9}}}
 * }</pre>
 *
 * <p>A bare trigger object is accepted as well. The {@code type} key is looked up in the trigger
 * first and in the options object second.
 */
public final class ScheduleSpecReader {
  private static final Logger logger = LoggerFactory.getLogger(ScheduleSpecReader.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ScheduleSpecReader() {}

  /**
   * Reads options from JSON text.
   *
   * @param json the options as JSON
   * @return the trigger options
   * @throws TriggerException if the text is not a JSON object
   */
  public static ScheduleSpec read(String json) throws TriggerException {
    JsonNode root;
    try {
      root = MAPPER.readTree(json == null ? "" : json);
    } catch (JsonProcessingException e) {
      throw TriggerException.syntax("invalid options JSON: " + e.getOriginalMessage(), json, e);
    }
    return read(root);
  }

  /**
   * Reads options from a map, as produced by a JSON bridge.
   *
   * @param options the options
   * @return the trigger options
   * @throws TriggerException if the map cannot be represented as a JSON object
   */
  public static ScheduleSpec read(Map<String, ?> options) throws TriggerException {
    if (options == null) {
      throw TriggerException.shape("options must be an object, got null");
    }
    JsonNode root;
    try {
      root = MAPPER.valueToTree(options);
    } catch (IllegalArgumentException e) {
      throw TriggerException.shape("options are not JSON compatible: " + e.getMessage());
    }
    return read(root);
  }

  /**
   * Reads options from a JSON tree.
   *
   * @param root the options object
   * @return the trigger options
   * @throws TriggerException if the root is not an object
   */
  public static ScheduleSpec read(JsonNode root) throws TriggerException {
    if (root == null || !root.isObject()) {
      String actual = root == null || root.isMissingNode() ? "nothing" : root.getNodeType().name();
      throw TriggerException.shape(
          "options must be an object, got " + actual.toLowerCase(Locale.ROOT));
    }

    JsonNode trigger = root.path("trigger").isObject() ? root.get("trigger") : root;

    String rawType = textOrNull(trigger.get("type"));
    if (rawType == null && trigger != root) {
      rawType = textOrNull(root.get("type"));
    }

    JsonNode atNode = trigger.get("at");
    JsonNode inNode = trigger.get("in");
    Instant at = Coercion.isAbsent(atNode) ? null : Coercion.toInstant(atNode);
    Double inTicks = Coercion.isAbsent(inNode) ? null : Coercion.toDouble(inNode);

    return new ScheduleSpec(
        TriggerType.fromOption(rawType),
        rawType,
        at,
        inTicks,
        textOrNull(trigger.get("unit")),
        readEvery(trigger.get("every")).orElse(null),
        readCenter(trigger.get("center")),
        Coercion.toDouble(trigger.get("radius")),
        Coercion.toBoolean(trigger.get("single")),
        Coercion.toBoolean(trigger.get("notifyOnEntry")),
        Coercion.toBoolean(trigger.get("notifyOnExit")));
  }

  private static Optional<Every> readEvery(JsonNode node) {
    if (Coercion.isAbsent(node)) {
      return Optional.empty();
    }
    if (node.isTextual()) {
      return node.textValue().isEmpty()
          ? Optional.empty()
          : Optional.of(new EveryUnit(node.textValue()));
    }
    if (node.isObject()) {
      return Optional.of(readFields(node));
    }
    return Optional.of(new EveryTicks(Coercion.toDouble(node)));
  }

  private static EveryFields readFields(JsonNode node) {
    Map<CalendarField, Long> fields = new EnumMap<>(CalendarField.class);
    Iterator<Map.Entry<String, JsonNode>> it = node.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> entry = it.next();
      Optional<CalendarField> field = CalendarField.parse(entry.getKey());
      if (field.isPresent()) {
        fields.put(field.get(), Coercion.toLong(entry.getValue()));
      } else {
        logger.debug("Ignoring unknown repeat field '{}'", entry.getKey());
      }
    }
    return new EveryFields(fields);
  }

  private static Coordinate readCenter(JsonNode node) {
    if (Coercion.isAbsent(node) || !node.isArray()) {
      return Coordinate.ORIGIN;
    }
    return new Coordinate(Coercion.toDouble(node.get(0)), Coercion.toDouble(node.get(1)));
  }

  private static String textOrNull(JsonNode node) {
    if (Coercion.isAbsent(node)) {
      return null;
    }
    return node.isTextual() ? node.textValue() : node.asText();
  }
}
