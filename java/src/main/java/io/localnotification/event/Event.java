package io.localnotification.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * A plugin event addressed to the web layer.
 *
 * @param name the event name, e.g. "trigger" or "click"
 * @param notificationId the notification the event is about (may be null)
 * @param data the event payload
 */
public record Event(String name, Integer notificationId, ObjectNode data) {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The JavaScript function that receives plugin events. */
  public static final String FIRE_EVENT_FUNCTION = "cordova.plugins.notification.local.fireEvent";

  /** Creates a new Event with a private copy of the payload. */
  public Event {
    data = data == null ? MAPPER.createObjectNode() : data.deepCopy();
  }

  /**
   * Creates an event with the standard payload keys filled in.
   *
   * @param name the event name
   * @param notificationId the notification id (may be null)
   * @param data extra payload entries (may be null)
   * @param queued whether the event is held until the web layer is ready
   * @return a new Event
   */
  public static Event of(String name, Integer notificationId, ObjectNode data, boolean queued) {
    ObjectNode payload = data == null ? MAPPER.createObjectNode() : data.deepCopy();
    payload.put("event", name);
    payload.put("queued", queued);
    if (notificationId != null) {
      payload.put("notification", notificationId);
    }
    return new Event(name, notificationId, payload);
  }

  /**
   * Renders the event as a JavaScript call.
   *
   * @return a statement like {@code cordova.plugins.notification.local.fireEvent("click",{...})}
   */
  public String toJavascript() {
    // TextNode quotes and escapes the name as a JSON string
    return FIRE_EVENT_FUNCTION + "(" + TextNode.valueOf(name) + "," + data + ")";
  }
}
