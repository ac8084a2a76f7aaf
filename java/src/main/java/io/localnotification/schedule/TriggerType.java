package io.localnotification.schedule;

/** The kind of trigger a notification asks for. */
public enum TriggerType {
  /** Fires at a time, after a delay, or on a repeating time pattern. */
  CALENDAR("calendar"),
  /** Fires when the device enters or leaves a region. */
  LOCATION("location");

  private final String value;

  TriggerType(String value) {
    this.value = value;
  }

  /**
   * Returns the option value that selects this type.
   *
   * @return the lowercase type name
   */
  public String value() {
    return value;
  }

  /**
   * Resolves a raw type option. Only {@code "location"} selects {@link #LOCATION}; everything
   * else, including null, is a calendar trigger.
   *
   * @param raw the raw option value (may be null)
   * @return the trigger type
   */
  public static TriggerType fromOption(String raw) {
    return LOCATION.value.equals(raw) ? LOCATION : CALENDAR;
  }

  /**
   * Returns whether a raw type option is one this library knows about.
   *
   * @param raw the raw option value (may be null)
   * @return true for null, "calendar" and "location"
   */
  public static boolean isKnown(String raw) {
    return raw == null || CALENDAR.value.equals(raw) || LOCATION.value.equals(raw);
  }

  @Override
  public String toString() {
    return value;
  }
}
