package io.localnotification.event;

/**
 * The notification and event that launched the app.
 *
 * @param id the notification id
 * @param action the event name, e.g. "click"
 */
public record LaunchDetails(int id, String action) {}
