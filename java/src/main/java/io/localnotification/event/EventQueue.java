package io.localnotification.event;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds plugin events until the web layer is ready to receive them.
 *
 * <p>The queue starts in {@link Mode#BUFFERING}. Events fired in that mode are kept in arrival
 * order. {@link #ready()} delivers them once and switches to {@link Mode#FLUSHED} for good, after
 * which events are delivered as they are fired.
 */
public final class EventQueue {
  private static final Logger logger = LoggerFactory.getLogger(EventQueue.class);

  /** Delivery mode of the queue. */
  public enum Mode {
    /** Events are held until ready. */
    BUFFERING,
    /** Events are delivered immediately. */
    FLUSHED
  }

  private final EventDispatcher dispatcher;
  private final Deque<String> pending = new ArrayDeque<>();
  private Mode mode = Mode.BUFFERING;
  private boolean flushing;
  private LaunchDetails launchDetails;

  /**
   * Creates a buffering queue.
   *
   * @param dispatcher where rendered events are delivered
   */
  public EventQueue(EventDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  /**
   * Fires an event. Before ready the event is buffered, and the first one that names a
   * notification is remembered as the launch details.
   *
   * @param name the event name
   * @param notificationId the notification id (may be null)
   * @param data extra payload entries (may be null)
   * @return the event as fired
   */
  public synchronized Event fireEvent(String name, Integer notificationId, ObjectNode data) {
    boolean queued = mode == Mode.BUFFERING;
    Event event = Event.of(name, notificationId, data, queued);

    if (queued && launchDetails == null && notificationId != null) {
      launchDetails = new LaunchDetails(notificationId, name);
    }

    String js = event.toJavascript();
    if (queued) {
      pending.add(js);
      logger.debug("Queued event '{}', {} pending", name, pending.size());
    } else {
      dispatcher.dispatch(js);
    }
    return event;
  }

  /**
   * Signals that the web layer is ready. Flushes pending events once, in the order they were fired.
   * Later calls do nothing.
   *
   * <p>An event leaves the buffer only after it was dispatched, and the queue switches to {@link
   * Mode#FLUSHED} only once the buffer is empty. If the dispatcher throws, the failed event and
   * everything after it stay buffered for the next call. Events fired by the dispatcher during the
   * flush are appended behind the older ones.
   *
   * @return the number of events flushed
   */
  public synchronized int ready() {
    if (mode == Mode.FLUSHED || flushing) {
      return 0;
    }
    flushing = true;
    int flushed = 0;
    try {
      while (!pending.isEmpty()) {
        dispatcher.dispatch(pending.peekFirst());
        pending.removeFirst();
        flushed++;
      }
      mode = Mode.FLUSHED;
    } finally {
      flushing = false;
    }
    logger.debug("Web layer ready, flushed {} queued events", flushed);
    return flushed;
  }

  /**
   * Returns the current delivery mode.
   *
   * @return the mode
   */
  public synchronized Mode mode() {
    return mode;
  }

  /**
   * Returns the number of events waiting for ready.
   *
   * @return the pending count
   */
  public synchronized int pendingCount() {
    return pending.size();
  }

  /**
   * Returns the first notification event fired before ready, if any.
   *
   * @return the launch details
   */
  public synchronized Optional<LaunchDetails> launchDetails() {
    return Optional.ofNullable(launchDetails);
  }
}
