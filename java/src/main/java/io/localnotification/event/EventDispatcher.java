package io.localnotification.event;

/** Delivers a rendered event statement to the web layer. */
@FunctionalInterface
public interface EventDispatcher {
  /**
   * Evaluates a JavaScript statement in the web view.
   *
   * @param javascript the statement to run
   */
  void dispatch(String javascript);
}
