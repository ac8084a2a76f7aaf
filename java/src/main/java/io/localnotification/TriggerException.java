package io.localnotification;

import java.util.Optional;

/**
 * Exception thrown when a notification options document cannot be read at all.
 *
 * <p>Malformed individual values never raise this exception; they are coerced instead.
 */
public final class TriggerException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The original input, if it was supplied as text. */
  private final String input;

  private TriggerException(ErrorKind kind, String message, String input, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.input = input;
  }

  /**
   * Creates a new syntax error.
   *
   * @param message the error message
   * @param input the original input string
   * @param cause the underlying parser failure
   * @return a new TriggerException for a syntax error
   */
  public static TriggerException syntax(String message, String input, Throwable cause) {
    return new TriggerException(ErrorKind.SYNTAX, message, input, cause);
  }

  /**
   * Creates a new shape error.
   *
   * @param message the error message
   * @return a new TriggerException for a document of the wrong shape
   */
  public static TriggerException shape(String message) {
    return new TriggerException(ErrorKind.SHAPE, message, null, null);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the original input string, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }
}
