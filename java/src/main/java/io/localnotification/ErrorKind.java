package io.localnotification;

/** The type of error that occurred while reading notification options. */
public enum ErrorKind {
  /** The options document is not valid JSON. */
  SYNTAX("syntax"),
  /** The options document is valid JSON but not an object. */
  SHAPE("shape");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
