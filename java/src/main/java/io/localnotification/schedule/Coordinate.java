package io.localnotification.schedule;

/**
 * A geographic point.
 *
 * @param latitude the latitude in degrees
 * @param longitude the longitude in degrees
 */
public record Coordinate(double latitude, double longitude) {
  /** The origin, used when no center is given. */
  public static final Coordinate ORIGIN = new Coordinate(0, 0);

  @Override
  public String toString() {
    return latitude + "," + longitude;
  }
}
