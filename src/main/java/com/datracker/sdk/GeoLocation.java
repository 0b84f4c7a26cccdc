package com.datracker.sdk;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An immutable latitude/longitude pair attached to an event.
 */
public final class GeoLocation {
  private final double latitude;
  private final double longitude;

  /**
   * Creates an instance.
   * 
   * @param latitude the latitude in degrees
   * @param longitude the longitude in degrees
   * @throws IllegalArgumentException if either coordinate is NaN or infinite
   */
  public GeoLocation(double latitude, double longitude) {
    checkArgument(Double.isFinite(latitude) && Double.isFinite(longitude), "coordinates must be finite numbers");
    this.latitude = latitude;
    this.longitude = longitude;
  }

  /**
   * Returns the latitude.
   * @return the latitude in degrees
   */
  public double getLatitude() {
    return latitude;
  }

  /**
   * Returns the longitude.
   * @return the longitude in degrees
   */
  public double getLongitude() {
    return longitude;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof GeoLocation)) {
      return false;
    }
    GeoLocation other = (GeoLocation)o;
    return Double.compare(latitude, other.latitude) == 0 && Double.compare(longitude, other.longitude) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(latitude, longitude);
  }

  @Override
  public String toString() {
    return "(" + latitude + "," + longitude + ")";
  }
}
