package com.datracker.sdk;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

@SuppressWarnings("javadoc")
public class GeoLocationTest {
  @Test
  public void equality() {
    assertEquals(new GeoLocation(1.5, -2), new GeoLocation(1.5, -2));
    assertEquals(new GeoLocation(1.5, -2).hashCode(), new GeoLocation(1.5, -2).hashCode());
    assertNotEquals(new GeoLocation(1.5, -2), new GeoLocation(-2, 1.5));
  }

  @Test(expected = IllegalArgumentException.class)
  public void latitudeMustBeFinite() {
    new GeoLocation(Double.NaN, 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void longitudeMustBeFinite() {
    new GeoLocation(0, Double.NEGATIVE_INFINITY);
  }
}
