package com.datracker.sdk;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import java.time.Instant;
import java.util.Date;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;

@SuppressWarnings("javadoc")
public class PropertyValueTest {
  @Test
  public void scalarsMapToTheirTypes() {
    assertEquals(PropertyValueType.STRING, PropertyValue.fromObject("x").getType());
    assertEquals(PropertyValueType.BOOLEAN, PropertyValue.fromObject(true).getType());
    assertEquals(PropertyValueType.NUMBER, PropertyValue.fromObject(3).getType());
    assertEquals(PropertyValueType.NUMBER, PropertyValue.fromObject(2.5f).getType());
    assertEquals(PropertyValueType.DATE, PropertyValue.fromObject(new Date(1000)).getType());
    assertEquals(PropertyValueType.DATE, PropertyValue.fromObject(Instant.ofEpochMilli(1000)).getType());
  }

  @Test
  public void unsupportedObjectsAreRejected() {
    assertNull(PropertyValue.fromObject(null));
    assertNull(PropertyValue.fromObject(new Object()));
    assertNull(PropertyValue.of((String)null));
  }

  @Test
  public void collectionsBecomeArraysSkippingUnsupportedElements() {
    PropertyValue v = PropertyValue.fromObject(ImmutableList.of("a", 1, new Object(), ImmutableList.of("nested")));
    assertEquals(PropertyValueType.ARRAY, v.getType());
    assertThat(v.values(), contains(PropertyValue.of("a"), PropertyValue.of(1)));
  }

  @Test
  public void nonFiniteNumbersAreRejected() {
    assertNull(PropertyValue.of(Double.NaN));
    assertNull(PropertyValue.of(Double.POSITIVE_INFINITY));
    assertNull(PropertyValue.fromObject(Double.NEGATIVE_INFINITY));
    assertNull(PropertyValue.fromObject(Float.NaN));
    assertThat(PropertyValue.fromObject(ImmutableList.of(1.5, Double.NaN)).values(), contains(PropertyValue.of(1.5)));
  }

  @Test
  public void javaArraysMayContainNulls() {
    PropertyValue v = PropertyValue.fromObject(new Object[] { "a", null, true });
    assertThat(v.values(), contains(PropertyValue.of("a"), PropertyValue.of(true)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void arraysOfArraysAreNotAllowed() {
    PropertyValue.arrayOf(PropertyValue.of("a"), PropertyValue.arrayOf(PropertyValue.of("b")));
  }

  @Test
  public void existingValueIsReturnedUnchanged() {
    PropertyValue v = PropertyValue.of("x");
    assertThat(PropertyValue.fromObject(v), sameInstance(v));
  }

  @Test
  public void accessorsReturnDefaultsForOtherTypes() {
    PropertyValue s = PropertyValue.of("x");
    assertThat(s.doubleValue(), equalTo(0d));
    assertThat(s.booleanValue(), equalTo(false));
    assertThat(s.instantValue(), nullValue());
    assertThat(s.values().size(), equalTo(0));
    assertThat(PropertyValue.of(7).stringValue(), nullValue());
  }

  @Test
  public void integerAndFractionalNumbersCompareByValue() {
    assertEquals(PropertyValue.of(3), PropertyValue.of(3.0));
    assertNotEquals(PropertyValue.of(3), PropertyValue.of(3.5));
    assertEquals(3L, PropertyValue.of(3.9).longValue());
  }

  @Test
  public void jsonRepresentation() {
    assertEquals("\"x\"", PropertyValue.of("x").toJsonString());
    assertEquals("true", PropertyValue.of(true).toJsonString());
    assertEquals("\"1970-01-01T00:00:01Z\"", PropertyValue.of(new Date(1000)).toJsonString());
    assertEquals("[\"a\",false]", PropertyValue.arrayOf(PropertyValue.of("a"), PropertyValue.of(false)).toJsonString());
  }
}
