package com.datracker.sdk;

import com.google.common.collect.ImmutableList;
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.List;

/**
 * An immutable instance of any value that can be used as an event attribute, a super property, or
 * a user profile property.
 * <p>
 * Values are strings, numbers, booleans, dates, or an array of those. Arrays cannot contain other
 * arrays, and there is no map type: the collector only understands one level of nesting.
 * <p>
 * Use the static {@code of} factory methods to create values, or {@link #fromObject(Object)} to
 * convert an arbitrary Java object.
 */
@JsonAdapter(PropertyValueTypeAdapter.class)
public abstract class PropertyValue {
  /**
   * Returns a string value.
   * 
   * @param value the string
   * @return a value, or null if the parameter was null
   */
  public static PropertyValue of(String value) {
    return value == null ? null : new PropertyValueString(value);
  }

  /**
   * Returns a boolean value.
   * 
   * @param value the boolean
   * @return a value
   */
  public static PropertyValue of(boolean value) {
    return PropertyValueBool.fromBoolean(value);
  }

  /**
   * Returns a numeric value.
   * <p>
   * NaN and infinite values cannot be represented in JSON, so they are not accepted.
   * 
   * @param value the number
   * @return a value, or null if the number is NaN or infinite
   */
  public static PropertyValue of(double value) {
    return Double.isFinite(value) ? new PropertyValueNumber(value) : null;
  }

  /**
   * Returns a numeric value.
   * 
   * @param value the number
   * @return a value
   */
  public static PropertyValue of(long value) {
    return new PropertyValueNumber(value);
  }

  /**
   * Returns a date value.
   * 
   * @param value the date
   * @return a value, or null if the parameter was null
   */
  public static PropertyValue of(Date value) {
    return value == null ? null : new PropertyValueDate(value.getTime());
  }

  /**
   * Returns a date value.
   * 
   * @param value the instant
   * @return a value, or null if the parameter was null
   */
  public static PropertyValue of(Instant value) {
    return value == null ? null : new PropertyValueDate(value.toEpochMilli());
  }

  /**
   * Returns an array value. Null elements are skipped.
   * 
   * @param values the elements
   * @return a value
   * @throws IllegalArgumentException if any element is itself an array
   */
  public static PropertyValue arrayOf(PropertyValue... values) {
    List<PropertyValue> list = new ArrayList<>();
    for (PropertyValue v: values) {
      if (v != null) {
        list.add(v);
      }
    }
    return arrayOf(list);
  }

  static PropertyValue arrayOf(List<PropertyValue> values) {
    for (PropertyValue v: values) {
      if (v.getType() == PropertyValueType.ARRAY) {
        throw new IllegalArgumentException("arrays of arrays are not supported");
      }
    }
    return new PropertyValueArray(ImmutableList.copyOf(values));
  }

  /**
   * Converts a Java object to a value.
   * <p>
   * Strings, {@link Number}s, {@link Boolean}s, {@link Date}s and {@link Instant}s map to the
   * corresponding type. NaN and infinite numbers are not convertible. A {@link Collection} or Java array becomes an array value, skipping any
   * element that is not convertible or is itself a collection. An existing {@link PropertyValue}
   * is returned unchanged.
   * 
   * @param o an object
   * @return a value, or null if the object is null or of an unsupported type
   */
  public static PropertyValue fromObject(Object o) {
    if (o == null) {
      return null;
    }
    if (o instanceof PropertyValue) {
      return (PropertyValue)o;
    }
    if (o instanceof Collection<?> || o instanceof Object[]) {
      Iterable<?> items = o instanceof Object[] ? Arrays.asList((Object[])o) : (Collection<?>)o;
      List<PropertyValue> list = new ArrayList<>();
      for (Object item: items) {
        PropertyValue v = fromScalar(item);
        if (v != null) {
          list.add(v);
        }
      }
      return new PropertyValueArray(ImmutableList.copyOf(list));
    }
    return fromScalar(o);
  }

  private static PropertyValue fromScalar(Object o) {
    if (o instanceof PropertyValue) {
      return ((PropertyValue)o).getType() == PropertyValueType.ARRAY ? null : (PropertyValue)o;
    }
    if (o instanceof String) {
      return of((String)o);
    }
    if (o instanceof Boolean) {
      return of(((Boolean)o).booleanValue());
    }
    if (o instanceof Long || o instanceof Integer || o instanceof Short || o instanceof Byte) {
      return of(((Number)o).longValue());
    }
    if (o instanceof Number) {
      return of(((Number)o).doubleValue());
    }
    if (o instanceof Date) {
      return of((Date)o);
    }
    if (o instanceof Instant) {
      return of((Instant)o);
    }
    return null;
  }

  /**
   * Returns the type of this value.
   * 
   * @return the value type
   */
  public abstract PropertyValueType getType();

  /**
   * Returns the string value if this is a string, otherwise null.
   * 
   * @return a string or null
   */
  public String stringValue() {
    return null;
  }

  /**
   * Returns the numeric value if this is a number, otherwise zero.
   * 
   * @return a number
   */
  public double doubleValue() {
    return 0;
  }

  /**
   * Returns the numeric value as a long if this is a number, otherwise zero. Fractional values are
   * truncated.
   * 
   * @return a number
   */
  public long longValue() {
    return (long)doubleValue();
  }

  /**
   * Returns the boolean value if this is a boolean, otherwise false.
   * 
   * @return a boolean
   */
  public boolean booleanValue() {
    return false;
  }

  /**
   * Returns the instant if this is a date, otherwise null.
   * 
   * @return an instant or null
   */
  public Instant instantValue() {
    return null;
  }

  /**
   * Returns the elements if this is an array, otherwise an empty list.
   * 
   * @return an immutable list
   */
  public List<PropertyValue> values() {
    return ImmutableList.of();
  }

  abstract void write(JsonWriter writer) throws IOException;

  /**
   * Converts this value to its JSON representation.
   * 
   * @return a JSON string
   */
  public String toJsonString() {
    StringWriter sw = new StringWriter();
    try (JsonWriter jw = new JsonWriter(sw)) {
      write(jw);
    } catch (IOException e) { // COVERAGE: StringWriter does not throw
      throw new IllegalStateException(e);
    }
    return sw.toString();
  }

  @Override
  public String toString() {
    return toJsonString();
  }
}
