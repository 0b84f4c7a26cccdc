package com.datracker.sdk;

/**
 * Describes the type of a {@link PropertyValue}.
 */
public enum PropertyValueType {
  /**
   * The value is a string.
   */
  STRING,
  /**
   * The value is numeric. Integers and floating-point values share this type.
   */
  NUMBER,
  /**
   * The value is a boolean.
   */
  BOOLEAN,
  /**
   * The value is a point in time. On the wire it is an ISO-8601 string.
   */
  DATE,
  /**
   * The value is an ordered list of non-array values.
   */
  ARRAY
}
