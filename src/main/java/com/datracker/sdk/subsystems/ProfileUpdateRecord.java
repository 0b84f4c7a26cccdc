package com.datracker.sdk.subsystems;

import com.datracker.sdk.PropertyValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * A single mutation of a user profile.
 */
public final class ProfileUpdateRecord extends Record {
  /**
   * The kinds of profile mutation.
   */
  public enum Operation {
    /**
     * Set properties, overwriting existing values.
     */
    SET,
    /**
     * Set properties only where the profile has no value yet.
     */
    SET_ONCE,
    /**
     * Remove the named properties.
     */
    UNSET,
    /**
     * Delete the whole profile.
     */
    DELETE_USER,
    /**
     * Record revenue for the user.
     */
    CHARGE
  }

  private final Operation operation;
  private final String userId;
  private final ImmutableMap<String, PropertyValue> properties;
  private final ImmutableList<String> propertyNames;
  private final Double amount;

  /**
   * Constructs an instance.
   * 
   * @param id the unique record identifier
   * @param timestamp the capture time in milliseconds since the epoch
   * @param operation the kind of mutation
   * @param userId the profile that is being changed
   * @param properties the property values for {@code SET}, {@code SET_ONCE} and {@code CHARGE}; may be null
   * @param propertyNames the property names for {@code UNSET}; may be null
   * @param amount the charged amount for {@code CHARGE}; otherwise null
   */
  public ProfileUpdateRecord(
      String id,
      long timestamp,
      Operation operation,
      String userId,
      Map<String, PropertyValue> properties,
      List<String> propertyNames,
      Double amount
      ) {
    super(id, timestamp);
    this.operation = operation;
    this.userId = userId;
    this.properties = properties == null ? ImmutableMap.of() : ImmutableMap.copyOf(properties);
    this.propertyNames = propertyNames == null ? ImmutableList.of() : ImmutableList.copyOf(propertyNames);
    this.amount = amount;
  }

  /**
   * The kind of mutation.
   * @return the operation
   */
  public Operation getOperation() {
    return operation;
  }

  /**
   * The identifier of the profile being changed.
   * @return the user identifier
   */
  public String getUserId() {
    return userId;
  }

  /**
   * The property values carried by the mutation.
   * @return an immutable map; never null
   */
  public Map<String, PropertyValue> getProperties() {
    return properties;
  }

  /**
   * The property names removed by an {@code UNSET}.
   * @return an immutable list; never null
   */
  public List<String> getPropertyNames() {
    return propertyNames;
  }

  /**
   * The amount of a {@code CHARGE}.
   * @return the amount or null
   */
  public Double getAmount() {
    return amount;
  }
}
