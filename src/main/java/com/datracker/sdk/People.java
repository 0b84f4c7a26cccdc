package com.datracker.sdk;

import com.datracker.sdk.subsystems.ProfileUpdateRecord.Operation;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Records changes to the profile of the current user.
 * <p>
 * Each call enqueues one profile update, which is uploaded along with events. The update applies
 * to the logged-in user (see {@link Tracker#loginUser(String)}), or to the device identifier when
 * no user is logged in. Like the tracking methods, these calls never throw and never block on the
 * network.
 * <p>
 * Obtain an instance from {@link Tracker#people()}.
 */
public final class People {
  /**
   * The profile property that holds the list of charges made with {@link #trackCharge(double)}.
   */
  public static final String TRANSACTIONS_PROPERTY = "$transactions";

  private final Tracker tracker;

  People(Tracker tracker) {
    this.tracker = tracker;
  }

  /**
   * Sets profile properties, overwriting existing values.
   * 
   * @param properties the property values; unsupported values are ignored
   */
  public void set(Map<String, ?> properties) {
    tracker.enqueueProfileUpdate(Operation.SET, properties, null, null);
  }

  /**
   * Sets a single profile property, overwriting any existing value.
   * 
   * @param key the property name
   * @param value the property value
   */
  public void set(String key, Object value) {
    if (key != null) {
      tracker.enqueueProfileUpdate(Operation.SET, singleton(key, value), null, null);
    }
  }

  /**
   * Sets profile properties that do not have a value yet. Existing values are left unchanged.
   * 
   * @param properties the property values; unsupported values are ignored
   */
  public void setOnce(Map<String, ?> properties) {
    tracker.enqueueProfileUpdate(Operation.SET_ONCE, properties, null, null);
  }

  /**
   * Sets a single profile property if it does not have a value yet.
   * 
   * @param key the property name
   * @param value the property value
   */
  public void setOnce(String key, Object value) {
    if (key != null) {
      tracker.enqueueProfileUpdate(Operation.SET_ONCE, singleton(key, value), null, null);
    }
  }

  /**
   * Removes a profile property.
   * 
   * @param key the property name
   */
  public void unset(String key) {
    if (key != null && !key.isEmpty()) {
      tracker.enqueueProfileUpdate(Operation.UNSET, null, ImmutableList.of(key), null);
    }
  }

  /**
   * Deletes the whole profile.
   */
  public void deleteUser() {
    tracker.enqueueProfileUpdate(Operation.DELETE_USER, null, null, null);
  }

  /**
   * Records revenue from the user.
   * 
   * @param amount the amount charged
   */
  public void trackCharge(double amount) {
    trackCharge(amount, null);
  }

  /**
   * Records revenue from the user, with additional details.
   * 
   * @param amount the amount charged
   * @param properties details of the charge, such as a product identifier; may be null
   */
  public void trackCharge(double amount, Map<String, ?> properties) {
    tracker.enqueueProfileUpdate(Operation.CHARGE, properties, null, amount);
  }

  /**
   * Removes all charges recorded for the user.
   */
  public void clearCharges() {
    unset(TRANSACTIONS_PROPERTY);
  }

  private static Map<String, ?> singleton(String key, Object value) {
    return value == null ? ImmutableMap.of() : ImmutableMap.of(key, value);
  }
}
