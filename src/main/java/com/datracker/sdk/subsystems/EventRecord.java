package com.datracker.sdk.subsystems;

import com.datracker.sdk.GeoLocation;
import com.datracker.sdk.PropertyValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * A single captured analytics event.
 */
public final class EventRecord extends Record {
  private final String name;
  private final Double costSeconds;
  private final ImmutableList<String> categories;
  private final ImmutableMap<String, PropertyValue> attributes;
  private final GeoLocation location;
  private final String sessionId;
  private final String userId;

  /**
   * Constructs an instance.
   * 
   * @param id the unique record identifier
   * @param name the event name
   * @param timestamp the capture time in milliseconds since the epoch
   * @param costSeconds the duration of the activity in seconds, or null
   * @param categories the category path, outermost first; may be null
   * @param attributes the merged attributes; may be null
   * @param location the geo-coordinates, or null
   * @param sessionId the session that was active at capture time, or null
   * @param userId the logged-in user at capture time, or null
   */
  public EventRecord(
      String id,
      String name,
      long timestamp,
      Double costSeconds,
      List<String> categories,
      Map<String, PropertyValue> attributes,
      GeoLocation location,
      String sessionId,
      String userId
      ) {
    super(id, timestamp);
    this.name = name;
    this.costSeconds = costSeconds;
    this.categories = categories == null ? ImmutableList.of() : ImmutableList.copyOf(categories);
    this.attributes = attributes == null ? ImmutableMap.of() : ImmutableMap.copyOf(attributes);
    this.location = location;
    this.sessionId = sessionId;
    this.userId = userId;
  }

  /**
   * The event name.
   * @return the name
   */
  public String getName() {
    return name;
  }

  /**
   * The duration of the tracked activity in seconds, if any.
   * @return the duration or null
   */
  public Double getCostSeconds() {
    return costSeconds;
  }

  /**
   * The category path, outermost first. At most five entries.
   * @return an immutable list; never null
   */
  public List<String> getCategories() {
    return categories;
  }

  /**
   * The event attributes, including super properties that were registered at capture time.
   * @return an immutable map; never null
   */
  public Map<String, PropertyValue> getAttributes() {
    return attributes;
  }

  /**
   * The geo-coordinates, if any.
   * @return the location or null
   */
  public GeoLocation getLocation() {
    return location;
  }

  /**
   * The session identifier at capture time, if a session was active.
   * @return the session identifier or null
   */
  public String getSessionId() {
    return sessionId;
  }

  /**
   * The logged-in user at capture time, if any.
   * @return the user identifier or null
   */
  public String getUserId() {
    return userId;
  }
}
