package com.datracker.sdk;

import com.datracker.sdk.interfaces.DropReason;
import com.datracker.sdk.subsystems.EventRecord;
import com.launchdarkly.logging.LDLogger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.LongSupplier;

/**
 * Validates an event request and turns it into an {@link EventRecord}, merging in the super
 * properties, any pending timer, the session, the logged-in user and the default location.
 * <p>
 * A rejected request returns null; it is logged and reported to the {@link DropRecorder}, and it
 * leaves the event's timer in place.
 */
final class EventRecordBuilder {
  /**
   * Event names with this prefix are reserved for events generated by the tracker itself.
   */
  static final String RESERVED_PREFIX = "da_";

  static final int MAX_CATEGORIES = 5;

  private final PropertyOverlayStore overlay;
  private final SessionTracker sessions;
  private final DropRecorder drops;
  private final LongSupplier clock;
  private final LDLogger logger;

  private volatile String userId;
  private volatile GeoLocation defaultLocation;

  EventRecordBuilder(
      PropertyOverlayStore overlay,
      SessionTracker sessions,
      DropRecorder drops,
      LongSupplier clock,
      LDLogger logger
      ) {
    this.overlay = overlay;
    this.sessions = sessions;
    this.drops = drops;
    this.clock = clock;
    this.logger = logger;
  }

  EventRecord build(
      String name,
      Double costSeconds,
      List<String> categories,
      Map<String, PropertyValue> attributes,
      GeoLocation location,
      boolean requireSession
      ) {
    if (name == null || name.isEmpty()) {
      logger.warn("Ignoring event with an empty name");
      drops.record(DropReason.INVALID_NAME, name, 1);
      return null;
    }
    if (name.startsWith(RESERVED_PREFIX)) {
      logger.warn("Ignoring event \"{}\": names starting with \"{}\" are reserved", name, RESERVED_PREFIX);
      drops.record(DropReason.RESERVED_NAME, name, 1);
      return null;
    }
    String sessionId = sessions.currentId();
    if (requireSession && sessionId == null) {
      logger.debug("Ignoring event \"{}\": it requires a session and none is active", name);
      drops.record(DropReason.SESSION_REQUIRED, name, 1);
      return null;
    }

    long now = clock.getAsLong();
    Double cost = costSeconds == null || costSeconds < 0 || !Double.isFinite(costSeconds) ? null : costSeconds;
    Long timerStart = overlay.consumeTimer(name);
    if (timerStart != null && (cost == null || cost == 0)) {
      cost = Math.max(0, now - timerStart) / 1000.0;
    }

    List<String> path = new ArrayList<>();
    if (categories != null) {
      for (String c: categories) {
        if (c == null) {
          continue;
        }
        if (path.size() == MAX_CATEGORIES) {
          logger.debug("Event \"{}\" has more than {} categories; extra categories were dropped", name, MAX_CATEGORIES);
          break;
        }
        path.add(c);
      }
    }

    return new EventRecord(
        UUID.randomUUID().toString(),
        name,
        now,
        cost,
        path,
        mergeAttributes(attributes),
        location == null ? defaultLocation : location,
        sessionId,
        userId
        );
  }

  /**
   * Builds one of the tracker's own events. The reserved-prefix check does not apply, and timers
   * are not consumed.
   */
  EventRecord buildInternal(String name, Double costSeconds, Map<String, PropertyValue> attributes, String sessionId) {
    return new EventRecord(
        UUID.randomUUID().toString(),
        name,
        clock.getAsLong(),
        costSeconds,
        Collections.<String>emptyList(),
        mergeAttributes(attributes),
        defaultLocation,
        sessionId,
        userId
        );
  }

  private Map<String, PropertyValue> mergeAttributes(Map<String, PropertyValue> attributes) {
    Map<String, PropertyValue> merged = new LinkedHashMap<>(overlay.current());
    if (attributes != null) {
      merged.putAll(attributes);
    }
    return merged;
  }

  String getUserId() {
    return userId;
  }

  void setUserId(String userId) {
    this.userId = userId;
  }

  GeoLocation getDefaultLocation() {
    return defaultLocation;
  }

  void setDefaultLocation(GeoLocation defaultLocation) {
    this.defaultLocation = defaultLocation;
  }
}
