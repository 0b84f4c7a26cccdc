package com.datracker.sdk;

import com.datracker.sdk.internal.RecordSerialization;
import com.datracker.sdk.subsystems.KeyValueStore;
import com.datracker.sdk.subsystems.StorageException;
import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Holds the super properties that are merged into every event, and the start times of event timers.
 * <p>
 * Every mutation is written through to the {@link KeyValueStore} while the lock is held, so the
 * stored state always matches some sequence of completed calls. If a write fails, the in-memory
 * state is still updated and the failure is logged. Properties that cannot be serialized at all
 * are rejected before anything changes.
 */
final class PropertyOverlayStore {
  static final String SUPER_PROPERTIES_KEY = "superProperties";
  static final String TIMERS_KEY = "eventTimers";

  private static final Gson gson = new Gson();
  private static final Type TIMERS_TYPE = new TypeToken<Map<String, Long>>() {}.getType();

  private final Object lock = new Object();
  private final KeyValueStore store;
  private final LongSupplier clock;
  private final LDLogger logger;
  private final Map<String, PropertyValue> superProperties = new LinkedHashMap<>();
  private final Map<String, Long> timers = new LinkedHashMap<>();

  PropertyOverlayStore(KeyValueStore store, LongSupplier clock, LDLogger logger) {
    this.store = store;
    this.clock = clock;
    this.logger = logger;
    load();
  }

  private void load() {
    String props = read(SUPER_PROPERTIES_KEY);
    if (props != null) {
      try {
        superProperties.putAll(RecordSerialization.propertiesFromJson(props));
      } catch (JsonParseException e) {
        logger.warn("Ignoring unreadable stored super properties: {}", LogValues.exceptionSummary(e));
      }
    }
    String storedTimers = read(TIMERS_KEY);
    if (storedTimers != null) {
      try {
        Map<String, Long> parsed = gson.fromJson(storedTimers, TIMERS_TYPE);
        if (parsed != null) {
          for (Map.Entry<String, Long> kv: parsed.entrySet()) {
            if (kv.getKey() != null && kv.getValue() != null) {
              timers.put(kv.getKey(), kv.getValue());
            }
          }
        }
      } catch (JsonParseException e) {
        logger.warn("Ignoring unreadable stored event timers: {}", LogValues.exceptionSummary(e));
      }
    }
  }

  /**
   * Adds super properties.
   * 
   * @param properties the new values
   * @param overwrite true to replace existing values; false to only add keys that are not present
   */
  void setSuperProperties(Map<String, PropertyValue> properties, boolean overwrite) {
    synchronized (lock) {
      Map<String, PropertyValue> updated = new LinkedHashMap<>(superProperties);
      boolean changed = false;
      for (Map.Entry<String, PropertyValue> kv: properties.entrySet()) {
        if (overwrite || !updated.containsKey(kv.getKey())) {
          updated.put(kv.getKey(), kv.getValue());
          changed = true;
        }
      }
      if (changed) {
        replaceSuperProperties(updated);
      }
    }
  }

  /**
   * Adds super properties that are not already set. A key whose current value equals
   * {@code defaultValue} counts as not set.
   * 
   * @param properties the new values
   * @param defaultValue a placeholder value that may be replaced, or null
   */
  void setSuperPropertiesOnce(Map<String, PropertyValue> properties, PropertyValue defaultValue) {
    synchronized (lock) {
      Map<String, PropertyValue> updated = new LinkedHashMap<>(superProperties);
      boolean changed = false;
      for (Map.Entry<String, PropertyValue> kv: properties.entrySet()) {
        PropertyValue existing = updated.get(kv.getKey());
        if (existing == null || (defaultValue != null && defaultValue.equals(existing))) {
          updated.put(kv.getKey(), kv.getValue());
          changed = true;
        }
      }
      if (changed) {
        replaceSuperProperties(updated);
      }
    }
  }

  void unregister(String key) {
    synchronized (lock) {
      if (superProperties.remove(key) != null) {
        persistSuperProperties();
      }
    }
  }

  void clear() {
    synchronized (lock) {
      superProperties.clear();
      persistSuperProperties();
    }
  }

  Map<String, PropertyValue> current() {
    synchronized (lock) {
      return ImmutableMap.copyOf(superProperties);
    }
  }

  /**
   * Starts, or restarts, the timer for an event name.
   * 
   * @param name the event name
   */
  void startTimer(String name) {
    synchronized (lock) {
      timers.put(name, clock.getAsLong());
      persistTimers();
    }
  }

  void clearTimers() {
    synchronized (lock) {
      timers.clear();
      persistTimers();
    }
  }

  /**
   * Removes the timer for an event name.
   * 
   * @param name the event name
   * @return the timer's start time in epoch milliseconds, or null if there was no timer
   */
  Long consumeTimer(String name) {
    synchronized (lock) {
      Long start = timers.remove(name);
      if (start != null) {
        persistTimers();
      }
      return start;
    }
  }

  Map<String, Long> timers() {
    synchronized (lock) {
      return ImmutableMap.copyOf(timers);
    }
  }

  private String read(String key) {
    try {
      return store.get(key);
    } catch (StorageException e) {
      logger.error("Could not read {} from local storage: {}", key, LogValues.exceptionSummary(e));
      return null;
    }
  }

  // The new map is serialized first; if that fails, the current properties are kept.
  private void replaceSuperProperties(Map<String, PropertyValue> updated) {
    String json;
    try {
      json = RecordSerialization.propertiesToJson(updated);
    } catch (IllegalArgumentException e) {
      logger.warn("Ignoring super properties that cannot be serialized: {}", LogValues.exceptionSummary(e));
      return;
    }
    superProperties.clear();
    superProperties.putAll(updated);
    write(SUPER_PROPERTIES_KEY, json);
  }

  private void persistSuperProperties() {
    write(SUPER_PROPERTIES_KEY, RecordSerialization.propertiesToJson(superProperties));
  }

  private void persistTimers() {
    write(TIMERS_KEY, gson.toJson(timers, TIMERS_TYPE));
  }

  private void write(String key, String json) {
    try {
      store.put(key, json);
    } catch (StorageException e) {
      logger.error("Could not save {} to local storage: {}", key, LogValues.exceptionSummary(e));
      logger.debug("{}", LogValues.exceptionTrace(e));
    }
  }
}
