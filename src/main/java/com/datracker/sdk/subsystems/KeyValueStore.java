package com.datracker.sdk.subsystems;

/**
 * Interface for a small persistent string map, used for state that must survive a restart
 * (super properties, event timers, the generated device identifier).
 * <p>
 * Every write must be stored before the method returns.
 */
public interface KeyValueStore {
  /**
   * Reads a value.
   * 
   * @param key the key
   * @return the stored value, or null if there is none
   * @throws StorageException if the value could not be read
   */
  String get(String key);

  /**
   * Stores a value, replacing any previous value.
   * 
   * @param key the key
   * @param value the value
   * @throws StorageException if the value could not be stored
   */
  void put(String key, String value);

  /**
   * Removes a value. Removing a key that does not exist has no effect.
   * 
   * @param key the key
   * @throws StorageException if the value could not be removed
   */
  void remove(String key);
}
