package com.datracker.sdk.integrations;

import com.datracker.sdk.subsystems.ComponentConfigurer;
import com.datracker.sdk.subsystems.LocalStorage;

/**
 * Base class for builders of the tracker's local storage.
 * 
 * @see SQLite#storage()
 * @see com.datracker.sdk.Components#inMemoryStorage()
 */
public abstract class LocalStorageBuilder implements ComponentConfigurer<LocalStorage> {
  /**
   * The default value for {@link #capacity(int)}.
   */
  public static final int DEFAULT_CAPACITY = 10000;

  protected int capacity = DEFAULT_CAPACITY;

  /**
   * Sets the maximum number of undelivered records to keep.
   * <p>
   * When the queue is full, the oldest records that are not currently being uploaded are discarded
   * to make room for new ones.
   * 
   * @param capacity the capacity; a non-positive value uses the default
   * @return the builder
   */
  public LocalStorageBuilder capacity(int capacity) {
    this.capacity = capacity <= 0 ? DEFAULT_CAPACITY : capacity;
    return this;
  }
}
