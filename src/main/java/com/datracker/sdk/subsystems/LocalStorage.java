package com.datracker.sdk.subsystems;

import java.io.Closeable;

/**
 * Interface for the tracker's local storage, which provides the queue of undelivered records and a
 * persistent key-value store.
 * <p>
 * The default implementation is {@link com.datracker.sdk.integrations.SQLite}; the non-durable
 * {@link com.datracker.sdk.Components#inMemoryStorage()} is useful in tests.
 */
public interface LocalStorage extends Closeable {
  /**
   * Returns the record queue.
   * 
   * @return the queue
   */
  DurableQueue getQueue();

  /**
   * Returns the key-value store.
   * 
   * @return the key-value store
   */
  KeyValueStore getKeyValueStore();
}
