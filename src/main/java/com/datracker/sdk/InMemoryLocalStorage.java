package com.datracker.sdk;

import com.datracker.sdk.internal.RecordSerialization;
import com.datracker.sdk.subsystems.DurableQueue;
import com.datracker.sdk.subsystems.KeyValueStore;
import com.datracker.sdk.subsystems.LocalStorage;
import com.datracker.sdk.subsystems.QueueEntry;
import com.datracker.sdk.subsystems.Record;
import com.datracker.sdk.subsystems.StorageException;
import com.launchdarkly.logging.LDLogger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Local storage that keeps everything in memory. Nothing survives a restart.
 * <p>
 * This is what {@link Components#inMemoryStorage()} builds.
 */
final class InMemoryLocalStorage implements LocalStorage {
  private final InMemoryQueue queue;
  private final InMemoryKeyValueStore keyValueStore = new InMemoryKeyValueStore();

  InMemoryLocalStorage(int capacity, LDLogger logger) {
    this.queue = new InMemoryQueue(capacity, logger);
  }

  @Override
  public DurableQueue getQueue() {
    return queue;
  }

  @Override
  public KeyValueStore getKeyValueStore() {
    return keyValueStore;
  }

  @Override
  public void close() {
    queue.close();
  }

  static final class InMemoryQueue implements DurableQueue {
    private final int capacity;
    private final LDLogger logger;
    private final TreeMap<Long, QueueEntry> entries = new TreeMap<>();
    private final Set<Long> leased = new HashSet<>();
    private long lastSequence;
    private long evictedCount;
    private boolean overflowing;
    private boolean closed;

    InMemoryQueue(int capacity, LDLogger logger) {
      this.capacity = capacity;
      this.logger = logger;
    }

    @Override
    public synchronized long enqueue(Record record) {
      if (closed) {
        throw new StorageException("queue has been closed", null);
      }
      // accept only what the uploader will be able to serialize
      try {
        RecordSerialization.toJson(record);
      } catch (IllegalArgumentException e) {
        throw new StorageException("could not serialize record " + record.getId(), e);
      }
      long seq = ++lastSequence;
      entries.put(seq, new QueueEntry(seq, record, 0, 0, System.currentTimeMillis()));
      int excess = entries.size() - capacity;
      if (excess <= 0) {
        overflowing = false;
      } else {
        Iterator<Long> it = entries.keySet().iterator();
        while (excess > 0 && it.hasNext()) {
          if (!leased.contains(it.next())) {
            it.remove();
            excess--;
            evictedCount++;
          }
        }
        if (!overflowing) {
          overflowing = true;
          logger.warn("Record queue reached its capacity of {}; discarding the oldest records", capacity);
        }
      }
      return seq;
    }

    @Override
    public synchronized List<QueueEntry> leaseBatch(int maxCount) {
      if (!leased.isEmpty() || maxCount <= 0) {
        return Collections.emptyList();
      }
      List<QueueEntry> ret = new ArrayList<>();
      for (QueueEntry e: entries.values()) {
        if (ret.size() >= maxCount) {
          break;
        }
        ret.add(e);
        leased.add(e.getSequence());
      }
      return ret;
    }

    @Override
    public synchronized void commit(Collection<Long> sequences) {
      for (Long seq: sequences) {
        entries.remove(seq);
      }
      leased.clear();
    }

    @Override
    public synchronized void release(Collection<Long> sequences) {
      long now = System.currentTimeMillis();
      for (Long seq: sequences) {
        QueueEntry e = entries.get(seq);
        if (e != null) {
          entries.put(seq, new QueueEntry(seq, e.getRecord(), e.getAttemptCount() + 1, now, e.getEnqueuedAt()));
        }
      }
      leased.clear();
    }

    @Override
    public synchronized int size() {
      return entries.size();
    }

    @Override
    public synchronized long getAndClearEvictedCount() {
      long ret = evictedCount;
      evictedCount = 0;
      return ret;
    }

    @Override
    public synchronized void close() {
      closed = true;
    }
  }

  static final class InMemoryKeyValueStore implements KeyValueStore {
    private final Map<String, String> values = new HashMap<>();

    @Override
    public synchronized String get(String key) {
      return values.get(key);
    }

    @Override
    public synchronized void put(String key, String value) {
      values.put(key, value);
    }

    @Override
    public synchronized void remove(String key) {
      values.remove(key);
    }
  }
}
