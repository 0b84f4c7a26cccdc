package com.datracker.sdk.integrations;

import com.datracker.sdk.internal.RecordSerialization;
import com.datracker.sdk.subsystems.DurableQueue;
import com.datracker.sdk.subsystems.QueueEntry;
import com.datracker.sdk.subsystems.Record;
import com.datracker.sdk.subsystems.StorageException;
import com.google.gson.JsonParseException;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

final class SQLiteDurableQueue implements DurableQueue {
  private final SQLiteLocalStorage storage;
  private final int capacity;
  private final LDLogger logger;

  // guarded by storage.lock
  private final Set<Long> leased = new HashSet<>();
  private boolean overflowing;
  private long evictedCount;

  SQLiteDurableQueue(SQLiteLocalStorage storage, int capacity, LDLogger logger) {
    this.storage = storage;
    this.capacity = capacity;
    this.logger = logger;
  }

  @Override
  public long enqueue(Record record) {
    String data;
    try {
      data = RecordSerialization.toJson(record);
    } catch (IllegalArgumentException e) {
      throw new StorageException("could not serialize record " + record.getId(), e);
    }
    synchronized (storage.lock) {
      Connection conn = storage.connection();
      long sequence;
      try {
        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO records (data, created_at) VALUES (?, ?)")) {
          ps.setString(1, data);
          ps.setLong(2, System.currentTimeMillis());
          ps.executeUpdate();
        }
        try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
          rs.next();
          sequence = rs.getLong(1);
        }
      } catch (SQLException e) {
        throw new StorageException("could not store record " + record.getId(), e);
      }
      try {
        evictOverflow(conn);
      } catch (StorageException e) {
        logger.warn("Could not enforce queue capacity: {}", LogValues.exceptionSummary(e));
      }
      return sequence;
    }
  }

  private void evictOverflow(Connection conn) {
    int excess = countRows(conn) - capacity;
    if (excess <= 0) {
      overflowing = false;
      return;
    }
    StringBuilder sql = new StringBuilder("DELETE FROM records WHERE seq IN (SELECT seq FROM records");
    if (!leased.isEmpty()) {
      sql.append(" WHERE seq NOT IN (").append(placeholders(leased.size())).append(")");
    }
    sql.append(" ORDER BY seq LIMIT ?)");
    int deleted;
    try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
      int i = 1;
      for (Long seq: leased) {
        ps.setLong(i++, seq);
      }
      ps.setInt(i, excess);
      deleted = ps.executeUpdate();
    } catch (SQLException e) {
      throw new StorageException("could not evict records", e);
    }
    evictedCount += deleted;
    if (!overflowing) {
      overflowing = true;
      logger.warn("Record queue reached its capacity of {}; discarding the oldest records", capacity);
    }
  }

  @Override
  public List<QueueEntry> leaseBatch(int maxCount) {
    synchronized (storage.lock) {
      if (!leased.isEmpty() || maxCount <= 0) {
        return Collections.emptyList();
      }
      Connection conn = storage.connection();
      List<QueueEntry> ret = new ArrayList<>();
      List<Long> corrupt = new ArrayList<>();
      try (PreparedStatement ps = conn.prepareStatement(
          "SELECT seq, data, attempts, last_attempt_at, created_at FROM records ORDER BY seq LIMIT ?")) {
        ps.setInt(1, maxCount);
        try (ResultSet rs = ps.executeQuery()) {
          while (rs.next()) {
            long seq = rs.getLong(1);
            Record record;
            try {
              record = RecordSerialization.fromJson(rs.getString(2));
            } catch (JsonParseException e) {
              logger.warn("Discarding unreadable stored record {}: {}", seq, LogValues.exceptionSummary(e));
              corrupt.add(seq);
              continue;
            }
            ret.add(new QueueEntry(seq, record, rs.getInt(3), rs.getLong(4), rs.getLong(5)));
          }
        }
      } catch (SQLException e) {
        throw new StorageException("could not read records", e);
      }
      if (!corrupt.isEmpty()) {
        deleteRows(conn, corrupt);
      }
      for (QueueEntry e: ret) {
        leased.add(e.getSequence());
      }
      return ret;
    }
  }

  @Override
  public void commit(Collection<Long> sequences) {
    synchronized (storage.lock) {
      try {
        if (!sequences.isEmpty()) {
          deleteRows(storage.connection(), sequences);
        }
      } finally {
        leased.clear();
      }
    }
  }

  @Override
  public void release(Collection<Long> sequences) {
    synchronized (storage.lock) {
      try {
        if (sequences.isEmpty()) {
          return;
        }
        long now = System.currentTimeMillis();
        runBatch(storage.connection(), "UPDATE records SET attempts = attempts + 1, last_attempt_at = ? WHERE seq = ?",
            sequences, now);
      } finally {
        leased.clear();
      }
    }
  }

  @Override
  public int size() {
    synchronized (storage.lock) {
      return countRows(storage.connection());
    }
  }

  @Override
  public long getAndClearEvictedCount() {
    synchronized (storage.lock) {
      long ret = evictedCount;
      evictedCount = 0;
      return ret;
    }
  }

  @Override
  public void close() {
    // the connection belongs to SQLiteLocalStorage
  }

  private void deleteRows(Connection conn, Collection<Long> sequences) {
    runBatch(conn, "DELETE FROM records WHERE seq = ?", sequences, null);
  }

  private void runBatch(Connection conn, String sql, Collection<Long> sequences, Long timestamp) {
    try {
      conn.setAutoCommit(false);
      try (PreparedStatement ps = conn.prepareStatement(sql)) {
        for (Long seq: sequences) {
          int i = 1;
          if (timestamp != null) {
            ps.setLong(i++, timestamp);
          }
          ps.setLong(i, seq);
          ps.addBatch();
        }
        ps.executeBatch();
        conn.commit();
      } catch (SQLException e) {
        conn.rollback();
        throw e;
      } finally {
        conn.setAutoCommit(true);
      }
    } catch (SQLException e) {
      throw new StorageException("could not update records", e);
    }
  }

  private static int countRows(Connection conn) {
    try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM records")) {
      rs.next();
      return rs.getInt(1);
    } catch (SQLException e) {
      throw new StorageException("could not count records", e);
    }
  }

  private static String placeholders(int n) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < n; i++) {
      sb.append(i == 0 ? "?" : ", ?");
    }
    return sb.toString();
  }
}
