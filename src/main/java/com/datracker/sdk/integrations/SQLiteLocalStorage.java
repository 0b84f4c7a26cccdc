package com.datracker.sdk.integrations;

import com.datracker.sdk.subsystems.DurableQueue;
import com.datracker.sdk.subsystems.KeyValueStore;
import com.datracker.sdk.subsystems.LocalStorage;
import com.datracker.sdk.subsystems.StorageException;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Local storage in a single SQLite database file.
 * <p>
 * All access goes through one JDBC connection in autocommit mode, guarded by {@link #lock}, so
 * every completed write is on disk before the calling method returns.
 */
final class SQLiteLocalStorage implements LocalStorage {
  static final String LOGGER_NAME = "Queue";

  private static final String CREATE_RECORDS_TABLE =
      "CREATE TABLE IF NOT EXISTS records (" +
      "seq INTEGER PRIMARY KEY AUTOINCREMENT, " +
      "data TEXT NOT NULL, " +
      "created_at INTEGER NOT NULL, " +
      "attempts INTEGER NOT NULL DEFAULT 0, " +
      "last_attempt_at INTEGER NOT NULL DEFAULT 0)";
  private static final String CREATE_KV_TABLE =
      "CREATE TABLE IF NOT EXISTS kv (k TEXT PRIMARY KEY, v TEXT NOT NULL)";

  final Object lock = new Object();
  private final Connection connection;
  private final SQLiteDurableQueue queue;
  private final KeyValueStore keyValueStore;
  private final LDLogger logger;
  private volatile boolean closed;

  SQLiteLocalStorage(Path path, int capacity, LDLogger logger) {
    this.logger = logger;
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
    } catch (IOException e) {
      throw new StorageException("could not create directory for " + path, e);
    }
    Connection conn = null;
    try {
      conn = DriverManager.getConnection("jdbc:sqlite:" + path.toAbsolutePath());
      try (Statement st = conn.createStatement()) {
        st.execute(CREATE_RECORDS_TABLE);
        st.execute(CREATE_KV_TABLE);
      }
    } catch (SQLException e) {
      closeAfterFailure(conn, e);
      throw new StorageException("could not open database " + path, e);
    }
    this.connection = conn;
    logger.debug("Opened SQLite storage at {}", path);
    this.queue = new SQLiteDurableQueue(this, capacity, logger);
    this.keyValueStore = new SQLiteKeyValueStore();
  }

  @Override
  public DurableQueue getQueue() {
    return queue;
  }

  @Override
  public KeyValueStore getKeyValueStore() {
    return keyValueStore;
  }

  Connection connection() {
    if (closed) {
      throw new StorageException("storage has been closed", null);
    }
    return connection;
  }

  @Override
  public void close() throws IOException {
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
      try {
        connection.close();
      } catch (SQLException e) {
        logger.warn("Error closing SQLite storage: {}", LogValues.exceptionSummary(e));
        throw new IOException(e);
      }
    }
  }

  private final class SQLiteKeyValueStore implements KeyValueStore {
    @Override
    public String get(String key) {
      synchronized (lock) {
        try (PreparedStatement ps = connection().prepareStatement("SELECT v FROM kv WHERE k = ?")) {
          ps.setString(1, key);
          try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getString(1) : null;
          }
        } catch (SQLException e) {
          throw new StorageException("could not read key " + key, e);
        }
      }
    }

    @Override
    public void put(String key, String value) {
      synchronized (lock) {
        try (PreparedStatement ps = connection().prepareStatement("INSERT OR REPLACE INTO kv (k, v) VALUES (?, ?)")) {
          ps.setString(1, key);
          ps.setString(2, value);
          ps.executeUpdate();
        } catch (SQLException e) {
          throw new StorageException("could not write key " + key, e);
        }
      }
    }

    @Override
    public void remove(String key) {
      synchronized (lock) {
        try (PreparedStatement ps = connection().prepareStatement("DELETE FROM kv WHERE k = ?")) {
          ps.setString(1, key);
          ps.executeUpdate();
        } catch (SQLException e) {
          throw new StorageException("could not remove key " + key, e);
        }
      }
    }
  }

  private static void closeAfterFailure(Connection conn, SQLException cause) {
    if (conn == null) {
      return;
    }
    try {
      conn.close();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }
}
