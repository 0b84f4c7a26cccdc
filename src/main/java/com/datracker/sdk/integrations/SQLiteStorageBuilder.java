package com.datracker.sdk.integrations;

import com.datracker.sdk.subsystems.ClientContext;
import com.datracker.sdk.subsystems.LocalStorage;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * A builder for configuring SQLite-backed local storage.
 * <p>
 * Obtain an instance of this class by calling {@link SQLite#storage()}. After calling its methods
 * to specify any desired custom settings, pass it to
 * {@link com.datracker.sdk.TrackerConfig.Builder#storage(com.datracker.sdk.subsystems.ComponentConfigurer)}.
 * <p>
 * Builder calls can be chained, for example:
 * 
 * <pre><code>
 *     TrackerConfig config = new TrackerConfig.Builder()
 *         .storage(SQLite.storage().path(Paths.get("analytics.db")))
 *         .build();
 * </code></pre>
 */
public final class SQLiteStorageBuilder extends LocalStorageBuilder {
  /**
   * The directory, under the user's home directory, that holds database files when no path is
   * specified.
   */
  public static final String DEFAULT_DIRECTORY = ".datracker";

  Path path;

  SQLiteStorageBuilder() {}

  /**
   * Specifies the database file.
   * <p>
   * The file and its parent directories are created if they do not exist. If you do not specify a
   * path, the database is created in {@code ~/.datracker/} with a file name derived from the
   * application key.
   * 
   * @param path the database file
   * @return the builder
   */
  public SQLiteStorageBuilder path(Path path) {
    this.path = path;
    return this;
  }

  @Override
  public SQLiteStorageBuilder capacity(int capacity) {
    super.capacity(capacity);
    return this;
  }

  @Override
  public LocalStorage build(ClientContext context) {
    Path dbPath = path == null ? defaultPath(context.getAppKey()) : path;
    return new SQLiteLocalStorage(dbPath, capacity, context.getBaseLogger().subLogger(SQLiteLocalStorage.LOGGER_NAME));
  }

  static Path defaultPath(String appKey) {
    String fileName = "datracker-" +
        Hashing.sha256().hashString(appKey, StandardCharsets.UTF_8).toString().substring(0, 16) + ".db";
    return Paths.get(System.getProperty("user.home"), DEFAULT_DIRECTORY, fileName);
  }
}
