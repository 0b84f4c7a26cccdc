package com.datracker.sdk.integrations;

/**
 * Integration between the tracker and SQLite, which is the default durable storage.
 * <p>
 * The database is a single file that holds the queue of undelivered records and the tracker's
 * persistent state. Each application key should use its own file.
 */
public abstract class SQLite {
  /**
   * Returns a builder object for creating SQLite-backed local storage.
   * <p>
   * This object can be modified with {@link SQLiteStorageBuilder} methods for any desired custom
   * options. Then, pass it to {@link com.datracker.sdk.TrackerConfig.Builder#storage(com.datracker.sdk.subsystems.ComponentConfigurer)}.
   * For example:
   * 
   * <pre><code>
   *     TrackerConfig config = new TrackerConfig.Builder()
   *         .storage(
   *             SQLite.storage().path(Paths.get("/var/lib/myapp/analytics.db")).capacity(20000)
   *         )
   *         .build();
   * </code></pre>
   * 
   * @return a storage configuration object
   */
  public static SQLiteStorageBuilder storage() {
    return new SQLiteStorageBuilder();
  }

  private SQLite() {}
}
