package com.datracker.sdk.integrations;

import com.datracker.sdk.subsystems.DurableQueue;
import com.datracker.sdk.subsystems.LocalStorage;
import com.launchdarkly.logging.LDLogLevel;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import static com.datracker.sdk.TestComponents.clientContext;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class SQLiteDurableQueueTest extends DurableQueueTestBase {
  @Rule public TemporaryFolder tempFolder = new TemporaryFolder();

  private Path dbPath() {
    return tempFolder.getRoot().toPath().resolve("sub").resolve("test.db");
  }

  @Override
  protected LocalStorage makeStorage(int capacity) {
    return new SQLiteLocalStorage(dbPath(), capacity, testLogger);
  }

  @Override
  protected boolean isPersistent() {
    return true;
  }

  @Test
  public void corruptRowsAreDiscarded() throws SQLException {
    DurableQueue q = open(100).getQueue();
    q.enqueue(event("a"));
    try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + dbPath().toAbsolutePath());
        Statement st = c.createStatement()) {
      st.executeUpdate("INSERT INTO records (data, created_at) VALUES ('{not json', 0)");
    }
    q.enqueue(event("b"));

    assertThat(q.leaseBatch(10), hasSize(2));
    assertEquals(2, q.size());
    assertTrue(hasLogMessage(LDLogLevel.WARN, "unreadable stored record"));
  }

  @Test
  public void defaultPathIsDerivedFromAppKey() {
    Path p1 = SQLiteStorageBuilder.defaultPath("key1");
    Path p2 = SQLiteStorageBuilder.defaultPath("key2");
    assertEquals(SQLiteStorageBuilder.DEFAULT_DIRECTORY, p1.getParent().getFileName().toString());
    assertTrue(p1.getFileName().toString().startsWith("datracker-"));
    assertNotEquals(p1, p2);
  }

  @Test
  public void builderUsesConfiguredPath() throws IOException {
    try (LocalStorage s = SQLite.storage().path(dbPath()).capacity(5)
        .build(clientContext("key"))) {
      s.getQueue().enqueue(event("a"));
    }
    try (LocalStorage s = makeStorage(5)) {
      assertThat(names(s.getQueue().leaseBatch(10)), contains("a"));
    }
  }
}
