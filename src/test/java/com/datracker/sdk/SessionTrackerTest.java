package com.datracker.sdk;

import com.datracker.sdk.TestComponents.MutableClock;
import com.launchdarkly.logging.LDLogLevel;

import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class SessionTrackerTest extends BaseTest {
  private static final long TIMEOUT_MILLIS = 30000;

  private final MutableClock clock = new MutableClock(1000000);
  private final RecordingListener listener = new RecordingListener();
  private final SessionTracker sessions = new SessionTracker(Duration.ofMillis(TIMEOUT_MILLIS), clock, listener, testLogger);

  @Test
  public void noSessionUntilForeground() {
    assertFalse(sessions.isActive());
    assertNull(sessions.currentId());
    assertThat(listener.calls, empty());
  }

  @Test
  public void foregroundStartsSession() {
    sessions.onForeground();

    assertTrue(sessions.isActive());
    assertNotNull(sessions.currentId());
    assertThat(listener.calls, contains("start " + sessions.currentId() + " 1000000"));
  }

  @Test
  public void repeatedForegroundKeepsSession() {
    sessions.onForeground();
    String id = sessions.currentId();
    clock.advance(5000);
    sessions.onForeground();

    assertEquals(id, sessions.currentId());
    assertEquals(1, listener.calls.size());
  }

  @Test
  public void returningWithinTimeoutResumesSession() {
    sessions.onForeground();
    String id = sessions.currentId();
    sessions.onBackground();
    clock.advance(TIMEOUT_MILLIS - 1);
    sessions.onForeground();

    assertEquals(id, sessions.currentId());
    assertEquals(1, listener.calls.size());
  }

  @Test
  public void sessionExpiresAfterTimeoutInBackground() {
    sessions.onForeground();
    String id = sessions.currentId();
    clock.advance(10000);
    sessions.onBackground();
    clock.advance(TIMEOUT_MILLIS);

    sessions.checkExpiry();

    assertFalse(sessions.isActive());
    assertThat(listener.calls, contains(
        "start " + id + " 1000000",
        "end " + id + " 1000000 1010000"));
  }

  @Test
  public void foregroundAfterExpiryStartsNewSession() {
    sessions.onForeground();
    String first = sessions.currentId();
    sessions.onBackground();
    clock.advance(TIMEOUT_MILLIS + 1);
    sessions.onForeground();
    String second = sessions.currentId();

    assertNotEquals(first, second);
    assertEquals(3, listener.calls.size());
    assertTrue(listener.calls.get(1).startsWith("end " + first));
    assertTrue(listener.calls.get(2).startsWith("start " + second));
  }

  @Test
  public void sessionDoesNotExpireInForeground() {
    sessions.onForeground();
    clock.advance(TIMEOUT_MILLIS * 10);
    assertTrue(sessions.isActive());
  }

  @Test
  public void endSessionUsesBackgroundTimeAsEnd() {
    sessions.onForeground();
    String id = sessions.currentId();
    clock.advance(4000);
    sessions.onBackground();
    clock.advance(1000);

    sessions.endSession();

    assertFalse(sessions.isActive());
    assertEquals("end " + id + " 1000000 1004000", listener.calls.get(1));
  }

  @Test
  public void endSessionWithoutSessionDoesNothing() {
    sessions.endSession();
    assertThat(listener.calls, empty());
  }

  @Test
  public void listenerErrorIsLogged() {
    SessionTracker failing = new SessionTracker(Duration.ofMillis(TIMEOUT_MILLIS), clock, new SessionTracker.Listener() {
      @Override
      public void sessionStarted(String sessionId, long startTime) {
        throw new RuntimeException("sorry");
      }

      @Override
      public void sessionEnded(String sessionId, long startTime, long endTime) {}
    }, testLogger);

    failing.onForeground();

    assertTrue(failing.isActive());
    assertTrue(hasLogMessage(LDLogLevel.ERROR, "sorry"));
  }

  private static final class RecordingListener implements SessionTracker.Listener {
    final List<String> calls = new ArrayList<>();

    @Override
    public void sessionStarted(String sessionId, long startTime) {
      calls.add("start " + sessionId + " " + startTime);
    }

    @Override
    public void sessionEnded(String sessionId, long startTime, long endTime) {
      calls.add("end " + sessionId + " " + startTime + " " + endTime);
    }
  }
}
