package com.datracker.sdk;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.time.Duration;
import java.util.UUID;
import java.util.function.LongSupplier;

/**
 * Derives sessions from the host application's foreground and background signals.
 * <p>
 * A session starts on a foreground signal when there is no session, and ends once the application
 * has stayed in the background for longer than the inactivity timeout. A foreground signal within
 * the timeout resumes the same session. Expiry is checked lazily on every query and periodically
 * by {@link #checkExpiry()}.
 * <p>
 * Listener callbacks are made on the calling thread, after the internal lock has been released.
 */
final class SessionTracker {
  /**
   * Receives session boundaries.
   */
  interface Listener {
    void sessionStarted(String sessionId, long startTime);

    void sessionEnded(String sessionId, long startTime, long endTime);
  }

  private static final class Transition {
    final String sessionId;
    final long startTime;
    final long endTime;

    Transition(String sessionId, long startTime, long endTime) {
      this.sessionId = sessionId;
      this.startTime = startTime;
      this.endTime = endTime;
    }
  }

  private final long timeoutMillis;
  private final LongSupplier clock;
  private final Listener listener;
  private final LDLogger logger;

  // all guarded by this
  private String sessionId;
  private long startedAt;
  private long backgroundSince = -1;

  SessionTracker(Duration timeout, LongSupplier clock, Listener listener, LDLogger logger) {
    this.timeoutMillis = timeout.toMillis();
    this.clock = clock;
    this.listener = listener;
    this.logger = logger;
  }

  void onForeground() {
    Transition ended, started = null;
    synchronized (this) {
      long now = clock.getAsLong();
      ended = expireIfIdle(now);
      if (sessionId == null) {
        sessionId = UUID.randomUUID().toString();
        startedAt = now;
        started = new Transition(sessionId, now, 0);
      }
      backgroundSince = -1;
    }
    fireEnded(ended);
    if (started != null) {
      logger.debug("Started session {}", started.sessionId);
      try {
        listener.sessionStarted(started.sessionId, started.startTime);
      } catch (RuntimeException e) {
        logger.error("Unexpected error from session listener: {}", LogValues.exceptionSummary(e));
      }
    }
  }

  void onBackground() {
    synchronized (this) {
      if (sessionId != null && backgroundSince < 0) {
        backgroundSince = clock.getAsLong();
      }
    }
  }

  boolean isActive() {
    return currentId() != null;
  }

  String currentId() {
    Transition ended;
    String id;
    synchronized (this) {
      ended = expireIfIdle(clock.getAsLong());
      id = sessionId;
    }
    fireEnded(ended);
    return id;
  }

  void checkExpiry() {
    currentId();
  }

  /**
   * Ends the current session immediately, if there is one. If the application is in the
   * background, the session is considered to have ended when it went there.
   */
  void endSession() {
    Transition ended = null;
    synchronized (this) {
      if (sessionId != null) {
        long end = backgroundSince >= 0 ? backgroundSince : clock.getAsLong();
        ended = new Transition(sessionId, startedAt, end);
        sessionId = null;
        backgroundSince = -1;
      }
    }
    fireEnded(ended);
  }

  private Transition expireIfIdle(long now) {
    if (sessionId != null && backgroundSince >= 0 && now - backgroundSince >= timeoutMillis) {
      Transition t = new Transition(sessionId, startedAt, backgroundSince);
      sessionId = null;
      backgroundSince = -1;
      return t;
    }
    return null;
  }

  private void fireEnded(Transition ended) {
    if (ended == null) {
      return;
    }
    logger.debug("Session {} ended", ended.sessionId);
    try {
      listener.sessionEnded(ended.sessionId, ended.startTime, ended.endTime);
    } catch (RuntimeException e) {
      logger.error("Unexpected error from session listener: {}", LogValues.exceptionSummary(e));
    }
  }
}
