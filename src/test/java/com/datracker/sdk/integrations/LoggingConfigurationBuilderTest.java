package com.datracker.sdk.integrations;

import com.datracker.sdk.Components;
import com.datracker.sdk.Tracker;
import com.datracker.sdk.subsystems.ClientContext;
import com.datracker.sdk.subsystems.LoggingConfiguration;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogCapture;
import com.launchdarkly.logging.Logs;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;

@SuppressWarnings("javadoc")
public class LoggingConfigurationBuilderTest {
  private static final String APP_KEY = "app-key";
  private static final ClientContext BASIC_CONTEXT = new ClientContext(APP_KEY);

  @Test
  public void defaultBaseLoggerName() {
    LoggingConfiguration c = Components.logging().build(BASIC_CONTEXT);
    assertEquals(Tracker.class.getName(), c.getBaseLoggerName());
  }

  @Test
  public void canSetBaseLoggerName() {
    LoggingConfiguration c = Components.logging().baseLoggerName("my.logger").build(BASIC_CONTEXT);
    assertEquals("my.logger", c.getBaseLoggerName());
  }

  @Test
  public void canSetLogAdapterAndLevel() {
    LogCapture logSink = Logs.capture();
    LoggingConfiguration c = Components.logging()
        .adapter(logSink)
        .level(LDLogLevel.WARN)
        .build(BASIC_CONTEXT);
    LDLogger logger = LDLogger.withAdapter(c.getLogAdapter(), "");
    logger.debug("message 1");
    logger.info("message 2");
    logger.warn("message 3");
    logger.error("message 4");
    assertThat(logSink.getMessageStrings(), contains("WARN:message 3", "ERROR:message 4"));
  }

  @Test
  public void defaultLevelIsInfo() {
    LogCapture logSink = Logs.capture();
    LoggingConfiguration c = Components.logging(logSink).build(BASIC_CONTEXT);
    LDLogger logger = LDLogger.withAdapter(c.getLogAdapter(), "");
    logger.debug("message 1");
    logger.info("message 2");
    assertThat(logSink.getMessageStrings(), contains("INFO:message 2"));
  }
}
