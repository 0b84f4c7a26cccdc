package com.datracker.sdk.integrations;

import com.datracker.sdk.Components;
import com.datracker.sdk.subsystems.ComponentConfigurer;
import com.datracker.sdk.subsystems.LoggingConfiguration;
import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.Logs;

/**
 * Contains methods for configuring the tracker's logging behavior.
 * <p>
 * If you want to set non-default values for any of these properties, create a builder with
 * {@link Components#logging()}, change its properties with the methods of this class, and pass it
 * to {@link com.datracker.sdk.TrackerConfig.Builder#logging(ComponentConfigurer)}:
 * <pre><code>
 *     TrackerConfig config = new TrackerConfig.Builder()
 *         .logging(
 *           Components.logging()
 *             .level(LDLogLevel.WARN)
 *          )
 *         .build();
 * </code></pre>
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling {@link Components#logging()}.
 */
public abstract class LoggingConfigurationBuilder implements ComponentConfigurer<LoggingConfiguration> {
  protected String baseName = null;
  protected LDLogAdapter logAdapter = null;
  protected LDLogLevel minimumLevel = null;

  /**
   * Specifies the implementation of logging to use.
   * <p>
   * If you do not set this, the tracker uses SLF4J if it is in the classpath, and otherwise
   * writes to the standard error stream. Other options are available from
   * {@link Logs}, such as {@code Logs.toJavaUtilLogging()} or {@code Logs.none()}.
   * 
   * @param logAdapter an {@link LDLogAdapter} for the desired logging implementation
   * @return the builder
   */
  public LoggingConfigurationBuilder adapter(LDLogAdapter logAdapter) {
    this.logAdapter = logAdapter;
    return this;
  }

  /**
   * Specifies a custom base logger name.
   * <p>
   * The default is {@code com.datracker.sdk.Tracker}. Each component adds a suffix to it, such as
   * {@code .Upload}.
   * 
   * @param name the base logger name
   * @return the builder
   */
  public LoggingConfigurationBuilder baseLoggerName(String name) {
    this.baseName = name;
    return this;
  }

  /**
   * Specifies the lowest level of logging to enable.
   * <p>
   * This only applies to adapters that do not have their own level configuration; for SLF4J, the
   * level is controlled by the SLF4J backend. The default is {@link LDLogLevel#INFO}.
   * 
   * @param minimumLevel the lowest level to enable
   * @return the builder
   */
  public LoggingConfigurationBuilder level(LDLogLevel minimumLevel) {
    this.minimumLevel = minimumLevel;
    return this;
  }
}
