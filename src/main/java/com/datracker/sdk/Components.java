package com.datracker.sdk;

import com.datracker.sdk.ComponentsImpl.HttpConfigurationBuilderImpl;
import com.datracker.sdk.ComponentsImpl.InMemoryStorageBuilderImpl;
import com.datracker.sdk.ComponentsImpl.LoggingConfigurationBuilderImpl;
import com.datracker.sdk.ComponentsImpl.UploaderBuilderImpl;
import com.datracker.sdk.integrations.HttpConfigurationBuilder;
import com.datracker.sdk.integrations.LocalStorageBuilder;
import com.datracker.sdk.integrations.LoggingConfigurationBuilder;
import com.datracker.sdk.integrations.UploaderBuilder;
import com.datracker.sdk.subsystems.ComponentConfigurer;
import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.Logs;

/**
 * Provides configurable factories for the standard implementations of tracker component interfaces.
 * <p>
 * Some of the configuration options in {@link TrackerConfig.Builder} affect the entire tracker, but
 * others are specific to one area of functionality, such as how records are uploaded. For the
 * latter, the standard way to specify a configuration is to call one of the static methods in
 * {@link Components} (such as {@link #uploader()}), apply any desired configuration change to the
 * object that that method returns (such as {@link UploaderBuilder#bulkSize(int)}), and then use the
 * corresponding method in {@link TrackerConfig.Builder} (such as
 * {@link TrackerConfig.Builder#uploader(ComponentConfigurer)}) to use that configured component.
 */
public abstract class Components {
  private Components() {}

  /**
   * Returns a configuration builder for record uploading.
   * <pre><code>
   *     TrackerConfig config = new TrackerConfig.Builder()
   *         .uploader(Components.uploader().uploadInterval(Duration.ofSeconds(30)))
   *         .build();
   * </code></pre>
   * 
   * @return a builder for setting upload properties
   * @see TrackerConfig.Builder#uploader(ComponentConfigurer)
   */
  public static UploaderBuilder uploader() {
    return new UploaderBuilderImpl();
  }

  /**
   * Returns a configuration builder for the tracker's networking configuration.
   * <p>
   * Passing this to {@link TrackerConfig.Builder#http(ComponentConfigurer)} applies this
   * configuration to all HTTP/HTTPS requests made by the tracker.
   * 
   * @return a factory object
   * @see TrackerConfig.Builder#http(ComponentConfigurer)
   */
  public static HttpConfigurationBuilder httpConfiguration() {
    return new HttpConfigurationBuilderImpl();
  }

  /**
   * Returns a configuration builder for the tracker's logging configuration.
   * <p>
   * Passing this to {@link TrackerConfig.Builder#logging(ComponentConfigurer)}, after setting any
   * desired properties on the builder, applies this configuration to the tracker.
   * <pre><code>
   *     TrackerConfig config = new TrackerConfig.Builder()
   *         .logging(
   *              Components.logging()
   *                  .level(LDLogLevel.WARN)
   *         )
   *         .build();
   * </code></pre>
   * 
   * @return a configuration builder
   * @see TrackerConfig.Builder#logging(ComponentConfigurer)
   */
  public static LoggingConfigurationBuilder logging() {
    return new LoggingConfigurationBuilderImpl();
  }

  /**
   * Returns a configuration builder for the tracker's logging configuration, specifying the
   * implementation of logging to use.
   * <p>
   * This is a shortcut for <code>Components.logging().adapter(logAdapter)</code>.
   * 
   * @param logAdapter the log adapter
   * @return a configuration builder
   * @see LoggingConfigurationBuilder#adapter(LDLogAdapter)
   */
  public static LoggingConfigurationBuilder logging(LDLogAdapter logAdapter) {
    return logging().adapter(logAdapter);
  }

  /**
   * Returns a configuration builder that turns off tracker logging.
   * 
   * @return a configuration builder
   */
  public static LoggingConfigurationBuilder noLogging() {
    return logging().adapter(Logs.none());
  }

  /**
   * Returns a configuration builder for local storage that is kept only in memory.
   * <p>
   * Records stored this way are lost if the process exits before they are uploaded. This is
   * mostly useful in tests; the default is {@link com.datracker.sdk.integrations.SQLite#storage()}.
   * 
   * @return a configuration builder
   * @see TrackerConfig.Builder#storage(ComponentConfigurer)
   */
  public static LocalStorageBuilder inMemoryStorage() {
    return new InMemoryStorageBuilderImpl();
  }
}
