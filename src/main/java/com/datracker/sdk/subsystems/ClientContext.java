package com.datracker.sdk.subsystems;

import com.datracker.sdk.Components;
import com.launchdarkly.logging.LDLogger;

/**
 * Context information provided by the {@link com.datracker.sdk.Tracker} when creating components.
 * <p>
 * This is passed as a parameter to component factories that implement {@link ComponentConfigurer}.
 * Component factories do not receive the entire {@link com.datracker.sdk.TrackerConfig} because
 * it could contain factory objects that have mutable state, and because components should not be
 * able to access the configurations of unrelated components.
 * <p>
 * The actual implementation class may contain other properties that are only relevant to the
 * built-in components and are not exposed to applications.
 */
public class ClientContext {
  private final String appKey;
  private final String appVersion;
  private final String appChannel;
  private final LDLogger baseLogger;
  private final HttpConfiguration http;
  private final LoggingConfiguration logging;
  private final boolean offline;
  private final int threadPriority;

  /**
   * Constructor that sets all properties. All should be non-null, except that the application
   * version and channel are optional.
   * 
   * @param appKey the application key
   * @param appVersion the application version, or null
   * @param appChannel the application release channel, or null
   * @param http the HTTP configuration properties
   * @param logging the logging configuration properties
   * @param offline true if the tracker should never send data
   * @param threadPriority the thread priority that should be used for any worker threads
   */
  public ClientContext(
      String appKey,
      String appVersion,
      String appChannel,
      HttpConfiguration http,
      LoggingConfiguration logging,
      boolean offline,
      int threadPriority
      ) {
    this.appKey = appKey;
    this.appVersion = appVersion;
    this.appChannel = appChannel;
    this.http = http;
    this.logging = logging;
    this.offline = offline;
    this.threadPriority = threadPriority;

    this.baseLogger = logging == null ? LDLogger.none() :
      LDLogger.withAdapter(logging.getLogAdapter(), logging.getBaseLoggerName());
  }

  /**
   * Copy constructor.
   * 
   * @param copyFrom the instance to copy from
   */
  protected ClientContext(ClientContext copyFrom) {
    this(copyFrom.appKey, copyFrom.appVersion, copyFrom.appChannel, copyFrom.http, copyFrom.logging,
        copyFrom.offline, copyFrom.threadPriority);
  }

  /**
   * Basic constructor for convenience in testing, using defaults for most properties.
   * 
   * @param appKey the application key
   */
  public ClientContext(String appKey) {
    this(
        appKey,
        null,
        null,
        defaultHttp(appKey),
        defaultLogging(),
        false,
        Thread.MIN_PRIORITY
        );
  }

  private static HttpConfiguration defaultHttp(String appKey) {
    ClientContext minimalContext = new ClientContext(appKey, null, null, null, null, false, 0);
    return Components.httpConfiguration().build(minimalContext);
  }

  private static LoggingConfiguration defaultLogging() {
    ClientContext minimalContext = new ClientContext("", null, null, null, null, false, 0);
    return Components.logging().build(minimalContext);
  }

  /**
   * Returns the configured application key.
   * 
   * @return the application key
   */
  public String getAppKey() {
    return appKey;
  }

  /**
   * Returns the application version, if one was configured.
   * 
   * @return the application version or null
   */
  public String getAppVersion() {
    return appVersion;
  }

  /**
   * Returns the application release channel, if one was configured.
   * 
   * @return the release channel or null
   */
  public String getAppChannel() {
    return appChannel;
  }

  /**
   * The base logger for the tracker. Components should use {@link LDLogger#subLogger(String)}
   * to get a logger for their own area of functionality.
   * 
   * @return a configured logger
   */
  public LDLogger getBaseLogger() {
    return baseLogger;
  }

  /**
   * The configured networking properties that apply to all components.
   * 
   * @return the HTTP configuration
   */
  public HttpConfiguration getHttp() {
    return http;
  }

  /**
   * The configured logging properties that apply to all components.
   * 
   * @return the logging configuration
   */
  public LoggingConfiguration getLogging() {
    return logging;
  }

  /**
   * True if the tracker was configured to be completely offline.
   * 
   * @return true if offline
   */
  public boolean isOffline() {
    return offline;
  }

  /**
   * The thread priority that should be used for any worker threads created by components.
   * 
   * @return the thread priority
   */
  public int getThreadPriority() {
    return threadPriority;
  }
}
