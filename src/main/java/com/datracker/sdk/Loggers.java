package com.datracker.sdk;

/**
 * Static logger names used by the tracker.
 * <p>
 * The base logger name can be changed with
 * {@link com.datracker.sdk.integrations.LoggingConfigurationBuilder#baseLoggerName(String)};
 * each component appends one of these suffixes to it.
 */
abstract class Loggers {
  private Loggers() {}

  static final String BASE_LOGGER_NAME = Tracker.class.getName();
  static final String EVENTS_LOGGER_NAME = "Events";
  static final String PROPERTIES_LOGGER_NAME = "Properties";
  static final String QUEUE_LOGGER_NAME = "Queue";
  static final String SESSION_LOGGER_NAME = "Session";
  static final String UPLOAD_LOGGER_NAME = "Upload";
}
