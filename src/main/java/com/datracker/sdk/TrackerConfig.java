package com.datracker.sdk;

import com.datracker.sdk.integrations.HttpConfigurationBuilder;
import com.datracker.sdk.integrations.LoggingConfigurationBuilder;
import com.datracker.sdk.integrations.SQLite;
import com.datracker.sdk.integrations.UploaderBuilder;
import com.datracker.sdk.interfaces.DropListener;
import com.datracker.sdk.interfaces.NetworkStatusProvider;
import com.datracker.sdk.subsystems.ComponentConfigurer;
import com.datracker.sdk.subsystems.HttpConfiguration;
import com.datracker.sdk.subsystems.LocalStorage;
import com.datracker.sdk.subsystems.LoggingConfiguration;
import com.datracker.sdk.subsystems.UploaderConfiguration;

import java.time.Duration;

/**
 * This class exposes configuration options for the {@link Tracker}. Instances of this class must be
 * constructed with a {@link TrackerConfig.Builder}.
 */
public final class TrackerConfig {
  /**
   * The default value for {@link Builder#sessionTimeout(Duration)}: 30 seconds.
   */
  public static final Duration DEFAULT_SESSION_TIMEOUT = Duration.ofSeconds(30);

  static final TrackerConfig DEFAULT = new Builder().build();

  final String appVersion;
  final String appChannel;
  final boolean autoUpload;
  final String customDeviceId;
  final DropListener dropListener;
  final ComponentConfigurer<HttpConfiguration> http;
  final ComponentConfigurer<LoggingConfiguration> logging;
  final NetworkStatusProvider networkStatus;
  final boolean offline;
  final boolean sendOnWifi;
  final Duration sessionTimeout;
  final ComponentConfigurer<LocalStorage> storage;
  final int threadPriority;
  final ComponentConfigurer<UploaderConfiguration> uploader;

  TrackerConfig(Builder builder) {
    this.appVersion = builder.appVersion;
    this.appChannel = builder.appChannel;
    this.autoUpload = builder.autoUpload;
    this.customDeviceId = builder.customDeviceId;
    this.dropListener = builder.dropListener;
    this.http = builder.http == null ? Components.httpConfiguration() : builder.http;
    this.logging = builder.logging == null ? Components.logging() : builder.logging;
    this.networkStatus = builder.networkStatus == null ? NetworkStatusProvider.UNMETERED : builder.networkStatus;
    this.offline = builder.offline;
    this.sendOnWifi = builder.sendOnWifi;
    this.sessionTimeout = builder.sessionTimeout;
    this.storage = builder.storage == null ? SQLite.storage() : builder.storage;
    this.threadPriority = builder.threadPriority;
    this.uploader = builder.uploader == null ? Components.uploader() : builder.uploader;
  }

  /**
   * A <a href="http://en.wikipedia.org/wiki/Builder_pattern">builder</a> that helps construct
   * {@link TrackerConfig} objects. Builder calls can be chained, enabling the following pattern:
   * <pre>
   * TrackerConfig config = new TrackerConfig.Builder()
   *      .appVersion("2.1.0")
   *      .sendOnWifi(true)
   *      .build()
   * </pre>
   */
  public static class Builder {
    private String appVersion = null;
    private String appChannel = null;
    private boolean autoUpload = true;
    private String customDeviceId = null;
    private DropListener dropListener = null;
    private ComponentConfigurer<HttpConfiguration> http = null;
    private ComponentConfigurer<LoggingConfiguration> logging = null;
    private NetworkStatusProvider networkStatus = null;
    private boolean offline = false;
    private boolean sendOnWifi = false;
    private Duration sessionTimeout = DEFAULT_SESSION_TIMEOUT;
    private ComponentConfigurer<LocalStorage> storage = null;
    private int threadPriority = Thread.MIN_PRIORITY;
    private ComponentConfigurer<UploaderConfiguration> uploader = null;

    /**
     * Creates a builder with all configuration parameters set to the default
     */
    public Builder() {
    }

    /**
     * Sets the version of the host application, which is sent with every batch.
     * 
     * @param appVersion the application version, or null
     * @return the builder
     */
    public Builder appVersion(String appVersion) {
      this.appVersion = appVersion;
      return this;
    }

    /**
     * Sets the distribution channel of the host application (for instance an app store name),
     * which is sent with every batch.
     * 
     * @param appChannel the channel, or null
     * @return the builder
     */
    public Builder appChannel(String appChannel) {
      this.appChannel = appChannel;
      return this;
    }

    /**
     * Sets whether records are uploaded periodically. The default is true.
     * <p>
     * If this is false, records are only uploaded when the application calls
     * {@link Tracker#upload()} or {@link Tracker#flush()}. It can be changed later with
     * {@link Tracker#setAutoUpload(boolean)}.
     * 
     * @param autoUpload true to upload periodically
     * @return the builder
     */
    public Builder autoUpload(boolean autoUpload) {
      this.autoUpload = autoUpload;
      return this;
    }

    /**
     * Sets the device identifier instead of letting the tracker generate one.
     * <p>
     * By default, the tracker generates a random identifier on first start and keeps it in local
     * storage.
     * 
     * @param customDeviceId the device identifier, or null to use the generated one
     * @return the builder
     */
    public Builder customDeviceId(String customDeviceId) {
      this.customDeviceId = customDeviceId;
      return this;
    }

    /**
     * Sets a listener that is notified whenever the tracker discards a record.
     * 
     * @param dropListener the listener, or null
     * @return the builder
     */
    public Builder dropListener(DropListener dropListener) {
      this.dropListener = dropListener;
      return this;
    }

    /**
     * Sets the tracker's networking configuration, using a configuration builder. This builder is
     * obtained from {@link Components#httpConfiguration()}, and has methods for setting individual
     * HTTP-related properties.
     * 
     * @param httpConfigurer the HTTP configuration builder
     * @return the builder
     * @see HttpConfigurationBuilder
     */
    public Builder http(ComponentConfigurer<HttpConfiguration> httpConfigurer) {
      this.http = httpConfigurer;
      return this;
    }

    /**
     * Sets the tracker's logging configuration, using a factory object. This object is normally a
     * configuration builder obtained from {@link Components#logging()}, which has methods for
     * setting individual logging-related properties.
     * 
     * @param loggingConfigurer the logging configuration builder
     * @return the builder
     * @see LoggingConfigurationBuilder
     */
    public Builder logging(ComponentConfigurer<LoggingConfiguration> loggingConfigurer) {
      this.logging = loggingConfigurer;
      return this;
    }

    /**
     * Sets the source of network status, which the uploader consults before every upload.
     * <p>
     * The default, {@link NetworkStatusProvider#UNMETERED}, always reports a wifi connection.
     * 
     * @param networkStatus the provider, or null to use the default
     * @return the builder
     */
    public Builder networkStatus(NetworkStatusProvider networkStatus) {
      this.networkStatus = networkStatus;
      return this;
    }

    /**
     * Set whether this tracker is offline.
     * <p>
     * In offline mode, the tracker still captures and stores records, but never sends them.
     * 
     * @param offline when set to true no records are sent
     * @return the builder
     */
    public Builder offline(boolean offline) {
      this.offline = offline;
      return this;
    }

    /**
     * Sets whether uploads are only allowed on a wifi connection. The default is false.
     * <p>
     * This can be changed later with {@link Tracker#setSendOnWifi(boolean)}.
     * 
     * @param sendOnWifi true to upload only on wifi
     * @return the builder
     */
    public Builder sendOnWifi(boolean sendOnWifi) {
      this.sendOnWifi = sendOnWifi;
      return this;
    }

    /**
     * Sets how long the application can stay in the background before its session ends. The
     * default is {@link TrackerConfig#DEFAULT_SESSION_TIMEOUT}.
     * 
     * @param sessionTimeout the inactivity timeout; null or a non-positive value uses the default
     * @return the builder
     */
    public Builder sessionTimeout(Duration sessionTimeout) {
      this.sessionTimeout = sessionTimeout == null || sessionTimeout.isZero() || sessionTimeout.isNegative() ?
          DEFAULT_SESSION_TIMEOUT : sessionTimeout;
      return this;
    }

    /**
     * Sets the implementation of local storage. The default is {@link SQLite#storage()}.
     * 
     * @param storageConfigurer a storage configuration builder, such as {@link Components#inMemoryStorage()}
     * @return the builder
     */
    public Builder storage(ComponentConfigurer<LocalStorage> storageConfigurer) {
      this.storage = storageConfigurer;
      return this;
    }

    /**
     * Set the priority to use for the tracker's worker thread.
     * <p>
     * The default is {@link Thread#MIN_PRIORITY}.
     * 
     * @param threadPriority the priority for the worker thread
     * @return the builder
     */
    public Builder threadPriority(int threadPriority) {
      this.threadPriority = Math.max(Thread.MIN_PRIORITY, Math.min(Thread.MAX_PRIORITY, threadPriority));
      return this;
    }

    /**
     * Sets the implementation of record uploading. This is normally a configuration builder
     * obtained from {@link Components#uploader()}.
     * 
     * @param uploaderConfigurer the uploader configuration builder
     * @return the builder
     * @see UploaderBuilder
     */
    public Builder uploader(ComponentConfigurer<UploaderConfiguration> uploaderConfigurer) {
      this.uploader = uploaderConfigurer;
      return this;
    }

    /**
     * Builds the configured {@link TrackerConfig} object.
     *
     * @return the {@link TrackerConfig} configured by this builder
     */
    public TrackerConfig build() {
      return new TrackerConfig(this);
    }
  }
}
