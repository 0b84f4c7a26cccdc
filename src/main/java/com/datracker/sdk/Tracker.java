package com.datracker.sdk;

import com.datracker.sdk.interfaces.DropReason;
import com.datracker.sdk.internal.http.HttpHelpers;
import com.datracker.sdk.subsystems.DurableQueue;
import com.datracker.sdk.subsystems.EventRecord;
import com.datracker.sdk.subsystems.KeyValueStore;
import com.datracker.sdk.subsystems.LocalStorage;
import com.datracker.sdk.subsystems.ProfileUpdateRecord;
import com.datracker.sdk.subsystems.Record;
import com.datracker.sdk.subsystems.StorageException;
import com.datracker.sdk.subsystems.UploaderConfiguration;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A client for recording analytics events and user profile changes.
 * <p>
 * Records are written to local storage as soon as they are captured, and uploaded to the collector
 * in batches on a background thread. Applications should instantiate a single {@code Tracker} for
 * the lifetime of their application, and call {@link #close()} on shutdown.
 */
public final class Tracker implements TrackerInterface {
  static final String DEVICE_ID_KEY = "deviceId";

  static final String SESSION_START_EVENT = "da_session_start";
  static final String SESSION_CLOSE_EVENT = "da_session_close";
  static final String SCREEN_EVENT = "da_screen";
  static final String LOGIN_EVENT = "da_user_login";
  static final String LOGOUT_EVENT = "da_user_logout";
  static final String SCREEN_NAME_ATTRIBUTE = "screenName";
  static final String USER_ACCOUNT_ATTRIBUTE = "userAccount";

  private static final long CLOSE_WAIT_MILLIS = 15000;

  private final String appKey;
  private final boolean offline;
  private final LongSupplier clock;
  private final LDLogger baseLogger;
  private final LDLogger eventsLogger;
  private final ScheduledExecutorService sharedExecutor;
  private final LocalStorage storage;
  private final DurableQueue queue;
  private final String deviceId;
  private final PropertyOverlayStore overlay;
  private final SessionTracker sessions;
  private final DropRecorder drops;
  private final EventRecordBuilder recordBuilder;
  private final Uploader uploader;
  private final People people;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * Creates a new tracker with the default configuration.
   * 
   * @param appKey the application key
   * @throws IllegalArgumentException if the key is empty or contains characters that cannot be
   *   used in an HTTP header
   * @throws NullPointerException if the key is null
   * @see #Tracker(String, TrackerConfig)
   */
  public Tracker(String appKey) {
    this(appKey, TrackerConfig.DEFAULT);
  }

  /**
   * Creates a new tracker to record events and profile updates with custom configuration.
   * <p>
   * The tracker opens its local storage, restores super properties and timers from it, and loads
   * or generates the device identifier. Any records left over from a previous run are uploaded
   * along with new ones. If the local storage cannot be opened, an error is logged and the tracker
   * falls back to storage that is kept only in memory.
   * 
   * @param appKey the application key
   * @param config a tracker configuration object
   * @throws IllegalArgumentException if the key is empty or contains characters that cannot be
   *   used in an HTTP header; for security reasons, the exception message does not include the key
   * @throws NullPointerException if a non-nullable parameter was null
   */
  public Tracker(String appKey, TrackerConfig config) {
    this(appKey, config, System::currentTimeMillis);
  }

  // Visible for testing: the clock drives timestamps, timers and session expiry.
  Tracker(String appKey, TrackerConfig config, LongSupplier clock) {
    checkNotNull(config, "config must not be null");
    this.appKey = checkNotNull(appKey, "appKey must not be null");
    if (appKey.isEmpty()) {
      throw new IllegalArgumentException("application key must not be empty");
    }
    if (!HttpHelpers.isAsciiHeaderValue(appKey)) {
      throw new IllegalArgumentException("application key contained an invalid character");
    }
    this.offline = config.offline;
    this.clock = clock;

    this.sharedExecutor = createSharedExecutor(config);
    ClientContextImpl context = ClientContextImpl.fromConfig(appKey, config, sharedExecutor);
    this.baseLogger = context.getBaseLogger();
    this.eventsLogger = baseLogger.subLogger(Loggers.EVENTS_LOGGER_NAME);

    this.storage = openStorage(config, context);
    this.queue = storage.getQueue();
    this.deviceId = loadDeviceId(config.customDeviceId, storage.getKeyValueStore());

    this.drops = new DropRecorder(config.dropListener, eventsLogger);
    this.overlay = new PropertyOverlayStore(storage.getKeyValueStore(), clock,
        baseLogger.subLogger(Loggers.PROPERTIES_LOGGER_NAME));
    this.sessions = new SessionTracker(config.sessionTimeout, clock, new SessionEvents(),
        baseLogger.subLogger(Loggers.SESSION_LOGGER_NAME));
    this.recordBuilder = new EventRecordBuilder(overlay, sessions, drops, clock, eventsLogger);

    UploaderConfiguration uploaderConfig = config.uploader.build(context);
    RecordOutputFormatter formatter = new RecordOutputFormatter(appKey, config.appVersion, config.appChannel, deviceId);
    this.uploader = new Uploader(
        uploaderConfig,
        queue,
        formatter,
        config.networkStatus,
        sharedExecutor,
        config.autoUpload,
        config.sendOnWifi,
        offline,
        baseLogger.subLogger(Loggers.UPLOAD_LOGGER_NAME));
    this.people = new People(this);

    long sessionCheckMillis = config.sessionTimeout.toMillis();
    sharedExecutor.scheduleAtFixedRate(sessions::checkExpiry, sessionCheckMillis, sessionCheckMillis,
        TimeUnit.MILLISECONDS);
    uploader.start();

    if (offline) {
      baseLogger.info("Starting tracker in offline mode; records will be stored but not sent");
    } else {
      baseLogger.info("Started tracker with {} stored record(s)", getQueueSize());
    }
  }

  private LocalStorage openStorage(TrackerConfig config, ClientContextImpl context) {
    try {
      return config.storage.build(context);
    } catch (StorageException e) {
      baseLogger.error("Could not open local storage, records will only be kept in memory: {}",
          LogValues.exceptionSummary(e));
      baseLogger.debug("{}", LogValues.exceptionTrace(e));
      return Components.inMemoryStorage().build(context);
    }
  }

  private String loadDeviceId(String customDeviceId, KeyValueStore kv) {
    if (customDeviceId != null && !customDeviceId.isEmpty()) {
      return customDeviceId;
    }
    try {
      String stored = kv.get(DEVICE_ID_KEY);
      if (stored != null && !stored.isEmpty()) {
        return stored;
      }
    } catch (StorageException e) {
      baseLogger.error("Could not read device identifier: {}", LogValues.exceptionSummary(e));
    }
    String generated = UUID.randomUUID().toString();
    try {
      kv.put(DEVICE_ID_KEY, generated);
    } catch (StorageException e) {
      baseLogger.error("Could not save device identifier: {}", LogValues.exceptionSummary(e));
    }
    return generated;
  }

  @Override
  public void trackEvent(String name) {
    trackEvent(name, 0, null, null, null, false);
  }

  @Override
  public void trackEvent(String name, Map<String, ?> attributes) {
    trackEvent(name, 0, null, attributes, null, false);
  }

  @Override
  public void trackEvent(String name, String category, String label, Map<String, ?> attributes) {
    List<String> categories = new ArrayList<>();
    if (category != null) {
      categories.add(category);
    }
    if (label != null) {
      categories.add(label);
    }
    trackEvent(name, 0, categories, attributes, null, false);
  }

  @Override
  public void trackEvent(String name, double costSeconds, List<String> categories, Map<String, ?> attributes,
      GeoLocation location, boolean mustInSession) {
    if (isClosed()) {
      return;
    }
    EventRecord record = recordBuilder.build(
        name,
        Double.isFinite(costSeconds) && costSeconds > 0 ? costSeconds : null,
        categories,
        PropertyMaps.fromObjects(attributes, eventsLogger),
        location,
        mustInSession);
    if (record != null) {
      enqueue(record, name);
    }
  }

  @Override
  public void trackScreen(String screenName) {
    if (isClosed()) {
      return;
    }
    if (screenName == null || screenName.isEmpty()) {
      eventsLogger.warn("Ignoring screen view with an empty name");
      drops.record(DropReason.INVALID_NAME, screenName, 1);
      return;
    }
    enqueueInternal(SCREEN_EVENT, null, ImmutableMap.of(SCREEN_NAME_ATTRIBUTE, PropertyValue.of(screenName)),
        sessions.currentId());
  }

  @Override
  public void trackTimer(String name) {
    if (name == null || name.isEmpty()) {
      eventsLogger.warn("Ignoring timer with an empty event name");
      return;
    }
    overlay.startTimer(name);
  }

  @Override
  public void clearTrackTimer() {
    overlay.clearTimers();
  }

  @Override
  public void registerSuperProperties(Map<String, ?> properties) {
    overlay.setSuperProperties(PropertyMaps.fromObjects(properties, eventsLogger), true);
  }

  @Override
  public void registerSuperPropertiesOnce(Map<String, ?> properties) {
    overlay.setSuperProperties(PropertyMaps.fromObjects(properties, eventsLogger), false);
  }

  @Override
  public void registerSuperPropertiesOnce(Map<String, ?> properties, Object defaultValue) {
    overlay.setSuperPropertiesOnce(PropertyMaps.fromObjects(properties, eventsLogger),
        PropertyValue.fromObject(defaultValue));
  }

  @Override
  public void unregisterSuperProperty(String name) {
    if (name != null) {
      overlay.unregister(name);
    }
  }

  @Override
  public void clearSuperProperties() {
    overlay.clear();
  }

  @Override
  public Map<String, PropertyValue> currentSuperProperties() {
    return overlay.current();
  }

  @Override
  public String getDeviceId() {
    return deviceId;
  }

  @Override
  public void loginUser(String userId) {
    loginUser(userId, null);
  }

  @Override
  public void loginUser(String userId, String userAccount) {
    if (userId == null || userId.isEmpty()) {
      eventsLogger.warn("Ignoring login with an empty user identifier");
      return;
    }
    recordBuilder.setUserId(userId);
    if (!isClosed()) {
      Map<String, PropertyValue> attributes = userAccount == null || userAccount.isEmpty() ? null :
          ImmutableMap.of(USER_ACCOUNT_ATTRIBUTE, PropertyValue.of(userAccount));
      enqueueInternal(LOGIN_EVENT, null, attributes, sessions.currentId());
    }
  }

  @Override
  public void logoutUser() {
    if (recordBuilder.getUserId() == null) {
      return;
    }
    if (!isClosed()) {
      enqueueInternal(LOGOUT_EVENT, null, null, sessions.currentId());
    }
    recordBuilder.setUserId(null);
  }

  @Override
  public void setLocation(double latitude, double longitude) {
    if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
      eventsLogger.warn("Ignoring location with non-finite coordinates");
      return;
    }
    recordBuilder.setDefaultLocation(new GeoLocation(latitude, longitude));
  }

  @Override
  public void onForeground() {
    if (!isClosed()) {
      sessions.onForeground();
    }
  }

  @Override
  public void onBackground() {
    if (!isClosed()) {
      sessions.onBackground();
    }
  }

  @Override
  public Future<UploadResult> upload() {
    if (isClosed()) {
      return Futures.immediateFuture(UploadResult.DISABLED);
    }
    return uploader.uploadAsync();
  }

  @Override
  public Future<UploadResult> flush() {
    if (isClosed()) {
      return Futures.immediateFuture(UploadResult.DISABLED);
    }
    return uploader.flushAsync();
  }

  @Override
  public void setAutoUpload(boolean autoUpload) {
    uploader.setAutoUpload(autoUpload);
  }

  @Override
  public void setSendOnWifi(boolean sendOnWifi) {
    uploader.setSendOnWifi(sendOnWifi);
  }

  @Override
  public void setUploadInterval(int seconds) {
    if (seconds > 0) {
      uploader.setUploadInterval(Duration.ofSeconds(seconds));
    }
  }

  @Override
  public void setUploadBulkSize(int bulkSize) {
    uploader.setBulkSize(bulkSize);
  }

  @Override
  public long getDroppedCount(DropReason reason) {
    return drops.getCount(reason);
  }

  @Override
  public int getQueueSize() {
    try {
      return queue.size();
    } catch (StorageException e) {
      baseLogger.error("Could not read queue size: {}", LogValues.exceptionSummary(e));
      return 0;
    }
  }

  @Override
  public People people() {
    return people;
  }

  @Override
  public boolean isOffline() {
    return offline;
  }

  /**
   * Shuts down the tracker.
   * <p>
   * An active session is ended and its closing event is stored. Periodic uploads stop, and an
   * upload that is in progress is allowed to finish. Records that have not been uploaded stay in
   * local storage for the next start.
   * 
   * @throws IOException if an exception was thrown by one of the underlying components
   */
  @Override
  public void close() throws IOException {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    baseLogger.info("Closing tracker");
    sessions.endSession();
    uploader.stop();
    sharedExecutor.shutdown();
    try {
      if (!sharedExecutor.awaitTermination(CLOSE_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
        baseLogger.warn("Timed out waiting for upload to finish");
        sharedExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      sharedExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    try {
      uploader.close();
    } finally {
      storage.close();
    }
  }

  void enqueueProfileUpdate(ProfileUpdateRecord.Operation operation, Map<String, ?> properties,
      List<String> propertyNames, Double amount) {
    if (isClosed()) {
      return;
    }
    if (amount != null && !Double.isFinite(amount)) {
      eventsLogger.warn("Ignoring charge: {} is not a finite amount", amount);
      drops.record(DropReason.INVALID_VALUE, null, 1);
      return;
    }
    Map<String, PropertyValue> props = PropertyMaps.fromObjects(properties, eventsLogger);
    if ((operation == ProfileUpdateRecord.Operation.SET || operation == ProfileUpdateRecord.Operation.SET_ONCE)
        && props.isEmpty()) {
      eventsLogger.debug("Ignoring profile update with no properties");
      return;
    }
    String userId = recordBuilder.getUserId() == null ? deviceId : recordBuilder.getUserId();
    ProfileUpdateRecord record = new ProfileUpdateRecord(
        UUID.randomUUID().toString(),
        clock.getAsLong(),
        operation,
        userId,
        props,
        propertyNames,
        amount);
    enqueue(record, null);
  }

  private void enqueueInternal(String name, Double cost, Map<String, PropertyValue> attributes, String sessionId) {
    enqueue(recordBuilder.buildInternal(name, cost, attributes, sessionId), name);
  }

  private void enqueue(Record record, String name) {
    try {
      queue.enqueue(record);
    } catch (StorageException e) {
      eventsLogger.error("Could not store record: {}", LogValues.exceptionSummary(e));
      eventsLogger.debug("{}", LogValues.exceptionTrace(e));
      drops.record(DropReason.STORAGE_FAILURE, name, 1);
      return;
    }
    drops.record(DropReason.QUEUE_OVERFLOW, null, queue.getAndClearEvictedCount());
  }

  private boolean isClosed() {
    if (closed.get()) {
      eventsLogger.debug("Ignoring call on a closed tracker");
      return true;
    }
    return false;
  }

  private ScheduledExecutorService createSharedExecutor(TrackerConfig config) {
    ThreadFactory threadFactory = new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("DATracker-tasks-%d")
        .setPriority(config.threadPriority)
        .build();
    return Executors.newSingleThreadScheduledExecutor(threadFactory);
  }

  private final class SessionEvents implements SessionTracker.Listener {
    @Override
    public void sessionStarted(String sessionId, long startTime) {
      enqueueInternal(SESSION_START_EVENT, null, null, sessionId);
    }

    @Override
    public void sessionEnded(String sessionId, long startTime, long endTime) {
      enqueueInternal(SESSION_CLOSE_EVENT, Math.max(0, endTime - startTime) / 1000.0, null, sessionId);
    }
  }
}
