package com.datracker.sdk;

import com.datracker.sdk.interfaces.DropReason;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;

/**
 * This interface defines the public methods of {@link Tracker}.
 * <p>
 * Applications will normally interact directly with {@link Tracker}, and must use its constructor to
 * initialize the tracker, but being able to refer to it indirectly via an interface may be helpful in
 * test scenarios (mocking) or for some dependency injection frameworks.
 * <p>
 * None of the capture methods throw exceptions or wait for the network. A request that cannot be
 * honored, such as an event with an invalid name, is logged and counted (see
 * {@link #getDroppedCount(DropReason)}).
 */
public interface TrackerInterface extends Closeable {
  /**
   * Records an event.
   * 
   * @param name the event name; must not be empty or start with {@code da_}
   */
  void trackEvent(String name);

  /**
   * Records an event with attributes.
   * 
   * @param name the event name; must not be empty or start with {@code da_}
   * @param attributes the event attributes; these take precedence over super properties with the
   *   same names. Values are converted with {@link PropertyValue#fromObject(Object)}.
   */
  void trackEvent(String name, Map<String, ?> attributes);

  /**
   * Records an event with a category and label, which become the first two levels of the event's
   * category path.
   * 
   * @param name the event name; must not be empty or start with {@code da_}
   * @param category the category, or null
   * @param label the label within the category, or null
   * @param attributes the event attributes, or null
   */
  void trackEvent(String name, String category, String label, Map<String, ?> attributes);

  /**
   * Records an event with all optional details.
   * <p>
   * If a timer was started for this event name with {@link #trackTimer(String)}, the timer is
   * stopped and, unless {@code costSeconds} is positive, the elapsed time becomes the event's
   * duration.
   * 
   * @param name the event name; must not be empty or start with {@code da_}
   * @param costSeconds the duration of the activity in seconds; zero or negative means none
   * @param categories the category path, outermost first; only the first five are kept
   * @param attributes the event attributes, or null
   * @param location the geo-coordinates; if null, the location set with
   *   {@link #setLocation(double, double)} is used
   * @param mustInSession true if the event should be discarded when no session is active
   */
  void trackEvent(String name, double costSeconds, List<String> categories, Map<String, ?> attributes,
      GeoLocation location, boolean mustInSession);

  /**
   * Records that the user viewed a screen or page.
   * 
   * @param screenName the screen name
   */
  void trackScreen(String screenName);

  /**
   * Starts a timer for an event. The next event recorded with the same name will carry the
   * elapsed time as its duration. Starting a timer that is already running restarts it.
   * <p>
   * Timers are kept in local storage, so they survive a restart.
   * 
   * @param name the event name
   */
  void trackTimer(String name);

  /**
   * Discards all running timers.
   */
  void clearTrackTimer();

  /**
   * Sets super properties, which are added to every subsequent event. Existing values with the
   * same names are replaced.
   * 
   * @param properties the property values
   */
  void registerSuperProperties(Map<String, ?> properties);

  /**
   * Sets super properties only where no value exists yet.
   * 
   * @param properties the property values
   */
  void registerSuperPropertiesOnce(Map<String, ?> properties);

  /**
   * Sets super properties only where no value exists yet, or where the existing value equals
   * {@code defaultValue}.
   * 
   * @param properties the property values
   * @param defaultValue a placeholder value that may be replaced
   */
  void registerSuperPropertiesOnce(Map<String, ?> properties, Object defaultValue);

  /**
   * Removes a super property.
   * 
   * @param name the property name
   */
  void unregisterSuperProperty(String name);

  /**
   * Removes all super properties.
   */
  void clearSuperProperties();

  /**
   * Returns the current super properties.
   * 
   * @return an immutable snapshot
   */
  Map<String, PropertyValue> currentSuperProperties();

  /**
   * Returns the identifier of this device, which is either the configured custom identifier or one
   * that was generated on first start.
   * 
   * @return the device identifier
   */
  String getDeviceId();

  /**
   * Associates subsequent records with a user, and records a login event.
   * 
   * @param userId the user identifier
   */
  void loginUser(String userId);

  /**
   * Like {@link #loginUser(String)}, but also records the account name the user signed in with
   * (an email address or phone number, for instance) as the {@code userAccount} attribute of the
   * login event. The account is not attached to any later records.
   * 
   * @param userId the user identifier
   * @param userAccount the account name; null or empty to omit it
   */
  void loginUser(String userId, String userAccount);

  /**
   * Records a logout event and stops associating records with the current user.
   */
  void logoutUser();

  /**
   * Sets the location that is attached to subsequent events that do not specify one.
   * 
   * @param latitude the latitude
   * @param longitude the longitude
   */
  void setLocation(double latitude, double longitude);

  /**
   * Tells the tracker that the application has moved to the foreground. This starts a session, or
   * resumes the previous one if the application was in the background for less than the session
   * timeout.
   */
  void onForeground();

  /**
   * Tells the tracker that the application has moved to the background. The session ends if the
   * application does not return to the foreground within the session timeout.
   */
  void onBackground();

  /**
   * Starts an upload of one batch on the tracker's worker thread.
   * 
   * @return a future for the outcome
   */
  Future<UploadResult> upload();

  /**
   * Uploads batches until the queue is empty or an upload does not succeed.
   * 
   * @return a future for the outcome of the last upload
   */
  Future<UploadResult> flush();

  /**
   * Turns periodic uploading on or off.
   * 
   * @param autoUpload true to upload periodically
   */
  void setAutoUpload(boolean autoUpload);

  /**
   * Sets whether uploads are only allowed on a wifi connection.
   * 
   * @param sendOnWifi true to upload only on wifi
   */
  void setSendOnWifi(boolean sendOnWifi);

  /**
   * Changes the interval between periodic uploads.
   * 
   * @param seconds the interval in seconds; non-positive values are ignored
   */
  void setUploadInterval(int seconds);

  /**
   * Changes the maximum number of records per upload.
   * 
   * @param bulkSize the batch size; non-positive values are ignored
   */
  void setUploadBulkSize(int bulkSize);

  /**
   * Returns the number of records discarded for a reason since the tracker was created.
   * 
   * @param reason the reason
   * @return the number of records
   */
  long getDroppedCount(DropReason reason);

  /**
   * Returns the number of records waiting to be uploaded.
   * 
   * @return the queue size
   */
  int getQueueSize();

  /**
   * Returns the object for recording user profile changes.
   * 
   * @return the profile API
   */
  People people();

  /**
   * Returns true if the tracker is in offline mode.
   * 
   * @return whether the tracker is offline
   */
  boolean isOffline();
}
