package com.datracker.sdk.interfaces;

/**
 * Reports the current network condition to the uploader.
 * <p>
 * The tracker does not inspect the host's network interfaces itself. Applications that run on
 * devices with metered connections should supply an implementation with
 * {@link com.datracker.sdk.TrackerConfig.Builder#networkStatus(NetworkStatusProvider)}; the
 * default, {@link #UNMETERED}, always reports {@link NetworkType#WIFI}.
 */
public interface NetworkStatusProvider {
  /**
   * A provider that always reports an unmetered connection.
   */
  public static final NetworkStatusProvider UNMETERED = () -> NetworkType.WIFI;

  /**
   * Returns the current network type. This is called before every upload attempt.
   * 
   * @return the network type
   */
  NetworkType getNetworkType();
}
