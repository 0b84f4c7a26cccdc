package com.datracker.sdk.interfaces;

/**
 * The kind of network connection that is currently available.
 * 
 * @see NetworkStatusProvider
 */
public enum NetworkType {
  /**
   * A wifi or other unmetered connection.
   */
  WIFI,

  /**
   * A cellular or other metered connection.
   */
  CELLULAR,

  /**
   * No connection.
   */
  NONE
}
