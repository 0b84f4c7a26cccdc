package com.datracker.sdk.interfaces;

/**
 * The reasons for which the tracker can discard a record without delivering it.
 * 
 * @see DropListener
 */
public enum DropReason {
  /**
   * The event name was null or empty.
   */
  INVALID_NAME,

  /**
   * The event name began with the prefix that is reserved for the tracker's own events.
   */
  RESERVED_NAME,

  /**
   * The event required an active session and there was none.
   */
  SESSION_REQUIRED,

  /**
   * A profile update carried an amount that was NaN or infinite.
   */
  INVALID_VALUE,

  /**
   * The record could not be written to local storage.
   */
  STORAGE_FAILURE,

  /**
   * The record was evicted from the queue because the queue reached its capacity.
   */
  QUEUE_OVERFLOW
}
