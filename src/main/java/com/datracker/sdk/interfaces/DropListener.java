package com.datracker.sdk.interfaces;

/**
 * Receives a notification whenever the tracker discards a record.
 * <p>
 * Tracking calls never report failures to the caller; this listener is the way to observe them.
 * It is called synchronously on the thread that caused the drop, so it must return quickly.
 * 
 * @see com.datracker.sdk.TrackerConfig.Builder#dropListener(DropListener)
 */
public interface DropListener {
  /**
   * Called when records are discarded.
   * 
   * @param reason the reason
   * @param name the event name, if the drop concerns a single event; otherwise null
   * @param count the number of records discarded
   */
  void onDrop(DropReason reason, String name, long count);
}
