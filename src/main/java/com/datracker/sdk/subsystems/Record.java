package com.datracker.sdk.subsystems;

/**
 * Base class for the records that the tracker stores in its {@link DurableQueue} and delivers to
 * the collector.
 * <p>
 * Records are immutable. Once a record has been enqueued, only its presence in the queue changes.
 * 
 * @see EventRecord
 * @see ProfileUpdateRecord
 */
public abstract class Record {
  private final String id;
  private final long timestamp;

  /**
   * Base constructor.
   * 
   * @param id a unique identifier that the collector uses to discard duplicate deliveries
   * @param timestamp the capture time in milliseconds since the epoch
   */
  protected Record(String id, long timestamp) {
    this.id = id;
    this.timestamp = timestamp;
  }

  /**
   * The unique identifier of the record.
   * 
   * @return the identifier
   */
  public String getId() {
    return id;
  }

  /**
   * The time the record was captured, in milliseconds since the epoch. This is not the time it
   * was sent.
   * 
   * @return the timestamp
   */
  public long getTimestamp() {
    return timestamp;
  }
}
