package com.datracker.sdk.subsystems;

/**
 * A record held by a {@link DurableQueue}, together with its delivery bookkeeping.
 * <p>
 * Instances are snapshots: the queue creates a new one every time it hands entries out, so the
 * attempt count seen here does not change while the entry is leased.
 */
public final class QueueEntry {
  private final long sequence;
  private final Record record;
  private final int attemptCount;
  private final long lastAttemptAt;
  private final long enqueuedAt;

  /**
   * Constructs an instance.
   * 
   * @param sequence the sequence number that defines delivery order
   * @param record the stored record
   * @param attemptCount the number of failed delivery attempts so far
   * @param lastAttemptAt the time of the last failed attempt in epoch milliseconds, or 0 if none
   * @param enqueuedAt the time the record was enqueued in epoch milliseconds
   */
  public QueueEntry(long sequence, Record record, int attemptCount, long lastAttemptAt, long enqueuedAt) {
    this.sequence = sequence;
    this.record = record;
    this.attemptCount = attemptCount;
    this.lastAttemptAt = lastAttemptAt;
    this.enqueuedAt = enqueuedAt;
  }

  /**
   * The sequence number. Entries are leased in ascending sequence order.
   * @return the sequence number
   */
  public long getSequence() {
    return sequence;
  }

  /**
   * The stored record.
   * @return the record
   */
  public Record getRecord() {
    return record;
  }

  /**
   * The number of delivery attempts that have failed for this entry.
   * @return the attempt count
   */
  public int getAttemptCount() {
    return attemptCount;
  }

  /**
   * The time of the last failed attempt.
   * @return epoch milliseconds, or 0 if there has been no failed attempt
   */
  public long getLastAttemptAt() {
    return lastAttemptAt;
  }

  /**
   * The time the record was enqueued.
   * @return epoch milliseconds
   */
  public long getEnqueuedAt() {
    return enqueuedAt;
  }
}
