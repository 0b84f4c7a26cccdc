package com.datracker.sdk;

import java.util.Objects;

/**
 * The outcome of one upload attempt.
 * 
 * @see Tracker#upload()
 */
public final class UploadResult {
  /**
   * The kinds of outcome.
   */
  public enum Status {
    /**
     * Uploading is off: the tracker is closed or offline, or the collector rejected the application
     * key. Nothing was leased.
     */
    DISABLED,

    /**
     * The current network does not allow uploading. Nothing was leased.
     */
    SKIPPED,

    /**
     * Another upload was already in progress.
     */
    BUSY,

    /**
     * There was nothing to send.
     */
    EMPTY,

    /**
     * A batch was delivered and removed from the queue.
     */
    SENT,

    /**
     * A batch could not be delivered and was returned to the queue.
     */
    FAILED
  }

  static final UploadResult DISABLED = new UploadResult(Status.DISABLED, 0);
  static final UploadResult SKIPPED = new UploadResult(Status.SKIPPED, 0);
  static final UploadResult BUSY = new UploadResult(Status.BUSY, 0);
  static final UploadResult EMPTY = new UploadResult(Status.EMPTY, 0);
  static final UploadResult FAILED = new UploadResult(Status.FAILED, 0);

  private final Status status;
  private final int recordCount;

  private UploadResult(Status status, int recordCount) {
    this.status = status;
    this.recordCount = recordCount;
  }

  static UploadResult sent(int recordCount) {
    return new UploadResult(Status.SENT, recordCount);
  }

  /**
   * The kind of outcome.
   * @return the status
   */
  public Status getStatus() {
    return status;
  }

  /**
   * The number of records delivered; zero unless the status is {@link Status#SENT}.
   * @return the record count
   */
  public int getRecordCount() {
    return recordCount;
  }

  @Override
  public boolean equals(Object o) {
    if (o instanceof UploadResult) {
      UploadResult other = (UploadResult)o;
      return status == other.status && recordCount == other.recordCount;
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, recordCount);
  }

  @Override
  public String toString() {
    return status == Status.SENT ? "SENT(" + recordCount + ")" : status.name();
  }
}
