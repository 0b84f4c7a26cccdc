package com.datracker.sdk.subsystems;

import java.io.Closeable;
import java.util.Collection;
import java.util.List;

/**
 * Interface for the local store of records that have not yet been delivered.
 * <p>
 * Implementations must be safe for concurrent use: any number of application threads may call
 * {@link #enqueue(Record)} while the uploader is leasing, committing or releasing entries.
 * <p>
 * Delivery is lease-based. {@link #leaseBatch(int)} hands out the oldest pending entries and marks
 * them as leased; the caller must then end the lease with {@link #commit(Collection)} if they were
 * delivered, or {@link #release(Collection)} if they were not. Only one lease can be outstanding at
 * a time. Leases are not persisted: after a restart, every stored entry is pending again.
 * <p>
 * Every implementation has a capacity. When an enqueue would exceed it, the oldest entries that are
 * not currently leased are evicted to make room; the number of records evicted this way is
 * available from {@link #getAndClearEvictedCount()}.
 */
public interface DurableQueue extends Closeable {
  /**
   * Stores a record. When this method returns, the record is in the implementation's storage
   * medium; for a durable implementation, it survives an immediate process kill.
   * 
   * @param record the record to store
   * @return the sequence number assigned to the record
   * @throws StorageException if the record could not be stored
   */
  long enqueue(Record record);

  /**
   * Leases up to {@code maxCount} of the oldest pending entries, in ascending sequence order.
   * <p>
   * If a lease is already outstanding, this returns an empty list without waiting.
   * 
   * @param maxCount the maximum number of entries to lease
   * @return the leased entries; empty if there are none or a lease is outstanding
   * @throws StorageException if the entries could not be read
   */
  List<QueueEntry> leaseBatch(int maxCount);

  /**
   * Deletes delivered entries and ends the outstanding lease.
   * 
   * @param sequences the sequence numbers of the leased entries
   * @throws StorageException if the entries could not be deleted; the lease is still ended
   */
  void commit(Collection<Long> sequences);

  /**
   * Returns entries to pending after a failed delivery attempt, incrementing their attempt counts,
   * and ends the outstanding lease.
   * 
   * @param sequences the sequence numbers of the leased entries
   * @throws StorageException if the attempt counts could not be updated; the lease is still ended
   */
  void release(Collection<Long> sequences);

  /**
   * Returns the number of stored entries, leased or not.
   * 
   * @return the entry count
   * @throws StorageException if the count could not be read
   */
  int size();

  /**
   * Returns the number of entries that have been evicted because of the capacity limit since the
   * last call to this method, and resets that number to zero.
   * 
   * @return the number of evicted entries
   */
  long getAndClearEvictedCount();
}
