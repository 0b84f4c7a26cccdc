package com.datracker.sdk;

import com.datracker.sdk.interfaces.NetworkStatusProvider;
import com.datracker.sdk.interfaces.NetworkType;
import com.datracker.sdk.subsystems.DurableQueue;
import com.datracker.sdk.subsystems.PayloadCodec;
import com.datracker.sdk.subsystems.QueueEntry;
import com.datracker.sdk.subsystems.RecordSender;
import com.datracker.sdk.subsystems.StorageException;
import com.datracker.sdk.subsystems.UploaderConfiguration;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Moves records from the {@link DurableQueue} to the collector in batches.
 * <p>
 * Scheduled and explicit uploads all run on the tracker's single worker thread, so they never
 * overlap. {@link #runOnce()} is also safe to call directly from any thread: a second concurrent
 * call returns {@link UploadResult#BUSY}.
 */
final class Uploader implements Closeable {
  private final DurableQueue queue;
  private final RecordSender sender;
  private final RecordOutputFormatter formatter;
  private final NetworkStatusProvider networkStatus;
  private final ScheduledExecutorService executor;
  private final UploaderConfiguration config;
  private final boolean offline;
  private final LDLogger logger;

  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicBoolean disabled = new AtomicBoolean(false);
  private final AtomicBoolean inFlight = new AtomicBoolean(false);

  private volatile boolean autoUpload;
  private volatile boolean sendOnWifi;
  private volatile int bulkSize;
  private volatile Duration uploadInterval;
  private volatile int consecutiveFailures;

  private final Object scheduleLock = new Object();
  private ScheduledFuture<?> nextScheduledRun;

  Uploader(
      UploaderConfiguration config,
      DurableQueue queue,
      RecordOutputFormatter formatter,
      NetworkStatusProvider networkStatus,
      ScheduledExecutorService executor,
      boolean autoUpload,
      boolean sendOnWifi,
      boolean offline,
      LDLogger logger
      ) {
    this.config = config;
    this.queue = queue;
    this.sender = config.getRecordSender();
    this.formatter = formatter;
    this.networkStatus = networkStatus;
    this.executor = executor;
    this.autoUpload = autoUpload;
    this.sendOnWifi = sendOnWifi;
    this.offline = offline;
    this.bulkSize = config.getBulkSize();
    this.uploadInterval = config.getUploadInterval();
    this.logger = logger;
  }

  void start() {
    reschedule();
  }

  UploadResult runOnce() {
    if (closed.get() || disabled.get() || offline) {
      return UploadResult.DISABLED;
    }
    NetworkType network = networkStatus.getNetworkType();
    if (network == NetworkType.NONE || (sendOnWifi && network != NetworkType.WIFI)) {
      logger.debug("Not uploading on network type {}", network);
      return UploadResult.SKIPPED;
    }
    if (!inFlight.compareAndSet(false, true)) {
      return UploadResult.BUSY;
    }
    try {
      return uploadBatch();
    } finally {
      inFlight.set(false);
    }
  }

  private UploadResult uploadBatch() {
    List<QueueEntry> batch;
    try {
      batch = queue.leaseBatch(bulkSize);
    } catch (StorageException e) {
      logger.error("Could not read records from local storage: {}", LogValues.exceptionSummary(e));
      logger.debug("{}", LogValues.exceptionTrace(e));
      consecutiveFailures++;
      return UploadResult.FAILED;
    }
    if (batch.isEmpty()) {
      return UploadResult.EMPTY;
    }
    List<Long> sequences = new ArrayList<>(batch.size());
    for (QueueEntry e: batch) {
      sequences.add(e.getSequence());
    }

    RecordSender.Result result;
    try {
      RecordSender.Payload payload = encodeBatch(batch);
      result = sender.sendRecords(payload, config.getBaseUri());
    } catch (Exception e) {
      logger.warn("Unexpected error while uploading records: {}", LogValues.exceptionSummary(e));
      logger.debug("{}", LogValues.exceptionTrace(e));
      result = RecordSender.Result.FAILURE;
    }

    switch (result) {
    case SUCCESS:
      try {
        queue.commit(sequences);
      } catch (StorageException e) {
        // the batch stays stored and will be delivered again; the collector discards duplicates
        logger.error("Could not remove delivered records from local storage: {}", LogValues.exceptionSummary(e));
      }
      consecutiveFailures = 0;
      logger.debug("Uploaded {} record(s)", batch.size());
      return UploadResult.sent(batch.size());
    case STOP:
      releaseQuietly(sequences);
      if (disabled.compareAndSet(false, true)) {
        logger.error("Uploading has been disabled for the rest of this session; stored records will be sent after a restart");
      }
      return UploadResult.FAILED;
    default:
      releaseQuietly(sequences);
      consecutiveFailures++;
      return UploadResult.FAILED;
    }
  }

  private RecordSender.Payload encodeBatch(List<QueueEntry> batch) throws IOException {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    try (Writer writer = new OutputStreamWriter(buffer, StandardCharsets.UTF_8)) {
      formatter.writeOutputRecords(batch, System.currentTimeMillis(), writer);
    }
    PayloadCodec compression = config.getCompression();
    byte[] data = compression.encode(buffer.toByteArray());
    String contentEncoding = "identity".equals(compression.getName()) ? null : compression.getName();
    String encryption = null;
    if (config.getEncryption() != null) {
      data = config.getEncryption().encode(data);
      encryption = config.getEncryption().getName();
    }
    return new RecordSender.Payload(data, batch.size(), contentEncoding, encryption);
  }

  private void releaseQuietly(List<Long> sequences) {
    try {
      queue.release(sequences);
    } catch (StorageException e) {
      logger.error("Could not update records in local storage: {}", LogValues.exceptionSummary(e));
    }
  }

  Future<UploadResult> uploadAsync() {
    return executor.submit(this::runOnce);
  }

  Future<UploadResult> flushAsync() {
    return executor.submit(() -> {
      UploadResult result;
      do {
        result = runOnce();
      } while (result.getStatus() == UploadResult.Status.SENT && queue.size() > 0);
      return result;
    });
  }

  void setAutoUpload(boolean autoUpload) {
    this.autoUpload = autoUpload;
    reschedule();
  }

  void setSendOnWifi(boolean sendOnWifi) {
    this.sendOnWifi = sendOnWifi;
  }

  void setBulkSize(int bulkSize) {
    if (bulkSize > 0) {
      this.bulkSize = bulkSize;
    }
  }

  void setUploadInterval(Duration uploadInterval) {
    if (uploadInterval != null && !uploadInterval.isZero() && !uploadInterval.isNegative()) {
      this.uploadInterval = uploadInterval;
      reschedule();
    }
  }

  int getBulkSize() {
    return bulkSize;
  }

  Duration getUploadInterval() {
    return uploadInterval;
  }

  boolean isAutoUpload() {
    return autoUpload;
  }

  boolean isSendOnWifi() {
    return sendOnWifi;
  }

  boolean isDisabled() {
    return disabled.get();
  }

  // Visible for testing. The delay doubles with each consecutive failure, up to the maximum backoff.
  Duration nextDelay() {
    Duration delay = uploadInterval;
    int failures = consecutiveFailures;
    for (int i = 0; i < failures && delay.compareTo(config.getMaxBackoff()) < 0; i++) {
      delay = delay.multipliedBy(2);
    }
    return delay.compareTo(config.getMaxBackoff()) > 0 ? config.getMaxBackoff() : delay;
  }

  private void scheduledRun() {
    try {
      runOnce();
    } catch (RuntimeException e) { // COVERAGE: runOnce catches its own errors
      logger.error("Unexpected error in scheduled upload: {}", LogValues.exceptionSummary(e));
    }
    reschedule();
  }

  private void reschedule() {
    synchronized (scheduleLock) {
      if (nextScheduledRun != null) {
        nextScheduledRun.cancel(false);
        nextScheduledRun = null;
      }
      if (!autoUpload || closed.get() || offline) {
        return;
      }
      nextScheduledRun = executor.schedule(this::scheduledRun, nextDelay().toMillis(), TimeUnit.MILLISECONDS);
    }
  }

  // Stops scheduling uploads. An upload that is already running is allowed to finish.
  void stop() {
    closed.set(true);
    synchronized (scheduleLock) {
      if (nextScheduledRun != null) {
        nextScheduledRun.cancel(false);
        nextScheduledRun = null;
      }
    }
  }

  @Override
  public void close() throws IOException {
    stop();
    sender.close();
  }
}
