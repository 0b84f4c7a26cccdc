package com.datracker.sdk.subsystems;

import com.datracker.sdk.integrations.UploaderBuilder;

import java.net.URI;
import java.time.Duration;

/**
 * Encapsulates the uploader's configuration.
 * <p>
 * Use {@link UploaderBuilder} to construct an instance.
 */
public final class UploaderConfiguration {
  private final Duration uploadInterval;
  private final int bulkSize;
  private final Duration maxBackoff;
  private final URI baseUri;
  private final PayloadCodec compression;
  private final PayloadCodec encryption;
  private final RecordSender recordSender;

  /**
   * Creates an instance.
   * 
   * @param uploadInterval see {@link #getUploadInterval()}
   * @param bulkSize see {@link #getBulkSize()}
   * @param maxBackoff see {@link #getMaxBackoff()}
   * @param baseUri see {@link #getBaseUri()}
   * @param compression see {@link #getCompression()}
   * @param encryption see {@link #getEncryption()}
   * @param recordSender see {@link #getRecordSender()}
   */
  public UploaderConfiguration(
      Duration uploadInterval,
      int bulkSize,
      Duration maxBackoff,
      URI baseUri,
      PayloadCodec compression,
      PayloadCodec encryption,
      RecordSender recordSender
      ) {
    this.uploadInterval = uploadInterval;
    this.bulkSize = bulkSize;
    this.maxBackoff = maxBackoff;
    this.baseUri = baseUri;
    this.compression = compression;
    this.encryption = encryption;
    this.recordSender = recordSender;
  }

  /**
   * The initial interval between scheduled uploads.
   * @return the interval
   */
  public Duration getUploadInterval() {
    return uploadInterval;
  }

  /**
   * The initial maximum number of records per batch.
   * @return the bulk size
   */
  public int getBulkSize() {
    return bulkSize;
  }

  /**
   * The upper bound for the delay between scheduled uploads after consecutive failures.
   * @return the maximum backoff
   */
  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  /**
   * The collector base URI.
   * @return the base URI
   */
  public URI getBaseUri() {
    return baseUri;
  }

  /**
   * The compression codec; never null.
   * @return the codec
   */
  public PayloadCodec getCompression() {
    return compression;
  }

  /**
   * The encryption codec, if encryption is enabled.
   * @return the codec or null
   */
  public PayloadCodec getEncryption() {
    return encryption;
  }

  /**
   * The component that delivers batches.
   * @return the record sender
   */
  public RecordSender getRecordSender() {
    return recordSender;
  }
}
