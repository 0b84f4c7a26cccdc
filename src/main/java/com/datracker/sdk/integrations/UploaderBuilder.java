package com.datracker.sdk.integrations;

import com.datracker.sdk.Components;
import com.datracker.sdk.subsystems.ComponentConfigurer;
import com.datracker.sdk.subsystems.PayloadCodec;
import com.datracker.sdk.subsystems.RecordSender;
import com.datracker.sdk.subsystems.UploaderConfiguration;

import java.net.URI;
import java.time.Duration;

/**
 * Contains methods for configuring delivery of records to the collector.
 * <p>
 * If you want to set non-default values for any of these properties, create a builder with
 * {@link Components#uploader()}, change its properties with the methods of this class, and pass it
 * to {@link com.datracker.sdk.TrackerConfig.Builder#uploader(ComponentConfigurer)}:
 * <pre><code>
 *     TrackerConfig config = new TrackerConfig.Builder()
 *         .uploader(Components.uploader().bulkSize(50).uploadInterval(Duration.ofSeconds(30)))
 *         .build();
 * </code></pre>
 * <p>
 * The interval and bulk size can also be changed while the tracker is running, with
 * {@link com.datracker.sdk.Tracker#setUploadInterval(int)} and
 * {@link com.datracker.sdk.Tracker#setUploadBulkSize(int)}.
 * <p>
 * Note that this class is abstract; the actual implementation is created by calling {@link Components#uploader()}.
 */
public abstract class UploaderBuilder implements ComponentConfigurer<UploaderConfiguration> {
  /**
   * The default value for {@link #uploadInterval(Duration)}: 15 seconds.
   */
  public static final Duration DEFAULT_UPLOAD_INTERVAL = Duration.ofSeconds(15);

  /**
   * The default value for {@link #bulkSize(int)}.
   */
  public static final int DEFAULT_BULK_SIZE = 100;

  /**
   * The default value for {@link #maxBackoff(Duration)}: 10 minutes.
   */
  public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMinutes(10);

  protected Duration uploadInterval = DEFAULT_UPLOAD_INTERVAL;
  protected int bulkSize = DEFAULT_BULK_SIZE;
  protected Duration maxBackoff = DEFAULT_MAX_BACKOFF;
  protected URI baseUri;
  protected PayloadCodec compression = PayloadCodecs.gzip();
  protected PayloadCodec encryption;
  protected ComponentConfigurer<RecordSender> recordSenderConfigurer;

  /**
   * Sets the interval between scheduled uploads.
   * 
   * @param uploadInterval the interval; null or a non-positive value uses the default
   * @return the builder
   */
  public UploaderBuilder uploadInterval(Duration uploadInterval) {
    this.uploadInterval = uploadInterval == null || uploadInterval.isZero() || uploadInterval.isNegative() ?
        DEFAULT_UPLOAD_INTERVAL : uploadInterval;
    return this;
  }

  /**
   * Sets the maximum number of records sent in one request.
   * 
   * @param bulkSize the batch size; a non-positive value uses the default
   * @return the builder
   */
  public UploaderBuilder bulkSize(int bulkSize) {
    this.bulkSize = bulkSize <= 0 ? DEFAULT_BULK_SIZE : bulkSize;
    return this;
  }

  /**
   * Sets the upper bound for the delay between scheduled uploads when uploads keep failing.
   * <p>
   * After each consecutive failure the delay doubles, starting from the upload interval.
   * 
   * @param maxBackoff the maximum delay; null uses the default
   * @return the builder
   */
  public UploaderBuilder maxBackoff(Duration maxBackoff) {
    this.maxBackoff = maxBackoff == null ? DEFAULT_MAX_BACKOFF : maxBackoff;
    return this;
  }

  /**
   * Sets a custom collector base URI, for instance a relay or a test server.
   * 
   * @param baseUri the base URI; null uses the default
   * @return the builder
   */
  public UploaderBuilder baseUri(URI baseUri) {
    this.baseUri = baseUri;
    return this;
  }

  /**
   * Sets the compression applied to each batch. The default is {@link PayloadCodecs#gzip()}.
   * 
   * @param compression the codec; null means {@link PayloadCodecs#identity()}
   * @return the builder
   */
  public UploaderBuilder compression(PayloadCodec compression) {
    this.compression = compression == null ? PayloadCodecs.identity() : compression;
    return this;
  }

  /**
   * Enables encryption of each batch, applied after compression. Encryption is off by default.
   * 
   * @param encryption the codec, for instance {@link PayloadCodecs#aesGcm(byte[])}; null disables encryption
   * @return the builder
   */
  public UploaderBuilder encryption(PayloadCodec encryption) {
    this.encryption = encryption;
    return this;
  }

  /**
   * Specifies a custom implementation for delivering batches.
   * <p>
   * This is mainly useful for testing. By default, batches are sent to the collector via HTTP.
   * 
   * @param recordSenderConfigurer a factory for a {@link RecordSender}; null uses the default
   * @return the builder
   */
  public UploaderBuilder recordSender(ComponentConfigurer<RecordSender> recordSenderConfigurer) {
    this.recordSenderConfigurer = recordSenderConfigurer;
    return this;
  }
}
