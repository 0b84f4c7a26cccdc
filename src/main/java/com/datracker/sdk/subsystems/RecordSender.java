package com.datracker.sdk.subsystems;

import java.io.Closeable;
import java.net.URI;

/**
 * Interface for a component that can deliver an encoded batch of records.
 * <p>
 * By default, the tracker sends batches to the collector via HTTP. You may provide a different
 * implementation, for instance a test fixture, with
 * {@link com.datracker.sdk.integrations.UploaderBuilder#recordSender(ComponentConfigurer)}.
 */
public interface RecordSender extends Closeable {
  /**
   * Result type for {@link RecordSender#sendRecords(Payload, URI)}.
   */
  public enum Result {
    /**
     * The collector accepted the batch.
     */
    SUCCESS,

    /**
     * The batch was not delivered; it should be retried later.
     */
    FAILURE,

    /**
     * The batch was not delivered, and the nature of the error (such as an invalid application key)
     * indicates that the tracker should not attempt to send any more data.
     */
    STOP
  };

  /**
   * An encoded batch, ready to be transmitted.
   */
  public static final class Payload {
    private final byte[] data;
    private final int recordCount;
    private final String contentEncoding;
    private final String encryption;

    /**
     * Constructs an instance.
     * 
     * @param data the encoded bytes
     * @param recordCount the number of records in the batch
     * @param contentEncoding the compression codec name, or null if the data is not compressed
     * @param encryption the encryption codec name, or null if the data is not encrypted
     */
    public Payload(byte[] data, int recordCount, String contentEncoding, String encryption) {
      this.data = data;
      this.recordCount = recordCount;
      this.contentEncoding = contentEncoding;
      this.encryption = encryption;
    }

    /**
     * The encoded bytes.
     * @return the data
     */
    public byte[] getData() {
      return data;
    }

    /**
     * The number of records in the batch.
     * @return the record count
     */
    public int getRecordCount() {
      return recordCount;
    }

    /**
     * The compression codec name.
     * @return the name, or null if the data is not compressed
     */
    public String getContentEncoding() {
      return contentEncoding;
    }

    /**
     * The encryption codec name.
     * @return the name, or null if the data is not encrypted
     */
    public String getEncryption() {
      return encryption;
    }
  }

  /**
   * Attempts to deliver a batch.
   * <p>
   * This method is called synchronously from the upload worker thread. It should return
   * {@link Result#FAILURE} rather than throw for network errors.
   * 
   * @param payload the encoded batch
   * @param baseUri the configured collector base URI
   * @return a {@link Result}
   */
  Result sendRecords(Payload payload, URI baseUri);
}
