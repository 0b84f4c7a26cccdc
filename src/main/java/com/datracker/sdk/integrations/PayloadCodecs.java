package com.datracker.sdk.integrations;

import com.datracker.sdk.subsystems.PayloadCodec;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import okio.Buffer;
import okio.BufferedSink;
import okio.GzipSink;
import okio.Okio;

/**
 * Built-in implementations of {@link PayloadCodec}, for use with
 * {@link UploaderBuilder#compression(PayloadCodec)} and {@link UploaderBuilder#encryption(PayloadCodec)}.
 */
public abstract class PayloadCodecs {
  /**
   * The length in bytes of the random nonce that {@link #aesGcm(byte[])} prepends to its output.
   */
  public static final int AES_GCM_NONCE_LENGTH = 12;

  /**
   * The length in bits of the authentication tag that {@link #aesGcm(byte[])} appends to its output.
   */
  public static final int AES_GCM_TAG_LENGTH_BITS = 128;

  private static final PayloadCodec IDENTITY = new IdentityCodec();
  private static final PayloadCodec GZIP = new GzipCodec();

  private PayloadCodecs() {}

  /**
   * Returns a codec that leaves the data unchanged.
   * 
   * @return the identity codec
   */
  public static PayloadCodec identity() {
    return IDENTITY;
  }

  /**
   * Returns a codec that compresses data in gzip format. This is the default compression.
   * 
   * @return the gzip codec
   */
  public static PayloadCodec gzip() {
    return GZIP;
  }

  /**
   * Returns a codec that encrypts data with AES in GCM mode.
   * <p>
   * Each output is a random 12-byte nonce followed by the ciphertext and a 128-bit authentication
   * tag. The collector must be configured with the same key.
   * 
   * @param key a 16, 24 or 32 byte AES key
   * @return the encryption codec
   */
  public static PayloadCodec aesGcm(byte[] key) {
    checkNotNull(key, "key must not be null");
    checkArgument(key.length == 16 || key.length == 24 || key.length == 32,
        "AES key must be 16, 24 or 32 bytes");
    return new AesGcmCodec(key.clone());
  }

  private static final class IdentityCodec implements PayloadCodec {
    @Override
    public String getName() {
      return "identity";
    }

    @Override
    public byte[] encode(byte[] data) {
      return data;
    }
  }

  private static final class GzipCodec implements PayloadCodec {
    @Override
    public String getName() {
      return "gzip";
    }

    @Override
    public byte[] encode(byte[] data) throws IOException {
      Buffer output = new Buffer();
      try (BufferedSink sink = Okio.buffer(new GzipSink(output))) {
        sink.write(data);
      }
      return output.readByteArray();
    }
  }

  private static final class AesGcmCodec implements PayloadCodec {
    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    AesGcmCodec(byte[] key) {
      this.key = new SecretKeySpec(key, "AES");
    }

    @Override
    public String getName() {
      return "aes-gcm";
    }

    @Override
    public byte[] encode(byte[] data) throws IOException {
      byte[] nonce = new byte[AES_GCM_NONCE_LENGTH];
      random.nextBytes(nonce);
      try {
        Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
        cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(AES_GCM_TAG_LENGTH_BITS, nonce));
        byte[] encrypted = cipher.doFinal(data);
        byte[] result = new byte[nonce.length + encrypted.length];
        System.arraycopy(nonce, 0, result, 0, nonce.length);
        System.arraycopy(encrypted, 0, result, nonce.length, encrypted.length);
        return result;
      } catch (GeneralSecurityException e) {
        throw new IOException("payload encryption failed", e);
      }
    }
  }
}
