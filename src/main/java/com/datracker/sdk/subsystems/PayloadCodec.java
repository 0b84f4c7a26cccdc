package com.datracker.sdk.subsystems;

import java.io.IOException;

/**
 * A transformation applied to a serialized batch before it is sent, such as compression or
 * encryption.
 * 
 * @see com.datracker.sdk.integrations.PayloadCodecs
 */
public interface PayloadCodec {
  /**
   * The codec name that is sent to the collector so that it can reverse the transformation; for
   * compression this is the HTTP {@code Content-Encoding} token.
   * 
   * @return the codec name
   */
  String getName();

  /**
   * Transforms a payload.
   * 
   * @param data the input bytes
   * @return the transformed bytes
   * @throws IOException if the transformation failed
   */
  byte[] encode(byte[] data) throws IOException;
}
