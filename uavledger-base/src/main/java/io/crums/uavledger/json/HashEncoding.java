/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.json;


import java.nio.ByteBuffer;
import java.util.Base64;
import java.util.HexFormat;

import io.crums.uavledger.HashAlgorithm;

/**
 * ASCII encodings for hash values.
 */
public enum HashEncoding {
  /**
   * Lowercase hexadecimal. 64 chars represent a 32-byte value.
   */
  HEX,
  /**
   * URL-safe base64 without padding. 43 chars represent a 32-byte value.
   */
  BASE64;
  
  private final static HexFormat HEX_FORMAT = HexFormat.of();

  /**
   * Returns the given hash in encoded form. The buffer's position is not
   * modified.
   */
  public String encode(ByteBuffer hash) {
    var bytes = new byte[hash.remaining()];
    hash.duplicate().get(bytes);
    return encode(bytes);
  }
  
  /**
   * Returns the given hash in encoded form.
   */
  public String encode(byte[] hash) {
    return
        this == HEX ?
            HEX_FORMAT.formatHex(hash) :
            Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
  }
  
  /**
   * Decodes and returns the given value.
   * 
   * @throws JsonParsingException if not properly encoded
   */
  public byte[] decode(CharSequence hash) throws JsonParsingException {
    try {
      return
          this == HEX ?
              HEX_FORMAT.parseHex(hash) :
              Base64.getUrlDecoder().decode(hash.toString());
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException("not " + this + " encoded: " + hash, iax);
    }
  }
  
  
  /**
   * Decodes and returns a hash of the given algorithm's width.
   * 
   * @return read-only buffer
   * @throws JsonParsingException if not properly encoded, or the wrong width
   */
  public ByteBuffer decodeHash(CharSequence hash, HashAlgorithm algo) throws JsonParsingException {
    byte[] bytes = decode(hash);
    if (bytes.length != algo.hashWidth())
      throw new JsonParsingException(
          "expected %d-byte %s hash; decoded %d bytes: %s"
          .formatted(algo.hashWidth(), algo.id(), bytes.length, hash));
    return ByteBuffer.wrap(bytes).asReadOnlyBuffer();
  }
  
  
  /**
   * Length of ASCII string representing a hash of the given width.
   */
  public int length(int hashWidth) {
    return this == HEX ? 2 * hashWidth : (hashWidth * 4 + 2) / 3;
  }
  
  
  /**
   * Returns the instance with the given (case insensitive) name.
   * 
   * @throws JsonParsingException if no such encoding
   */
  public static HashEncoding forName(String name) throws JsonParsingException {
    for (var enc : values())
      if (enc.name().equalsIgnoreCase(name.trim()))
        return enc;
    throw new JsonParsingException("unknown hash encoding: " + name);
  }
  
}
