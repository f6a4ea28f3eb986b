/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.entry;


/**
 * Classification of field value types in a log entry. For the most part,
 * this concerns (and defines) the byte-sequence used to represent a field
 * value in an entry's canonical form. The enum's ordinal is the tag byte
 * written ahead of each value.
 * <p>
 * The set is closed: every {@linkplain FieldValue} is exactly one of these,
 * so canonical encoding is exhaustive.
 * </p>
 * 
 * @see Canonicalizer
 */
public enum FieldType {
  
  /** Explicit null. No payload. */
  NULL,
  /** Boolean value. 1 byte. */
  BOOL,
  /** Signed big endian long. 8 bytes. */
  LONG,
  /** IEEE-754 double, as its big endian {@code doubleToLongBits}. 8 bytes. */
  FLOAT,
  /** Arbitrary precision decimal. Variable size. */
  DECIMAL,
  /** NFC-normalized UTF-8 string. Variable size. */
  STRING,
  /** Blob of bytes. (Untyped). Variable size. */
  BYTES,
  /** Ordered sequence of values. Variable size. */
  LIST,
  /** Named values; canonical order is by name. Variable size. */
  STRUCT;
  
  
  private final static FieldType[] SET = values();
  
  
  /**
   * Returns the type by its tag byte.
   * 
   * @throws IndexOutOfBoundsException if the tag is not defined
   */
  public static FieldType forTag(int tag) throws IndexOutOfBoundsException {
    return SET[tag];
  }
  
  
  /** Returns the tag byte written ahead of values of this type. */
  public byte tag() {
    return (byte) ordinal();
  }

}
