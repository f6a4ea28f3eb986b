/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.entry;


import java.nio.ByteBuffer;

/**
 * The canonical byte representation of a {@linkplain LogEntry}. The only
 * use for these bytes is in the calculation of the entry's hash.
 * 
 * @see Canonicalizer#canonicalize(LogEntry)
 */
public final class CanonicalEntry {
  
  private final long index;
  private final ByteBuffer bytes;
  
  
  CanonicalEntry(long index, byte[] bytes) {
    this.index = index;
    this.bytes = ByteBuffer.wrap(bytes).asReadOnlyBuffer();
  }
  
  
  /** Returns the index of the entry these bytes represent. */
  public long index() {
    return index;
  }
  
  /**
   * Returns the canonical bytes.
   * 
   * @return a new read-only view
   */
  public ByteBuffer bytes() {
    return bytes.duplicate();
  }
  
  /** Returns the number of canonical bytes. */
  public int size() {
    return bytes.capacity();
  }
  
  
  /** Instances are equal iff their bytes are equal. */
  @Override
  public boolean equals(Object o) {
    return
        o == this ||
        o instanceof CanonicalEntry other &&
        other.bytes.equals(bytes);
  }
  
  @Override
  public int hashCode() {
    return bytes.hashCode();
  }
  
  @Override
  public String toString() {
    return "[" + index + ": " + size() + " bytes]";
  }

}
