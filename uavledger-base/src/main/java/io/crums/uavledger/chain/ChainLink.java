/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.chain;


import java.nio.ByteBuffer;
import java.util.HexFormat;

/**
 * A link in the chain: one per entry. The fields of an instance satisfy
 * the following hash-relation:
 * <p>
 *  {@code chainHash() = H(entryHash() || prevChainHash() || index())}
 * </p><p>
 * where the index is written as an 8-byte big endian integer, and {@code H}
 * is the chain's {@linkplain io.crums.uavledger.HashAlgorithm HashAlgorithm}.
 * Since each chain hash commits to the previous one, the chain hash at
 * index <em>i</em> is a function of every entry at indices {@code 0..i}.
 * Instances are immutable.
 * </p>
 * 
 * @see ChainBuilder#append(ChainLink, io.crums.uavledger.entry.LogEntry)
 */
public final class ChainLink {
  
  private final long index;
  private final ByteBuffer entryHash;
  private final ByteBuffer prevChainHash;
  private final ByteBuffer chainHash;
  
  
  /**
   * Package-private. The hash-relation is not checked here; instances
   * are only created by {@linkplain ChainBuilder}.
   */
  ChainLink(long index, ByteBuffer entryHash, ByteBuffer prevChainHash, ByteBuffer chainHash) {
    this.index = index;
    this.entryHash = readOnlyCopy(entryHash);
    this.prevChainHash = readOnlyCopy(prevChainHash);
    this.chainHash = readOnlyCopy(chainHash);
    
    if (index < 0L)
      throw new IllegalArgumentException("index: " + index);
    int width = this.chainHash.remaining();
    if (this.entryHash.remaining() != width || this.prevChainHash.remaining() != width)
      throw new IllegalArgumentException("hash width mismatch at index " + index);
  }
  
  
  private static ByteBuffer readOnlyCopy(ByteBuffer hash) {
    var copy = ByteBuffer.allocate(hash.remaining()).put(hash.duplicate()).flip();
    return copy.asReadOnlyBuffer();
  }
  
  
  /** Returns the entry's sequence index. */
  public long index() {
    return index;
  }
  
  /** Returns the number of entries the chain hash commits to. */
  public long entryCount() {
    return index + 1;
  }
  
  /** Determines whether this is the first link in its chain. */
  public boolean isGenesis() {
    return index == 0L;
  }
  
  /** @return a new read-only view */
  public ByteBuffer entryHash() {
    return entryHash.duplicate();
  }
  
  /**
   * Returns the previous link's chain hash; for index 0, the genesis constant.
   * 
   * @return a new read-only view
   */
  public ByteBuffer prevChainHash() {
    return prevChainHash.duplicate();
  }
  
  /** @return a new read-only view */
  public ByteBuffer chainHash() {
    return chainHash.duplicate();
  }
  
  
  /** Returns {@code true} iff all members are equal. */
  @Override
  public boolean equals(Object o) {
    return
        o == this ||
        o instanceof ChainLink other &&
        other.index == index &&
        other.chainHash.equals(chainHash) &&
        other.entryHash.equals(entryHash) &&
        other.prevChainHash.equals(prevChainHash);
  }
  
  @Override
  public int hashCode() {
    return Long.hashCode(index) ^ chainHash.hashCode();
  }
  
  @Override
  public String toString() {
    var hex = HexFormat.of();
    byte[] head = new byte[Math.min(3, chainHash.remaining())];
    chainHash().get(head);
    return "[" + index + ": " + hex.formatHex(head) + "]";
  }

}
