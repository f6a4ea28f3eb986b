/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.chain;


import java.nio.ByteBuffer;
import java.util.HexFormat;

/**
 * A recorded chain hash at a known index: a trust anchor for later
 * re-verification. Checkpoints are snapshots; recording one has no
 * effect on the chain.
 * 
 * <h2>Purpose</h2>
 * <p>
 * Checkpoints record the state of a chain up to a certain index and allow
 * a verifier both to localize tampering between consecutive checkpoints
 * and to re-verify a suffix of the log starting just past a checkpoint,
 * without rehashing the prefix. When recorded at regular intervals they
 * serve as a coarse-grained index into the chain.
 * </p>
 * 
 * @see ChainBuilder#checkpoint(ChainLink)
 * @see ChainBuilder#resume(Checkpoint, io.crums.uavledger.HashAlgorithm)
 */
public final class Checkpoint implements Comparable<Checkpoint> {
  
  private final long index;
  private final ByteBuffer chainHash;
  private final long timestamp;
  
  
  /**
   * @param index       the index of the link whose chain hash is recorded (&ge; 0)
   * @param chainHash   the chain hash (remaining bytes)
   * @param timestamp   UTC millis the checkpoint was recorded
   */
  public Checkpoint(long index, ByteBuffer chainHash, long timestamp) {
    this.index = index;
    this.chainHash =
        ByteBuffer.allocate(chainHash.remaining())
        .put(chainHash.duplicate()).flip().asReadOnlyBuffer();
    this.timestamp = timestamp;
    
    if (index < 0L)
      throw new IllegalArgumentException("index: " + index);
    if (!this.chainHash.hasRemaining())
      throw new IllegalArgumentException("empty chainHash");
  }
  
  
  /** Returns the index of the checkpointed link. */
  public long index() {
    return index;
  }
  
  /** @return a new read-only view */
  public ByteBuffer chainHash() {
    return chainHash.duplicate();
  }
  
  /** Returns the UTC millis the checkpoint was recorded. */
  public long timestamp() {
    return timestamp;
  }
  
  /** Returns the number of entries the checkpoint covers. */
  public long entryCount() {
    return index + 1;
  }
  
  
  /**
   * Determines whether the given link is the one checkpointed.
   * 
   * @return {@code link.index() == index() && link.chainHash().equals(chainHash())}
   */
  public boolean matches(ChainLink link) {
    return link.index() == index && link.chainHash().equals(chainHash);
  }
  
  
  /** Ordered by index. */
  @Override
  public int compareTo(Checkpoint o) {
    return Long.compare(index, o.index);
  }
  
  
  /** Returns {@code true} iff all members are equal. */
  @Override
  public boolean equals(Object o) {
    return
        o == this ||
        o instanceof Checkpoint other &&
        other.index == index &&
        other.timestamp == timestamp &&
        other.chainHash.equals(chainHash);
  }
  
  /**
   * Consistent with {@linkplain #equals(Object)}.
   * Computed from index and chain hash, only.
   */
  @Override
  public int hashCode() {
    return Long.hashCode(index) * 31 + chainHash.hashCode();
  }
  
  @Override
  public String toString() {
    byte[] head = new byte[Math.min(3, chainHash.remaining())];
    chainHash().get(head);
    return "[%d: %s @%d]".formatted(index, HexFormat.of().formatHex(head), timestamp);
  }

}
