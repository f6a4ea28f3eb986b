/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.chain;


import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;

import io.crums.uavledger.HashAlgorithm;

/**
 * A single commitment summarizing a mission's chain at some point: the
 * value handed off for external anchoring. Immutable.
 * 
 * <h2>Digest hash</h2>
 * <p>
 * Besides its members, an instance exposes a derived {@linkplain #hash()}:
 * </p>
 * <pre>
 *  H( str(algorithm id) || str(mission id) || finalChainHash || entryCount )
 * </pre>
 * <p>
 * (where {@code str} is a 4-byte length-prefixed UTF-8 string, and the
 * entry count is 8 bytes big endian). The creation time is <em>not</em>
 * hashed, so identical chains always yield byte-identical digest hashes.
 * </p>
 * 
 * @see MissionDigests#finalizeMission(String, ChainLink, long)
 */
public final class MissionDigest {
  
  private final String missionId;
  private final HashAlgorithm algo;
  private final ByteBuffer finalChainHash;
  private final long entryCount;
  private final long createdAt;
  private final ByteBuffer hash;
  
  
  /**
   * Full constructor.
   * 
   * @param missionId       not blank
   * @param algo            the scheme the chain was computed under
   * @param finalChainHash  the last link's chain hash (the genesis constant,
   *                        if {@code entryCount} is zero)
   * @param entryCount      &ge; 0
   * @param createdAt       UTC millis
   */
  public MissionDigest(
      String missionId, HashAlgorithm algo, ByteBuffer finalChainHash,
      long entryCount, long createdAt) {
    
    this.missionId = Objects.requireNonNull(missionId, "null missionId");
    this.algo = Objects.requireNonNull(algo, "null algo");
    this.finalChainHash =
        ByteBuffer.allocate(finalChainHash.remaining())
        .put(finalChainHash.duplicate()).flip().asReadOnlyBuffer();
    this.entryCount = entryCount;
    this.createdAt = createdAt;
    
    if (missionId.isBlank())
      throw new IllegalArgumentException("blank missionId");
    if (entryCount < 0L)
      throw new IllegalArgumentException("entryCount: " + entryCount);
    if (this.finalChainHash.remaining() != algo.hashWidth())
      throw new IllegalArgumentException(
          "finalChainHash width %d; %s expects %d"
          .formatted(this.finalChainHash.remaining(), algo.id(), algo.hashWidth()));
    if (entryCount == 0L && !this.finalChainHash.equals(algo.genesisHash()))
      throw new IllegalArgumentException(
          "empty mission must have the genesis hash as its final chain hash");
    
    this.hash = computeHash();
  }
  
  
  private ByteBuffer computeHash() {
    var digest = algo.newDigest();
    updateString(algo.id(), digest);
    updateString(missionId, digest);
    digest.update(finalChainHash.duplicate());
    digest.update(ByteBuffer.allocate(8).putLong(entryCount).flip());
    return ByteBuffer.wrap(digest.digest()).asReadOnlyBuffer();
  }
  
  private static void updateString(String s, MessageDigest digest) {
    byte[] b = s.getBytes(StandardCharsets.UTF_8);
    digest.update(ByteBuffer.allocate(4).putInt(b.length).flip());
    digest.update(b);
  }
  
  
  public String missionId() {
    return missionId;
  }
  
  /** Returns the hashing scheme the chain was computed under. */
  public HashAlgorithm algorithm() {
    return algo;
  }
  
  /** @return a new read-only view */
  public ByteBuffer finalChainHash() {
    return finalChainHash.duplicate();
  }
  
  /** Returns the number of entries in the chain. */
  public long entryCount() {
    return entryCount;
  }
  
  /** Determines whether this is the digest of an empty chain. */
  public boolean isEmpty() {
    return entryCount == 0L;
  }
  
  /** Returns the UTC millis this digest was computed. */
  public long createdAt() {
    return createdAt;
  }
  
  
  /**
   * Returns the digest hash (creation time excluded).
   * 
   * @return a new read-only view
   */
  public ByteBuffer hash() {
    return hash.duplicate();
  }
  
  
  /**
   * Returns the digest's final chain hash as a checkpoint, if the chain
   * is not empty.
   * 
   * @return a checkpoint at index {@code entryCount() - 1}, timestamped
   *         {@code createdAt()}
   */
  public Optional<Checkpoint> toCheckpoint() {
    return isEmpty() ?
        Optional.empty() :
          Optional.of(new Checkpoint(entryCount - 1, finalChainHash, createdAt));
  }
  
  
  /**
   * Determines whether the given digest commits to the same chain
   * (creation times may differ).
   * 
   * @return {@code other.hash().equals(hash())}
   */
  public boolean sameCommitment(MissionDigest other) {
    return other.hash.equals(hash);
  }
  
  
  /** Returns {@code true} iff all members are equal. */
  @Override
  public boolean equals(Object o) {
    return
        o == this ||
        o instanceof MissionDigest other &&
        other.createdAt == createdAt &&
        other.hash.equals(hash);
  }
  
  @Override
  public int hashCode() {
    return hash.hashCode();
  }
  
  @Override
  public String toString() {
    byte[] head = new byte[4];
    hash().get(head);
    return "[%s: %d entries, %s %s]".formatted(
        missionId, entryCount, algo.id(), HexFormat.of().formatHex(head));
  }

}
