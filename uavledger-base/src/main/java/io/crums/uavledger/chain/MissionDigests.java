/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.chain;


import java.nio.ByteBuffer;
import java.time.Clock;
import java.util.Objects;

import io.crums.uavledger.HashAlgorithm;
import io.crums.uavledger.SequenceException;

/**
 * Mission digest computer. The same computation serves intermediate
 * (checkpoint) anchoring and the terminal mission digest: a digest over an
 * unfinished chain simply covers the entries seen so far. Thread-safe.
 */
public class MissionDigests {
  
  private final HashAlgorithm algo;
  private final Clock clock;
  
  
  /** Uses the system UTC clock. */
  public MissionDigests(HashAlgorithm algo) {
    this(algo, Clock.systemUTC());
  }
  
  /**
   * @param algo        the scheme chains are computed under
   * @param clock       stamps each digest's creation time
   */
  public MissionDigests(HashAlgorithm algo, Clock clock) {
    this.algo = Objects.requireNonNull(algo, "null algo");
    this.clock = Objects.requireNonNull(clock, "null clock");
  }
  
  
  public HashAlgorithm algorithm() {
    return algo;
  }
  
  
  /**
   * Computes and returns the digest of a chain ending at the given link.
   * 
   * @param missionId   not blank
   * @param finalLink   the chain's last link, or {@code null} for the empty chain
   * @param entryCount  {@code finalLink.index() + 1} (or zero, if {@code finalLink} is {@code null})
   * 
   * @throws SequenceException if {@code entryCount} disagrees with {@code finalLink}
   */
  public MissionDigest finalizeMission(String missionId, ChainLink finalLink, long entryCount)
      throws SequenceException {
    
    if (finalLink == null) {
      if (entryCount != 0L)
        throw new SequenceException(
            "entryCount %d given with no final link".formatted(entryCount));
      return finalizeHead(missionId, algo.genesisHash(), 0L);
    }
    if (entryCount != finalLink.entryCount())
      throw new SequenceException(
          "entryCount %d disagrees with final link at index %d"
          .formatted(entryCount, finalLink.index()));
    return finalizeHead(missionId, finalLink.chainHash(), entryCount);
  }
  
  
  /**
   * Computes and returns the digest of a chain with the given head hash.
   * 
   * @param missionId       not blank
   * @param finalChainHash  the chain hash at index {@code entryCount - 1}
   *                        (the genesis constant, if {@code entryCount} is zero)
   * @param entryCount      &ge; 0
   */
  public MissionDigest finalizeHead(String missionId, ByteBuffer finalChainHash, long entryCount) {
    return new MissionDigest(missionId, algo, finalChainHash, entryCount, clock.millis());
  }

}
