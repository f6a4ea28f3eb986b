/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.verify;


import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.crums.uavledger.AlgorithmMismatchException;
import io.crums.uavledger.HashAlgorithm;
import io.crums.uavledger.chain.Checkpoint;
import io.crums.uavledger.chain.MissionDigest;

/**
 * What a candidate log is verified against: a mission's previously recorded
 * checkpoints, its digest, or both. The digest contributes one more
 * expected point (its final chain hash at index {@code entryCount - 1}) and
 * fixes the expected length of the log. Immutable.
 */
public final class TrustedRecord {
  
  
  /**
   * Returns an instance with just the given digest.
   */
  public static TrustedRecord of(MissionDigest digest) {
    return new TrustedRecord(digest.missionId(), digest.algorithm(), List.of(), digest);
  }
  
  
  /**
   * Returns an instance with the given checkpoint history (no digest).
   * 
   * @param missionId   mission identifier
   * @param algo        the scheme the checkpoints were computed under
   * @param checkpoints in any order; duplicates (same index and hash) are collapsed
   */
  public static TrustedRecord of(String missionId, HashAlgorithm algo, List<Checkpoint> checkpoints) {
    return new TrustedRecord(missionId, algo, checkpoints, null);
  }
  
  
  private final String missionId;
  private final HashAlgorithm algo;
  private final List<Checkpoint> checkpoints;
  private final MissionDigest digest;
  private final List<Checkpoint> points;
  
  
  private TrustedRecord(
      String missionId, HashAlgorithm algo, List<Checkpoint> checkpoints, MissionDigest digest) {
    
    this.missionId = Objects.requireNonNull(missionId, "null missionId");
    this.algo = Objects.requireNonNull(algo, "null algo");
    this.checkpoints = normalize(checkpoints);
    this.digest = digest;
    
    if (missionId.isBlank())
      throw new IllegalArgumentException("blank missionId");
    
    for (var cp : this.checkpoints)
      if (cp.chainHash().remaining() != algo.hashWidth())
        throw new IllegalArgumentException(
            "checkpoint hash width does not match %s: %s".formatted(algo.id(), cp));
    
    if (digest == null)
      this.points = this.checkpoints;
    else {
      if (!checkpoints.isEmpty() &&
          this.checkpoints.get(this.checkpoints.size() - 1).index() >= digest.entryCount())
        throw new IllegalArgumentException(
            "checkpoint beyond digest's entry count (%d): %s"
            .formatted(digest.entryCount(), this.checkpoints.get(this.checkpoints.size() - 1)));
      var merged = new ArrayList<Checkpoint>(this.checkpoints.size() + 1);
      merged.addAll(this.checkpoints);
      digest.toCheckpoint().ifPresent(merged::add);
      this.points = normalize(merged);
    }
  }
  
  
  private static List<Checkpoint> normalize(List<Checkpoint> checkpoints) {
    var sorted = new ArrayList<>(checkpoints);
    Collections.sort(sorted);
    for (int index = sorted.size() - 1; index-- > 0; ) {
      var cp = sorted.get(index);
      var next = sorted.get(index + 1);
      if (cp.index() == next.index()) {
        if (!cp.chainHash().equals(next.chainHash()))
          throw new IllegalArgumentException(
              "conflicting expected hashes at index " + cp.index() + ": " + cp + ", " + next);
        sorted.remove(index + 1);
      }
    }
    return Collections.unmodifiableList(sorted);
  }
  
  
  /**
   * Returns an instance with the given digest added.
   * 
   * @throws AlgorithmMismatchException if the digest was computed under another scheme
   * @throws IllegalArgumentException if the digest is for another mission, or
   *         conflicts with a recorded checkpoint
   */
  public TrustedRecord withDigest(MissionDigest digest)
      throws AlgorithmMismatchException, IllegalArgumentException {
    algo.checkSame(digest.algorithm());
    if (!digest.missionId().equals(missionId))
      throw new IllegalArgumentException(
          "digest mission id %s; expected %s".formatted(digest.missionId(), missionId));
    return new TrustedRecord(missionId, algo, checkpoints, digest);
  }
  
  
  public String missionId() {
    return missionId;
  }
  
  /** Returns the hashing scheme the expected hashes were computed under. */
  public HashAlgorithm algorithm() {
    return algo;
  }
  
  /** Returns the checkpoint history (sans digest), ordered by index. */
  public List<Checkpoint> checkpoints() {
    return checkpoints;
  }
  
  public Optional<MissionDigest> digest() {
    return Optional.ofNullable(digest);
  }
  
  
  /**
   * Returns the expected points: the checkpoints plus the digest's final
   * point, ordered by index.
   */
  public List<Checkpoint> expectedPoints() {
    return points;
  }
  
  
  /**
   * Returns the number of entries this record covers. A candidate log
   * shorter than this is truncated.
   * 
   * @return the digest's entry count, if present; o.w. 1 + the last
   *         checkpoint's index (zero if there are none)
   */
  public long expectedLength() {
    if (digest != null)
      return digest.entryCount();
    return checkpoints.isEmpty() ? 0L : checkpoints.get(checkpoints.size() - 1).entryCount();
  }
  
  
  @Override
  public String toString() {
    return "TrustedRecord[%s, %s, %d points, length %d]"
        .formatted(missionId, algo.id(), points.size(), expectedLength());
  }

}
