/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.verify;


import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.crums.uavledger.chain.MissionDigest;

/**
 * Result of verifying a candidate log against a {@linkplain TrustedRecord}.
 * Immutable.
 * 
 * <h2>Localization</h2>
 * <p>
 * On {@linkplain Verdict#FAIL FAIL}, the first tampered entry lies in the
 * closed range [{@linkplain #divergenceLowerBound()},
 * {@linkplain #firstDivergenceIndex()}]. With a checkpoint at every index
 * the two are equal. With sparse checkpoints, the reported index is the
 * first position in that range whose entry's declared index disagrees
 * with its position (a deletion, insertion or reordering), or else the
 * index of the first mismatched expected point.
 * </p>
 */
public final class VerificationReport {
  
  private final String missionId;
  private final Verdict verdict;
  private final long firstDivergenceIndex;
  private final long divergenceLowerBound;
  private final MissionDigest recomputedDigest;
  private final MissionDigest expectedDigest;
  private final long checkedEntryCount;
  private final long uncoveredSuffixLength;
  private final List<CheckpointResult> checkpointResults;
  
  
  /**
   * Full constructor. Not validated beyond basic consistency: instances are
   * normally created by a {@linkplain VerificationRun}.
   * 
   * @param missionId             mission identifier
   * @param verdict               pass or fail
   * @param firstDivergenceIndex  -1 on pass; &ge; 0 on fail
   * @param divergenceLowerBound  -1 on pass; &ge; 0 and &le; {@code firstDivergenceIndex} on fail
   * @param recomputedDigest      digest of the recomputed prefix of the candidate
   * @param expectedDigest        the trusted digest (may be {@code null})
   * @param checkedEntryCount     number of candidate entries recomputed
   * @param uncoveredSuffixLength number of candidate entries past the last expected point
   * @param checkpointResults     per expected point, in index order
   */
  public VerificationReport(
      String missionId,
      Verdict verdict,
      long firstDivergenceIndex,
      long divergenceLowerBound,
      MissionDigest recomputedDigest,
      MissionDigest expectedDigest,
      long checkedEntryCount,
      long uncoveredSuffixLength,
      List<CheckpointResult> checkpointResults) {
    
    this.missionId = Objects.requireNonNull(missionId, "null missionId");
    this.verdict = Objects.requireNonNull(verdict, "null verdict");
    this.firstDivergenceIndex = firstDivergenceIndex;
    this.divergenceLowerBound = divergenceLowerBound;
    this.recomputedDigest = Objects.requireNonNull(recomputedDigest, "null recomputedDigest");
    this.expectedDigest = expectedDigest;
    this.checkedEntryCount = checkedEntryCount;
    this.uncoveredSuffixLength = uncoveredSuffixLength;
    this.checkpointResults = List.copyOf(checkpointResults);
    
    if (verdict.passed()) {
      if (firstDivergenceIndex != -1L || divergenceLowerBound != -1L)
        throw new IllegalArgumentException(
            "divergence indices set on PASS: %d, %d"
            .formatted(divergenceLowerBound, firstDivergenceIndex));
    } else if (divergenceLowerBound < 0L || firstDivergenceIndex < divergenceLowerBound)
      throw new IllegalArgumentException(
          "divergence range [%d, %d] on FAIL"
          .formatted(divergenceLowerBound, firstDivergenceIndex));
    if (checkedEntryCount < 0L || uncoveredSuffixLength < 0L)
      throw new IllegalArgumentException(
          "negative count: checked %d, uncovered %d"
          .formatted(checkedEntryCount, uncoveredSuffixLength));
  }
  
  
  public String missionId() {
    return missionId;
  }
  
  
  public Verdict verdict() {
    return verdict;
  }
  
  /** Shorthand for {@code verdict().passed()}. */
  public boolean passed() {
    return verdict.passed();
  }
  
  /** Returns {@code !passed()}. */
  public boolean failed() {
    return !verdict.passed();
  }
  
  
  /**
   * Returns the index of the first tampered entry. Present iff the verdict
   * is {@code FAIL}.
   */
  public Optional<Long> firstDivergenceIndex() {
    return firstDivergenceIndex == -1L ? Optional.empty() : Optional.of(firstDivergenceIndex);
  }
  
  
  /**
   * Returns the lowest index the first tampered entry can have: one past
   * the last matched expected point (or the verification base). Present iff
   * the verdict is {@code FAIL}.
   */
  public Optional<Long> divergenceLowerBound() {
    return divergenceLowerBound == -1L ? Optional.empty() : Optional.of(divergenceLowerBound);
  }
  
  
  /**
   * Returns the digest over the recomputed entries. On {@code PASS} this
   * covers the entire candidate log; on {@code FAIL} it covers the entries
   * up to where the run stopped.
   */
  public MissionDigest recomputedDigest() {
    return recomputedDigest;
  }
  
  
  public Optional<MissionDigest> expectedDigest() {
    return Optional.ofNullable(expectedDigest);
  }
  
  
  /** Number of candidate entries that were recomputed. */
  public long checkedEntryCount() {
    return checkedEntryCount;
  }
  
  
  /**
   * Number of candidate entries past the last expected point. These entries
   * were hashed, but nothing vouches for them.
   */
  public long uncoveredSuffixLength() {
    return uncoveredSuffixLength;
  }
  
  
  /** Per expected point results, in index order. */
  public List<CheckpointResult> checkpointResults() {
    return checkpointResults;
  }
  
  
  /** Returns the results that are not {@linkplain PointStatus#MATCHED MATCHED}. */
  public List<CheckpointResult> problems() {
    return checkpointResults.stream().filter(r -> !r.status().isOk()).toList();
  }
  
  
  @Override
  public String toString() {
    var s = new StringBuilder("VerificationReport[")
        .append(missionId).append(", ").append(verdict);
    if (failed())
      s.append(" at ").append(firstDivergenceIndex)
      .append(" (>= ").append(divergenceLowerBound).append(')');
    return s.append(", checked ").append(checkedEntryCount)
        .append(", uncovered ").append(uncoveredSuffixLength).append(']').toString();
  }

}
