/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.verify;


import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.crums.uavledger.AlgorithmMismatchException;
import io.crums.uavledger.Constants;
import io.crums.uavledger.HashAlgorithm;
import io.crums.uavledger.MalformedInputException;
import io.crums.uavledger.chain.ChainBuilder;
import io.crums.uavledger.chain.Checkpoint;
import io.crums.uavledger.chain.MissionDigests;
import io.crums.uavledger.entry.Canonicalizer;
import io.crums.uavledger.entry.EntryHasher;
import io.crums.uavledger.entry.LogEntry;

/**
 * A resumable verification of a candidate log against a
 * {@linkplain TrustedRecord}. Each {@linkplain #step()} recomputes at most
 * one link; the run stops at the first divergence. A caller wanting
 * cancellation simply stops stepping.
 * 
 * <h2>Positional Recomputation</h2>
 * <p>
 * The entry at position {@code p} in the candidate (offset by the run's
 * base index) is hashed <em>as</em> the link at index {@code p}: its
 * declared index is canonicalized along with the rest of its content, but
 * does not pick its position. Positions where the declared index
 * disagrees with the position are remembered (as <em>drift</em>) and used
 * to localize a divergence between sparse checkpoints.
 * </p>
 * <p>
 * Not thread-safe.
 * </p>
 * 
 * @see Verifier
 */
public class VerificationRun {
  
  private final static System.Logger LOG = Constants.getLogger();
  
  private final HashAlgorithm algo;
  private final Clock clock;
  private final List<LogEntry> candidate;
  private final TrustedRecord expected;
  private final long baseIndex;
  private final EntryHasher hasher;
  private final MessageDigest digest;
  
  /** Expected points at or after {@code baseIndex}. */
  private final List<Checkpoint> points;
  private final List<CheckpointResult> results;
  
  private RunState state = RunState.START;
  
  /** Next candidate position (relative to {@code baseIndex}). */
  private int cursor;
  private ByteBuffer headHash;
  private int nextPoint;
  
  private long lastMatched;
  /** Where the first drift after {@code lastMatched} originates; -1 if none. */
  private long firstDrift = -1L;
  private long divergence = -1L;
  private VerificationReport report;
  
  
  /**
   * Creates a run from the beginning of the chain.
   * 
   * @param candidate   the log to verify (entries in position order)
   * @param expected    what to verify against
   * @param algo        the scheme to recompute with
   * @param clock       stamps the recomputed digest
   * 
   * @throws AlgorithmMismatchException if {@code expected} was computed under another scheme
   */
  public VerificationRun(
      List<LogEntry> candidate, TrustedRecord expected, HashAlgorithm algo, Clock clock)
          throws AlgorithmMismatchException {
    this(candidate, expected, algo, clock, 0L, algo.genesisHash());
  }
  
  
  /**
   * Creates a run that starts just past a trusted checkpoint. Expected
   * points at or before the checkpoint are ignored.
   * 
   * @param trusted     the checkpoint the suffix continues from
   * @param suffix      the candidate entries following {@code trusted}
   * @param expected    what to verify against
   * @param algo        the scheme to recompute with
   * @param clock       stamps the recomputed digest
   * 
   * @throws AlgorithmMismatchException if {@code expected} was computed under another scheme
   */
  public VerificationRun(
      Checkpoint trusted, List<LogEntry> suffix, TrustedRecord expected,
      HashAlgorithm algo, Clock clock)
          throws AlgorithmMismatchException {
    this(suffix, expected, algo, clock, trusted.index() + 1, trusted.chainHash());
    if (trusted.chainHash().remaining() != algo.hashWidth())
      throw new IllegalArgumentException(
          "trusted checkpoint hash width does not match %s: %s".formatted(algo.id(), trusted));
  }
  
  
  private VerificationRun(
      List<LogEntry> candidate, TrustedRecord expected, HashAlgorithm algo, Clock clock,
      long baseIndex, ByteBuffer baseHash) {
    
    this.algo = Objects.requireNonNull(algo, "null algo");
    this.clock = Objects.requireNonNull(clock, "null clock");
    this.candidate = Objects.requireNonNull(candidate, "null candidate");
    this.expected = Objects.requireNonNull(expected, "null expected");
    algo.checkSame(expected.algorithm());
    
    this.baseIndex = baseIndex;
    this.headHash = baseHash.asReadOnlyBuffer();
    this.lastMatched = baseIndex - 1;
    this.hasher = new EntryHasher(algo);
    this.digest = algo.newDigest();
    this.points = expected.expectedPoints().stream().filter(cp -> cp.index() >= baseIndex).toList();
    this.results = new ArrayList<>(points.size());
  }
  
  
  /** Returns the current state. */
  public RunState state() {
    return state;
  }
  
  /** Returns {@code true} iff the report is ready. */
  public boolean isDone() {
    return state.isDone();
  }
  
  /** Returns the index of the next link to be recomputed. */
  public long position() {
    return baseIndex + cursor;
  }
  
  /** Returns the trusted record this run verifies against. */
  public TrustedRecord expected() {
    return expected;
  }
  
  
  /**
   * Advances the run by one transition and returns the new state.
   * Idempotent once {@linkplain RunState#DONE DONE}.
   * 
   * @throws MalformedInputException if the next candidate entry cannot be
   *         canonicalized (the run is left in its current state)
   */
  public RunState step() throws MalformedInputException {
    switch (state) {
    case DONE:
      break;
    case DIVERGED:
      finish(Verdict.FAIL);
      break;
    default:
      if (cursor == candidate.size())
        endOfCandidate();
      else
        recomputeNext();
    }
    return state;
  }
  
  
  /**
   * Steps until done and returns the report.
   * 
   * @throws MalformedInputException if a candidate entry cannot be canonicalized
   */
  public VerificationReport runToEnd() throws MalformedInputException {
    while (!isDone())
      step();
    return report;
  }
  
  
  /**
   * Returns the report, once {@linkplain #isDone() done}.
   * 
   * @throws IllegalStateException if not done
   */
  public VerificationReport report() throws IllegalStateException {
    if (report == null)
      throw new IllegalStateException("run not done: " + state);
    return report;
  }
  
  
  private void recomputeNext() throws MalformedInputException {
    final long index = position();
    var entry = candidate.get(cursor);
    if (entry == null)
      throw new MalformedInputException("null entry at position " + index, index);
    
    var entryHash = hasher.hash(Canonicalizer.canonicalize(entry), digest);
    var link = ChainBuilder.linkAt(index, entryHash, headHash, digest);
    
    if (entry.index() != index && firstDrift == -1L)
      firstDrift = driftOrigin(entry.index(), index);
    
    headHash = link.chainHash();
    ++cursor;
    
    if (nextPoint < points.size() && points.get(nextPoint).index() == index) {
      var cp = points.get(nextPoint++);
      if (cp.matches(link)) {
        results.add(new CheckpointResult(
            index, cp.chainHash(), Optional.of(link.chainHash()), PointStatus.MATCHED));
        lastMatched = index;
        firstDrift = -1L;
        state = RunState.MATCHED;
      } else {
        results.add(new CheckpointResult(
            index, cp.chainHash(), Optional.of(link.chainHash()), PointStatus.MISMATCHED));
        divergence = firstDrift == -1L ? index : firstDrift;
        state = RunState.DIVERGED;
      }
    } else
      state = RunState.RECOMPUTING;
  }
  
  
  /**
   * Returns the index a drift first observed at {@code index} points to.
   * A backward drift whose successor follows on from it marks a displaced
   * entry: something was inserted at its declared index (but never below
   * {@code lastMatched + 1}). Any other drift points to its position.
   */
  private long driftOrigin(long declared, long index) {
    if (declared > index)
      return index;
    int next = cursor + 1;
    if (next == candidate.size() || candidate.get(next) == null)
      return index;
    if (candidate.get(next).index() != declared + 1)
      return index;
    return Math.max(declared, lastMatched + 1);
  }
  
  
  private void endOfCandidate() {
    if (nextPoint == points.size()) {
      finish(Verdict.PASS);
      return;
    }
    // truncated: the first missing index, unless an earlier drift explains it
    divergence = firstDrift == -1L ? position() : firstDrift;
    finish(Verdict.FAIL);
  }
  
  
  private void finish(Verdict verdict) {
    // points past a divergence are unchecked, even if the candidate ends there
    PointStatus unreached =
        state == RunState.DIVERGED ? PointStatus.UNCHECKED : PointStatus.MISSING;
    while (nextPoint < points.size()) {
      var cp = points.get(nextPoint++);
      results.add(new CheckpointResult(cp.index(), cp.chainHash(), Optional.empty(), unreached));
    }
    
    final long checkedEnd = position();
    final long candidateEnd = baseIndex + candidate.size();
    final long coveredEnd = Math.max(expected.expectedLength(), baseIndex);
    final long uncovered = Math.max(0L, candidateEnd - coveredEnd);
    
    var recomputed = new MissionDigests(algo, clock)
        .finalizeHead(expected.missionId(), headHash, checkedEnd);
    
    final boolean pass = verdict.passed();
    report = new VerificationReport(
        expected.missionId(),
        verdict,
        pass ? -1L : divergence,
        pass ? -1L : lastMatched + 1,
        recomputed,
        expected.digest().orElse(null),
        cursor,
        uncovered,
        results);
    
    state = RunState.DONE;
    
    if (pass)
      LOG.log(Level.DEBUG, "mission {0} verified: {1} entries, {2} uncovered",
          expected.missionId(), checkedEnd, uncovered);
    else
      LOG.log(Level.INFO, "mission {0} diverges at index {1} (not before {2})",
          expected.missionId(), divergence, lastMatched + 1);
  }

}
