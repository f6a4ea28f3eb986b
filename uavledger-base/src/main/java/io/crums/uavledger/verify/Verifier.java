/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.verify;


import java.time.Clock;
import java.util.List;
import java.util.Objects;

import io.crums.uavledger.AlgorithmMismatchException;
import io.crums.uavledger.Constants;
import io.crums.uavledger.HashAlgorithm;
import io.crums.uavledger.MalformedInputException;
import io.crums.uavledger.chain.Checkpoint;
import io.crums.uavledger.chain.MissionDigest;
import io.crums.uavledger.entry.LogEntry;

/**
 * Recomputes candidate logs and compares them against trusted records.
 * Tampering is reported as a {@linkplain Verdict#FAIL FAIL}
 * {@linkplain VerificationReport report}; exceptions are reserved for
 * inputs that cannot be verified at all.
 * 
 * <p>
 * Stateless (beyond its configuration) and safe to share across threads.
 * Each call works on its own {@linkplain VerificationRun}.
 * </p>
 */
public class Verifier {
  
  private final HashAlgorithm algo;
  private final Clock clock;
  
  
  /** Creates an instance using the default algorithm. */
  public Verifier() {
    this(Constants.DEFAULT_ALGORITHM);
  }
  
  
  public Verifier(HashAlgorithm algo) {
    this(algo, Clock.systemUTC());
  }
  
  /**
   * @param algo    the scheme candidates are recomputed with
   * @param clock   stamps recomputed digests
   */
  public Verifier(HashAlgorithm algo, Clock clock) {
    this.algo = Objects.requireNonNull(algo, "null algo");
    this.clock = Objects.requireNonNull(clock, "null clock");
  }
  
  
  public HashAlgorithm algorithm() {
    return algo;
  }
  
  
  /**
   * Verifies the candidate log against a mission digest.
   * 
   * @throws AlgorithmMismatchException if the digest names another scheme
   * @throws MalformedInputException if a candidate entry cannot be canonicalized
   */
  public VerificationReport verify(List<LogEntry> candidate, MissionDigest expected)
      throws AlgorithmMismatchException, MalformedInputException {
    return verify(candidate, TrustedRecord.of(expected));
  }
  
  
  /**
   * Verifies the candidate log against a checkpoint history. The checkpoints
   * are assumed computed under this instance's {@linkplain #algorithm()}.
   * 
   * @throws MalformedInputException if a candidate entry cannot be canonicalized
   */
  public VerificationReport verify(
      List<LogEntry> candidate, String missionId, List<Checkpoint> checkpoints)
          throws MalformedInputException {
    return verify(candidate, TrustedRecord.of(missionId, algo, checkpoints));
  }
  
  
  /**
   * Verifies the candidate log against the given trusted record.
   * 
   * @throws AlgorithmMismatchException if the record names another scheme
   * @throws MalformedInputException if a candidate entry cannot be canonicalized
   */
  public VerificationReport verify(List<LogEntry> candidate, TrustedRecord expected)
      throws AlgorithmMismatchException, MalformedInputException {
    return newRun(candidate, expected).runToEnd();
  }
  
  
  /**
   * Verifies a suffix of a log, starting just past a trusted checkpoint.
   * The result agrees with verifying the full log whenever the first
   * divergence lies after the checkpoint.
   * 
   * @param trusted     checkpoint known to be good
   * @param suffix      candidate entries following {@code trusted}
   * @param expected    trusted record (points at or before {@code trusted} are ignored)
   * 
   * @throws AlgorithmMismatchException if the record names another scheme
   * @throws MalformedInputException if a candidate entry cannot be canonicalized
   */
  public VerificationReport verifyFrom(
      Checkpoint trusted, List<LogEntry> suffix, TrustedRecord expected)
          throws AlgorithmMismatchException, MalformedInputException {
    return newRun(trusted, suffix, expected).runToEnd();
  }
  
  
  /**
   * Returns a new, un-started run. Use this for stepwise (cancellable)
   * verification.
   */
  public VerificationRun newRun(List<LogEntry> candidate, TrustedRecord expected)
      throws AlgorithmMismatchException {
    return new VerificationRun(candidate, expected, algo, clock);
  }
  
  
  /**
   * Returns a new, un-started run from a trusted checkpoint.
   * 
   * @see #verifyFrom(Checkpoint, List, TrustedRecord)
   */
  public VerificationRun newRun(Checkpoint trusted, List<LogEntry> suffix, TrustedRecord expected)
      throws AlgorithmMismatchException {
    return new VerificationRun(trusted, suffix, expected, algo, clock);
  }

}
