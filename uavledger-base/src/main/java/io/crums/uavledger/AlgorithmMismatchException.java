/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger;


/**
 * Indicates hashes computed under one {@linkplain HashAlgorithm} were about
 * to be compared with hashes computed under another (or under a scheme this
 * library does not support). This is a compatibility failure; it is never
 * downgraded to a tamper finding.
 */
@SuppressWarnings("serial")
public class AlgorithmMismatchException extends UavLedgerException {
  
  /**
   * Returns an instance for an id no supported algorithm carries.
   */
  public static AlgorithmMismatchException unsupported(String id) {
    return new AlgorithmMismatchException(
        "unsupported hash algorithm id: " + id, null, id);
  }
  
  
  private final String expectedId;
  private final String actualId;
  
  
  /**
   * @param expectedId  the algorithm id this side uses
   * @param actualId    the algorithm id the other side declares
   */
  public AlgorithmMismatchException(String expectedId, String actualId) {
    this(
        "hash algorithm mismatch: expected %s; actual %s"
        .formatted(expectedId, actualId),
        expectedId, actualId);
  }
  

  private AlgorithmMismatchException(String message, String expectedId, String actualId) {
    super(message);
    this.expectedId = expectedId;
    this.actualId = actualId;
  }
  
  
  /** Returns the expected id; {@code null} if the actual id is unsupported. */
  public String expectedId() {
    return expectedId;
  }
  
  /** Returns the declared (offending) id. */
  public String actualId() {
    return actualId;
  }

}
