/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger;


import java.util.Optional;

/**
 * Indicates a log entry (or a value destined for one) cannot be
 * canonicalized. Fatal to the construction or verification call it
 * occurs in; never a tamper finding.
 */
@SuppressWarnings("serial")
public class MalformedInputException extends UavLedgerException {
  
  private final long index;

  public MalformedInputException(String message) {
    this(message, -1L);
  }
  
  /**
   * @param message     the detail message
   * @param index       the offending entry's index, or -1 if not known
   */
  public MalformedInputException(String message, long index) {
    super(message);
    this.index = index;
  }

  public MalformedInputException(String message, Throwable cause) {
    super(message, cause);
    this.index = -1L;
  }
  
  /**
   * @param message     the detail message
   * @param index       the offending entry's index, or -1 if not known
   * @param cause       the underlying cause
   */
  public MalformedInputException(String message, long index, Throwable cause) {
    super(message, cause);
    this.index = index;
  }
  
  
  /** Returns the index of the offending entry, if known. */
  public Optional<Long> entryIndex() {
    return index < 0 ? Optional.empty() : Optional.of(index);
  }
  
  
  /**
   * Returns a copy of this exception with the given entry index attached.
   */
  public MalformedInputException atIndex(long entryIndex) {
    if (entryIndex == index)
      return this;
    return new MalformedInputException(
        "[" + entryIndex + "]: " + getMessage(), entryIndex, this);
  }

}
