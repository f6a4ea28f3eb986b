/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger;


/**
 * Indicates an entry was appended out of order, or with a gap in its
 * index, or that an entry count disagrees with a chain's length. These
 * are producer-side bugs, not evidence of tampering.
 */
@SuppressWarnings("serial")
public class SequenceException extends UavLedgerException {

  public SequenceException(String message) {
    super(message);
  }

  public SequenceException(String message, Throwable cause) {
    super(message, cause);
  }

}
