/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.verify;


/**
 * Outcome of a verification run. A {@code FAIL} is the normal way tampering
 * is reported: it is never thrown.
 */
public enum Verdict {
  /** Every expected point matched. */
  PASS,
  /** Tamper detected. */
  FAIL;
  
  public boolean passed() {
    return this == PASS;
  }
}
