/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.verify;


/**
 * Status of an expected point (checkpoint or digest head) after a
 * verification run.
 */
public enum PointStatus {
  /** Recomputed chain hash equals the expected one. */
  MATCHED,
  /** Recomputed chain hash differs from the expected one. */
  MISMATCHED,
  /** The candidate log ends before this point's index. */
  MISSING,
  /** The run stopped (at an earlier divergence) before reaching this point. */
  UNCHECKED;
  
  public boolean isOk() {
    return this == MATCHED;
  }
}
