/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.verify;


/**
 * States of a {@linkplain VerificationRun}.
 * <pre>
 *  START -> RECOMPUTING -> MATCHED -> RECOMPUTING ..
 *                       -> DIVERGED -> DONE
 * </pre>
 * Any state but {@code DIVERGED} moves to {@code DONE} once the candidate
 * log is exhausted.
 */
public enum RunState {
  START,
  /** Last step recomputed a link with no expected point at its index. */
  RECOMPUTING,
  /** Last step recomputed a link that matched its expected point. */
  MATCHED,
  /** Last step found the first divergence. Terminal finding. */
  DIVERGED,
  /** The report is ready. */
  DONE;
  
  public boolean isDone() {
    return this == DONE;
  }
}
