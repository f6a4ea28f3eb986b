/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger;


/**
 * Base exception in the <code>uavledger</code> modules. These signal
 * contract violations or incompatible inputs, never tampering: tampering
 * is reported as a failed
 * {@linkplain io.crums.uavledger.verify.VerificationReport VerificationReport}.
 */
@SuppressWarnings("serial")
public class UavLedgerException extends RuntimeException {

  public UavLedgerException(String message) {
    super(message);
  }

  public UavLedgerException(Throwable cause) {
    super(cause);
  }

  public UavLedgerException(String message, Throwable cause) {
    super(message, cause);
  }

  public UavLedgerException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
    super(message, cause, enableSuppression, writableStackTrace);
  }

}
