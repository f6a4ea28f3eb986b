/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.anchor;


import io.crums.uavledger.UavLedgerException;

/**
 * Failure reported by an {@linkplain Anchor}: the external ledger is
 * unreachable, or it refused the digest.
 */
@SuppressWarnings("serial")
public class AnchorException extends UavLedgerException {

  public AnchorException(String message) {
    super(message);
  }

  public AnchorException(Throwable cause) {
    super(cause);
  }

  public AnchorException(String message, Throwable cause) {
    super(message, cause);
  }

}
