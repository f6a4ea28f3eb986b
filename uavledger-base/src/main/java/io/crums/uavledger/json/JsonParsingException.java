/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.json;


import io.crums.uavledger.UavLedgerException;

/**
 * Unchecked exception for illegal JSON input.
 */
@SuppressWarnings("serial")
public class JsonParsingException extends UavLedgerException {

  public JsonParsingException(String s) {
    super(s);
  }

  public JsonParsingException(Throwable cause) {
    super(cause);
  }

  public JsonParsingException(String message, Throwable cause) {
    super(message, cause);
  }

}
