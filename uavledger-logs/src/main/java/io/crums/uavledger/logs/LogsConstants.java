/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.logs;


import java.lang.System.Logger;

/**
 * Constants for the flight-log module.
 */
public class LogsConstants {
  
  private LogsConstants() {  }
  
  /** Logger name. */
  public final static String LOG_NAME = "uavledger.logs";
  
  /** File extensions recognized as JSON-lines logs. */
  public final static String[] JSON_LINES_EXTS = { ".jsonl", ".ndjson" };
  
  /** Entry field: 1-based line number in the source file. */
  public final static String LINE_NO = "line_no";
  /** Entry field: the line's text (sans line terminator). */
  public final static String TEXT = "text";
  /** Entry field: the line's tokens. */
  public final static String TOKENS = "tokens";
  
  
  public static Logger sysLogger() {
    return System.getLogger(LOG_NAME);
  }

}
