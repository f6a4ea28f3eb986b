/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger;


import java.lang.System.Logger;

/**
 * Library constants.
 */
public class Constants {
  
  
  /**
   * Default hashing algorithm. Currently SHA-256 with canonical format
   * version 1.
   */
  public final static HashAlgorithm DEFAULT_ALGORITHM = HashAlgorithm.SHA256_V1;
  
  /**
   * Canonical encoding format version. This is the first byte of every
   * {@linkplain io.crums.uavledger.entry.CanonicalEntry CanonicalEntry}.
   * Bumping it requires new {@linkplain HashAlgorithm} ids.
   */
  public final static byte CANON_VERSION = 1;
  
  /**
   * Version number used in json.
   */
  public final static int VERSION = CANON_VERSION;
  
  /**
   * Used in json.
   */
  public final static String VERSION_TAG = "version";
  
  /**
   * JSON file extension (includes the dot).
   */
  public final static String JSON_EXT = ".json";
  
  
  /**
   * The module's logger name.
   * 
   * @see #getLogger()
   */
  public final static String LOGGER_NAME = "uavledger";
  
  
  /**
   * Returns the module logger.
   * 
   * @see #LOGGER_NAME
   */
  public static Logger getLogger() {
    return System.getLogger(LOGGER_NAME);
  }
  
  
  private Constants() {  }

}
