/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.config;


import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.json.simple.JSONObject;

import io.crums.uavledger.Constants;
import io.crums.uavledger.HashAlgorithm;
import io.crums.uavledger.MissionSession;
import io.crums.uavledger.anchor.Anchor;
import io.crums.uavledger.chain.ChainBuilder;
import io.crums.uavledger.chain.CheckpointPlan;
import io.crums.uavledger.json.HashEncoding;
import io.crums.uavledger.json.JsonEntityParser;
import io.crums.uavledger.json.JsonParsingException;
import io.crums.uavledger.json.JsonUtils;
import io.crums.uavledger.json.MissionDigestParser;
import io.crums.uavledger.json.TrustedRecordParser;
import io.crums.uavledger.json.VerificationReportParser;
import io.crums.uavledger.verify.Verifier;

/**
 * Ledger settings. Example JSON (every member optional):
 * <pre>{@code
 *  {"algo": "sha256/1", "checkpoint_interval": 100,
 *   "hash_encoding": "hex", "text_entry_type": "LOG"}
 * }</pre>
 * 
 * @param algorithm           hashing scheme for new chains and verification
 * @param checkpointInterval  a checkpoint every so many entries (0 for none)
 * @param hashEncoding        how hashes are written in JSON
 * @param textEntryType       entry type assigned to lines of text logs
 */
public record LedgerConfig(
    HashAlgorithm algorithm, long checkpointInterval,
    HashEncoding hashEncoding, String textEntryType) {
  
  /** Default entry type for text log lines. */
  public final static String DEFAULT_TEXT_ENTRY_TYPE = "LOG";
  
  /** Default checkpoint interval. */
  public final static long DEFAULT_CHECKPOINT_INTERVAL = 100;
  
  /** Defaults. */
  public final static LedgerConfig DEFAULT = new LedgerConfig(
      Constants.DEFAULT_ALGORITHM, DEFAULT_CHECKPOINT_INTERVAL,
      HashEncoding.HEX, DEFAULT_TEXT_ENTRY_TYPE);
  
  public final static Parser PARSER = new Parser();
  
  
  public LedgerConfig {
    Objects.requireNonNull(algorithm, "null algorithm");
    Objects.requireNonNull(hashEncoding, "null hashEncoding");
    if (checkpointInterval < 0L)
      throw new IllegalArgumentException("checkpointInterval: " + checkpointInterval);
    textEntryType = textEntryType == null ? DEFAULT_TEXT_ENTRY_TYPE : textEntryType.trim();
    if (textEntryType.isEmpty())
      throw new IllegalArgumentException("blank textEntryType");
  }
  
  
  /**
   * Loads and returns the config from the given JSON file.
   * 
   * @throws JsonParsingException if malformed
   * @throws UncheckedIOException on I/O error
   */
  public static LedgerConfig load(File file) throws JsonParsingException, UncheckedIOException {
    return PARSER.toEntity(file);
  }
  
  
  /**
   * Loads and returns the config from the named class-path resource.
   * 
   * @param resource  absolute resource path (e.g. {@code "/uavledger.json"})
   * @throws JsonParsingException if malformed
   * @throws UncheckedIOException if not found, or on I/O error
   */
  public static LedgerConfig loadResource(String resource)
      throws JsonParsingException, UncheckedIOException {
    var in = LedgerConfig.class.getResourceAsStream(resource);
    if (in == null)
      throw new UncheckedIOException(
          new FileNotFoundException("resource not found: " + resource));
    try (var reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return PARSER.toEntity(reader);
    } catch (IOException iox) {
      throw new UncheckedIOException("on loading resource " + resource, iox);
    }
  }
  
  
  /** Returns a copy with the given algorithm. */
  public LedgerConfig algorithm(HashAlgorithm algo) {
    return new LedgerConfig(algo, checkpointInterval, hashEncoding, textEntryType);
  }
  
  /** Returns a copy with the given checkpoint interval. */
  public LedgerConfig checkpointInterval(long interval) {
    return new LedgerConfig(algorithm, interval, hashEncoding, textEntryType);
  }
  
  
  /** Returns the checkpoint schedule implied by the interval. */
  public CheckpointPlan checkpointPlan() {
    return checkpointInterval == 0L ? CheckpointPlan.NONE : CheckpointPlan.every(checkpointInterval);
  }
  
  
  /**
   * Opens a mission session with this config's algorithm and checkpoint plan.
   * 
   * @param missionId   mission identifier
   * @param anchor      optional (may be {@code null})
   */
  public MissionSession newSession(String missionId, Anchor anchor) {
    return new MissionSession(missionId, new ChainBuilder(algorithm), checkpointPlan(), anchor);
  }
  
  
  public Verifier newVerifier() {
    return new Verifier(algorithm);
  }
  
  public MissionDigestParser digestParser() {
    return new MissionDigestParser(hashEncoding);
  }
  
  public TrustedRecordParser trustedRecordParser() {
    return new TrustedRecordParser(hashEncoding);
  }
  
  public VerificationReportParser reportParser() {
    return new VerificationReportParser(hashEncoding);
  }
  
  
  
  public static class Parser implements JsonEntityParser<LedgerConfig> {
    
    public final static String ALGO = "algo";
    public final static String CHECKPOINT_INTERVAL = "checkpoint_interval";
    public final static String HASH_ENCODING = "hash_encoding";
    public final static String TEXT_ENTRY_TYPE = "text_entry_type";

    @Override
    public JSONObject injectEntity(LedgerConfig config, JSONObject jObj) {
      JsonUtils.put(jObj, ALGO, config.algorithm().id());
      JsonUtils.put(jObj, CHECKPOINT_INTERVAL, config.checkpointInterval());
      JsonUtils.put(jObj, HASH_ENCODING, config.hashEncoding().name().toLowerCase());
      JsonUtils.put(jObj, TEXT_ENTRY_TYPE, config.textEntryType());
      return jObj;
    }

    /** Missing members take their {@linkplain LedgerConfig#DEFAULT default} values. */
    @Override
    public LedgerConfig toEntity(JSONObject jObj) throws JsonParsingException {
      var algoId = JsonUtils.getString(jObj, ALGO, false);
      var algo = algoId == null ? DEFAULT.algorithm() : HashAlgorithm.forId(algoId);
      long interval =
          JsonUtils.getLong(jObj, CHECKPOINT_INTERVAL, DEFAULT.checkpointInterval());
      var encName = JsonUtils.getString(jObj, HASH_ENCODING, false);
      var encoding = encName == null ? DEFAULT.hashEncoding() : HashEncoding.forName(encName);
      var entryType = JsonUtils.getString(jObj, TEXT_ENTRY_TYPE, false);
      try {
        return new LedgerConfig(algo, interval, encoding, entryType);
      } catch (IllegalArgumentException iax) {
        throw new JsonParsingException(iax);
      }
    }
  }

}
