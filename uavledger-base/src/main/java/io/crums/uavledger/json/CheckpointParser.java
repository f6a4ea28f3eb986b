/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.json;


import java.util.Objects;

import org.json.simple.JSONObject;

import io.crums.uavledger.HashAlgorithm;
import io.crums.uavledger.chain.Checkpoint;

/**
 * {@code Checkpoint} JSON parser. Example:
 * <pre>{@code
 *  {"index": 99, "hash": "9f2c..", "timestamp": 1700000004000}
 * }</pre>
 * Checkpoints don't name their algorithm: instances are bound to one, so
 * that the hash width can be checked on parsing.
 */
public class CheckpointParser implements JsonEntityParser<Checkpoint> {
  
  public final static String INDEX = "index";
  public final static String HASH = "hash";
  public final static String TIMESTAMP = "timestamp";
  
  private final HashEncoding hashCodec;
  private final HashAlgorithm algo;
  
  
  public CheckpointParser(HashEncoding hashCodec, HashAlgorithm algo) {
    this.hashCodec = Objects.requireNonNull(hashCodec, "null hashCodec");
    this.algo = Objects.requireNonNull(algo, "null algo");
  }
  
  
  public HashEncoding hashEncoding() {
    return hashCodec;
  }
  
  public HashAlgorithm algorithm() {
    return algo;
  }
  

  @Override
  public JSONObject injectEntity(Checkpoint checkpoint, JSONObject jObj) {
    JsonUtils.put(jObj, INDEX, checkpoint.index());
    JsonUtils.put(jObj, HASH, hashCodec.encode(checkpoint.chainHash()));
    JsonUtils.put(jObj, TIMESTAMP, checkpoint.timestamp());
    return jObj;
  }
  

  @Override
  public Checkpoint toEntity(JSONObject jObj) throws JsonParsingException {
    long index = JsonUtils.getLong(jObj, INDEX);
    var hash = hashCodec.decodeHash(JsonUtils.getString(jObj, HASH, true), algo);
    long timestamp = JsonUtils.getLong(jObj, TIMESTAMP, 0L);
    try {
      return new Checkpoint(index, hash, timestamp);
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException("illegal checkpoint: " + iax.getMessage(), iax);
    }
  }

}
