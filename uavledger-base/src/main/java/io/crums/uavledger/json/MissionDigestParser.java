/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.json;


import java.util.Objects;

import org.json.simple.JSONObject;

import io.crums.uavledger.HashAlgorithm;
import io.crums.uavledger.chain.MissionDigest;

/**
 * {@code MissionDigest} JSON parser. Example:
 * <pre>{@code
 *  {"mission_id": "M-17", "algo": "sha256/1", "final_hash": "..",
 *   "entry_count": 1200, "created_at": 1700000009000, "hash": ".."}
 * }</pre>
 * The {@code hash} member is derived. It is written for the benefit of
 * readers; on parsing, if present, it must agree with the other members.
 */
public class MissionDigestParser implements JsonEntityParser<MissionDigest> {
  
  public final static String MISSION_ID = "mission_id";
  public final static String ALGO = "algo";
  public final static String FINAL_HASH = "final_hash";
  public final static String ENTRY_COUNT = "entry_count";
  public final static String CREATED_AT = "created_at";
  public final static String HASH = "hash";
  
  private final HashEncoding hashCodec;
  
  
  public MissionDigestParser(HashEncoding hashCodec) {
    this.hashCodec = Objects.requireNonNull(hashCodec, "null hashCodec");
  }
  

  @Override
  public JSONObject injectEntity(MissionDigest digest, JSONObject jObj) {
    JsonUtils.put(jObj, MISSION_ID, digest.missionId());
    JsonUtils.put(jObj, ALGO, digest.algorithm().id());
    JsonUtils.put(jObj, FINAL_HASH, hashCodec.encode(digest.finalChainHash()));
    JsonUtils.put(jObj, ENTRY_COUNT, digest.entryCount());
    JsonUtils.put(jObj, CREATED_AT, digest.createdAt());
    JsonUtils.put(jObj, HASH, hashCodec.encode(digest.hash()));
    return jObj;
  }
  

  /**
   * {@inheritDoc}
   * 
   * @throws io.crums.uavledger.AlgorithmMismatchException if the algorithm
   *         id is not supported
   */
  @Override
  public MissionDigest toEntity(JSONObject jObj) throws JsonParsingException {
    String missionId = JsonUtils.getString(jObj, MISSION_ID, true);
    var algo = HashAlgorithm.forId(JsonUtils.getString(jObj, ALGO, true));
    var finalHash = hashCodec.decodeHash(JsonUtils.getString(jObj, FINAL_HASH, true), algo);
    long count = JsonUtils.getLong(jObj, ENTRY_COUNT);
    long createdAt = JsonUtils.getLong(jObj, CREATED_AT, 0L);
    
    MissionDigest digest;
    try {
      digest = new MissionDigest(missionId, algo, finalHash, count, createdAt);
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException("illegal mission digest: " + iax.getMessage(), iax);
    }
    
    var hash = JsonUtils.getString(jObj, HASH, false);
    if (hash != null && !digest.hash().equals(hashCodec.decodeHash(hash, algo)))
      throw new JsonParsingException(
          "'" + HASH + "' does not match the other members of mission digest " + missionId);
    return digest;
  }

}
