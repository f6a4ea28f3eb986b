/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.json;


import java.util.Objects;

import org.json.simple.JSONObject;

import io.crums.uavledger.HashAlgorithm;
import io.crums.uavledger.verify.TrustedRecord;

/**
 * {@code TrustedRecord} JSON parser. Example:
 * <pre>{@code
 *  {"mission_id": "M-17", "algo": "sha256/1",
 *   "checkpoints": [ {..}, .. ],
 *   "digest": {..}}
 * }</pre>
 * Both {@code checkpoints} and {@code digest} are optional.
 * 
 * @see CheckpointParser
 * @see MissionDigestParser
 */
public class TrustedRecordParser implements JsonEntityParser<TrustedRecord> {
  
  public final static String MISSION_ID = MissionDigestParser.MISSION_ID;
  public final static String ALGO = MissionDigestParser.ALGO;
  public final static String CHECKPOINTS = "checkpoints";
  public final static String DIGEST = "digest";
  
  private final HashEncoding hashCodec;
  private final MissionDigestParser digestParser;
  
  
  public TrustedRecordParser(HashEncoding hashCodec) {
    this.hashCodec = Objects.requireNonNull(hashCodec, "null hashCodec");
    this.digestParser = new MissionDigestParser(hashCodec);
  }
  

  @Override
  public JSONObject injectEntity(TrustedRecord record, JSONObject jObj) {
    JsonUtils.put(jObj, MISSION_ID, record.missionId());
    JsonUtils.put(jObj, ALGO, record.algorithm().id());
    var cpParser = new CheckpointParser(hashCodec, record.algorithm());
    JsonUtils.put(jObj, CHECKPOINTS, cpParser.toJsonArray(record.checkpoints()));
    record.digest().ifPresent(d -> JsonUtils.put(jObj, DIGEST, digestParser.toJsonObject(d)));
    return jObj;
  }
  

  @Override
  public TrustedRecord toEntity(JSONObject jObj) throws JsonParsingException {
    String missionId = JsonUtils.getString(jObj, MISSION_ID, true);
    var algo = HashAlgorithm.forId(JsonUtils.getString(jObj, ALGO, true));
    var cpParser = new CheckpointParser(hashCodec, algo);
    var checkpoints = cpParser.toEntityList(JsonUtils.getJsonArray(jObj, CHECKPOINTS, false));
    var jDigest = JsonUtils.getJsonObject(jObj, DIGEST, false);
    try {
      var record = TrustedRecord.of(missionId, algo, checkpoints);
      return jDigest == null ? record : record.withDigest(digestParser.toEntity(jDigest));
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException("illegal trusted record: " + iax.getMessage(), iax);
    }
  }

}
