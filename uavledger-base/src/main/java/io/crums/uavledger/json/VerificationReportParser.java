/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.json;


import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Objects;
import java.util.Optional;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import io.crums.uavledger.HashAlgorithm;
import io.crums.uavledger.verify.CheckpointResult;
import io.crums.uavledger.verify.PointStatus;
import io.crums.uavledger.verify.Verdict;
import io.crums.uavledger.verify.VerificationReport;

/**
 * {@code VerificationReport} JSON parser. Example (a failure):
 * <pre>{@code
 *  {"mission_id": "M-17", "verdict": "FAIL",
 *   "first_divergence": 5, "lower_bound": 4,
 *   "checked": 8, "uncovered": 0,
 *   "recomputed": {..digest..},
 *   "expected": {..digest..},
 *   "points": [
 *     {"index": 3, "expected": "..", "recomputed": "..", "status": "MATCHED"},
 *     {"index": 7, "expected": "..", "recomputed": "..", "status": "MISMATCHED"}
 *   ]}
 * }</pre>
 * The divergence members are omitted on a pass, as is {@code expected}
 * when the report was made against checkpoints alone.
 */
public class VerificationReportParser implements JsonEntityParser<VerificationReport> {
  
  public final static String MISSION_ID = MissionDigestParser.MISSION_ID;
  public final static String VERDICT = "verdict";
  public final static String FIRST_DIVERGENCE = "first_divergence";
  public final static String LOWER_BOUND = "lower_bound";
  public final static String CHECKED = "checked";
  public final static String UNCOVERED = "uncovered";
  public final static String RECOMPUTED = "recomputed";
  public final static String EXPECTED = "expected";
  public final static String POINTS = "points";
  
  public final static String INDEX = "index";
  public final static String STATUS = "status";
  
  private final HashEncoding hashCodec;
  private final MissionDigestParser digestParser;
  
  
  public VerificationReportParser(HashEncoding hashCodec) {
    this.hashCodec = Objects.requireNonNull(hashCodec, "null hashCodec");
    this.digestParser = new MissionDigestParser(hashCodec);
  }
  

  @Override
  public JSONObject injectEntity(VerificationReport report, JSONObject jObj) {
    JsonUtils.put(jObj, MISSION_ID, report.missionId());
    JsonUtils.put(jObj, VERDICT, report.verdict().name());
    JsonUtils.addIfPresent(jObj, FIRST_DIVERGENCE, report.firstDivergenceIndex().orElse(null));
    JsonUtils.addIfPresent(jObj, LOWER_BOUND, report.divergenceLowerBound().orElse(null));
    JsonUtils.put(jObj, CHECKED, report.checkedEntryCount());
    JsonUtils.put(jObj, UNCOVERED, report.uncoveredSuffixLength());
    JsonUtils.put(jObj, RECOMPUTED, digestParser.toJsonObject(report.recomputedDigest()));
    report.expectedDigest().ifPresent(
        d -> JsonUtils.put(jObj, EXPECTED, digestParser.toJsonObject(d)));
    
    var jPoints = new JSONArray();
    for (var result : report.checkpointResults()) {
      var jPoint = new JSONObject();
      JsonUtils.put(jPoint, INDEX, result.index());
      JsonUtils.put(jPoint, EXPECTED, hashCodec.encode(result.expectedHash()));
      result.recomputedHash().ifPresent(
          h -> JsonUtils.put(jPoint, RECOMPUTED, hashCodec.encode(h)));
      JsonUtils.put(jPoint, STATUS, result.status().name());
      JsonUtils.add(jPoints, jPoint);
    }
    JsonUtils.put(jObj, POINTS, jPoints);
    return jObj;
  }
  

  @Override
  public VerificationReport toEntity(JSONObject jObj) throws JsonParsingException {
    String missionId = JsonUtils.getString(jObj, MISSION_ID, true);
    var verdict = toEnum(Verdict.class, JsonUtils.getString(jObj, VERDICT, true));
    long firstDivergence = JsonUtils.getLong(jObj, FIRST_DIVERGENCE, -1L);
    long lowerBound = JsonUtils.getLong(jObj, LOWER_BOUND, -1L);
    long checked = JsonUtils.getLong(jObj, CHECKED);
    long uncovered = JsonUtils.getLong(jObj, UNCOVERED);
    var recomputed = digestParser.toEntity(JsonUtils.getJsonObject(jObj, RECOMPUTED, true));
    var jExpected = JsonUtils.getJsonObject(jObj, EXPECTED, false);
    var expected = jExpected == null ? null : digestParser.toEntity(jExpected);
    
    var jPoints = JsonUtils.getJsonArray(jObj, POINTS, false);
    var results = new ArrayList<CheckpointResult>(jPoints == null ? 0 : jPoints.size());
    if (jPoints != null) {
      for (Object jPoint : jPoints) {
        if (!(jPoint instanceof JSONObject jPointObj))
          throw new JsonParsingException("expected JSON object in '" + POINTS + "': " + jPoint);
        results.add(toResult(jPointObj, recomputed.algorithm()));
      }
    }
    
    try {
      return new VerificationReport(
          missionId, verdict, firstDivergence, lowerBound,
          recomputed, expected, checked, uncovered, results);
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException("illegal verification report: " + iax.getMessage(), iax);
    }
  }
  
  
  private CheckpointResult toResult(JSONObject jPoint, HashAlgorithm algo) throws JsonParsingException {
    long index = JsonUtils.getLong(jPoint, INDEX);
    var expected = hashCodec.decodeHash(JsonUtils.getString(jPoint, EXPECTED, true), algo);
    var jRecomputed = JsonUtils.getString(jPoint, RECOMPUTED, false);
    var recomputed = jRecomputed == null ?
        Optional.<ByteBuffer>empty() :
          Optional.of(hashCodec.decodeHash(jRecomputed, algo));
    var status = toEnum(PointStatus.class, JsonUtils.getString(jPoint, STATUS, true));
    try {
      return new CheckpointResult(index, expected, recomputed, status);
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException("illegal point result: " + iax.getMessage(), iax);
    }
  }
  
  
  private static <E extends Enum<E>> E toEnum(Class<E> type, String name) throws JsonParsingException {
    try {
      return Enum.valueOf(type, name);
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException(
          "unknown " + type.getSimpleName() + " value: " + name, iax);
    }
  }

}
