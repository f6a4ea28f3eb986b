/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.json;


import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import io.crums.uavledger.AlgorithmMismatchException;
import io.crums.uavledger.FlightLogFixtures;
import io.crums.uavledger.HashAlgorithm;
import io.crums.uavledger.chain.ChainBuilder;
import io.crums.uavledger.chain.MissionDigest;

/**
 * 
 */
public class MissionDigestParserTest {
  
  
  private static MissionDigest sampleDigest(HashAlgorithm algo) {
    var builder = new ChainBuilder(algo, FlightLogFixtures.CLOCK);
    builder.appendAll(FlightLogFixtures.sampleLog(7));
    return builder.digest("M-17");
  }
  

  @Test
  public void testRoundTrip() {
    for (var algo : HashAlgorithm.values()) {
      var digest = sampleDigest(algo);
      for (var enc : HashEncoding.values()) {
        var parser = new MissionDigestParser(enc);
        var json = parser.toJson(digest);
        var out = parser.toEntity(json);
        assertEquals(digest, out, json);
        assertEquals(7L, out.entryCount());
        assertEquals(algo, out.algorithm());
      }
    }
  }
  
  
  @Test
  public void testHashIsOptional() {
    var parser = new MissionDigestParser(HashEncoding.HEX);
    var digest = sampleDigest(HashAlgorithm.SHA256_V1);
    var jObj = parser.toJsonObject(digest);
    jObj.remove(MissionDigestParser.HASH);
    assertEquals(digest, parser.toEntity(jObj));
  }
  
  
  @Test
  public void testHashMismatch() {
    var parser = new MissionDigestParser(HashEncoding.HEX);
    var jObj = parser.toJsonObject(sampleDigest(HashAlgorithm.SHA256_V1));
    // claim one more entry than the hash commits to
    JsonUtils.put(jObj, MissionDigestParser.ENTRY_COUNT, 8L);
    assertThrows(JsonParsingException.class, () -> parser.toEntity(jObj));
  }
  
  
  @Test
  public void testUnknownAlgorithm() {
    var parser = new MissionDigestParser(HashEncoding.HEX);
    var jObj = parser.toJsonObject(sampleDigest(HashAlgorithm.SHA256_V1));
    JsonUtils.put(jObj, MissionDigestParser.ALGO, "md5/1");
    assertThrows(AlgorithmMismatchException.class, () -> parser.toEntity(jObj));
  }
  
  
  @Test
  public void testWrongEncoding() {
    var jObj = new MissionDigestParser(HashEncoding.HEX)
        .toJsonObject(sampleDigest(HashAlgorithm.SHA256_V1));
    var b64 = new MissionDigestParser(HashEncoding.BASE64);
    // 64 hex chars decode to 48 bytes in base64
    assertThrows(JsonParsingException.class, () -> b64.toEntity(jObj));
  }

}
