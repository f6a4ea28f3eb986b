/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.json;


import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.junit.jupiter.api.Test;

import io.crums.uavledger.entry.FieldType;
import io.crums.uavledger.entry.FieldValue;
import io.crums.uavledger.entry.FieldValue.StructValue;

/**
 * 
 */
public class FieldValueCodecTest {
  
  
  private static StructValue reparse(StructValue struct) throws Exception {
    String json = FieldValueCodec.toJsonObject(struct).toJSONString();
    return FieldValueCodec.toStruct((JSONObject) new JSONParser().parse(json));
  }
  
  
  @Test
  public void testNativeTypes() throws Exception {
    var map = new LinkedHashMap<String, Object>();
    map.put("alt", 120L);
    map.put("lat", 47.3769);
    map.put("fix", true);
    map.put("mode", "LOITER");
    map.put("note", null);
    map.put("cells", List.of(3.7, 3.69));
    map.put("gps", Map.of("sats", 11, "hdop", 0.8));
    var struct = StructValue.of(map);
    
    var out = reparse(struct);
    assertEquals(struct, out);
    assertEquals(FieldType.LONG, out.get("alt").get().type());
    assertEquals(FieldType.NULL, out.get("note").get().type());
  }
  
  
  @Test
  public void testIntegralFloat() throws Exception {
    // 2.0 is written "2.0", so it stays a float
    var struct = StructValue.of(Map.of("pitch", 2.0));
    assertEquals(FieldType.FLOAT, reparse(struct).get("pitch").get().type());
  }
  
  
  @Test
  public void testTaggedTypes() throws Exception {
    var struct = StructValue.of(Map.of(
        "volts", new BigDecimal("22.20"),
        "blob", new byte[] { 1, 2, -1 },
        "drift", Double.NaN,
        "floor", Double.NEGATIVE_INFINITY));
    
    var jObj = FieldValueCodec.toJsonObject(struct);
    var volts = (JSONObject) jObj.get("volts");
    assertEquals("22.2", volts.get(FieldValueCodec.DECIMAL_TAG));
    assertTrue(((JSONObject) jObj.get("blob")).containsKey(FieldValueCodec.BYTES_TAG));
    assertEquals("NaN", ((JSONObject) jObj.get("drift")).get(FieldValueCodec.FLOAT_TAG));
    
    assertEquals(struct, reparse(struct));
  }
  
  
  @Test
  public void testReservedNames() throws Exception {
    var struct = StructValue.of(Map.of("$bytes", "not really"));
    var jObj = FieldValueCodec.toJsonObject(struct);
    assertEquals(1, jObj.size());
    assertTrue(jObj.containsKey(FieldValueCodec.STRUCT_TAG));
    
    var out = reparse(struct);
    assertEquals(struct, out);
    assertEquals(FieldType.STRING, out.get("$bytes").get().type());
  }
  
  
  @Test
  public void testUnknownTagIsStruct() throws Exception {
    var jObj = (JSONObject) new JSONParser().parse("{\"$other\": 5}");
    var value = FieldValueCodec.toFieldValue(jObj);
    assertEquals(FieldType.STRUCT, value.type());
  }
  
  
  @Test
  public void testTaggedValueIsNotStruct() throws Exception {
    var jObj = (JSONObject) new JSONParser().parse("{\"$decimal\": \"1.5\"}");
    assertEquals(FieldType.DECIMAL, FieldValueCodec.toFieldValue(jObj).type());
    assertThrows(JsonParsingException.class, () -> FieldValueCodec.toStruct(jObj));
  }
  
  
  @Test
  public void testMalformedTags() throws Exception {
    var parser = new JSONParser();
    for (var json : List.of(
        "{\"$decimal\": \"1.5x\"}",
        "{\"$decimal\": 1.5}",
        "{\"$bytes\": \"*\"}",
        "{\"$float\": \"fast\"}",
        "{\"$struct\": 3}")) {
      var jObj = parser.parse(json);
      assertThrows(JsonParsingException.class, () -> FieldValueCodec.toFieldValue(jObj), json);
    }
  }
  
  
  @Test
  public void testNotJsonValue() {
    assertThrows(JsonParsingException.class, () -> FieldValueCodec.toFieldValue(new Object()));
    assertEquals(FieldValue.NULL, assertDoesNotThrow(() -> FieldValueCodec.toFieldValue(null)));
  }

}
