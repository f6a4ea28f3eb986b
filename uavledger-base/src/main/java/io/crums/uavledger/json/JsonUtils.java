/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.json;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Typed getters over {@code json-simple}'s raw maps.
 */
public class JsonUtils {

  private JsonUtils() {  }
  
  
  public static String getString(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected '" + name + "' missing");
      return null;
    }
    if (!(value instanceof String))
      throw new JsonParsingException("'" + name + "' expects a simple string: " + value);
    return value.toString();
  }
  
  
  public static Number getNumber(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected numeral '" + name + "' missing");
      return null;
    }
    try {
      return (Number) value;
    } catch (ClassCastException ccx) {
      throw new JsonParsingException("'" + name + "' expects a numeral: " + value, ccx);
    }
  }
  
  
  /**
   * Returns the required, integral value.
   * 
   * @throws JsonParsingException if missing, or not an integer
   */
  public static long getLong(JSONObject jObj, String name) throws JsonParsingException {
    var n = getNumber(jObj, name, true);
    if (n instanceof Long lng)
      return lng;
    throw new JsonParsingException("'" + name + "' expects an integer: " + n);
  }
  
  
  /**
   * Returns the integral value, or the given default if missing.
   */
  public static long getLong(JSONObject jObj, String name, long defaultValue) throws JsonParsingException {
    return jObj.get(name) == null ? defaultValue : getLong(jObj, name);
  }
  
  
  public static JSONArray getJsonArray(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected JSON array '" + name + "' missing");
      return null;
    }
    try {
      return (JSONArray) value;
    } catch (ClassCastException ccx) {
      throw new JsonParsingException("'" + name + "' expects a JSON array: " + value, ccx);
    }
  }
  
  
  public static JSONObject getJsonObject(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected JSON object '" + name + "' missing");
      return null;
    }
    try {
      return (JSONObject) value;
    } catch (ClassCastException ccx) {
      throw new JsonParsingException("'" + name + "' expects a JSON object: " + value, ccx);
    }
  }
  
  
  
  @SuppressWarnings("unchecked")
  public static boolean addIfPresent(JSONObject jObj, String name, Object value) {
    if (value == null)
      return false;
    jObj.put(name, value);
    return true;
  }
  
  
  /** Typed {@code put}; {@code json-simple}'s maps are raw. */
  @SuppressWarnings("unchecked")
  public static JSONObject put(JSONObject jObj, String name, Object value) {
    jObj.put(name, value);
    return jObj;
  }
  
  
  /** Typed {@code add}; {@code json-simple}'s lists are raw. */
  @SuppressWarnings("unchecked")
  public static JSONArray add(JSONArray jArray, Object value) {
    jArray.add(value);
    return jArray;
  }

}
