/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.json;


import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import io.crums.uavledger.MalformedInputException;
import io.crums.uavledger.entry.FieldValue;
import io.crums.uavledger.entry.FieldValue.BoolValue;
import io.crums.uavledger.entry.FieldValue.BytesValue;
import io.crums.uavledger.entry.FieldValue.DecimalValue;
import io.crums.uavledger.entry.FieldValue.FloatValue;
import io.crums.uavledger.entry.FieldValue.ListValue;
import io.crums.uavledger.entry.FieldValue.LongValue;
import io.crums.uavledger.entry.FieldValue.StringValue;
import io.crums.uavledger.entry.FieldValue.StructValue;

/**
 * Maps {@linkplain FieldValue}s to and from {@code json-simple} values.
 * JSON's native types cover most kinds; the rest are written as
 * single-member objects with a {@code $}-prefixed tag:
 * <ul>
 * <li>{@code {"$bytes": "<url-safe base64>"}}</li>
 * <li>{@code {"$decimal": "12.50"}}</li>
 * <li>{@code {"$float": "NaN"}} (non-finite floats only)</li>
 * <li>{@code {"$struct": {..}}} (structs with {@code $}-prefixed names only)</li>
 * </ul>
 * Integral JSON numbers read as {@code LONG}; others as {@code FLOAT}.
 */
public class FieldValueCodec {
  
  public final static String BYTES_TAG = "$bytes";
  public final static String DECIMAL_TAG = "$decimal";
  public final static String FLOAT_TAG = "$float";
  public final static String STRUCT_TAG = "$struct";
  
  private FieldValueCodec() {  }
  
  
  /**
   * Returns the given value as a {@code json-simple} value: one of
   * {@code null}, {@code Boolean}, {@code Long}, {@code Double},
   * {@code String}, {@code JSONArray}, or {@code JSONObject}.
   */
  public static Object toJsonValue(FieldValue value) {
    switch (value.type()) {
    case NULL:    return null;
    case BOOL:    return ((BoolValue) value).value();
    case LONG:    return ((LongValue) value).value();
    case FLOAT: {
      double d = ((FloatValue) value).value();
      return Double.isFinite(d) ? (Object) d : tagged(FLOAT_TAG, Double.toString(d));
    }
    case DECIMAL:
      return tagged(DECIMAL_TAG, ((DecimalValue) value).value().toPlainString());
    case STRING:  return ((StringValue) value).value();
    case BYTES:
      return tagged(
          BYTES_TAG,
          Base64.getUrlEncoder().withoutPadding().encodeToString(((BytesValue) value).bytes()));
    case LIST: {
      var jArray = new JSONArray();
      for (var element : ((ListValue) value).values())
        JsonUtils.add(jArray, toJsonValue(element));
      return jArray;
    }
    case STRUCT:
      return toJsonObject((StructValue) value);
    default:
      throw new AssertionError("unhandled type: " + value.type());
    }
  }
  
  
  /**
   * Returns the given struct as a JSON object, wrapped in a
   * {@code $struct} object if any of its names start with {@code $}.
   */
  public static JSONObject toJsonObject(StructValue struct) {
    var jObj = new JSONObject();
    boolean reserved = false;
    for (var e : struct.fields().entrySet()) {
      reserved |= e.getKey().startsWith("$");
      JsonUtils.put(jObj, e.getKey(), toJsonValue(e.getValue()));
    }
    return reserved ? tagged(STRUCT_TAG, jObj) : jObj;
  }
  
  
  private static JSONObject tagged(String tag, Object value) {
    return JsonUtils.put(new JSONObject(), tag, value);
  }
  
  
  /**
   * Returns the given {@code json-simple} value as a field value.
   * 
   * @throws JsonParsingException if a {@code $}-tagged value is malformed,
   *         or the argument is not a JSON value
   */
  public static FieldValue toFieldValue(Object jValue) throws JsonParsingException {
    if (jValue == null)
      return FieldValue.NULL;
    if (jValue instanceof Boolean b)
      return b ? FieldValue.TRUE : FieldValue.FALSE;
    if (jValue instanceof Long lng)
      return new LongValue(lng);
    if (jValue instanceof Number n)
      return new FloatValue(n.doubleValue());
    if (jValue instanceof String s)
      return new StringValue(s);
    if (jValue instanceof JSONArray jArray) {
      var values = new ArrayList<FieldValue>(jArray.size());
      for (Object element : jArray)
        values.add(toFieldValue(element));
      return new ListValue(values);
    }
    if (jValue instanceof JSONObject jObj)
      return toTaggedOrStruct(jObj);
    throw new JsonParsingException("not a JSON value: " + jValue);
  }
  
  
  private static FieldValue toTaggedOrStruct(JSONObject jObj) throws JsonParsingException {
    if (jObj.size() == 1) {
      String key = jObj.keySet().iterator().next().toString();
      Object tagValue = jObj.get(key);
      try {
        switch (key) {
        case BYTES_TAG:
          return new BytesValue(Base64.getUrlDecoder().decode(tagString(key, tagValue)));
        case DECIMAL_TAG:
          return new DecimalValue(new BigDecimal(tagString(key, tagValue)));
        case FLOAT_TAG:
          return new FloatValue(Double.parseDouble(tagString(key, tagValue)));
        case STRUCT_TAG:
          if (tagValue instanceof JSONObject inner)
            return rawStruct(inner);
          throw new JsonParsingException("'" + STRUCT_TAG + "' expects a JSON object: " + tagValue);
        default:
          break;
        }
      } catch (IllegalArgumentException iax) {
        // NumberFormatException, too
        throw new JsonParsingException("malformed '" + key + "' value: " + tagValue, iax);
      }
    }
    return rawStruct(jObj);
  }
  
  
  private static String tagString(String tag, Object value) throws JsonParsingException {
    if (value instanceof String s)
      return s;
    throw new JsonParsingException("'" + tag + "' expects a string: " + value);
  }
  
  
  /**
   * Returns the given JSON object as a struct. This is the inverse of
   * {@linkplain #toJsonObject(StructValue)}.
   * 
   * @throws JsonParsingException if the object is a tagged non-struct value,
   *         a nested value is malformed, or names collide after normalization
   */
  public static StructValue toStruct(JSONObject jObj) throws JsonParsingException {
    var value = toTaggedOrStruct(jObj);
    if (value instanceof StructValue struct)
      return struct;
    throw new JsonParsingException("expected a struct; found " + value.type() + ": " + jObj);
  }
  
  
  private static StructValue rawStruct(JSONObject jObj) throws JsonParsingException {
    var fields = new HashMap<String, FieldValue>(Math.max(16, jObj.size() * 2));
    for (Object key : jObj.keySet())
      fields.put(key.toString(), toFieldValue(jObj.get(key)));
    try {
      return new StructValue(fields);
    } catch (MalformedInputException mix) {
      throw new JsonParsingException(mix.getMessage(), mix);
    }
  }

}
