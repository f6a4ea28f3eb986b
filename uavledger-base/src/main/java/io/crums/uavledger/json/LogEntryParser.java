/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.json;


import org.json.simple.JSONObject;

import io.crums.uavledger.entry.FieldValue.StructValue;
import io.crums.uavledger.entry.LogEntry;

/**
 * {@code LogEntry} JSON parser. Example:
 * <pre>{@code
 *  {"index": 3, "timestamp": 1700000000123, "type": "GPS",
 *   "fields": {"lat": 47.39, "lon": 8.54, "fix": true}}
 * }</pre>
 * The {@code fields} member may be omitted (for an entry with no fields).
 * Stateless.
 */
public class LogEntryParser implements JsonEntityParser<LogEntry> {
  
  /** Stateless instance. */
  public final static LogEntryParser INSTANCE = new LogEntryParser();
  
  public final static String INDEX = "index";
  public final static String TIMESTAMP = "timestamp";
  public final static String TYPE = "type";
  public final static String FIELDS = "fields";
  

  @Override
  public JSONObject injectEntity(LogEntry entry, JSONObject jObj) {
    JsonUtils.put(jObj, INDEX, entry.index());
    JsonUtils.put(jObj, TIMESTAMP, entry.timestamp());
    JsonUtils.put(jObj, TYPE, entry.type());
    JsonUtils.put(jObj, FIELDS, FieldValueCodec.toJsonObject(entry.fields()));
    return jObj;
  }

  
  @Override
  public LogEntry toEntity(JSONObject jObj) throws JsonParsingException {
    long index = JsonUtils.getLong(jObj, INDEX);
    long timestamp = JsonUtils.getLong(jObj, TIMESTAMP);
    String type = JsonUtils.getString(jObj, TYPE, true);
    var jFields = JsonUtils.getJsonObject(jObj, FIELDS, false);
    var fields = jFields == null ?
        StructValue.EMPTY :
          FieldValueCodec.toStruct(jFields);
    try {
      return new LogEntry(index, timestamp, type, fields);
    } catch (IllegalArgumentException iax) {
      throw new JsonParsingException("illegal log entry: " + iax.getMessage(), iax);
    }
  }

}
