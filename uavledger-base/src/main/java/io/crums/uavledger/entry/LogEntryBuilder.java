/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.entry;


import java.util.HashMap;
import java.util.Map;

import io.crums.uavledger.MalformedInputException;
import io.crums.uavledger.entry.FieldValue.StructValue;

/**
 * Builder for {@linkplain LogEntry}s. Fields may be set in any order;
 * the built entry does not remember it. Not thread-safe.
 * 
 * <h2>Permitted Value Types</h2>
 * <p>
 * See {@linkplain FieldValue#of(Object)}. A {@code null} value sets an
 * explicit null, which is different from not setting the field at all.
 * </p>
 */
public class LogEntryBuilder {
  
  private long index;
  private long timestamp;
  private String type;
  private final Map<String, FieldValue> fields = new HashMap<>();
  
  
  /**
   * @param index       the entry's sequence index (&ge; 0)
   */
  public LogEntryBuilder(long index) {
    index(index);
  }
  
  
  LogEntryBuilder(LogEntry proto) {
    this.index = proto.index();
    this.timestamp = proto.timestamp();
    this.type = proto.type();
    this.fields.putAll(proto.fields().fields());
  }
  
  
  public LogEntryBuilder index(long index) {
    if (index < 0L)
      throw new IllegalArgumentException("negative index: " + index);
    this.index = index;
    return this;
  }
  
  /** Sets the timestamp in UTC millis. */
  public LogEntryBuilder timestamp(long utcMillis) {
    this.timestamp = utcMillis;
    return this;
  }
  
  public LogEntryBuilder type(String type) {
    this.type = type;
    return this;
  }
  
  
  /**
   * Sets the named field.
   * 
   * @param value       a supported type, or {@code null} (explicit null)
   * @throws MalformedInputException if the value type is not supported
   */
  public LogEntryBuilder put(String name, Object value) throws MalformedInputException {
    if (name == null)
      throw new MalformedInputException("null field name", index);
    try {
      fields.put(name, FieldValue.of(value));
    } catch (MalformedInputException mix) {
      throw mix.atIndex(index);
    }
    return this;
  }
  
  
  /**
   * Removes the named field (if it was set).
   */
  public LogEntryBuilder remove(String name) {
    fields.remove(name);
    return this;
  }
  
  
  /**
   * Builds and returns the entry.
   * 
   * @throws IllegalStateException if the type is not set
   * @throws MalformedInputException if field names collide after normalization
   */
  public LogEntry build() throws IllegalStateException, MalformedInputException {
    if (type == null)
      throw new IllegalStateException("type not set at index " + index);
    try {
      return new LogEntry(index, timestamp, type, new StructValue(fields));
    } catch (MalformedInputException mix) {
      throw mix.atIndex(index);
    }
  }

}
