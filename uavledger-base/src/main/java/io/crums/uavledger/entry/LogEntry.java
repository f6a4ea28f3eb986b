/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.entry;


import java.text.Normalizer;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.crums.uavledger.MalformedInputException;
import io.crums.uavledger.entry.FieldValue.StructValue;

/**
 * One mission event or telemetry sample. Immutable.
 * 
 * @param index       the explicit sequence index (&ge; 0). This is the ordering
 *                    key; storage order is never trusted in its place
 * @param timestamp   UTC millis
 * @param type        entry type tag (not blank; NFC-normalized)
 * @param fields      the named field values
 * 
 * @see LogEntryBuilder
 */
public record LogEntry(long index, long timestamp, String type, StructValue fields) {
  
  
  /**
   * Creates and returns an instance from plain Java field values.
   * 
   * @param fields      see {@linkplain FieldValue#of(Object)} for supported value types
   * @throws MalformedInputException if a field value is of an unsupported type
   */
  public static LogEntry of(long index, long timestamp, String type, Map<String, ?> fields)
      throws MalformedInputException {
    try {
      return new LogEntry(index, timestamp, type, StructValue.of(fields));
    } catch (MalformedInputException mix) {
      throw mix.atIndex(index);
    }
  }
  
  
  public LogEntry {
    if (index < 0L)
      throw new IllegalArgumentException("negative index: " + index);
    Objects.requireNonNull(fields, "null fields");
    if (type.isBlank())
      throw new IllegalArgumentException("blank type at index " + index);
    type = Normalizer.normalize(type, Normalizer.Form.NFC);
  }
  
  
  /** Returns the named field value, if present. */
  public Optional<FieldValue> field(String name) {
    return fields.get(name);
  }
  
  /** Determines whether the named field is present (possibly as an explicit null). */
  public boolean hasField(String name) {
    return fields.get(name).isPresent();
  }
  
  
  /** Returns an instance identical to this one but with the given index. */
  public LogEntry withIndex(long newIndex) {
    return newIndex == index ? this : new LogEntry(newIndex, timestamp, type, fields);
  }
  
  /** Returns an instance identical to this one but with the given timestamp. */
  public LogEntry withTimestamp(long utcMillis) {
    return utcMillis == timestamp ? this : new LogEntry(index, utcMillis, type, fields);
  }
  
  /**
   * Returns a builder initialized with a copy of this instance's state.
   */
  public LogEntryBuilder toBuilder() {
    return new LogEntryBuilder(this);
  }

}
