/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.entry;


import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.text.Normalizer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.crums.uavledger.MalformedInputException;

/**
 * A typed field value in a {@linkplain LogEntry}. This is a closed set of
 * variants, one per {@linkplain FieldType}. Instances are immutable, and
 * two instances are {@code equals} iff they canonicalize to the same bytes.
 * 
 * <h2>Conversion from plain Java objects</h2>
 * <p>
 * {@linkplain #of(Object)} maps the usual Java types to variants:
 * </p>
 * <ul>
 * <li>{@code null}: {@linkplain NullValue}</li>
 * <li>{@code Boolean}: {@linkplain BoolValue}</li>
 * <li>{@code Byte, Short, Integer, Long} and {@code BigInteger} (in long
 *  range): {@linkplain LongValue}</li>
 * <li>{@code Float, Double}: {@linkplain FloatValue}</li>
 * <li>{@code BigDecimal} (and out-of-range {@code BigInteger}):
 *  {@linkplain DecimalValue}</li>
 * <li>{@code CharSequence, Character}: {@linkplain StringValue}</li>
 * <li>{@code byte[], ByteBuffer}: {@linkplain BytesValue}</li>
 * <li>{@code java.util.Date, Instant}: UTC millis as {@linkplain LongValue}</li>
 * <li>{@code Collection} and object arrays: {@linkplain ListValue}</li>
 * <li>{@code Map} with string keys: {@linkplain StructValue}</li>
 * </ul>
 */
public sealed interface FieldValue {
  
  /** The null value. */
  public final static NullValue NULL = new NullValue();
  
  /** Boolean {@code true}. */
  public final static BoolValue TRUE = new BoolValue(true);
  
  /** Boolean {@code false}. */
  public final static BoolValue FALSE = new BoolValue(false);
  
  
  /** Returns the value's type. */
  FieldType type();
  
  
  /**
   * Returns the given object as a typed value.
   * 
   * @param value       of one of the supported types (see class doc)
   * @throws MalformedInputException if {@code value} (or a nested member)
   *                                 is of an unsupported type
   */
  public static FieldValue of(Object value) throws MalformedInputException {
    if (value == null)
      return NULL;
    if (value instanceof FieldValue fv)
      return fv;
    if (value instanceof Boolean b)
      return b ? TRUE : FALSE;
    if (value instanceof Long || value instanceof Integer ||
        value instanceof Short || value instanceof Byte)
      return new LongValue(((Number) value).longValue());
    if (value instanceof Double || value instanceof Float)
      return new FloatValue(((Number) value).doubleValue());
    if (value instanceof BigDecimal dec)
      return new DecimalValue(dec);
    if (value instanceof BigInteger bi)
      return bi.bitLength() < 64 ?
          new LongValue(bi.longValue()) :
            new DecimalValue(new BigDecimal(bi));
    if (value instanceof CharSequence || value instanceof Character)
      return new StringValue(value.toString());
    if (value instanceof byte[] bytes)
      return new BytesValue(bytes);
    if (value instanceof ByteBuffer buf)
      return BytesValue.copyOf(buf);
    if (value instanceof Date date)
      return new LongValue(date.getTime());
    if (value instanceof Instant instant)
      return new LongValue(instant.toEpochMilli());
    if (value instanceof Collection<?> col)
      return ListValue.of(col);
    if (value instanceof Object[] array)
      return ListValue.of(Arrays.asList(array));
    if (value instanceof Map<?,?> map)
      return StructValue.of(map);
    
    throw new MalformedInputException(
        "unsupported value type (class: %s): %s"
        .formatted(value.getClass().getName(), value));
  }
  
  
  
  
  /** The explicit null. Distinct from an absent field. */
  public record NullValue() implements FieldValue {
    @Override
    public FieldType type() {
      return FieldType.NULL;
    }
  }
  
  
  public record BoolValue(boolean value) implements FieldValue {
    @Override
    public FieldType type() {
      return FieldType.BOOL;
    }
  }
  
  
  public record LongValue(long value) implements FieldValue {
    @Override
    public FieldType type() {
      return FieldType.LONG;
    }
  }
  
  
  /**
   * Floating point value. Equality follows {@linkplain Double#compare(double, double)}:
   * all NaNs are equal, and {@code -0.0} is not equal to {@code 0.0}. This
   * matches the canonical encoding.
   */
  public record FloatValue(double value) implements FieldValue {
    @Override
    public FieldType type() {
      return FieldType.FLOAT;
    }
  }
  
  
  /**
   * Arbitrary precision decimal. Trailing zeroes are stripped on
   * construction, so {@code 1.50} and {@code 1.5} are the same value.
   */
  public record DecimalValue(BigDecimal value) implements FieldValue {
    
    public DecimalValue {
      value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }
    
    @Override
    public FieldType type() {
      return FieldType.DECIMAL;
    }
  }
  
  
  /** String value, NFC-normalized on construction. */
  public record StringValue(String value) implements FieldValue {
    
    public StringValue {
      value = Normalizer.normalize(value, Normalizer.Form.NFC);
    }
    
    @Override
    public FieldType type() {
      return FieldType.STRING;
    }
  }
  
  
  /** Byte sequence. The array is copied on the way in and on the way out. */
  public record BytesValue(byte[] bytes) implements FieldValue {
    
    /** Returns an instance with a copy of the buffer's remaining bytes. */
    public static BytesValue copyOf(ByteBuffer buffer) {
      byte[] b = new byte[buffer.remaining()];
      buffer.duplicate().get(b);
      return new BytesValue(b);
    }
    
    public BytesValue {
      bytes = bytes.clone();
    }
    
    @Override
    public FieldType type() {
      return FieldType.BYTES;
    }
    
    /** Returns a copy of the bytes. */
    @Override
    public byte[] bytes() {
      return bytes.clone();
    }
    
    /** Returns a read-only view of the bytes. */
    public ByteBuffer buffer() {
      return ByteBuffer.wrap(bytes).asReadOnlyBuffer();
    }
    
    /** Returns the number of bytes. */
    public int size() {
      return bytes.length;
    }
    
    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof BytesValue other && Arrays.equals(bytes, other.bytes);
    }
    
    @Override
    public int hashCode() {
      return Arrays.hashCode(bytes);
    }
    
    @Override
    public String toString() {
      return "BytesValue[" + bytes.length + " bytes]";
    }
  }
  
  
  /** Ordered list of values. Order is significant. */
  public record ListValue(List<FieldValue> values) implements FieldValue {
    
    /**
     * Returns the given collection's elements (in iteration order) as a list value.
     * 
     * @throws MalformedInputException if an element is of an unsupported type
     */
    public static ListValue of(Collection<?> elements) throws MalformedInputException {
      var values = new ArrayList<FieldValue>(elements.size());
      for (var e : elements)
        values.add(FieldValue.of(e));
      return new ListValue(values);
    }
    
    public ListValue {
      values = List.copyOf(values);
    }
    
    @Override
    public FieldType type() {
      return FieldType.LIST;
    }
    
    public int size() {
      return values.size();
    }
  }
  
  
  /**
   * Named values. Names are NFC-normalized; the order in which they were
   * set is not remembered (and does not matter).
   */
  public record StructValue(Map<String, FieldValue> fields) implements FieldValue {
    
    /** The empty struct. */
    public final static StructValue EMPTY = new StructValue(Map.of());
    
    /**
     * Returns the given map as a struct value.
     * 
     * @param map         keys must be strings, values of supported types
     * @throws MalformedInputException on non-string keys, unsupported value
     *                                 types, or names that collide after
     *                                 normalization
     */
    public static StructValue of(Map<?,?> map) throws MalformedInputException {
      var fields = new HashMap<String, FieldValue>(Math.max(16, map.size() * 2));
      for (var e : map.entrySet()) {
        if (!(e.getKey() instanceof CharSequence key))
          throw new MalformedInputException(
              "field name must be a string: " + e.getKey());
        var prev = fields.put(key.toString(), FieldValue.of(e.getValue()));
        if (prev != null)
          throw new MalformedInputException("duplicate field name: " + key);
      }
      return new StructValue(fields);
    }
    
    public StructValue {
      var normalized = new HashMap<String, FieldValue>(Math.max(16, fields.size() * 2));
      for (var e : fields.entrySet()) {
        String name = Normalizer.normalize(e.getKey(), Normalizer.Form.NFC);
        var value = Objects.requireNonNull(e.getValue(), "null value for field " + name);
        if (normalized.put(name, value) != null)
          throw new MalformedInputException(
              "field names collide after NFC normalization: " + name);
      }
      fields = Collections.unmodifiableMap(normalized);
    }
    
    @Override
    public FieldType type() {
      return FieldType.STRUCT;
    }
    
    /** Returns the named value, if present. */
    public Optional<FieldValue> get(String name) {
      return Optional.ofNullable(
          fields.get(Normalizer.normalize(name, Normalizer.Form.NFC)));
    }
    
    public int size() {
      return fields.size();
    }
  }

}
