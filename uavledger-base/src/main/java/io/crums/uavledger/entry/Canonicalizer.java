/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.entry;


import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

import io.crums.uavledger.Constants;
import io.crums.uavledger.MalformedInputException;
import io.crums.uavledger.entry.FieldValue.BoolValue;
import io.crums.uavledger.entry.FieldValue.BytesValue;
import io.crums.uavledger.entry.FieldValue.DecimalValue;
import io.crums.uavledger.entry.FieldValue.FloatValue;
import io.crums.uavledger.entry.FieldValue.ListValue;
import io.crums.uavledger.entry.FieldValue.LongValue;
import io.crums.uavledger.entry.FieldValue.StringValue;
import io.crums.uavledger.entry.FieldValue.StructValue;

/**
 * Converts {@linkplain LogEntry}s to their canonical bytes. Stateless and
 * thread-safe.
 * 
 * <h2>Layout</h2>
 * <p>
 * All integers are big endian. An entry is laid out as
 * </p>
 * <pre>
 *  VERSION(1) index(8) timestamp(8) str(type) STRUCT-payload(fields)
 * </pre>
 * <p>
 * where {@code str} is a 4-byte length followed by the NFC-normalized UTF-8
 * bytes. Each value is its {@linkplain FieldType#tag() tag} byte followed
 * by its payload:
 * </p>
 * <ul>
 * <li>{@code NULL}: nothing</li>
 * <li>{@code BOOL}: 1 byte, 0 or 1</li>
 * <li>{@code LONG}: 8 bytes</li>
 * <li>{@code FLOAT}: the 8-byte {@linkplain Double#doubleToLongBits(double)}</li>
 * <li>{@code DECIMAL}: 4-byte scale, then 4-byte length and the unscaled
 *     two's complement bytes (trailing zeroes stripped)</li>
 * <li>{@code STRING}: {@code str}</li>
 * <li>{@code BYTES}: 4-byte length, then the bytes</li>
 * <li>{@code LIST}: 4-byte count, then each value</li>
 * <li>{@code STRUCT}: 4-byte count, then {@code str(name) value} pairs in
 *     ascending unsigned byte order of the names' UTF-8 encodings</li>
 * </ul>
 * <p>
 * An absent field contributes nothing; an explicit null contributes its
 * name and a {@code NULL} tag. So deleting a field always changes the bytes.
 * </p>
 */
public class Canonicalizer {
  
  /**
   * Returns the canonical form of the given entry.
   * 
   * @throws MalformedInputException if a string in the entry has no UTF-8
   *         encoding (e.g. contains an unpaired surrogate)
   */
  public static CanonicalEntry canonicalize(LogEntry entry) throws MalformedInputException {
    var bytes = new ByteArrayOutputStream(256);
    var out = new DataOutputStream(bytes);
    var encoder = newEncoder();
    try {
      out.writeByte(Constants.CANON_VERSION);
      out.writeLong(entry.index());
      out.writeLong(entry.timestamp());
      writeString(entry.type(), out, encoder);
      writeStruct(entry.fields(), out, encoder);
      out.flush();
    } catch (MalformedInputException mix) {
      throw mix.atIndex(entry.index());
    } catch (IOException iox) {
      // ByteArrayOutputStream does not throw
      throw new UncheckedIOException(iox);
    }
    return new CanonicalEntry(entry.index(), bytes.toByteArray());
  }
  
  
  /**
   * Returns the canonical bytes of a single value (tag included).
   * 
   * @throws MalformedInputException if a string in the value has no UTF-8 encoding
   */
  public static byte[] encode(FieldValue value) throws MalformedInputException {
    var bytes = new ByteArrayOutputStream(64);
    var out = new DataOutputStream(bytes);
    try {
      writeValue(value, out, newEncoder());
      out.flush();
    } catch (IOException iox) {
      throw new UncheckedIOException(iox);
    }
    return bytes.toByteArray();
  }
  
  
  private static CharsetEncoder newEncoder() {
    return StandardCharsets.UTF_8.newEncoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
  }
  
  
  private static void writeValue(FieldValue value, DataOutputStream out, CharsetEncoder encoder)
      throws IOException {
    
    final FieldType type = value.type();
    out.writeByte(type.tag());
    
    switch (type) {
    case NULL:
      break;
    case BOOL:
      out.writeByte(((BoolValue) value).value() ? 1 : 0);
      break;
    case LONG:
      out.writeLong(((LongValue) value).value());
      break;
    case FLOAT:
      out.writeLong(Double.doubleToLongBits(((FloatValue) value).value()));
      break;
    case DECIMAL:
      {
        var dec = ((DecimalValue) value).value();
        byte[] unscaled = dec.unscaledValue().toByteArray();
        out.writeInt(dec.scale());
        out.writeInt(unscaled.length);
        out.write(unscaled);
      }
      break;
    case STRING:
      writeString(((StringValue) value).value(), out, encoder);
      break;
    case BYTES:
      {
        byte[] b = ((BytesValue) value).bytes();
        out.writeInt(b.length);
        out.write(b);
      }
      break;
    case LIST:
      {
        var values = ((ListValue) value).values();
        out.writeInt(values.size());
        for (var v : values)
          writeValue(v, out, encoder);
      }
      break;
    case STRUCT:
      writeStruct((StructValue) value, out, encoder);
      break;
    default:
      throw new RuntimeException("Unaccounted enum type " + type);
    }
  }
  
  
  /** Writes the struct payload (sans tag). */
  private static void writeStruct(StructValue struct, DataOutputStream out, CharsetEncoder encoder)
      throws IOException {
    
    var named = new ArrayList<NamedValue>(struct.size());
    for (Map.Entry<String, FieldValue> e : struct.fields().entrySet())
      named.add(new NamedValue(utf8(e.getKey(), encoder), e.getValue()));
    
    named.sort((a, b) -> Arrays.compareUnsigned(a.name, b.name));
    
    out.writeInt(named.size());
    for (var nv : named) {
      out.writeInt(nv.name.length);
      out.write(nv.name);
      writeValue(nv.value, out, encoder);
    }
  }
  
  
  private static void writeString(String s, DataOutputStream out, CharsetEncoder encoder)
      throws IOException {
    byte[] b = utf8(s, encoder);
    out.writeInt(b.length);
    out.write(b);
  }
  
  
  /**
   * Strings are already NFC-normalized (by {@code StringValue},
   * {@code StructValue} and {@code LogEntry}).
   */
  private static byte[] utf8(String s, CharsetEncoder encoder) throws MalformedInputException {
    try {
      ByteBuffer buf = encoder.reset().encode(CharBuffer.wrap(s));
      byte[] b = new byte[buf.remaining()];
      buf.get(b);
      return b;
    } catch (CharacterCodingException ccx) {
      throw new MalformedInputException(
          "string not encodable as UTF-8 (unpaired surrogate?): " + s, ccx);
    }
  }
  
  
  private record NamedValue(byte[] name, FieldValue value) {  }
  
  
  private Canonicalizer() {  }

}
