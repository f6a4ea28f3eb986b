/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.logs;


import static org.junit.jupiter.api.Assertions.*;
import static io.crums.uavledger.logs.LogsTestResources.*;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.uavledger.entry.FieldType;
import io.crums.uavledger.entry.FieldValue.DecimalValue;
import io.crums.uavledger.json.JsonParsingException;

/**
 * 
 */
public class JsonLinesLogReaderTest {

  @Test
  public void testReadFile(@TempDir Path dir) throws Exception {
    var log = copy(JSONL_LOG, dir);
    var entries = new JsonLinesLogReader().read(log);
    assertEquals(JSONL_ENTRY_COUNT, entries.size());
    
    for (int index = 0; index < entries.size(); ++index)
      assertEquals(index, entries.get(index).index());
    
    var bat = entries.get(3);
    assertEquals("BAT", bat.type());
    assertEquals(new DecimalValue(new BigDecimal("22.2")), bat.field("volts").get());
    assertEquals(FieldType.LIST, bat.field("cells").get().type());
    assertEquals(0, entries.get(4).fields().size());
  }
  
  
  @Test
  public void testWriteThenRead(@TempDir Path dir) throws Exception {
    var reader = new JsonLinesLogReader();
    var entries = reader.read(copy(JSONL_LOG, dir));
    var out = dir.resolve("copy.ndjson");
    reader.write(entries, out);
    assertEquals(entries, reader.read(out));
  }
  
  
  @Test
  public void testDeclaredOrderKept() throws Exception {
    var text =
        "{\"index\": 1, \"timestamp\": 2, \"type\": \"B\"}\n" +
        "{\"index\": 0, \"timestamp\": 1, \"type\": \"A\"}\n";
    var entries = new JsonLinesLogReader().read(new BufferedReader(new StringReader(text)));
    assertEquals(1L, entries.get(0).index());
    assertEquals(0L, entries.get(1).index());
  }
  
  
  @Test
  public void testMalformedLineNamed() {
    var text =
        "{\"index\": 0, \"timestamp\": 1, \"type\": \"A\"}\n" +
        "\n" +
        "{\"index\": 1, \"timestamp\": 2, \"type\": \n";
    var jpx = assertThrows(
        JsonParsingException.class,
        () -> new JsonLinesLogReader().read(new BufferedReader(new StringReader(text))));
    assertTrue(jpx.getMessage().startsWith("line 3: "), jpx.getMessage());
  }
  
  
  @Test
  public void testUndecodableFile(@TempDir Path dir) throws Exception {
    var bytes = new ByteArrayOutputStream();
    bytes.write("{\"index\": 0, \"timestamp\": 1, \"type\": \"A\"}\n".getBytes(StandardCharsets.UTF_8));
    bytes.write(new byte[] { '{', (byte) 0xc3, '}', '\n' });
    var log = dir.resolve("garbled.jsonl");
    Files.write(log, bytes.toByteArray());
    
    var jpx = assertThrows(JsonParsingException.class, () -> new JsonLinesLogReader().read(log));
    assertTrue(jpx.getCause() instanceof CharacterCodingException, jpx.toString());
  }
  
  
  @Test
  public void testWriteOneLinePerEntry() throws Exception {
    var reader = new JsonLinesLogReader();
    var entries = reader.read(new BufferedReader(new StringReader(
        "{\"index\": 0, \"timestamp\": 1, \"type\": \"A\", \"fields\": {\"note\": \"x\\ny\"}}")));
    var out = new StringWriter();
    reader.write(entries, out);
    assertEquals(1, out.toString().split("\n").length);
  }

}
