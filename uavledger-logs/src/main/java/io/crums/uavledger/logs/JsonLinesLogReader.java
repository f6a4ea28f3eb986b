/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.logs;


import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.crums.uavledger.entry.LogEntry;
import io.crums.uavledger.json.JsonParsingException;
import io.crums.uavledger.json.LogEntryParser;

/**
 * Reads (and writes) JSON-lines flight logs: one
 * {@linkplain LogEntryParser LogEntry JSON object} per line. Blank lines
 * are ignored. Entries are returned in file order, whatever their
 * declared indices: it's the verifier's job to notice.
 */
public class JsonLinesLogReader {
  
  private final LogEntryParser parser;
  
  
  public JsonLinesLogReader() {
    this(LogEntryParser.INSTANCE);
  }
  
  public JsonLinesLogReader(LogEntryParser parser) {
    this.parser = parser;
  }
  
  
  /**
   * Reads the given UTF-8 file.
   * 
   * @throws JsonParsingException if a line is malformed (the message names the line),
   *         or if the file is not valid UTF-8
   */
  public List<LogEntry> read(Path file) throws IOException, JsonParsingException {
    try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader);
    }
  }
  
  
  /**
   * Reads the given stream to the end.
   * 
   * @return read-only list
   * @throws JsonParsingException if a line is malformed (the message names the line)
   */
  public List<LogEntry> read(BufferedReader reader) throws IOException, JsonParsingException {
    var entries = new ArrayList<LogEntry>();
    long lineNo = 0;
    try {
      for (String line = reader.readLine(); line != null; line = reader.readLine()) {
        ++lineNo;
        if (line.isBlank())
          continue;
        try {
          entries.add(parser.toEntity(line));
        } catch (JsonParsingException jpx) {
          throw new JsonParsingException("line " + lineNo + ": " + jpx.getMessage(), jpx);
        }
      }
    } catch (CharacterCodingException ccx) {
      throw new JsonParsingException(
          "undecodable text at or after line " + (lineNo + 1) + ": " + ccx, ccx);
    }
    return Collections.unmodifiableList(entries);
  }
  
  
  /**
   * Writes the given entries, one per line.
   */
  public void write(List<LogEntry> entries, Writer out) throws IOException {
    for (var entry : entries) {
      out.write(parser.toJson(entry));
      out.write('\n');
    }
    out.flush();
  }
  
  
  /**
   * Writes the given entries to the given UTF-8 file (overwriting it).
   */
  public void write(List<LogEntry> entries, Path file) throws IOException {
    try (var out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      write(entries, out);
    }
  }

}
