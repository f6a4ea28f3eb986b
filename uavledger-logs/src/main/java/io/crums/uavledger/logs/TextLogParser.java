/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.logs;


import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.lang.System.Logger.Level;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import io.crums.uavledger.MalformedInputException;
import io.crums.uavledger.entry.LogEntry;
import io.crums.uavledger.entry.LogEntryBuilder;

/**
 * Turns a line-delimited text log into {@linkplain LogEntry}s, one per
 * ledgered line (as decided by the {@linkplain Grammar}). Each entry
 * carries the fields
 * <ul>
 * <li>{@value LogsConstants#LINE_NO}: the 1-based line number in the source,</li>
 * <li>{@value LogsConstants#TEXT}: the line (sans terminator), and</li>
 * <li>{@value LogsConstants#TOKENS}: the line's tokens.</li>
 * </ul>
 * If the grammar is {@linkplain Grammar#timestamped() timestamped}, the
 * entry's timestamp is taken from the line's first token; otherwise it is
 * zero. Entry indices are consecutive from zero, regardless of skipped lines.
 * Stateless.
 */
public class TextLogParser {
  
  private final static System.Logger LOG = LogsConstants.sysLogger();
  
  private final Grammar grammar;
  private final String entryType;
  
  
  /**
   * @param grammar     line rules
   * @param entryType   the type assigned to every entry
   */
  public TextLogParser(Grammar grammar, String entryType) {
    this.grammar = Objects.requireNonNull(grammar, "null grammar");
    this.entryType = Objects.requireNonNull(entryType, "null entryType").trim();
    if (this.entryType.isEmpty())
      throw new IllegalArgumentException("blank entryType");
  }
  
  
  public Grammar grammar() {
    return grammar;
  }
  
  public String entryType() {
    return entryType;
  }
  
  
  /**
   * Parses the given UTF-8 log file.
   * 
   * @return read-only list of entries
   * @throws MalformedInputException if the file is not valid UTF-8, or if a
   *         timestamped line has no valid timestamp
   */
  public List<LogEntry> parse(Path log) throws IOException, MalformedInputException {
    try (var reader = Files.newBufferedReader(log, StandardCharsets.UTF_8)) {
      return parse(reader);
    }
  }
  
  
  /**
   * Parses the given text.
   * 
   * @return read-only list of entries
   */
  public List<LogEntry> parse(String text) throws MalformedInputException {
    try {
      return parse(new BufferedReader(new StringReader(text)));
    } catch (IOException iox) {
      // StringReader does not throw
      throw new UncheckedIOException(iox);
    }
  }
  
  
  /**
   * Parses the given log stream.
   * 
   * @return read-only list of entries
   */
  public List<LogEntry> parse(BufferedReader reader) throws IOException, MalformedInputException {
    var entries = new ArrayList<LogEntry>();
    parse(reader, entries::add);
    return Collections.unmodifiableList(entries);
  }
  
  
  /**
   * Parses the given log stream, handing each entry to the given
   * {@code listener} as soon as it is parsed.
   * 
   * @return the number of entries parsed
   * @throws MalformedInputException if the stream's bytes cannot be decoded
   *         (the message names the first line not yet parsed), or if a
   *         timestamped line has no valid timestamp
   */
  public long parse(BufferedReader reader, Consumer<LogEntry> listener)
      throws IOException, MalformedInputException {
    
    long lineNo = 0;
    long index = 0;
    long skipped = 0;
    try {
      for (String line = reader.readLine(); line != null; line = reader.readLine()) {
        ++lineNo;
        if (!grammar.isLedgered(line)) {
          ++skipped;
          continue;
        }
        listener.accept(toEntry(index++, lineNo, line));
      }
    } catch (CharacterCodingException ccx) {
      // the reader decodes ahead, so the bad bytes are at or after this line
      throw new MalformedInputException(
          "undecodable text at or after line " + (lineNo + 1) + ": " + ccx, ccx);
    }
    LOG.log(Level.TRACE, "parsed {0} lines: {1} entries, {2} skipped", lineNo, index, skipped);
    return index;
  }
  
  
  /**
   * Returns the entry for the given line.
   * 
   * @param index   the entry's index
   * @param lineNo  the line's 1-based number
   * @param line    the line (sans terminator)
   * @throws MalformedInputException if the grammar is timestamped and the
   *         line's first token is not a timestamp
   */
  public LogEntry toEntry(long index, long lineNo, String line) throws MalformedInputException {
    var tokens = grammar.parseTokens(line);
    long timestamp = 0L;
    if (grammar.timestamped()) {
      var ts = tokens.isEmpty() ? null : Grammar.parseTimestamp(tokens.get(0));
      if (ts == null || ts.isEmpty())
        throw new MalformedInputException(
            "line " + lineNo + ": expected leading ISO-8601 timestamp: " + line, index);
      timestamp = ts.getAsLong();
    }
    return new LogEntryBuilder(index)
        .timestamp(timestamp)
        .type(entryType)
        .put(LogsConstants.LINE_NO, lineNo)
        .put(LogsConstants.TEXT, line)
        .put(LogsConstants.TOKENS, tokens)
        .build();
  }

}
