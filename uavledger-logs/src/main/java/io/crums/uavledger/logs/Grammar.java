/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.logs;


import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.StringTokenizer;
import java.util.function.Predicate;

/**
 * A text log's grammar: comment-line filter, token delimiters, whether
 * blank lines count as entries, and whether lines begin with an ISO-8601
 * timestamp. Instances are immutable (and thread-safe).
 * <p>
 * Since instances are immutable, <em>mutator methods return new instances.</em>
 * </p>
 */
public class Grammar {
  
  
  /**
   * Returns a comment matcher for lines beginning with the given prefix.
   * Leading whitespace is not skipped.
   * 
   * @param prefix      not empty
   */
  public static Predicate<String> prefixMatcher(String prefix) {
    if (prefix.isEmpty())
      throw new IllegalArgumentException("empty prefix");
    if (prefix.length() == 1) {
      final char pc = prefix.charAt(0);
      return line -> !line.isEmpty() && line.charAt(0) == pc;
    }
    return line -> line.startsWith(prefix);
  }
  
  
  /**
   * Parses an ISO-8601 instant (e.g. {@code 2024-05-01T10:15:30.250Z}) or
   * offset date-time (e.g. {@code 2024-05-01T12:15:30+02:00}).
   * 
   * @return UTC millis, or empty if the token is neither
   */
  public static OptionalLong parseTimestamp(String token) {
    try {
      return OptionalLong.of(OffsetDateTime.parse(token).toInstant().toEpochMilli());
    } catch (DateTimeParseException notTimestamp) {
      return OptionalLong.empty();
    }
  }
  
  
  
  /** Default whitespace-delimited, empty lines included, no timestamps. */
  public final static Grammar DEFAULT = new Grammar();
  
  
  private final String tokenDelimiters;
  private final Predicate<String> commentMatcher;
  private final boolean skipBlankLines;
  private final boolean timestamped;
  
  
  /**
   * Constructs a whitespace-token-delimiting instance with no
   * comment-matcher. Blank lines are not skipped.
   */
  public Grammar() {
    this(null, null, false, false);
  }
  
  
  /**
   * Constructor defaults to blank-lines-skipped, without timestamps.
   * 
   * @param tokenDelimiters   as used in {@code StringTokenizer}; {@code null}
   *                          means whitespace-delimited
   * @param commentMatcher    optional (may be {@code null})
   */
  public Grammar(String tokenDelimiters, Predicate<String> commentMatcher) {
    this(tokenDelimiters, commentMatcher, true, false);
  }

  
  /**
   * Full constructor.
   * 
   * @param tokenDelimiters   as used in {@code StringTokenizer}; {@code null}
   *                          means whitespace-delimited
   * @param commentMatcher    optional (may be {@code null})
   * @param skipBlankLines    if {@code true}, then blank lines are skipped
   * @param timestamped       if {@code true}, the first token of every
   *                          ledgered line is an ISO-8601 timestamp
   */
  public Grammar(
      String tokenDelimiters,
      Predicate<String> commentMatcher,
      boolean skipBlankLines,
      boolean timestamped) {
    
    this.tokenDelimiters = tokenDelimiters;
    this.commentMatcher = commentMatcher;
    this.skipBlankLines = skipBlankLines;
    this.timestamped = timestamped;
    
    if (tokenDelimiters != null && tokenDelimiters.isEmpty())
      throw new IllegalArgumentException("empty tokenDelimiters");
  }
  
  
  /**
   * Returns an instance with the given comment-matcher.
   * 
   * @param matcher     may be set to {@code null}
   * @return    {@code this} if the instance already has the given matcher;
   *            a new instance, o.w.
   */
  public Grammar commentMatcher(Predicate<String> matcher) {
    return Objects.equals(this.commentMatcher, matcher) ?
        this :
          new Grammar(tokenDelimiters, matcher, skipBlankLines, timestamped);
  }
  
  
  /** Returns an instance whose comment lines begin with the given prefix. */
  public Grammar commentPrefix(String prefix) {
    return commentMatcher(prefixMatcher(prefix));
  }
  
  
  /** Returns the optional comment matcher. Commented-out lines are ignored. */
  public Optional<Predicate<String>> commentMatcher() {
    return Optional.ofNullable(commentMatcher);
  }
  
  
  /**
   * Returns an instance with the given token delimiters.
   * 
   * @param delimiters  {@code null} means whitespace delimited
   * @return   {@code this} if the instance already has the given token
   *            delimiters; a new instance, o.w.
   */
  public Grammar tokenDelimiters(String delimiters) {
    return Objects.equals(this.tokenDelimiters, delimiters) ?
        this :
          new Grammar(delimiters, commentMatcher, skipBlankLines, timestamped);
  }
  
  /**
   * Returns the token delimiters, if any. If not present, then tokenization
   * is whitespace-delimited.
   */
  public Optional<String> tokenDelimiters() {
    return Optional.ofNullable(tokenDelimiters);
  }
  
  
  public List<String> parseTokens(String line) {
    if (line.isEmpty())
      return List.of();
    
    var tokenizer =
        tokenDelimiters == null ?
            new StringTokenizer(line) :
            new StringTokenizer(line, tokenDelimiters);
    
    List<String> out = new ArrayList<>();
    while (tokenizer.hasMoreTokens())
      out.add(tokenizer.nextToken());
    
    return out;
  }
  
  
  public Grammar skipBlankLines(boolean skipBlank) {
    return this.skipBlankLines == skipBlank ?
        this :
          new Grammar(tokenDelimiters, commentMatcher, skipBlank, timestamped);
  }
  
  
  public boolean skipBlankLines() {
    return skipBlankLines;
  }
  
  
  public Grammar timestamped(boolean leadingTimestamp) {
    return this.timestamped == leadingTimestamp ?
        this :
          new Grammar(tokenDelimiters, commentMatcher, skipBlankLines, leadingTimestamp);
  }
  
  /** Returns {@code true} iff ledgered lines begin with an ISO-8601 timestamp. */
  public boolean timestamped() {
    return timestamped;
  }
  
  
  /**
   * Determines whether the given line becomes a log entry. Comment lines
   * never do; blank lines do unless {@linkplain #skipBlankLines()}.
   */
  public boolean isLedgered(String line) {
    if (commentMatcher != null && commentMatcher.test(line))
      return false;
    return !skipBlankLines || !line.isBlank();
  }

}
