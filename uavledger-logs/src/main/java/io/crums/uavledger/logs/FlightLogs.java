/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.logs;


import java.io.IOException;
import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import io.crums.uavledger.MissionSession;
import io.crums.uavledger.SealedMission;
import io.crums.uavledger.anchor.Anchor;
import io.crums.uavledger.chain.ChainBuilder;
import io.crums.uavledger.chain.CheckpointPlan;
import io.crums.uavledger.config.LedgerConfig;
import io.crums.uavledger.entry.LogEntry;
import io.crums.uavledger.verify.TrustedRecord;
import io.crums.uavledger.verify.VerificationReport;

/**
 * File-level facade: seals flight log files into missions and verifies
 * them later. Files ending in {@code .jsonl} or {@code .ndjson} are read as
 * JSON-lines logs; anything else as a text log, under this instance's
 * {@linkplain Grammar}.
 */
public class FlightLogs {
  
  private final static System.Logger LOG = LogsConstants.sysLogger();
  
  private final LedgerConfig config;
  private final TextLogParser textParser;
  private final JsonLinesLogReader jsonReader = new JsonLinesLogReader();
  
  
  /** Uses the default config and grammar. */
  public FlightLogs() {
    this(LedgerConfig.DEFAULT, Grammar.DEFAULT);
  }
  
  
  /**
   * @param config    algorithm, checkpoint interval, hash encoding, text entry type
   * @param grammar   text log grammar
   */
  public FlightLogs(LedgerConfig config, Grammar grammar) {
    this.config = Objects.requireNonNull(config, "null config");
    this.textParser = new TextLogParser(grammar, config.textEntryType());
  }
  
  
  public LedgerConfig config() {
    return config;
  }
  
  
  /** Determines whether the given file is read as a JSON-lines log. */
  public static boolean isJsonLines(Path log) {
    var name = log.getFileName().toString().toLowerCase();
    for (var ext : LogsConstants.JSON_LINES_EXTS)
      if (name.endsWith(ext))
        return true;
    return false;
  }
  
  
  /**
   * Reads the entries in the given log file.
   */
  public List<LogEntry> readEntries(Path log) throws IOException {
    return isJsonLines(log) ? jsonReader.read(log) : textParser.parse(log);
  }
  
  
  /**
   * Seals the given log using the config's checkpoint plan.
   * 
   * @see #seal(String, Path, CheckpointPlan, Anchor)
   */
  public SealedMission seal(String missionId, Path log, Anchor anchor) throws IOException {
    return seal(missionId, log, config.checkpointPlan(), anchor);
  }
  
  
  /**
   * Seals the log in even chunks: a checkpoint at the end of each of
   * {@code chunks} nearly equal runs of entries (earlier chunks take the
   * remainder).
   */
  public SealedMission sealInChunks(String missionId, Path log, int chunks, Anchor anchor)
      throws IOException {
    var entries = readEntries(log);
    var plan = CheckpointPlan.evenChunks(entries.size(), chunks);
    return seal(missionId, entries, plan, anchor);
  }
  
  
  /**
   * Reads the given log file, chains its entries, and returns the sealed
   * mission.
   * 
   * @param missionId   mission identifier
   * @param log         the flight log file
   * @param plan        checkpoint schedule
   * @param anchor      optional (may be {@code null})
   */
  public SealedMission seal(String missionId, Path log, CheckpointPlan plan, Anchor anchor)
      throws IOException {
    return seal(missionId, readEntries(log), plan, anchor);
  }
  
  
  private SealedMission seal(
      String missionId, List<LogEntry> entries, CheckpointPlan plan, Anchor anchor) {
    var session = new MissionSession(
        missionId, new ChainBuilder(config.algorithm()), plan, anchor);
    session.appendAll(entries);
    var sealed = session.close();
    LOG.log(Level.DEBUG, "sealed {0} from {1} entries", missionId, entries.size());
    return sealed;
  }
  
  
  /**
   * Verifies the given log file against the given trusted record.
   */
  public VerificationReport verify(Path log, TrustedRecord expected) throws IOException {
    return config.newVerifier().verify(readEntries(log), expected);
  }
  
  
  /**
   * Writes the sealed mission's trusted record (checkpoints and digest) as
   * JSON to the given file.
   */
  public void writeRecord(SealedMission sealed, Path file) throws IOException {
    var json = config.trustedRecordParser().toJsonObject(sealed.trustedRecord()).toJSONString();
    Files.writeString(file, json, StandardCharsets.UTF_8);
  }
  
  
  /**
   * Reads a trusted record written by {@linkplain #writeRecord(SealedMission, Path)}.
   */
  public TrustedRecord readRecord(Path file) throws IOException {
    return config.trustedRecordParser().toEntity(Files.readString(file, StandardCharsets.UTF_8));
  }
  
  
  /**
   * Writes the given report as JSON.
   */
  public void writeReport(VerificationReport report, Path file) throws IOException {
    Files.writeString(
        file, config.reportParser().toJson(report), StandardCharsets.UTF_8);
  }

}
