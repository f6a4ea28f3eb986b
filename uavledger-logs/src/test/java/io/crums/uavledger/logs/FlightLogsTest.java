/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.logs;


import static org.junit.jupiter.api.Assertions.*;
import static io.crums.uavledger.logs.LogsTestResources.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.crums.uavledger.HashAlgorithm;
import io.crums.uavledger.anchor.VolatileAnchor;
import io.crums.uavledger.config.LedgerConfig;
import io.crums.uavledger.json.HashEncoding;
import io.crums.uavledger.json.VerificationReportParser;

/**
 * 
 */
public class FlightLogsTest {
  
  
  private static FlightLogs fcuLogs(long checkpointInterval) {
    var config = LedgerConfig.DEFAULT.checkpointInterval(checkpointInterval);
    return new FlightLogs(config, FCU_GRAMMAR);
  }
  

  @Test
  public void testIsJsonLines() {
    assertTrue(FlightLogs.isJsonLines(Path.of("a", "flight.jsonl")));
    assertTrue(FlightLogs.isJsonLines(Path.of("FLIGHT.NDJSON")));
    assertFalse(FlightLogs.isJsonLines(Path.of("flight.log")));
    assertFalse(FlightLogs.isJsonLines(Path.of("jsonl")));
  }
  
  
  @Test
  public void testSealAndVerifyText(@TempDir Path dir) throws Exception {
    var logs = fcuLogs(1);
    var log = copy(FCU_LOG, dir);
    var anchor = new VolatileAnchor();
    
    var sealed = logs.seal("M-42", log, anchor);
    assertEquals(FCU_ENTRY_COUNT, sealed.digest().entryCount());
    assertEquals(FCU_ENTRY_COUNT, sealed.checkpoints().size());
    assertTrue(anchor.isClosed("M-42"));
    
    var recordFile = dir.resolve("M-42.json");
    logs.writeRecord(sealed, recordFile);
    var record = logs.readRecord(recordFile);
    
    assertTrue(logs.verify(log, record).passed());
    
    // edit the TAKEOFF line (entry 1)
    var lines = new ArrayList<>(Files.readAllLines(log, StandardCharsets.UTF_8));
    lines.set(lines.indexOf("2024-05-01T10:15:31.250Z TAKEOFF target_alt=20.0"),
        "2024-05-01T10:15:31.250Z TAKEOFF target_alt=30.0");
    Files.write(log, lines, StandardCharsets.UTF_8);
    var report = logs.verify(log, record);
    assertTrue(report.failed());
    assertEquals(1L, report.firstDivergenceIndex().get());
    assertEquals(1L, report.divergenceLowerBound().get());
    
    var reportFile = dir.resolve("M-42-report.json");
    logs.writeReport(report, reportFile);
    var reread = new VerificationReportParser(HashEncoding.HEX).toEntity(reportFile.toFile());
    assertEquals(report.firstDivergenceIndex(), reread.firstDivergenceIndex());
  }
  
  
  @Test
  public void testLineNumbersLedgered(@TempDir Path dir) throws Exception {
    var logs = fcuLogs(1);
    var log = copy(FCU_LOG, dir);
    var record = logs.seal("M-45", log, null).trustedRecord();
    
    // a new comment line shifts every entry's line number
    var lines = new ArrayList<>(Files.readAllLines(log, StandardCharsets.UTF_8));
    lines.add(0, "# added later");
    Files.write(log, lines, StandardCharsets.UTF_8);
    
    var report = logs.verify(log, record);
    assertTrue(report.failed());
    assertEquals(0L, report.firstDivergenceIndex().get());
    assertEquals(FCU_ENTRY_COUNT, report.problems().size());
  }
  
  
  @Test
  public void testSealInChunksJsonLines(@TempDir Path dir) throws Exception {
    var logs = new FlightLogs(
        LedgerConfig.DEFAULT.algorithm(HashAlgorithm.SHA3_256_V1), Grammar.DEFAULT);
    var log = copy(JSONL_LOG, dir);
    var anchor = new VolatileAnchor();
    
    var sealed = logs.sealInChunks("M-43", log, 2, anchor);
    // 5 entries in 2 chunks: 3 + 2
    assertEquals(2, sealed.checkpoints().size());
    assertEquals(2L, sealed.checkpoints().get(0).index());
    assertEquals(4L, sealed.checkpoints().get(1).index());
    assertEquals(3, sealed.receipts().size());
    assertEquals(HashAlgorithm.SHA3_256_V1, sealed.digest().algorithm());
    
    assertTrue(logs.verify(log, anchor.trustedRecord("M-43").get()).passed());
  }
  
  
  @Test
  public void testDeletedLineDetected(@TempDir Path dir) throws Exception {
    var logs = fcuLogs(0);
    var log = copy(FCU_LOG, dir);
    var record = logs.seal("M-44", log, null).trustedRecord();
    assertTrue(record.checkpoints().isEmpty());
    
    var lines = new ArrayList<>(Files.readAllLines(log, StandardCharsets.UTF_8));
    lines.remove("2024-05-01T10:18:45Z RTL");
    Files.write(log, lines, StandardCharsets.UTF_8);
    
    var report = logs.verify(log, record);
    assertTrue(report.failed());
    assertEquals(FCU_ENTRY_COUNT - 1, report.checkedEntryCount());
  }

}
