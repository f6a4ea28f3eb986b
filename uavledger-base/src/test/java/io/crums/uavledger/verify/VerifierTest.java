/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.verify;


import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.crums.uavledger.AlgorithmMismatchException;
import io.crums.uavledger.FlightLogFixtures;
import io.crums.uavledger.HashAlgorithm;
import io.crums.uavledger.MalformedInputException;
import io.crums.uavledger.chain.ChainBuilder;
import io.crums.uavledger.chain.Checkpoint;
import io.crums.uavledger.entry.LogEntry;

/**
 * 
 */
public class VerifierTest {
  
  final static HashAlgorithm ALGO = HashAlgorithm.SHA256_V1;
  final static String MISSION = "M-42";
  
  
  /** Seals the given log with a checkpoint at every index in {@code cps}. */
  private static TrustedRecord seal(List<LogEntry> log, long... cps) {
    var builder = new ChainBuilder(ALGO, FlightLogFixtures.CLOCK);
    builder.appendAll(log);
    for (long index : cps)
      builder.checkpoint(index);
    return TrustedRecord.of(MISSION, ALGO, builder.checkpoints())
        .withDigest(builder.digest(MISSION));
  }
  
  /** Seals with a checkpoint at every entry. */
  private static TrustedRecord sealDense(List<LogEntry> log) {
    long[] cps = new long[log.size()];
    for (int index = 0; index < cps.length; ++index)
      cps[index] = index;
    return seal(log, cps);
  }
  
  private static Verifier verifier() {
    return new Verifier(ALGO, FlightLogFixtures.CLOCK);
  }
  
  private static void assertFailAt(long index, VerificationReport report) {
    assertEquals(Verdict.FAIL, report.verdict(), report.toString());
    assertEquals(index, report.firstDivergenceIndex().orElseThrow(), report.toString());
    assertTrue(report.divergenceLowerBound().orElseThrow() <= index);
  }
  
  
  @Test
  public void testUntouchedAgainstOwnDigest() {
    var log = FlightLogFixtures.sampleLog(10);
    var builder = new ChainBuilder(ALGO, FlightLogFixtures.CLOCK);
    builder.appendAll(log);
    var digest = builder.digest(MISSION);
    
    var report = verifier().verify(log, digest);
    assertEquals(Verdict.PASS, report.verdict());
    assertTrue(report.passed());
    assertTrue(report.firstDivergenceIndex().isEmpty());
    assertTrue(report.divergenceLowerBound().isEmpty());
    assertEquals(0L, report.uncoveredSuffixLength());
    assertEquals(10L, report.checkedEntryCount());
    assertTrue(report.recomputedDigest().sameCommitment(digest));
    assertEquals(digest, report.expectedDigest().orElseThrow());
    assertEquals(1, report.checkpointResults().size());
    assertEquals(PointStatus.MATCHED, report.checkpointResults().get(0).status());
    assertTrue(report.problems().isEmpty());
  }
  
  
  @Test
  public void testTimestampAltered() {
    var log = FlightLogFixtures.sampleLog(5);
    var expected = sealDense(log);
    
    var tampered = new ArrayList<>(log);
    tampered.set(3, log.get(3).withTimestamp(log.get(3).timestamp() + 1));
    
    var report = verifier().verify(tampered, expected);
    assertFailAt(3, report);
    assertEquals(3L, report.divergenceLowerBound().orElseThrow());
    assertEquals(4L, report.checkedEntryCount());
    var results = report.checkpointResults();
    assertEquals(5, results.size());
    assertEquals(PointStatus.MATCHED, results.get(2).status());
    assertEquals(PointStatus.MISMATCHED, results.get(3).status());
    assertNotEquals(results.get(3).expectedHash(), results.get(3).recomputedHash().orElseThrow());
    assertEquals(PointStatus.UNCHECKED, results.get(4).status());
  }
  
  
  @Test
  public void testEditAgainstDigestOnly() {
    var log = FlightLogFixtures.sampleLog(5);
    var expected = seal(log);
    var tampered = new ArrayList<>(log);
    tampered.set(1, log.get(1).toBuilder().put("pitch", 9.0).build());
    
    var report = verifier().verify(tampered, expected);
    // without intermediate checkpoints, an edit is only bounded
    assertFailAt(4, report);
    assertEquals(0L, report.divergenceLowerBound().orElseThrow());
  }
  
  
  @Test
  public void testDeletionWithCheckpointHistory() {
    var log = FlightLogFixtures.sampleLog(8);
    var expected = sealDense(log);
    
    var tampered = new ArrayList<>(log);
    tampered.remove(5);
    
    assertFailAt(5, verifier().verify(tampered, expected));
  }
  
  
  @Test
  public void testDeletionSparseCheckpoints() {
    var log = FlightLogFixtures.sampleLog(20);
    var expected = seal(log, 4, 9, 14);
    
    var tampered = new ArrayList<>(log);
    tampered.remove(11);
    
    var report = verifier().verify(tampered, expected);
    assertFailAt(11, report);
    assertEquals(10L, report.divergenceLowerBound().orElseThrow());
  }
  
  
  @Test
  public void testInsertion() {
    var log = FlightLogFixtures.sampleLog(12);
    var expected = seal(log, 5);
    
    var tampered = new ArrayList<>(log);
    tampered.add(7, FlightLogFixtures.entry(7).withTimestamp(0L));
    
    // the inserted entry declares index 7 at position 7; the displaced one repeats it at 8
    var report = verifier().verify(tampered, expected);
    assertFailAt(7, report);
    assertEquals(6L, report.divergenceLowerBound().orElseThrow());
    
    var dense = sealDense(log);
    assertFailAt(7, verifier().verify(tampered, dense));
  }
  
  
  @Test
  public void testInsertionAgainstDigestOnly() {
    var log = FlightLogFixtures.sampleLog(10);
    var tampered = new ArrayList<>(log);
    tampered.add(4, FlightLogFixtures.entry(4).withTimestamp(42L));
    
    assertFailAt(4, verifier().verify(tampered, seal(log)));
    assertFailAt(4, verifier().verify(tampered, seal(log, 1, 8)));
  }
  
  
  @Test
  public void testInsertionAfterLastMatched() {
    var log = FlightLogFixtures.sampleLog(10);
    var tampered = new ArrayList<>(log);
    // declares an index already matched by the checkpoint at 3
    tampered.add(5, FlightLogFixtures.entry(2));
    
    var report = verifier().verify(tampered, seal(log, 3));
    assertFailAt(5, report);
    assertEquals(4L, report.divergenceLowerBound().orElseThrow());
  }
  
  
  @Test
  public void testIndexEdited() {
    var log = FlightLogFixtures.sampleLog(10);
    var tampered = new ArrayList<>(log);
    tampered.set(6, log.get(6).toBuilder().index(5).build());
    
    assertFailAt(6, verifier().verify(tampered, seal(log)));
    assertFailAt(6, verifier().verify(tampered, sealDense(log)));
  }
  
  
  @Test
  public void testReorder() {
    var log = FlightLogFixtures.sampleLog(10);
    var tampered = new ArrayList<>(log);
    Collections.swap(tampered, 4, 6);
    
    assertFailAt(4, verifier().verify(tampered, sealDense(log)));
    assertFailAt(4, verifier().verify(tampered, seal(log, 2)));
  }
  
  
  @Test
  public void testSingleEditDetectedEverywhere() {
    final int count = 7;
    var log = FlightLogFixtures.sampleLog(count);
    var expected = sealDense(log);
    for (int index = 0; index < count; ++index) {
      var tampered = new ArrayList<>(log);
      tampered.set(index, log.get(index).toBuilder().put("tampered", true).build());
      assertFailAt(index, verifier().verify(tampered, expected));
    }
  }
  
  
  @Test
  public void testTruncated() {
    var log = FlightLogFixtures.sampleLog(10);
    var expected = seal(log, 3);
    
    var report = verifier().verify(log.subList(0, 6), expected);
    assertFailAt(6, report);
    assertEquals(4L, report.divergenceLowerBound().orElseThrow());
    var results = report.checkpointResults();
    assertEquals(PointStatus.MATCHED, results.get(0).status());
    assertEquals(PointStatus.MISSING, results.get(1).status());
    assertTrue(results.get(1).recomputedHash().isEmpty());
    
    assertFailAt(0, verifier().verify(List.of(), expected));
  }
  
  
  @Test
  public void testUncoveredSuffix() {
    var log = FlightLogFixtures.sampleLog(12);
    var expected = seal(log.subList(0, 9), 4);
    
    var report = verifier().verify(log, expected);
    assertEquals(Verdict.PASS, report.verdict());
    assertEquals(3L, report.uncoveredSuffixLength());
    assertEquals(12L, report.checkedEntryCount());
    assertEquals(12L, report.recomputedDigest().entryCount());
  }
  
  
  @Test
  public void testCheckpointsOnly() {
    var log = FlightLogFixtures.sampleLog(9);
    var builder = new ChainBuilder(ALGO, FlightLogFixtures.CLOCK);
    builder.appendAll(log);
    builder.checkpoint(2);
    builder.checkpoint(8);
    
    var report = verifier().verify(log, MISSION, builder.checkpoints());
    assertTrue(report.passed());
    assertTrue(report.expectedDigest().isEmpty());
    assertEquals(2, report.checkpointResults().size());
  }
  
  
  @Test
  public void testCheckpointEquivalence() {
    var log = FlightLogFixtures.sampleLog(15);
    var builder = new ChainBuilder(ALGO, FlightLogFixtures.CLOCK);
    builder.appendAll(log);
    for (long index : new long[] { 3, 6, 10, 12 })
      builder.checkpoint(index);
    var expected = TrustedRecord.of(MISSION, ALGO, builder.checkpoints())
        .withDigest(builder.digest(MISSION));
    Checkpoint trusted = builder.checkpoints().get(1);   // index 6
    
    // untouched
    var full = verifier().verify(log, expected);
    var suffix = verifier().verifyFrom(trusted, log.subList(7, 15), expected);
    assertEquals(full.verdict(), suffix.verdict());
    assertEquals(full.uncoveredSuffixLength(), suffix.uncoveredSuffixLength());
    assertTrue(full.recomputedDigest().sameCommitment(suffix.recomputedDigest()));
    
    // edits past the checkpoint
    for (int index = 7; index < 15; ++index) {
      var tampered = new ArrayList<>(log);
      tampered.set(index, log.get(index).withTimestamp(-1L));
      full = verifier().verify(tampered, expected);
      suffix = verifier().verifyFrom(trusted, tampered.subList(7, 15), expected);
      assertEquals(Verdict.FAIL, full.verdict());
      assertEquals(full.verdict(), suffix.verdict());
      assertEquals(full.firstDivergenceIndex(), suffix.firstDivergenceIndex());
      assertEquals(full.divergenceLowerBound(), suffix.divergenceLowerBound());
    }
    
    // deletion past the checkpoint
    var tampered = new ArrayList<>(log);
    tampered.remove(9);
    full = verifier().verify(tampered, expected);
    suffix = verifier().verifyFrom(trusted, tampered.subList(7, tampered.size()), expected);
    assertFailAt(9, full);
    assertEquals(full.firstDivergenceIndex(), suffix.firstDivergenceIndex());
  }
  
  
  @Test
  public void testAlgorithmMismatch() {
    var log = FlightLogFixtures.sampleLog(3);
    var builder = new ChainBuilder(HashAlgorithm.SHA3_256_V1);
    builder.appendAll(log);
    var digest = builder.digest(MISSION);
    
    var amx = assertThrows(
        AlgorithmMismatchException.class, () -> verifier().verify(log, digest));
    assertEquals(ALGO.id(), amx.expectedId());
    assertEquals(HashAlgorithm.SHA3_256_V1.id(), amx.actualId());
    
    assertTrue(new Verifier(HashAlgorithm.SHA3_256_V1).verify(log, digest).passed());
  }
  
  
  @Test
  public void testMalformedInputPropagates() {
    var log = new ArrayList<>(FlightLogFixtures.sampleLog(4));
    var expected = seal(log);
    log.set(2, LogEntry.of(2, 0L, "MSG", Map.of("text", "\uDC00")));
    var mix = assertThrows(MalformedInputException.class, () -> verifier().verify(log, expected));
    assertEquals(2L, mix.entryIndex().orElseThrow());
  }
  
  
  @Test
  public void testEmptyMission() {
    var expected = seal(List.of());
    assertEquals(0L, expected.expectedLength());
    var report = verifier().verify(List.of(), expected);
    assertTrue(report.passed());
    assertEquals(0L, report.checkedEntryCount());
    assertTrue(report.recomputedDigest().isEmpty());
  }

}
