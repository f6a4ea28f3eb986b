/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.chain;


import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.crums.uavledger.FlightLogFixtures;
import io.crums.uavledger.HashAlgorithm;
import io.crums.uavledger.SequenceException;
import io.crums.uavledger.entry.EntryHasher;

/**
 * 
 */
public class ChainBuilderTest {
  
  final static HashAlgorithm ALGO = HashAlgorithm.SHA256_V1;
  
  
  @Test
  public void testEmpty() {
    var builder = new ChainBuilder(ALGO, FlightLogFixtures.CLOCK);
    assertTrue(builder.isEmpty());
    assertEquals(0L, builder.entryCount());
    assertTrue(builder.lastLink().isEmpty());
    assertEquals(ALGO.genesisHash(), builder.headHash());
    assertThrows(IllegalStateException.class, () -> builder.checkpoint());
  }
  
  
  @Test
  public void testLinks() {
    var builder = new ChainBuilder(ALGO, FlightLogFixtures.CLOCK);
    var log = FlightLogFixtures.sampleLog(5);
    builder.appendAll(log);
    assertEquals(5L, builder.entryCount());
    
    var hasher = new EntryHasher(ALGO);
    ByteBuffer prev = ALGO.genesisHash();
    for (int index = 0; index < 5; ++index) {
      var link = builder.link(index);
      assertEquals(index, link.index());
      assertEquals(index == 0, link.isGenesis());
      assertEquals(hasher.hash(log.get(index)), link.entryHash());
      assertEquals(prev, link.prevChainHash());
      assertEquals(
          ChainBuilder.chainHash(link.entryHash(), prev, index, ALGO.newDigest()),
          link.chainHash());
      prev = link.chainHash();
    }
    assertEquals(prev, builder.headHash());
    assertEquals(builder.link(4), builder.lastLink().orElseThrow());
  }
  
  
  @Test
  public void testFunctionalAppendAgrees() {
    var builder = new ChainBuilder(ALGO);
    ChainLink prev = null;
    for (var entry : FlightLogFixtures.sampleLog(4)) {
      prev = ChainBuilder.append(prev, entry, ALGO);
      assertEquals(builder.append(entry), prev);
    }
  }
  
  
  @Test
  public void testDeterministic() {
    var a = new ChainBuilder(ALGO);
    var b = new ChainBuilder(ALGO);
    a.appendAll(FlightLogFixtures.sampleLog(10));
    b.appendAll(FlightLogFixtures.sampleLog(10));
    assertEquals(a.headHash(), b.headHash());
    assertEquals(a.links(), b.links());
  }
  
  
  @Test
  public void testIndexIsBound() {
    // same entry content, different positions, different chain hashes
    var entryHash = ALGO.genesisHash();
    var digest = ALGO.newDigest();
    var h0 = ChainBuilder.chainHash(entryHash, ALGO.genesisHash(), 0, digest);
    var h1 = ChainBuilder.chainHash(entryHash, ALGO.genesisHash(), 1, digest);
    assertNotEquals(h0, h1);
  }
  
  
  @Test
  public void testOutOfSequence() {
    var builder = new ChainBuilder(ALGO);
    builder.appendAll(FlightLogFixtures.sampleLog(3));
    var sx = assertThrows(
        SequenceException.class, () -> builder.append(FlightLogFixtures.entry(1)));
    assertTrue(sx.getMessage().contains("append-only"));
    sx = assertThrows(
        SequenceException.class, () -> builder.append(FlightLogFixtures.entry(4)));
    assertTrue(sx.getMessage().contains("gap"));
    assertEquals(3L, builder.entryCount());
    
    assertThrows(
        SequenceException.class, () -> ChainBuilder.append(null, FlightLogFixtures.entry(1), ALGO));
  }
  
  
  @Test
  public void testCheckpoints() {
    var builder = new ChainBuilder(ALGO, FlightLogFixtures.CLOCK);
    builder.appendAll(FlightLogFixtures.sampleLog(8));
    var cp5 = builder.checkpoint(5);
    var cp2 = builder.checkpoint(2);
    var cp7 = builder.checkpoint();
    assertEquals(7L, cp7.index());
    assertEquals(8L, cp7.entryCount());
    assertEquals(FlightLogFixtures.CLOCK.millis(), cp7.timestamp());
    assertSame(cp5, builder.checkpoint(builder.link(5)));
    assertEquals(List.of(cp2, cp5, cp7), builder.checkpoints());
    assertTrue(cp5.matches(builder.link(5)));
    assertFalse(cp5.matches(builder.link(4)));
    
    var other = new ChainBuilder(ALGO);
    var log = FlightLogFixtures.sampleLog(3);
    other.append(log.get(0));
    other.append(log.get(1));
    var foreign = other.append(log.get(2).withTimestamp(0L));
    assertThrows(IllegalArgumentException.class, () -> builder.checkpoint(foreign));
  }
  
  
  @Test
  public void testResume() {
    var full = new ChainBuilder(ALGO, FlightLogFixtures.CLOCK);
    var log = FlightLogFixtures.sampleLog(10);
    full.appendAll(log);
    var cp = full.checkpoint(3);
    
    var resumed = ChainBuilder.resume(cp, ALGO, FlightLogFixtures.CLOCK);
    assertEquals(4L, resumed.nextIndex());
    assertEquals(4L, resumed.baseIndex());
    assertTrue(resumed.isEmpty());
    resumed.appendAll(log.subList(4, 10));
    assertEquals(full.headHash(), resumed.headHash());
    assertEquals(full.link(7), resumed.link(7));
    assertThrows(IndexOutOfBoundsException.class, () -> resumed.link(3));
    assertEquals(full.digest("M-1").hash(), resumed.digest("M-1").hash());
  }

}
