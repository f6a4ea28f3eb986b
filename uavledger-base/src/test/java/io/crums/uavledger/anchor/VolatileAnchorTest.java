/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.anchor;


import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;

import org.junit.jupiter.api.Test;

import io.crums.uavledger.FlightLogFixtures;
import io.crums.uavledger.HashAlgorithm;
import io.crums.uavledger.chain.ChainBuilder;
import io.crums.uavledger.verify.Verifier;

/**
 * 
 */
public class VolatileAnchorTest {
  
  final static HashAlgorithm ALGO = HashAlgorithm.SHA256_V1;

  @Test
  public void testAppendOnly() {
    var anchor = new VolatileAnchor("test", FlightLogFixtures.CLOCK);
    var log = FlightLogFixtures.sampleLog(9);
    var builder = new ChainBuilder(ALGO, FlightLogFixtures.CLOCK);
    
    builder.appendAll(log.subList(0, 4));
    var d4 = builder.digest("M");
    var r0 = anchor.anchor(d4);
    assertEquals("test", r0.anchorName());
    assertEquals(0L, r0.receiptNo());
    assertEquals(4L, r0.entryCount());
    assertEquals(d4.hash(), r0.digestHash());
    
    builder.appendAll(log.subList(4, 9));
    var d9 = builder.digest("M");
    assertEquals(1L, anchor.anchor(d9).receiptNo());
    
    assertThrows(AnchorException.class, () -> anchor.anchor(d4));
    
    var other = new ChainBuilder(ALGO);
    other.appendAll(FlightLogFixtures.sampleLog(9).subList(0, 8));
    other.append(log.get(8).withTimestamp(0L));
    assertThrows(AnchorException.class, () -> anchor.anchor(other.digest("M")));
    
    assertEquals(2, anchor.digests("M").size());
    assertTrue(anchor.digests("X").isEmpty());
  }
  
  
  @Test
  public void testClose() {
    var anchor = new VolatileAnchor();
    var builder = new ChainBuilder(ALGO);
    builder.appendAll(FlightLogFixtures.sampleLog(3));
    assertThrows(AnchorException.class, () -> anchor.close("M"));
    anchor.anchor(builder.digest("M"));
    assertFalse(anchor.isClosed("M"));
    anchor.close("M");
    assertTrue(anchor.isClosed("M"));
    assertThrows(AnchorException.class, () -> anchor.anchor(builder.digest("M")));
  }
  
  
  @Test
  public void testTrustedRecord() {
    var anchor = new VolatileAnchor();
    var log = FlightLogFixtures.sampleLog(10);
    var builder = new ChainBuilder(ALGO);
    for (int index = 0; index < 10; ++index) {
      builder.append(log.get(index));
      if (index % 3 == 2)
        anchor.anchor(builder.digest("M"));
    }
    anchor.anchor(builder.digest("M"));
    assertTrue(anchor.trustedRecord("nope").isEmpty());
    
    var record = anchor.trustedRecord("M").orElseThrow();
    assertEquals(3, record.checkpoints().size());
    assertEquals(10L, record.expectedLength());
    
    var verifier = new Verifier(ALGO);
    assertTrue(verifier.verify(log, record).passed());
    
    var tampered = new ArrayList<>(log);
    tampered.set(4, log.get(4).withTimestamp(0L));
    var report = verifier.verify(tampered, record);
    assertEquals(5L, report.firstDivergenceIndex().orElseThrow());
    assertEquals(3L, report.divergenceLowerBound().orElseThrow());
  }

}
