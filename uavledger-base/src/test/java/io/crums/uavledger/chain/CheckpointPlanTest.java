/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.chain;


import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.TreeSet;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class CheckpointPlanTest {
  
  @Test
  public void testChunkEnds() {
    assertEquals(List.of(3L, 6L, 9L), List.copyOf(CheckpointPlan.chunkEnds(10, 3)));
    assertEquals(List.of(2L, 4L, 6L), List.copyOf(CheckpointPlan.chunkEnds(7, 3)));
    assertEquals(List.of(4L, 9L), List.copyOf(CheckpointPlan.chunkEnds(10, 2)));
    assertEquals(List.of(0L, 1L), List.copyOf(CheckpointPlan.chunkEnds(2, 5)));
    assertTrue(CheckpointPlan.chunkEnds(0, 3).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> CheckpointPlan.chunkEnds(5, 0));
  }
  
  @Test
  public void testEvenChunks() {
    var plan = CheckpointPlan.evenChunks(10, 3);
    var hits = new TreeSet<Long>();
    for (long index = 0; index < 10; ++index)
      if (plan.isCheckpoint(index))
        hits.add(index);
    assertEquals(CheckpointPlan.chunkEnds(10, 3), hits);
  }
  
  @Test
  public void testEvery() {
    var plan = CheckpointPlan.every(4);
    assertFalse(plan.isCheckpoint(0));
    assertTrue(plan.isCheckpoint(3));
    assertTrue(plan.isCheckpoint(7));
    assertFalse(plan.isCheckpoint(8));
    assertTrue(CheckpointPlan.every(1).isCheckpoint(0));
    assertThrows(IllegalArgumentException.class, () -> CheckpointPlan.every(0));
    assertFalse(CheckpointPlan.NONE.isCheckpoint(0));
  }

}
