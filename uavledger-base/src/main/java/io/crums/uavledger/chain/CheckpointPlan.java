/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.chain;


import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Decides at which indices a mission's chain is checkpointed.
 * Implementations are stateless.
 */
public interface CheckpointPlan {
  
  
  /** Never checkpoints. */
  public final static CheckpointPlan NONE = new CheckpointPlan() {
    @Override
    public boolean isCheckpoint(long index) {
      return false;
    }
    @Override
    public String toString() {
      return "CheckpointPlan.NONE";
    }
  };
  
  
  /**
   * Returns a plan that checkpoints every {@code interval} entries: at indices
   * {@code interval - 1, 2 * interval - 1, ..}. An interval of 1 checkpoints
   * every entry.
   * 
   * @param interval    &ge; 1
   */
  public static CheckpointPlan every(long interval) {
    if (interval < 1L)
      throw new IllegalArgumentException("interval: " + interval);
    return new CheckpointPlan() {
      @Override
      public boolean isCheckpoint(long index) {
        return (index + 1) % interval == 0;
      }
      @Override
      public String toString() {
        return "CheckpointPlan.every(" + interval + ")";
      }
    };
  }
  
  
  /**
   * Returns a plan checkpointing exactly the given indices.
   */
  public static CheckpointPlan at(SortedSet<Long> indices) {
    var copy = Collections.unmodifiableSortedSet(new TreeSet<>(indices));
    return new CheckpointPlan() {
      @Override
      public boolean isCheckpoint(long index) {
        return copy.contains(index);
      }
      @Override
      public String toString() {
        return "CheckpointPlan.at(" + copy + ")";
      }
    };
  }
  
  
  /**
   * Returns a plan that splits {@code total} entries into {@code chunks}
   * cumulative uploads and checkpoints the last entry of each. The
   * remainder of {@code total / chunks} is distributed one apiece to the
   * earliest chunks. (E.g. 10 entries in 3 chunks checkpoints indices 3, 6
   * and 9.) Empty chunks (when {@code chunks > total}) are skipped.
   * 
   * @param total       total no. of entries (&ge; 0)
   * @param chunks      no. of chunks (&ge; 1)
   * 
   * @see #chunkEnds(long, int)
   */
  public static CheckpointPlan evenChunks(long total, int chunks) {
    return at(chunkEnds(total, chunks));
  }
  
  
  /**
   * Returns the last index of each (non-empty) chunk.
   * 
   * @see #evenChunks(long, int)
   */
  public static SortedSet<Long> chunkEnds(long total, int chunks) {
    if (total < 0L)
      throw new IllegalArgumentException("total: " + total);
    if (chunks < 1)
      throw new IllegalArgumentException("chunks: " + chunks);
    
    long base = total / chunks;
    long rem = total % chunks;
    var ends = new TreeSet<Long>();
    long acc = 0;
    for (int index = 0; index < chunks; ++index) {
      acc += base + (index < rem ? 1 : 0);
      if (acc > 0)
        ends.add(acc - 1);
    }
    return ends;
  }
  
  
  /**
   * Determines whether the link at the given index is to be checkpointed.
   */
  boolean isCheckpoint(long index);

}
