/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.anchor;


import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.crums.uavledger.chain.Checkpoint;
import io.crums.uavledger.chain.MissionDigest;
import io.crums.uavledger.verify.TrustedRecord;

/**
 * In-memory {@linkplain Anchor}. Stands in for an external ledger in tests
 * and simulations. Per mission, the recorded digests are append-only:
 * each must cover at least as many entries as the one before it, use the
 * same algorithm, and (if it covers the same number) commit to the same
 * chain. Synchronized.
 */
public class VolatileAnchor implements Anchor {
  
  private final String name;
  private final Clock clock;
  
  private final Map<String, List<MissionDigest>> missions = new HashMap<>();
  private final Map<String, Boolean> closed = new HashMap<>();
  private long receiptCount;
  
  
  public VolatileAnchor() {
    this("volatile", Clock.systemUTC());
  }
  
  /**
   * @param name    the name reported in receipts
   * @param clock   stamps receipts
   */
  public VolatileAnchor(String name, Clock clock) {
    this.name = Objects.requireNonNull(name, "null name");
    this.clock = Objects.requireNonNull(clock, "null clock");
  }
  

  @Override
  public synchronized AnchorReceipt anchor(MissionDigest digest) throws AnchorException {
    var missionId = digest.missionId();
    if (isClosed(missionId))
      throw new AnchorException("mission " + missionId + " is closed");
    
    var history = missions.computeIfAbsent(missionId, id -> new ArrayList<>());
    if (!history.isEmpty()) {
      var last = history.get(history.size() - 1);
      if (last.algorithm() != digest.algorithm())
        throw new AnchorException(
            "mission %s anchored under %s; rejecting %s digest"
            .formatted(missionId, last.algorithm().id(), digest.algorithm().id()));
      if (digest.entryCount() < last.entryCount())
        throw new AnchorException(
            "mission %s already anchored at %d entries; rejecting %d"
            .formatted(missionId, last.entryCount(), digest.entryCount()));
      if (digest.entryCount() == last.entryCount() && !digest.sameCommitment(last))
        throw new AnchorException(
            "conflicting digest for mission %s at %d entries"
            .formatted(missionId, digest.entryCount()));
    }
    history.add(digest);
    return new AnchorReceipt(
        name, missionId, digest.entryCount(), digest.hash(), receiptCount++, clock.millis());
  }
  
  
  @Override
  public synchronized void close(String missionId) throws AnchorException {
    if (!missions.containsKey(missionId))
      throw new AnchorException("unknown mission: " + missionId);
    closed.put(missionId, Boolean.TRUE);
  }
  
  
  public synchronized boolean isClosed(String missionId) {
    return closed.getOrDefault(missionId, Boolean.FALSE);
  }
  
  
  /** Returns the anchored digests for the given mission, in anchoring order. */
  public synchronized List<MissionDigest> digests(String missionId) {
    var history = missions.get(missionId);
    return history == null ? List.of() : List.copyOf(history);
  }
  
  
  /**
   * Returns what this anchor knows about the given mission as a trusted
   * record: the latest digest, with every earlier (non-empty) digest
   * standing in as a checkpoint.
   * 
   * @return empty, if the mission was never anchored
   */
  public synchronized Optional<TrustedRecord> trustedRecord(String missionId) {
    var history = missions.get(missionId);
    if (history == null)
      return Optional.empty();
    
    var latest = history.get(history.size() - 1);
    var checkpoints = new ArrayList<Checkpoint>();
    for (int index = 0; index < history.size() - 1; ++index)
      history.get(index).toCheckpoint().ifPresent(checkpoints::add);
    
    return Optional.of(
        TrustedRecord.of(missionId, latest.algorithm(), checkpoints).withDigest(latest));
  }

}
