/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger;


import java.util.List;
import java.util.Objects;

import io.crums.uavledger.anchor.AnchorReceipt;
import io.crums.uavledger.chain.Checkpoint;
import io.crums.uavledger.chain.MissionDigest;
import io.crums.uavledger.verify.TrustedRecord;

/**
 * What a closed {@linkplain MissionSession} leaves behind.
 * 
 * @param digest          the final mission digest
 * @param checkpoints     the checkpoints recorded during the mission, in index order
 * @param receipts        anchor receipts (intermediate and final), in anchoring order
 * @param anchorFailures  number of intermediate digests the anchor failed to record
 */
public record SealedMission(
    MissionDigest digest, List<Checkpoint> checkpoints,
    List<AnchorReceipt> receipts, int anchorFailures) {
  
  public SealedMission {
    Objects.requireNonNull(digest, "null digest");
    checkpoints = List.copyOf(checkpoints);
    receipts = List.copyOf(receipts);
    if (anchorFailures < 0)
      throw new IllegalArgumentException("anchorFailures: " + anchorFailures);
  }
  
  
  public String missionId() {
    return digest.missionId();
  }
  
  
  /**
   * Returns the checkpoints and digest as a record later logs can be
   * verified against.
   */
  public TrustedRecord trustedRecord() {
    return TrustedRecord.of(digest.missionId(), digest.algorithm(), checkpoints)
        .withDigest(digest);
  }

}
