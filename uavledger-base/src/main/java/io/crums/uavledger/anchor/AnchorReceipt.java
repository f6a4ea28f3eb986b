/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.anchor;


import java.nio.ByteBuffer;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Acknowledgement that a {@linkplain io.crums.uavledger.chain.MissionDigest
 * MissionDigest} was recorded by an {@linkplain Anchor}.
 * 
 * @param anchorName    identifies the anchor (e.g. a contract address)
 * @param missionId     the digest's mission
 * @param entryCount    the digest's entry count
 * @param digestHash    the digest's {@linkplain io.crums.uavledger.chain.MissionDigest#hash() hash}
 * @param receiptNo     the anchor's sequence number for this record (&ge; 0)
 * @param anchoredAt    UTC millis the anchor recorded the digest
 */
public record AnchorReceipt(
    String anchorName, String missionId, long entryCount,
    ByteBuffer digestHash, long receiptNo, long anchoredAt) {
  
  public AnchorReceipt {
    Objects.requireNonNull(anchorName, "null anchorName");
    Objects.requireNonNull(missionId, "null missionId");
    digestHash = ByteBuffer.allocate(digestHash.remaining())
        .put(digestHash.duplicate()).flip().asReadOnlyBuffer();
    if (entryCount < 0L || receiptNo < 0L)
      throw new IllegalArgumentException(
          "entryCount %d, receiptNo %d".formatted(entryCount, receiptNo));
  }
  
  @Override
  public ByteBuffer digestHash() {
    return digestHash.duplicate();
  }
  
  @Override
  public String toString() {
    var hex = new byte[Math.min(4, digestHash.remaining())];
    digestHash().get(hex);
    return "AnchorReceipt[%s#%d, %s, %d entries, %s..]".formatted(
        anchorName, receiptNo, missionId, entryCount, HexFormat.of().formatHex(hex));
  }
}
