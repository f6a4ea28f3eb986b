/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.verify;


import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.Optional;

/**
 * The verification outcome at one expected point.
 * 
 * @param index           the expected point's index
 * @param expectedHash    the expected chain hash
 * @param recomputedHash  the recomputed chain hash, if the run reached this index
 * @param status          the outcome
 */
public record CheckpointResult(
    long index, ByteBuffer expectedHash,
    Optional<ByteBuffer> recomputedHash, PointStatus status) {
  
  public CheckpointResult {
    if (index < 0L)
      throw new IllegalArgumentException("index: " + index);
    expectedHash = expectedHash.asReadOnlyBuffer();
    recomputedHash = recomputedHash.map(ByteBuffer::asReadOnlyBuffer);
    Objects.requireNonNull(status, "null status");
    boolean reached = status == PointStatus.MATCHED || status == PointStatus.MISMATCHED;
    if (reached != recomputedHash.isPresent())
      throw new IllegalArgumentException(
          "recomputedHash presence (%b) inconsistent with status %s"
          .formatted(recomputedHash.isPresent(), status));
  }
  
  
  @Override
  public ByteBuffer expectedHash() {
    return expectedHash.duplicate();
  }
  
  @Override
  public Optional<ByteBuffer> recomputedHash() {
    return recomputedHash.map(ByteBuffer::duplicate);
  }

}
