/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.anchor;


import io.crums.uavledger.chain.MissionDigest;

/**
 * Records mission digests in some external, append-only ledger (a
 * blockchain contract, a timestamping service, ..). This is the only
 * outbound interface of the engine; how an implementation reaches its
 * ledger is its own business.
 * 
 * <p>
 * A mission is registered implicitly by its first anchored digest.
 * Intermediate digests (one per checkpoint) may precede the final one.
 * </p>
 */
@FunctionalInterface
public interface Anchor {
  
  /**
   * Records the given digest.
   * 
   * @return the anchor's receipt
   * @throws AnchorException if the digest could not be recorded
   */
  AnchorReceipt anchor(MissionDigest digest) throws AnchorException;
  
  
  /**
   * Marks the mission closed: no further digests will be accepted for it.
   * The base implementation does nothing.
   * 
   * @throws AnchorException if the mission could not be closed
   */
  default void close(String missionId) throws AnchorException {  }

}
