/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger;


import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.crums.uavledger.anchor.Anchor;
import io.crums.uavledger.anchor.AnchorException;
import io.crums.uavledger.anchor.AnchorReceipt;
import io.crums.uavledger.chain.ChainBuilder;
import io.crums.uavledger.chain.ChainLink;
import io.crums.uavledger.chain.Checkpoint;
import io.crums.uavledger.chain.CheckpointPlan;
import io.crums.uavledger.chain.MissionDigest;
import io.crums.uavledger.entry.LogEntry;

/**
 * A mission's single append stream. Entries are chained as they arrive;
 * wherever the {@linkplain CheckpointPlan plan} says so, a checkpoint is
 * recorded and the digest up to that point is anchored. Closing the
 * session finalizes and anchors the mission digest.
 * 
 * <h2>Anchor Failures</h2>
 * <p>
 * An intermediate digest the anchor fails to record is logged (at
 * {@code WARNING}) and counted; the mission goes on. Failure to anchor the
 * final digest, on the other hand, propagates from {@linkplain #close()}.
 * </p>
 * <p>
 * Not thread-safe.
 * </p>
 */
public class MissionSession {
  
  private final static System.Logger LOG = Constants.getLogger();
  
  
  /**
   * Opens a session for a new mission using the default algorithm.
   * 
   * @param missionId   mission identifier
   * @param plan        checkpoint schedule
   * @param anchor      the anchor (may be {@code null})
   */
  public static MissionSession open(String missionId, CheckpointPlan plan, Anchor anchor) {
    return new MissionSession(missionId, new ChainBuilder(), plan, anchor);
  }
  
  
  private final String missionId;
  private final ChainBuilder builder;
  private final CheckpointPlan plan;
  private final Anchor anchor;
  
  private final List<AnchorReceipt> receipts = new ArrayList<>();
  private int anchorFailures;
  private SealedMission sealed;
  
  
  /**
   * Full constructor.
   * 
   * @param missionId   not blank
   * @param builder     the mission's chain (possibly {@linkplain ChainBuilder#resume resumed})
   * @param plan        checkpoint schedule
   * @param anchor      optional anchor (may be {@code null})
   */
  public MissionSession(String missionId, ChainBuilder builder, CheckpointPlan plan, Anchor anchor) {
    this.missionId = Objects.requireNonNull(missionId, "null missionId");
    this.builder = Objects.requireNonNull(builder, "null builder");
    this.plan = Objects.requireNonNull(plan, "null plan");
    this.anchor = anchor;
    if (missionId.isBlank())
      throw new IllegalArgumentException("blank missionId");
  }
  
  
  public String missionId() {
    return missionId;
  }
  
  /** Returns the underlying chain. Don't append to it directly. */
  public ChainBuilder chain() {
    return builder;
  }
  
  public boolean isClosed() {
    return sealed != null;
  }
  
  
  /**
   * Appends the given entry, recording (and anchoring) a checkpoint if the
   * plan calls for one at its index.
   * 
   * @return the new link
   * @throws IllegalStateException if the session is closed
   * @throws SequenceException if the entry is out of sequence
   * @throws MalformedInputException if the entry cannot be canonicalized
   */
  public ChainLink append(LogEntry entry)
      throws IllegalStateException, SequenceException, MalformedInputException {
    checkOpen();
    var link = builder.append(entry);
    if (plan.isCheckpoint(link.index())) {
      builder.checkpoint(link);
      anchorIntermediate();
    }
    return link;
  }
  
  
  /**
   * Appends the given entries in order.
   * 
   * @see #append(LogEntry)
   */
  public List<ChainLink> appendAll(Collection<LogEntry> entries) {
    var links = new ArrayList<ChainLink>(entries.size());
    for (var entry : entries)
      links.add(append(entry));
    return links;
  }
  
  
  private void checkOpen() {
    if (sealed != null)
      throw new IllegalStateException("mission " + missionId + " is closed");
  }
  
  
  private void anchorIntermediate() {
    if (anchor == null)
      return;
    var digest = builder.digest(missionId);
    try {
      receipts.add(anchor.anchor(digest));
      LOG.log(Level.TRACE, "anchored {0} at {1} entries", missionId, digest.entryCount());
    } catch (AnchorException ax) {
      ++anchorFailures;
      LOG.log(Level.WARNING,
          "failed to anchor checkpoint digest for mission " + missionId +
          " at " + digest.entryCount() + " entries (continuing): " + ax.getMessage(), ax);
    }
  }
  
  
  /** Returns the receipts collected so far. */
  public List<AnchorReceipt> receipts() {
    return Collections.unmodifiableList(receipts);
  }
  
  /** Returns the number of intermediate digests that failed to anchor. */
  public int anchorFailures() {
    return anchorFailures;
  }
  
  /** Returns the checkpoints recorded so far. */
  public List<Checkpoint> checkpoints() {
    return builder.checkpoints();
  }
  
  
  /**
   * Finalizes the mission digest, anchors it (if there's an anchor) and
   * closes the mission at the anchor. Idempotent: subsequent invocations
   * return the same instance.
   * 
   * @throws AnchorException if the final digest could not be anchored or
   *         the mission closed (the session stays open, and the call may be retried)
   */
  public SealedMission close() throws AnchorException {
    if (sealed != null)
      return sealed;
    
    MissionDigest digest = builder.digest(missionId);
    var allReceipts = new ArrayList<>(receipts);
    if (anchor != null) {
      allReceipts.add(anchor.anchor(digest));
      anchor.close(missionId);
    }
    sealed = new SealedMission(digest, builder.checkpoints(), allReceipts, anchorFailures);
    LOG.log(Level.DEBUG, "sealed {0}: {1} entries, {2} checkpoints, {3} anchor failures",
        missionId, digest.entryCount(), sealed.checkpoints().size(), anchorFailures);
    return sealed;
  }

}
