/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.chain;


import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.crums.uavledger.Constants;
import io.crums.uavledger.HashAlgorithm;
import io.crums.uavledger.MalformedInputException;
import io.crums.uavledger.SequenceException;
import io.crums.uavledger.entry.Canonicalizer;
import io.crums.uavledger.entry.EntryHasher;
import io.crums.uavledger.entry.LogEntry;

/**
 * Builds a mission's hash chain, one entry at a time. The chain is
 * append-only: entries must arrive with consecutive indices, and nothing
 * once appended is ever revised. The builder owns its links (an arena
 * indexed by sequence index) and its recorded {@linkplain Checkpoint}s.
 * 
 * <h2>Single Producer</h2>
 * <p>
 * Instances are <em>not</em> thread-safe and do no internal locking. A
 * chain under construction is appended to by one producer (one append
 * stream per mission); callers sharing an instance serialize their own
 * access.
 * </p>
 * 
 * @see #append(ChainLink, LogEntry, HashAlgorithm)
 * @see #resume(Checkpoint, HashAlgorithm)
 */
public class ChainBuilder {
  
  
  /**
   * Computes and returns the next link in a chain. This is the functional
   * form of the append operation; it touches no builder state.
   * 
   * @param prev        the previous link, or {@code null} if {@code entry}
   *                    is the first in the chain
   * @param entry       with index {@code prev.index() + 1} (or zero, if
   *                    {@code prev} is {@code null})
   * @param algo        the hashing scheme (the same one {@code prev} was built with)
   * 
   * @throws SequenceException if the entry's index is out of sequence
   * @throws MalformedInputException if the entry cannot be canonicalized
   */
  public static ChainLink append(ChainLink prev, LogEntry entry, HashAlgorithm algo)
      throws SequenceException, MalformedInputException {
    
    long expected = prev == null ? 0L : prev.index() + 1;
    checkSequence(expected, entry.index());
    var digest = algo.newDigest();
    var entryHash = new EntryHasher(algo).hash(Canonicalizer.canonicalize(entry), digest);
    var prevHash = prev == null ? algo.genesisHash() : prev.chainHash();
    return linkAt(expected, entryHash, prevHash, digest);
  }
  
  
  private static void checkSequence(long expected, long actual) throws SequenceException {
    if (actual == expected)
      return;
    if (actual < expected)
      throw new SequenceException(
          "attempt to append entry at index %d; chain length is already %d (chain is append-only)"
          .formatted(actual, expected));
    throw new SequenceException(
        "gap in indices: expected entry at index %d; actual %d"
        .formatted(expected, actual));
  }
  
  
  /**
   * Computes and returns the link at the given position. The declared index
   * of the entry (if any) plays no role here: the given {@code index} is
   * what is hashed.
   * 
   * @param index           the position in the chain (&ge; 0)
   * @param entryHash       the entry's content hash
   * @param prevChainHash   the previous link's chain hash (or the genesis constant)
   * @param digest          work digest
   */
  public static ChainLink linkAt(
      long index, ByteBuffer entryHash, ByteBuffer prevChainHash, MessageDigest digest) {
    
    var chainHash = chainHash(entryHash, prevChainHash, index, digest);
    return new ChainLink(index, entryHash, prevChainHash, chainHash);
  }
  
  
  /**
   * Returns {@code H(entryHash || prevChainHash || index)}, with {@code index}
   * written as an 8-byte big endian integer. The argument buffers' positions
   * are not modified.
   */
  public static ByteBuffer chainHash(
      ByteBuffer entryHash, ByteBuffer prevChainHash, long index, MessageDigest digest) {
    
    if (index < 0L)
      throw new IllegalArgumentException("index: " + index);
    digest.reset();
    digest.update(entryHash.duplicate());
    digest.update(prevChainHash.duplicate());
    digest.update(ByteBuffer.allocate(8).putLong(index).flip());
    return ByteBuffer.wrap(digest.digest()).asReadOnlyBuffer();
  }
  
  
  /**
   * Returns a builder that continues the chain just past the given trusted
   * checkpoint. The prefix up to the checkpoint is not rehashed (nor known):
   * the first entry appended must have index {@code checkpoint.index() + 1}.
   * 
   * @param checkpoint  trusted anchor
   * @param algo        the scheme the checkpoint was computed under
   */
  public static ChainBuilder resume(Checkpoint checkpoint, HashAlgorithm algo) {
    return resume(checkpoint, algo, Clock.systemUTC());
  }
  
  
  /**
   * Returns a builder that continues the chain just past the given trusted
   * checkpoint, using the given clock to stamp new checkpoints.
   * 
   * @see #resume(Checkpoint, HashAlgorithm)
   */
  public static ChainBuilder resume(Checkpoint checkpoint, HashAlgorithm algo, Clock clock) {
    if (checkpoint.chainHash().remaining() != algo.hashWidth())
      throw new IllegalArgumentException(
          "checkpoint hash width does not match " + algo.id() + ": " + checkpoint);
    return new ChainBuilder(algo, clock, checkpoint.index() + 1, checkpoint.chainHash());
  }
  
  
  
  private final HashAlgorithm algo;
  private final Clock clock;
  private final EntryHasher hasher;
  private final MessageDigest digest;
  
  /** Index of the first link in the arena. */
  private final long baseIndex;
  /** Chain hash preceding the first link in the arena. */
  private final ByteBuffer baseHash;
  
  private final ArrayList<ChainLink> links = new ArrayList<>();
  private final ArrayList<Checkpoint> checkpoints = new ArrayList<>();
  
  
  /**
   * Creates an empty chain using the {@linkplain Constants#DEFAULT_ALGORITHM
   * default algorithm} and the system UTC clock.
   */
  public ChainBuilder() {
    this(Constants.DEFAULT_ALGORITHM);
  }
  
  /**
   * Creates an empty chain using the system UTC clock.
   */
  public ChainBuilder(HashAlgorithm algo) {
    this(algo, Clock.systemUTC());
  }
  
  /**
   * Creates an empty chain.
   * 
   * @param algo        the hashing scheme
   * @param clock       used to timestamp checkpoints and digests
   */
  public ChainBuilder(HashAlgorithm algo, Clock clock) {
    this(algo, clock, 0L, algo.genesisHash());
  }
  
  
  private ChainBuilder(HashAlgorithm algo, Clock clock, long baseIndex, ByteBuffer baseHash) {
    this.algo = Objects.requireNonNull(algo, "null algo");
    this.clock = Objects.requireNonNull(clock, "null clock");
    this.hasher = new EntryHasher(algo);
    this.digest = algo.newDigest();
    this.baseIndex = baseIndex;
    this.baseHash = baseHash.asReadOnlyBuffer();
  }
  
  
  /** Returns the hashing scheme. */
  public HashAlgorithm algorithm() {
    return algo;
  }
  
  
  /**
   * Appends the given entry to the chain.
   * 
   * @param entry       with index {@linkplain #nextIndex()}
   * @return the new last link
   * 
   * @throws SequenceException if the entry's index is not {@code nextIndex()}
   * @throws MalformedInputException if the entry cannot be canonicalized
   */
  public ChainLink append(LogEntry entry) throws SequenceException, MalformedInputException {
    final long index = nextIndex();
    checkSequence(index, entry.index());
    var entryHash = hasher.hash(Canonicalizer.canonicalize(entry), digest);
    var link = linkAt(index, entryHash, headHash(), digest);
    links.add(link);
    return link;
  }
  
  
  /**
   * Appends the given entries in iteration order.
   * On failure, the entries before the failed one remain appended.
   * 
   * @return the new links (in order)
   */
  public List<ChainLink> appendAll(Collection<LogEntry> entries)
      throws SequenceException, MalformedInputException {
    var out = new ArrayList<ChainLink>(entries.size());
    for (var entry : entries)
      out.add(append(entry));
    return Collections.unmodifiableList(out);
  }
  
  
  /** Returns the index the next appended entry must have. */
  public long nextIndex() {
    return baseIndex + links.size();
  }
  
  
  /**
   * Returns the number of entries the head of the chain commits to.
   * For a {@linkplain #resume(Checkpoint, HashAlgorithm) resumed} chain
   * this includes the entries before the checkpoint.
   * 
   * @return {@code nextIndex()}
   */
  public long entryCount() {
    return nextIndex();
  }
  
  
  /** Determines whether no entries have been appended to this instance. */
  public boolean isEmpty() {
    return links.isEmpty();
  }
  
  
  /**
   * Returns the first index whose link this instance knows. Zero, unless resumed.
   */
  public long baseIndex() {
    return baseIndex;
  }
  
  
  /**
   * Returns the link at the given index.
   * 
   * @param index       &ge; {@linkplain #baseIndex()} and &lt; {@linkplain #nextIndex()}
   */
  public ChainLink link(long index) throws IndexOutOfBoundsException {
    if (index < baseIndex || index >= nextIndex())
      throw new IndexOutOfBoundsException(
          "index %d not in [%d, %d)".formatted(index, baseIndex, nextIndex()));
    return links.get((int) (index - baseIndex));
  }
  
  
  /** Returns the last link, if any were appended. */
  public Optional<ChainLink> lastLink() {
    return links.isEmpty() ? Optional.empty() : Optional.of(links.get(links.size() - 1));
  }
  
  
  /**
   * Returns the chain hash at the head of the chain: the last link's chain
   * hash, or if empty, the genesis constant (or the resumed checkpoint's hash).
   * 
   * @return a new read-only view
   */
  public ByteBuffer headHash() {
    return links.isEmpty() ? baseHash.duplicate() : links.get(links.size() - 1).chainHash();
  }
  
  
  /** Returns a read-only view of the links, in index order. */
  public List<ChainLink> links() {
    return Collections.unmodifiableList(links);
  }
  
  
  
  /**
   * Records and returns a checkpoint at the given link. This is a snapshot:
   * the chain itself is unaffected. If a checkpoint at the link's index is
   * already recorded, that instance is returned.
   * 
   * @param link        a link in this chain
   * 
   * @throws IllegalStateException if nothing has been appended yet
   * @throws IllegalArgumentException if {@code link} is not in this chain
   */
  public Checkpoint checkpoint(ChainLink link)
      throws IllegalStateException, IllegalArgumentException {
    
    if (links.isEmpty())
      throw new IllegalStateException("no entries appended");
    long index = link.index();
    if (index < baseIndex || index >= nextIndex() || !link(index).equals(link))
      throw new IllegalArgumentException("not a link in this chain: " + link);
    
    int searchIndex = Collections.binarySearch(
        checkpoints, new Checkpoint(index, link.chainHash(), 0L));
    if (searchIndex >= 0)
      return checkpoints.get(searchIndex);
    
    var checkpoint = new Checkpoint(index, link.chainHash(), clock.millis());
    checkpoints.add(-1 - searchIndex, checkpoint);
    
    Constants.getLogger().log(Level.TRACE, "checkpoint recorded: " + checkpoint);
    return checkpoint;
  }
  
  
  /**
   * Records and returns a checkpoint at the last link.
   * 
   * @throws IllegalStateException if nothing has been appended yet
   */
  public Checkpoint checkpoint() throws IllegalStateException {
    return checkpoint(
        lastLink().orElseThrow(() -> new IllegalStateException("no entries appended")));
  }
  
  
  /**
   * Records and returns a checkpoint at the given index.
   * 
   * @throws IllegalStateException if nothing has been appended yet
   */
  public Checkpoint checkpoint(long index) throws IllegalStateException, IndexOutOfBoundsException {
    if (links.isEmpty())
      throw new IllegalStateException("no entries appended");
    return checkpoint(link(index));
  }
  
  
  /**
   * Returns the recorded checkpoints, ordered by index. Checkpoints are
   * never removed.
   * 
   * @return read-only view
   */
  public List<Checkpoint> checkpoints() {
    return Collections.unmodifiableList(checkpoints);
  }
  
  
  /**
   * Returns a digest over the entries appended so far. May be invoked
   * mid-mission (for intermediate anchoring).
   * 
   * @param missionId   mission identifier
   */
  public MissionDigest digest(String missionId) {
    return new MissionDigests(algo, clock).finalizeHead(missionId, headHash(), entryCount());
  }

}
