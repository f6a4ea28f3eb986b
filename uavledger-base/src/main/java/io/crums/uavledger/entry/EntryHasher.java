/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.entry;


import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.util.Objects;

import io.crums.uavledger.HashAlgorithm;
import io.crums.uavledger.MalformedInputException;

/**
 * Computes entry (content) hashes. Instances are thread-safe (a new
 * {@code MessageDigest} is created per call, unless one is supplied).
 */
public class EntryHasher {
  
  private final HashAlgorithm algo;
  
  
  public EntryHasher(HashAlgorithm algo) {
    this.algo = Objects.requireNonNull(algo, "null algo");
  }
  
  
  /** Returns the hashing scheme. */
  public HashAlgorithm algorithm() {
    return algo;
  }
  
  
  /**
   * Returns the hash of the given canonical entry.
   * 
   * @return read-only buffer with {@linkplain HashAlgorithm#hashWidth()} bytes remaining
   */
  public ByteBuffer hash(CanonicalEntry entry) {
    return hash(entry, algo.newDigest());
  }
  
  
  /**
   * Returns the hash of the given canonical entry using the given work digest.
   * 
   * @param digest      compatible with this instance's algorithm (reusing this is more efficient)
   */
  public ByteBuffer hash(CanonicalEntry entry, MessageDigest digest) {
    if (!algo.compatible(digest))
      throw new IllegalArgumentException("digest: " + digest);
    digest.reset();
    digest.update(entry.bytes());
    return ByteBuffer.wrap(digest.digest()).asReadOnlyBuffer();
  }
  
  
  /**
   * Canonicalizes and hashes the given entry.
   * 
   * @throws MalformedInputException if the entry cannot be canonicalized
   */
  public ByteBuffer hash(LogEntry entry) throws MalformedInputException {
    return hash(Canonicalizer.canonicalize(entry));
  }

}
