/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger;


import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Versioned hashing schemes. An instance's {@linkplain #id() id} names both
 * the hash function and the canonical encoding version it is applied to.
 * The id travels with every mission digest, so that hashes computed under
 * different schemes are never compared.
 * 
 * @see AlgorithmMismatchException
 */
public enum HashAlgorithm {
  
  /** SHA-256 over canonical format version 1. */
  SHA256_V1("sha256/1", "SHA-256", 32),
  /** SHA3-256 over canonical format version 1. */
  SHA3_256_V1("sha3-256/1", "SHA3-256", 32);
  
  
  private final static HashAlgorithm[] SET = values();
  
  
  /**
   * Returns the instance with the given id.
   * 
   * @param id          the versioned id (e.g. {@code "sha256/1"})
   * 
   * @throws AlgorithmMismatchException if no supported algorithm has this id
   */
  public static HashAlgorithm forId(String id) throws AlgorithmMismatchException {
    for (var algo : SET)
      if (algo.id.equals(id))
        return algo;
    throw AlgorithmMismatchException.unsupported(id);
  }
  
  
  private final String id;
  private final String jcaName;
  private final int hashWidth;
  private final ByteBuffer genesis;
  
  
  private HashAlgorithm(String id, String jcaName, int hashWidth) {
    this.id = id;
    this.jcaName = jcaName;
    this.hashWidth = hashWidth;
    this.genesis = ByteBuffer.allocate(hashWidth).asReadOnlyBuffer();
  }
  
  
  /** Returns the versioned identifier. */
  public String id() {
    return id;
  }
  
  
  /**
   * Returns the name of the hashing algorithm.
   * 
   * @see MessageDigest#getAlgorithm()
   */
  public String hashAlgo() {
    return jcaName;
  }
  
  
  /**
   * Returns the number of bytes used to form a hash.
   * 
   * @see MessageDigest#getDigestLength()
   */
  public int hashWidth() {
    return hashWidth;
  }
  
  
  /**
   * Returns the publicly known chain seed: {@linkplain #hashWidth()} zeroes.
   * It stands in for the previous chain hash of the first entry.
   * 
   * @return a new read-only view
   */
  public ByteBuffer genesisHash() {
    return genesis.asReadOnlyBuffer();
  }
  
  
  /**
   * Creates and returns a new {@code MessageDigest}. Instances are not
   * thread-safe, so each is owned by one thread.
   */
  public MessageDigest newDigest() {
    try {
      MessageDigest digest = MessageDigest.getInstance(jcaName);
      assert digest.getDigestLength() == hashWidth;
      return digest;
      
    } catch (NoSuchAlgorithmException nsax) {
      throw new UavLedgerException("on creating digest with algo " + jcaName, nsax);
    }
  }
  
  
  /**
   * Determines whether the given digest is compatible with this scheme.
   */
  public boolean compatible(MessageDigest md) {
    return
        md.getDigestLength() == hashWidth &&
        md.getAlgorithm().equals(jcaName);
  }
  
  
  /**
   * Checks that this instance and the {@code other} are the same.
   * 
   * @param other       the algorithm the other side used
   * @return {@code this}
   * @throws AlgorithmMismatchException if {@code other != this}
   */
  public HashAlgorithm checkSame(HashAlgorithm other) throws AlgorithmMismatchException {
    if (other != this)
      throw new AlgorithmMismatchException(id, other.id);
    return this;
  }

}
