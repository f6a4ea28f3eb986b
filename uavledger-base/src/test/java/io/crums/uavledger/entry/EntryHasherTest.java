/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger.entry;


import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.junit.jupiter.api.Test;

import io.crums.uavledger.FlightLogFixtures;
import io.crums.uavledger.HashAlgorithm;

/**
 * 
 */
public class EntryHasherTest {
  
  @Test
  public void testHashIsDigestOfCanonicalBytes() throws NoSuchAlgorithmException {
    var entry = FlightLogFixtures.entry(2);
    var canon = Canonicalizer.canonicalize(entry);
    byte[] b = new byte[canon.size()];
    canon.bytes().get(b);
    var expected = ByteBuffer.wrap(MessageDigest.getInstance("SHA-256").digest(b));
    
    var hasher = new EntryHasher(HashAlgorithm.SHA256_V1);
    assertEquals(expected, hasher.hash(canon));
    assertEquals(expected, hasher.hash(entry));
  }
  
  @Test
  public void testAlgorithmsDiffer() {
    var entry = FlightLogFixtures.entry(0);
    var a = new EntryHasher(HashAlgorithm.SHA256_V1).hash(entry);
    var b = new EntryHasher(HashAlgorithm.SHA3_256_V1).hash(entry);
    assertEquals(32, a.remaining());
    assertEquals(32, b.remaining());
    assertNotEquals(a, b);
  }
  
  @Test
  public void testIncompatibleDigest() {
    var hasher = new EntryHasher(HashAlgorithm.SHA256_V1);
    var canon = Canonicalizer.canonicalize(FlightLogFixtures.entry(0));
    assertThrows(
        IllegalArgumentException.class,
        () -> hasher.hash(canon, HashAlgorithm.SHA3_256_V1.newDigest()));
  }

}
