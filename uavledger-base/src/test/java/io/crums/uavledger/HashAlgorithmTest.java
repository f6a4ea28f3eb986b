/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.uavledger;


import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class HashAlgorithmTest {

  @Test
  public void testForId() {
    for (var algo : HashAlgorithm.values())
      assertSame(algo, HashAlgorithm.forId(algo.id()));
    var amx = assertThrows(AlgorithmMismatchException.class, () -> HashAlgorithm.forId("md5/1"));
    assertEquals("md5/1", amx.actualId());
  }
  
  @Test
  public void testGenesis() {
    for (var algo : HashAlgorithm.values()) {
      var genesis = algo.genesisHash();
      assertEquals(algo.hashWidth(), genesis.remaining());
      while (genesis.hasRemaining())
        assertEquals(0, genesis.get());
      var digest = algo.newDigest();
      assertTrue(algo.compatible(digest));
      assertEquals(algo.hashAlgo(), digest.getAlgorithm());
    }
  }
  
  @Test
  public void testCheckSame() {
    var algo = HashAlgorithm.SHA256_V1;
    assertSame(algo, algo.checkSame(HashAlgorithm.SHA256_V1));
    var amx = assertThrows(
        AlgorithmMismatchException.class, () -> algo.checkSame(HashAlgorithm.SHA3_256_V1));
    assertEquals(algo.id(), amx.expectedId());
    assertEquals(HashAlgorithm.SHA3_256_V1.id(), amx.actualId());
  }

}
