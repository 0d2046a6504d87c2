package io.quadrangle.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InvariantCacheTest {

   @Test
   void valuesAreComputedOncePerKey() {
      InvariantCache cache = new InvariantCache();
      AtomicInteger calls = new AtomicInteger();
      CacheKey key = CacheKey.of("rank", 2, ContentHash.md5Hex("w33"));

      Integer first = cache.getOrCompute(key, () -> 16 + calls.getAndIncrement());
      Integer second = cache.getOrCompute(key, () -> 99 + calls.getAndIncrement());
      assertEquals(16, first);
      assertEquals(16, second);
      assertEquals(1, calls.get());
      assertEquals(1, cache.hits());
      assertEquals(1, cache.misses());
   }

   @Test
   void fieldOrderIsPartOfTheKey() {
      InvariantCache cache = new InvariantCache();
      String hash = ContentHash.md5Hex("w33");
      cache.getOrCompute(CacheKey.of("rank", 2, hash), () -> 16);
      cache.getOrCompute(CacheKey.of("rank", 3, hash), () -> 39);
      assertEquals(2, cache.size());
      assertEquals(Integer.valueOf(39), cache.get(CacheKey.of("rank", 3, hash)));
      assertNull(cache.get(CacheKey.of("rank", 5, hash)));
   }

   @Test
   void invalidateAndClear() {
      InvariantCache cache = new InvariantCache();
      CacheKey key = CacheKey.of("spectrum", "abc");
      cache.getOrCompute(key, () -> "x");
      assertTrue(cache.invalidate(key));
      assertFalse(cache.invalidate(key));
      assertEquals("y", cache.getOrCompute(key, () -> "y"));
      cache.clear();
      assertEquals(0, cache.size());
   }
}
