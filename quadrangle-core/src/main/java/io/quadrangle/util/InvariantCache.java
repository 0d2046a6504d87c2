package io.quadrangle.util;

import com.koloboke.collect.map.ObjObjMap;
import com.koloboke.collect.map.hash.HashObjObjMaps;
import org.apache.log4j.Logger;

import java.util.function.Supplier;

/**
 * Content-addressed store of computed invariants. An entry is only ever
 * reached through the exact key it was computed for and is never refreshed
 * implicitly; {@link #invalidate} and {@link #clear} are the only ways to
 * drop one.
 */
public class InvariantCache {
   private static final Logger LOG = Logger.getLogger(InvariantCache.class);

   // store: computed invariants
   private final ObjObjMap<CacheKey, Object> entries =
           HashObjObjMaps.newMutableMap();

   private long hits;
   private long misses;

   /**
    * Returns the cached value for {@code key}, computing and storing it on
    * first use. The computation runs outside the lock; if two threads race
    * the first stored value wins.
    */
   @SuppressWarnings("unchecked")
   public <T> T getOrCompute(CacheKey key, Supplier<T> computation) {
      synchronized (entries) {
         Object cached = entries.get(key);
         if (cached != null) {
            hits++;
            LOG.debug("Cache hit " + key);
            return (T) cached;
         }
         misses++;
      }

      T value = computation.get();

      synchronized (entries) {
         Object raced = entries.putIfAbsent(key, value);
         return raced == null ? value : (T) raced;
      }
   }

   @SuppressWarnings("unchecked")
   public <T> T get(CacheKey key) {
      synchronized (entries) {
         return (T) entries.get(key);
      }
   }

   public boolean invalidate(CacheKey key) {
      synchronized (entries) {
         boolean removed = entries.remove(key) != null;
         if (removed) {
            LOG.info("Invalidated " + key);
         }
         return removed;
      }
   }

   public void clear() {
      synchronized (entries) {
         LOG.info("Clearing " + entries.size() + " cached invariants");
         entries.clear();
      }
   }

   public int size() {
      synchronized (entries) {
         return entries.size();
      }
   }

   public long hits() {
      synchronized (entries) {
         return hits;
      }
   }

   public long misses() {
      synchronized (entries) {
         return misses;
      }
   }
}
