package io.quadrangle.code;

import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Number of codewords of each Hamming weight. A distribution that was not
 * enumerated (too many codewords) reports {@link #isEnumerated()} false and
 * carries no counts.
 */
public final class WeightDistribution {

   private final long[] counts;
   private final long codewords;

   WeightDistribution(long[] counts, long codewords) {
      this.counts = counts;
      this.codewords = codewords;
   }

   static WeightDistribution notEnumerated(long codewords) {
      return new WeightDistribution(null, codewords);
   }

   public boolean isEnumerated() {
      return counts != null;
   }

   /**
    * @return q^k, or -1 if it overflows a long
    */
   public long codewords() {
      return codewords;
   }

   public long count(int weight) {
      requireEnumerated();
      return weight < 0 || weight >= counts.length ? 0 : counts[weight];
   }

   /**
    * @return smallest non-zero weight, or 0 for the zero code
    */
   public int minimumWeight() {
      requireEnumerated();
      for (int w = 1; w < counts.length; ++w) {
         if (counts[w] != 0) {
            return w;
         }
      }
      return 0;
   }

   public SortedMap<Integer, Long> nonZeroCounts() {
      requireEnumerated();
      SortedMap<Integer, Long> result = new TreeMap<>();
      for (int w = 0; w < counts.length; ++w) {
         if (counts[w] != 0) {
            result.put(w, counts[w]);
         }
      }
      return result;
   }

   private void requireEnumerated() {
      if (counts == null) {
         throw new IllegalStateException("Weight distribution of " + codewords +
                 " codewords was not enumerated");
      }
   }

   @Override
   public String toString() {
      return isEnumerated() ? nonZeroCounts().toString()
              : "not enumerated (" + codewords + " codewords)";
   }
}
