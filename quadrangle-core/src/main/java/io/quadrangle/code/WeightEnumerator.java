package io.quadrangle.code;

import io.quadrangle.field.FiniteField;
import io.quadrangle.linalg.FieldMatrix;
import org.apache.log4j.Logger;

/**
 * Enumerates every codeword of a small linear code. Binary codes of length
 * at most 64 walk a Gray code over bit-packed rows; other codes step an
 * odometer over the coefficient vectors, updating the current word by one
 * scaled generator row per step.
 */
public class WeightEnumerator {
   private static final Logger LOG = Logger.getLogger(WeightEnumerator.class);

   private WeightEnumerator() {
   }

   /**
    * @return q^k, or -1 when it does not fit a long
    */
   static long codewordCount(int q, int k) {
      long total = 1;
      for (int i = 0; i < k; ++i) {
         if (total > Long.MAX_VALUE / q) {
            return -1;
         }
         total *= q;
      }
      return total;
   }

   public static WeightDistribution enumerate(FieldMatrix generator, long limit) {
      FiniteField field = generator.field();
      int k = generator.rows();
      long total = codewordCount(field.order(), k);
      if (total < 0 || total > limit) {
         LOG.info("Skipping weight enumeration of " + total + " codewords (limit " +
                 limit + ")");
         return WeightDistribution.notEnumerated(total);
      }

      long start = System.currentTimeMillis();
      long[] counts = field.order() == 2 && generator.cols() <= 64 ?
              binary(generator) : general(generator);
      LOG.debug("Enumerated " + total + " codewords in " +
              (System.currentTimeMillis() - start) + " ms");
      return new WeightDistribution(counts, total);
   }

   private static long[] binary(FieldMatrix generator) {
      int k = generator.rows();
      int n = generator.cols();
      long[] rows = new long[k];
      for (int i = 0; i < k; ++i) {
         for (int j = 0; j < n; ++j) {
            if (generator.get(i, j) != 0) {
               rows[i] |= 1L << j;
            }
         }
      }

      long[] counts = new long[n + 1];
      counts[0] = 1;
      long word = 0;
      long total = 1L << k;
      for (long g = 1; g < total; ++g) {
         word ^= rows[Long.numberOfTrailingZeros(g)];
         counts[Long.bitCount(word)]++;
      }
      return counts;
   }

   private static long[] general(FieldMatrix generator) {
      FiniteField field = generator.field();
      int q = field.order();
      int k = generator.rows();
      int n = generator.cols();
      int[][] rows = generator.toArray();

      long[] counts = new long[n + 1];
      int[] word = new int[n];
      int[] digits = new int[k];
      int weight = 0;
      counts[0] = 1;

      while (true) {
         int i = 0;
         while (i < k && digits[i] == q - 1) {
            weight = addScaledRow(field, word, rows[i], field.neg(digits[i]), weight);
            digits[i] = 0;
            i++;
         }
         if (i == k) {
            break;
         }
         int next = digits[i] + 1;
         weight = addScaledRow(field, word, rows[i], field.sub(next, digits[i]), weight);
         digits[i] = next;
         counts[weight]++;
      }
      return counts;
   }

   private static int addScaledRow(FiniteField field, int[] word, int[] row,
                                   int scalar, int weight) {
      if (scalar == 0) {
         return weight;
      }
      for (int j = 0; j < row.length; ++j) {
         if (row[j] == 0) {
            continue;
         }
         int before = word[j];
         int after = field.add(before, field.mul(scalar, row[j]));
         word[j] = after;
         if (before == 0 && after != 0) {
            weight++;
         } else if (before != 0 && after == 0) {
            weight--;
         }
      }
      return weight;
   }
}
