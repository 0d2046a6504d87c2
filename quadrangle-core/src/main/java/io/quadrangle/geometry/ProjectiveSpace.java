package io.quadrangle.geometry;

import io.quadrangle.field.FiniteField;

import java.util.ArrayList;
import java.util.List;

/**
 * Points of PG(n-1, q) as normalized vectors: the first non-zero coordinate
 * is 1. Points are listed in lexicographic order of their coordinates.
 */
public final class ProjectiveSpace {

   private ProjectiveSpace() {
   }

   public static List<int[]> points(FiniteField field, int dimension) {
      int q = field.order();
      List<int[]> points = new ArrayList<>();
      int[] v = new int[dimension];
      long total = 1;
      for (int i = 0; i < dimension; ++i) {
         total *= q;
      }
      for (long code = 1; code < total; ++code) {
         long rem = code;
         for (int i = dimension - 1; i >= 0; --i) {
            v[i] = (int) (rem % q);
            rem /= q;
         }
         if (leadingCoordinate(v) == 1) {
            points.add(v.clone());
         }
      }
      return points;
   }

   private static int leadingCoordinate(int[] v) {
      for (int x : v) {
         if (x != 0) {
            return x;
         }
      }
      return 0;
   }

   /**
    * @return the normalized representative of the point spanned by v
    * @throws IllegalArgumentException for the zero vector
    */
   public static int[] normalize(FiniteField field, int[] v) {
      int lead = leadingCoordinate(v);
      if (lead == 0) {
         throw new IllegalArgumentException("Zero vector spans no point");
      }
      int[] result = v.clone();
      if (lead != 1) {
         int inverse = field.inv(lead);
         for (int i = 0; i < result.length; ++i) {
            result[i] = field.mul(result[i], inverse);
         }
      }
      return result;
   }

   /**
    * Base-q code of a vector, most significant coordinate first.
    */
   public static int encode(FiniteField field, int[] v) {
      int code = 0;
      for (int x : v) {
         code = code * field.order() + x;
      }
      return code;
   }
}
