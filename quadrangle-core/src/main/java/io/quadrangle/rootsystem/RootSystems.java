package io.quadrangle.rootsystem;

import java.util.ArrayList;
import java.util.List;

/**
 * Classical simply laced root systems, norm 2 throughout.
 */
public final class RootSystems {

   private RootSystems() {
   }

   /**
    * A_n: e_i - e_j in R^(n+1).
    */
   public static RootSystem a(int n) {
      if (n < 1) {
         throw new IllegalArgumentException("A_n needs n >= 1, got " + n);
      }
      List<int[]> roots = new ArrayList<>();
      for (int i = 0; i <= n; ++i) {
         for (int j = 0; j <= n; ++j) {
            if (i != j) {
               int[] r = new int[n + 1];
               r[i] = 1;
               r[j] = -1;
               roots.add(r);
            }
         }
      }
      return RootSystem.of("A" + n, roots, 1);
   }

   /**
    * D_n: +-e_i +- e_j in R^n.
    */
   public static RootSystem d(int n) {
      if (n < 2) {
         throw new IllegalArgumentException("D_n needs n >= 2, got " + n);
      }
      List<int[]> roots = new ArrayList<>();
      addPairs(roots, n, 1);
      return RootSystem.of("D" + n, roots, 1);
   }

   private static void addPairs(List<int[]> roots, int n, int value) {
      for (int i = 0; i < n; ++i) {
         for (int j = i + 1; j < n; ++j) {
            for (int si = -1; si <= 1; si += 2) {
               for (int sj = -1; sj <= 1; sj += 2) {
                  int[] r = new int[n];
                  r[i] = si * value;
                  r[j] = sj * value;
                  roots.add(r);
               }
            }
         }
      }
   }

   /**
    * E8 in doubled coordinates: the 112 vectors +-2e_i +- 2e_j and the 128
    * vectors (+-1)^8 with an even number of minus signs, all at scale 2.
    */
   public static RootSystem e8() {
      List<int[]> roots = new ArrayList<>(240);
      addPairs(roots, 8, 2);
      for (int mask = 0; mask < 256; ++mask) {
         if (Integer.bitCount(mask) % 2 != 0) {
            continue;
         }
         int[] r = new int[8];
         for (int i = 0; i < 8; ++i) {
            r[i] = (mask & (1 << i)) != 0 ? -1 : 1;
         }
         roots.add(r);
      }
      return RootSystem.of("E8", roots, 2);
   }

   /**
    * E7: the roots of E8 orthogonal to (1/2)(1, .., 1).
    */
   public static RootSystem e7() {
      return orthogonalTo("E7", e8(), new int[]{1, 1, 1, 1, 1, 1, 1, 1});
   }

   /**
    * E6: the roots of E8 orthogonal to (1/2)(1, .., 1) and to -e1 - e2,
    * an A2 pair.
    */
   public static RootSystem e6() {
      return orthogonalTo("E6", e7(), new int[]{-2, -2, 0, 0, 0, 0, 0, 0});
   }

   private static RootSystem orthogonalTo(String name, RootSystem parent,
                                          int[] vector) {
      List<int[]> roots = new ArrayList<>();
      for (int i = 0; i < parent.size(); ++i) {
         int[] r = parent.root(i);
         int dot = 0;
         for (int k = 0; k < r.length; ++k) {
            dot += r[k] * vector[k];
         }
         if (dot == 0) {
            roots.add(r);
         }
      }
      return RootSystem.of(name, roots, parent.scale());
   }

   /**
    * @param name one of A1.., D2.., E6, E7, E8 (case insensitive)
    */
   public static RootSystem byName(String name) {
      String upper = name.trim().toUpperCase();
      switch (upper) {
         case "E6":
            return e6();
         case "E7":
            return e7();
         case "E8":
            return e8();
         default:
            if (upper.length() > 1 && (upper.charAt(0) == 'A' || upper.charAt(0) == 'D')) {
               int n;
               try {
                  n = Integer.parseInt(upper.substring(1));
               } catch (NumberFormatException e) {
                  throw new IllegalArgumentException("Unknown root system " + name, e);
               }
               return upper.charAt(0) == 'A' ? a(n) : d(n);
            }
            throw new IllegalArgumentException("Unknown root system " + name);
      }
   }
}
