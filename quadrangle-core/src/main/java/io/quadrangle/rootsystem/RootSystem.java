package io.quadrangle.rootsystem;

import io.quadrangle.util.ContentHash;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finite set of root vectors with integer coordinates and a common scale:
 * the actual root is {@code coordinates / scale}. Inner products are kept
 * exact by comparing {@code dot(coordinates)} with {@code target * scale^2}.
 */
public final class RootSystem {

   private final String name;
   private final int[][] roots;
   private final int scale;

   private RootSystem(String name, int[][] roots, int scale) {
      this.name = name;
      this.roots = roots;
      this.scale = scale;
   }

   /**
    * @throws IllegalArgumentException for an empty list, ragged or zero
    *                                  vectors, duplicates or a scale below 1
    */
   public static RootSystem of(String name, List<int[]> roots, int scale) {
      if (scale < 1) {
         throw new IllegalArgumentException("Scale must be positive: " + scale);
      }
      if (roots.isEmpty()) {
         throw new IllegalArgumentException("Root system " + name + " is empty");
      }
      int rank = roots.get(0).length;
      Set<List<Integer>> seen = new HashSet<>();
      int[][] copy = new int[roots.size()][];
      for (int i = 0; i < copy.length; ++i) {
         int[] r = roots.get(i);
         if (r.length != rank) {
            throw new IllegalArgumentException("Root " + i + " has " + r.length +
                    " coordinates, expected " + rank);
         }
         List<Integer> key = new ArrayList<>();
         boolean zero = true;
         for (int x : r) {
            key.add(x);
            zero &= x == 0;
         }
         if (zero) {
            throw new IllegalArgumentException("Root " + i + " is the zero vector");
         }
         if (!seen.add(key)) {
            throw new IllegalArgumentException("Root " + i + " " +
                    Arrays.toString(r) + " is repeated");
         }
         copy[i] = r.clone();
      }
      return new RootSystem(name, copy, scale);
   }

   public String name() {
      return name;
   }

   public int size() {
      return roots.length;
   }

   public int ambientDimension() {
      return roots[0].length;
   }

   public int scale() {
      return scale;
   }

   public int[] root(int i) {
      return roots[i].clone();
   }

   /**
    * Inner product of the stored coordinates, i.e. scale^2 times the actual
    * inner product.
    */
   public int scaledInnerProduct(int i, int j) {
      int[] a = roots[i];
      int[] b = roots[j];
      int dot = 0;
      for (int k = 0; k < a.length; ++k) {
         dot += a[k] * b[k];
      }
      return dot;
   }

   public boolean innerProductEquals(int i, int j, int target) {
      return scaledInnerProduct(i, j) == target * scale * scale;
   }

   /**
    * @return the actual squared length of root i, which must be integral
    */
   public int norm(int i) {
      int scaled = scaledInnerProduct(i, i);
      if (scaled % (scale * scale) != 0) {
         throw new IllegalStateException("Root " + i + " of " + name +
                 " has non-integral norm " + scaled + "/" + (scale * scale));
      }
      return scaled / (scale * scale);
   }

   public String contentHash() {
      return ContentHash.builder().add("roots").add(scale).add(roots).build();
   }

   @Override
   public String toString() {
      return name + "(" + roots.length + " roots in R^" + ambientDimension() + ")";
   }
}
