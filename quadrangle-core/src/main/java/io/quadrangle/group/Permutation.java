package io.quadrangle.group;

import io.quadrangle.graph.Graph;

import java.util.Arrays;

/**
 * Immutable permutation of {@code 0..n-1}. {@code p.then(q)} applies p first,
 * so {@code p.then(q).apply(i) == q.apply(p.apply(i))}.
 */
public final class Permutation {

   private final int[] images;
   private final int hash;

   private Permutation(int[] images) {
      this.images = images;
      this.hash = Arrays.hashCode(images);
   }

   /**
    * @throws IllegalArgumentException unless {@code images} is a bijection
    */
   public static Permutation of(int... images) {
      boolean[] seen = new boolean[images.length];
      for (int i = 0; i < images.length; ++i) {
         int x = images[i];
         if (x < 0 || x >= images.length || seen[x]) {
            throw new IllegalArgumentException("Not a permutation of 0.." +
                    (images.length - 1) + ": " + Arrays.toString(images));
         }
         seen[x] = true;
      }
      return new Permutation(images.clone());
   }

   static Permutation trusted(int[] images) {
      return new Permutation(images);
   }

   public static Permutation identity(int degree) {
      int[] images = new int[degree];
      for (int i = 0; i < degree; ++i) {
         images[i] = i;
      }
      return new Permutation(images);
   }

   public int degree() {
      return images.length;
   }

   public int apply(int point) {
      return images[point];
   }

   public int[] images() {
      return images.clone();
   }

   public Permutation then(Permutation next) {
      if (next.images.length != images.length) {
         throw new IllegalArgumentException("Degree mismatch: " + images.length +
                 " vs " + next.images.length);
      }
      int[] result = new int[images.length];
      for (int i = 0; i < images.length; ++i) {
         result[i] = next.images[images[i]];
      }
      return new Permutation(result);
   }

   public Permutation inverse() {
      int[] result = new int[images.length];
      for (int i = 0; i < images.length; ++i) {
         result[images[i]] = i;
      }
      return new Permutation(result);
   }

   public boolean isIdentity() {
      for (int i = 0; i < images.length; ++i) {
         if (images[i] != i) {
            return false;
         }
      }
      return true;
   }

   public boolean fixes(int point) {
      return images[point] == point;
   }

   /**
    * Whether this permutation preserves adjacency and colours of the graph.
    */
   public boolean isAutomorphismOf(Graph graph) {
      if (graph.numVertices() != images.length) {
         return false;
      }
      for (int u = 0; u < images.length; ++u) {
         if (graph.color(u) != graph.color(images[u]) ||
                 graph.degree(u) != graph.degree(images[u])) {
            return false;
         }
         for (int v : graph.neighbours(u)) {
            if (!graph.isAdjacent(images[u], images[v])) {
               return false;
            }
         }
      }
      return true;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Permutation)) return false;
      Permutation that = (Permutation) o;
      return hash == that.hash && Arrays.equals(images, that.images);
   }

   @Override
   public int hashCode() {
      return hash;
   }

   /**
    * Cycle notation without fixed points, "()" for the identity.
    */
   @Override
   public String toString() {
      StringBuilder sb = new StringBuilder();
      boolean[] done = new boolean[images.length];
      for (int i = 0; i < images.length; ++i) {
         if (done[i] || images[i] == i) {
            continue;
         }
         sb.append('(');
         int j = i;
         do {
            done[j] = true;
            sb.append(j);
            j = images[j];
            if (j != i) {
               sb.append(' ');
            }
         } while (j != i);
         sb.append(')');
      }
      return sb.length() == 0 ? "()" : sb.toString();
   }
}
