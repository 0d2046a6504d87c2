package io.quadrangle.group;

import com.koloboke.collect.IntCursor;
import com.koloboke.collect.set.IntSet;
import com.koloboke.collect.set.hash.HashIntSets;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Partition of {@code 0..n-1} into orbits. Equivalences are added pairwise
 * and closed transitively by {@link #propagateEquivalences()}.
 */
public class OrbitPartition {
   private final int[] parent;
   private IntSet[] equivalences;

   public OrbitPartition(int numPoints) {
      this.parent = new int[numPoints];
      for (int i = 0; i < numPoints; ++i) {
         parent[i] = i;
      }
   }

   public static OrbitPartition of(int degree, Iterable<Permutation> generators) {
      OrbitPartition partition = new OrbitPartition(degree);
      for (Permutation g : generators) {
         for (int i = 0; i < degree; ++i) {
            partition.addEquivalence(i, g.apply(i));
         }
      }
      partition.propagateEquivalences();
      return partition;
   }

   private int find(int x) {
      while (parent[x] != x) {
         parent[x] = parent[parent[x]];
         x = parent[x];
      }
      return x;
   }

   public void addEquivalence(int pos1, int pos2) {
      int a = find(pos1);
      int b = find(pos2);
      if (a != b) {
         // smaller root wins, so each class is represented by its minimum
         if (a < b) {
            parent[b] = a;
         } else {
            parent[a] = b;
         }
      }
      equivalences = null;
   }

   public void propagateEquivalences() {
      IntSet[] byRoot = new IntSet[parent.length];
      equivalences = new IntSet[parent.length];
      for (int i = 0; i < parent.length; ++i) {
         int root = find(i);
         if (byRoot[root] == null) {
            byRoot[root] = HashIntSets.newMutableSet();
         }
         byRoot[root].add(i);
         equivalences[i] = byRoot[root];
      }
   }

   /**
    * @return the orbit containing {@code pos}; shared, do not modify
    */
   public IntSet getEquivalences(int pos) {
      if (equivalences == null) {
         propagateEquivalences();
      }
      return equivalences[pos];
   }

   public int numPoints() {
      return parent.length;
   }

   public int representative(int pos) {
      return find(pos);
   }

   public boolean sameOrbit(int pos1, int pos2) {
      return find(pos1) == find(pos2);
   }

   /**
    * Orbits as sorted arrays, ordered by their smallest point.
    */
   public List<int[]> orbits() {
      List<int[]> orbits = new ArrayList<>();
      for (int i = 0; i < parent.length; ++i) {
         if (find(i) != i) {
            continue;
         }
         IntSet members = getEquivalences(i);
         int[] orbit = new int[members.size()];
         int next = 0;
         IntCursor cursor = members.cursor();
         while (cursor.moveNext()) {
            orbit[next++] = cursor.elem();
         }
         Arrays.sort(orbit);
         orbits.add(orbit);
      }
      return orbits;
   }

   public List<Integer> orbitSizes() {
      List<Integer> sizes = new ArrayList<>();
      for (int[] orbit : orbits()) {
         sizes.add(orbit.length);
      }
      return sizes;
   }

   public int numOrbits() {
      int count = 0;
      for (int i = 0; i < parent.length; ++i) {
         if (find(i) == i) {
            count++;
         }
      }
      return count;
   }

   @Override
   public String toString() {
      return "OrbitPartition{orbitSizes=" + orbitSizes() + '}';
   }
}
