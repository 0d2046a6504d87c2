package io.quadrangle.rootsystem;

import io.quadrangle.graph.Graph;
import org.roaringbitmap.RoaringBitmap;

import java.util.Arrays;

/**
 * Graph on the roots of a system, two roots adjacent iff their actual inner
 * product lies in a target set.
 */
public final class RootSystemGraph {

   private RootSystemGraph() {
   }

   public static Graph build(RootSystem system, int... innerProducts) {
      int n = system.size();
      int[] targets = innerProducts.clone();
      Arrays.sort(targets);
      RoaringBitmap[] nb = new RoaringBitmap[n];
      for (int i = 0; i < n; ++i) {
         nb[i] = new RoaringBitmap();
      }
      for (int i = 0; i < n; ++i) {
         for (int j = i + 1; j < n; ++j) {
            for (int target : targets) {
               if (system.innerProductEquals(i, j, target)) {
                  nb[i].add(j);
                  nb[j].add(i);
                  break;
               }
            }
         }
      }
      return Graph.fromNeighbourhoods(name(system, targets), nb);
   }

   static String name(RootSystem system, int[] sortedTargets) {
      StringBuilder sb = new StringBuilder(system.name()).append("[ip in {");
      for (int i = 0; i < sortedTargets.length; ++i) {
         if (i > 0) {
            sb.append(',');
         }
         sb.append(sortedTargets[i]);
      }
      return sb.append("}]").toString();
   }
}
