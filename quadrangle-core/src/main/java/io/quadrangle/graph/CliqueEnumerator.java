package io.quadrangle.graph;

import io.quadrangle.util.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * k-clique listing on the degeneracy-free DAG where every edge points to the
 * higher vertex id (kClist). Cliques are produced as sorted vertex arrays in
 * lexicographic order.
 */
public class CliqueEnumerator {

   /**
    * Receives each clique; the array is reused between calls.
    */
   public interface CliqueConsumer {
      void accept(int[] clique);
   }

   private final Graph graph;
   private final int[][] dag;
   private final int maxOutDegree;

   protected long cliqueCount;

   public CliqueEnumerator(Graph graph) {
      this.graph = graph;
      this.dag = new int[graph.numVertices()][];
      int max = 0;
      for (int u = 0; u < dag.length; ++u) {
         int[] nb = graph.neighbours(u);
         int from = 0;
         while (from < nb.length && nb[from] < u) {
            from++;
         }
         int[] higher = new int[nb.length - from];
         System.arraycopy(nb, from, higher, 0, higher.length);
         dag[u] = higher;
         max = Math.max(max, higher.length);
      }
      this.maxOutDegree = max;
   }

   public static long countCliques(Graph graph, int size) {
      return new CliqueEnumerator(graph).count(size);
   }

   public static List<int[]> listCliques(Graph graph, int size) {
      return new CliqueEnumerator(graph).list(size);
   }

   public static int cliqueNumber(Graph graph) {
      return new CliqueEnumerator(graph).cliqueNumber();
   }

   public long count(int size) {
      cliqueCount = 0;
      enumerate(size, null);
      return cliqueCount;
   }

   public List<int[]> list(int size) {
      List<int[]> cliques = new ArrayList<>();
      enumerate(size, clique -> cliques.add(clique.clone()));
      return cliques;
   }

   public int cliqueNumber() {
      if (graph.numVertices() == 0) {
         return 0;
      }
      int k = 1;
      while (count(k + 1) > 0) {
         k++;
      }
      return k;
   }

   /**
    * @param consumer receives every clique, or null to only count them
    */
   public void enumerate(int size, CliqueConsumer consumer) {
      if (size < 1) {
         throw new IllegalArgumentException("Clique size must be positive: " + size);
      }
      int[] clique = new int[size];
      if (size == 1) {
         for (int u = 0; u < dag.length; ++u) {
            clique[0] = u;
            emit(clique, consumer);
         }
         return;
      }

      int[][] buffers = new int[size][maxOutDegree];
      for (int u = 0; u < dag.length; ++u) {
         if (dag[u].length < size - 1) {
            continue;
         }
         clique[0] = u;
         cliqueListing(size - 1, 1, dag[u], dag[u].length, clique, buffers,
                 consumer);
      }
   }

   private void cliqueListing(int l, int depth, int[] candidates, int len,
                              int[] clique, int[][] buffers,
                              CliqueConsumer consumer) {
      if (l == 1) {
         if (consumer == null) {
            cliqueCount += len;
            return;
         }
         for (int i = 0; i < len; ++i) {
            clique[depth] = candidates[i];
            consumer.accept(clique);
         }
         return;
      }

      int[] target = buffers[depth];
      for (int i = 0; i < len; ++i) {
         int v = candidates[i];
         int[] vneighbors = dag[v];
         int size = Utils.sintersect(candidates, vneighbors,
                 i + 1, len, 0, vneighbors.length, target);
         if (size < l - 1) {
            continue;
         }
         clique[depth] = v;
         cliqueListing(l - 1, depth + 1, target, size, clique, buffers,
                 consumer);
      }
   }

   private void emit(int[] clique, CliqueConsumer consumer) {
      if (consumer == null) {
         cliqueCount++;
      } else {
         consumer.accept(clique);
      }
   }
}
