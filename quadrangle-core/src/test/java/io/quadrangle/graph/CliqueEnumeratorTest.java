package io.quadrangle.graph;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliqueEnumeratorTest {

   private static Graph complete(int n) {
      int[][] edges = new int[n * (n - 1) / 2][];
      int next = 0;
      for (int u = 0; u < n; ++u) {
         for (int v = u + 1; v < n; ++v) {
            edges[next++] = new int[]{u, v};
         }
      }
      return Graph.fromEdges("K" + n, n, edges);
   }

   @Test
   void completeGraphHasBinomiallyManyCliques() {
      CliqueEnumerator cliques = new CliqueEnumerator(complete(6));
      assertEquals(6, cliques.count(1));
      assertEquals(15, cliques.count(2));
      assertEquals(20, cliques.count(3));
      assertEquals(15, cliques.count(4));
      assertEquals(1, cliques.count(6));
      assertEquals(0, cliques.count(7));
      assertEquals(6, cliques.cliqueNumber());
   }

   @Test
   void cliquesAreListedSortedAndInOrder() {
      Graph g = Graph.fromEdges("g", 5,
              new int[][]{{0, 1}, {1, 2}, {0, 2}, {2, 3}, {3, 4}, {2, 4}});
      List<int[]> triangles = CliqueEnumerator.listCliques(g, 3);
      assertEquals(2, triangles.size());
      assertArrayEquals(new int[]{0, 1, 2}, triangles.get(0));
      assertArrayEquals(new int[]{2, 3, 4}, triangles.get(1));
      assertEquals(3, CliqueEnumerator.cliqueNumber(g));
   }

   @Test
   void symplecticQuadrangleLinesAreTheMaximalCliques() {
      Graph w33 = GraphInvariantsTest.w33();
      assertEquals(40, CliqueEnumerator.countCliques(w33, 4));
      assertEquals(0, CliqueEnumerator.countCliques(w33, 5));
   }

   @Test
   void sizeMustBePositive() {
      assertThrows(IllegalArgumentException.class,
              () -> new CliqueEnumerator(complete(3)).count(0));
   }
}
