package io.quadrangle.search;

import io.quadrangle.graph.Graph;

/**
 * Classifies pairs of edges of a graph by (number of shared endpoints,
 * number of adjacent pairs x in e, y in f with x != y).
 */
public class EdgeRelationClassifier implements PairClassifier {

   private final Graph graph;
   private final int[][] edges;

   public EdgeRelationClassifier(Graph graph) {
      this.graph = graph;
      this.edges = graph.edges();
   }

   public int[] edge(int i) {
      return edges[i].clone();
   }

   @Override
   public int size() {
      return edges.length;
   }

   @Override
   public RelationClass classify(int a, int b) {
      int[] e = edges[a];
      int[] f = edges[b];
      int shared = 0;
      int cross = 0;
      for (int x : e) {
         for (int y : f) {
            if (x == y) {
               shared++;
            } else if (graph.isAdjacent(x, y)) {
               cross++;
            }
         }
      }
      return RelationClass.of(shared, cross);
   }

   @Override
   public String describe() {
      return "edge pairs of " + graph.name() + " by (shared, cross-adjacent)";
   }
}
