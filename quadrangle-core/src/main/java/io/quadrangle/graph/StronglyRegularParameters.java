package io.quadrangle.graph;

import io.quadrangle.exceptions.AlgebraicInconsistencyException;

/**
 * Parameters (n, k, lambda, mu) of a strongly regular graph, or the reason a
 * graph is not one. lambda and mu are counted exactly, the spectrum only
 * decides whether to look.
 */
public final class StronglyRegularParameters {

   private final boolean stronglyRegular;
   private final int n;
   private final int k;
   private final int lambda;
   private final int mu;
   private final String reason;

   private StronglyRegularParameters(boolean stronglyRegular, int n, int k,
                                     int lambda, int mu, String reason) {
      this.stronglyRegular = stronglyRegular;
      this.n = n;
      this.k = k;
      this.lambda = lambda;
      this.mu = mu;
      this.reason = reason;
   }

   private static StronglyRegularParameters not(String reason) {
      return new StronglyRegularParameters(false, -1, -1, -1, -1, reason);
   }

   public static StronglyRegularParameters of(Graph graph, Spectrum spectrum) {
      int n = graph.numVertices();
      int k = GraphInvariants.regularDegree(graph);
      if (k < 0) {
         return not("not regular");
      }
      if (k == 0 || k == n - 1) {
         return not("empty or complete");
      }
      if (spectrum.eigenvalues().get(0).multiplicity() != 1) {
         return not("disconnected");
      }
      if (spectrum.distinctCount() != 3) {
         return not(spectrum.distinctCount() - 1 + " distinct non-principal eigenvalues");
      }

      int lambda = -1;
      int mu = -1;
      for (int u = 0; u < n; ++u) {
         for (int v = u + 1; v < n; ++v) {
            int common = graph.commonNeighbours(u, v);
            if (graph.isAdjacent(u, v)) {
               if (lambda < 0) {
                  lambda = common;
               } else if (lambda != common) {
                  throw inconsistent(graph, "adjacent", u, v, lambda, common);
               }
            } else {
               if (mu < 0) {
                  mu = common;
               } else if (mu != common) {
                  throw inconsistent(graph, "non-adjacent", u, v, mu, common);
               }
            }
         }
      }
      return new StronglyRegularParameters(true, n, k, lambda, mu, null);
   }

   private static AlgebraicInconsistencyException inconsistent(
           Graph graph, String kind, int u, int v, int expected, int found) {
      return new AlgebraicInconsistencyException("Spectrum of " + graph.name() +
              " says strongly regular, but " + kind + " pair " + u + "," + v +
              " has " + found + " common neighbours instead of " + expected);
   }

   public boolean isStronglyRegular() {
      return stronglyRegular;
   }

   public int n() {
      return n;
   }

   public int k() {
      return k;
   }

   public int lambda() {
      return lambda;
   }

   public int mu() {
      return mu;
   }

   public String reason() {
      return reason;
   }

   @Override
   public String toString() {
      return stronglyRegular ? "SRG(" + n + "," + k + "," + lambda + "," + mu + ")"
              : "not strongly regular: " + reason;
   }
}
