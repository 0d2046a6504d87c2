package io.quadrangle.search;

import io.quadrangle.graph.Graph;
import io.quadrangle.graph.GraphInvariants;
import io.quadrangle.graph.Spectrum;
import io.quadrangle.graph.SpectrumCalculator;

/**
 * What two graphs are compared on: order, regular degree and spectrum.
 */
public final class GraphSignature {

   private final int order;
   private final int degree;
   private final Spectrum spectrum;

   public GraphSignature(int order, int degree, Spectrum spectrum) {
      this.order = order;
      this.degree = degree;
      this.spectrum = spectrum;
   }

   public static GraphSignature of(Graph graph, SpectrumCalculator calculator) {
      return new GraphSignature(graph.numVertices(),
              GraphInvariants.regularDegree(graph), calculator.compute(graph));
   }

   public int order() {
      return order;
   }

   /**
    * @return the common degree, -1 if not regular
    */
   public int degree() {
      return degree;
   }

   public Spectrum spectrum() {
      return spectrum;
   }

   public Verdict compare(GraphSignature target) {
      if (order != target.order || degree != target.degree) {
         return Verdict.MISMATCH;
      }
      return spectrum.sameAs(target.spectrum) ? Verdict.MATCH : Verdict.NEAR_MATCH;
   }

   @Override
   public String toString() {
      return "n=" + order + " k=" + degree + " spectrum=" + spectrum +
              " tol=" + spectrum.tolerance();
   }
}
