package io.quadrangle.search;

import io.quadrangle.graph.Graph;
import io.quadrangle.graph.SpectrumCalculator;

/**
 * A named graph signature that candidates are compared against.
 */
public final class TargetSignature {

   private final String name;
   private final GraphSignature signature;

   public TargetSignature(String name, GraphSignature signature) {
      this.name = name;
      this.signature = signature;
   }

   public static TargetSignature of(Graph graph, SpectrumCalculator calculator) {
      return new TargetSignature(graph.name(), GraphSignature.of(graph, calculator));
   }

   public String name() {
      return name;
   }

   public GraphSignature signature() {
      return signature;
   }

   @Override
   public String toString() {
      return name + " " + signature;
   }
}
