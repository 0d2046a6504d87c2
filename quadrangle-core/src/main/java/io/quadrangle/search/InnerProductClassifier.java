package io.quadrangle.search;

import io.quadrangle.rootsystem.RootSystem;

/**
 * Classifies pairs of roots by their inner product. Integral products give
 * a one component key; otherwise the key is (scaled product, scale^2).
 */
public class InnerProductClassifier implements PairClassifier {

   private final RootSystem system;
   private final int scaleSquared;

   public InnerProductClassifier(RootSystem system) {
      this.system = system;
      this.scaleSquared = system.scale() * system.scale();
   }

   @Override
   public int size() {
      return system.size();
   }

   @Override
   public RelationClass classify(int a, int b) {
      int dot = system.scaledInnerProduct(a, b);
      if (dot % scaleSquared == 0) {
         return RelationClass.of(dot / scaleSquared);
      }
      return RelationClass.of(dot, scaleSquared);
   }

   @Override
   public String describe() {
      return "root pairs of " + system.name() + " by inner product";
   }
}
