package io.quadrangle.group;

/**
 * Callback receiving each automorphism found by {@link AutomorphismSearch}.
 */
public interface Reporter {
   /**
    * @param generator the automorphism, a new strong generator
    * @param level     depth in the stabilizer chain where it was found
    */
   void report(Permutation generator, int level);
}
