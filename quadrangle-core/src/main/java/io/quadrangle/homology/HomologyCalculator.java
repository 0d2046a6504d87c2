package io.quadrangle.homology;

import io.quadrangle.field.FiniteField;
import io.quadrangle.linalg.LinearAlgebra;
import org.apache.log4j.Logger;

/**
 * Cohomology dimensions over a field:
 * dim H^k = dim C_k - rank d_k - rank d_(k+1).
 */
public final class HomologyCalculator {
   private static final Logger LOG = Logger.getLogger(HomologyCalculator.class);

   private HomologyCalculator() {
   }

   public static CohomologyResult compute(SimplicialComplex complex,
                                          FiniteField field) {
      return compute(ChainComplex.over(complex, field));
   }

   public static CohomologyResult compute(ChainComplex chain) {
      int top = chain.topDimension();
      int[] dims = chain.chainDimensions();
      int[] ranks = new int[Math.max(0, top)];
      for (int k = 1; k <= top; ++k) {
         ranks[k - 1] = LinearAlgebra.rank(chain.boundary(k));
      }

      int[] betti = new int[top + 1];
      for (int k = 0; k <= top; ++k) {
         int rankIn = k >= 1 ? ranks[k - 1] : 0;
         int rankOut = k + 1 <= top ? ranks[k] : 0;
         betti[k] = dims[k] - rankIn - rankOut;
      }

      CohomologyResult result = new CohomologyResult(chain.name(), chain.field(),
              dims, ranks, betti);
      LOG.info("Cohomology " + result);
      return result;
   }

   public static CohomologyComparison crossCheck(SimplicialComplex complex,
                                                 FiniteField first,
                                                 FiniteField second) {
      CohomologyComparison comparison = new CohomologyComparison(
              compute(complex, first), compute(complex, second));
      if (!comparison.agrees()) {
         LOG.warn("Cohomology of " + complex.name() + " differs between " + first +
                 " and " + second + " in dimensions " +
                 comparison.differingDimensions());
      }
      return comparison;
   }
}
