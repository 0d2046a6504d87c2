package io.quadrangle.homology;

import io.quadrangle.exceptions.AlgebraicInconsistencyException;
import io.quadrangle.util.InvariantRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Betti numbers of one complex over two fields. A difference is torsion
 * showing through; it is reported as is and never reconciled.
 */
public final class CohomologyComparison {

   private final CohomologyResult first;
   private final CohomologyResult second;
   private final List<Integer> differingDimensions;

   CohomologyComparison(CohomologyResult first, CohomologyResult second) {
      this.first = first;
      this.second = second;
      this.differingDimensions = new ArrayList<>();
      int top = Math.max(first.bettiNumbers().length, second.bettiNumbers().length);
      for (int k = 0; k < top; ++k) {
         if (first.betti(k) != second.betti(k)) {
            differingDimensions.add(k);
         }
      }
   }

   public CohomologyResult first() {
      return first;
   }

   public CohomologyResult second() {
      return second;
   }

   public boolean agrees() {
      return differingDimensions.isEmpty();
   }

   public List<Integer> differingDimensions() {
      return new ArrayList<>(differingDimensions);
   }

   /**
    * @throws AlgebraicInconsistencyException if the Betti numbers depend on
    *                                         the field
    */
   public void requireFieldIndependent() {
      if (!agrees()) {
         throw new AlgebraicInconsistencyException("Cohomology of " +
                 first.complexName() + " depends on the field: " + first +
                 " vs " + second + " in dimensions " + differingDimensions);
      }
   }

   public InvariantRecord toRecord() {
      return new InvariantRecord("cohomology comparison " + first.complexName())
              .put("fields", first.field() + " vs " + second.field())
              .put("betti." + first.field(), first.bettiNumbers())
              .put("betti." + second.field(), second.bettiNumbers())
              .put("field_independent", agrees())
              .put("differing_dimensions", differingDimensions);
   }
}
