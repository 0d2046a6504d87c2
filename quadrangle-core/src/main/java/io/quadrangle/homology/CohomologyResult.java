package io.quadrangle.homology;

import io.quadrangle.field.FiniteField;
import io.quadrangle.util.InvariantRecord;

import java.util.Arrays;

public final class CohomologyResult {

   private final String complexName;
   private final FiniteField field;
   private final int[] chainDimensions;
   private final int[] boundaryRanks;
   private final int[] bettiNumbers;

   CohomologyResult(String complexName, FiniteField field, int[] chainDimensions,
                    int[] boundaryRanks, int[] bettiNumbers) {
      this.complexName = complexName;
      this.field = field;
      this.chainDimensions = chainDimensions;
      this.boundaryRanks = boundaryRanks;
      this.bettiNumbers = bettiNumbers;
   }

   public String complexName() {
      return complexName;
   }

   public FiniteField field() {
      return field;
   }

   public int[] chainDimensions() {
      return chainDimensions.clone();
   }

   /**
    * @return rank d_k for k = 1..top, indexed from 0
    */
   public int[] boundaryRanks() {
      return boundaryRanks.clone();
   }

   public int[] bettiNumbers() {
      return bettiNumbers.clone();
   }

   public int betti(int k) {
      return k < 0 || k >= bettiNumbers.length ? 0 : bettiNumbers[k];
   }

   public long eulerCharacteristic() {
      long chi = 0;
      for (int k = 0; k < chainDimensions.length; ++k) {
         chi += (k % 2 == 0 ? 1 : -1) * (long) chainDimensions[k];
      }
      return chi;
   }

   public InvariantRecord toRecord() {
      return new InvariantRecord("cohomology " + complexName + " over " + field)
              .put("field", field)
              .put("chain_dimensions", chainDimensions)
              .put("boundary_ranks", boundaryRanks)
              .put("betti", bettiNumbers)
              .put("euler_characteristic", eulerCharacteristic());
   }

   @Override
   public String toString() {
      return complexName + " over " + field + ": betti=" +
              Arrays.toString(bettiNumbers);
   }
}
