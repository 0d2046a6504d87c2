package io.quadrangle.homology;

import io.quadrangle.field.FiniteField;
import io.quadrangle.linalg.FieldMatrix;

/**
 * Simplicial boundary maps over a field. Column j of the k-th boundary is
 * the alternating sum of the faces of the j-th k-simplex.
 */
public final class BoundaryOperator {

   private BoundaryOperator() {
   }

   /**
    * @return the matrix of d_k : C_k -> C_{k-1}; zero with the right shape
    * when k is 0 or above the top dimension
    */
   public static FieldMatrix matrix(SimplicialComplex complex, int k,
                                    FiniteField field) {
      int rows = complex.count(k - 1);
      int cols = complex.count(k);
      int[][] entries = new int[rows][cols];
      if (k >= 1) {
         int plus = field.one();
         int minus = field.fromInt(-1);
         int[] face = new int[k];
         for (int j = 0; j < cols; ++j) {
            int[] simplex = complex.simplex(k, j);
            for (int drop = 0; drop <= k; ++drop) {
               int next = 0;
               for (int i = 0; i <= k; ++i) {
                  if (i != drop) {
                     face[next++] = simplex[i];
                  }
               }
               int row = complex.indexOf(face);
               if (row < 0) {
                  throw new IllegalStateException("Face of " + complex.name() +
                          " missing from dimension " + (k - 1));
               }
               entries[row][j] = drop % 2 == 0 ? plus : minus;
            }
         }
      }
      return FieldMatrix.of(field, cols, entries);
   }
}
