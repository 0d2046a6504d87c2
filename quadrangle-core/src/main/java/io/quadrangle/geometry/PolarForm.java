package io.quadrangle.geometry;

import io.quadrangle.field.FiniteField;
import io.quadrangle.linalg.FieldMatrix;

/**
 * A reflexive sesquilinear form, possibly coming from a quadratic form,
 * whose totally singular subspaces make up a polar space.
 */
public interface PolarForm {

   FiniteField field();

   /**
    * @return dimension n of the underlying vector space GF(q)^n
    */
   int dimension();

   /**
    * Whether the vector spans a point of the polar space.
    */
   boolean isSingular(int[] x);

   /**
    * Value of the associated bilinear form B(x, y).
    */
   int polar(int[] x, int[] y);

   /**
    * Gram matrix of the bilinear form in the standard basis.
    */
   default FieldMatrix gramMatrix() {
      int n = dimension();
      int[][] gram = new int[n][n];
      int[] ei = new int[n];
      int[] ej = new int[n];
      for (int i = 0; i < n; ++i) {
         ei[i] = 1;
         for (int j = 0; j < n; ++j) {
            ej[j] = 1;
            gram[i][j] = polar(ei, ej);
            ej[j] = 0;
         }
         ei[i] = 0;
      }
      return FieldMatrix.of(field(), n, gram);
   }

   /**
    * Short name used in records, e.g. "W(3,3)".
    */
   String name();
}
