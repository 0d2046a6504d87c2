package io.quadrangle.linalg;

import io.quadrangle.exceptions.AlgebraicInconsistencyException;
import io.quadrangle.exceptions.FieldArithmeticException;
import io.quadrangle.field.FiniteField;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinearAlgebraTest {
   private static final FiniteField GF2 = FiniteField.of(2);
   private static final FiniteField GF3 = FiniteField.of(3);

   @Test
   void rankDependsOnTheField() {
      // rows sum to zero mod 3 but not mod 2
      int[][] entries = {{1, 1, 0}, {0, 1, 1}, {2, 1, 2}};
      assertEquals(2, LinearAlgebra.rank(FieldMatrix.of(GF3, entries)));

      int[][] binary = {{1, 1, 0}, {0, 1, 1}, {1, 0, 1}};
      assertEquals(2, LinearAlgebra.rank(FieldMatrix.of(GF2, binary)));
      assertEquals(3, LinearAlgebra.rank(FieldMatrix.identity(GF2, 3)));
      assertEquals(0, LinearAlgebra.rank(FieldMatrix.zero(GF3, 2, 4)));
   }

   @Test
   void reducedRowEchelonFormHasUnitPivots() {
      FieldMatrix m = FieldMatrix.of(GF3, new int[][]{{2, 1, 0, 1}, {1, 2, 1, 0}});
      RowEchelonForm ref = LinearAlgebra.rowEchelon(m);
      assertEquals(2, ref.rank());
      assertArrayEquals(new int[]{0, 2}, ref.pivotColumns());
      assertEquals(1, ref.reduced().get(0, 0));
      assertEquals(0, ref.reduced().get(1, 0));
      assertEquals(1, ref.reduced().get(1, 2));
   }

   @Test
   void kernelVectorsAreAnnihilated() {
      FieldMatrix m = FieldMatrix.of(GF3, new int[][]{{1, 2, 0, 1}, {0, 1, 1, 2}});
      FieldMatrix kernel = LinearAlgebra.kernelBasis(m);
      assertEquals(2, kernel.rows());
      assertEquals(4, kernel.cols());
      assertTrue(m.multiply(kernel.transpose()).isZero());
      assertEquals(2, LinearAlgebra.rank(kernel));
   }

   @Test
   void imageAndRowSpaceBases() {
      FieldMatrix m = FieldMatrix.of(GF2, new int[][]{{1, 0, 1}, {0, 1, 1}, {1, 1, 0}});
      assertEquals(2, LinearAlgebra.imageBasis(m).rows());
      FieldMatrix rows = LinearAlgebra.rowSpaceBasis(m);
      assertEquals(2, rows.rows());
      assertTrue(LinearAlgebra.spans(rows, m));
      assertTrue(LinearAlgebra.inRowSpace(m, new int[]{1, 1, 0}));
      assertFalse(LinearAlgebra.inRowSpace(m, new int[]{1, 0, 0}));
   }

   @Test
   void quotientRequiresASubspace() {
      FieldMatrix v = FieldMatrix.identity(GF3, 3);
      FieldMatrix w = FieldMatrix.of(GF3, new int[][]{{1, 1, 0}});
      assertEquals(2, LinearAlgebra.quotientDimension(v, w));

      FieldMatrix plane = FieldMatrix.of(GF3, new int[][]{{1, 0, 0}, {0, 1, 0}});
      FieldMatrix outside = FieldMatrix.of(GF3, new int[][]{{0, 0, 1}});
      assertThrows(AlgebraicInconsistencyException.class,
              () -> LinearAlgebra.quotientDimension(plane, outside));
   }

   @Test
   void matrixArithmetic() {
      FieldMatrix a = FieldMatrix.of(GF3, new int[][]{{1, 2}, {0, 1}});
      FieldMatrix square = a.multiply(a);
      assertEquals(FieldMatrix.of(GF3, new int[][]{{1, 1}, {0, 1}}), square);
      assertTrue(a.subtract(a).isZero());
      assertEquals(a.scale(2), a.add(a));
      assertArrayEquals(new int[]{2, 1}, a.multiply(new int[]{0, 1}));
      assertEquals(a, a.transpose().transpose());
      assertEquals(4, a.stack(a).rows());
   }

   @Test
   void mixingFieldsFails() {
      FieldMatrix a = FieldMatrix.identity(GF2, 2);
      FieldMatrix b = FieldMatrix.identity(GF3, 2);
      assertThrows(FieldArithmeticException.class, () -> a.multiply(b));
      assertThrows(FieldArithmeticException.class, () -> a.add(b));
   }

   @Test
   void entriesOutsideTheFieldAreRejected() {
      assertThrows(IllegalArgumentException.class,
              () -> FieldMatrix.of(GF2, new int[][]{{0, 2}}));
      assertThrows(IllegalArgumentException.class,
              () -> FieldMatrix.of(GF2, new int[][]{{0, 1}, {1}}));
   }
}
