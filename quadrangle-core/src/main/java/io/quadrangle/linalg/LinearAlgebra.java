package io.quadrangle.linalg;

import io.quadrangle.exceptions.AlgebraicInconsistencyException;
import io.quadrangle.field.FiniteField;

import java.util.Arrays;

/**
 * Exact linear algebra over finite fields. Subspaces are given as the row
 * span of a {@link FieldMatrix}.
 */
public final class LinearAlgebra {

   private LinearAlgebra() {
   }

   public static RowEchelonForm rowEchelon(FieldMatrix matrix) {
      FiniteField field = matrix.field();
      int rows = matrix.rows();
      int cols = matrix.cols();
      int[][] m = matrix.toArray();
      int[] pivots = new int[Math.min(rows, cols)];
      int rank = 0;

      for (int col = 0; col < cols && rank < rows; ++col) {
         int pivotRow = -1;
         for (int r = rank; r < rows; ++r) {
            if (m[r][col] != 0) {
               pivotRow = r;
               break;
            }
         }
         if (pivotRow < 0) {
            continue;
         }

         int[] tmp = m[rank];
         m[rank] = m[pivotRow];
         m[pivotRow] = tmp;

         int[] pivot = m[rank];
         int inverse = field.inv(pivot[col]);
         if (inverse != 1) {
            for (int j = col; j < cols; ++j) {
               pivot[j] = field.mul(pivot[j], inverse);
            }
         }

         for (int r = 0; r < rows; ++r) {
            int factor = m[r][col];
            if (r == rank || factor == 0) {
               continue;
            }
            int[] row = m[r];
            for (int j = col; j < cols; ++j) {
               if (pivot[j] != 0) {
                  row[j] = field.sub(row[j], field.mul(factor, pivot[j]));
               }
            }
         }

         pivots[rank++] = col;
      }

      return new RowEchelonForm(FieldMatrix.wrap(field, cols, m),
              Arrays.copyOf(pivots, rank));
   }

   public static int rank(FieldMatrix matrix) {
      return rowEchelon(matrix).rank();
   }

   /**
    * Basis of the right kernel {x : Mx = 0}, one vector per row.
    */
   public static FieldMatrix kernelBasis(FieldMatrix matrix) {
      FiniteField field = matrix.field();
      RowEchelonForm ref = rowEchelon(matrix);
      FieldMatrix reduced = ref.reduced();
      int[] pivots = ref.pivotColumns();
      int cols = matrix.cols();

      boolean[] isPivot = new boolean[cols];
      for (int c : pivots) {
         isPivot[c] = true;
      }

      int[][] basis = new int[cols - pivots.length][];
      int next = 0;
      for (int free = 0; free < cols; ++free) {
         if (isPivot[free]) {
            continue;
         }
         int[] v = new int[cols];
         v[free] = 1;
         for (int i = 0; i < pivots.length; ++i) {
            v[pivots[i]] = field.neg(reduced.get(i, free));
         }
         basis[next++] = v;
      }
      return FieldMatrix.wrap(field, cols, basis);
   }

   /**
    * Basis of the column space, taken from the pivot columns of the input
    * and returned as rows.
    */
   public static FieldMatrix imageBasis(FieldMatrix matrix) {
      int[] pivots = rowEchelon(matrix).pivotColumns();
      int[][] basis = new int[pivots.length][matrix.rows()];
      for (int k = 0; k < pivots.length; ++k) {
         for (int i = 0; i < matrix.rows(); ++i) {
            basis[k][i] = matrix.get(i, pivots[k]);
         }
      }
      return FieldMatrix.wrap(matrix.field(), matrix.rows(), basis);
   }

   public static FieldMatrix rowSpaceBasis(FieldMatrix matrix) {
      RowEchelonForm ref = rowEchelon(matrix);
      int[][] basis = new int[ref.rank()][];
      for (int i = 0; i < basis.length; ++i) {
         basis[i] = ref.reduced().row(i);
      }
      return FieldMatrix.wrap(matrix.field(), matrix.cols(), basis);
   }

   /**
    * dim(V / W) where V and W are the row spans of the arguments.
    *
    * @throws AlgebraicInconsistencyException if W is not contained in V
    */
   public static int quotientDimension(FieldMatrix ambientSpan,
                                       FieldMatrix subSpan) {
      int dimV = rank(ambientSpan);
      int dimW = rank(subSpan);
      int dimSum = rank(ambientSpan.stack(subSpan));
      if (dimSum != dimV) {
         throw new AlgebraicInconsistencyException("Subspace of dimension " +
                 dimW + " is not contained in ambient space of dimension " + dimV);
      }
      return dimV - dimW;
   }

   /**
    * @return whether the rows of {@code words} span exactly the row space of
    * {@code space}
    */
   public static boolean spans(FieldMatrix words, FieldMatrix space) {
      int dimSpace = rank(space);
      return rank(words) == dimSpace && rank(space.stack(words)) == dimSpace;
   }

   public static boolean inRowSpace(FieldMatrix space, int[] vector) {
      FieldMatrix v = FieldMatrix.of(space.field(), space.cols(),
              new int[][]{vector});
      return rank(space.stack(v)) == rank(space);
   }
}
