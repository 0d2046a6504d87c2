package io.quadrangle.linalg;

/**
 * Reduced row echelon form of a matrix together with its pivot columns.
 */
public final class RowEchelonForm {

   private final FieldMatrix reduced;
   private final int[] pivotColumns;

   RowEchelonForm(FieldMatrix reduced, int[] pivotColumns) {
      this.reduced = reduced;
      this.pivotColumns = pivotColumns;
   }

   public FieldMatrix reduced() {
      return reduced;
   }

   public int[] pivotColumns() {
      return pivotColumns.clone();
   }

   public int rank() {
      return pivotColumns.length;
   }
}
