package io.quadrangle.geometry;

import io.quadrangle.exceptions.ConstructionException;
import io.quadrangle.exceptions.ConstructionException.Axiom;
import io.quadrangle.field.FiniteField;
import io.quadrangle.linalg.FieldMatrix;

import java.util.Arrays;

/**
 * Alternating bilinear form given by its Gram matrix. Every point is
 * singular; the polar space is the symplectic space W(n-1, q).
 */
public final class AlternatingForm implements PolarForm {

   private final FiniteField field;
   private final int[][] gram;
   private final boolean standard;

   private AlternatingForm(FiniteField field, int[][] gram, boolean standard) {
      this.field = field;
      this.gram = gram;
      this.standard = standard;
   }

   /**
    * The standard form x0 y_m - x_m y0 + ... with m = dim/2, i.e. for
    * dim = 4: x0 y2 - x2 y0 + x1 y3 - x3 y1.
    */
   public static AlternatingForm standard(FiniteField field, int dimension) {
      if (dimension < 2 || dimension % 2 != 0) {
         throw new ConstructionException(Axiom.FORM_SHAPE,
                 "standard alternating form needs an even dimension, got " +
                         dimension);
      }
      int m = dimension / 2;
      int[][] gram = new int[dimension][dimension];
      for (int i = 0; i < m; ++i) {
         gram[i][i + m] = 1;
         gram[i + m][i] = field.neg(1);
      }
      return new AlternatingForm(field, gram, true);
   }

   public static AlternatingForm of(FiniteField field, int[][] gram) {
      int n = gram.length;
      int[][] copy = new int[n][];
      for (int i = 0; i < n; ++i) {
         if (gram[i].length != n) {
            throw new ConstructionException(Axiom.FORM_SHAPE,
                    "Gram matrix is not square at row " + i);
         }
         copy[i] = gram[i].clone();
         for (int j = 0; j < n; ++j) {
            field.checkElement(gram[i][j]);
         }
      }
      for (int i = 0; i < n; ++i) {
         if (copy[i][i] != 0) {
            throw new ConstructionException(Axiom.FORM_SHAPE,
                    "diagonal entry " + i + " of an alternating form is not 0");
         }
         for (int j = i + 1; j < n; ++j) {
            if (copy[j][i] != field.neg(copy[i][j])) {
               throw new ConstructionException(Axiom.FORM_SHAPE,
                       "entries (" + i + "," + j + ") and (" + j + "," + i +
                               ") are not opposite");
            }
         }
      }
      AlternatingForm std = n % 2 == 0 && n > 0 ? standard(field, n) : null;
      boolean isStandard = std != null && Arrays.deepEquals(copy, std.gram);
      return new AlternatingForm(field, copy, isStandard);
   }

   public boolean isStandard() {
      return standard;
   }

   @Override
   public FiniteField field() {
      return field;
   }

   @Override
   public int dimension() {
      return gram.length;
   }

   @Override
   public boolean isSingular(int[] x) {
      return true;
   }

   @Override
   public int polar(int[] x, int[] y) {
      int acc = 0;
      for (int i = 0; i < gram.length; ++i) {
         if (x[i] == 0) {
            continue;
         }
         for (int j = 0; j < gram.length; ++j) {
            if (gram[i][j] != 0 && y[j] != 0) {
               acc = field.add(acc, field.mul(x[i], field.mul(gram[i][j], y[j])));
            }
         }
      }
      return acc;
   }

   @Override
   public FieldMatrix gramMatrix() {
      return FieldMatrix.of(field, gram.length, gram);
   }

   @Override
   public String name() {
      return "W(" + (gram.length - 1) + "," + field.order() + ")";
   }

   @Override
   public String toString() {
      return name() + (standard ? "" : "*");
   }
}
