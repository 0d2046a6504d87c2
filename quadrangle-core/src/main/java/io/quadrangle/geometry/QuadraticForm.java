package io.quadrangle.geometry;

import io.quadrangle.exceptions.ConstructionException;
import io.quadrangle.exceptions.ConstructionException.Axiom;
import io.quadrangle.field.FiniteField;

/**
 * Quadratic form Q(x) = sum over i <= j of c[i][j] x_i x_j, given by its
 * upper triangular coefficients. The polar form is
 * B(x, y) = Q(x + y) - Q(x) - Q(y).
 */
public final class QuadraticForm implements PolarForm {

   private final FiniteField field;
   private final int[][] coefficients;
   private final String name;

   private QuadraticForm(FiniteField field, int[][] coefficients, String name) {
      this.field = field;
      this.coefficients = coefficients;
      this.name = name;
   }

   public static QuadraticForm of(FiniteField field, int[][] coefficients) {
      int n = coefficients.length;
      int[][] copy = new int[n][];
      for (int i = 0; i < n; ++i) {
         if (coefficients[i].length != n) {
            throw new ConstructionException(Axiom.FORM_SHAPE,
                    "coefficient matrix is not square at row " + i);
         }
         copy[i] = coefficients[i].clone();
         for (int j = 0; j < n; ++j) {
            field.checkElement(copy[i][j]);
            if (j < i && copy[i][j] != 0) {
               throw new ConstructionException(Axiom.FORM_SHAPE,
                       "coefficient (" + i + "," + j + ") below the diagonal");
            }
         }
      }
      return new QuadraticForm(field, copy, quadricName(
              new QuadraticForm(field, copy, null)));
   }

   /**
    * Q(n-1,q) in odd dimension. In even dimension n = 2m the singular point
    * count tells the types apart: (q^m + 1)(q^(m-1) - 1)/(q - 1) for the
    * elliptic quadric Q-(n-1,q), (q^m - 1)(q^(m-1) + 1)/(q - 1) for the
    * hyperbolic Q+(n-1,q). Degenerate forms keep the plain name.
    */
   static String quadricName(QuadraticForm form) {
      int n = form.dimension();
      int q = form.field().order();
      String suffix = "(" + (n - 1) + "," + q + ")";
      if (n % 2 != 0) {
         return "Q" + suffix;
      }
      long singular = 0;
      for (int[] x : ProjectiveSpace.points(form.field(), n)) {
         if (form.isSingular(x)) {
            singular++;
         }
      }
      int m = n / 2;
      long qm = pow(q, m);
      long qm1 = pow(q, m - 1);
      if (singular == (qm + 1) * (qm1 - 1) / (q - 1)) {
         return "Q-" + suffix;
      } else if (singular == (qm - 1) * (qm1 + 1) / (q - 1)) {
         return "Q+" + suffix;
      }
      return "Q" + suffix;
   }

   private static long pow(long base, int exponent) {
      long result = 1;
      for (int i = 0; i < exponent; ++i) {
         result *= base;
      }
      return result;
   }

   /**
    * Parabolic quadric x0 x1 + x2 x3 + x4^2 in PG(4, q); a GQ(q, q).
    */
   public static QuadraticForm parabolic(FiniteField field) {
      int[][] c = new int[5][5];
      c[0][1] = 1;
      c[2][3] = 1;
      c[4][4] = 1;
      return new QuadraticForm(field, c, "Q(4," + field.order() + ")");
   }

   /**
    * Elliptic quadric x0 x1 + x2 x3 + x4^2 + a x4 x5 + b x5^2 in PG(5, q),
    * with x^2 + a x + b the first irreducible monic quadratic; a GQ(q, q^2).
    */
   public static QuadraticForm elliptic(FiniteField field) {
      int[][] c = new int[6][6];
      c[0][1] = 1;
      c[2][3] = 1;
      c[4][4] = 1;
      int[] ab = irreducibleQuadratic(field);
      c[4][5] = ab[0];
      c[5][5] = ab[1];
      return new QuadraticForm(field, c, "Q-(5," + field.order() + ")");
   }

   private static int[] irreducibleQuadratic(FiniteField field) {
      for (int a = 0; a < field.order(); ++a) {
         for (int b = 1; b < field.order(); ++b) {
            boolean hasRoot = false;
            for (int x = 0; x < field.order() && !hasRoot; ++x) {
               int value = field.add(field.add(field.square(x), field.mul(a, x)), b);
               hasRoot = value == 0;
            }
            if (!hasRoot) {
               return new int[]{a, b};
            }
         }
      }
      throw new IllegalStateException("No irreducible quadratic over " + field);
   }

   public int evaluate(int[] x) {
      int acc = 0;
      for (int i = 0; i < coefficients.length; ++i) {
         if (x[i] == 0) {
            continue;
         }
         for (int j = i; j < coefficients.length; ++j) {
            int c = coefficients[i][j];
            if (c != 0 && x[j] != 0) {
               acc = field.add(acc, field.mul(c, field.mul(x[i], x[j])));
            }
         }
      }
      return acc;
   }

   @Override
   public FiniteField field() {
      return field;
   }

   @Override
   public int dimension() {
      return coefficients.length;
   }

   @Override
   public boolean isSingular(int[] x) {
      return evaluate(x) == 0;
   }

   @Override
   public int polar(int[] x, int[] y) {
      int[] sum = new int[x.length];
      for (int i = 0; i < x.length; ++i) {
         sum[i] = field.add(x[i], y[i]);
      }
      return field.sub(field.sub(evaluate(sum), evaluate(x)), evaluate(y));
   }

   @Override
   public String name() {
      return name;
   }

   @Override
   public String toString() {
      return name;
   }
}
