package io.quadrangle.field;

import com.koloboke.collect.map.hash.HashIntObjMap;
import com.koloboke.collect.map.hash.HashIntObjMaps;
import io.quadrangle.exceptions.FieldArithmeticException;
import org.apache.log4j.Logger;

import java.io.Serializable;
import java.util.Arrays;

/**
 * The finite field GF(q), q = p^k. Elements are ints in {@code 0..q-1}: the
 * base-p digits of an element are the coefficients (constant term first) of
 * its residue modulo a monic irreducible polynomial of degree k. The
 * polynomial is the first irreducible one in digit order, so the encoding is
 * the same on every run.
 *
 * <p>Fields are immutable and cached per order. Arithmetic is table driven.
 */
public final class FiniteField implements Serializable {
   private static final Logger LOG = Logger.getLogger(FiniteField.class);

   public static final int MAX_ORDER = 256;

   private static final HashIntObjMap<FiniteField> FIELDS =
           HashIntObjMaps.newMutableMap();

   private final int order;
   private final int characteristic;
   private final int degree;
   private final int[] modulus;

   private final int[][] addTable;
   private final int[][] mulTable;
   private final int[] negTable;
   private final int[] invTable;

   public static FiniteField of(int order) {
      synchronized (FIELDS) {
         FiniteField field = FIELDS.get(order);
         if (field == null) {
            field = new FiniteField(order);
            FIELDS.put(order, field);
            LOG.debug("Created " + field + " modulus=" +
                    Arrays.toString(field.modulus));
         }
         return field;
      }
   }

   private FiniteField(int order) {
      if (order < 2 || order > MAX_ORDER) {
         throw new IllegalArgumentException("Unsupported field order " + order
                 + ", expected a prime power in [2," + MAX_ORDER + "]");
      }

      int p = smallestPrimeFactor(order);
      int k = 0;
      int rest = order;
      while (rest % p == 0) {
         rest /= p;
         k++;
      }

      if (rest != 1) {
         throw new IllegalArgumentException(
                 "Field order " + order + " is not a prime power");
      }

      this.order = order;
      this.characteristic = p;
      this.degree = k;
      this.addTable = new int[order][order];
      this.negTable = new int[order];

      for (int a = 0; a < order; ++a) {
         for (int b = 0; b < order; ++b) {
            addTable[a][b] = digitwise(a, b, 1);
         }
         negTable[a] = digitwise(0, a, -1);
      }

      int[] found = null;
      int[][] table = null;
      int candidates = 1;
      for (int i = 0; i < k; ++i) {
         candidates *= p;
      }

      for (int lower = 0; lower < candidates && found == null; ++lower) {
         int[] poly = new int[k + 1];
         int rem = lower;
         for (int i = 0; i < k; ++i) {
            poly[i] = rem % p;
            rem /= p;
         }
         poly[k] = 1;
         table = multiplicationTable(poly);
         if (table != null) {
            found = poly;
         }
      }

      if (found == null) {
         throw new IllegalStateException(
                 "No irreducible polynomial of degree " + k + " over GF(" + p + ")");
      }

      this.modulus = found;
      this.mulTable = table;
      this.invTable = new int[order];
      for (int a = 1; a < order; ++a) {
         for (int b = 1; b < order; ++b) {
            if (mulTable[a][b] == 1) {
               invTable[a] = b;
               break;
            }
         }
      }
   }

   private static int smallestPrimeFactor(int n) {
      for (int d = 2; d * d <= n; ++d) {
         if (n % d == 0) {
            return d;
         }
      }
      return n;
   }

   private int digitwise(int a, int b, int sign) {
      int result = 0;
      int place = 1;
      for (int i = 0; i < degree; ++i) {
         int da = a % characteristic;
         int db = b % characteristic;
         int digit = Math.floorMod(da + sign * db, characteristic);
         result += digit * place;
         place *= characteristic;
         a /= characteristic;
         b /= characteristic;
      }
      return result;
   }

   /**
    * Multiplication table modulo {@code poly}, or null when the quotient ring
    * has zero divisors (the polynomial is reducible).
    */
   private int[][] multiplicationTable(int[] poly) {
      int[][] table = new int[order][order];
      int[] da = new int[degree];
      int[] db = new int[degree];
      int[] product = new int[2 * degree];
      for (int a = 0; a < order; ++a) {
         digits(a, da);
         for (int b = a; b < order; ++b) {
            digits(b, db);
            Arrays.fill(product, 0);
            for (int i = 0; i < degree; ++i) {
               if (da[i] == 0) {
                  continue;
               }
               for (int j = 0; j < degree; ++j) {
                  product[i + j] = (product[i + j] + da[i] * db[j]) % characteristic;
               }
            }
            // reduce using x^k = -(poly[0] + ... + poly[k-1] x^(k-1))
            for (int top = 2 * degree - 2; top >= degree; --top) {
               int c = product[top];
               if (c == 0) {
                  continue;
               }
               product[top] = 0;
               for (int i = 0; i < degree; ++i) {
                  product[top - degree + i] = Math.floorMod(
                          product[top - degree + i] - c * poly[i], characteristic);
               }
            }
            int value = 0;
            int place = 1;
            for (int i = 0; i < degree; ++i) {
               value += product[i] * place;
               place *= characteristic;
            }
            if (value == 0 && a != 0 && b != 0) {
               return null;
            }
            table[a][b] = value;
            table[b][a] = value;
         }
      }
      return table;
   }

   private void digits(int value, int[] target) {
      for (int i = 0; i < degree; ++i) {
         target[i] = value % characteristic;
         value /= characteristic;
      }
   }

   public int order() {
      return order;
   }

   public int characteristic() {
      return characteristic;
   }

   public int degree() {
      return degree;
   }

   public boolean isPrime() {
      return degree == 1;
   }

   public int zero() {
      return 0;
   }

   public int one() {
      return 1;
   }

   /**
    * @return all elements in encoding order, zero first
    */
   public int[] elements() {
      int[] elements = new int[order];
      for (int i = 0; i < order; ++i) {
         elements[i] = i;
      }
      return elements;
   }

   /**
    * Image of an integer in the prime subfield.
    */
   public int fromInt(long n) {
      return (int) Math.floorMod(n, (long) characteristic);
   }

   public boolean contains(int x) {
      return x >= 0 && x < order;
   }

   public int checkElement(int x) {
      if (!contains(x)) {
         throw new FieldArithmeticException(
                 "Value " + x + " is not an element of " + this);
      }
      return x;
   }

   public int add(int a, int b) {
      try {
         return addTable[a][b];
      } catch (ArrayIndexOutOfBoundsException e) {
         throw notElements(e, a, b);
      }
   }

   public int sub(int a, int b) {
      try {
         return addTable[a][negTable[b]];
      } catch (ArrayIndexOutOfBoundsException e) {
         throw notElements(e, a, b);
      }
   }

   public int neg(int a) {
      try {
         return negTable[a];
      } catch (ArrayIndexOutOfBoundsException e) {
         throw notElements(e, a);
      }
   }

   public int mul(int a, int b) {
      try {
         return mulTable[a][b];
      } catch (ArrayIndexOutOfBoundsException e) {
         throw notElements(e, a, b);
      }
   }

   public int square(int a) {
      return mul(a, a);
   }

   public int inv(int a) {
      if (a == 0) {
         throw new FieldArithmeticException("Inverse of zero in " + this);
      }
      try {
         return invTable[a];
      } catch (ArrayIndexOutOfBoundsException e) {
         throw notElements(e, a);
      }
   }

   private FieldArithmeticException notElements(RuntimeException cause,
                                                int... values) {
      for (int x : values) {
         if (!contains(x)) {
            return new FieldArithmeticException(
                    "Value " + x + " is not an element of " + this, cause);
         }
      }
      return new FieldArithmeticException("Invalid operands for " + this, cause);
   }

   public int div(int a, int b) {
      if (b == 0) {
         throw new FieldArithmeticException(
                 "Division of " + a + " by zero in " + this);
      }
      return mul(a, inv(b));
   }

   /**
    * @param exponent any integer; negative exponents invert first
    */
   public int pow(int a, long exponent) {
      if (exponent < 0) {
         a = inv(a);
         exponent = -exponent;
      }
      int result = 1;
      int base = a;
      while (exponent > 0) {
         if ((exponent & 1) == 1) {
            result = mulTable[result][base];
         }
         base = mulTable[base][base];
         exponent >>= 1;
      }
      return result;
   }

   /**
    * Frobenius automorphism x -> x^p.
    */
   public int frobenius(int a) {
      return pow(a, characteristic);
   }

   /**
    * Absolute trace GF(p^k) -> GF(p): x + x^p + ... + x^(p^(k-1)).
    */
   public int trace(int a) {
      int sum = 0;
      int term = a;
      for (int i = 0; i < degree; ++i) {
         sum = add(sum, term);
         term = frobenius(term);
      }
      return sum;
   }

   public FieldElement element(int value) {
      return new FieldElement(this, checkElement(value));
   }

   public void requireSame(FiniteField other) {
      if (this != other) {
         throw new FieldArithmeticException(
                 "Field mismatch: " + this + " vs " + other);
      }
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      return order == ((FiniteField) o).order;
   }

   @Override
   public int hashCode() {
      return order;
   }

   @Override
   public String toString() {
      return "GF(" + order + ")";
   }

   private Object readResolve() {
      return of(order);
   }
}
