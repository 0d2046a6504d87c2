package io.quadrangle.field;

import io.quadrangle.exceptions.FieldArithmeticException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FiniteFieldTest {

   @Test
   void primeFieldReducesModP() {
      FiniteField f = FiniteField.of(3);
      assertTrue(f.isPrime());
      assertEquals(3, f.characteristic());
      assertEquals(1, f.degree());
      assertEquals(1, f.fromInt(7));
      assertEquals(2, f.fromInt(-1));
      assertEquals(0, f.add(1, 2));
      assertEquals(1, f.mul(2, 2));
      assertEquals(2, f.inv(2));
      assertEquals(2, f.neg(1));
   }

   @Test
   void everyNonZeroElementHasAnInverse() {
      for (int q : new int[]{2, 3, 4, 5, 7, 8, 9, 16, 27}) {
         FiniteField f = FiniteField.of(q);
         for (int a : f.elements()) {
            if (a == 0) {
               continue;
            }
            assertEquals(f.one(), f.mul(a, f.inv(a)), "inverse of " + a + " in " + f);
            assertEquals(f.one(), f.pow(a, q - 1), "Fermat in " + f);
         }
      }
   }

   @Test
   void extensionFieldIsNotTheIntegersModQ() {
      FiniteField f = FiniteField.of(4);
      assertFalse(f.isPrime());
      assertEquals(2, f.characteristic());
      assertEquals(2, f.degree());
      // modulus x^2 + x + 1: alpha = 2, alpha^2 = alpha + 1 = 3
      assertEquals(3, f.mul(2, 2));
      assertEquals(0, f.add(3, 3));
      assertEquals(1, f.add(2, 3));
      assertEquals(1, f.mul(2, 3));
   }

   @Test
   void frobeniusAndTraceLandInTheRightPlaces() {
      FiniteField f = FiniteField.of(9);
      for (int a : f.elements()) {
         assertEquals(a, f.frobenius(f.frobenius(a)));
         assertTrue(f.trace(a) < 3, "trace must lie in GF(3)");
      }
      FieldElement x = f.element(5);
      assertEquals(f.trace(5), x.trace().value());
      assertSame(FiniteField.of(3), x.trace().field());
   }

   @Test
   void fieldsAreCachedPerOrder() {
      assertSame(FiniteField.of(8), FiniteField.of(8));
      assertEquals("GF(8)", FiniteField.of(8).toString());
   }

   @Test
   void divisionByZeroFails() {
      FiniteField f = FiniteField.of(5);
      assertThrows(FieldArithmeticException.class, () -> f.inv(0));
      assertThrows(FieldArithmeticException.class, () -> f.div(3, 0));
      assertThrows(FieldArithmeticException.class, () -> f.element(5));
   }

   @Test
   void valuesOutsideTheFieldAreArithmeticErrors() {
      FiniteField f = FiniteField.of(5);
      FieldArithmeticException e = assertThrows(FieldArithmeticException.class,
              () -> f.add(5, 1));
      assertTrue(e.getMessage().contains("Value 5"), e.getMessage());
      assertThrows(FieldArithmeticException.class, () -> f.sub(1, -1));
      assertThrows(FieldArithmeticException.class, () -> f.neg(7));
      assertThrows(FieldArithmeticException.class, () -> f.mul(2, 6));
      assertThrows(FieldArithmeticException.class, () -> f.square(-3));
      assertThrows(FieldArithmeticException.class, () -> f.inv(9));
      assertThrows(FieldArithmeticException.class, () -> f.div(1, 5));
      assertEquals(4, f.add(2, 2));
   }

   @Test
   void rejectsNonPrimePowers() {
      assertThrows(IllegalArgumentException.class, () -> FiniteField.of(6));
      assertThrows(IllegalArgumentException.class, () -> FiniteField.of(1));
      assertThrows(IllegalArgumentException.class, () -> FiniteField.of(512));
   }

   @Test
   void elementsOfDifferentFieldsDoNotMix() {
      FieldElement a = FiniteField.of(3).element(1);
      FieldElement b = FiniteField.of(5).element(1);
      assertThrows(FieldArithmeticException.class, () -> a.add(b));
      assertEquals(FiniteField.of(3).element(2), a.add(a));
      assertNotEquals(a, b);
   }
}
