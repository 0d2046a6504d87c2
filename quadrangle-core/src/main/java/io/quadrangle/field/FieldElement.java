package io.quadrangle.field;

import io.quadrangle.exceptions.FieldArithmeticException;

import java.io.Serializable;

/**
 * Immutable element of a {@link FiniteField}. Combining elements of
 * different fields throws {@link FieldArithmeticException}.
 */
public final class FieldElement implements Serializable {

   private final FiniteField field;
   private final int value;

   FieldElement(FiniteField field, int value) {
      this.field = field;
      this.value = value;
   }

   public FiniteField field() {
      return field;
   }

   public int value() {
      return value;
   }

   public boolean isZero() {
      return value == 0;
   }

   private int other(FieldElement o) {
      if (!field.equals(o.field)) {
         throw new FieldArithmeticException(
                 "Cannot combine " + this + " with " + o);
      }
      return o.value;
   }

   public FieldElement add(FieldElement o) {
      return new FieldElement(field, field.add(value, other(o)));
   }

   public FieldElement sub(FieldElement o) {
      return new FieldElement(field, field.sub(value, other(o)));
   }

   public FieldElement mul(FieldElement o) {
      return new FieldElement(field, field.mul(value, other(o)));
   }

   public FieldElement div(FieldElement o) {
      return new FieldElement(field, field.div(value, other(o)));
   }

   public FieldElement neg() {
      return new FieldElement(field, field.neg(value));
   }

   public FieldElement inv() {
      return new FieldElement(field, field.inv(value));
   }

   public FieldElement square() {
      return new FieldElement(field, field.square(value));
   }

   public FieldElement pow(long exponent) {
      return new FieldElement(field, field.pow(value, exponent));
   }

   public FieldElement frobenius() {
      return new FieldElement(field, field.frobenius(value));
   }

   /**
    * @return the trace, an element of the prime subfield GF(p)
    */
   public FieldElement trace() {
      FiniteField prime = FiniteField.of(field.characteristic());
      return new FieldElement(prime, field.trace(value));
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof FieldElement)) return false;
      FieldElement that = (FieldElement) o;
      return value == that.value && field.equals(that.field);
   }

   @Override
   public int hashCode() {
      return 31 * field.hashCode() + value;
   }

   @Override
   public String toString() {
      return value + "@" + field;
   }
}
