package io.quadrangle.exceptions;

/**
 * Division by zero, a value outside the field, or an operation combining
 * values of different fields.
 */
public class FieldArithmeticException extends KernelException {

   public FieldArithmeticException(String message) {
      super(message);
   }

   public FieldArithmeticException(String message, Throwable cause) {
      super(message, cause);
   }
}
