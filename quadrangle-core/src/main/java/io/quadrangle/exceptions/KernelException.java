package io.quadrangle.exceptions;

/**
 * Root of the kernel's failure hierarchy. All kernel failures are unchecked:
 * they signal a broken construction or a contradiction between independently
 * computed facts, never an expected outcome.
 */
public class KernelException extends RuntimeException {

   public KernelException(String message) {
      super(message);
   }

   public KernelException(String message, Throwable cause) {
      super(message, cause);
   }
}
