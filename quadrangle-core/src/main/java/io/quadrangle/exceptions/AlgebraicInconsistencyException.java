package io.quadrangle.exceptions;

/**
 * Two computations that must agree did not: a boundary composition that is
 * not zero, group orders that differ, a code whose rank contradicts its
 * declared dimension, and so on. Always a bug or a wrong input, never
 * something to retry.
 */
public class AlgebraicInconsistencyException extends KernelException {

   public AlgebraicInconsistencyException(String message) {
      super(message);
   }
}
