package io.quadrangle.exceptions;

/**
 * Thrown when an incidence structure cannot be built or fails one of the
 * generalized quadrangle axioms. The violated axiom is kept so callers can
 * react to it without parsing the message.
 */
public class ConstructionException extends KernelException {

   public enum Axiom {
      FORM_SHAPE,
      NON_DEGENERATE_FORM,
      LINE_REGULARITY,
      POINT_REGULARITY,
      UNIQUE_JOINING_LINE,
      QUADRANGLE_AXIOM,
      POINT_COUNT,
      LINE_COUNT,
      UNSUPPORTED_PARAMETERS
   }

   private final Axiom axiom;

   public ConstructionException(Axiom axiom, String detail) {
      super(axiom + ": " + detail);
      this.axiom = axiom;
   }

   public Axiom getAxiom() {
      return axiom;
   }
}
