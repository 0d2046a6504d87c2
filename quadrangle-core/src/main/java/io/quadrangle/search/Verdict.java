package io.quadrangle.search;

public enum Verdict {
   /** order, degree and spectrum all equal */
   MATCH,
   /** order and degree equal, spectrum differs; not a match */
   NEAR_MATCH,
   MISMATCH
}
