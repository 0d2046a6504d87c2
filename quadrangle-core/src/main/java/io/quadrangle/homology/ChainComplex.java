package io.quadrangle.homology;

import io.quadrangle.exceptions.AlgebraicInconsistencyException;
import io.quadrangle.field.FiniteField;
import io.quadrangle.linalg.FieldMatrix;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Chain groups C_0..C_top over a field with boundaries d_1..d_top, where
 * d_k : C_k -> C_{k-1}. Construction fails unless every composite
 * d_{k-1} d_k vanishes.
 */
public final class ChainComplex {
   private static final Logger LOG = Logger.getLogger(ChainComplex.class);

   private final String name;
   private final FiniteField field;
   private final int[] chainDimensions;
   private final List<FieldMatrix> boundaries;

   private ChainComplex(String name, FiniteField field, int[] chainDimensions,
                        List<FieldMatrix> boundaries) {
      this.name = name;
      this.field = field;
      this.chainDimensions = chainDimensions;
      this.boundaries = boundaries;
   }

   public static ChainComplex over(SimplicialComplex complex, FiniteField field) {
      int top = complex.dimension();
      List<FieldMatrix> boundaries = new ArrayList<>();
      for (int k = 1; k <= top; ++k) {
         boundaries.add(BoundaryOperator.matrix(complex, k, field));
      }
      return of(complex.name(), field, complex.fVector(), boundaries);
   }

   /**
    * @param boundaries d_1..d_top; d_k must be chainDimensions[k-1] x
    *                   chainDimensions[k]
    */
   public static ChainComplex of(String name, FiniteField field,
                                 int[] chainDimensions,
                                 List<FieldMatrix> boundaries) {
      if (boundaries.size() != Math.max(0, chainDimensions.length - 1)) {
         throw new IllegalArgumentException("Expected " +
                 (chainDimensions.length - 1) + " boundaries, got " +
                 boundaries.size());
      }
      for (int k = 1; k <= boundaries.size(); ++k) {
         FieldMatrix d = boundaries.get(k - 1);
         if (!d.field().equals(field)) {
            throw new IllegalArgumentException("Boundary d_" + k + " is over " +
                    d.field() + ", complex over " + field);
         }
         if (d.rows() != chainDimensions[k - 1] || d.cols() != chainDimensions[k]) {
            throw new IllegalArgumentException("Boundary d_" + k + " is " +
                    d.rows() + "x" + d.cols() + ", expected " +
                    chainDimensions[k - 1] + "x" + chainDimensions[k]);
         }
      }
      for (int k = 2; k <= boundaries.size(); ++k) {
         FieldMatrix composite = boundaries.get(k - 2).multiply(boundaries.get(k - 1));
         if (!composite.isZero()) {
            throw new AlgebraicInconsistencyException("d_" + (k - 1) + " d_" + k +
                    " != 0 for " + name + " over " + field);
         }
      }
      LOG.debug("Chain complex " + name + " over " + field + " verified");
      return new ChainComplex(name, field, chainDimensions.clone(),
              Collections.unmodifiableList(new ArrayList<>(boundaries)));
   }

   public String name() {
      return name;
   }

   public FiniteField field() {
      return field;
   }

   public int topDimension() {
      return chainDimensions.length - 1;
   }

   public int chainDimension(int k) {
      return k < 0 || k >= chainDimensions.length ? 0 : chainDimensions[k];
   }

   public int[] chainDimensions() {
      return chainDimensions.clone();
   }

   /**
    * @return d_k for 1 <= k <= top
    */
   public FieldMatrix boundary(int k) {
      return boundaries.get(k - 1);
   }
}
