package io.quadrangle.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Adjacency spectrum as distinct eigenvalues (descending) with
 * multiplicities. Eigenvalues closer than the tolerance were merged, and
 * values within the tolerance of an integer were snapped to it.
 */
public final class Spectrum {

   public static final class Eigenvalue {
      private final double value;
      private final int multiplicity;

      public Eigenvalue(double value, int multiplicity) {
         this.value = value;
         this.multiplicity = multiplicity;
      }

      public double value() {
         return value;
      }

      public int multiplicity() {
         return multiplicity;
      }

      public boolean isIntegral() {
         return value == Math.rint(value);
      }

      @Override
      public String toString() {
         return Spectrum.format(value) + ":" + multiplicity;
      }
   }

   private final List<Eigenvalue> eigenvalues;
   private final double tolerance;

   public Spectrum(List<Eigenvalue> eigenvalues, double tolerance) {
      this.eigenvalues = Collections.unmodifiableList(new ArrayList<>(eigenvalues));
      this.tolerance = tolerance;
   }

   static String format(double value) {
      if (value == Math.rint(value)) {
         return Long.toString((long) value);
      }
      return String.format(Locale.ROOT, "%.6f", value);
   }

   public List<Eigenvalue> eigenvalues() {
      return eigenvalues;
   }

   public double tolerance() {
      return tolerance;
   }

   public int distinctCount() {
      return eigenvalues.size();
   }

   public int dimension() {
      int total = 0;
      for (Eigenvalue e : eigenvalues) {
         total += e.multiplicity;
      }
      return total;
   }

   public double largest() {
      return eigenvalues.get(0).value;
   }

   public boolean isIntegral() {
      for (Eigenvalue e : eigenvalues) {
         if (!e.isIntegral()) {
            return false;
         }
      }
      return true;
   }

   /**
    * @return multiplicity of the eigenvalue within tolerance, 0 if absent
    */
   public int multiplicity(double value) {
      for (Eigenvalue e : eigenvalues) {
         if (Math.abs(e.value - value) <= tolerance) {
            return e.multiplicity;
         }
      }
      return 0;
   }

   /**
    * Equal distinct eigenvalues (within the larger tolerance) with equal
    * multiplicities.
    */
   public boolean sameAs(Spectrum other) {
      if (eigenvalues.size() != other.eigenvalues.size()) {
         return false;
      }
      double tol = Math.max(tolerance, other.tolerance);
      for (int i = 0; i < eigenvalues.size(); ++i) {
         Eigenvalue a = eigenvalues.get(i);
         Eigenvalue b = other.eigenvalues.get(i);
         if (a.multiplicity != b.multiplicity ||
                 Math.abs(a.value - b.value) > tol) {
            return false;
         }
      }
      return true;
   }

   @Override
   public String toString() {
      StringBuilder sb = new StringBuilder("{");
      for (int i = 0; i < eigenvalues.size(); ++i) {
         if (i > 0) {
            sb.append(", ");
         }
         sb.append(eigenvalues.get(i));
      }
      return sb.append('}').toString();
   }
}
