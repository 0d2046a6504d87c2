package io.quadrangle.graph;

import io.quadrangle.conf.Configuration;
import org.apache.log4j.Logger;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Adjacency spectra through the symmetric eigen-decomposition of EJML.
 */
public class SpectrumCalculator {
   private static final Logger LOG = Logger.getLogger(SpectrumCalculator.class);

   private final double tolerance;

   public SpectrumCalculator(double tolerance) {
      if (!(tolerance > 0)) {
         throw new IllegalArgumentException("Tolerance must be positive: " + tolerance);
      }
      this.tolerance = tolerance;
   }

   public SpectrumCalculator(Configuration configuration) {
      this(configuration.getSpectrumTolerance());
   }

   public double tolerance() {
      return tolerance;
   }

   public Spectrum compute(Graph graph) {
      int n = graph.numVertices();
      DMatrixRMaj matrix = new DMatrixRMaj(n, n);
      for (int u = 0; u < n; ++u) {
         for (int v : graph.neighbours(u)) {
            matrix.set(u, v, 1.0);
         }
      }
      Spectrum spectrum = compute(matrix);
      LOG.debug("Spectrum of " + graph.name() + ": " + spectrum);
      return spectrum;
   }

   /**
    * @param symmetric a symmetric matrix; it is not modified
    */
   public Spectrum compute(DMatrixRMaj symmetric) {
      int n = symmetric.numRows;
      if (n == 0) {
         return new Spectrum(new ArrayList<>(), tolerance);
      }

      EigenDecomposition_F64<DMatrixRMaj> eig =
              DecompositionFactory_DDRM.eig(n, false, true);
      if (!eig.decompose(symmetric.copy())) {
         throw new IllegalStateException("Eigen-decomposition did not converge" +
                 " for a " + n + "x" + n + " matrix");
      }

      double[] values = new double[n];
      for (int i = 0; i < n; ++i) {
         values[i] = eig.getEigenvalue(i).getReal();
      }
      return cluster(values);
   }

   /**
    * Groups sorted eigenvalues whose consecutive gap is within the
    * tolerance and represents each group by its mean, snapped to the nearest
    * integer when within tolerance of it.
    */
   Spectrum cluster(double[] values) {
      double[] sorted = values.clone();
      Arrays.sort(sorted);
      List<Spectrum.Eigenvalue> result = new ArrayList<>();
      int i = sorted.length - 1;
      while (i >= 0) {
         int j = i;
         double sum = sorted[i];
         while (j > 0 && sorted[j] - sorted[j - 1] <= tolerance) {
            j--;
            sum += sorted[j];
         }
         int multiplicity = i - j + 1;
         double mean = sum / multiplicity;
         double rounded = Math.rint(mean);
         if (Math.abs(mean - rounded) <= tolerance) {
            mean = rounded == 0.0 ? 0.0 : rounded;
         }
         result.add(new Spectrum.Eigenvalue(mean, multiplicity));
         i = j - 1;
      }
      return new Spectrum(result, tolerance);
   }
}
