package io.quadrangle.graph;

import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SpectrumCalculatorTest {

   @Test
   void nearbyEigenvaluesAreMergedAndSnapped() {
      SpectrumCalculator calc = new SpectrumCalculator(1e-6);
      Spectrum s = calc.cluster(new double[]{2.0000000001, -1.0, 1.9999999999,
              -0.9999999997, 0.5});
      assertEquals(3, s.distinctCount());
      assertEquals(2.0, s.largest());
      assertEquals(2, s.multiplicity(2));
      assertEquals(2, s.multiplicity(-1));
      assertEquals(1, s.multiplicity(0.5));
      assertEquals(0, s.multiplicity(7));
      assertEquals(5, s.dimension());
      assertEquals("{2:2, 0.500000:1, -1:2}", s.toString());
   }

   @Test
   void diagonalMatrix() {
      DMatrixRMaj m = new DMatrixRMaj(new double[][]{{3, 0, 0}, {0, -1, 0}, {0, 0, 3}});
      Spectrum s = new SpectrumCalculator(1e-6).compute(m);
      assertEquals("{3:2, -1:1}", s.toString());
      assertTrue(s.isIntegral());
   }

   @Test
   void spectraCompareWithinTolerance() {
      SpectrumCalculator calc = new SpectrumCalculator(1e-6);
      Spectrum a = calc.compute(GraphInvariantsTest.petersen());
      Spectrum b = calc.compute(GraphInvariantsTest.petersen().withName("copy"));
      assertTrue(a.sameAs(b));
      assertFalse(a.sameAs(calc.compute(GraphInvariantsTest.cycle(10))));
      assertEquals(0, calc.compute(Graph.fromEdges("empty", 0, new int[0][])).dimension());
   }
}
