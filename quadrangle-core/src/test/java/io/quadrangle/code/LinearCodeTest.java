package io.quadrangle.code;

import io.quadrangle.exceptions.AlgebraicInconsistencyException;
import io.quadrangle.field.FiniteField;
import io.quadrangle.geometry.AlternatingForm;
import io.quadrangle.geometry.GeneralizedQuadrangleBuilder;
import io.quadrangle.geometry.IncidenceStructure;
import io.quadrangle.graph.Graph;
import io.quadrangle.linalg.FieldMatrix;
import io.quadrangle.linalg.LinearAlgebra;
import io.quadrangle.util.InvariantRecord;
import org.junit.jupiter.api.Test;

import java.util.SortedMap;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class LinearCodeTest {
   private static final FiniteField GF2 = FiniteField.of(2);
   private static final FiniteField GF3 = FiniteField.of(3);

   @Test
   void hammingCode() {
      FieldMatrix g = FieldMatrix.of(GF2, new int[][]{
              {1, 0, 0, 0, 1, 1, 0},
              {0, 1, 0, 0, 1, 0, 1},
              {0, 0, 1, 0, 0, 1, 1},
              {0, 0, 0, 1, 1, 1, 1}});
      LinearCode hamming = LinearCode.of("hamming", g, 4);
      WeightDistribution wd = hamming.weightDistribution(1 << 10);
      assertEquals(16, wd.codewords());
      assertEquals(3, wd.minimumWeight());
      SortedMap<Integer, Long> expected = new TreeMap<>();
      expected.put(0, 1L);
      expected.put(3, 7L);
      expected.put(4, 7L);
      expected.put(7, 1L);
      assertEquals(expected, wd.nonZeroCounts());
      assertTrue(hamming.contains(new int[]{1, 1, 0, 0, 0, 1, 1}));
      assertFalse(hamming.contains(new int[]{1, 0, 0, 0, 0, 0, 0}));
   }

   @Test
   void ternaryTetracodeUsesTheGeneralEnumerator() {
      FieldMatrix g = FieldMatrix.of(GF3, new int[][]{{1, 0, 1, 1}, {0, 1, 1, 2}});
      LinearCode tetracode = LinearCode.of("tetracode", g, 2);
      assertTrue(tetracode.verifyMinimumWeight(3, 8, 100));
      assertEquals(0, tetracode.weightDistribution(100).count(4));
   }

   @Test
   void declaredDimensionMustMatchTheRank() {
      FieldMatrix g = FieldMatrix.of(GF2, new int[][]{{1, 1, 0}, {0, 1, 1}, {1, 0, 1}});
      assertThrows(AlgebraicInconsistencyException.class, () -> LinearCode.of("bad", g, 3));
      assertEquals(2, LinearCode.of("ok", g, 2).dimension());
   }

   @Test
   void wrongMinimumWeightClaimFails() {
      FieldMatrix g = FieldMatrix.of(GF3, new int[][]{{1, 0, 1, 1}, {0, 1, 1, 2}});
      LinearCode tetracode = LinearCode.of("tetracode", g, 2);
      assertThrows(AlgebraicInconsistencyException.class,
              () -> tetracode.verifyMinimumWeight(2, 8, 100));
   }

   @Test
   void enumerationLimitIsRespected() {
      FieldMatrix g = FieldMatrix.identity(GF3, 5);
      LinearCode full = LinearCode.of("full", g, 5);
      WeightDistribution wd = full.weightDistribution(10);
      assertFalse(wd.isEnumerated());
      assertEquals(243, wd.codewords());
      assertThrows(IllegalStateException.class, wd::minimumWeight);
      assertFalse(full.verifyMinimumWeight(1, 10, 10));

      InvariantRecord record = full.toRecord(10);
      assertEquals("false", record.get("weights.enumerated"));
      assertNull(record.get("minimum_weight"));

      assertTrue(full.weightDistribution(1000).isEnumerated());
      assertEquals("1", full.toRecord(1000).get("minimum_weight"));
   }

   @Test
   void kernelOfTheBinaryAdjacencyMatrixOfW33() {
      FiniteField f3 = FiniteField.of(3);
      IncidenceStructure w3 = GeneralizedQuadrangleBuilder.build(f3,
              AlternatingForm.standard(f3, 4));
      Graph g = Graph.collinearity(w3);
      FieldMatrix a = FieldMatrix.adjacency(g, GF2);
      assertEquals(16, LinearAlgebra.rank(a));
      assertTrue(a.multiply(a).isZero());

      LinearCode code = LinearCode.kernelCode("C", a);
      assertEquals(40, code.length());
      assertEquals(24, code.dimension());
      assertTrue(code.verifyMinimumWeight(6, 240, 1L << 24));

      FieldMatrix words = LinearCode.linePairWords(w3);
      assertEquals(240, words.rows());
      assertTrue(code.isSpannedBy(words));
   }
}
