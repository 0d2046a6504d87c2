package io.quadrangle.homology;

import io.quadrangle.exceptions.AlgebraicInconsistencyException;
import io.quadrangle.field.FiniteField;
import io.quadrangle.geometry.AlternatingForm;
import io.quadrangle.geometry.GeneralizedQuadrangleBuilder;
import io.quadrangle.graph.Graph;
import io.quadrangle.linalg.FieldMatrix;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HomologyCalculatorTest {
   private static final FiniteField GF2 = FiniteField.of(2);
   private static final FiniteField GF3 = FiniteField.of(3);

   private static SimplicialComplex projectivePlane() {
      String[] facets = {"124", "126", "134", "135", "156", "235", "236", "245",
              "346", "456"};
      List<int[]> list = new ArrayList<>();
      for (String f : facets) {
         int[] facet = new int[f.length()];
         for (int i = 0; i < facet.length; ++i) {
            facet[i] = f.charAt(i) - '1';
         }
         list.add(facet);
      }
      return SimplicialComplex.fromFacets("RP2", list);
   }

   @Test
   void cliqueComplexOfW33() {
      FiniteField f = FiniteField.of(3);
      Graph g = Graph.collinearity(GeneralizedQuadrangleBuilder.build(f,
              AlternatingForm.standard(f, 4)));
      SimplicialComplex complex = SimplicialComplex.cliqueComplex(g, 3);
      assertArrayEquals(new int[]{40, 240, 160, 40}, complex.fVector());
      assertEquals(-80, complex.eulerCharacteristic());

      CohomologyComparison comparison = HomologyCalculator.crossCheck(complex, GF2, GF3);
      assertTrue(comparison.agrees());
      comparison.requireFieldIndependent();
      CohomologyResult result = comparison.first();
      assertArrayEquals(new int[]{1, 81, 0, 0}, result.bettiNumbers());
      assertArrayEquals(new int[]{39, 120, 40}, result.boundaryRanks());
      assertEquals(-80, result.eulerCharacteristic());
      assertArrayEquals(new int[]{1, 81, 0, 0}, comparison.second().bettiNumbers());
   }

   @Test
   void projectivePlaneHasTorsion() {
      SimplicialComplex rp2 = projectivePlane();
      assertArrayEquals(new int[]{6, 15, 10}, rp2.fVector());
      assertEquals(1, rp2.eulerCharacteristic());

      assertArrayEquals(new int[]{1, 1, 1},
              HomologyCalculator.compute(rp2, GF2).bettiNumbers());
      assertArrayEquals(new int[]{1, 0, 0},
              HomologyCalculator.compute(rp2, GF3).bettiNumbers());

      CohomologyComparison comparison = HomologyCalculator.crossCheck(rp2, GF2, GF3);
      assertFalse(comparison.agrees());
      assertEquals(Arrays.asList(1, 2), comparison.differingDimensions());
      assertThrows(AlgebraicInconsistencyException.class,
              comparison::requireFieldIndependent);
      assertEquals("false", comparison.toRecord().get("field_independent"));
   }

   @Test
   void sphereBoundaryOfTetrahedron() {
      List<int[]> facets = Arrays.asList(new int[]{0, 1, 2}, new int[]{0, 1, 3},
              new int[]{0, 2, 3}, new int[]{1, 2, 3});
      SimplicialComplex sphere = SimplicialComplex.fromFacets("S2", facets);
      for (FiniteField f : new FiniteField[]{GF2, GF3, FiniteField.of(5)}) {
         assertArrayEquals(new int[]{1, 0, 1},
                 HomologyCalculator.compute(sphere, f).bettiNumbers());
      }
   }

   @Test
   void boundaryOfBoundaryVanishes() {
      SimplicialComplex rp2 = projectivePlane();
      FieldMatrix d1 = BoundaryOperator.matrix(rp2, 1, GF3);
      FieldMatrix d2 = BoundaryOperator.matrix(rp2, 2, GF3);
      assertEquals(6, d1.rows());
      assertEquals(15, d1.cols());
      assertTrue(d1.multiply(d2).isZero());
   }

   @Test
   void inconsistentChainComplexIsRejected() {
      FieldMatrix d1 = FieldMatrix.of(GF3, new int[][]{{1, 1}});
      FieldMatrix d2 = FieldMatrix.of(GF3, new int[][]{{1}, {0}});
      assertThrows(AlgebraicInconsistencyException.class,
              () -> ChainComplex.of("bad", GF3, new int[]{1, 2, 1}, Arrays.asList(d1, d2)));
      assertThrows(IllegalArgumentException.class,
              () -> ChainComplex.of("short", GF3, new int[]{1, 2, 1},
                      Collections.singletonList(d1)));
   }

   @Test
   void facetsWithRepeatedVerticesAreRejected() {
      assertThrows(IllegalArgumentException.class,
              () -> SimplicialComplex.fromFacets("bad",
                      Collections.singletonList(new int[]{0, 1, 1})));
   }
}
