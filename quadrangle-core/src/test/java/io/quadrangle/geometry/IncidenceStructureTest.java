package io.quadrangle.geometry;

import io.quadrangle.exceptions.ConstructionException;
import io.quadrangle.exceptions.ConstructionException.Axiom;
import io.quadrangle.field.FiniteField;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IncidenceStructureTest {

   private static IncidenceStructure w2() {
      FiniteField f = FiniteField.of(2);
      return GeneralizedQuadrangleBuilder.build(f, AlternatingForm.standard(f, 4));
   }

   @Test
   void incidenceMatrixRoundTripKeepsTheStructure() {
      IncidenceStructure w2 = w2();
      int[][] incidence = new int[w2.numPoints()][w2.numLines()];
      for (int l = 0; l < w2.numLines(); ++l) {
         for (int p : w2.line(l)) {
            incidence[p][l] = 1;
         }
      }
      IncidenceStructure read = IncidenceStructure.fromIncidenceMatrix("read", incidence);
      assertFalse(read.hasCoordinates());
      assertNull(read.field());
      assertEquals(w2.parameters(), read.parameters());
      assertEquals(w2.contentHash(), read.contentHash());
      assertThrows(IllegalStateException.class, () -> read.coordinates(0));
   }

   @Test
   void gridIsAQuadrangleWithThinPencils() {
      // 3x3 grid: rows and columns as lines, GQ(2,1)
      int[][] lines = {{0, 1, 2}, {3, 4, 5}, {6, 7, 8}, {0, 3, 6}, {1, 4, 7}, {2, 5, 8}};
      IncidenceStructure grid = IncidenceStructure.fromLines("grid", 9, lines);
      assertEquals(2, grid.s());
      assertEquals(1, grid.t());
   }

   @Test
   void linesOfUnequalSizeFail() {
      int[][] lines = {{0, 1, 2}, {3, 4}};
      ConstructionException e = assertThrows(ConstructionException.class,
              () -> IncidenceStructure.fromLines("bad", 5, lines));
      assertEquals(Axiom.LINE_REGULARITY, e.getAxiom());
   }

   @Test
   void pointsOnUnequalNumbersOfLinesFail() {
      int[][] lines = {{0, 1}, {0, 2}, {1, 2}, {2, 3}};
      ConstructionException e = assertThrows(ConstructionException.class,
              () -> IncidenceStructure.fromLines("bad", 4, lines));
      assertEquals(Axiom.POINT_REGULARITY, e.getAxiom());
   }

   @Test
   void repeatedLineFailsUniqueness() {
      int[][] lines = {{0, 1}, {0, 1}, {2, 3}, {2, 3}};
      ConstructionException e = assertThrows(ConstructionException.class,
              () -> IncidenceStructure.fromLines("bad", 4, lines));
      assertEquals(Axiom.UNIQUE_JOINING_LINE, e.getAxiom());
   }

   @Test
   void triangleFailsTheQuadrangleAxiom() {
      // projective plane of order 2: every point meets every line
      int[][] fano = {{0, 1, 2}, {0, 3, 4}, {0, 5, 6}, {1, 3, 5}, {1, 4, 6},
              {2, 3, 6}, {2, 4, 5}};
      ConstructionException e = assertThrows(ConstructionException.class,
              () -> IncidenceStructure.fromLines("fano", 7, fano));
      assertEquals(Axiom.QUADRANGLE_AXIOM, e.getAxiom());
   }

   @Test
   void projectivePointsAreNormalized() {
      FiniteField f = FiniteField.of(3);
      assertEquals(40, ProjectiveSpace.points(f, 4).size());
      assertArrayEquals(new int[]{0, 1, 2, 0},
              ProjectiveSpace.normalize(f, new int[]{0, 2, 1, 0}));
      assertThrows(IllegalArgumentException.class,
              () -> ProjectiveSpace.normalize(f, new int[4]));
      assertEquals(112, new QuadrangleParameters(3, 9).expectedPoints());
   }
}
