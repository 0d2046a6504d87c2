package io.quadrangle.geometry;

import io.quadrangle.exceptions.ConstructionException;
import io.quadrangle.exceptions.ConstructionException.Axiom;
import io.quadrangle.exceptions.FieldArithmeticException;
import io.quadrangle.field.FiniteField;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeneralizedQuadrangleBuilderTest {

   @Test
   void symplecticQuadrangleOverGF3() {
      FiniteField f = FiniteField.of(3);
      IncidenceStructure w3 = GeneralizedQuadrangleBuilder.build(f,
              AlternatingForm.standard(f, 4));
      assertEquals("W(3,3)", w3.name());
      assertEquals(40, w3.numPoints());
      assertEquals(40, w3.numLines());
      assertEquals(new QuadrangleParameters(3, 3), w3.parameters());
      for (int p = 0; p < w3.numPoints(); ++p) {
         assertEquals(4, w3.linesThrough(p).length);
      }
      for (int l = 0; l < w3.numLines(); ++l) {
         assertEquals(4, w3.line(l).length);
      }
   }

   @Test
   void pointsAreSingularAndLinesTotallyIsotropic() {
      FiniteField f = FiniteField.of(3);
      AlternatingForm form = AlternatingForm.standard(f, 4);
      IncidenceStructure w3 = GeneralizedQuadrangleBuilder.build(f, form);
      assertTrue(w3.hasCoordinates());
      assertSame(f, w3.field());
      for (int[] line : w3.lines()) {
         for (int a : line) {
            for (int b : line) {
               assertEquals(0, form.polar(w3.coordinates(a), w3.coordinates(b)));
            }
         }
      }
   }

   @Test
   void joiningLinesAreUnique() {
      FiniteField f = FiniteField.of(2);
      IncidenceStructure w2 = GeneralizedQuadrangleBuilder.build(f,
              AlternatingForm.standard(f, 4));
      assertEquals(15, w2.numPoints());
      assertEquals(15, w2.numLines());
      int[] line = w2.line(0);
      assertEquals(0, w2.joiningLine(line[0], line[1]));
      assertTrue(w2.collinear(line[1], line[2]));
      int collinear = 0;
      for (int p = 1; p < w2.numPoints(); ++p) {
         if (w2.collinear(0, p)) {
            collinear++;
         } else {
            assertEquals(-1, w2.joiningLine(0, p));
         }
      }
      assertEquals(6, collinear);
   }

   @Test
   void quadricQuadrangles() {
      FiniteField f3 = FiniteField.of(3);
      IncidenceStructure q43 = GeneralizedQuadrangleBuilder.build(f3,
              QuadraticForm.parabolic(f3));
      assertEquals("Q(4,3)", q43.name());
      assertEquals(40, q43.numPoints());
      assertEquals(40, q43.numLines());

      FiniteField f2 = FiniteField.of(2);
      IncidenceStructure q52 = GeneralizedQuadrangleBuilder.build(f2,
              QuadraticForm.elliptic(f2));
      assertEquals(27, q52.numPoints());
      assertEquals(45, q52.numLines());
      assertEquals("Q-(5,2)", q52.name());
      assertEquals(2, q52.s());
      assertEquals(4, q52.t());
   }

   @Test
   void quadricsFromCoefficientsAreNamedByType() {
      FiniteField f2 = FiniteField.of(2);
      // x0 x1 + x2 x3 + x4^2 + x4 x5 + x5^2
      int[][] elliptic = new int[6][6];
      elliptic[0][1] = 1;
      elliptic[2][3] = 1;
      elliptic[4][4] = 1;
      elliptic[4][5] = 1;
      elliptic[5][5] = 1;
      QuadraticForm form = QuadraticForm.of(f2, elliptic);
      assertEquals("Q-(5,2)", form.name());
      assertEquals(27, GeneralizedQuadrangleBuilder.build(f2, form).numPoints());

      FiniteField f3 = FiniteField.of(3);
      int[][] hyperbolic = new int[4][4];
      hyperbolic[0][1] = 1;
      hyperbolic[2][3] = 1;
      assertEquals("Q+(3,3)", QuadraticForm.of(f3, hyperbolic).name());

      int[][] parabolic = new int[5][5];
      parabolic[0][1] = 1;
      parabolic[2][3] = 1;
      parabolic[4][4] = 1;
      assertEquals("Q(4,3)", QuadraticForm.of(f3, parabolic).name());
   }

   @Test
   void buildForParametersPicksTheClassicalModel() {
      IncidenceStructure gq22 = GeneralizedQuadrangleBuilder.buildForParameters(2, 2);
      assertEquals(15, gq22.numPoints());
      IncidenceStructure gq24 = GeneralizedQuadrangleBuilder.buildForParameters(2, 4);
      assertEquals(27, gq24.numPoints());

      ConstructionException e = assertThrows(ConstructionException.class,
              () -> GeneralizedQuadrangleBuilder.buildForParameters(3, 5));
      assertEquals(Axiom.UNSUPPORTED_PARAMETERS, e.getAxiom());
      e = assertThrows(ConstructionException.class,
              () -> GeneralizedQuadrangleBuilder.buildForParameters(6, 6));
      assertEquals(Axiom.UNSUPPORTED_PARAMETERS, e.getAxiom());
   }

   @Test
   void higherRankSymplecticSpaceIsNotAQuadrangle() {
      FiniteField f = FiniteField.of(2);
      ConstructionException e = assertThrows(ConstructionException.class,
              () -> GeneralizedQuadrangleBuilder.build(f, AlternatingForm.standard(f, 6)));
      assertEquals(Axiom.QUADRANGLE_AXIOM, e.getAxiom());
   }

   @Test
   void degenerateFormsAreRejected() {
      FiniteField f = FiniteField.of(3);
      int[][] gram = {{0, 1, 0, 0}, {2, 0, 0, 0}, {0, 0, 0, 0}, {0, 0, 0, 0}};
      AlternatingForm form = AlternatingForm.of(f, gram);
      assertFalse(form.isStandard());
      ConstructionException e = assertThrows(ConstructionException.class,
              () -> GeneralizedQuadrangleBuilder.build(f, form));
      assertEquals(Axiom.NON_DEGENERATE_FORM, e.getAxiom());

      int[][] coefficients = new int[4][4];
      coefficients[0][1] = 1;
      coefficients[2][2] = 1;
      e = assertThrows(ConstructionException.class,
              () -> GeneralizedQuadrangleBuilder.build(f, QuadraticForm.of(f, coefficients)));
      assertEquals(Axiom.NON_DEGENERATE_FORM, e.getAxiom());
   }

   @Test
   void malformedGramMatricesAreRejected() {
      FiniteField f = FiniteField.of(3);
      ConstructionException e = assertThrows(ConstructionException.class,
              () -> AlternatingForm.of(f, new int[][]{{0, 1}, {1, 0}}));
      assertEquals(Axiom.FORM_SHAPE, e.getAxiom());
      e = assertThrows(ConstructionException.class,
              () -> AlternatingForm.standard(f, 3));
      assertEquals(Axiom.FORM_SHAPE, e.getAxiom());
      assertTrue(AlternatingForm.of(f,
              new int[][]{{0, 0, 1, 0}, {0, 0, 0, 1}, {2, 0, 0, 0}, {0, 2, 0, 0}})
              .isStandard());
   }

   @Test
   void formFromAnotherFieldIsRejected() {
      AlternatingForm form = AlternatingForm.standard(FiniteField.of(3), 4);
      assertThrows(FieldArithmeticException.class,
              () -> GeneralizedQuadrangleBuilder.build(FiniteField.of(5), form));
   }
}
