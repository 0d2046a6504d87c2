package io.quadrangle.search;

import io.quadrangle.field.FiniteField;
import io.quadrangle.geometry.AlternatingForm;
import io.quadrangle.geometry.GeneralizedQuadrangleBuilder;
import io.quadrangle.graph.Graph;
import io.quadrangle.graph.SpectrumCalculator;
import io.quadrangle.rootsystem.RootSystem;
import io.quadrangle.rootsystem.RootSystemGraph;
import io.quadrangle.rootsystem.RootSystems;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CorrespondenceSearchTest {
   private static final SpectrumCalculator CALCULATOR = new SpectrumCalculator(1e-6);

   private static Graph w33() {
      FiniteField f = FiniteField.of(3);
      return Graph.collinearity(GeneralizedQuadrangleBuilder.build(f,
              AlternatingForm.standard(f, 4)));
   }

   @Test
   void edgePairsOfW33FallIntoSixClasses() {
      CorrespondenceSearch search = new CorrespondenceSearch(2, 0, CALCULATOR);
      CorrespondenceReport report = search.run(new EdgeRelationClassifier(w33()),
              Collections.emptyList());
      RelationClassification classes = report.classification();
      assertEquals(240, classes.numObjects());
      assertEquals(Arrays.asList(RelationClass.of(0, 0), RelationClass.of(0, 1),
              RelationClass.of(0, 2), RelationClass.of(0, 4), RelationClass.of(1, 2),
              RelationClass.of(1, 3)), classes.classes());
      int[] sizes = new int[classes.numClasses()];
      for (int i = 0; i < sizes.length; ++i) {
         sizes[i] = classes.classSize(i);
      }
      assertArrayEquals(new int[]{5400, 12960, 7560, 120, 2160, 480}, sizes);
      assertEquals(63, report.totalSubsets());
      assertEquals(0, report.evaluatedSubsets());
      assertEquals(CorrespondenceReport.Status.SEARCH_INCOMPLETE, report.status());
   }

   @Test
   void w33EdgesHaveNoE8Correspondence() {
      RootSystem e8 = RootSystems.e8();
      List<TargetSignature> targets = new ArrayList<>();
      targets.add(TargetSignature.of(RootSystemGraph.build(e8, -1, 1), CALCULATOR));
      targets.add(TargetSignature.of(RootSystemGraph.build(e8, 0), CALCULATOR));
      targets.add(TargetSignature.of(RootSystemGraph.build(e8, 1), CALCULATOR));

      CorrespondenceReport report = new CorrespondenceSearch(4, 4096, CALCULATOR)
              .run(new EdgeRelationClassifier(w33()), targets);
      assertTrue(report.isComplete());
      assertEquals(63, report.evaluatedSubsets());
      assertEquals(63, report.regularCandidates());
      assertEquals(CorrespondenceReport.Status.NO_CORRESPONDENCE, report.status());
      assertTrue(report.matches().isEmpty());

      List<String> near = new ArrayList<>();
      for (CorrespondenceReport.Comparison c : report.nearMatches()) {
         assertEquals(c.target().signature().degree(), c.candidate().signature().degree());
         near.add(c.candidate().describeClasses() + " " + c.target().name());
      }
      assertEquals(Arrays.asList(
              "[(0,1), (1,2)] E8[ip in {0}]",
              "[(0,0), (0,2), (1,2)] E8[ip in {0}]",
              "[(0,1), (1,3)] E8[ip in {-1,1}]",
              "[(0,0), (0,2), (1,3)] E8[ip in {-1,1}]"), near);
   }

   @Test
   void e8InnerProductClassesRecoverTheTarget() {
      RootSystem e8 = RootSystems.e8();
      List<TargetSignature> targets = Collections.singletonList(
              TargetSignature.of(RootSystemGraph.build(e8, -1, 1), CALCULATOR));
      CorrespondenceReport report = new CorrespondenceSearch(3, 4096, CALCULATOR)
              .run(new InnerProductClassifier(e8), targets);
      assertEquals(Arrays.asList(RelationClass.of(-2), RelationClass.of(-1),
              RelationClass.of(0), RelationClass.of(1)), report.classification().classes());
      assertEquals(15, report.totalSubsets());
      assertEquals(CorrespondenceReport.Status.MATCH_FOUND, report.status());
      assertEquals(1, report.matches().size());
      assertEquals("[(-1), (1)]", report.matches().get(0).candidate().describeClasses());
   }

   @Test
   void subsetCapMakesTheSearchIncomplete() {
      RootSystem e8 = RootSystems.e8();
      List<TargetSignature> targets = Collections.singletonList(
              TargetSignature.of(RootSystemGraph.build(e8, -1, 1), CALCULATOR));
      CorrespondenceReport report = new CorrespondenceSearch(2, 2, CALCULATOR)
              .run(new InnerProductClassifier(e8), targets);
      assertEquals(2, report.evaluatedSubsets());
      assertFalse(report.isComplete());
      assertEquals(CorrespondenceReport.Status.SEARCH_INCOMPLETE, report.status());
      assertEquals("SEARCH_INCOMPLETE", report.toRecord().get("status"));
   }

   @Test
   void resultsDoNotDependOnTheNumberOfWorkers() {
      RootSystem d4 = RootSystems.d(4);
      List<TargetSignature> targets = Collections.singletonList(
              TargetSignature.of(RootSystemGraph.build(d4, 1), CALCULATOR));
      String one = new CorrespondenceSearch(1, 100, CALCULATOR)
              .run(new InnerProductClassifier(d4), targets).toRecord().render();
      String many = new CorrespondenceSearch(7, 100, CALCULATOR)
              .run(new InnerProductClassifier(d4), targets).toRecord().render();
      assertEquals(one, many);
   }

   @Test
   void nonIntegralInnerProductsKeepTheirDenominator() {
      RootSystem halves = RootSystem.of("halves", Arrays.asList(
              new int[]{2, 0}, new int[]{1, 1}), 2);
      InnerProductClassifier classifier = new InnerProductClassifier(halves);
      assertEquals(RelationClass.of(2, 4), classifier.classify(0, 1));
   }
}
