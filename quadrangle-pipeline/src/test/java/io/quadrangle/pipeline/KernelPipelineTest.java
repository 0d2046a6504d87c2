package io.quadrangle.pipeline;

import io.quadrangle.conf.Configuration;
import io.quadrangle.graph.GraphInvariants;
import io.quadrangle.search.TargetSignature;
import io.quadrangle.util.InvariantCache;
import io.quadrangle.util.InvariantRecord;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KernelPipelineTest {

   private static InvariantRecord only(PipelineResult result, String stage) {
      List<InvariantRecord> records = result.stage(stage);
      assertEquals(1, records.size());
      return records.get(0);
   }

   @Test
   void symplecticQuadrangleOverGF3() {
      Session session = Session.open(Configuration.defaults());
      PipelineResult result = new KernelPipeline(session).run();

      assertEquals(Arrays.asList("geometry", "graph", "code", "cohomology",
              "automorphisms", "correspondence"), List.copyOf(result.stageNames()));

      InvariantRecord geometry = only(result, KernelPipeline.STAGE_GEOMETRY);
      assertEquals("geometry W(3,3)", geometry.name());
      assertEquals("GQ(3,3)", geometry.get("parameters"));
      assertEquals("40", geometry.get("points"));
      assertEquals("40", geometry.get("lines"));
      assertEquals("4", geometry.get("points_per_line"));

      InvariantRecord graph = only(result, KernelPipeline.STAGE_GRAPH);
      assertEquals("SRG(40,12,2,4)", graph.get("strongly_regular"));
      assertEquals("{12:1, 2:24, -4:15}", graph.get("spectrum"));
      assertEquals("160", graph.get("triangles"));
      assertEquals("4", graph.get("clique_number"));

      InvariantRecord code = only(result, KernelPipeline.STAGE_CODE);
      assertEquals("16", code.get("adjacency.rank"));
      assertEquals("true", code.get("adjacency.square_is_zero"));
      assertEquals("24", code.get("dimension"));
      assertEquals("6", code.get("minimum_weight"));
      assertEquals("240", code.get("minimum_weight.count"));
      assertEquals("240", code.get("line_pairs"));
      assertEquals("true", code.get("line_pairs.span_code"));

      List<InvariantRecord> cohomology = result.stage(KernelPipeline.STAGE_COHOMOLOGY);
      assertEquals(3, cohomology.size());
      assertEquals("[40, 240, 160, 40]", cohomology.get(0).get("chain_dimensions"));
      assertEquals("-80", cohomology.get(0).get("euler_characteristic"));
      InvariantRecord comparison = cohomology.get(2);
      assertEquals("[1, 81, 0, 0]", comparison.get("betti.GF(3)"));
      assertEquals("[1, 81, 0, 0]", comparison.get("betti.GF(2)"));
      assertEquals("true", comparison.get("field_independent"));

      InvariantRecord automorphisms = only(result, KernelPipeline.STAGE_AUTOMORPHISMS);
      assertEquals("COMPLETE", automorphisms.get("status"));
      assertEquals("51840", automorphisms.get("order"));
      assertEquals("51840", automorphisms.get("closure.order"));
      assertEquals("[40]", automorphisms.get("closure.orbits"));
      assertEquals("1296", automorphisms.get("closure.stabilizer"));

      InvariantRecord correspondence = only(result, KernelPipeline.STAGE_CORRESPONDENCE);
      assertEquals("NO_CORRESPONDENCE", correspondence.get("status"));
      assertEquals("63", correspondence.get("subsets.evaluated"));
      assertEquals("[]", correspondence.get("matches"));
   }

   @Test
   void rerunsRenderIdentically() {
      Configuration conf = Configuration.defaults();
      Session session = Session.open(conf);
      String first = new KernelPipeline(session).run().render();

      long misses = session.cache().misses();
      String cached = new KernelPipeline(session).run().render();
      assertEquals(first, cached);
      assertEquals(misses, session.cache().misses());
      assertTrue(session.cache().hits() > 0);

      String fresh = new KernelPipeline(Session.open(conf)).run().render();
      assertEquals(first, fresh);
      assertTrue(first.startsWith("[geometry W(3,3)]\n"));
      assertFalse(first.contains(" ms"));
   }

   @Test
   void sharedCacheKeepsSpectraOfDifferentTolerancesApart() {
      InvariantCache cache = new InvariantCache();
      Configuration coarse = Configuration.defaults()
              .with(Configuration.CONF_SPECTRUM_TOLERANCE, 0.25);
      KernelPipeline fine = new KernelPipeline(Session.open(Configuration.defaults(), cache));
      KernelPipeline rough = new KernelPipeline(Session.open(coarse, cache));

      GraphInvariants fineInvariants = fine.graphInvariants();
      GraphInvariants roughInvariants = rough.graphInvariants();
      assertNotSame(fineInvariants, roughInvariants);
      assertEquals("0.000001", fineInvariants.toRecord().get("spectrum.tolerance"));
      assertEquals("0.250000", roughInvariants.toRecord().get("spectrum.tolerance"));
      assertEquals("{12:1, 2:24, -4:15}", roughInvariants.toRecord().get("spectrum"));

      List<TargetSignature> fineTargets = fine.e8Targets();
      List<TargetSignature> roughTargets = rough.e8Targets();
      for (int i = 0; i < fineTargets.size(); ++i) {
         assertEquals(1e-6, fineTargets.get(i).signature().spectrum().tolerance());
         assertEquals(0.25, roughTargets.get(i).signature().spectrum().tolerance());
      }

      long misses = cache.misses();
      assertSame(roughInvariants, rough.graphInvariants());
      assertSame(fineInvariants, new KernelPipeline(
              Session.open(Configuration.defaults(), cache)).graphInvariants());
      assertEquals(misses, cache.misses());
   }

   @Test
   void smallerQuadrangle() {
      Configuration conf = Configuration.defaults()
              .with(Configuration.CONF_FIELD_ORDER, 2)
              .with(Configuration.CONF_SEARCH_WORKERS, 2);
      PipelineResult result = new KernelPipeline(Session.open(conf)).run();

      assertEquals("15", only(result, KernelPipeline.STAGE_GEOMETRY).get("points"));
      assertEquals("SRG(15,6,1,3)",
              only(result, KernelPipeline.STAGE_GRAPH).get("strongly_regular"));
      InvariantRecord automorphisms = only(result, KernelPipeline.STAGE_AUTOMORPHISMS);
      assertEquals("720", automorphisms.get("order"));
      assertEquals("720", automorphisms.get("closure.order"));
      assertFalse(result.timer().isInconsistent());
   }

   @Test
   void budgetExhaustionIsReportedNotThrown() {
      Configuration conf = Configuration.defaults()
              .with(Configuration.CONF_FIELD_ORDER, 2)
              .with(Configuration.CONF_AUTOMORPHISM_NODE_BUDGET, 1);
      InvariantRecord automorphisms = only(new KernelPipeline(Session.open(conf))
              .run(), KernelPipeline.STAGE_AUTOMORPHISMS);
      assertEquals("EXHAUSTED", automorphisms.get("status"));
      assertNull(automorphisms.get("order"));
      assertEquals("720", automorphisms.get("closure.order"));
   }

   @Test
   void otherQuadricsAndInvalidForms() {
      Configuration parabolic = Configuration.defaults()
              .with(Configuration.CONF_GEOMETRY_FORM, Session.FORM_PARABOLIC)
              .with(Configuration.CONF_GEOMETRY_DIMENSION, 5);
      Session q43 = Session.open(parabolic);
      assertEquals(40, q43.geometry().numPoints());
      assertEquals("Q(4,3)", q43.form().name());

      Configuration elliptic = Configuration.defaults()
              .with(Configuration.CONF_FIELD_ORDER, 2)
              .with(Configuration.CONF_GEOMETRY_FORM, Session.FORM_ELLIPTIC)
              .with(Configuration.CONF_GEOMETRY_DIMENSION, 6);
      assertEquals(45, Session.open(elliptic).geometry().numLines());

      IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
              () -> Session.open(Configuration.defaults()
                      .with(Configuration.CONF_GEOMETRY_FORM, Session.FORM_PARABOLIC)));
      assertTrue(e.getMessage().contains(Configuration.CONF_GEOMETRY_DIMENSION));

      assertThrows(IllegalArgumentException.class,
              () -> Session.open(Configuration.defaults()
                      .with(Configuration.CONF_GEOMETRY_FORM, "hermitian")));
   }
}
