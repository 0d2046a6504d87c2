package io.quadrangle.pipeline;

import io.quadrangle.code.LinearCode;
import io.quadrangle.conf.Configuration;
import io.quadrangle.field.FiniteField;
import io.quadrangle.geometry.AlternatingForm;
import io.quadrangle.geometry.IncidenceStructure;
import io.quadrangle.graph.Graph;
import io.quadrangle.graph.GraphInvariants;
import io.quadrangle.group.AutomorphismResult;
import io.quadrangle.group.AutomorphismSearch;
import io.quadrangle.group.GroupOrderCheck;
import io.quadrangle.group.Permutation;
import io.quadrangle.group.PermutationGroup;
import io.quadrangle.group.SymplecticGenerators;
import io.quadrangle.homology.CohomologyComparison;
import io.quadrangle.homology.HomologyCalculator;
import io.quadrangle.homology.SimplicialComplex;
import io.quadrangle.linalg.FieldMatrix;
import io.quadrangle.linalg.LinearAlgebra;
import io.quadrangle.rootsystem.RootSystem;
import io.quadrangle.rootsystem.RootSystemGraph;
import io.quadrangle.rootsystem.RootSystems;
import io.quadrangle.search.CorrespondenceReport;
import io.quadrangle.search.CorrespondenceSearch;
import io.quadrangle.search.EdgeRelationClassifier;
import io.quadrangle.search.TargetSignature;
import io.quadrangle.util.CacheKey;
import io.quadrangle.util.InvariantCache;
import io.quadrangle.util.InvariantRecord;
import io.quadrangle.util.StageTimer;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * End-to-end run over a {@link Session}: geometry, graph invariants, the
 * binary kernel code of the adjacency matrix, clique complex cohomology,
 * automorphisms and the edge-pair correspondence search against E8. Each
 * stage only reads the session and the results of earlier stages; every
 * expensive result goes through the session cache.
 */
public class KernelPipeline {
   private static final Logger LOG = Logger.getLogger(KernelPipeline.class);

   public static final String STAGE_GEOMETRY = "geometry";
   public static final String STAGE_GRAPH = "graph";
   public static final String STAGE_CODE = "code";
   public static final String STAGE_COHOMOLOGY = "cohomology";
   public static final String STAGE_AUTOMORPHISMS = "automorphisms";
   public static final String STAGE_CORRESPONDENCE = "correspondence";

   private static final FiniteField GF2 = FiniteField.of(2);

   /**
    * Inner product sets of the E8 root graphs the edge classes are compared to.
    */
   static final int[][] E8_TARGETS = {{-1, 1}, {0}, {1}};

   private final Session session;

   public KernelPipeline(Session session) {
      this.session = session;
   }

   public PipelineResult run() {
      StageTimer timer = new StageTimer("pipeline " + session.geometry().name());
      PipelineResult result = new PipelineResult(timer);

      timer.start(STAGE_GEOMETRY);
      result.add(STAGE_GEOMETRY, geometry());
      timer.stop(STAGE_GEOMETRY);

      timer.start(STAGE_GRAPH);
      result.add(STAGE_GRAPH, graphInvariants().toRecord());
      timer.stop(STAGE_GRAPH);

      timer.start(STAGE_CODE);
      result.add(STAGE_CODE, code());
      timer.stop(STAGE_CODE);

      timer.start(STAGE_COHOMOLOGY);
      CohomologyComparison comparison = cohomology();
      result.add(STAGE_COHOMOLOGY, comparison.first().toRecord());
      result.add(STAGE_COHOMOLOGY, comparison.second().toRecord());
      result.add(STAGE_COHOMOLOGY, comparison.toRecord());
      timer.stop(STAGE_COHOMOLOGY);

      timer.start(STAGE_AUTOMORPHISMS);
      result.add(STAGE_AUTOMORPHISMS, automorphisms());
      timer.stop(STAGE_AUTOMORPHISMS);

      timer.start(STAGE_CORRESPONDENCE);
      result.add(STAGE_CORRESPONDENCE, correspondence().toRecord());
      timer.stop(STAGE_CORRESPONDENCE);

      LOG.info("Finished " + timer);
      return result;
   }

   InvariantRecord geometry() {
      IncidenceStructure geometry = session.geometry();
      return new InvariantRecord("geometry " + geometry.name())
              .put("form", session.form())
              .put("field", session.field())
              .put("parameters", geometry.parameters())
              .put("points", geometry.numPoints())
              .put("lines", geometry.numLines())
              .put("points_per_line", geometry.s() + 1)
              .put("lines_per_point", geometry.t() + 1)
              .put("content_hash", geometry.contentHash());
   }

   /**
    * Operation name for a cached result computed through the session's
    * spectrum calculator.
    */
   private String spectral(String operation) {
      return operation + ".tol." + session.spectrumCalculator().tolerance();
   }

   GraphInvariants graphInvariants() {
      Graph graph = session.collinearity();
      return session.cache().getOrCompute(
              CacheKey.of(spectral("graph.invariants"), graph.contentHash()),
              () -> GraphInvariants.of(graph, session.spectrumCalculator()));
   }

   /**
    * Kernel of the adjacency matrix over GF(2), checked against the span of
    * the sums of two concurrent lines.
    */
   InvariantRecord code() {
      Graph graph = session.collinearity();
      FieldMatrix adjacency = FieldMatrix.adjacency(graph, GF2);
      LinearCode code = session.cache().getOrCompute(
              CacheKey.of("code.kernel", GF2.order(), graph.contentHash()),
              () -> LinearCode.kernelCode("ker A(" + graph.name() + ")", adjacency));
      FieldMatrix words = LinearCode.linePairWords(session.geometry());
      long limit = session.configuration().getCodeEnumerationLimit();
      return code.toRecord(limit)
              .put("adjacency.rank", LinearAlgebra.rank(adjacency))
              .put("adjacency.square_is_zero", adjacency.multiply(adjacency).isZero())
              .put("line_pairs", words.rows())
              .put("line_pairs.span_code", code.isSpannedBy(words));
   }

   /**
    * Clique complex cohomology over the session field and the configured
    * cross-check field.
    */
   CohomologyComparison cohomology() {
      Configuration conf = session.configuration();
      Graph graph = session.collinearity();
      int maxDimension = conf.getHomologyMaxDimension();
      FiniteField primary = session.field();
      FiniteField crossCheck = FiniteField.of(conf.getHomologyCrossCheckField());
      String operation = "cohomology.cliques." + maxDimension + ".vs." +
              crossCheck.order();
      return session.cache().getOrCompute(
              CacheKey.of(operation, primary.order(), graph.contentHash()),
              () -> HomologyCalculator.crossCheck(
                      SimplicialComplex.cliqueComplex(graph, maxDimension),
                      primary, crossCheck));
   }

   /**
    * Backtracking search on the collinearity graph. For the standard
    * symplectic form the result must agree with the closure of the known
    * similitude generators.
    */
   InvariantRecord automorphisms() {
      Graph graph = session.collinearity();
      long budget = session.configuration().getAutomorphismNodeBudget();
      AutomorphismResult result = session.cache().getOrCompute(
              CacheKey.of("automorphisms.budget." + budget, graph.contentHash()),
              () -> new AutomorphismSearch(graph, budget).run());
      InvariantRecord record = result.toRecord();

      if (session.form() instanceof AlternatingForm &&
              ((AlternatingForm) session.form()).isStandard()) {
         List<Permutation> generators = SymplecticGenerators.of(session.geometry(),
                 (AlternatingForm) session.form());
         GroupOrderCheck.requireAutomorphisms(graph, generators);
         PermutationGroup closure = session.cache().getOrCompute(
                 CacheKey.of("automorphisms.symplectic", session.field().order(),
                         graph.contentHash()),
                 () -> PermutationGroup.generatedBy(graph.numVertices(), generators));
         if (result.isComplete()) {
            GroupOrderCheck.requireAgreement("Aut(" + graph.name() + ")",
                    result.order(), closure.order());
         } else {
            LOG.warn("Search on " + graph.name() + " exhausted, closure order " +
                    closure.order() + " not cross-checked");
         }
         record.put("closure.generators", generators.size())
                 .put("closure.order", closure.order())
                 .put("closure.orbits", closure.orbits().orbitSizes())
                 .put("closure.stabilizer", closure.stabilizerOrder(0));
      }
      return record;
   }

   /**
    * Edge pairs of the collinearity graph against the E8 root graphs.
    */
   CorrespondenceReport correspondence() {
      Graph graph = session.collinearity();
      List<TargetSignature> targets = e8Targets();
      long maxSubsets = session.configuration().getSearchMaxSubsets();
      return session.cache().getOrCompute(
              CacheKey.of(spectral("correspondence.e8.max." + maxSubsets),
                      graph.contentHash()),
              () -> new CorrespondenceSearch(session.configuration())
                      .run(new EdgeRelationClassifier(graph), targets));
   }

   List<TargetSignature> e8Targets() {
      RootSystem e8 = RootSystems.e8();
      List<TargetSignature> targets = new ArrayList<>();
      for (int[] innerProducts : E8_TARGETS) {
         Graph target = RootSystemGraph.build(e8, innerProducts);
         targets.add(session.cache().getOrCompute(
                 CacheKey.of(spectral("target.signature." + target.name()),
                         target.contentHash()),
                 () -> TargetSignature.of(target, session.spectrumCalculator())));
      }
      return targets;
   }

   public Session session() {
      return session;
   }
}
