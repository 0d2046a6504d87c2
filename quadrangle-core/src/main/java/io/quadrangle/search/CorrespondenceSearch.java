package io.quadrangle.search;

import io.quadrangle.conf.Configuration;
import io.quadrangle.graph.Graph;
import io.quadrangle.graph.GraphInvariants;
import io.quadrangle.graph.SpectrumCalculator;
import org.apache.log4j.Logger;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Classify, combine, compare: pairs of objects are split into relation
 * classes, every non-empty subset of classes (in bitmask order, up to a cap)
 * becomes a union graph, and each regular union is compared with every
 * target signature.
 *
 * <p>Both the classification and the subset evaluation run on a fixed pool.
 * Tasks only read shared inputs and return their own outputs, which are
 * merged in task order, so results do not depend on scheduling.
 */
public class CorrespondenceSearch {
   private static final Logger LOG = Logger.getLogger(CorrespondenceSearch.class);

   private static final int MASKS_PER_TASK = 8;

   private final int workers;
   private final long maxSubsets;
   private final SpectrumCalculator calculator;

   public CorrespondenceSearch(int workers, long maxSubsets,
                               SpectrumCalculator calculator) {
      if (workers < 1) {
         throw new IllegalArgumentException("Need at least one worker: " + workers);
      }
      if (maxSubsets < 0) {
         throw new IllegalArgumentException("Negative subset cap: " + maxSubsets);
      }
      this.workers = workers;
      this.maxSubsets = maxSubsets;
      this.calculator = calculator;
   }

   public CorrespondenceSearch(Configuration configuration) {
      this(configuration.getSearchWorkers(), configuration.getSearchMaxSubsets(),
              new SpectrumCalculator(configuration));
   }

   public CorrespondenceReport run(PairClassifier classifier,
                                   List<TargetSignature> targets) {
      long start = System.currentTimeMillis();
      ExecutorService pool = newPool();
      try {
         RelationClassification classification = classify(classifier, pool);
         int numClasses = classification.numClasses();
         if (numClasses > 63) {
            throw new IllegalArgumentException(numClasses + " relation classes " +
                    "do not fit a subset bitmask");
         }
         long total = numClasses == 63 ? Long.MAX_VALUE : (1L << numClasses) - 1;
         long limit = Math.min(total, maxSubsets);
         LOG.info(classifier.describe() + ": " + numClasses + " classes, " + total +
                 " subsets, evaluating " + limit);

         List<CandidateEvaluation> evaluations = evaluate(classification, targets,
                 limit, pool);
         CorrespondenceReport report = new CorrespondenceReport(
                 classifier.describe(), classification, targets, total, evaluations);
         LOG.info(report + " in " + (System.currentTimeMillis() - start) + " ms");
         return report;
      } finally {
         pool.shutdownNow();
      }
   }

   private ExecutorService newPool() {
      AtomicInteger threads = new AtomicInteger();
      return Executors.newFixedThreadPool(workers, r -> {
         Thread t = new Thread(r, "correspondence-" + threads.incrementAndGet());
         t.setDaemon(true);
         return t;
      });
   }

   /**
    * Row a of the pair triangle goes to task a % tasks.
    */
   RelationClassification classify(PairClassifier classifier, ExecutorService pool) {
      int n = classifier.size();
      int tasks = Math.max(1, Math.min(n, workers * 4));
      List<Callable<Map<RelationClass, PairList>>> jobs = new ArrayList<>();
      for (int t = 0; t < tasks; ++t) {
         int offset = t;
         jobs.add(() -> {
            Map<RelationClass, PairList> local = new TreeMap<>();
            for (int a = offset; a < n; a += tasks) {
               for (int b = a + 1; b < n; ++b) {
                  local.computeIfAbsent(classifier.classify(a, b),
                          k -> new PairList()).add(((long) a << 32) | b);
               }
            }
            return local;
         });
      }

      TreeMap<RelationClass, PairList> merged = new TreeMap<>();
      for (Map<RelationClass, PairList> local : invokeAll(pool, jobs)) {
         for (Map.Entry<RelationClass, PairList> e : local.entrySet()) {
            merged.computeIfAbsent(e.getKey(), k -> new PairList()).addAll(e.getValue());
         }
      }

      List<RelationClass> classes = new ArrayList<>(merged.keySet());
      List<long[]> pairs = new ArrayList<>();
      for (PairList list : merged.values()) {
         pairs.add(list.toArray());
      }
      return new RelationClassification(n, classes, pairs);
   }

   private List<CandidateEvaluation> evaluate(RelationClassification classification,
                                              List<TargetSignature> targets,
                                              long limit, ExecutorService pool) {
      List<Callable<List<CandidateEvaluation>>> jobs = new ArrayList<>();
      for (long from = 1; from <= limit; from += MASKS_PER_TASK) {
         long first = from;
         long last = Math.min(limit, from + MASKS_PER_TASK - 1);
         jobs.add(() -> {
            List<CandidateEvaluation> local = new ArrayList<>();
            for (long mask = first; mask <= last; ++mask) {
               local.add(evaluate(classification, targets, mask));
            }
            return local;
         });
      }

      List<CandidateEvaluation> evaluations = new ArrayList<>();
      for (List<CandidateEvaluation> local : invokeAll(pool, jobs)) {
         evaluations.addAll(local);
      }
      return evaluations;
   }

   CandidateEvaluation evaluate(RelationClassification classification,
                                List<TargetSignature> targets, long mask) {
      int n = classification.numObjects();
      RoaringBitmap[] nb = new RoaringBitmap[n];
      for (int i = 0; i < n; ++i) {
         nb[i] = new RoaringBitmap();
      }
      List<RelationClass> included = new ArrayList<>();
      int edges = 0;
      for (int c = 0; c < classification.numClasses(); ++c) {
         if ((mask & (1L << c)) == 0) {
            continue;
         }
         included.add(classification.relationClass(c));
         for (long pair : classification.pairs(c)) {
            int a = RelationClassification.first(pair);
            int b = RelationClassification.second(pair);
            nb[a].add(b);
            nb[b].add(a);
         }
         edges += classification.classSize(c);
      }

      Graph union = Graph.fromNeighbourhoods("union" + included, nb);
      LinkedHashMap<String, Verdict> verdicts = new LinkedHashMap<>();
      if (GraphInvariants.regularDegree(union) < 0) {
         return new CandidateEvaluation(mask, included, edges, null, verdicts);
      }

      GraphSignature signature = GraphSignature.of(union, calculator);
      for (TargetSignature target : targets) {
         verdicts.put(target.name(), signature.compare(target.signature()));
      }
      if (LOG.isDebugEnabled()) {
         LOG.debug("Candidate " + included + ": " + signature + " " + verdicts);
      }
      return new CandidateEvaluation(mask, included, edges, signature, verdicts);
   }

   private static <T> List<T> invokeAll(ExecutorService pool,
                                        List<Callable<T>> jobs) {
      List<T> results = new ArrayList<>(jobs.size());
      try {
         for (Future<T> future : pool.invokeAll(jobs)) {
            results.add(future.get());
         }
      } catch (InterruptedException e) {
         Thread.currentThread().interrupt();
         throw new IllegalStateException("Correspondence search interrupted", e);
      } catch (ExecutionException e) {
         Throwable cause = e.getCause();
         if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
         }
         throw new IllegalStateException("Correspondence task failed", cause);
      }
      return results;
   }

   /**
    * Growable array of packed pairs.
    */
   private static final class PairList {
      private long[] data = new long[16];
      private int size;

      void add(long pair) {
         if (size == data.length) {
            data = Arrays.copyOf(data, size * 2);
         }
         data[size++] = pair;
      }

      void addAll(PairList other) {
         for (int i = 0; i < other.size; ++i) {
            add(other.data[i]);
         }
      }

      long[] toArray() {
         long[] result = Arrays.copyOf(data, size);
         Arrays.sort(result);
         return result;
      }
   }
}
