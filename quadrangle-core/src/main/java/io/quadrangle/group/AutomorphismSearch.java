package io.quadrangle.group;

import io.quadrangle.graph.Graph;
import org.apache.log4j.Logger;
import org.roaringbitmap.RoaringBitmap;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Backtracking automorphism search along a stabilizer chain.
 *
 * <p>Each vertex keeps a bitmap of candidate images, initially the vertices
 * with the same colour and degree. Mapping v to c restricts every unmapped u
 * to N(c) when u ~ v and to the non-neighbours of c otherwise; an empty
 * candidate set prunes the branch. The next vertex to map is always the one
 * with fewest candidates.
 *
 * <p>For every base point b the orbit of b under the pointwise stabilizer of
 * the earlier base points is found by trying each candidate image not yet
 * reached by the generators found at that level. The group order is the
 * product of the orbit lengths.
 */
public class AutomorphismSearch {
   private static final Logger LOG = Logger.getLogger(AutomorphismSearch.class);

   private final Graph graph;
   private final long nodeBudget;
   private final int n;
   private final RoaringBitmap[] neighbourhoods;

   private Reporter reporter;
   private long nodes;
   private boolean exhausted;

   public AutomorphismSearch(Graph graph, long nodeBudget) {
      if (nodeBudget <= 0) {
         throw new IllegalArgumentException("Node budget must be positive: " +
                 nodeBudget);
      }
      this.graph = graph;
      this.nodeBudget = nodeBudget;
      this.n = graph.numVertices();
      this.neighbourhoods = new RoaringBitmap[n];
      for (int v = 0; v < n; ++v) {
         neighbourhoods[v] = graph.neighbourhood(v);
      }
   }

   public AutomorphismSearch withReporter(Reporter reporter) {
      this.reporter = reporter;
      return this;
   }

   public AutomorphismResult run() {
      nodes = 0;
      exhausted = false;
      long start = System.currentTimeMillis();

      RoaringBitmap[] candidates = initialCandidates();
      int[] mapping = new int[n];
      Arrays.fill(mapping, -1);

      List<Permutation> generators = new ArrayList<>();
      List<Integer> base = new ArrayList<>();
      List<Integer> orbitLengths = new ArrayList<>();
      BigInteger order = BigInteger.ONE;

      while (true) {
         int b = nextBasePoint(mapping, candidates);
         if (b < 0) {
            break;
         }

         int level = base.size();
         List<Permutation> levelGenerators = new ArrayList<>();
         boolean[] orbit = new boolean[n];
         orbit[b] = true;
         int orbitSize = 1;

         for (int c : candidates[b]) {
            if (orbit[c]) {
               continue;
            }
            Permutation found = findExtension(mapping, candidates, b, c);
            if (exhausted) {
               return exhaustedResult(start);
            }
            if (found == null) {
               continue;
            }
            levelGenerators.add(found);
            generators.add(found);
            if (reporter != null) {
               reporter.report(found, level);
            }
            orbitSize = closeOrbit(orbit, levelGenerators);
         }

         LOG.debug("Base point " + b + " at level " + level + ": orbit " +
                 orbitSize + ", " + levelGenerators.size() + " generators");
         base.add(b);
         orbitLengths.add(orbitSize);
         order = order.multiply(BigInteger.valueOf(orbitSize));

         candidates = refine(mapping, candidates, b, b);
         mapping[b] = b;
         if (candidates == null) {
            throw new IllegalStateException("Fixing base point " + b +
                    " left a vertex of " + graph.name() + " without candidates");
         }
      }

      LOG.info("Aut(" + graph.name() + ") has order " + order + " (" +
              generators.size() + " strong generators, " + nodes + " nodes, " +
              (System.currentTimeMillis() - start) + " ms)");

      return new AutomorphismResult(graph.name(), n,
              AutomorphismResult.Status.COMPLETE, order, generators,
              toArray(base), toArray(orbitLengths), nodes, nodeBudget);
   }

   private AutomorphismResult exhaustedResult(long start) {
      LOG.warn("Automorphism search on " + graph.name() + " exhausted its " +
              "budget of " + nodeBudget + " nodes after " +
              (System.currentTimeMillis() - start) + " ms");
      return new AutomorphismResult(graph.name(), n,
              AutomorphismResult.Status.EXHAUSTED, null, new ArrayList<>(),
              new int[0], new int[0], nodes, nodeBudget);
   }

   private static int[] toArray(List<Integer> values) {
      int[] result = new int[values.size()];
      for (int i = 0; i < result.length; ++i) {
         result[i] = values.get(i);
      }
      return result;
   }

   private RoaringBitmap[] initialCandidates() {
      RoaringBitmap[] candidates = new RoaringBitmap[n];
      for (int v = 0; v < n; ++v) {
         RoaringBitmap cand = new RoaringBitmap();
         for (int u = 0; u < n; ++u) {
            if (graph.color(u) == graph.color(v) &&
                    graph.degree(u) == graph.degree(v)) {
               cand.add(u);
            }
         }
         candidates[v] = cand;
      }
      return candidates;
   }

   /**
    * Unmapped vertex with the fewest candidates among those with at least
    * two, or -1 when every candidate set is a singleton.
    */
   private int nextBasePoint(int[] mapping, RoaringBitmap[] candidates) {
      int best = -1;
      long bestSize = Long.MAX_VALUE;
      for (int v = 0; v < n; ++v) {
         if (mapping[v] >= 0) {
            continue;
         }
         long size = candidates[v].getLongCardinality();
         if (size > 1 && size < bestSize) {
            best = v;
            bestSize = size;
         }
      }
      return best;
   }

   /**
    * Candidate sets after additionally mapping v to c, or null if some
    * unmapped vertex is left without candidates.
    */
   private RoaringBitmap[] refine(int[] mapping, RoaringBitmap[] candidates,
                                  int v, int c) {
      RoaringBitmap[] next = new RoaringBitmap[n];
      RoaringBitmap image = neighbourhoods[c];
      for (int u = 0; u < n; ++u) {
         if (u == v) {
            next[u] = RoaringBitmap.bitmapOf(c);
         } else if (mapping[u] >= 0) {
            next[u] = candidates[u];
         } else {
            RoaringBitmap cand = graph.isAdjacent(v, u) ?
                    RoaringBitmap.and(candidates[u], image) :
                    RoaringBitmap.andNot(candidates[u], image);
            cand.remove(c);
            if (cand.isEmpty()) {
               return null;
            }
            next[u] = cand;
         }
      }
      return next;
   }

   private Permutation findExtension(int[] mapping, RoaringBitmap[] candidates,
                                     int b, int c) {
      if (++nodes > nodeBudget) {
         exhausted = true;
         return null;
      }
      RoaringBitmap[] refined = refine(mapping, candidates, b, c);
      if (refined == null) {
         return null;
      }
      int[] extended = mapping.clone();
      extended[b] = c;
      return extend(extended, refined);
   }

   private Permutation extend(int[] mapping, RoaringBitmap[] candidates) {
      int v = -1;
      long fewest = Long.MAX_VALUE;
      for (int u = 0; u < n; ++u) {
         if (mapping[u] >= 0) {
            continue;
         }
         long size = candidates[u].getLongCardinality();
         if (size < fewest) {
            v = u;
            fewest = size;
         }
      }

      if (v < 0) {
         return Permutation.trusted(mapping.clone());
      }

      for (int c : candidates[v]) {
         if (++nodes > nodeBudget) {
            exhausted = true;
            return null;
         }
         RoaringBitmap[] refined = refine(mapping, candidates, v, c);
         if (refined == null) {
            continue;
         }
         mapping[v] = c;
         Permutation found = extend(mapping, refined);
         mapping[v] = -1;
         if (found != null || exhausted) {
            return found;
         }
      }
      return null;
   }

   /**
    * Extends {@code orbit} to its closure under the given generators.
    *
    * @return the orbit size
    */
   private int closeOrbit(boolean[] orbit, List<Permutation> generators) {
      int[] queue = new int[n];
      int head = 0;
      int tail = 0;
      for (int v = 0; v < n; ++v) {
         if (orbit[v]) {
            queue[tail++] = v;
         }
      }
      while (head < tail) {
         int x = queue[head++];
         for (Permutation g : generators) {
            int y = g.apply(x);
            if (!orbit[y]) {
               orbit[y] = true;
               queue[tail++] = y;
            }
         }
      }
      return tail;
   }
}
