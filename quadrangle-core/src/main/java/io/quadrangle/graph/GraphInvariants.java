package io.quadrangle.graph;

import com.koloboke.collect.map.IntIntCursor;
import com.koloboke.collect.map.hash.HashIntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;
import io.quadrangle.util.InvariantRecord;
import org.apache.log4j.Logger;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.SimpleGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Structural invariants of a graph, computed exactly (except the spectrum,
 * which carries its tolerance).
 */
public final class GraphInvariants {
   private static final Logger LOG = Logger.getLogger(GraphInvariants.class);

   private final String graphName;
   private final int numVertices;
   private final int numEdges;
   private final SortedMap<Integer, Integer> degreeHistogram;
   private final long triangles;
   private final SortedMap<Integer, Long> cliqueCounts;
   private final int cliqueNumber;
   private final List<Integer> componentSizes;
   private final SortedMap<Integer, Integer> adjacentCommonNeighbours;
   private final SortedMap<Integer, Integer> nonAdjacentCommonNeighbours;
   private final Spectrum spectrum;
   private final StronglyRegularParameters srg;

   private GraphInvariants(Graph graph, Spectrum spectrum) {
      this.graphName = graph.name();
      this.numVertices = graph.numVertices();
      this.numEdges = graph.numEdges();
      this.degreeHistogram = degreeHistogram(graph);

      CliqueEnumerator cliques = new CliqueEnumerator(graph);
      this.cliqueNumber = cliques.cliqueNumber();
      this.cliqueCounts = new TreeMap<>();
      for (int k = 1; k <= cliqueNumber; ++k) {
         cliqueCounts.put(k, cliques.count(k));
      }
      this.triangles = cliqueNumber >= 3 ? cliqueCounts.get(3) : 0;
      this.componentSizes = componentSizes(graph);

      this.adjacentCommonNeighbours = new TreeMap<>();
      this.nonAdjacentCommonNeighbours = new TreeMap<>();
      for (int u = 0; u < numVertices; ++u) {
         for (int v = u + 1; v < numVertices; ++v) {
            SortedMap<Integer, Integer> target = graph.isAdjacent(u, v) ?
                    adjacentCommonNeighbours : nonAdjacentCommonNeighbours;
            target.merge(graph.commonNeighbours(u, v), 1, Integer::sum);
         }
      }

      this.spectrum = spectrum;
      this.srg = StronglyRegularParameters.of(graph, spectrum);
   }

   public static GraphInvariants of(Graph graph, SpectrumCalculator calculator) {
      return of(graph, calculator.compute(graph));
   }

   public static GraphInvariants of(Graph graph, Spectrum spectrum) {
      GraphInvariants invariants = new GraphInvariants(graph, spectrum);
      LOG.info("Invariants of " + graph.name() + ": " + invariants.srg +
              ", spectrum " + spectrum);
      return invariants;
   }

   public static SortedMap<Integer, Integer> degreeHistogram(Graph graph) {
      HashIntIntMap counts = HashIntIntMaps.newMutableMap();
      for (int v = 0; v < graph.numVertices(); ++v) {
         counts.addValue(graph.degree(v), 1);
      }
      SortedMap<Integer, Integer> histogram = new TreeMap<>();
      IntIntCursor cur = counts.cursor();
      while (cur.moveNext()) {
         histogram.put(cur.key(), cur.value());
      }
      return histogram;
   }

   /**
    * @return the common degree, or -1 if the graph is not regular
    */
   public static int regularDegree(Graph graph) {
      if (graph.numVertices() == 0) {
         return 0;
      }
      int k = graph.degree(0);
      for (int v = 1; v < graph.numVertices(); ++v) {
         if (graph.degree(v) != k) {
            return -1;
         }
      }
      return k;
   }

   public static int[] degreeSequence(Graph graph) {
      int[] degrees = new int[graph.numVertices()];
      for (int v = 0; v < degrees.length; ++v) {
         degrees[v] = graph.degree(v);
      }
      return degrees;
   }

   /**
    * Connected component sizes, largest first.
    */
   public static List<Integer> componentSizes(Graph graph) {
      SimpleGraph<Integer, DefaultEdge> g = new SimpleGraph<>(DefaultEdge.class);
      for (int v = 0; v < graph.numVertices(); ++v) {
         g.addVertex(v);
      }
      for (int[] e : graph.edges()) {
         g.addEdge(e[0], e[1]);
      }
      List<Integer> sizes = new ArrayList<>();
      for (Set<Integer> component : new ConnectivityInspector<>(g).connectedSets()) {
         sizes.add(component.size());
      }
      sizes.sort(Collections.reverseOrder());
      return sizes;
   }

   public String graphName() {
      return graphName;
   }

   public int numVertices() {
      return numVertices;
   }

   public int numEdges() {
      return numEdges;
   }

   public SortedMap<Integer, Integer> degreeHistogram() {
      return Collections.unmodifiableSortedMap(degreeHistogram);
   }

   public boolean isRegular() {
      return degreeHistogram.size() <= 1;
   }

   public long triangles() {
      return triangles;
   }

   public SortedMap<Integer, Long> cliqueCounts() {
      return Collections.unmodifiableSortedMap(cliqueCounts);
   }

   public int cliqueNumber() {
      return cliqueNumber;
   }

   public List<Integer> componentSizes() {
      return Collections.unmodifiableList(componentSizes);
   }

   public boolean isConnected() {
      return componentSizes.size() <= 1;
   }

   public SortedMap<Integer, Integer> adjacentCommonNeighbours() {
      return Collections.unmodifiableSortedMap(adjacentCommonNeighbours);
   }

   public SortedMap<Integer, Integer> nonAdjacentCommonNeighbours() {
      return Collections.unmodifiableSortedMap(nonAdjacentCommonNeighbours);
   }

   public Spectrum spectrum() {
      return spectrum;
   }

   public StronglyRegularParameters stronglyRegular() {
      return srg;
   }

   public InvariantRecord toRecord() {
      return new InvariantRecord("graph " + graphName)
              .put("vertices", numVertices)
              .put("edges", numEdges)
              .put("degrees", degreeHistogram)
              .put("triangles", triangles)
              .put("cliques", cliqueCounts)
              .put("clique_number", cliqueNumber)
              .put("components", componentSizes)
              .put("common_neighbours.adjacent", adjacentCommonNeighbours)
              .put("common_neighbours.non_adjacent", nonAdjacentCommonNeighbours)
              .put("spectrum", spectrum)
              .put("spectrum.tolerance", spectrum.tolerance())
              .put("strongly_regular", srg);
   }
}
