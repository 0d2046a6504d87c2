package io.quadrangle.io;

import io.quadrangle.exceptions.IngestException;
import io.quadrangle.graph.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.SimpleGraph;
import org.jgrapht.nio.ImportException;
import org.jgrapht.nio.graph6.Graph6Sparse6Importer;
import org.jgrapht.util.SupplierUtil;

import java.io.StringReader;

/**
 * Decodes graph6 / sparse6 strings with JGraphT.
 */
public class Graph6Reader {

   private Graph6Reader() {
   }

   public static Graph read(String name, String encoded) {
      SimpleGraph<Integer, DefaultEdge> g = new SimpleGraph<>(
              SupplierUtil.createIntegerSupplier(),
              SupplierUtil.DEFAULT_EDGE_SUPPLIER, false);
      Graph6Sparse6Importer<Integer, DefaultEdge> importer =
              new Graph6Sparse6Importer<>();
      try {
         importer.importGraph(g, new StringReader(encoded.trim()));
      } catch (ImportException | IllegalArgumentException e) {
         throw new IngestException("Malformed graph6 string for " + name + ": " +
                 e.getMessage(), e);
      }

      int[][] edges = new int[g.edgeSet().size()][];
      int next = 0;
      for (DefaultEdge e : g.edgeSet()) {
         edges[next++] = new int[]{g.getEdgeSource(e), g.getEdgeTarget(e)};
      }
      return Graph.fromEdges(name, g.vertexSet().size(), edges);
   }
}
