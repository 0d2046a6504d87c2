package io.quadrangle.graph;

import io.quadrangle.geometry.IncidenceStructure;
import io.quadrangle.util.ContentHash;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable simple undirected graph on vertices {@code 0..n-1}.
 * Neighbourhoods are kept as bitmaps; an optional colouring partitions the
 * vertices (automorphisms must preserve it).
 */
public final class Graph {

   private final String name;
   private final RoaringBitmap[] neighbourhoods;
   private final int[][] adjacencyLists;
   private final int[] colors;
   private final int numEdges;
   private final String contentHash;

   private Graph(String name, RoaringBitmap[] neighbourhoods, int[] colors) {
      this.name = name;
      this.neighbourhoods = neighbourhoods;
      this.colors = colors;
      this.adjacencyLists = new int[neighbourhoods.length][];
      long degreeSum = 0;
      for (int v = 0; v < neighbourhoods.length; ++v) {
         neighbourhoods[v].runOptimize();
         adjacencyLists[v] = neighbourhoods[v].toArray();
         degreeSum += adjacencyLists[v].length;
      }
      this.numEdges = (int) (degreeSum / 2);

      ContentHash hash = ContentHash.builder().add("graph")
              .add(neighbourhoods.length)
              .add(colors == null ? new int[0] : colors);
      for (int[] adj : adjacencyLists) {
         hash.add(adj);
      }
      this.contentHash = hash.build();
   }

   /**
    * @param edges pairs {u, v}; loops are rejected, repeated edges collapse
    */
   public static Graph fromEdges(String name, int numVertices, int[][] edges) {
      RoaringBitmap[] nb = emptyNeighbourhoods(numVertices);
      for (int[] e : edges) {
         int u = e[0];
         int v = e[1];
         if (u == v) {
            throw new IllegalArgumentException("Loop at vertex " + u);
         }
         if (u < 0 || v < 0 || u >= numVertices || v >= numVertices) {
            throw new IllegalArgumentException("Edge " + Arrays.toString(e) +
                    " outside vertex range [0," + numVertices + ")");
         }
         nb[u].add(v);
         nb[v].add(u);
      }
      return new Graph(name, nb, null);
   }

   /**
    * @param adjacency symmetric 0/1 matrix with zero diagonal
    */
   public static Graph fromAdjacency(String name, int[][] adjacency) {
      int n = adjacency.length;
      RoaringBitmap[] nb = emptyNeighbourhoods(n);
      for (int i = 0; i < n; ++i) {
         if (adjacency[i].length != n) {
            throw new IllegalArgumentException("Adjacency row " + i + " has " +
                    adjacency[i].length + " entries, expected " + n);
         }
         for (int j = 0; j < n; ++j) {
            int a = adjacency[i][j];
            if ((a != 0 && a != 1) || a != adjacency[j][i] || (i == j && a != 0)) {
               throw new IllegalArgumentException("Adjacency entry (" + i + "," +
                       j + ") breaks symmetry, 0/1 entries or zero diagonal");
            }
            if (a == 1) {
               nb[i].add(j);
            }
         }
      }
      return new Graph(name, nb, null);
   }

   /**
    * Takes ownership of the bitmaps; callers must not touch them afterwards.
    */
   public static Graph fromNeighbourhoods(String name,
                                          RoaringBitmap[] neighbourhoods) {
      for (int v = 0; v < neighbourhoods.length; ++v) {
         if (neighbourhoods[v].contains(v)) {
            throw new IllegalArgumentException("Loop at vertex " + v);
         }
         for (int u : neighbourhoods[v]) {
            if (!neighbourhoods[u].contains(v)) {
               throw new IllegalArgumentException("Edge " + v + "-" + u +
                       " is not symmetric");
            }
         }
      }
      return new Graph(name, neighbourhoods, null);
   }

   /**
    * Collinearity graph: points adjacent iff they share a line.
    */
   public static Graph collinearity(IncidenceStructure structure) {
      RoaringBitmap[] nb = emptyNeighbourhoods(structure.numPoints());
      for (int[] line : structure.lines()) {
         for (int p : line) {
            for (int r : line) {
               if (p != r) {
                  nb[p].add(r);
               }
            }
         }
      }
      return new Graph(structure.name() + ".collinearity", nb, null);
   }

   /**
    * Point/line incidence (Levi) graph. Points are vertices
    * {@code 0..P-1} with colour 0, lines follow with colour 1.
    */
   public static Graph incidence(IncidenceStructure structure) {
      int numPoints = structure.numPoints();
      RoaringBitmap[] nb = emptyNeighbourhoods(numPoints + structure.numLines());
      int[] colors = new int[nb.length];
      for (int l = 0; l < structure.numLines(); ++l) {
         int lineVertex = numPoints + l;
         colors[lineVertex] = 1;
         for (int p : structure.line(l)) {
            nb[p].add(lineVertex);
            nb[lineVertex].add(p);
         }
      }
      return new Graph(structure.name() + ".incidence", nb, colors);
   }

   private static RoaringBitmap[] emptyNeighbourhoods(int n) {
      RoaringBitmap[] nb = new RoaringBitmap[n];
      for (int i = 0; i < n; ++i) {
         nb[i] = new RoaringBitmap();
      }
      return nb;
   }

   /**
    * Same graph with a vertex colouring.
    */
   public Graph withColors(int[] colors) {
      if (colors.length != neighbourhoods.length) {
         throw new IllegalArgumentException("Expected " + neighbourhoods.length +
                 " colours, got " + colors.length);
      }
      return new Graph(name, copyNeighbourhoods(), colors.clone());
   }

   public Graph withoutColors() {
      return new Graph(name, copyNeighbourhoods(), null);
   }

   public Graph withName(String newName) {
      return new Graph(newName, copyNeighbourhoods(), colors);
   }

   private RoaringBitmap[] copyNeighbourhoods() {
      RoaringBitmap[] copy = new RoaringBitmap[neighbourhoods.length];
      for (int i = 0; i < copy.length; ++i) {
         copy[i] = neighbourhoods[i].clone();
      }
      return copy;
   }

   public String name() {
      return name;
   }

   public int numVertices() {
      return neighbourhoods.length;
   }

   public int numEdges() {
      return numEdges;
   }

   public int degree(int v) {
      return adjacencyLists[v].length;
   }

   public boolean isAdjacent(int u, int v) {
      return neighbourhoods[u].contains(v);
   }

   /**
    * @return sorted neighbours of v; the array is shared, do not modify
    */
   public int[] neighbours(int v) {
      return adjacencyLists[v];
   }

   /**
    * @return a private copy of the neighbourhood bitmap of v
    */
   public RoaringBitmap neighbourhood(int v) {
      return neighbourhoods[v].clone();
   }

   public int commonNeighbours(int u, int v) {
      return RoaringBitmap.andCardinality(neighbourhoods[u], neighbourhoods[v]);
   }

   public boolean hasColors() {
      return colors != null;
   }

   public int color(int v) {
      return colors == null ? 0 : colors[v];
   }

   /**
    * @return edges {u, v} with u < v, in lexicographic order
    */
   public int[][] edges() {
      List<int[]> edges = new ArrayList<>(numEdges);
      for (int u = 0; u < adjacencyLists.length; ++u) {
         for (int v : adjacencyLists[u]) {
            if (v > u) {
               edges.add(new int[]{u, v});
            }
         }
      }
      return edges.toArray(new int[0][]);
   }

   public String contentHash() {
      return contentHash;
   }

   @Override
   public String toString() {
      return name + "(n=" + numVertices() + ", m=" + numEdges +
              (colors == null ? "" : ", coloured") + ")";
   }
}
