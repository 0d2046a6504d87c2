package io.quadrangle.homology;

import com.koloboke.collect.map.hash.HashObjIntMap;
import com.koloboke.collect.map.hash.HashObjIntMaps;
import io.quadrangle.graph.CliqueEnumerator;
import io.quadrangle.graph.Graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Finite abstract simplicial complex. Simplices of each dimension are sorted
 * vertex arrays, listed in lexicographic order; their position in that list
 * is the basis index used by boundary matrices.
 */
public final class SimplicialComplex {

   private static final class Simplex {
      private final int[] vertices;

      Simplex(int[] vertices) {
         this.vertices = vertices;
      }

      @Override
      public boolean equals(Object o) {
         return o instanceof Simplex && Arrays.equals(vertices, ((Simplex) o).vertices);
      }

      @Override
      public int hashCode() {
         return Arrays.hashCode(vertices);
      }
   }

   private final String name;
   private final List<int[][]> simplices;
   private final List<HashObjIntMap<Simplex>> index;

   private SimplicialComplex(String name, List<int[][]> simplices) {
      this.name = name;
      this.simplices = simplices;
      this.index = new ArrayList<>(simplices.size());
      for (int[][] layer : simplices) {
         HashObjIntMap<Simplex> map = HashObjIntMaps.newMutableMap(layer.length);
         for (int i = 0; i < layer.length; ++i) {
            map.put(new Simplex(layer[i]), i);
         }
         index.add(map);
      }
   }

   /**
    * Complex whose k-simplices are the (k+1)-cliques of the graph, up to
    * dimension {@code maxDimension}.
    */
   public static SimplicialComplex cliqueComplex(Graph graph, int maxDimension) {
      CliqueEnumerator enumerator = new CliqueEnumerator(graph);
      List<int[][]> simplices = new ArrayList<>();
      for (int d = 0; d <= maxDimension; ++d) {
         List<int[]> cliques = enumerator.list(d + 1);
         if (cliques.isEmpty()) {
            break;
         }
         simplices.add(cliques.toArray(new int[0][]));
      }
      return new SimplicialComplex(graph.name() + ".cliques", simplices);
   }

   /**
    * Downward closure of the given facets.
    */
   public static SimplicialComplex fromFacets(String name,
                                              Collection<int[]> facets) {
      List<TreeSet<int[]>> layers = new ArrayList<>();
      for (int[] facet : facets) {
         int[] sorted = facet.clone();
         Arrays.sort(sorted);
         for (int i = 1; i < sorted.length; ++i) {
            if (sorted[i] == sorted[i - 1]) {
               throw new IllegalArgumentException("Facet " +
                       Arrays.toString(facet) + " repeats vertex " + sorted[i]);
            }
         }
         if (sorted.length > 30) {
            throw new IllegalArgumentException("Facet of dimension " +
                    (sorted.length - 1) + " is too large to close");
         }
         int faces = 1 << sorted.length;
         for (int mask = 1; mask < faces; ++mask) {
            int[] face = new int[Integer.bitCount(mask)];
            int next = 0;
            for (int i = 0; i < sorted.length; ++i) {
               if ((mask & (1 << i)) != 0) {
                  face[next++] = sorted[i];
               }
            }
            int dim = face.length - 1;
            while (layers.size() <= dim) {
               layers.add(new TreeSet<>(Arrays::compare));
            }
            layers.get(dim).add(face);
         }
      }
      List<int[][]> simplices = new ArrayList<>();
      for (TreeSet<int[]> layer : layers) {
         simplices.add(layer.toArray(new int[0][]));
      }
      return new SimplicialComplex(name, simplices);
   }

   public String name() {
      return name;
   }

   /**
    * @return top dimension, -1 for the empty complex
    */
   public int dimension() {
      return simplices.size() - 1;
   }

   public int count(int dim) {
      return dim < 0 || dim >= simplices.size() ? 0 : simplices.get(dim).length;
   }

   public int[] simplex(int dim, int i) {
      return simplices.get(dim)[i].clone();
   }

   /**
    * @return the basis index of the simplex, or -1 if absent
    */
   public int indexOf(int[] simplex) {
      int dim = simplex.length - 1;
      if (dim < 0 || dim >= index.size()) {
         return -1;
      }
      return index.get(dim).getOrDefault(new Simplex(simplex), -1);
   }

   public int[] fVector() {
      int[] f = new int[simplices.size()];
      for (int d = 0; d < f.length; ++d) {
         f[d] = simplices.get(d).length;
      }
      return f;
   }

   public long eulerCharacteristic() {
      long chi = 0;
      for (int d = 0; d < simplices.size(); ++d) {
         chi += (d % 2 == 0 ? 1 : -1) * (long) simplices.get(d).length;
      }
      return chi;
   }

   @Override
   public String toString() {
      return name + Arrays.toString(fVector());
   }
}
