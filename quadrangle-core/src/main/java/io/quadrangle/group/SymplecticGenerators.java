package io.quadrangle.group;

import com.koloboke.collect.map.hash.HashIntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;
import io.quadrangle.field.FiniteField;
import io.quadrangle.geometry.AlternatingForm;
import io.quadrangle.geometry.IncidenceStructure;
import io.quadrangle.geometry.ProjectiveSpace;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Generators of PGammaSp(n, q) acting on the points of W(n-1, q), built from
 * the form rather than found by search: all symplectic transvections
 * x -> x + a B(x, v) v, the similitudes diag(1, .., 1, l, .., l) and the
 * Frobenius map.
 */
public class SymplecticGenerators {
   private static final Logger LOG = Logger.getLogger(SymplecticGenerators.class);

   private SymplecticGenerators() {
   }

   /**
    * @param structure W(n-1, q) built from {@code form}, with coordinates
    */
   public static List<Permutation> of(IncidenceStructure structure,
                                      AlternatingForm form) {
      if (!structure.hasCoordinates()) {
         throw new IllegalArgumentException(structure.name() +
                 " has no coordinates to act on");
      }
      if (!form.isStandard()) {
         throw new IllegalArgumentException("Similitudes are only known for " +
                 "the standard form, got " + form);
      }

      FiniteField field = form.field();
      int numPoints = structure.numPoints();
      int dim = form.dimension();
      HashIntIntMap index = HashIntIntMaps.newMutableMap(numPoints);
      for (int p = 0; p < numPoints; ++p) {
         index.put(ProjectiveSpace.encode(field, structure.coordinates(p)), p);
      }

      LinkedHashSet<Permutation> generators = new LinkedHashSet<>();

      for (int p = 0; p < numPoints; ++p) {
         int[] v = structure.coordinates(p);
         for (int a = 1; a < field.order(); ++a) {
            int scalar = a;
            generators.add(act(structure, index, field, x -> {
               int coefficient = field.mul(scalar, form.polar(x, v));
               int[] y = x.clone();
               for (int i = 0; i < y.length; ++i) {
                  y[i] = field.add(y[i], field.mul(coefficient, v[i]));
               }
               return y;
            }));
         }
      }

      for (int lambda = 2; lambda < field.order(); ++lambda) {
         int scalar = lambda;
         generators.add(act(structure, index, field, x -> {
            int[] y = x.clone();
            for (int i = dim / 2; i < dim; ++i) {
               y[i] = field.mul(scalar, y[i]);
            }
            return y;
         }));
      }

      if (!field.isPrime()) {
         generators.add(act(structure, index, field, x -> {
            int[] y = new int[x.length];
            for (int i = 0; i < y.length; ++i) {
               y[i] = field.frobenius(x[i]);
            }
            return y;
         }));
      }

      List<Permutation> result = new ArrayList<>();
      for (Permutation g : generators) {
         if (!g.isIdentity()) {
            result.add(g);
         }
      }
      LOG.info(result.size() + " symplectic generators on " + structure.name());
      return result;
   }

   private static Permutation act(IncidenceStructure structure,
                                  HashIntIntMap index, FiniteField field,
                                  UnaryOperator<int[]> map) {
      int[] images = new int[structure.numPoints()];
      for (int p = 0; p < images.length; ++p) {
         int[] y = ProjectiveSpace.normalize(field, map.apply(structure.coordinates(p)));
         int image = index.getOrDefault(ProjectiveSpace.encode(field, y), -1);
         if (image < 0) {
            throw new IllegalStateException("Image of point " + p +
                    " is not a point of " + structure.name());
         }
         images[p] = image;
      }
      return Permutation.of(images);
   }
}
