package io.quadrangle.geometry;

import com.koloboke.collect.map.hash.HashIntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;
import com.koloboke.collect.set.hash.HashLongSet;
import com.koloboke.collect.set.hash.HashLongSets;
import io.quadrangle.exceptions.AlgebraicInconsistencyException;
import io.quadrangle.exceptions.ConstructionException;
import io.quadrangle.exceptions.ConstructionException.Axiom;
import io.quadrangle.exceptions.FieldArithmeticException;
import io.quadrangle.field.FiniteField;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds the polar space of a form: points are the singular projective
 * points, lines the totally singular 2-spaces. The result is only returned
 * once it passed {@link GeneralizedQuadrangleValidator}.
 */
public class GeneralizedQuadrangleBuilder {
   private static final Logger LOG =
           Logger.getLogger(GeneralizedQuadrangleBuilder.class);

   private GeneralizedQuadrangleBuilder() {
   }

   public static IncidenceStructure build(FiniteField field, PolarForm form) {
      if (!field.equals(form.field())) {
         throw new FieldArithmeticException("Form " + form.name() +
                 " is defined over " + form.field() + ", not " + field);
      }

      GeneralizedQuadrangleValidator.requireNonDegenerate(form);

      List<int[]> points = new ArrayList<>();
      for (int[] v : ProjectiveSpace.points(field, form.dimension())) {
         if (form.isSingular(v)) {
            points.add(v);
         }
      }
      int n = points.size();

      HashIntIntMap index = HashIntIntMaps.newMutableMap(n);
      for (int i = 0; i < n; ++i) {
         index.put(ProjectiveSpace.encode(field, points.get(i)), i);
      }

      HashLongSet covered = HashLongSets.newMutableSet();
      List<int[]> lines = new ArrayList<>();
      for (int i = 0; i < n; ++i) {
         int[] p = points.get(i);
         for (int j = i + 1; j < n; ++j) {
            if (covered.contains((long) i * n + j)) {
               continue;
            }
            int[] r = points.get(j);
            if (form.polar(p, r) != 0) {
               continue;
            }

            int[] line = span(field, form, index, p, r);
            lines.add(line);
            for (int a = 0; a < line.length; ++a) {
               for (int b = a + 1; b < line.length; ++b) {
                  covered.add((long) line[a] * n + line[b]);
               }
            }
         }
      }

      lines.sort(GeneralizedQuadrangleBuilder::compareLines);

      LOG.info("Built " + form.name() + ": " + n + " points, " + lines.size() +
              " lines");

      return new IncidenceStructure(form.name(), field,
              points.toArray(new int[0][]), n, lines.toArray(new int[0][]));
   }

   /**
    * Point ids of the projective line through p and r, sorted.
    */
   private static int[] span(FiniteField field, PolarForm form,
                             HashIntIntMap index, int[] p, int[] r) {
      int q = field.order();
      int[] line = new int[q + 1];
      line[0] = lookup(field, form, index, p);
      int[] v = new int[p.length];
      for (int a = 0; a < q; ++a) {
         for (int k = 0; k < v.length; ++k) {
            v[k] = field.add(r[k], field.mul(a, p[k]));
         }
         line[a + 1] = lookup(field, form, index,
                 ProjectiveSpace.normalize(field, v));
      }
      Arrays.sort(line);
      return line;
   }

   private static int lookup(FiniteField field, PolarForm form,
                             HashIntIntMap index, int[] v) {
      int id = index.getOrDefault(ProjectiveSpace.encode(field, v), -1);
      if (id < 0) {
         throw new AlgebraicInconsistencyException("Point " +
                 Arrays.toString(v) + " on a totally singular line is not " +
                 "singular for " + form.name());
      }
      return id;
   }

   private static int compareLines(int[] a, int[] b) {
      return Arrays.compare(a, b);
   }

   /**
    * Classical quadrangle of order (s, t): W(q) for (q, q) and the elliptic
    * quadric Q-(5, q) for (q, q^2).
    */
   public static IncidenceStructure buildForParameters(int s, int t) {
      if (s >= 2 && isPrimePower(s)) {
         FiniteField field = FiniteField.of(s);
         IncidenceStructure structure = null;
         if (t == s) {
            structure = build(field, AlternatingForm.standard(field, 4));
         } else if (t == s * s) {
            structure = build(field, QuadraticForm.elliptic(field));
         }
         if (structure != null) {
            return structure;
         }
      }
      throw new ConstructionException(Axiom.UNSUPPORTED_PARAMETERS,
              "no known construction for GQ(" + s + "," + t + ")");
   }

   private static boolean isPrimePower(int q) {
      if (q > FiniteField.MAX_ORDER) {
         return false;
      }
      int p = 2;
      while (q % p != 0) {
         p++;
      }
      while (q % p == 0) {
         q /= p;
      }
      return q == 1;
   }
}
