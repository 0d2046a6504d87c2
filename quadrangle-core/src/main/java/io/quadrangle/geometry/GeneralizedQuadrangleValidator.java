package io.quadrangle.geometry;

import com.koloboke.collect.map.hash.HashLongIntMap;
import com.koloboke.collect.map.hash.HashLongIntMaps;
import io.quadrangle.exceptions.ConstructionException;
import io.quadrangle.exceptions.ConstructionException.Axiom;
import io.quadrangle.linalg.FieldMatrix;
import io.quadrangle.linalg.LinearAlgebra;
import org.apache.log4j.Logger;

import java.util.Arrays;

/**
 * Checks the generalized quadrangle axioms, in a fixed order, and names the
 * first one that fails together with a witness.
 */
public class GeneralizedQuadrangleValidator {
   private static final Logger LOG =
           Logger.getLogger(GeneralizedQuadrangleValidator.class);

   private GeneralizedQuadrangleValidator() {
   }

   /**
    * A polar form is usable when its radical is trivial. In characteristic
    * 2 a quadratic form may keep a one dimensional radical as long as Q does
    * not vanish on it.
    */
   public static void requireNonDegenerate(PolarForm form) {
      FieldMatrix radical = LinearAlgebra.kernelBasis(form.gramMatrix());
      if (radical.rows() == 0) {
         return;
      }

      if (form instanceof QuadraticForm && form.field().characteristic() == 2) {
         QuadraticForm quadric = (QuadraticForm) form;
         int q = form.field().order();
         int dim = radical.rows();
         long combinations = 1;
         for (int i = 0; i < dim; ++i) {
            combinations *= q;
         }
         int[] coeffs = new int[dim];
         for (long c = 1; c < combinations; ++c) {
            long rem = c;
            for (int i = 0; i < dim; ++i) {
               coeffs[i] = (int) (rem % q);
               rem /= q;
            }
            int[] v = new int[form.dimension()];
            for (int i = 0; i < dim; ++i) {
               if (coeffs[i] == 0) {
                  continue;
               }
               for (int j = 0; j < v.length; ++j) {
                  v[j] = form.field().add(v[j],
                          form.field().mul(coeffs[i], radical.get(i, j)));
               }
            }
            if (quadric.isSingular(v)) {
               throw new ConstructionException(Axiom.NON_DEGENERATE_FORM,
                       form.name() + " has singular radical vector " +
                               Arrays.toString(v));
            }
         }
         return;
      }

      throw new ConstructionException(Axiom.NON_DEGENERATE_FORM,
              form.name() + " has a radical of dimension " + radical.rows() +
                      ", e.g. " + Arrays.toString(radical.row(0)));
   }

   static long pairKey(int numPoints, int p, int r) {
      return p < r ? (long) p * numPoints + r : (long) r * numPoints + p;
   }

   /**
    * @param lines each line as a sorted array of point ids
    * @return the order (s, t) of the quadrangle
    */
   public static QuadrangleParameters validate(int numPoints, int[][] lines) {
      if (lines.length == 0) {
         throw new ConstructionException(Axiom.LINE_REGULARITY,
                 "structure has no lines");
      }

      // lines: well formed and of the same size
      int lineSize = lines[0].length;
      for (int l = 0; l < lines.length; ++l) {
         int[] line = lines[l];
         for (int i = 0; i < line.length; ++i) {
            if (line[i] < 0 || line[i] >= numPoints ||
                    (i > 0 && line[i] <= line[i - 1])) {
               throw new ConstructionException(Axiom.LINE_REGULARITY,
                       "line " + l + " is not a sorted set of point ids: " +
                               Arrays.toString(line));
            }
         }
         if (line.length != lineSize) {
            throw new ConstructionException(Axiom.LINE_REGULARITY,
                    "line " + l + " has " + line.length + " points, line 0 has " +
                            lineSize);
         }
      }
      int s = lineSize - 1;
      if (s < 1) {
         throw new ConstructionException(Axiom.LINE_REGULARITY,
                 "lines have " + lineSize + " point(s), need at least 2");
      }

      // points: on the same number of lines
      int[] linesPerPoint = new int[numPoints];
      for (int[] line : lines) {
         for (int p : line) {
            linesPerPoint[p]++;
         }
      }
      int t = linesPerPoint.length == 0 ? 0 : linesPerPoint[0] - 1;
      for (int p = 0; p < numPoints; ++p) {
         if (linesPerPoint[p] != t + 1) {
            throw new ConstructionException(Axiom.POINT_REGULARITY,
                    "point " + p + " is on " + linesPerPoint[p] +
                            " lines, point 0 is on " + (t + 1));
         }
      }
      if (t < 1) {
         throw new ConstructionException(Axiom.POINT_REGULARITY,
                 "points are on " + (t + 1) + " line(s), need at least 2");
      }

      HashLongIntMap joining = HashLongIntMaps.newMutableMap();
      for (int l = 0; l < lines.length; ++l) {
         int[] line = lines[l];
         for (int i = 0; i < line.length; ++i) {
            for (int j = i + 1; j < line.length; ++j) {
               long key = pairKey(numPoints, line[i], line[j]);
               int previous = joining.getOrDefault(key, -1);
               if (previous >= 0) {
                  throw new ConstructionException(Axiom.UNIQUE_JOINING_LINE,
                          "points " + line[i] + " and " + line[j] +
                                  " lie on lines " + previous + " and " + l);
               }
               joining.put(key, l);
            }
         }
      }

      boolean[] onLine = new boolean[numPoints];
      for (int l = 0; l < lines.length; ++l) {
         int[] line = lines[l];
         for (int p : line) {
            onLine[p] = true;
         }
         for (int p = 0; p < numPoints; ++p) {
            if (onLine[p]) {
               continue;
            }
            int collinear = 0;
            for (int x : line) {
               if (joining.containsKey(pairKey(numPoints, p, x))) {
                  collinear++;
               }
            }
            if (collinear != 1) {
               throw new ConstructionException(Axiom.QUADRANGLE_AXIOM,
                       "point " + p + " is collinear with " + collinear +
                               " points of line " + l + " " + Arrays.toString(line));
            }
         }
         for (int p : line) {
            onLine[p] = false;
         }
      }

      QuadrangleParameters params = new QuadrangleParameters(s, t);
      if (numPoints != params.expectedPoints()) {
         throw new ConstructionException(Axiom.POINT_COUNT, params + " needs " +
                 params.expectedPoints() + " points, found " + numPoints);
      }
      if (lines.length != params.expectedLines()) {
         throw new ConstructionException(Axiom.LINE_COUNT, params + " needs " +
                 params.expectedLines() + " lines, found " + lines.length);
      }

      LOG.debug("Validated " + params + " with " + numPoints + " points and " +
              lines.length + " lines");
      return params;
   }
}
