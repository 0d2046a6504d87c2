package io.quadrangle.geometry;

import com.koloboke.collect.map.hash.HashLongIntMap;
import com.koloboke.collect.map.hash.HashLongIntMaps;
import io.quadrangle.field.FiniteField;
import io.quadrangle.util.ContentHash;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable point/line geometry that satisfies the generalized quadrangle
 * axioms. Instances only exist after {@link GeneralizedQuadrangleValidator}
 * accepted them.
 */
public final class IncidenceStructure {

   private final String name;
   private final FiniteField field;
   private final int[][] coordinates;
   private final int[][] lines;
   private final int[][] linesThrough;
   private final QuadrangleParameters parameters;
   private final HashLongIntMap joining;
   private final String contentHash;

   IncidenceStructure(String name, FiniteField field, int[][] coordinates,
                      int numPoints, int[][] lines) {
      this.parameters = GeneralizedQuadrangleValidator.validate(numPoints, lines);
      this.name = name;
      this.field = field;
      this.coordinates = coordinates;
      this.lines = lines;

      int[] fill = new int[numPoints];
      this.linesThrough = new int[numPoints][parameters.t() + 1];
      this.joining = HashLongIntMaps.newMutableMap(
              numPoints * parameters.t() * parameters.s());
      for (int l = 0; l < lines.length; ++l) {
         int[] line = lines[l];
         for (int i = 0; i < line.length; ++i) {
            for (int j = i + 1; j < line.length; ++j) {
               joining.put(GeneralizedQuadrangleValidator.pairKey(
                       numPoints, line[i], line[j]), l);
            }
         }
      }
      for (int l = 0; l < lines.length; ++l) {
         for (int p : lines[l]) {
            linesThrough[p][fill[p]++] = l;
         }
      }

      this.contentHash = ContentHash.builder()
              .add("incidence").add(numPoints).add(lines).build();
   }

   /**
    * Builds a structure from a point-by-line 0/1 incidence matrix.
    */
   public static IncidenceStructure fromIncidenceMatrix(String name,
                                                        int[][] incidence) {
      int numPoints = incidence.length;
      int numLines = numPoints == 0 ? 0 : incidence[0].length;
      List<int[]> lines = new ArrayList<>(numLines);
      for (int l = 0; l < numLines; ++l) {
         int size = 0;
         for (int p = 0; p < numPoints; ++p) {
            if (incidence[p].length != numLines) {
               throw new IllegalArgumentException("Incidence row " + p +
                       " has " + incidence[p].length + " columns, expected " +
                       numLines);
            }
            if (incidence[p][l] != 0 && incidence[p][l] != 1) {
               throw new IllegalArgumentException("Incidence entry (" + p +
                       "," + l + ") is " + incidence[p][l] + ", expected 0 or 1");
            }
            size += incidence[p][l];
         }
         int[] line = new int[size];
         int next = 0;
         for (int p = 0; p < numPoints; ++p) {
            if (incidence[p][l] == 1) {
               line[next++] = p;
            }
         }
         lines.add(line);
      }
      return new IncidenceStructure(name, null, null, numPoints,
              lines.toArray(new int[0][]));
   }

   public static IncidenceStructure fromLines(String name, int numPoints,
                                              int[][] lines) {
      int[][] sorted = new int[lines.length][];
      for (int i = 0; i < lines.length; ++i) {
         sorted[i] = lines[i].clone();
         Arrays.sort(sorted[i]);
      }
      return new IncidenceStructure(name, null, null, numPoints, sorted);
   }

   public String name() {
      return name;
   }

   /**
    * @return the coordinate field, or null for structures read without
    * coordinates
    */
   public FiniteField field() {
      return field;
   }

   public boolean hasCoordinates() {
      return coordinates != null;
   }

   public int[] coordinates(int point) {
      if (coordinates == null) {
         throw new IllegalStateException(name + " has no point coordinates");
      }
      return coordinates[point].clone();
   }

   public int numPoints() {
      return linesThrough.length;
   }

   public int numLines() {
      return lines.length;
   }

   public int[] line(int l) {
      return lines[l].clone();
   }

   public int[][] lines() {
      int[][] copy = new int[lines.length][];
      for (int i = 0; i < lines.length; ++i) {
         copy[i] = lines[i].clone();
      }
      return copy;
   }

   public int[] linesThrough(int point) {
      return linesThrough[point].clone();
   }

   public QuadrangleParameters parameters() {
      return parameters;
   }

   public int s() {
      return parameters.s();
   }

   public int t() {
      return parameters.t();
   }

   /**
    * @return the line joining two distinct points, or -1 if they are not
    * collinear
    */
   public int joiningLine(int p, int r) {
      if (p == r) {
         throw new IllegalArgumentException("Point " + p + " joined with itself");
      }
      return joining.getOrDefault(
              GeneralizedQuadrangleValidator.pairKey(numPoints(), p, r), -1);
   }

   public boolean collinear(int p, int r) {
      return p != r && joiningLine(p, r) >= 0;
   }

   public String contentHash() {
      return contentHash;
   }

   @Override
   public String toString() {
      return name + " " + parameters + " [" + numPoints() + " points, " +
              numLines() + " lines]";
   }
}
