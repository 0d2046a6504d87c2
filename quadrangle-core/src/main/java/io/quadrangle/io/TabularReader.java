package io.quadrangle.io;

import io.quadrangle.exceptions.IngestException;
import io.quadrangle.field.FiniteField;
import io.quadrangle.geometry.IncidenceStructure;
import io.quadrangle.graph.Graph;
import io.quadrangle.group.Permutation;
import io.quadrangle.linalg.FieldMatrix;
import io.quadrangle.rootsystem.RootSystem;
import org.apache.commons.io.input.BOMInputStream;
import org.apache.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.StringTokenizer;

/**
 * Reads whitespace separated integer tables. Blank lines and lines starting
 * with {@code #} are skipped, a leading byte order mark is ignored. Every
 * structural problem is reported as an {@link IngestException} naming the
 * source line and column.
 */
public class TabularReader {
   private static final Logger LOG = Logger.getLogger(TabularReader.class);

   private TabularReader() {
   }

   /**
    * A parsed row and the 1-based source line it came from.
    */
   static final class Row {
      final int line;
      final int[] values;

      Row(int line, int[] values) {
         this.line = line;
         this.values = values;
      }
   }

   static List<Row> readRows(InputStream is) {
      List<Row> rows = new ArrayList<>();
      try (BufferedReader reader = new BufferedReader(new InputStreamReader(
              new BOMInputStream(is), StandardCharsets.UTF_8))) {
         String line = reader.readLine();
         int lineNumber = 1;
         while (line != null) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
               StringTokenizer tokenizer = new StringTokenizer(trimmed);
               int[] values = new int[tokenizer.countTokens()];
               for (int col = 0; col < values.length; ++col) {
                  String token = tokenizer.nextToken();
                  try {
                     values[col] = Integer.parseInt(token);
                  } catch (NumberFormatException e) {
                     throw new IngestException("line " + lineNumber + ", column " +
                             (col + 1) + ": '" + token + "' is not an integer", e);
                  }
               }
               rows.add(new Row(lineNumber, values));
            }
            line = reader.readLine();
            lineNumber++;
         }
      } catch (IOException e) {
         throw new IngestException("Could not read table", e);
      }
      return rows;
   }

   static InputStream open(Path path) {
      try {
         return Files.newInputStream(path);
      } catch (IOException e) {
         throw new IngestException("Could not open " + path, e);
      }
   }

   /**
    * @return a rectangular table
    */
   public static int[][] readTable(InputStream is) {
      List<Row> rows = readRows(is);
      int[][] table = new int[rows.size()][];
      for (int i = 0; i < table.length; ++i) {
         Row row = rows.get(i);
         if (row.values.length != rows.get(0).values.length) {
            throw new IngestException("line " + row.line + ": " +
                    row.values.length + " columns, expected " +
                    rows.get(0).values.length);
         }
         table[i] = row.values;
      }
      return table;
   }

   /**
    * Square, symmetric 0/1 matrix with zero diagonal.
    */
   public static Graph readAdjacencyMatrix(String name, InputStream is) {
      List<Row> rows = readRows(is);
      int n = rows.size();
      int[][] adjacency = new int[n][];
      for (int i = 0; i < n; ++i) {
         Row row = rows.get(i);
         if (row.values.length != n) {
            throw new IngestException("line " + row.line + ": adjacency row " + i +
                    " has " + row.values.length + " entries, matrix has " + n +
                    " rows");
         }
         adjacency[i] = row.values;
      }
      for (int i = 0; i < n; ++i) {
         for (int j = 0; j < n; ++j) {
            int a = adjacency[i][j];
            String where = "line " + rows.get(i).line + ", column " + (j + 1);
            if (a != 0 && a != 1) {
               throw new IngestException(where + ": entry " + a + " is not 0/1");
            }
            if (i == j && a != 0) {
               throw new IngestException(where + ": loop on the diagonal");
            }
            if (a != adjacency[j][i]) {
               throw new IngestException(where + ": entry differs from (" +
                       (j + 1) + "," + (i + 1) + "), matrix is not symmetric");
            }
         }
      }
      LOG.info("Read adjacency matrix " + name + " with " + n + " vertices");
      return Graph.fromAdjacency(name, adjacency);
   }

   public static Graph readAdjacencyMatrix(Path path) {
      return readAdjacencyMatrix(path.getFileName().toString(), open(path));
   }

   /**
    * Points by lines 0/1 matrix, validated as a generalized quadrangle.
    */
   public static IncidenceStructure readIncidenceMatrix(String name,
                                                        InputStream is) {
      List<Row> rows = readRows(is);
      if (rows.isEmpty()) {
         throw new IngestException("Incidence matrix " + name + " is empty");
      }
      int cols = rows.get(0).values.length;
      int[][] incidence = new int[rows.size()][];
      for (int i = 0; i < incidence.length; ++i) {
         Row row = rows.get(i);
         if (row.values.length != cols) {
            throw new IngestException("line " + row.line + ": " +
                    row.values.length + " columns, expected " + cols);
         }
         for (int j = 0; j < cols; ++j) {
            if (row.values[j] != 0 && row.values[j] != 1) {
               throw new IngestException("line " + row.line + ", column " +
                       (j + 1) + ": entry " + row.values[j] + " is not 0/1");
            }
         }
         incidence[i] = row.values;
      }
      return IncidenceStructure.fromIncidenceMatrix(name, incidence);
   }

   /**
    * Matrix whose entries must be elements of the field.
    */
   public static FieldMatrix readMatrix(FiniteField field, InputStream is) {
      int[][] table = readTable(is);
      for (int i = 0; i < table.length; ++i) {
         for (int j = 0; j < table[i].length; ++j) {
            if (!field.contains(table[i][j])) {
               throw new IngestException("row " + (i + 1) + ", column " + (j + 1) +
                       ": " + table[i][j] + " is not an element of " + field);
            }
         }
      }
      return FieldMatrix.of(field, table);
   }

   /**
    * One permutation per row, in image notation.
    */
   public static List<Permutation> readPermutations(int degree, InputStream is) {
      List<Permutation> permutations = new ArrayList<>();
      for (Row row : readRows(is)) {
         if (row.values.length != degree) {
            throw new IngestException("line " + row.line + ": permutation has " +
                    row.values.length + " images, expected " + degree);
         }
         boolean[] seen = new boolean[degree];
         for (int col = 0; col < degree; ++col) {
            int x = row.values[col];
            if (x < 0 || x >= degree || seen[x]) {
               throw new IngestException("line " + row.line + ", column " +
                       (col + 1) + ": image " + x + " is out of range or repeated");
            }
            seen[x] = true;
         }
         permutations.add(Permutation.of(row.values));
      }
      return permutations;
   }

   /**
    * One root per row, integer coordinates at the given scale.
    */
   public static RootSystem readRootSystem(String name, int scale, InputStream is) {
      List<Row> rows = readRows(is);
      List<int[]> roots = new ArrayList<>();
      for (Row row : rows) {
         if (!roots.isEmpty() && row.values.length != roots.get(0).length) {
            throw new IngestException("line " + row.line + ": root has " +
                    row.values.length + " coordinates, expected " +
                    roots.get(0).length);
         }
         roots.add(row.values);
      }
      try {
         return RootSystem.of(name, roots, scale);
      } catch (IllegalArgumentException e) {
         throw new IngestException("Invalid root system " + name + ": " +
                 e.getMessage(), e);
      }
   }
}
