package io.quadrangle.linalg;

import io.quadrangle.exceptions.FieldArithmeticException;
import io.quadrangle.field.FiniteField;
import io.quadrangle.graph.Graph;

import java.util.Arrays;

/**
 * Immutable dense matrix over a finite field. The field is a runtime tag:
 * every binary operation checks that both operands carry the same field
 * before touching any entry.
 */
public final class FieldMatrix {

   private final FiniteField field;
   private final int rows;
   private final int cols;
   private final int[][] entries;

   private FieldMatrix(FiniteField field, int rows, int cols, int[][] entries) {
      this.field = field;
      this.rows = rows;
      this.cols = cols;
      this.entries = entries;
   }

   /**
    * @param entries row-major entries, each in {@code 0..q-1}; copied
    */
   public static FieldMatrix of(FiniteField field, int[][] entries) {
      int cols = entries.length == 0 ? 0 : entries[0].length;
      return of(field, cols, entries);
   }

   /**
    * Variant that fixes the column count, so matrices with zero rows keep
    * their width.
    */
   public static FieldMatrix of(FiniteField field, int cols, int[][] entries) {
      int[][] copy = new int[entries.length][];
      for (int i = 0; i < entries.length; ++i) {
         if (entries[i].length != cols) {
            throw new IllegalArgumentException("Row " + i + " has " +
                    entries[i].length + " entries, expected " + cols);
         }
         for (int j = 0; j < cols; ++j) {
            if (!field.contains(entries[i][j])) {
               throw new IllegalArgumentException("Entry (" + i + "," + j +
                       ")=" + entries[i][j] + " is not in " + field);
            }
         }
         copy[i] = entries[i].clone();
      }
      return new FieldMatrix(field, entries.length, cols, copy);
   }

   static FieldMatrix wrap(FiniteField field, int cols, int[][] entries) {
      return new FieldMatrix(field, entries.length, cols, entries);
   }

   public static FieldMatrix zero(FiniteField field, int rows, int cols) {
      return new FieldMatrix(field, rows, cols, new int[rows][cols]);
   }

   public static FieldMatrix identity(FiniteField field, int n) {
      int[][] entries = new int[n][n];
      for (int i = 0; i < n; ++i) {
         entries[i][i] = 1;
      }
      return new FieldMatrix(field, n, n, entries);
   }

   /**
    * Adjacency matrix of a graph, read over the given field.
    */
   public static FieldMatrix adjacency(Graph graph, FiniteField field) {
      int n = graph.numVertices();
      int[][] entries = new int[n][n];
      for (int u = 0; u < n; ++u) {
         for (int v : graph.neighbours(u)) {
            entries[u][v] = 1;
         }
      }
      return new FieldMatrix(field, n, n, entries);
   }

   public FiniteField field() {
      return field;
   }

   public int rows() {
      return rows;
   }

   public int cols() {
      return cols;
   }

   public int get(int i, int j) {
      return entries[i][j];
   }

   public int[] row(int i) {
      return entries[i].clone();
   }

   public int[][] toArray() {
      int[][] copy = new int[rows][];
      for (int i = 0; i < rows; ++i) {
         copy[i] = entries[i].clone();
      }
      return copy;
   }

   private void requireSameField(FieldMatrix other) {
      if (!field.equals(other.field)) {
         throw new FieldArithmeticException("Field mismatch: " + field +
                 " matrix combined with " + other.field + " matrix");
      }
   }

   private void requireSameShape(FieldMatrix other) {
      if (rows != other.rows || cols != other.cols) {
         throw new IllegalArgumentException("Shape mismatch: " + rows + "x" +
                 cols + " vs " + other.rows + "x" + other.cols);
      }
   }

   public FieldMatrix multiply(FieldMatrix other) {
      requireSameField(other);
      if (cols != other.rows) {
         throw new IllegalArgumentException("Cannot multiply " + rows + "x" +
                 cols + " by " + other.rows + "x" + other.cols);
      }
      int[][] result = new int[rows][other.cols];
      for (int i = 0; i < rows; ++i) {
         int[] target = result[i];
         for (int k = 0; k < cols; ++k) {
            int a = entries[i][k];
            if (a == 0) {
               continue;
            }
            int[] otherRow = other.entries[k];
            for (int j = 0; j < other.cols; ++j) {
               int b = otherRow[j];
               if (b != 0) {
                  target[j] = field.add(target[j], field.mul(a, b));
               }
            }
         }
      }
      return new FieldMatrix(field, rows, other.cols, result);
   }

   /**
    * Matrix-vector product with a column vector.
    */
   public int[] multiply(int[] vector) {
      if (vector.length != cols) {
         throw new IllegalArgumentException("Vector length " + vector.length +
                 " does not match " + cols + " columns");
      }
      int[] result = new int[rows];
      for (int i = 0; i < rows; ++i) {
         int acc = 0;
         for (int j = 0; j < cols; ++j) {
            if (entries[i][j] != 0 && vector[j] != 0) {
               acc = field.add(acc, field.mul(entries[i][j], vector[j]));
            }
         }
         result[i] = acc;
      }
      return result;
   }

   public FieldMatrix add(FieldMatrix other) {
      requireSameField(other);
      requireSameShape(other);
      int[][] result = new int[rows][cols];
      for (int i = 0; i < rows; ++i) {
         for (int j = 0; j < cols; ++j) {
            result[i][j] = field.add(entries[i][j], other.entries[i][j]);
         }
      }
      return new FieldMatrix(field, rows, cols, result);
   }

   public FieldMatrix subtract(FieldMatrix other) {
      requireSameField(other);
      requireSameShape(other);
      int[][] result = new int[rows][cols];
      for (int i = 0; i < rows; ++i) {
         for (int j = 0; j < cols; ++j) {
            result[i][j] = field.sub(entries[i][j], other.entries[i][j]);
         }
      }
      return new FieldMatrix(field, rows, cols, result);
   }

   public FieldMatrix scale(int scalar) {
      field.checkElement(scalar);
      int[][] result = new int[rows][cols];
      for (int i = 0; i < rows; ++i) {
         for (int j = 0; j < cols; ++j) {
            result[i][j] = field.mul(scalar, entries[i][j]);
         }
      }
      return new FieldMatrix(field, rows, cols, result);
   }

   public FieldMatrix transpose() {
      int[][] result = new int[cols][rows];
      for (int i = 0; i < rows; ++i) {
         for (int j = 0; j < cols; ++j) {
            result[j][i] = entries[i][j];
         }
      }
      return new FieldMatrix(field, cols, rows, result);
   }

   /**
    * Rows of this matrix followed by the rows of {@code other}.
    */
   public FieldMatrix stack(FieldMatrix other) {
      requireSameField(other);
      if (cols != other.cols) {
         throw new IllegalArgumentException("Cannot stack " + cols +
                 " columns on " + other.cols);
      }
      int[][] result = new int[rows + other.rows][];
      for (int i = 0; i < rows; ++i) {
         result[i] = entries[i].clone();
      }
      for (int i = 0; i < other.rows; ++i) {
         result[rows + i] = other.entries[i].clone();
      }
      return new FieldMatrix(field, rows + other.rows, cols, result);
   }

   public boolean isZero() {
      for (int[] row : entries) {
         for (int x : row) {
            if (x != 0) {
               return false;
            }
         }
      }
      return true;
   }

   public boolean isSquare() {
      return rows == cols;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof FieldMatrix)) return false;
      FieldMatrix that = (FieldMatrix) o;
      return rows == that.rows && cols == that.cols &&
              field.equals(that.field) &&
              Arrays.deepEquals(entries, that.entries);
   }

   @Override
   public int hashCode() {
      return 31 * field.hashCode() + Arrays.deepHashCode(entries);
   }

   @Override
   public String toString() {
      return "FieldMatrix(" + rows + "x" + cols + " over " + field + ")";
   }
}
