package io.quadrangle.geometry;

/**
 * Order (s, t) of a generalized quadrangle: s+1 points per line, t+1 lines
 * per point.
 */
public final class QuadrangleParameters {

   private final int s;
   private final int t;

   public QuadrangleParameters(int s, int t) {
      this.s = s;
      this.t = t;
   }

   public int s() {
      return s;
   }

   public int t() {
      return t;
   }

   public long expectedPoints() {
      return (s + 1L) * (s * (long) t + 1);
   }

   public long expectedLines() {
      return (t + 1L) * (s * (long) t + 1);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof QuadrangleParameters)) return false;
      QuadrangleParameters that = (QuadrangleParameters) o;
      return s == that.s && t == that.t;
   }

   @Override
   public int hashCode() {
      return 31 * s + t;
   }

   @Override
   public String toString() {
      return "GQ(" + s + "," + t + ")";
   }
}
