package io.quadrangle.util;

public class Utils {

   /**
    * Writes the common values of two sorted ranges into {@code target}
    * (which must be large enough) and returns how many were written.
    */
   public static int sintersect(int[] arr1, int[] arr2,
                                int startIdx1, int endIdx1, int startIdx2,
                                int endIdx2, int[] target) {
      int size = 0;
      while (startIdx1 < endIdx1 && startIdx2 < endIdx2) {
         int v1 = arr1[startIdx1];
         int v2 = arr2[startIdx2];
         if (v1 < v2) {
            ++startIdx1;
         } else if (v1 > v2) {
            ++startIdx2;
         } else {
            target[size++] = v1;
            ++startIdx1;
            ++startIdx2;
         }
      }

      return size;
   }
}
