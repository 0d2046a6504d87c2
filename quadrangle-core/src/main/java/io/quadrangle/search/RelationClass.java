package io.quadrangle.search;

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;

/**
 * Key of a pair relation: a short tuple of ints, ordered lexicographically.
 */
public final class RelationClass implements Comparable<RelationClass> {

   private final int[] key;

   private RelationClass(int[] key) {
      this.key = key;
   }

   public static RelationClass of(int... key) {
      return new RelationClass(key.clone());
   }

   public int[] key() {
      return key.clone();
   }

   public int component(int i) {
      return key[i];
   }

   @Override
   public int compareTo(RelationClass o) {
      return Arrays.compare(key, o.key);
   }

   @Override
   public boolean equals(Object o) {
      return o instanceof RelationClass && Arrays.equals(key, ((RelationClass) o).key);
   }

   @Override
   public int hashCode() {
      return Arrays.hashCode(key);
   }

   @Override
   public String toString() {
      return "(" + StringUtils.join(key, ',') + ")";
   }
}
