package io.quadrangle.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pairs of objects grouped by relation class. Classes are sorted; pairs are
 * packed as {@code (long) a << 32 | b}.
 */
public final class RelationClassification {

   private final int numObjects;
   private final List<RelationClass> classes;
   private final List<long[]> pairs;

   RelationClassification(int numObjects, List<RelationClass> classes,
                          List<long[]> pairs) {
      this.numObjects = numObjects;
      this.classes = Collections.unmodifiableList(new ArrayList<>(classes));
      this.pairs = pairs;
   }

   public int numObjects() {
      return numObjects;
   }

   public int numClasses() {
      return classes.size();
   }

   public List<RelationClass> classes() {
      return classes;
   }

   public RelationClass relationClass(int i) {
      return classes.get(i);
   }

   public int classSize(int i) {
      return pairs.get(i).length;
   }

   /**
    * @return packed pairs of class i; shared, do not modify
    */
   long[] pairs(int i) {
      return pairs.get(i);
   }

   public int indexOf(RelationClass relationClass) {
      return Collections.binarySearch(classes, relationClass);
   }

   static int first(long pair) {
      return (int) (pair >>> 32);
   }

   static int second(long pair) {
      return (int) pair;
   }
}
