package io.quadrangle.search;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One subset of relation classes, its union graph and the verdict against
 * every target. Irregular unions have no signature and no verdicts.
 */
public final class CandidateEvaluation {

   private final long mask;
   private final List<RelationClass> classes;
   private final int edges;
   private final GraphSignature signature;
   private final Map<String, Verdict> verdicts;

   CandidateEvaluation(long mask, List<RelationClass> classes, int edges,
                       GraphSignature signature,
                       LinkedHashMap<String, Verdict> verdicts) {
      this.mask = mask;
      this.classes = Collections.unmodifiableList(classes);
      this.edges = edges;
      this.signature = signature;
      this.verdicts = Collections.unmodifiableMap(verdicts);
   }

   public long mask() {
      return mask;
   }

   public List<RelationClass> classes() {
      return classes;
   }

   public int edges() {
      return edges;
   }

   public boolean isRegular() {
      return signature != null;
   }

   /**
    * @return the signature, or null for irregular unions
    */
   public GraphSignature signature() {
      return signature;
   }

   public Map<String, Verdict> verdicts() {
      return verdicts;
   }

   public Verdict verdict(String target) {
      Verdict v = verdicts.get(target);
      return v == null ? Verdict.MISMATCH : v;
   }

   public String describeClasses() {
      return classes.toString();
   }

   @Override
   public String toString() {
      return describeClasses() + " " + (signature == null ? "irregular" : signature);
   }
}
