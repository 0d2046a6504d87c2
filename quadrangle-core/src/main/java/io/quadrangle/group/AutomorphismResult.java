package io.quadrangle.group;

import io.quadrangle.util.InvariantRecord;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of an {@link AutomorphismSearch}. An exhausted search carries no
 * group and no order: it is "search exhausted without conclusion", never a
 * partial answer.
 */
public final class AutomorphismResult {

   public enum Status {
      COMPLETE,
      EXHAUSTED
   }

   private final String graphName;
   private final int degree;
   private final Status status;
   private final BigInteger order;
   private final List<Permutation> generators;
   private final int[] base;
   private final int[] orbitLengths;
   private final long nodesVisited;
   private final long nodeBudget;

   AutomorphismResult(String graphName, int degree, Status status,
                      BigInteger order, List<Permutation> generators, int[] base,
                      int[] orbitLengths, long nodesVisited, long nodeBudget) {
      this.graphName = graphName;
      this.degree = degree;
      this.status = status;
      this.order = order;
      this.generators = Collections.unmodifiableList(generators);
      this.base = base;
      this.orbitLengths = orbitLengths;
      this.nodesVisited = nodesVisited;
      this.nodeBudget = nodeBudget;
   }

   public Status status() {
      return status;
   }

   public boolean isComplete() {
      return status == Status.COMPLETE;
   }

   /**
    * @throws IllegalStateException if the search was exhausted
    */
   public BigInteger order() {
      requireComplete();
      return order;
   }

   /**
    * Strong generating set relative to {@link #base()}.
    */
   public List<Permutation> generators() {
      requireComplete();
      return generators;
   }

   public int[] base() {
      requireComplete();
      return base.clone();
   }

   public int[] orbitLengths() {
      requireComplete();
      return orbitLengths.clone();
   }

   public PermutationGroup group() {
      requireComplete();
      return PermutationGroup.generatedBy(degree, generators);
   }

   public long nodesVisited() {
      return nodesVisited;
   }

   public long nodeBudget() {
      return nodeBudget;
   }

   private void requireComplete() {
      if (status != Status.COMPLETE) {
         throw new IllegalStateException("Automorphism search on " + graphName +
                 " exhausted its budget of " + nodeBudget + " nodes");
      }
   }

   public InvariantRecord toRecord() {
      InvariantRecord record = new InvariantRecord("automorphisms " + graphName)
              .put("status", status)
              .put("node_budget", nodeBudget);
      if (isComplete()) {
         record.put("order", order)
                 .put("base", base)
                 .put("orbit_lengths", orbitLengths)
                 .put("strong_generators", generators.size())
                 .put("nodes", nodesVisited);
      }
      return record;
   }

   @Override
   public String toString() {
      return isComplete() ? "Aut(" + graphName + ") of order " + order :
              "Aut(" + graphName + ") search exhausted after " + nodesVisited +
                      " nodes";
   }
}
