package io.quadrangle.group;

import io.quadrangle.exceptions.AlgebraicInconsistencyException;
import io.quadrangle.graph.Graph;
import org.apache.log4j.Logger;

import java.math.BigInteger;
import java.util.Collection;

/**
 * Cross-checks between independently computed group facts.
 */
public class GroupOrderCheck {
   private static final Logger LOG = Logger.getLogger(GroupOrderCheck.class);

   private GroupOrderCheck() {
   }

   public static void requireAgreement(String what, BigInteger first,
                                       BigInteger second) {
      if (!first.equals(second)) {
         throw new AlgebraicInconsistencyException("Group orders for " + what +
                 " disagree: " + first + " vs " + second);
      }
      LOG.info("Group order of " + what + " confirmed: " + first);
   }

   public static void requireAgreement(String what, BigInteger first, long second) {
      requireAgreement(what, first, BigInteger.valueOf(second));
   }

   /**
    * @throws AlgebraicInconsistencyException naming the first permutation
    *                                         that does not preserve the graph
    */
   public static void requireAutomorphisms(Graph graph,
                                           Collection<Permutation> permutations) {
      int i = 0;
      for (Permutation p : permutations) {
         if (!p.isAutomorphismOf(graph)) {
            throw new AlgebraicInconsistencyException("Permutation " + i + " " + p +
                    " is not an automorphism of " + graph.name());
         }
         i++;
      }
   }

   public static void requireAutomorphisms(Graph graph, PermutationGroup group) {
      requireAutomorphisms(graph, group.generators());
   }
}
