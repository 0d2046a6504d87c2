package io.quadrangle.group;

import com.koloboke.collect.set.hash.HashObjSet;
import com.koloboke.collect.set.hash.HashObjSets;
import io.quadrangle.exceptions.AlgebraicInconsistencyException;
import org.apache.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Permutation group given by generators. The element closure is computed
 * on first use and memoized; the group never changes afterwards, and
 * {@link #withGenerators} returns a new group instead of mutating this one.
 */
public final class PermutationGroup {
   private static final Logger LOG = Logger.getLogger(PermutationGroup.class);

   private final int degree;
   private final List<Permutation> generators;

   private volatile Set<Permutation> closure;

   private PermutationGroup(int degree, List<Permutation> generators) {
      this.degree = degree;
      this.generators = generators;
   }

   /**
    * Identities and repeated generators are dropped.
    */
   public static PermutationGroup generatedBy(int degree,
                                              Collection<Permutation> generators) {
      LinkedHashSet<Permutation> distinct = new LinkedHashSet<>();
      for (Permutation g : generators) {
         if (g.degree() != degree) {
            throw new IllegalArgumentException("Generator of degree " +
                    g.degree() + " in a group of degree " + degree);
         }
         if (!g.isIdentity()) {
            distinct.add(g);
         }
      }
      return new PermutationGroup(degree,
              Collections.unmodifiableList(new ArrayList<>(distinct)));
   }

   public static PermutationGroup trivial(int degree) {
      return new PermutationGroup(degree, Collections.emptyList());
   }

   public PermutationGroup withGenerators(Collection<Permutation> extra) {
      List<Permutation> all = new ArrayList<>(generators);
      all.addAll(extra);
      return generatedBy(degree, all);
   }

   public int degree() {
      return degree;
   }

   public List<Permutation> generators() {
      return generators;
   }

   /**
    * All elements, by breadth-first search from the identity.
    */
   public Set<Permutation> closure() {
      Set<Permutation> elements = closure;
      if (elements == null) {
         synchronized (this) {
            elements = closure;
            if (elements == null) {
               elements = computeClosure();
               closure = elements;
            }
         }
      }
      return elements;
   }

   private Set<Permutation> computeClosure() {
      long start = System.currentTimeMillis();
      HashObjSet<Permutation> elements = HashObjSets.newMutableSet();
      ArrayDeque<Permutation> queue = new ArrayDeque<>();
      Permutation identity = Permutation.identity(degree);
      elements.add(identity);
      queue.add(identity);
      while (!queue.isEmpty()) {
         Permutation current = queue.poll();
         for (Permutation g : generators) {
            Permutation next = current.then(g);
            if (elements.add(next)) {
               queue.add(next);
            }
         }
      }
      LOG.info("Closure of " + generators.size() + " generators on " + degree +
              " points: " + elements.size() + " elements in " +
              (System.currentTimeMillis() - start) + " ms");
      return Collections.unmodifiableSet(elements);
   }

   public long order() {
      return closure().size();
   }

   public boolean contains(Permutation p) {
      return p.degree() == degree && closure().contains(p);
   }

   public OrbitPartition orbits() {
      return OrbitPartition.of(degree, generators);
   }

   /**
    * Orbit of a point, sorted.
    */
   public int[] orbit(int point) {
      boolean[] seen = new boolean[degree];
      ArrayDeque<Integer> queue = new ArrayDeque<>();
      seen[point] = true;
      queue.add(point);
      int size = 1;
      while (!queue.isEmpty()) {
         int x = queue.poll();
         for (Permutation g : generators) {
            int y = g.apply(x);
            if (!seen[y]) {
               seen[y] = true;
               queue.add(y);
               size++;
            }
         }
      }
      int[] orbit = new int[size];
      int next = 0;
      for (int i = 0; i < degree; ++i) {
         if (seen[i]) {
            orbit[next++] = i;
         }
      }
      return orbit;
   }

   /**
    * Point stabilizer from Schreier generators. The result is checked
    * against the orbit-stabilizer theorem.
    *
    * @throws AlgebraicInconsistencyException if |orbit| * |stabilizer| is not
    *                                         the group order
    */
   public PermutationGroup stabilizer(int point) {
      // transversal: coset representative u_x with u_x(point) = x
      Permutation[] transversal = new Permutation[degree];
      ArrayDeque<Integer> queue = new ArrayDeque<>();
      transversal[point] = Permutation.identity(degree);
      queue.add(point);
      int orbitSize = 1;
      while (!queue.isEmpty()) {
         int x = queue.poll();
         for (Permutation g : generators) {
            int y = g.apply(x);
            if (transversal[y] == null) {
               transversal[y] = transversal[x].then(g);
               queue.add(y);
               orbitSize++;
            }
         }
      }

      LinkedHashSet<Permutation> schreier = new LinkedHashSet<>();
      for (int x = 0; x < degree; ++x) {
         if (transversal[x] == null) {
            continue;
         }
         for (Permutation g : generators) {
            int y = g.apply(x);
            Permutation s = transversal[x].then(g).then(transversal[y].inverse());
            if (!s.isIdentity()) {
               schreier.add(s);
            }
         }
      }

      PermutationGroup stabilizer = generatedBy(degree, schreier);
      long order = order();
      long stabOrder = stabilizer.order();
      if (orbitSize * stabOrder != order) {
         throw new AlgebraicInconsistencyException("Orbit-stabilizer check failed" +
                 " at point " + point + ": " + orbitSize + " * " + stabOrder +
                 " != " + order);
      }
      LOG.debug("Stabilizer of " + point + ": order " + stabOrder + ", orbit " +
              orbitSize);
      return stabilizer;
   }

   public long stabilizerOrder(int point) {
      return stabilizer(point).order();
   }

   @Override
   public String toString() {
      return "PermutationGroup{degree=" + degree + ", generators=" +
              generators.size() + (closure == null ? "" : ", order=" + closure.size()) +
              '}';
   }
}
