package io.quadrangle.code;

import io.quadrangle.exceptions.AlgebraicInconsistencyException;
import io.quadrangle.field.FiniteField;
import io.quadrangle.geometry.IncidenceStructure;
import io.quadrangle.linalg.FieldMatrix;
import io.quadrangle.linalg.LinearAlgebra;
import io.quadrangle.util.InvariantRecord;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Linear code given by a generator matrix whose rank equals the declared
 * dimension.
 */
public final class LinearCode {
   private static final Logger LOG = Logger.getLogger(LinearCode.class);

   private final String name;
   private final FieldMatrix generator;
   private final FieldMatrix parityCheck;
   private final int dimension;

   private WeightDistribution distribution;
   private long distributionLimit = -1;

   private LinearCode(String name, FieldMatrix generator,
                      FieldMatrix parityCheck, int dimension) {
      this.name = name;
      this.generator = generator;
      this.parityCheck = parityCheck;
      this.dimension = dimension;
   }

   /**
    * @throws AlgebraicInconsistencyException if the generator rank is not
    *                                         {@code declaredDimension}
    */
   public static LinearCode of(String name, FieldMatrix generator,
                               int declaredDimension) {
      int rank = LinearAlgebra.rank(generator);
      if (rank != declaredDimension) {
         throw new AlgebraicInconsistencyException("Code " + name + " declared " +
                 "with dimension " + declaredDimension + " but its generator has rank " +
                 rank);
      }
      return new LinearCode(name, LinearAlgebra.rowSpaceBasis(generator), null,
              declaredDimension);
   }

   /**
    * The code {x : Hx = 0}.
    */
   public static LinearCode kernelCode(String name, FieldMatrix parityCheck) {
      FieldMatrix basis = LinearAlgebra.kernelBasis(parityCheck);
      LOG.info("Kernel code " + name + ": [" + parityCheck.cols() + "," +
              basis.rows() + "] over " + parityCheck.field());
      return new LinearCode(name, basis, parityCheck, basis.rows());
   }

   /**
    * Binary words l1 + l2 for every pair of distinct lines meeting in a
    * point, one row per pair, ordered by point and then by line index.
    */
   public static FieldMatrix linePairWords(IncidenceStructure structure) {
      int n = structure.numPoints();
      List<int[]> words = new ArrayList<>();
      for (int p = 0; p < n; ++p) {
         int[] through = structure.linesThrough(p);
         for (int i = 0; i < through.length; ++i) {
            for (int j = i + 1; j < through.length; ++j) {
               int[] word = new int[n];
               for (int x : structure.line(through[i])) {
                  word[x] ^= 1;
               }
               for (int x : structure.line(through[j])) {
                  word[x] ^= 1;
               }
               words.add(word);
            }
         }
      }
      return FieldMatrix.of(FiniteField.of(2), n, words.toArray(new int[0][]));
   }

   public String name() {
      return name;
   }

   public FiniteField field() {
      return generator.field();
   }

   public int length() {
      return generator.cols();
   }

   public int dimension() {
      return dimension;
   }

   public FieldMatrix generator() {
      return generator;
   }

   public boolean contains(int[] word) {
      if (word.length != length()) {
         return false;
      }
      if (parityCheck != null) {
         for (int x : parityCheck.multiply(word)) {
            if (x != 0) {
               return false;
            }
         }
         return true;
      }
      return LinearAlgebra.inRowSpace(generator, word);
   }

   /**
    * Whether every row of {@code words} is a codeword and together they span
    * the whole code.
    */
   public boolean isSpannedBy(FieldMatrix words) {
      if (!words.field().equals(field())) {
         return false;
      }
      for (int i = 0; i < words.rows(); ++i) {
         if (!contains(words.row(i))) {
            LOG.debug("Word " + i + " is not in " + name);
            return false;
         }
      }
      return LinearAlgebra.rank(words) == dimension;
   }

   public synchronized WeightDistribution weightDistribution(long limit) {
      if (distribution == null || (!distribution.isEnumerated() &&
              limit > distributionLimit)) {
         distribution = WeightEnumerator.enumerate(generator, limit);
         distributionLimit = limit;
      }
      return distribution;
   }

   /**
    * Checks a minimum weight claim against the full enumeration.
    *
    * @return true if verified, false when the code is too large to enumerate
    * @throws AlgebraicInconsistencyException when the claim is wrong
    */
   public boolean verifyMinimumWeight(int claimedWeight, long claimedCount,
                                      long limit) {
      WeightDistribution wd = weightDistribution(limit);
      if (!wd.isEnumerated()) {
         LOG.warn("Minimum weight of " + name + " not verified: " + wd);
         return false;
      }
      if (wd.minimumWeight() != claimedWeight ||
              wd.count(claimedWeight) != claimedCount) {
         throw new AlgebraicInconsistencyException("Code " + name +
                 " claimed minimum weight " + claimedWeight + " with " +
                 claimedCount + " words, enumeration found " + wd.minimumWeight() +
                 " with " + wd.count(wd.minimumWeight()));
      }
      return true;
   }

   public InvariantRecord toRecord(long limit) {
      InvariantRecord record = new InvariantRecord("code " + name)
              .put("field", field())
              .put("length", length())
              .put("dimension", dimension);
      WeightDistribution wd = weightDistribution(limit);
      record.put("weights.enumerated", wd.isEnumerated());
      if (wd.isEnumerated()) {
         record.put("minimum_weight", wd.minimumWeight())
                 .put("minimum_weight.count", wd.count(wd.minimumWeight()))
                 .put("weights", wd.nonZeroCounts());
      }
      return record;
   }

   @Override
   public String toString() {
      return name + "[" + length() + "," + dimension + "]_" + field().order() +
              (parityCheck == null ? "" : " kernel of " + parityCheck);
   }
}
