package io.quadrangle.search;

import io.quadrangle.util.InvariantRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a {@link CorrespondenceSearch}. {@link Status#NO_CORRESPONDENCE}
 * is a valid, complete answer; {@link Status#SEARCH_INCOMPLETE} means the
 * subset cap cut the search short and nothing matched in the part seen.
 */
public final class CorrespondenceReport {

   public enum Status {
      MATCH_FOUND,
      NO_CORRESPONDENCE,
      SEARCH_INCOMPLETE
   }

   /**
    * A candidate paired with one target it was compared to.
    */
   public static final class Comparison {
      private final CandidateEvaluation candidate;
      private final TargetSignature target;

      Comparison(CandidateEvaluation candidate, TargetSignature target) {
         this.candidate = candidate;
         this.target = target;
      }

      public CandidateEvaluation candidate() {
         return candidate;
      }

      public TargetSignature target() {
         return target;
      }

      @Override
      public String toString() {
         return candidate.describeClasses() + " vs " + target.name() + ": " +
                 candidate.signature() + " | " + target.signature();
      }
   }

   private final String classifier;
   private final RelationClassification classification;
   private final List<TargetSignature> targets;
   private final long totalSubsets;
   private final List<CandidateEvaluation> evaluations;
   private final List<Comparison> matches;
   private final List<Comparison> nearMatches;

   CorrespondenceReport(String classifier, RelationClassification classification,
                        List<TargetSignature> targets, long totalSubsets,
                        List<CandidateEvaluation> evaluations) {
      this.classifier = classifier;
      this.classification = classification;
      this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
      this.totalSubsets = totalSubsets;
      this.evaluations = Collections.unmodifiableList(evaluations);
      this.matches = new ArrayList<>();
      this.nearMatches = new ArrayList<>();
      for (CandidateEvaluation e : evaluations) {
         for (TargetSignature t : targets) {
            Verdict v = e.verdict(t.name());
            if (v == Verdict.MATCH) {
               matches.add(new Comparison(e, t));
            } else if (v == Verdict.NEAR_MATCH) {
               nearMatches.add(new Comparison(e, t));
            }
         }
      }
   }

   public Status status() {
      if (!matches.isEmpty()) {
         return Status.MATCH_FOUND;
      }
      return isComplete() ? Status.NO_CORRESPONDENCE : Status.SEARCH_INCOMPLETE;
   }

   public boolean isComplete() {
      return evaluations.size() == totalSubsets;
   }

   public RelationClassification classification() {
      return classification;
   }

   public List<TargetSignature> targets() {
      return targets;
   }

   /**
    * @return 2^classes - 1, or Long.MAX_VALUE when that overflows
    */
   public long totalSubsets() {
      return totalSubsets;
   }

   public long evaluatedSubsets() {
      return evaluations.size();
   }

   public List<CandidateEvaluation> evaluations() {
      return evaluations;
   }

   public List<Comparison> matches() {
      return Collections.unmodifiableList(matches);
   }

   public List<Comparison> nearMatches() {
      return Collections.unmodifiableList(nearMatches);
   }

   public long regularCandidates() {
      return evaluations.stream().filter(CandidateEvaluation::isRegular).count();
   }

   public InvariantRecord toRecord() {
      List<String> classSizes = new ArrayList<>();
      for (int i = 0; i < classification.numClasses(); ++i) {
         classSizes.add(classification.relationClass(i) + ":" +
                 classification.classSize(i));
      }
      List<String> targetNames = new ArrayList<>();
      for (TargetSignature t : targets) {
         targetNames.add(t.toString());
      }
      List<String> matchLines = new ArrayList<>();
      for (Comparison c : matches) {
         matchLines.add(c.toString());
      }
      List<String> nearLines = new ArrayList<>();
      for (Comparison c : nearMatches) {
         nearLines.add(c.toString());
      }
      return new InvariantRecord("correspondence " + classifier)
              .put("classes", classSizes)
              .put("targets", targetNames)
              .put("subsets.total", totalSubsets)
              .put("subsets.evaluated", evaluations.size())
              .put("subsets.regular", regularCandidates())
              .put("complete", isComplete())
              .put("status", status())
              .put("matches", matchLines)
              .put("near_matches", nearLines);
   }

   @Override
   public String toString() {
      return "CorrespondenceReport{" + classifier + ", status=" + status() +
              ", matches=" + matches.size() + ", nearMatches=" +
              nearMatches.size() + '}';
   }
}
