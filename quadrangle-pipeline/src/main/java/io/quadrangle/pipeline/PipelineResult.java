package io.quadrangle.pipeline;

import io.quadrangle.util.InvariantRecord;
import io.quadrangle.util.StageTimer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Records of one pipeline run, grouped by stage in execution order. Timings
 * stay in the {@link StageTimer} and never reach {@link #render()}.
 */
public final class PipelineResult {

   private final LinkedHashMap<String, List<InvariantRecord>> stages =
           new LinkedHashMap<>();
   private final StageTimer timer;

   PipelineResult(StageTimer timer) {
      this.timer = timer;
   }

   void add(String stage, InvariantRecord record) {
      stages.computeIfAbsent(stage, s -> new ArrayList<>()).add(record);
   }

   public Set<String> stageNames() {
      return Collections.unmodifiableSet(stages.keySet());
   }

   public List<InvariantRecord> stage(String stage) {
      List<InvariantRecord> records = stages.get(stage);
      if (records == null) {
         throw new IllegalArgumentException("No stage " + stage + " in " +
                 stages.keySet());
      }
      return Collections.unmodifiableList(records);
   }

   public List<InvariantRecord> records() {
      List<InvariantRecord> all = new ArrayList<>();
      for (List<InvariantRecord> records : stages.values()) {
         all.addAll(records);
      }
      return all;
   }

   public StageTimer timer() {
      return timer;
   }

   /**
    * All records, one blank line apart.
    */
   public String render() {
      StringBuilder sb = new StringBuilder();
      for (Map.Entry<String, List<InvariantRecord>> e : stages.entrySet()) {
         for (InvariantRecord record : e.getValue()) {
            if (sb.length() > 0) {
               sb.append('\n');
            }
            sb.append(record.render());
         }
      }
      return sb.toString();
   }

   @Override
   public String toString() {
      return "PipelineResult{stages=" + stages.keySet() + ", " + timer + "}";
   }
}
