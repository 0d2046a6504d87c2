package io.quadrangle.util;

import com.koloboke.collect.map.ObjLongMap;
import com.koloboke.collect.map.hash.HashObjLongMaps;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Measures named stages of a run. Timings go to the log only, never into
 * invariant records, so records stay reproducible.
 */
public class StageTimer {
   private static final Logger LOG = Logger.getLogger(StageTimer.class);

   private final String name;
   private final ObjLongMap<String> started = HashObjLongMaps.newMutableMap();
   private final ObjLongMap<String> elapsed = HashObjLongMaps.newMutableMap();
   private final List<String> order = new ArrayList<>();

   /**
    * set once a stage is stopped that was never started
    */
   private boolean inconsistent;

   public StageTimer(String name) {
      this.name = name;
   }

   public synchronized void start(String stage) {
      started.put(stage, System.nanoTime());
      if (!elapsed.containsKey(stage)) {
         elapsed.put(stage, 0L);
         order.add(stage);
      }
   }

   public synchronized long stop(String stage) {
      if (!started.containsKey(stage)) {
         inconsistent = true;
         LOG.warn(name + ": stage " + stage + " stopped before started");
         return 0;
      }
      long delta = System.nanoTime() - started.removeAsLong(stage);
      elapsed.addValue(stage, delta);
      long ms = delta / 1_000_000;
      LOG.info(name + ": stage " + stage + " took " + ms + " ms");
      return ms;
   }

   public synchronized long elapsedMillis(String stage) {
      return elapsed.getOrDefault(stage, 0L) / 1_000_000;
   }

   public synchronized boolean isInconsistent() {
      return inconsistent;
   }

   @Override
   public synchronized String toString() {
      StringBuilder sb = new StringBuilder(name).append('{');
      for (int i = 0; i < order.size(); ++i) {
         if (i > 0) {
            sb.append(", ");
         }
         String stage = order.get(i);
         sb.append(stage).append('=')
                 .append(elapsed.getLong(stage) / 1_000_000).append("ms");
      }
      return sb.append('}').toString();
   }
}
