package io.quadrangle.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class ContentHashTest {

   @Test
   void hashIsDeterministicAndContentSensitive() {
      String a = ContentHash.builder().add(new int[][]{{1, 2}, {3}}).build();
      String b = ContentHash.builder().add(new int[][]{{1, 2}, {3}}).build();
      String c = ContentHash.builder().add(new int[][]{{1}, {2, 3}}).build();
      assertEquals(a, b);
      assertEquals(32, a.length());
      assertNotEquals(a, c, "row boundaries must change the hash");
   }

   @Test
   void recordsRenderWithFixedFormatting() {
      TreeMap<Integer, Long> weights = new TreeMap<>();
      weights.put(0, 1L);
      weights.put(6, 240L);
      InvariantRecord record = new InvariantRecord("code C")
              .put("dimension", 24)
              .put("tolerance", 1e-6)
              .put("betti", new int[]{1, 81, 0, 0})
              .put("sizes", Arrays.asList(3, 3))
              .put("weights", weights);
      assertEquals("[code C]\n" +
              "dimension = 24\n" +
              "tolerance = 0.000001\n" +
              "betti = [1, 81, 0, 0]\n" +
              "sizes = [3, 3]\n" +
              "weights = {0:1, 6:240}\n", record.render());
   }

   @Test
   void stageTimerFlagsUnbalancedStops() {
      StageTimer timer = new StageTimer("run");
      timer.start("graph");
      timer.stop("graph");
      assertFalse(timer.isInconsistent());
      assertEquals(0, timer.stop("code"));
      assertTrue(timer.isInconsistent());
      assertTrue(timer.toString().startsWith("run{graph="));
   }

   @Test
   void sortedIntersection() {
      int[] a = {1, 3, 5, 7, 9};
      int[] b = {3, 4, 5, 9, 10};
      int[] target = new int[5];
      assertEquals(3, Utils.sintersect(a, b, 0, a.length, 0, b.length, target));
      assertArrayEquals(new int[]{3, 5, 9}, Arrays.copyOf(target, 3));
      assertEquals(2, Utils.sintersect(a, b, 1, 3, 0, 3, target));
   }
}
