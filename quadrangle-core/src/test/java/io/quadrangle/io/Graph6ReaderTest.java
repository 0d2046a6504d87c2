package io.quadrangle.io;

import io.quadrangle.exceptions.IngestException;
import io.quadrangle.graph.Graph;
import io.quadrangle.graph.GraphInvariants;
import io.quadrangle.graph.SpectrumCalculator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Graph6ReaderTest {

   @Test
   void readsPetersenGraph() {
      Graph petersen = Graph6Reader.read("petersen", "IheA@GUAo\n");
      assertEquals("petersen", petersen.name());
      assertEquals(10, petersen.numVertices());
      assertEquals(15, petersen.numEdges());
      assertEquals("SRG(10,3,0,1)", GraphInvariants.of(petersen,
              new SpectrumCalculator(1e-6)).stronglyRegular().toString());
   }

   @Test
   void readsSmallGraphs() {
      Graph k4 = Graph6Reader.read("K4", "C~");
      assertEquals(6, k4.numEdges());
      Graph c5 = Graph6Reader.read("C5", "Dhc");
      assertEquals(2, GraphInvariants.regularDegree(c5));
   }

   @Test
   void corruptStringsAreIngestErrors() {
      IngestException e = assertThrows(IngestException.class,
              () -> Graph6Reader.read("bad", "Dh!c"));
      assertTrue(e.getMessage().contains("bad"));
   }
}
