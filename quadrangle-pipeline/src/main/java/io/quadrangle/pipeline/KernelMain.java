package io.quadrangle.pipeline;

import io.quadrangle.conf.Configuration;
import io.quadrangle.exceptions.KernelException;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Runs the pipeline on the configured geometry and prints the rendered
 * records, or writes them to the file given as the only argument. Settings
 * come from {@code quadrangle.properties} and {@code -Dquadrangle.*} system
 * properties.
 */
public class KernelMain {
   private static final Logger LOG = Logger.getLogger(KernelMain.class);

   public static void main(String[] args) throws IOException {
      if (args.length > 1) {
         System.out.println(
                 "Usage: java io.quadrangle.pipeline.KernelMain [outputFile]");
         System.exit(1);
      }

      Configuration configuration = Configuration.load();
      LOG.info("Starting with " + configuration);

      PipelineResult result;
      try {
         result = new KernelPipeline(Session.open(configuration)).run();
      } catch (KernelException e) {
         LOG.error("Pipeline failed: " + e.getMessage(), e);
         System.exit(2);
         return;
      }

      String rendered = result.render();
      if (args.length == 1) {
         File output = new File(args[0]);
         FileUtils.writeStringToFile(output, rendered, StandardCharsets.UTF_8);
         LOG.info("Wrote " + result.records().size() + " records to " +
                 output.getAbsolutePath());
      } else {
         System.out.print(rendered);
      }
      LOG.info(result.timer());
   }
}
