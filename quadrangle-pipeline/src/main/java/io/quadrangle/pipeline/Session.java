package io.quadrangle.pipeline;

import io.quadrangle.conf.Configuration;
import io.quadrangle.field.FiniteField;
import io.quadrangle.geometry.AlternatingForm;
import io.quadrangle.geometry.GeneralizedQuadrangleBuilder;
import io.quadrangle.geometry.IncidenceStructure;
import io.quadrangle.geometry.PolarForm;
import io.quadrangle.geometry.QuadraticForm;
import io.quadrangle.graph.Graph;
import io.quadrangle.graph.SpectrumCalculator;
import io.quadrangle.util.InvariantCache;
import org.apache.log4j.Logger;

/**
 * Everything a pipeline run is computed from: the configuration, the
 * geometry it selects and the collinearity graph of that geometry. Sessions
 * are immutable apart from their content-addressed {@link InvariantCache},
 * which may be shared by several runs.
 */
public final class Session {
   private static final Logger LOG = Logger.getLogger(Session.class);

   public static final String FORM_SYMPLECTIC = "symplectic";
   public static final String FORM_PARABOLIC = "parabolic";
   public static final String FORM_ELLIPTIC = "elliptic";

   private final Configuration configuration;
   private final FiniteField field;
   private final PolarForm form;
   private final IncidenceStructure geometry;
   private final Graph collinearity;
   private final SpectrumCalculator spectrumCalculator;
   private final InvariantCache cache;

   private Session(Configuration configuration, FiniteField field,
                   PolarForm form, IncidenceStructure geometry,
                   InvariantCache cache) {
      this.configuration = configuration;
      this.field = field;
      this.form = form;
      this.geometry = geometry;
      this.collinearity = Graph.collinearity(geometry);
      this.spectrumCalculator = new SpectrumCalculator(configuration);
      this.cache = cache;
   }

   public static Session open(Configuration configuration) {
      return open(configuration, new InvariantCache());
   }

   /**
    * Builds the geometry named by the configuration.
    *
    * @throws IllegalArgumentException for an unknown form or a dimension the
    *                                  form does not live in
    */
   public static Session open(Configuration configuration, InvariantCache cache) {
      FiniteField field = FiniteField.of(configuration.getFieldOrder());
      PolarForm form = formFor(configuration, field);
      IncidenceStructure geometry = GeneralizedQuadrangleBuilder.build(field, form);
      LOG.info("Session on " + geometry);
      return new Session(configuration, field, form, geometry, cache);
   }

   static PolarForm formFor(Configuration configuration, FiniteField field) {
      String name = configuration.getGeometryForm();
      int dimension = configuration.getGeometryDimension();
      PolarForm form;
      switch (name) {
         case FORM_SYMPLECTIC:
            form = AlternatingForm.standard(field, dimension);
            break;
         case FORM_PARABOLIC:
            form = QuadraticForm.parabolic(field);
            break;
         case FORM_ELLIPTIC:
            form = QuadraticForm.elliptic(field);
            break;
         default:
            throw new IllegalArgumentException("Unknown " +
                    Configuration.CONF_GEOMETRY_FORM + ": " + name);
      }
      if (form.dimension() != dimension) {
         throw new IllegalArgumentException(form.name() + " lives in dimension " +
                 form.dimension() + ", but " + Configuration.CONF_GEOMETRY_DIMENSION +
                 " is " + dimension);
      }
      return form;
   }

   public Configuration configuration() {
      return configuration;
   }

   public FiniteField field() {
      return field;
   }

   public PolarForm form() {
      return form;
   }

   public IncidenceStructure geometry() {
      return geometry;
   }

   public Graph collinearity() {
      return collinearity;
   }

   public SpectrumCalculator spectrumCalculator() {
      return spectrumCalculator;
   }

   public InvariantCache cache() {
      return cache;
   }

   @Override
   public String toString() {
      return "Session{" + geometry + ", " + configuration + "}";
   }
}
