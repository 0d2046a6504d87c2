package io.quadrangle.conf;

import org.apache.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.util.Properties;
import java.util.TreeSet;

/**
 * Immutable kernel configuration. Defaults live in the {@code CONF_*_DEFAULT}
 * constants, {@code quadrangle.properties} on the classpath overrides them and
 * JVM system properties with the {@code quadrangle.} prefix override both.
 */
public class Configuration implements Serializable {
   private static final Logger LOG = Logger.getLogger(Configuration.class);

   public static final String CONF_RESOURCE = "quadrangle.properties";
   public static final String CONF_PREFIX = "quadrangle.";

   public static final String CONF_FIELD_ORDER = "quadrangle.field.order";
   public static final int CONF_FIELD_ORDER_DEFAULT = 3;
   public static final String CONF_GEOMETRY_DIMENSION =
           "quadrangle.geometry.dimension";
   public static final int CONF_GEOMETRY_DIMENSION_DEFAULT = 4;
   public static final String CONF_GEOMETRY_FORM = "quadrangle.geometry.form";
   public static final String CONF_GEOMETRY_FORM_DEFAULT = "symplectic";
   public static final String CONF_SPECTRUM_TOLERANCE =
           "quadrangle.spectrum.tolerance";
   public static final double CONF_SPECTRUM_TOLERANCE_DEFAULT = 1e-6;
   public static final String CONF_AUTOMORPHISM_NODE_BUDGET =
           "quadrangle.automorphism.node_budget";
   public static final long CONF_AUTOMORPHISM_NODE_BUDGET_DEFAULT = 5_000_000L;
   public static final String CONF_SEARCH_MAX_SUBSETS =
           "quadrangle.search.max_subsets";
   public static final long CONF_SEARCH_MAX_SUBSETS_DEFAULT = 4096;
   public static final String CONF_SEARCH_WORKERS = "quadrangle.search.workers";
   public static final int CONF_SEARCH_WORKERS_DEFAULT = 4;
   public static final String CONF_CODE_ENUMERATION_LIMIT =
           "quadrangle.code.enumeration_limit";
   public static final long CONF_CODE_ENUMERATION_LIMIT_DEFAULT = 1L << 24;
   public static final String CONF_HOMOLOGY_MAX_DIMENSION =
           "quadrangle.homology.max_dimension";
   public static final int CONF_HOMOLOGY_MAX_DIMENSION_DEFAULT = 3;
   public static final String CONF_HOMOLOGY_CROSS_CHECK_FIELD =
           "quadrangle.homology.cross_check_field";
   public static final int CONF_HOMOLOGY_CROSS_CHECK_FIELD_DEFAULT = 2;

   private final Properties properties;

   protected Configuration(Properties properties) {
      this.properties = properties;
   }

   /**
    * Defaults only, ignoring classpath resources and system properties.
    */
   public static Configuration defaults() {
      return new Configuration(new Properties());
   }

   public static Configuration fromProperties(Properties properties) {
      Properties copy = new Properties();
      copy.putAll(properties);
      return new Configuration(copy);
   }

   /**
    * Classpath resource first, then system property overrides.
    */
   public static Configuration load() {
      Properties properties = new Properties();
      ClassLoader loader = Configuration.class.getClassLoader();
      try (InputStream is = loader.getResourceAsStream(CONF_RESOURCE)) {
         if (is != null) {
            properties.load(is);
            LOG.info("Loaded " + CONF_RESOURCE + " from classpath");
         } else {
            LOG.info(CONF_RESOURCE + " not found, using defaults");
         }
      } catch (IOException e) {
         throw new IllegalStateException("Could not read " + CONF_RESOURCE, e);
      }

      for (String key : System.getProperties().stringPropertyNames()) {
         if (key.startsWith(CONF_PREFIX)) {
            properties.setProperty(key, System.getProperty(key));
         }
      }

      return new Configuration(properties);
   }

   /**
    * @return a copy of this configuration with one key replaced
    */
   public Configuration with(String key, Object value) {
      Properties copy = new Properties();
      copy.putAll(properties);
      copy.setProperty(key, String.valueOf(value));
      return new Configuration(copy);
   }

   public String getString(String key, String defaultValue) {
      String value = properties.getProperty(key);
      return value == null ? defaultValue : value.trim();
   }

   public Integer getInteger(String key, Integer defaultValue) {
      String value = getString(key, null);
      if (value == null) {
         return defaultValue;
      }
      try {
         return Integer.parseInt(value);
      } catch (NumberFormatException e) {
         throw new IllegalArgumentException(
                 "Invalid integer for " + key + ": " + value, e);
      }
   }

   public Long getLong(String key, Long defaultValue) {
      String value = getString(key, null);
      if (value == null) {
         return defaultValue;
      }
      try {
         return Long.parseLong(value);
      } catch (NumberFormatException e) {
         throw new IllegalArgumentException(
                 "Invalid long for " + key + ": " + value, e);
      }
   }

   public Double getDouble(String key, Double defaultValue) {
      String value = getString(key, null);
      if (value == null) {
         return defaultValue;
      }
      try {
         return Double.parseDouble(value);
      } catch (NumberFormatException e) {
         throw new IllegalArgumentException(
                 "Invalid double for " + key + ": " + value, e);
      }
   }

   public Boolean getBoolean(String key, Boolean defaultValue) {
      String value = getString(key, null);
      return value == null ? defaultValue : Boolean.parseBoolean(value);
   }

   public int getFieldOrder() {
      return getInteger(CONF_FIELD_ORDER, CONF_FIELD_ORDER_DEFAULT);
   }

   public int getGeometryDimension() {
      return getInteger(CONF_GEOMETRY_DIMENSION, CONF_GEOMETRY_DIMENSION_DEFAULT);
   }

   public String getGeometryForm() {
      return getString(CONF_GEOMETRY_FORM, CONF_GEOMETRY_FORM_DEFAULT);
   }

   public double getSpectrumTolerance() {
      return getDouble(CONF_SPECTRUM_TOLERANCE, CONF_SPECTRUM_TOLERANCE_DEFAULT);
   }

   public long getAutomorphismNodeBudget() {
      return getLong(CONF_AUTOMORPHISM_NODE_BUDGET,
              CONF_AUTOMORPHISM_NODE_BUDGET_DEFAULT);
   }

   public long getSearchMaxSubsets() {
      return getLong(CONF_SEARCH_MAX_SUBSETS, CONF_SEARCH_MAX_SUBSETS_DEFAULT);
   }

   public int getSearchWorkers() {
      int workers = getInteger(CONF_SEARCH_WORKERS, CONF_SEARCH_WORKERS_DEFAULT);
      return workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
   }

   public long getCodeEnumerationLimit() {
      return getLong(CONF_CODE_ENUMERATION_LIMIT,
              CONF_CODE_ENUMERATION_LIMIT_DEFAULT);
   }

   public int getHomologyMaxDimension() {
      return getInteger(CONF_HOMOLOGY_MAX_DIMENSION,
              CONF_HOMOLOGY_MAX_DIMENSION_DEFAULT);
   }

   public int getHomologyCrossCheckField() {
      return getInteger(CONF_HOMOLOGY_CROSS_CHECK_FIELD,
              CONF_HOMOLOGY_CROSS_CHECK_FIELD_DEFAULT);
   }

   @Override
   public String toString() {
      StringBuilder sb = new StringBuilder("Configuration{");
      boolean first = true;
      for (String key : new TreeSet<>(properties.stringPropertyNames())) {
         if (!first) {
            sb.append(", ");
         }
         sb.append(key).append('=').append(properties.getProperty(key));
         first = false;
      }
      return sb.append('}').toString();
   }
}
