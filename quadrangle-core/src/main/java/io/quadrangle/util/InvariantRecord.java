package io.quadrangle.util;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Ordered, self-describing key/value record of computed invariants. Values
 * are rendered when put, with a fixed locale and fixed decimal precision, so
 * two records built from the same facts render to identical text.
 */
public final class InvariantRecord {

   private final String name;
   private final LinkedHashMap<String, String> entries = new LinkedHashMap<>();

   public InvariantRecord(String name) {
      this.name = name;
   }

   public String name() {
      return name;
   }

   public InvariantRecord put(String key, Object value) {
      entries.put(key, format(value));
      return this;
   }

   public String get(String key) {
      return entries.get(key);
   }

   public Map<String, String> entries() {
      return Collections.unmodifiableMap(entries);
   }

   public static String format(Object value) {
      if (value == null) {
         return "null";
      } else if (value instanceof Double || value instanceof Float) {
         return String.format(Locale.ROOT, "%.6f", ((Number) value).doubleValue());
      } else if (value instanceof int[]) {
         return Arrays.toString((int[]) value);
      } else if (value instanceof long[]) {
         return Arrays.toString((long[]) value);
      } else if (value instanceof double[]) {
         StringBuilder sb = new StringBuilder("[");
         double[] values = (double[]) value;
         for (int i = 0; i < values.length; ++i) {
            if (i > 0) {
               sb.append(", ");
            }
            sb.append(format(values[i]));
         }
         return sb.append(']').toString();
      } else if (value instanceof Collection) {
         StringBuilder sb = new StringBuilder("[");
         boolean first = true;
         for (Object o : (Collection<?>) value) {
            if (!first) {
               sb.append(", ");
            }
            sb.append(format(o));
            first = false;
         }
         return sb.append(']').toString();
      } else if (value instanceof Map) {
         StringBuilder sb = new StringBuilder("{");
         boolean first = true;
         for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
            if (!first) {
               sb.append(", ");
            }
            sb.append(format(e.getKey())).append(':').append(format(e.getValue()));
            first = false;
         }
         return sb.append('}').toString();
      }
      return value.toString();
   }

   public String render() {
      StringBuilder sb = new StringBuilder();
      sb.append('[').append(name).append(']').append('\n');
      for (Map.Entry<String, String> e : entries.entrySet()) {
         sb.append(e.getKey()).append(" = ").append(e.getValue()).append('\n');
      }
      return sb.toString();
   }

   @Override
   public String toString() {
      return render();
   }
}
