package io.seqgen.drawio;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * draw.io cell style: <code>key=value;</code> pairs and bare <code>flag;</code> entries, in insertion order.
 */
class Style {
   private final Map<String, String> entries = new LinkedHashMap<>();

   Style flag(String name) {
      entries.put(name, null);
      return this;
   }

   Style set(String key, String value) {
      entries.put(key, value);
      return this;
   }

   Style set(String key, double value) {
      return set(key, DrawioWriter.number(value));
   }

   @Override
   public String toString() {
      StringBuilder sb = new StringBuilder();
      for (Map.Entry<String, String> entry : entries.entrySet()) {
         sb.append(entry.getKey());
         if (entry.getValue() != null) {
            sb.append('=').append(entry.getValue());
         }
         sb.append(';');
      }
      return sb.toString();
   }
}
