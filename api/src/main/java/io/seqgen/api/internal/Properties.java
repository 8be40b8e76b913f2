package io.seqgen.api.internal;

import java.util.function.Function;

/**
 * Settings that can be set as a system property or as an environment variable
 * (upper-cased, non-alphanumeric characters replaced by underscores: {@code seqgen.id.prefix} is {@code SEQGEN_ID_PREFIX}).
 */
public interface Properties {
   String ID_PREFIX = "seqgen.id.prefix";
   String PARSER_DEBUG = "io.seqgen.parser.debug";
   String STACKTRACE = "io.seqgen.stacktrace";

   static String get(String property, String def) {
      return get(property, Function.identity(), def);
   }

   static boolean getBoolean(String property) {
      return get(property, Boolean::valueOf, false);
   }

   static <T> T get(String property, Function<String, T> f, T def) {
      String value = System.getProperty(property);
      if (value != null) {
         return f.apply(value);
      }
      value = System.getenv(property.replaceAll("[^a-zA-Z0-9]", "_").toUpperCase());
      if (value != null) {
         return f.apply(value);
      }
      return def;
   }
}
