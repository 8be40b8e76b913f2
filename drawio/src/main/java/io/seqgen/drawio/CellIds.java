package io.seqgen.drawio;

import java.util.concurrent.ThreadLocalRandom;

import io.seqgen.api.internal.Properties;

/**
 * Cell ids are a counter behind a per-document prefix. A random prefix keeps ids of regenerated files distinct
 * (draw.io live reload gets confused when an id changes the kind of its object); a fixed one makes output reproducible.
 */
class CellIds {
   static final String OPTION = "idPrefix";

   private final String prefix;
   private int next = 1;

   CellIds(String prefix) {
      this.prefix = prefix;
   }

   static String resolvePrefix(String option) {
      if (option != null) {
         return option;
      }
      return Properties.get(Properties.ID_PREFIX, randomPrefix());
   }

   private static String randomPrefix() {
      return String.format("%08x-", ThreadLocalRandom.current().nextInt());
   }

   String next() {
      return prefix + next++;
   }
}
