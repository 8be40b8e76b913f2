package io.seqgen.core.parser;

import java.util.Iterator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.events.CollectionEndEvent;
import org.yaml.snakeyaml.events.CollectionStartEvent;
import org.yaml.snakeyaml.events.Event;

/**
 * Logs every YAML event the settings parser consumes, indented by nesting depth.
 * Enabled through the <code>io.seqgen.parser.debug</code> property.
 */
class DebugIterator implements Iterator<Event> {
   private static final Logger log = LogManager.getLogger(DebugIterator.class);

   private final Iterator<Event> events;
   private int depth;

   DebugIterator(Iterator<Event> events) {
      this.events = events;
   }

   @Override
   public boolean hasNext() {
      return events.hasNext();
   }

   @Override
   public Event next() {
      Event event = events.next();
      if (event instanceof CollectionEndEvent && depth > 0) {
         --depth;
      }
      Mark mark = event.getStartMark();
      log.debug("{}{} at line {}", "| ".repeat(depth), event.getEventId(), mark == null ? "?" : mark.getLine() + 1);
      if (event instanceof CollectionStartEvent) {
         ++depth;
      }
      return event;
   }

   int depth() {
      return depth;
   }
}
