package io.seqgen.core.parser;

import java.util.Iterator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.MappingEndEvent;
import org.yaml.snakeyaml.events.MappingStartEvent;
import org.yaml.snakeyaml.events.ScalarEvent;
import org.yaml.snakeyaml.events.SequenceEndEvent;
import org.yaml.snakeyaml.events.SequenceStartEvent;

public class Context {
   private final Iterator<Event> events;
   private Event peeked;

   Context(Iterator<Event> events) {
      this.events = events;
   }

   private ParserException transformException(MarkedYAMLException e) {
      if (e.getProblemMark() == null) {
         return new ParserException("YAML is malformed: " + e.getProblem(), e);
      }
      return new ParserException(e.getProblemMark().getLine() + 1, e.getProblemMark().getColumn() + 1,
            "YAML is malformed: " + e.getProblem(), e);
   }

   private String translate(Class<? extends Event> clazz) {
      if (clazz == MappingStartEvent.class) {
         return "<start of mapping>";
      } else if (clazz == MappingEndEvent.class) {
         return "<end of mapping>";
      } else if (clazz == SequenceStartEvent.class) {
         return "<start of sequence>";
      } else if (clazz == SequenceEndEvent.class) {
         return "<end of sequence>";
      } else if (clazz == ScalarEvent.class) {
         return "<scalar value>";
      }
      return clazz.getSimpleName();
   }

   public boolean hasNext() throws ParserException {
      if (peeked != null) {
         return true;
      }
      try {
         return events.hasNext();
      } catch (MarkedYAMLException e) {
         throw transformException(e);
      }
   }

   public Event next() throws ParserException {
      if (peeked == null) {
         try {
            return events.next();
         } catch (MarkedYAMLException e) {
            throw transformException(e);
         }
      } else {
         Event tmp = peeked;
         peeked = null;
         return tmp;
      }
   }

   public Event peek() throws ParserException {
      if (peeked == null) {
         peeked = next();
      }
      return peeked;
   }

   public <E extends Event> E expectEvent(Class<E> eventClazz) throws ParserException {
      if (hasNext()) {
         Event event = next();
         if (!eventClazz.isInstance(event)) {
            throw new ParserException(event,
                  "Expected " + translate(eventClazz) + ", got " + translate(event.getClass()) + ": " + event);
         }
         @SuppressWarnings("unchecked")
         E expectedEvent = (E) event;
         return expectedEvent;
      } else {
         throw noMoreEvents(eventClazz);
      }
   }

   @SafeVarargs
   public final ParserException noMoreEvents(Class<? extends Event>... eventClazzes) {
      String expected = Stream.of(eventClazzes).map(this::translate).collect(Collectors.joining(", "));
      return new ParserException("Expected one of [" + expected + "] but there are no more events.");
   }

   public ParserException unexpectedEvent(Event event) {
      return new ParserException(event, "Unexpected " + translate(event.getClass()) + ": " + event);
   }

   public <S> void parseMapping(S target, BuilderProvider<S> builderProvider) throws ParserException {
      expectEvent(MappingStartEvent.class);
      while (hasNext()) {
         Event next = next();
         if (next instanceof MappingEndEvent) {
            return;
         } else if (next instanceof ScalarEvent) {
            ScalarEvent event = (ScalarEvent) next;
            Parser<S> builder = builderProvider.apply(event);
            builder.parse(this, target);
         } else {
            throw unexpectedEvent(next);
         }
      }
      throw noMoreEvents(MappingEndEvent.class);
   }

   @FunctionalInterface
   public interface BuilderProvider<S> {
      Parser<S> apply(ScalarEvent event) throws ParserException;
   }
}
