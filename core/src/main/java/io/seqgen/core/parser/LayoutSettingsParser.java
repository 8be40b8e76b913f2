package io.seqgen.core.parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.events.DocumentEndEvent;
import org.yaml.snakeyaml.events.DocumentStartEvent;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.ScalarEvent;
import org.yaml.snakeyaml.events.StreamEndEvent;
import org.yaml.snakeyaml.events.StreamStartEvent;

import io.seqgen.api.config.DiagramDefinitionException;
import io.seqgen.api.config.LayoutSettings;
import io.seqgen.api.internal.Properties;

/**
 * Reads {@link LayoutSettings} overrides from a flat YAML mapping, e.g.
 * <pre>
 * participantWidth: 200
 * participantSpacing: 60
 * </pre>
 * Properties not present in the file keep their default values.
 */
public class LayoutSettingsParser extends AbstractParser<LayoutSettings.Builder, LayoutSettings.Builder> {
   private static final Logger log = LogManager.getLogger(LayoutSettingsParser.class);
   private static final LayoutSettingsParser INSTANCE = new LayoutSettingsParser();
   private static final boolean DEBUG_PARSER = Properties.getBoolean(Properties.PARSER_DEBUG);

   public static LayoutSettingsParser instance() {
      return INSTANCE;
   }

   private LayoutSettingsParser() {
      register("participantWidth", new PropertyParser.Int<>(LayoutSettings.Builder::participantWidth));
      register("participantSpacing", new PropertyParser.Int<>(LayoutSettings.Builder::participantSpacing));
      register("laneHeaderHeight", new PropertyParser.Int<>(LayoutSettings.Builder::laneHeaderHeight));
      register("statementOffset", new PropertyParser.Int<>(LayoutSettings.Builder::statementOffset));
      register("endOffset", new PropertyParser.Int<>(LayoutSettings.Builder::endOffset));
      register("messageMinSpacing", new PropertyParser.Int<>(LayoutSettings.Builder::messageMinSpacing));
      register("messageAnchorOffset", new PropertyParser.Int<>(LayoutSettings.Builder::messageAnchorOffset));
      register("textLineHeight", new PropertyParser.Int<>(LayoutSettings.Builder::textLineHeight));
      register("activationWidth", new PropertyParser.Int<>(LayoutSettings.Builder::activationWidth));
      register("activationStackOffset", new PropertyParser.Int<>(LayoutSettings.Builder::activationStackOffset));
      register("selfCallWidth", new PropertyParser.Int<>(LayoutSettings.Builder::selfCallWidth));
      register("frameTabWidth", new PropertyParser.Int<>(LayoutSettings.Builder::frameTabWidth));
      register("frameTabHeight", new PropertyParser.Int<>(LayoutSettings.Builder::frameTabHeight));
      register("frameLabelHeight", new PropertyParser.Int<>(LayoutSettings.Builder::frameLabelHeight));
      register("framePadding", new PropertyParser.Int<>(LayoutSettings.Builder::framePadding));
      register("branchLabelHeight", new PropertyParser.Int<>(LayoutSettings.Builder::branchLabelHeight));
      register("noteWidth", new PropertyParser.Int<>(LayoutSettings.Builder::noteWidth));
      register("noteHeight", new PropertyParser.Int<>(LayoutSettings.Builder::noteHeight));
      register("titleWidth", new PropertyParser.Int<>(LayoutSettings.Builder::titleWidth));
      register("titleHeight", new PropertyParser.Int<>(LayoutSettings.Builder::titleHeight));
      register("titlePadding", new PropertyParser.Int<>(LayoutSettings.Builder::titlePadding));
      register("edgeMargin", new PropertyParser.Int<>(LayoutSettings.Builder::edgeMargin));
   }

   @Override
   public void parse(Context ctx, LayoutSettings.Builder target) throws ParserException {
      callSubBuilders(ctx, target);
   }

   public LayoutSettings parse(InputStream stream) throws ParserException, IOException {
      return parse(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
   }

   public LayoutSettings parse(String source) throws ParserException {
      Yaml yaml = new Yaml();
      Iterator<Event> events = yaml.parse(new StringReader(source)).iterator();
      if (DEBUG_PARSER) {
         events = new DebugIterator(events);
      }
      Context ctx = new Context(events);
      LayoutSettings.Builder builder = LayoutSettings.builder();

      ctx.expectEvent(StreamStartEvent.class);
      if (ctx.peek() instanceof StreamEndEvent) {
         log.warn("Layout settings file is empty, using defaults.");
         return builder.build();
      }
      ctx.expectEvent(DocumentStartEvent.class);
      Event first = ctx.peek();
      if (first instanceof ScalarEvent && ((ScalarEvent) first).getValue().isEmpty()) {
         // document with comments only
         ctx.next();
      } else {
         parse(ctx, builder);
      }
      ctx.expectEvent(DocumentEndEvent.class);
      if (!(ctx.peek() instanceof StreamEndEvent)) {
         throw new ParserException(ctx.peek(), "Layout settings must be a single YAML document.");
      }
      try {
         return builder.build();
      } catch (DiagramDefinitionException e) {
         throw new ParserException("Invalid layout settings: " + e.getMessage(), e);
      }
   }
}
