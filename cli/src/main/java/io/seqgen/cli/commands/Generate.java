package io.seqgen.cli.commands;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.aesh.command.Command;
import org.aesh.command.CommandDefinition;
import org.aesh.command.CommandResult;
import org.aesh.command.invocation.CommandInvocation;
import org.aesh.command.option.Option;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.seqgen.api.config.DiagramDefinitionException;
import io.seqgen.api.config.LayoutSettings;
import io.seqgen.api.internal.Properties;
import io.seqgen.api.render.SceneRenderer;
import io.seqgen.api.scene.SceneGraph;
import io.seqgen.api.statement.Statement;
import io.seqgen.cli.Renderers;
import io.seqgen.core.layout.StatementInterpreter;
import io.seqgen.core.parser.LayoutSettingsParser;
import io.seqgen.core.parser.ParserException;
import io.seqgen.core.parser.StatementParser;

@CommandDefinition(name = Generate.NAME, description = "Lays out a sequence diagram and writes it to a file.")
public class Generate implements Command<CommandInvocation> {
   private static final Logger log = LogManager.getLogger(Generate.class);
   public static final String NAME = "seqgen";

   @Option(shortName = 'i', name = "input", description = "Diagram source file.", required = true)
   String input;

   @Option(shortName = 'o', name = "output", description = "File to write.", required = true)
   String output;

   @Option(shortName = 'c', name = "config", description = "YAML file overriding layout settings.")
   String config;

   @Option(shortName = 'f', name = "format", description = "Output format; detected from the output file extension by default.")
   String format;

   @Option(name = "id-prefix", description = "Prefix of generated object ids; random by default.")
   String idPrefix;

   @Option(name = "print-stack-trace", description = "Print full stack trace on failure.", hasValue = false)
   boolean printStackTrace;

   @Option(shortName = 'h', hasValue = false, overrideRequired = true)
   boolean help;

   @Override
   public CommandResult execute(CommandInvocation invocation) {
      if (help) {
         invocation.println(invocation.getHelpInfo(NAME));
         return CommandResult.SUCCESS;
      }
      SceneRenderer renderer = selectRenderer();
      if (renderer == null) {
         String available = Renderers.all().stream().map(SceneRenderer::name).collect(Collectors.joining(", "));
         invocation.println("Unknown output format" + (format == null ? " for " + output : " '" + format + "'") +
               "; available formats: " + available);
         return CommandResult.FAILURE;
      }
      try {
         LayoutSettings settings = loadSettings();
         List<Statement> statements;
         try (InputStream stream = Files.newInputStream(Paths.get(input))) {
            statements = StatementParser.instance().parse(stream);
         } catch (ParserException e) {
            throw new ParserException(input + ": " + e.getMessage(), e);
         }
         SceneGraph graph = new StatementInterpreter(settings).interpret(statements);

         Map<String, String> options = new HashMap<>();
         if (idPrefix != null) {
            options.put("idPrefix", idPrefix);
         }
         ByteArrayOutputStream buffer = new ByteArrayOutputStream();
         renderer.render(graph, buffer, options);
         Path outputPath = Paths.get(output);
         Files.write(outputPath, buffer.toByteArray());
         log.info("Written {} ({} objects) to {}", input, graph.size(), outputPath);
         return CommandResult.SUCCESS;
      } catch (ParserException e) {
         return fail(invocation, "Syntax error: " + e.getMessage(), e);
      } catch (DiagramDefinitionException e) {
         return fail(invocation, "Invalid diagram " + input + ": " + e.getMessage(), e);
      } catch (IOException e) {
         return fail(invocation, "I/O error: " + e.getMessage(), e);
      }
   }

   private SceneRenderer selectRenderer() {
      if (format != null) {
         return Renderers.byName(format);
      }
      SceneRenderer renderer = Renderers.byFileName(output);
      return renderer != null ? renderer : Renderers.byName("drawio");
   }

   private LayoutSettings loadSettings() throws IOException, ParserException {
      if (config == null) {
         return LayoutSettings.DEFAULT;
      }
      try (InputStream stream = Files.newInputStream(Paths.get(config))) {
         return LayoutSettingsParser.instance().parse(stream);
      } catch (ParserException e) {
         throw new ParserException(config + ": " + e.getMessage(), e);
      }
   }

   private CommandResult fail(CommandInvocation invocation, String message, Exception e) {
      invocation.println(message);
      if (printStackTrace || Properties.getBoolean(Properties.STACKTRACE)) {
         log.error("Generating diagram failed", e);
      }
      return CommandResult.FAILURE;
   }
}
