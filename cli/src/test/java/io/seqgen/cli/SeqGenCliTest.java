package io.seqgen.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.aesh.command.CommandResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class SeqGenCliTest {
   private static final int SUCCESS = CommandResult.SUCCESS.getResultValue();

   @TempDir
   Path dir;

   private Path write(String name, String... lines) throws IOException {
      Path file = dir.resolve(name);
      Files.write(file, String.join("\n", lines).getBytes(StandardCharsets.UTF_8));
      return file;
   }

   private static int run(String... args) {
      return new SeqGenCli().mainMethod(args);
   }

   @Test
   public void testGenerate() throws IOException {
      Path input = write("order.seq",
            "title Order",
            "participant Client",
            "participant Server",
            "Client ->+ Server: place order",
            "Server -->>- Client: confirmation");
      Path output = dir.resolve("order.drawio");

      assertThat(run("-i", input.toString(), "-o", output.toString(), "--id-prefix", "x-")).isEqualTo(SUCCESS);
      String xml = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
      assertThat(xml).contains("<mxfile", "id=\"x-1\"", "value=\"Client\"", "value=\"place order\"");
   }

   @Test
   public void testOutputIsReproducibleWithPrefix() throws IOException {
      Path input = write("a.seq", "participant A", "activate A", "deactivate A");
      Path first = dir.resolve("first.drawio");
      Path second = dir.resolve("second.drawio");
      assertThat(run("--input", input.toString(), "--output", first.toString(), "--id-prefix", "p-")).isEqualTo(SUCCESS);
      assertThat(run("--input", input.toString(), "--output", second.toString(), "--id-prefix", "p-")).isEqualTo(SUCCESS);
      assertThat(Files.readAllBytes(second)).isEqualTo(Files.readAllBytes(first));
   }

   @Test
   public void testConfig() throws IOException {
      Path input = write("a.seq", "participant A");
      Path config = write("layout.yaml", "participantWidth: 123");
      Path output = dir.resolve("a.drawio");
      assertThat(run("-i", input.toString(), "-o", output.toString(), "-c", config.toString())).isEqualTo(SUCCESS);
      assertThat(new String(Files.readAllBytes(output), StandardCharsets.UTF_8)).contains("width=\"123\"");
   }

   @Test
   public void testFormatOption() throws IOException {
      Path input = write("a.seq", "participant A");
      Path output = dir.resolve("diagram.xml");
      assertThat(run("-i", input.toString(), "-o", output.toString(), "-f", "drawio")).isEqualTo(SUCCESS);
      assertThat(output).exists();
      assertThat(run("-i", input.toString(), "-o", dir.resolve("other.xml").toString(), "-f", "svg")).isNotEqualTo(SUCCESS);
      assertThat(dir.resolve("other.xml")).doesNotExist();
   }

   @Test
   public void testInvalidDiagramWritesNothing() throws IOException {
      Path input = write("bad.seq", "participant A", "deactivate A");
      Path output = dir.resolve("bad.drawio");
      assertThat(run("-i", input.toString(), "-o", output.toString())).isNotEqualTo(SUCCESS);
      assertThat(output).doesNotExist();
   }

   @Test
   public void testSyntaxErrorWritesNothing() throws IOException {
      Path input = write("bad.seq", "participant A", "A => B");
      Path output = dir.resolve("bad.drawio");
      assertThat(run("-i", input.toString(), "-o", output.toString(), "--print-stack-trace")).isNotEqualTo(SUCCESS);
      assertThat(output).doesNotExist();
   }

   @Test
   public void testInvalidConfig() throws IOException {
      Path input = write("a.seq", "participant A");
      Path config = write("layout.yaml", "participantWidth: -1");
      Path output = dir.resolve("a.drawio");
      assertThat(run("-i", input.toString(), "-o", output.toString(), "-c", config.toString())).isNotEqualTo(SUCCESS);
      assertThat(output).doesNotExist();
   }

   @Test
   public void testMissingInput() {
      Path output = dir.resolve("none.drawio");
      assertThat(run("-i", dir.resolve("missing.seq").toString(), "-o", output.toString())).isNotEqualTo(SUCCESS);
      assertThat(output).doesNotExist();
   }

   @Test
   public void testMissingRequiredOption() throws IOException {
      Path input = write("a.seq", "participant A");
      assertThat(run("-i", input.toString())).isNotEqualTo(SUCCESS);
   }

   @Test
   public void testHelp() {
      assertThat(run("-h")).isEqualTo(SUCCESS);
   }
}
