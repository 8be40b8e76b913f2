package io.seqgen.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.seqgen.api.statement.ActivateStatement;
import io.seqgen.api.statement.ArrowStyle;
import io.seqgen.api.statement.DeactivateStatement;
import io.seqgen.api.statement.ElseStatement;
import io.seqgen.api.statement.EndStatement;
import io.seqgen.api.statement.FrameExtendStatement;
import io.seqgen.api.statement.FrameKind;
import io.seqgen.api.statement.FrameOpenStatement;
import io.seqgen.api.statement.LineStyle;
import io.seqgen.api.statement.MessageActivation;
import io.seqgen.api.statement.MessageStatement;
import io.seqgen.api.statement.NoteEndStatement;
import io.seqgen.api.statement.NoteStatement;
import io.seqgen.api.statement.NoteTextStatement;
import io.seqgen.api.statement.OffsetStatement;
import io.seqgen.api.statement.ParticipantSpacingStatement;
import io.seqgen.api.statement.ParticipantStatement;
import io.seqgen.api.statement.ParticipantWidthStatement;
import io.seqgen.api.statement.SelfCallStatement;
import io.seqgen.api.statement.Statement;
import io.seqgen.api.statement.TitleHeightStatement;
import io.seqgen.api.statement.TitleStatement;
import io.seqgen.api.statement.TitleWidthStatement;
import io.seqgen.core.layout.Participant;

public class StatementParserTest {
   private static List<Statement> parse(String... lines) throws ParserException {
      return StatementParser.instance().parse(String.join("\n", lines));
   }

   private static Statement single(String line) throws ParserException {
      List<Statement> statements = parse(line);
      assertThat(statements).hasSize(1);
      return statements.get(0);
   }

   private static ParserException error(String... lines) {
      return catchThrowableOfType(() -> parse(lines), ParserException.class);
   }

   @Test
   public void testParticipants() throws ParserException {
      List<Statement> statements = parse(
            "participant Alice",
            "participant \"Bob the \\\"builder\\\"\" as bob",
            "participant width 120",
            "participant spacing 0",
            "participant width");

      ParticipantStatement alice = (ParticipantStatement) statements.get(0);
      assertThat(alice.name()).isEqualTo("Alice");
      assertThat(alice.alias()).isNull();
      assertThat(alice.line()).isEqualTo(1);
      ParticipantStatement bob = (ParticipantStatement) statements.get(1);
      assertThat(bob.name()).isEqualTo("Bob the \"builder\"");
      assertThat(bob.alias()).isEqualTo("bob");
      assertThat(((ParticipantWidthStatement) statements.get(2)).width()).isEqualTo(120);
      assertThat(((ParticipantSpacingStatement) statements.get(3)).spacing()).isZero();
      // not followed by a number: a participant called 'width'
      assertThat(((ParticipantStatement) statements.get(4)).name()).isEqualTo("width");
   }

   @Test
   public void testMessages() throws ParserException {
      MessageStatement call = (MessageStatement) single("Alice ->+ bob: hello");
      assertThat(call.sender()).isEqualTo("Alice");
      assertThat(call.receiver()).isEqualTo("bob");
      assertThat(call.text()).containsExactly("hello");
      assertThat(call.activation()).isEqualTo(MessageActivation.ACTIVATE);
      assertThat(call.lineStyle()).isEqualTo(LineStyle.SOLID);
      assertThat(call.arrowStyle()).isEqualTo(ArrowStyle.CLOSED);

      MessageStatement reply = (MessageStatement) single("bob -->>- Alice");
      assertThat(reply.text()).isEmpty();
      assertThat(reply.activation()).isEqualTo(MessageActivation.DEACTIVATE);
      assertThat(reply.lineStyle()).isEqualTo(LineStyle.DASHED);
      assertThat(reply.arrowStyle()).isEqualTo(ArrowStyle.OPEN);

      MessageStatement event = (MessageStatement) single("  \"a b\" ->>| c:  first \\n second ");
      assertThat(event.sender()).isEqualTo("a b");
      assertThat(event.activation()).isEqualTo(MessageActivation.FIRE_AND_FORGET);
      assertThat(event.arrowStyle()).isEqualTo(ArrowStyle.OPEN);
      assertThat(event.text()).containsExactly("first", "second");

      MessageStatement dashed = (MessageStatement) single("a --> b");
      assertThat(dashed.lineStyle()).isEqualTo(LineStyle.DASHED);
      assertThat(dashed.activation()).isEqualTo(MessageActivation.NONE);
   }

   @Test
   public void testFoundAndLost() throws ParserException {
      MessageStatement found = (MessageStatement) single("found right ->+ A");
      assertThat(found.sender()).isEqualTo(Participant.FOUND_RIGHT);
      MessageStatement lost = (MessageStatement) single("A -> lost left: gone");
      assertThat(lost.receiver()).isEqualTo(Participant.LOST_LEFT);
      // keywords followed by an arrow are participant names
      MessageStatement named = (MessageStatement) single("found -> lost");
      assertThat(named.sender()).isEqualTo("found");

      assertThat(error("found middle -> A").getMessage()).contains("Expected 'left' or 'right'");
   }

   @Test
   public void testKeywordsAsNames() throws ParserException {
      MessageStatement message = (MessageStatement) single("end -> \"note\"");
      assertThat(message.sender()).isEqualTo("end");
      assertThat(message.receiver()).isEqualTo("note");
      assertThat(single("\"title\" -> x")).isInstanceOf(MessageStatement.class);
   }

   @Test
   public void testFrames() throws ParserException {
      List<Statement> statements = parse(
            "alt  all good ",
            "else",
            "else timeout",
            "end",
            "loop",
            "extend -25",
            "end");

      FrameOpenStatement alt = (FrameOpenStatement) statements.get(0);
      assertThat(alt.kind()).isEqualTo(FrameKind.ALT);
      assertThat(alt.label()).isEqualTo("all good");
      assertThat(((ElseStatement) statements.get(1)).label()).isEmpty();
      assertThat(((ElseStatement) statements.get(2)).label()).isEqualTo("timeout");
      assertThat(statements.get(3)).isInstanceOf(EndStatement.class);
      assertThat(((FrameOpenStatement) statements.get(4)).kind()).isEqualTo(FrameKind.LOOP);
      assertThat(((FrameExtendStatement) statements.get(5)).delta()).isEqualTo(-25);
   }

   @Test
   public void testActivations() throws ParserException {
      List<Statement> statements = parse("activate A, \"B C\",D", "deactivate A", "self A: recurse", "offset 15");
      assertThat(((ActivateStatement) statements.get(0)).targets()).containsExactly("A", "B C", "D");
      assertThat(((DeactivateStatement) statements.get(1)).targets()).containsExactly("A");
      SelfCallStatement self = (SelfCallStatement) statements.get(2);
      assertThat(self.target()).isEqualTo("A");
      assertThat(self.text()).containsExactly("recurse");
      assertThat(((OffsetStatement) statements.get(3)).dy()).isEqualTo(15);
   }

   @Test
   public void testTitle() throws ParserException {
      List<Statement> statements = parse("title width 300", "title height 60", "title  Ordering flow ");
      assertThat(((TitleWidthStatement) statements.get(0)).width()).isEqualTo(300);
      assertThat(((TitleHeightStatement) statements.get(1)).height()).isEqualTo(60);
      assertThat(((TitleStatement) statements.get(2)).text()).isEqualTo("Ordering flow");
      assertThat(error("title").getMessage()).contains("Expected title text");
   }

   @Test
   public void testNotes() throws ParserException {
      List<Statement> statements = parse(
            "note A 5 -10 80 20",
            "  line one",
            "",
            "  # kept",
            "  end note",
            "# comment",
            "note B",
            "end note");

      assertThat(statements).hasSize(6);
      NoteStatement note = (NoteStatement) statements.get(0);
      assertThat(note.target()).isEqualTo("A");
      assertThat(note.dx()).isEqualTo(5);
      assertThat(note.dy()).isEqualTo(-10);
      assertThat(note.width()).isEqualTo(80);
      assertThat(note.height()).isEqualTo(20);
      assertThat(((NoteTextStatement) statements.get(1)).text()).isEqualTo("line one");
      assertThat(((NoteTextStatement) statements.get(2)).text()).isEqualTo("# kept");
      assertThat(statements.get(3)).isInstanceOf(NoteEndStatement.class);
      assertThat(statements.get(3).line()).isEqualTo(5);
      NoteStatement defaults = (NoteStatement) statements.get(4);
      assertThat(defaults.line()).isEqualTo(7);
      assertThat(defaults.width()).isNull();
      assertThat(defaults.height()).isNull();
   }

   @Test
   public void testCommentsAndBlankLines() throws ParserException {
      List<Statement> statements = parse("# header", "", "   ", "participant A", "  # indented comment");
      assertThat(statements).hasSize(1);
      assertThat(statements.get(0).line()).isEqualTo(4);
   }

   @Test
   public void testErrorLocation() {
      ParserException e = error("participant A", "offset abc");
      assertThat(e.line()).isEqualTo(2);
      assertThat(e.column()).isEqualTo(8);
      assertThat(e.getMessage()).isEqualTo("line 2, column 8: Expected a number, got 'abc'");
   }

   @Test
   public void testSyntaxErrors() {
      assertThat(error("A => B").getMessage()).contains("invalid arrow '=>'");
      assertThat(error("A->B").getMessage()).contains("Expected an arrow");
      assertThat(error("A -> B hello").getMessage()).contains("Expected ':'");
      assertThat(error("participant \"unterminated").getMessage()).contains("Unterminated quoted name");
      assertThat(error("end note").getMessage()).contains("'end note' without a note");
      assertThat(error("activate A B").getMessage()).contains("Unexpected 'B'");
      assertThat(error("extend").getMessage()).contains("Expected a number");
      assertThat(error("participant A as").getMessage()).contains("Expected participant name");
   }

   @Test
   public void testInputStream() throws ParserException, IOException {
      byte[] bytes = "participant Žofie\r\nparticipant B\r\n".getBytes(StandardCharsets.UTF_8);
      List<Statement> statements = StatementParser.instance().parse(new ByteArrayInputStream(bytes));
      assertThat(statements).hasSize(2);
      assertThat(((ParticipantStatement) statements.get(0)).name()).isEqualTo("Žofie");
   }
}
