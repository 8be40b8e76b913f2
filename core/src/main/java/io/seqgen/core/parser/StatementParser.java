package io.seqgen.core.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

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

/**
 * Turns diagram source text into statements, one statement per line.
 * <p>
 * Lines starting with <code>#</code> and blank lines are ignored, except inside a note where every line up to
 * <code>end note</code> is note text. A line is recognized as a keyword statement only when its first word is
 * an unquoted keyword not followed by an arrow, so participants may be named like keywords.
 */
public class StatementParser {
   private static final Logger log = LogManager.getLogger(StatementParser.class);
   private static final StatementParser INSTANCE = new StatementParser();
   private static final Pattern ARROW = Pattern.compile("(--?)(>>?)([+|\\-]?)");

   public static StatementParser instance() {
      return INSTANCE;
   }

   private StatementParser() {
   }

   public List<Statement> parse(InputStream stream) throws ParserException, IOException {
      return parse(new InputStreamReader(stream, StandardCharsets.UTF_8));
   }

   public List<Statement> parse(String source) throws ParserException {
      try {
         return parse(new StringReader(source));
      } catch (IOException e) {
         throw new IllegalStateException("Reading from a string failed", e);
      }
   }

   public List<Statement> parse(Reader source) throws ParserException, IOException {
      List<Statement> statements = new ArrayList<>();
      BufferedReader reader = new BufferedReader(source);
      boolean inNote = false;
      int lineNumber = 0;
      String text;
      while ((text = reader.readLine()) != null) {
         ++lineNumber;
         LineScanner scanner = new LineScanner(lineNumber, text);
         if (inNote) {
            if (isEndNote(scanner)) {
               statements.add(new NoteEndStatement(lineNumber));
               inNote = false;
            } else if (!text.trim().isEmpty()) {
               statements.add(new NoteTextStatement(lineNumber, text.trim()));
            }
            continue;
         }
         String trimmed = text.trim();
         if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            continue;
         }
         Statement statement = parseLine(scanner);
         statements.add(statement);
         inNote = statement instanceof NoteStatement;
      }
      log.debug("Parsed {} statements from {} lines", statements.size(), lineNumber);
      return statements;
   }

   private static boolean isEndNote(LineScanner scanner) {
      return scanner.tryKeyword("end") && scanner.tryKeyword("note") && scanner.atEnd();
   }

   private Statement parseLine(LineScanner scanner) throws ParserException {
      int line = scanner.line();
      String keyword = scanner.isQuoted() ? null : scanner.peekToken();
      if (keyword == null || isArrow(scanner.peekSecondToken())) {
         return message(scanner);
      }
      Statement statement;
      switch (keyword) {
         case "title":
            scanner.token();
            if (isSizeSetting(scanner, "width")) {
               statement = new TitleWidthStatement(line, scanner.integer());
            } else if (isSizeSetting(scanner, "height")) {
               statement = new TitleHeightStatement(line, scanner.integer());
            } else {
               String title = scanner.rest();
               if (title.isEmpty()) {
                  throw scanner.error("Expected title text");
               }
               return new TitleStatement(line, title);
            }
            break;
         case "participant":
            scanner.token();
            if (isSizeSetting(scanner, "width")) {
               statement = new ParticipantWidthStatement(line, scanner.integer());
            } else if (isSizeSetting(scanner, "spacing")) {
               statement = new ParticipantSpacingStatement(line, scanner.integer());
            } else {
               String name = scanner.name();
               String alias = null;
               if (scanner.tryKeyword("as")) {
                  alias = scanner.name();
               }
               statement = new ParticipantStatement(line, name, alias);
            }
            break;
         case "activate":
            scanner.token();
            statement = new ActivateStatement(line, scanner.nameList());
            break;
         case "deactivate":
            scanner.token();
            statement = new DeactivateStatement(line, scanner.nameList());
            break;
         case "self":
            scanner.token();
            statement = new SelfCallStatement(line, scanner.name(), scanner.optionalText());
            break;
         case "opt":
         case "alt":
         case "loop":
         case "group":
            scanner.token();
            return new FrameOpenStatement(line, FrameKind.fromKeyword(keyword), scanner.rest());
         case "else":
            scanner.token();
            return new ElseStatement(line, scanner.rest());
         case "end":
            scanner.token();
            if (scanner.tryKeyword("note")) {
               throw scanner.error("'end note' without a note");
            }
            statement = new EndStatement(line);
            break;
         case "extend":
            scanner.token();
            statement = new FrameExtendStatement(line, scanner.integer());
            break;
         case "note":
            scanner.token();
            statement = note(scanner);
            break;
         case "offset":
            scanner.token();
            statement = new OffsetStatement(line, scanner.integer());
            break;
         default:
            return message(scanner);
      }
      scanner.expectEnd();
      return statement;
   }

   private static boolean isSizeSetting(LineScanner scanner, String keyword) {
      if (!keyword.equals(scanner.peekToken())) {
         return false;
      }
      String value = scanner.peekSecondToken();
      if (value == null) {
         return false;
      }
      try {
         Integer.parseInt(value);
      } catch (NumberFormatException e) {
         return false;
      }
      scanner.token();
      return true;
   }

   private NoteStatement note(LineScanner scanner) throws ParserException {
      String target = scanner.name();
      int dx = 0;
      int dy = 0;
      Integer width = null;
      Integer height = null;
      if (scanner.nextIsInteger()) {
         dx = scanner.integer();
         dy = scanner.integer();
         if (scanner.nextIsInteger()) {
            width = scanner.integer();
            height = scanner.integer();
         }
      }
      return new NoteStatement(scanner.line(), target, dx, dy, width, height);
   }

   private Statement message(LineScanner scanner) throws ParserException {
      String sender;
      if (!scanner.isQuoted() && "found".equals(scanner.peekToken()) && !isArrow(scanner.peekSecondToken())) {
         scanner.token();
         sender = edge(scanner, Participant.FOUND_LEFT, Participant.FOUND_RIGHT);
      } else {
         sender = scanner.name();
      }
      String arrow = scanner.peekToken();
      Matcher matcher = arrow == null ? null : ARROW.matcher(arrow);
      if (matcher == null || !matcher.matches()) {
         throw scanner.error(arrow == null ? "Expected an arrow" : "Unknown statement or invalid arrow '" + arrow + "'");
      }
      scanner.token();
      LineStyle lineStyle = matcher.group(1).length() == 1 ? LineStyle.SOLID : LineStyle.DASHED;
      ArrowStyle arrowStyle = matcher.group(2).length() == 1 ? ArrowStyle.CLOSED : ArrowStyle.OPEN;
      MessageActivation activation = MessageActivation.fromMarker(matcher.group(3));

      String receiver;
      if (!scanner.isQuoted() && "lost".equals(scanner.peekToken()) && isEdgeSide(scanner.peekSecondToken())) {
         scanner.token();
         receiver = edge(scanner, Participant.LOST_LEFT, Participant.LOST_RIGHT);
      } else {
         receiver = scanner.name();
      }
      List<String> text = scanner.optionalText();
      return new MessageStatement(scanner.line(), sender, receiver, text, activation, lineStyle, arrowStyle);
   }

   private static String edge(LineScanner scanner, String left, String right) throws ParserException {
      String side = scanner.name();
      if ("left".equals(side)) {
         return left;
      } else if ("right".equals(side)) {
         return right;
      }
      throw scanner.error("Expected 'left' or 'right', got '" + side + "'");
   }

   // 'lost' alone, or followed by the message text, is a participant name
   private static boolean isEdgeSide(String token) {
      return token != null && !token.startsWith(":");
   }

   private static boolean isArrow(String token) {
      return token != null && ARROW.matcher(token).matches();
   }
}
