package io.seqgen.core.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tokenizer over a single source line. Columns reported in errors are 1-based.
 */
class LineScanner {
   private final int line;
   private final String text;
   private int pos;

   LineScanner(int line, String text) {
      this.line = line;
      this.text = text;
   }

   int line() {
      return line;
   }

   void skipWhitespace() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
         ++pos;
      }
   }

   boolean atEnd() {
      skipWhitespace();
      return pos >= text.length();
   }

   boolean isQuoted() {
      skipWhitespace();
      return pos < text.length() && text.charAt(pos) == '"';
   }

   /**
    * @return next whitespace-delimited token without consuming it, or <code>null</code> at the end of line.
    */
   String peekToken() {
      skipWhitespace();
      int end = pos;
      while (end < text.length() && !Character.isWhitespace(text.charAt(end))) {
         ++end;
      }
      return end == pos ? null : text.substring(pos, end);
   }

   /**
    * @return whitespace-delimited token following the next one, or <code>null</code>.
    */
   String peekSecondToken() {
      int mark = pos;
      try {
         if (token() == null) {
            return null;
         }
         return peekToken();
      } finally {
         pos = mark;
      }
   }

   String token() {
      String token = peekToken();
      if (token != null) {
         pos += token.length();
      }
      return token;
   }

   boolean tryKeyword(String keyword) {
      if (keyword.equals(peekToken())) {
         pos += keyword.length();
         return true;
      }
      return false;
   }

   boolean tryChar(char c) {
      skipWhitespace();
      if (pos < text.length() && text.charAt(pos) == c) {
         ++pos;
         return true;
      }
      return false;
   }

   /**
    * Participant name: a double-quoted string (with <code>\"</code> and <code>\\</code> escapes) or a bare word
    * ending at whitespace, comma or colon.
    */
   String name() throws ParserException {
      skipWhitespace();
      if (pos >= text.length()) {
         throw error("Expected participant name");
      }
      if (text.charAt(pos) == '"') {
         return quoted();
      }
      int start = pos;
      while (pos < text.length()) {
         char c = text.charAt(pos);
         if (Character.isWhitespace(c) || c == ',' || c == ':' || c == '"') {
            break;
         }
         ++pos;
      }
      if (pos == start) {
         throw error("Expected participant name");
      }
      return text.substring(start, pos);
   }

   private String quoted() throws ParserException {
      int start = pos;
      StringBuilder sb = new StringBuilder();
      ++pos;
      while (pos < text.length()) {
         char c = text.charAt(pos++);
         if (c == '"') {
            return sb.toString();
         } else if (c == '\\' && pos < text.length()) {
            char escaped = text.charAt(pos++);
            if (escaped == '"' || escaped == '\\') {
               sb.append(escaped);
            } else {
               sb.append(c).append(escaped);
            }
         } else {
            sb.append(c);
         }
      }
      pos = start;
      throw error("Unterminated quoted name");
   }

   List<String> nameList() throws ParserException {
      List<String> names = new ArrayList<>();
      do {
         names.add(name());
      } while (tryChar(','));
      return names;
   }

   int integer() throws ParserException {
      skipWhitespace();
      int start = pos;
      String token = token();
      if (token == null) {
         throw error("Expected a number");
      }
      try {
         return Integer.parseInt(token);
      } catch (NumberFormatException e) {
         pos = start;
         throw error("Expected a number, got '" + token + "'");
      }
   }

   boolean nextIsInteger() {
      String token = peekToken();
      if (token == null) {
         return false;
      }
      try {
         Integer.parseInt(token);
         return true;
      } catch (NumberFormatException e) {
         return false;
      }
   }

   /**
    * @return the rest of the line, trimmed.
    */
   String rest() {
      skipWhitespace();
      String rest = text.substring(pos).trim();
      pos = text.length();
      return rest;
   }

   /**
    * Optional <code>: text</code> suffix, split into lines on <code>\n</code> escapes.
    */
   List<String> optionalText() throws ParserException {
      if (atEnd()) {
         return Collections.emptyList();
      }
      if (!tryChar(':')) {
         throw error("Expected ':' followed by text");
      }
      return splitLines(rest());
   }

   static List<String> splitLines(String text) {
      if (text.isEmpty()) {
         return Collections.emptyList();
      }
      List<String> lines = new ArrayList<>();
      for (String line : text.split("\\\\n", -1)) {
         lines.add(line.trim());
      }
      return lines;
   }

   void expectEnd() throws ParserException {
      if (!atEnd()) {
         throw error("Unexpected '" + text.substring(pos).trim() + "'");
      }
   }

   ParserException error(String msg) {
      skipWhitespace();
      return new ParserException(line, pos + 1, msg);
   }
}
