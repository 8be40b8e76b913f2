/*
 * Copyright 2018 Red Hat Inc. and/or its affiliates and other contributors
 * as indicated by the @authors tag. All rights reserved.
 * See the copyright.txt in the distribution for a
 * full listing of individual contributors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.seqgen.core.parser;

import org.yaml.snakeyaml.events.Event;

/**
 * Syntax error in the diagram source or in the layout settings file.
 */
public class ParserException extends Exception {
   private final int line;
   private final int column;

   public ParserException(String msg) {
      this(msg, null);
   }

   public ParserException(String msg, Throwable cause) {
      super(msg, cause);
      this.line = 0;
      this.column = 0;
   }

   public ParserException(Event event, String msg) {
      this(event, msg, null);
   }

   public ParserException(Event event, String msg, Throwable cause) {
      this(event.getStartMark().getLine() + 1, event.getStartMark().getColumn() + 1, msg, cause);
   }

   public ParserException(int line, int column, String msg) {
      this(line, column, msg, null);
   }

   public ParserException(int line, int column, String msg, Throwable cause) {
      super(location(line, column) + ": " + msg, cause);
      this.line = line;
      this.column = column;
   }

   static String location(int line, int column) {
      StringBuilder lineInfo = new StringBuilder("line ").append(line);
      if (column > 0) {
         lineInfo.append(", column ").append(column);
      }
      return lineInfo.toString();
   }

   /**
    * @return 1-based line or 0 when unknown.
    */
   public int line() {
      return line;
   }

   /**
    * @return 1-based column or 0 when unknown.
    */
   public int column() {
      return column;
   }
}
