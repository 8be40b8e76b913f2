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
package io.seqgen.api.config;

/**
 * Thrown when a statement sequence breaks one of the sequencing rules. The first error aborts the whole pass.
 */
public class DiagramDefinitionException extends RuntimeException {
   public static final int UNKNOWN_LINE = 0;

   private final ErrorKind kind;
   private final int line;
   private final String detail;

   public DiagramDefinitionException(ErrorKind kind, String detail) {
      this(kind, UNKNOWN_LINE, detail, null);
   }

   public DiagramDefinitionException(ErrorKind kind, int line, String detail) {
      this(kind, line, detail, null);
   }

   public DiagramDefinitionException(ErrorKind kind, int line, String detail, Throwable cause) {
      super(getMessage(kind, line, detail), cause);
      this.kind = kind;
      this.line = line;
      this.detail = detail;
   }

   private static String getMessage(ErrorKind kind, int line, String detail) {
      if (line == UNKNOWN_LINE) {
         return String.format("%s: %s", kind, detail);
      }
      return String.format("line %d: %s: %s", line, kind, detail);
   }

   /**
    * @return copy of this exception pointing to given source line; this instance if it already carries a line.
    */
   public DiagramDefinitionException atLine(int line) {
      if (this.line != UNKNOWN_LINE) {
         return this;
      }
      return new DiagramDefinitionException(kind, line, detail, this);
   }

   public ErrorKind kind() {
      return kind;
   }

   public int line() {
      return line;
   }

   public String detail() {
      return detail;
   }
}
