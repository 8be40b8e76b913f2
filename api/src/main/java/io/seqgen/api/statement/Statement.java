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
package io.seqgen.api.statement;

/**
 * A single parsed line (or line group) of the diagram definition.
 * <p>
 * The set of statement kinds is closed: every kind is dispatched through {@link StatementVisitor}, so adding a kind
 * requires every visitor to handle it.
 */
public abstract class Statement {
   private final int line;

   protected Statement(int line) {
      this.line = line;
   }

   /**
    * @return 1-based line in the source text this statement was parsed from.
    */
   public int line() {
      return line;
   }

   public abstract <R, P> R accept(StatementVisitor<R, P> visitor, P param);
}
