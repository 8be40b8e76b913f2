package io.seqgen.api.statement;

import java.util.Collections;
import java.util.List;

public class ActivateStatement extends Statement {
   private final List<String> targets;

   public ActivateStatement(int line, List<String> targets) {
      super(line);
      this.targets = Collections.unmodifiableList(targets);
   }

   public List<String> targets() {
      return targets;
   }

   @Override
   public <R, P> R accept(StatementVisitor<R, P> visitor, P param) {
      return visitor.visitActivate(this, param);
   }
}
