package io.seqgen.api.statement;

import java.util.Collections;
import java.util.List;

public class SelfCallStatement extends Statement {
   private final String target;
   private final List<String> text;

   public SelfCallStatement(int line, String target, List<String> text) {
      super(line);
      this.target = target;
      this.text = Collections.unmodifiableList(text);
   }

   public String target() {
      return target;
   }

   public List<String> text() {
      return text;
   }

   @Override
   public <R, P> R accept(StatementVisitor<R, P> visitor, P param) {
      return visitor.visitSelfCall(this, param);
   }
}
