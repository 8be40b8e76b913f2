package io.seqgen.api.statement;

public class TitleStatement extends Statement {
   private final String text;

   public TitleStatement(int line, String text) {
      super(line);
      this.text = text;
   }

   public String text() {
      return text;
   }

   @Override
   public <R, P> R accept(StatementVisitor<R, P> visitor, P param) {
      return visitor.visitTitle(this, param);
   }
}
