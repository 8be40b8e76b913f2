package io.seqgen.api.statement;

/**
 * Starts another branch of the innermost {@code alt} frame.
 */
public class ElseStatement extends Statement {
   private final String label;

   public ElseStatement(int line, String label) {
      super(line);
      this.label = label;
   }

   public String label() {
      return label;
   }

   @Override
   public <R, P> R accept(StatementVisitor<R, P> visitor, P param) {
      return visitor.visitElse(this, param);
   }
}
