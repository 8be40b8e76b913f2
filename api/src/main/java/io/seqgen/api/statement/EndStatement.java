package io.seqgen.api.statement;

/**
 * Closes the innermost open frame.
 */
public class EndStatement extends Statement {
   public EndStatement(int line) {
      super(line);
   }

   @Override
   public <R, P> R accept(StatementVisitor<R, P> visitor, P param) {
      return visitor.visitEnd(this, param);
   }
}
