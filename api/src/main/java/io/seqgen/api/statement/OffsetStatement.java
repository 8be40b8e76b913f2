package io.seqgen.api.statement;

/**
 * Standalone vertical offset: permanently shifts the position of all following statements.
 */
public class OffsetStatement extends Statement {
   private final int dy;

   public OffsetStatement(int line, int dy) {
      super(line);
      this.dy = dy;
   }

   public int dy() {
      return dy;
   }

   @Override
   public <R, P> R accept(StatementVisitor<R, P> visitor, P param) {
      return visitor.visitOffset(this, param);
   }
}
