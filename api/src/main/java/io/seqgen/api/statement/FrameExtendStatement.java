package io.seqgen.api.statement;

/**
 * Widens the innermost open frame: positive delta moves its right edge to the right, negative delta moves
 * its left edge to the left.
 */
public class FrameExtendStatement extends Statement {
   private final int delta;

   public FrameExtendStatement(int line, int delta) {
      super(line);
      this.delta = delta;
   }

   public int delta() {
      return delta;
   }

   @Override
   public <R, P> R accept(StatementVisitor<R, P> visitor, P param) {
      return visitor.visitFrameExtend(this, param);
   }
}
