package io.seqgen.api.statement;

/**
 * Sets the lane width for participants declared after this statement.
 */
public class ParticipantWidthStatement extends Statement {
   private final int width;

   public ParticipantWidthStatement(int line, int width) {
      super(line);
      this.width = width;
   }

   public int width() {
      return width;
   }

   @Override
   public <R, P> R accept(StatementVisitor<R, P> visitor, P param) {
      return visitor.visitParticipantWidth(this, param);
   }
}
