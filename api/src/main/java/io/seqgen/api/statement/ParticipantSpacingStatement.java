package io.seqgen.api.statement;

/**
 * Sets the gap in front of lanes declared after this statement.
 */
public class ParticipantSpacingStatement extends Statement {
   private final int spacing;

   public ParticipantSpacingStatement(int line, int spacing) {
      super(line);
      this.spacing = spacing;
   }

   public int spacing() {
      return spacing;
   }

   @Override
   public <R, P> R accept(StatementVisitor<R, P> visitor, P param) {
      return visitor.visitParticipantSpacing(this, param);
   }
}
