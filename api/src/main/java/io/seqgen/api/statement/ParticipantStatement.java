package io.seqgen.api.statement;

/**
 * Declares a new lane. The name is also the displayed label; the optional alias is a second (usually shorter)
 * reference to the same participant.
 */
public class ParticipantStatement extends Statement {
   private final String name;
   private final String alias;

   public ParticipantStatement(int line, String name, String alias) {
      super(line);
      this.name = name;
      this.alias = alias;
   }

   public String name() {
      return name;
   }

   /**
    * @return alias or <code>null</code> if not set.
    */
   public String alias() {
      return alias;
   }

   @Override
   public <R, P> R accept(StatementVisitor<R, P> visitor, P param) {
      return visitor.visitParticipant(this, param);
   }
}
