package io.seqgen.api.statement;

public class FrameOpenStatement extends Statement {
   private final FrameKind kind;
   private final String label;

   public FrameOpenStatement(int line, FrameKind kind, String label) {
      super(line);
      this.kind = kind;
      this.label = label;
   }

   public FrameKind kind() {
      return kind;
   }

   public String label() {
      return label;
   }

   @Override
   public <R, P> R accept(StatementVisitor<R, P> visitor, P param) {
      return visitor.visitFrameOpen(this, param);
   }
}
