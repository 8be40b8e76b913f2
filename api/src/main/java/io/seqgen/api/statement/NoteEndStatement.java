package io.seqgen.api.statement;

public class NoteEndStatement extends Statement {
   public NoteEndStatement(int line) {
      super(line);
   }

   @Override
   public <R, P> R accept(StatementVisitor<R, P> visitor, P param) {
      return visitor.visitNoteEnd(this, param);
   }
}
