package io.seqgen.api.statement;

public class NoteTextStatement extends Statement {
   private final String text;

   public NoteTextStatement(int line, String text) {
      super(line);
      this.text = text;
   }

   public String text() {
      return text;
   }

   @Override
   public <R, P> R accept(StatementVisitor<R, P> visitor, P param) {
      return visitor.visitNoteText(this, param);
   }
}
