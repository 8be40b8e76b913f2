package io.seqgen.api.statement;

/**
 * Opens a note attached to a participant. Its text follows as {@link NoteTextStatement}s terminated by
 * {@link NoteEndStatement}.
 */
public class NoteStatement extends Statement {
   private final String target;
   private final int dx;
   private final int dy;
   private final Integer width;
   private final Integer height;

   public NoteStatement(int line, String target, int dx, int dy, Integer width, Integer height) {
      super(line);
      this.target = target;
      this.dx = dx;
      this.dy = dy;
      this.width = width;
      this.height = height;
   }

   public String target() {
      return target;
   }

   public int dx() {
      return dx;
   }

   public int dy() {
      return dy;
   }

   /**
    * @return explicit width or <code>null</code> to use the default.
    */
   public Integer width() {
      return width;
   }

   /**
    * @return explicit height or <code>null</code> to use the default.
    */
   public Integer height() {
      return height;
   }

   @Override
   public <R, P> R accept(StatementVisitor<R, P> visitor, P param) {
      return visitor.visitNote(this, param);
   }
}
