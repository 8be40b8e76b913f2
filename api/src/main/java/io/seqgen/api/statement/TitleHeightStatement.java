package io.seqgen.api.statement;

public class TitleHeightStatement extends Statement {
   private final int height;

   public TitleHeightStatement(int line, int height) {
      super(line);
      this.height = height;
   }

   public int height() {
      return height;
   }

   @Override
   public <R, P> R accept(StatementVisitor<R, P> visitor, P param) {
      return visitor.visitTitleHeight(this, param);
   }
}
