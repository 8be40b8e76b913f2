package io.seqgen.api.statement;

public class TitleWidthStatement extends Statement {
   private final int width;

   public TitleWidthStatement(int line, int width) {
      super(line);
      this.width = width;
   }

   public int width() {
      return width;
   }

   @Override
   public <R, P> R accept(StatementVisitor<R, P> visitor, P param) {
      return visitor.visitTitleWidth(this, param);
   }
}
