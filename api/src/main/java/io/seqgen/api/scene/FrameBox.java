package io.seqgen.api.scene;

import java.util.Objects;

import io.seqgen.api.statement.FrameKind;

public class FrameBox extends SceneNode {
   private final FrameKind kind;
   private final String label;
   private final int depth;
   private final int branches;
   private final double x;
   private final double y;
   private final double width;
   private final double height;
   private final double tabWidth;
   private final double tabHeight;

   public FrameBox(FrameKind kind, String label, int depth, int branches, double x, double y, double width, double height,
                   double tabWidth, double tabHeight) {
      this.kind = kind;
      this.label = label;
      this.depth = depth;
      this.branches = branches;
      this.x = x;
      this.y = y;
      this.width = width;
      this.height = height;
      this.tabWidth = tabWidth;
      this.tabHeight = tabHeight;
   }

   public FrameKind kind() {
      return kind;
   }

   public String label() {
      return label;
   }

   /**
    * @return 1 for a top-level frame, 2 for a frame nested in a top-level frame etc.
    */
   public int depth() {
      return depth;
   }

   /**
    * @return number of branches; always 1 unless this is an {@code alt} frame with {@code else} sections.
    */
   public int branches() {
      return branches;
   }

   public double x() {
      return x;
   }

   public double y() {
      return y;
   }

   public double width() {
      return width;
   }

   public double height() {
      return height;
   }

   public double tabWidth() {
      return tabWidth;
   }

   public double tabHeight() {
      return tabHeight;
   }

   @Override
   public <R> R accept(SceneVisitor<R> visitor) {
      return visitor.visitFrameBox(this);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (o == null || getClass() != o.getClass()) {
         return false;
      }
      FrameBox frameBox = (FrameBox) o;
      return depth == frameBox.depth && branches == frameBox.branches && kind == frameBox.kind &&
            Double.compare(frameBox.x, x) == 0 && Double.compare(frameBox.y, y) == 0 &&
            Double.compare(frameBox.width, width) == 0 && Double.compare(frameBox.height, height) == 0 &&
            Double.compare(frameBox.tabWidth, tabWidth) == 0 && Double.compare(frameBox.tabHeight, tabHeight) == 0 &&
            label.equals(frameBox.label);
   }

   @Override
   public int hashCode() {
      return Objects.hash(kind, label, depth, branches, x, y, width, height, tabWidth, tabHeight);
   }

   @Override
   public String toString() {
      return "FrameBox{" + kind.keyword() + " [" + label + "] x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + '}';
   }
}
