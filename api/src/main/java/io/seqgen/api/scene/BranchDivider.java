package io.seqgen.api.scene;

import java.util.Objects;

/**
 * Dashed horizontal line separating two branches of an {@code alt} frame, spanning the whole frame.
 */
public class BranchDivider extends SceneNode {
   private final String label;
   private final double x;
   private final double y;
   private final double width;

   public BranchDivider(String label, double x, double y, double width) {
      this.label = label;
      this.x = x;
      this.y = y;
      this.width = width;
   }

   public String label() {
      return label;
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

   @Override
   public <R> R accept(SceneVisitor<R> visitor) {
      return visitor.visitBranchDivider(this);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (o == null || getClass() != o.getClass()) {
         return false;
      }
      BranchDivider that = (BranchDivider) o;
      return Double.compare(that.x, x) == 0 && Double.compare(that.y, y) == 0 &&
            Double.compare(that.width, width) == 0 && label.equals(that.label);
   }

   @Override
   public int hashCode() {
      return Objects.hash(label, x, y, width);
   }

   @Override
   public String toString() {
      return "BranchDivider{[" + label + "] y=" + y + '}';
   }
}
