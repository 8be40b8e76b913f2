package io.seqgen.api.scene;

import java.util.Objects;

public class ActivationBar extends SceneNode {
   private final String participant;
   private final int depth;
   private final double x;
   private final double y;
   private final double width;
   private final double height;

   public ActivationBar(String participant, int depth, double x, double y, double width, double height) {
      this.participant = participant;
      this.depth = depth;
      this.x = x;
      this.y = y;
      this.width = width;
      this.height = height;
   }

   public String participant() {
      return participant;
   }

   /**
    * @return 1 for the bottom-most activation, 2 for the one stacked on it etc.
    */
   public int depth() {
      return depth;
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

   @Override
   public <R> R accept(SceneVisitor<R> visitor) {
      return visitor.visitActivationBar(this);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (o == null || getClass() != o.getClass()) {
         return false;
      }
      ActivationBar that = (ActivationBar) o;
      return depth == that.depth && Double.compare(that.x, x) == 0 && Double.compare(that.y, y) == 0 &&
            Double.compare(that.width, width) == 0 && Double.compare(that.height, height) == 0 &&
            participant.equals(that.participant);
   }

   @Override
   public int hashCode() {
      return Objects.hash(participant, depth, x, y, width, height);
   }

   @Override
   public String toString() {
      return "ActivationBar{" + participant + " depth=" + depth + " x=" + x + ", y=" + y + ", height=" + height + '}';
   }
}
