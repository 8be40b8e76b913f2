package io.seqgen.api.scene;

import java.util.Objects;

/**
 * Participant box together with its lifeline. The box occupies the top {@link #headerHeight()} of the lane,
 * the lifeline continues down to {@code y + height}.
 */
public class LaneHeader extends SceneNode {
   private final String participant;
   private final String label;
   private final int index;
   private final double x;
   private final double y;
   private final double width;
   private final double height;
   private final double headerHeight;

   public LaneHeader(String participant, String label, int index, double x, double y, double width, double height, double headerHeight) {
      this.participant = participant;
      this.label = label;
      this.index = index;
      this.x = x;
      this.y = y;
      this.width = width;
      this.height = height;
      this.headerHeight = headerHeight;
   }

   public String participant() {
      return participant;
   }

   public String label() {
      return label;
   }

   public int index() {
      return index;
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

   public double headerHeight() {
      return headerHeight;
   }

   public double centerX() {
      return x + width / 2;
   }

   @Override
   public <R> R accept(SceneVisitor<R> visitor) {
      return visitor.visitLaneHeader(this);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (o == null || getClass() != o.getClass()) {
         return false;
      }
      LaneHeader that = (LaneHeader) o;
      return index == that.index && Double.compare(that.x, x) == 0 && Double.compare(that.y, y) == 0 &&
            Double.compare(that.width, width) == 0 && Double.compare(that.height, height) == 0 &&
            Double.compare(that.headerHeight, headerHeight) == 0 &&
            participant.equals(that.participant) && label.equals(that.label);
   }

   @Override
   public int hashCode() {
      return Objects.hash(participant, label, index, x, y, width, height, headerHeight);
   }

   @Override
   public String toString() {
      return "LaneHeader{" + participant + " #" + index + " x=" + x + ", width=" + width + ", height=" + height + '}';
   }
}
