package io.seqgen.api.scene;

import java.util.Objects;

public class Point {
   private final double x;
   private final double y;

   public Point(double x, double y) {
      this.x = x;
      this.y = y;
   }

   public double x() {
      return x;
   }

   public double y() {
      return y;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (o == null || getClass() != o.getClass()) {
         return false;
      }
      Point point = (Point) o;
      return Double.compare(point.x, x) == 0 && Double.compare(point.y, y) == 0;
   }

   @Override
   public int hashCode() {
      return Objects.hash(x, y);
   }

   @Override
   public String toString() {
      return "(" + x + ", " + y + ")";
   }
}
