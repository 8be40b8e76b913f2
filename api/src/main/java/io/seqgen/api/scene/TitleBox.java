package io.seqgen.api.scene;

import java.util.Objects;

/**
 * Frame around the whole diagram with the title in its tab.
 */
public class TitleBox extends SceneNode {
   private final String text;
   private final double x;
   private final double y;
   private final double width;
   private final double height;
   private final double tabWidth;
   private final double tabHeight;

   public TitleBox(String text, double x, double y, double width, double height, double tabWidth, double tabHeight) {
      this.text = text;
      this.x = x;
      this.y = y;
      this.width = width;
      this.height = height;
      this.tabWidth = tabWidth;
      this.tabHeight = tabHeight;
   }

   public String text() {
      return text;
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
      return visitor.visitTitleBox(this);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (o == null || getClass() != o.getClass()) {
         return false;
      }
      TitleBox titleBox = (TitleBox) o;
      return Double.compare(titleBox.x, x) == 0 && Double.compare(titleBox.y, y) == 0 &&
            Double.compare(titleBox.width, width) == 0 && Double.compare(titleBox.height, height) == 0 &&
            Double.compare(titleBox.tabWidth, tabWidth) == 0 && Double.compare(titleBox.tabHeight, tabHeight) == 0 &&
            text.equals(titleBox.text);
   }

   @Override
   public int hashCode() {
      return Objects.hash(text, x, y, width, height, tabWidth, tabHeight);
   }

   @Override
   public String toString() {
      return "TitleBox{" + text + " x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + '}';
   }
}
