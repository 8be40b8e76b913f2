package io.seqgen.api.scene;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class NoteBox extends SceneNode {
   private final String participant;
   private final List<String> text;
   private final double x;
   private final double y;
   private final double width;
   private final double height;

   public NoteBox(String participant, List<String> text, double x, double y, double width, double height) {
      this.participant = participant;
      this.text = Collections.unmodifiableList(text);
      this.x = x;
      this.y = y;
      this.width = width;
      this.height = height;
   }

   public String participant() {
      return participant;
   }

   public List<String> text() {
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

   @Override
   public <R> R accept(SceneVisitor<R> visitor) {
      return visitor.visitNoteBox(this);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (o == null || getClass() != o.getClass()) {
         return false;
      }
      NoteBox noteBox = (NoteBox) o;
      return Double.compare(noteBox.x, x) == 0 && Double.compare(noteBox.y, y) == 0 &&
            Double.compare(noteBox.width, width) == 0 && Double.compare(noteBox.height, height) == 0 &&
            participant.equals(noteBox.participant) && text.equals(noteBox.text);
   }

   @Override
   public int hashCode() {
      return Objects.hash(participant, text, x, y, width, height);
   }

   @Override
   public String toString() {
      return "NoteBox{" + participant + " x=" + x + ", y=" + y + ", text=" + text + '}';
   }
}
