package io.seqgen.core.layout;

/**
 * Current vertical writing position.
 */
public class Cursor {
   private double position;

   public Cursor(double position) {
      this.position = position;
   }

   /**
    * Moves the position permanently.
    */
   public double advance(double amount) {
      position += amount;
      return position;
   }

   /**
    * One-shot displacement: returns the position a single statement should use, the cursor itself does not move.
    */
   public double offset(double delta) {
      return position + delta;
   }

   public double current() {
      return position;
   }

   @Override
   public String toString() {
      return "Cursor{" + position + '}';
   }
}
