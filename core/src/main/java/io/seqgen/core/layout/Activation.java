package io.seqgen.core.layout;

/**
 * One entry on a participant's activation stack.
 */
public class Activation {
   private final Participant participant;
   private final int depth;
   private final double dx;
   private final double startY;
   private final int line;

   Activation(Participant participant, int depth, double dx, double startY, int line) {
      this.participant = participant;
      this.depth = depth;
      this.dx = dx;
      this.startY = startY;
      this.line = line;
   }

   public Participant participant() {
      return participant;
   }

   public int depth() {
      return depth;
   }

   /**
    * @return horizontal shift of the bar centre against the lane centre.
    */
   public double dx() {
      return dx;
   }

   public double startY() {
      return startY;
   }

   /**
    * @return source line of the statement that started this activation.
    */
   public int line() {
      return line;
   }

   @Override
   public String toString() {
      return participant.name() + "@" + depth;
   }
}
