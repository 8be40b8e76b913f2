package io.seqgen.api.statement;

/**
 * Effect of a message on the activation state, written as a suffix of the arrow.
 */
public enum MessageActivation {
   /** No suffix. */
   NONE(""),
   /** {@code +}: the receiver becomes active. */
   ACTIVATE("+"),
   /** {@code -}: the sender ends its activation (typically a reply). */
   DEACTIVATE("-"),
   /** {@code |}: the receiver is activated and immediately deactivated again. */
   FIRE_AND_FORGET("|");

   private final String marker;

   MessageActivation(String marker) {
      this.marker = marker;
   }

   public String marker() {
      return marker;
   }

   public static MessageActivation fromMarker(String marker) {
      for (MessageActivation activation : values()) {
         if (activation.marker.equals(marker)) {
            return activation;
         }
      }
      throw new IllegalArgumentException("Unknown activation marker '" + marker + "'");
   }
}
