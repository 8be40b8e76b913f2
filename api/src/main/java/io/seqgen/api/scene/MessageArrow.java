package io.seqgen.api.scene;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.seqgen.api.statement.ArrowStyle;
import io.seqgen.api.statement.LineStyle;

/**
 * Arrow from {@link #source()} to {@link #target()}, optionally routed through {@link #waypoints()}.
 * The label is placed above the arrow, or right of the loop for self calls.
 */
public class MessageArrow extends SceneNode {
   private final Kind kind;
   private final String sender;
   private final String receiver;
   private final List<String> text;
   private final LineStyle lineStyle;
   private final ArrowStyle arrowStyle;
   private final Point source;
   private final Point target;
   private final List<Point> waypoints;

   public MessageArrow(Kind kind, String sender, String receiver, List<String> text, LineStyle lineStyle, ArrowStyle arrowStyle,
                       Point source, Point target, List<Point> waypoints) {
      this.kind = kind;
      this.sender = sender;
      this.receiver = receiver;
      this.text = Collections.unmodifiableList(text);
      this.lineStyle = lineStyle;
      this.arrowStyle = arrowStyle;
      this.source = source;
      this.target = target;
      this.waypoints = Collections.unmodifiableList(waypoints);
   }

   public Kind kind() {
      return kind;
   }

   public String sender() {
      return sender;
   }

   public String receiver() {
      return receiver;
   }

   public List<String> text() {
      return text;
   }

   public LineStyle lineStyle() {
      return lineStyle;
   }

   public ArrowStyle arrowStyle() {
      return arrowStyle;
   }

   public Point source() {
      return source;
   }

   public Point target() {
      return target;
   }

   public List<Point> waypoints() {
      return waypoints;
   }

   @Override
   public <R> R accept(SceneVisitor<R> visitor) {
      return visitor.visitMessageArrow(this);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (o == null || getClass() != o.getClass()) {
         return false;
      }
      MessageArrow that = (MessageArrow) o;
      return kind == that.kind && sender.equals(that.sender) && receiver.equals(that.receiver) &&
            text.equals(that.text) && lineStyle == that.lineStyle && arrowStyle == that.arrowStyle &&
            source.equals(that.source) && target.equals(that.target) && waypoints.equals(that.waypoints);
   }

   @Override
   public int hashCode() {
      return Objects.hash(kind, sender, receiver, text, lineStyle, arrowStyle, source, target, waypoints);
   }

   @Override
   public String toString() {
      return "MessageArrow{" + sender + " -> " + receiver + " " + kind + " " + source + " -> " + target + ", text=" + text + '}';
   }

   public enum Kind {
      REGULAR,
      SELF,
      /** Sender is a diagram edge. */
      FOUND,
      /** Receiver is a diagram edge. */
      LOST
   }
}
