package io.seqgen.core.layout;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import io.seqgen.api.config.DiagramDefinitionException;
import io.seqgen.api.config.ErrorKind;
import io.seqgen.api.statement.FrameKind;

public class FrameStack {
   private final Deque<Frame> frames = new ArrayDeque<>();
   private final ParticipantRegistry registry;
   private final double padding;

   public FrameStack(ParticipantRegistry registry, double padding) {
      this.registry = registry;
      this.padding = padding;
   }

   public Frame open(FrameKind kind, String label, double y, int line, int slot) {
      Frame frame = new Frame(kind, label, frames.size() + 1, line, slot, y);
      frames.push(frame);
      return frame;
   }

   public Frame.Branch addBranch(String label, double y) {
      Frame top = frames.peek();
      if (top == null) {
         throw new DiagramDefinitionException(ErrorKind.INVALID_BRANCH, "'else' outside of any frame");
      } else if (top.kind() != FrameKind.ALT) {
         throw new DiagramDefinitionException(ErrorKind.INVALID_BRANCH, "'else' is allowed only in 'alt' frames, the innermost frame is " + top);
      }
      return top.addBranch(label, y);
   }

   /**
    * Closes the innermost frame at given y and merges its box (span with padding) into the enclosing frame.
    */
   public Frame closeInnermost(double y) {
      Frame top = frames.peek();
      if (top == null) {
         throw new DiagramDefinitionException(ErrorKind.NO_OPEN_FRAME, "'end' without an open frame");
      }
      if (!top.isReferenced()) {
         throw new DiagramDefinitionException(ErrorKind.EMPTY_FRAME, "frame " + top + " does not refer to any participant");
      }
      frames.pop();
      top.close(y);
      Frame parent = frames.peek();
      if (parent != null) {
         parent.include(boxMinX(top), boxMaxX(top));
      }
      return top;
   }

   public void referenceParticipant(Participant participant) {
      if (frames.isEmpty()) {
         return;
      }
      Span laneSpan = registry.laneSpan(participant);
      for (Frame frame : frames) {
         frame.reference(laneSpan);
      }
   }

   /**
    * Widens every open frame by geometry that does not belong to a lane, e.g. a self call loop or a note.
    */
   public void include(double from, double to) {
      for (Frame frame : frames) {
         frame.include(from, to);
      }
   }

   public void extend(double delta) {
      Frame top = frames.peek();
      if (top == null) {
         throw new DiagramDefinitionException(ErrorKind.NO_OPEN_FRAME, "'extend' without an open frame");
      }
      top.extend(delta);
   }

   public double boxMinX(Frame frame) {
      return frame.minX() - padding;
   }

   public double boxMaxX(Frame frame) {
      return frame.maxX() + padding;
   }

   public boolean isEmpty() {
      return frames.isEmpty();
   }

   public int depth() {
      return frames.size();
   }

   public Frame innermost() {
      return frames.peek();
   }

   /**
    * @return open frames from the outermost to the innermost.
    */
   public List<Frame> openFrames() {
      List<Frame> list = new ArrayList<>(frames.size());
      Iterator<Frame> it = frames.descendingIterator();
      while (it.hasNext()) {
         list.add(it.next());
      }
      return Collections.unmodifiableList(list);
   }
}
