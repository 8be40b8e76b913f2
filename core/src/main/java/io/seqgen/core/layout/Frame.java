package io.seqgen.core.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.seqgen.api.statement.FrameKind;

/**
 * Open (or just closed) frame. The horizontal span grows with every participant referenced inside the frame;
 * extensions are kept separately and applied on top of it.
 */
public class Frame {
   private final FrameKind kind;
   private final String label;
   private final int depth;
   private final int line;
   private final int slot;
   private final double yStart;
   private final Span span = new Span();
   private final List<Branch> branches = new ArrayList<>();
   private Span branchSpan = new Span();
   private double leftExtension;
   private double rightExtension;
   private boolean referenced;
   private double yEnd = Double.NaN;

   Frame(FrameKind kind, String label, int depth, int line, int slot, double yStart) {
      this.kind = kind;
      this.label = label;
      this.depth = depth;
      this.line = line;
      this.slot = slot;
      this.yStart = yStart;
   }

   void reference(Span laneSpan) {
      referenced = true;
      span.include(laneSpan);
      branchSpan.include(laneSpan);
   }

   void include(double from, double to) {
      span.include(from, to);
      branchSpan.include(from, to);
   }

   void extend(double delta) {
      if (delta > 0) {
         rightExtension += delta;
      } else {
         leftExtension -= delta;
      }
   }

   Branch addBranch(String label, double y) {
      Branch branch = new Branch(label, y);
      branches.add(branch);
      branchSpan = branch.span;
      return branch;
   }

   void close(double yEnd) {
      this.yEnd = yEnd;
   }

   public FrameKind kind() {
      return kind;
   }

   public String label() {
      return label;
   }

   public int depth() {
      return depth;
   }

   public int line() {
      return line;
   }

   /**
    * @return position reserved for the frame box in the scene.
    */
   public int slot() {
      return slot;
   }

   public double yStart() {
      return yStart;
   }

   public double yEnd() {
      return yEnd;
   }

   public boolean isReferenced() {
      return referenced;
   }

   /**
    * @return union of all referenced lanes and nested frames, without extensions.
    */
   public Span span() {
      return span;
   }

   public double minX() {
      return span.min() - leftExtension;
   }

   public double maxX() {
      return span.max() + rightExtension;
   }

   /**
    * @return dividers added by {@code else}; the first branch starts at the frame top and has no divider.
    */
   public List<Branch> branches() {
      return Collections.unmodifiableList(branches);
   }

   public int branchCount() {
      return branches.size() + 1;
   }

   @Override
   public String toString() {
      return kind.keyword() + " [" + label + "]";
   }

   public static class Branch {
      private final String label;
      private final double y;
      private final Span span = new Span();

      private Branch(String label, double y) {
         this.label = label;
         this.y = y;
      }

      public String label() {
         return label;
      }

      public double y() {
         return y;
      }

      /**
       * @return participants referenced within this branch only.
       */
      public Span span() {
         return span;
      }
   }
}
