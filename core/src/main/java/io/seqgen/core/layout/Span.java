package io.seqgen.core.layout;

/**
 * Horizontal interval that can only grow.
 */
public class Span {
   private double min = Double.NaN;
   private double max = Double.NaN;

   public Span() {
   }

   public Span(double min, double max) {
      include(min, max);
   }

   public Span include(double from, double to) {
      double lo = Math.min(from, to);
      double hi = Math.max(from, to);
      if (isEmpty()) {
         min = lo;
         max = hi;
      } else {
         min = Math.min(min, lo);
         max = Math.max(max, hi);
      }
      return this;
   }

   public Span include(Span other) {
      if (!other.isEmpty()) {
         include(other.min, other.max);
      }
      return this;
   }

   public boolean isEmpty() {
      return Double.isNaN(min);
   }

   public double min() {
      return min;
   }

   public double max() {
      return max;
   }

   public boolean contains(double from, double to) {
      return !isEmpty() && min <= Math.min(from, to) && max >= Math.max(from, to);
   }

   @Override
   public String toString() {
      return isEmpty() ? "[]" : "[" + min + ", " + max + "]";
   }
}
