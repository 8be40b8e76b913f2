/*
 * Copyright 2018 Red Hat Inc. and/or its affiliates and other contributors
 * as indicated by the @authors tag. All rights reserved.
 * See the copyright.txt in the distribution for a
 * full listing of individual contributors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.seqgen.core.layout;

/**
 * A lane in the diagram, or one of the two diagram edges that found and lost messages start from or end at.
 */
public class Participant {
   public static final String FOUND_LEFT = "found-left";
   public static final String FOUND_RIGHT = "found-right";
   public static final String LOST_LEFT = "lost-left";
   public static final String LOST_RIGHT = "lost-right";

   private final Kind kind;
   private final String name;
   private final String alias;
   private final int index;
   private final double x;
   private final double width;
   // y of the last message crossing the gap to the right of this lane
   private double lastMessageY;

   static Participant leftEdge() {
      return new Participant(Kind.LEFT_EDGE, "left edge", null, -1, Double.NaN, 0);
   }

   static Participant rightEdge() {
      return new Participant(Kind.RIGHT_EDGE, "right edge", null, Integer.MAX_VALUE, Double.NaN, 0);
   }

   Participant(Kind kind, String name, String alias, int index, double x, double width) {
      this.kind = kind;
      this.name = name;
      this.alias = alias;
      this.index = index;
      this.x = x;
      this.width = width;
   }

   public Kind kind() {
      return kind;
   }

   public String name() {
      return name;
   }

   public String alias() {
      return alias;
   }

   /**
    * @return The name used to refer to this participant: alias when set, name otherwise.
    */
   public String reference() {
      return alias != null ? alias : name;
   }

   public String label() {
      return name;
   }

   /**
    * @return lane index; -1 for the left edge and {@link Integer#MAX_VALUE} for the right edge.
    */
   public int index() {
      return index;
   }

   public double x() {
      return x;
   }

   public double width() {
      return width;
   }

   public double right() {
      return x + width;
   }

   public double centerX() {
      return x + width / 2;
   }

   public boolean isEdge() {
      return kind != Kind.LANE;
   }

   double lastMessageY() {
      return lastMessageY;
   }

   void lastMessageY(double lastMessageY) {
      this.lastMessageY = lastMessageY;
   }

   @Override
   public String toString() {
      return isEdge() ? name : name + "#" + index;
   }

   public enum Kind {
      LANE,
      LEFT_EDGE,
      RIGHT_EDGE
   }
}
