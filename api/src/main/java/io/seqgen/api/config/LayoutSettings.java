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
package io.seqgen.api.config;

import java.io.Serializable;
import java.util.Objects;

/**
 * Spacing and sizing constants used by the layout. All values are in diagram units (pixels in draw.io).
 * <p>
 * {@link #statementOffset()} is the basic vertical increment the cursor advances by for every rendered statement;
 * most other vertical distances are expressed as its multiples.
 */
public class LayoutSettings implements Serializable {
   public static final LayoutSettings DEFAULT = builder().build();

   private final int participantWidth;
   private final int participantSpacing;
   private final int laneHeaderHeight;
   private final int statementOffset;
   private final int endOffset;
   private final int messageMinSpacing;
   private final int messageAnchorOffset;
   private final int textLineHeight;
   private final int activationWidth;
   private final int activationStackOffset;
   private final int selfCallWidth;
   private final int frameTabWidth;
   private final int frameTabHeight;
   private final int frameLabelHeight;
   private final int framePadding;
   private final int branchLabelHeight;
   private final int noteWidth;
   private final int noteHeight;
   private final int titleWidth;
   private final int titleHeight;
   private final int titlePadding;
   private final int edgeMargin;

   private LayoutSettings(Builder builder) {
      this.participantWidth = builder.participantWidth;
      this.participantSpacing = builder.participantSpacing;
      this.laneHeaderHeight = builder.laneHeaderHeight;
      this.statementOffset = builder.statementOffset;
      this.endOffset = builder.endOffset;
      this.messageMinSpacing = builder.messageMinSpacing;
      this.messageAnchorOffset = builder.messageAnchorOffset;
      this.textLineHeight = builder.textLineHeight;
      this.activationWidth = builder.activationWidth;
      this.activationStackOffset = builder.activationStackOffset;
      this.selfCallWidth = builder.selfCallWidth;
      this.frameTabWidth = builder.frameTabWidth;
      this.frameTabHeight = builder.frameTabHeight;
      this.frameLabelHeight = builder.frameLabelHeight;
      this.framePadding = builder.framePadding;
      this.branchLabelHeight = builder.branchLabelHeight;
      this.noteWidth = builder.noteWidth;
      this.noteHeight = builder.noteHeight;
      this.titleWidth = builder.titleWidth;
      this.titleHeight = builder.titleHeight;
      this.titlePadding = builder.titlePadding;
      this.edgeMargin = builder.edgeMargin;
   }

   public static Builder builder() {
      return new Builder();
   }

   public Builder toBuilder() {
      return new Builder(this);
   }

   /** Default lane width for participants declared before any {@code participant width} statement. */
   public int participantWidth() {
      return participantWidth;
   }

   /** Default horizontal gap between two adjacent lanes. */
   public int participantSpacing() {
      return participantSpacing;
   }

   public int laneHeaderHeight() {
      return laneHeaderHeight;
   }

   public int statementOffset() {
      return statementOffset;
   }

   /** Vertical space added below the last statement before the lifelines end. */
   public int endOffset() {
      return endOffset;
   }

   /** Minimal vertical distance of two messages crossing the same gap between lanes. */
   public int messageMinSpacing() {
      return messageMinSpacing;
   }

   /** Distance of an activating (deactivating) message from the top (bottom) of the activation bar. */
   public int messageAnchorOffset() {
      return messageAnchorOffset;
   }

   public int textLineHeight() {
      return textLineHeight;
   }

   public int activationWidth() {
      return activationWidth;
   }

   /** Horizontal shift of each nested activation bar against the one below it. */
   public int activationStackOffset() {
      return activationStackOffset;
   }

   public int selfCallWidth() {
      return selfCallWidth;
   }

   public int frameTabWidth() {
      return frameTabWidth;
   }

   public int frameTabHeight() {
      return frameTabHeight;
   }

   /** Space reserved under the frame tab for the {@code [condition]} label. */
   public int frameLabelHeight() {
      return frameLabelHeight;
   }

   public int framePadding() {
      return framePadding;
   }

   public int branchLabelHeight() {
      return branchLabelHeight;
   }

   public int noteWidth() {
      return noteWidth;
   }

   public int noteHeight() {
      return noteHeight;
   }

   public int titleWidth() {
      return titleWidth;
   }

   public int titleHeight() {
      return titleHeight;
   }

   public int titlePadding() {
      return titlePadding;
   }

   /** Distance of the found/lost message endpoints from the outermost lanes. */
   public int edgeMargin() {
      return edgeMargin;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (o == null || getClass() != o.getClass()) {
         return false;
      }
      LayoutSettings that = (LayoutSettings) o;
      return participantWidth == that.participantWidth && participantSpacing == that.participantSpacing &&
            laneHeaderHeight == that.laneHeaderHeight && statementOffset == that.statementOffset &&
            endOffset == that.endOffset && messageMinSpacing == that.messageMinSpacing &&
            messageAnchorOffset == that.messageAnchorOffset && textLineHeight == that.textLineHeight &&
            activationWidth == that.activationWidth && activationStackOffset == that.activationStackOffset &&
            selfCallWidth == that.selfCallWidth && frameTabWidth == that.frameTabWidth &&
            frameTabHeight == that.frameTabHeight && frameLabelHeight == that.frameLabelHeight &&
            framePadding == that.framePadding && branchLabelHeight == that.branchLabelHeight &&
            noteWidth == that.noteWidth && noteHeight == that.noteHeight && titleWidth == that.titleWidth &&
            titleHeight == that.titleHeight && titlePadding == that.titlePadding && edgeMargin == that.edgeMargin;
   }

   @Override
   public int hashCode() {
      return Objects.hash(participantWidth, participantSpacing, laneHeaderHeight, statementOffset, endOffset,
            messageMinSpacing, messageAnchorOffset, textLineHeight, activationWidth, activationStackOffset,
            selfCallWidth, frameTabWidth, frameTabHeight, frameLabelHeight, framePadding, branchLabelHeight,
            noteWidth, noteHeight, titleWidth, titleHeight, titlePadding, edgeMargin);
   }

   public static class Builder {
      private int participantWidth = 160;
      private int participantSpacing = 40;
      private int laneHeaderHeight = 40;
      private int statementOffset = 10;
      private int endOffset = 20;
      private int messageMinSpacing = 20;
      private int messageAnchorOffset = 5;
      private int textLineHeight = 14;
      private int activationWidth = 10;
      private int activationStackOffset = 10;
      private int selfCallWidth = 30;
      private int frameTabWidth = 60;
      private int frameTabHeight = 20;
      private int frameLabelHeight = 30;
      private int framePadding = 10;
      private int branchLabelHeight = 30;
      private int noteWidth = 100;
      private int noteHeight = 40;
      private int titleWidth = 160;
      private int titleHeight = 40;
      private int titlePadding = 30;
      private int edgeMargin = 40;

      private Builder() {
      }

      private Builder(LayoutSettings settings) {
         this.participantWidth = settings.participantWidth;
         this.participantSpacing = settings.participantSpacing;
         this.laneHeaderHeight = settings.laneHeaderHeight;
         this.statementOffset = settings.statementOffset;
         this.endOffset = settings.endOffset;
         this.messageMinSpacing = settings.messageMinSpacing;
         this.messageAnchorOffset = settings.messageAnchorOffset;
         this.textLineHeight = settings.textLineHeight;
         this.activationWidth = settings.activationWidth;
         this.activationStackOffset = settings.activationStackOffset;
         this.selfCallWidth = settings.selfCallWidth;
         this.frameTabWidth = settings.frameTabWidth;
         this.frameTabHeight = settings.frameTabHeight;
         this.frameLabelHeight = settings.frameLabelHeight;
         this.framePadding = settings.framePadding;
         this.branchLabelHeight = settings.branchLabelHeight;
         this.noteWidth = settings.noteWidth;
         this.noteHeight = settings.noteHeight;
         this.titleWidth = settings.titleWidth;
         this.titleHeight = settings.titleHeight;
         this.titlePadding = settings.titlePadding;
         this.edgeMargin = settings.edgeMargin;
      }

      public Builder participantWidth(int participantWidth) {
         this.participantWidth = participantWidth;
         return this;
      }

      public Builder participantSpacing(int participantSpacing) {
         this.participantSpacing = participantSpacing;
         return this;
      }

      public Builder laneHeaderHeight(int laneHeaderHeight) {
         this.laneHeaderHeight = laneHeaderHeight;
         return this;
      }

      public Builder statementOffset(int statementOffset) {
         this.statementOffset = statementOffset;
         return this;
      }

      public Builder endOffset(int endOffset) {
         this.endOffset = endOffset;
         return this;
      }

      public Builder messageMinSpacing(int messageMinSpacing) {
         this.messageMinSpacing = messageMinSpacing;
         return this;
      }

      public Builder messageAnchorOffset(int messageAnchorOffset) {
         this.messageAnchorOffset = messageAnchorOffset;
         return this;
      }

      public Builder textLineHeight(int textLineHeight) {
         this.textLineHeight = textLineHeight;
         return this;
      }

      public Builder activationWidth(int activationWidth) {
         this.activationWidth = activationWidth;
         return this;
      }

      public Builder activationStackOffset(int activationStackOffset) {
         this.activationStackOffset = activationStackOffset;
         return this;
      }

      public Builder selfCallWidth(int selfCallWidth) {
         this.selfCallWidth = selfCallWidth;
         return this;
      }

      public Builder frameTabWidth(int frameTabWidth) {
         this.frameTabWidth = frameTabWidth;
         return this;
      }

      public Builder frameTabHeight(int frameTabHeight) {
         this.frameTabHeight = frameTabHeight;
         return this;
      }

      public Builder frameLabelHeight(int frameLabelHeight) {
         this.frameLabelHeight = frameLabelHeight;
         return this;
      }

      public Builder framePadding(int framePadding) {
         this.framePadding = framePadding;
         return this;
      }

      public Builder branchLabelHeight(int branchLabelHeight) {
         this.branchLabelHeight = branchLabelHeight;
         return this;
      }

      public Builder noteWidth(int noteWidth) {
         this.noteWidth = noteWidth;
         return this;
      }

      public Builder noteHeight(int noteHeight) {
         this.noteHeight = noteHeight;
         return this;
      }

      public Builder titleWidth(int titleWidth) {
         this.titleWidth = titleWidth;
         return this;
      }

      public Builder titleHeight(int titleHeight) {
         this.titleHeight = titleHeight;
         return this;
      }

      public Builder titlePadding(int titlePadding) {
         this.titlePadding = titlePadding;
         return this;
      }

      public Builder edgeMargin(int edgeMargin) {
         this.edgeMargin = edgeMargin;
         return this;
      }

      public LayoutSettings build() {
         requirePositive("participantWidth", participantWidth);
         requirePositive("statementOffset", statementOffset);
         requirePositive("activationWidth", activationWidth);
         requirePositive("textLineHeight", textLineHeight);
         requireNonNegative("participantSpacing", participantSpacing);
         requireNonNegative("laneHeaderHeight", laneHeaderHeight);
         requireNonNegative("endOffset", endOffset);
         requireNonNegative("messageMinSpacing", messageMinSpacing);
         requireNonNegative("messageAnchorOffset", messageAnchorOffset);
         requireNonNegative("activationStackOffset", activationStackOffset);
         requireNonNegative("selfCallWidth", selfCallWidth);
         requireNonNegative("frameTabWidth", frameTabWidth);
         requireNonNegative("frameTabHeight", frameTabHeight);
         requireNonNegative("frameLabelHeight", frameLabelHeight);
         requireNonNegative("framePadding", framePadding);
         requireNonNegative("branchLabelHeight", branchLabelHeight);
         requirePositive("noteWidth", noteWidth);
         requirePositive("noteHeight", noteHeight);
         requirePositive("titleWidth", titleWidth);
         requirePositive("titleHeight", titleHeight);
         requireNonNegative("titlePadding", titlePadding);
         requireNonNegative("edgeMargin", edgeMargin);
         return new LayoutSettings(this);
      }

      private static void requirePositive(String name, int value) {
         if (value <= 0) {
            throw new DiagramDefinitionException(ErrorKind.INVALID_SETTING, name + " must be positive, was " + value);
         }
      }

      private static void requireNonNegative(String name, int value) {
         if (value < 0) {
            throw new DiagramDefinitionException(ErrorKind.INVALID_SETTING, name + " must not be negative, was " + value);
         }
      }
   }
}
