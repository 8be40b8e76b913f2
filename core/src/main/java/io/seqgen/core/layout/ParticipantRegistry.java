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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.seqgen.api.config.DiagramDefinitionException;
import io.seqgen.api.config.ErrorKind;

/**
 * Declared participants in lane order, plus the two diagram edges.
 * <p>
 * Lane geometry is fixed at declaration: the first lane starts at x = 0, every following lane starts
 * {@code spacing} after the end of the previous one, using the width and spacing passed to {@link #declare}.
 */
public class ParticipantRegistry {
   private final List<Participant> lanes = new ArrayList<>();
   private final Map<String, Participant> byReference = new HashMap<>();
   private final Participant leftEdge = Participant.leftEdge();
   private final Participant rightEdge = Participant.rightEdge();
   private final double edgeMargin;

   public ParticipantRegistry(double edgeMargin) {
      this.edgeMargin = edgeMargin;
   }

   public Participant declare(String name, String alias, double width, double spacing) {
      checkAvailable(name);
      if (alias != null && !alias.equals(name)) {
         checkAvailable(alias);
      }
      int index = lanes.size();
      double x = lanes.isEmpty() ? 0 : lanes.get(index - 1).right() + spacing;
      Participant participant = new Participant(Participant.Kind.LANE, name, alias, index, x, width);
      lanes.add(participant);
      byReference.put(name, participant);
      if (alias != null) {
         byReference.put(alias, participant);
      }
      return participant;
   }

   private void checkAvailable(String reference) {
      if (isEdgeReference(reference)) {
         throw new DiagramDefinitionException(ErrorKind.DUPLICATE_PARTICIPANT, "'" + reference + "' is reserved for diagram edges");
      }
      Participant existing = byReference.get(reference);
      if (existing != null) {
         throw new DiagramDefinitionException(ErrorKind.DUPLICATE_PARTICIPANT,
               "'" + reference + "' is already used by participant " + existing.name());
      }
   }

   /**
    * Finds a declared participant by name or alias, or one of the edges by its found/lost identity.
    */
   public Participant resolve(String reference) {
      switch (reference) {
         case Participant.FOUND_LEFT:
         case Participant.LOST_LEFT:
            return leftEdge;
         case Participant.FOUND_RIGHT:
         case Participant.LOST_RIGHT:
            return rightEdge;
         default:
            Participant participant = byReference.get(reference);
            if (participant == null) {
               throw new DiagramDefinitionException(ErrorKind.UNKNOWN_PARTICIPANT, "'" + reference + "' was not declared");
            }
            return participant;
      }
   }

   /**
    * Like {@link #resolve(String)} but accepts only declared participants.
    */
   public Participant resolveLane(String reference) {
      Participant participant = resolve(reference);
      if (participant.isEdge()) {
         throw new DiagramDefinitionException(ErrorKind.UNKNOWN_PARTICIPANT, "'" + reference + "' is a diagram edge, not a participant");
      }
      return participant;
   }

   public Participant resolveSender(String reference) {
      if (Participant.LOST_LEFT.equals(reference) || Participant.LOST_RIGHT.equals(reference)) {
         throw new DiagramDefinitionException(ErrorKind.UNKNOWN_PARTICIPANT, "'" + reference + "' can only receive messages");
      }
      return resolve(reference);
   }

   public Participant resolveReceiver(String reference) {
      if (Participant.FOUND_LEFT.equals(reference) || Participant.FOUND_RIGHT.equals(reference)) {
         throw new DiagramDefinitionException(ErrorKind.UNKNOWN_PARTICIPANT, "'" + reference + "' can only send messages");
      }
      return resolve(reference);
   }

   public static boolean isEdgeReference(String reference) {
      return Participant.FOUND_LEFT.equals(reference) || Participant.FOUND_RIGHT.equals(reference) ||
            Participant.LOST_LEFT.equals(reference) || Participant.LOST_RIGHT.equals(reference);
   }

   public List<Participant> lanes() {
      return Collections.unmodifiableList(lanes);
   }

   public int size() {
      return lanes.size();
   }

   /**
    * @return x where messages attach to the participant when it is not active: lane centre, or the edge position.
    */
   public double anchorX(Participant participant) {
      switch (participant.kind()) {
         case LEFT_EDGE:
            return (lanes.isEmpty() ? 0 : lanes.get(0).x()) - edgeMargin;
         case RIGHT_EDGE:
            return (lanes.isEmpty() ? 0 : lanes.get(lanes.size() - 1).right()) + edgeMargin;
         default:
            return participant.centerX();
      }
   }

   /**
    * @return horizontal extent of the lane; a zero-width span at the edge position for the edges.
    */
   public Span laneSpan(Participant participant) {
      if (participant.isEdge()) {
         double x = anchorX(participant);
         return new Span(x, x);
      }
      return new Span(participant.x(), participant.right());
   }

   /**
    * @return y of the latest message crossing any gap between the two participants,
    * or {@link Double#NEGATIVE_INFINITY} if there is no lane gap between them.
    */
   public double lastMessageY(Participant a, Participant b) {
      double last = Double.NEGATIVE_INFINITY;
      for (Participant owner : gapsBetween(a, b)) {
         last = Math.max(last, owner.lastMessageY());
      }
      return last;
   }

   public void markMessage(Participant a, Participant b, double y) {
      for (Participant owner : gapsBetween(a, b)) {
         owner.lastMessageY(y);
      }
   }

   public void resetGaps(double y) {
      leftEdge.lastMessageY(y);
      for (Participant lane : lanes) {
         lane.lastMessageY(y);
      }
   }

   // each lane owns the gap to its right, the left edge owns the gap before the first lane
   private List<Participant> gapsBetween(Participant a, Participant b) {
      int low = Math.min(a.index(), b.index());
      int high = Math.max(a.index(), b.index());
      if (low == high) {
         return Collections.emptyList();
      }
      List<Participant> owners = new ArrayList<>();
      if (low < 0) {
         owners.add(leftEdge);
      }
      int to = Math.min(lanes.size(), high);
      for (int i = Math.max(0, low); i < to; ++i) {
         owners.add(lanes.get(i));
      }
      return owners;
   }
}
