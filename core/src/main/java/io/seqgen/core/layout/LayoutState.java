package io.seqgen.core.layout;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.seqgen.api.config.LayoutSettings;
import io.seqgen.api.scene.SceneGraph;
import io.seqgen.api.statement.NoteStatement;

/**
 * Mutable state of a single interpretation run. A new instance is created for each document;
 * nothing here is shared between runs.
 */
public class LayoutState {
   final LayoutSettings settings;
   final Cursor cursor;
   final ParticipantRegistry registry;
   final ActivationTracker activations;
   final FrameStack frames;
   final SceneGraph.Builder scene = SceneGraph.builder();
   // horizontal extent of everything drawn, used to place the title frame
   final Span extent = new Span();
   final Map<Participant, Integer> laneSlots = new LinkedHashMap<>();

   int participantWidth;
   int participantSpacing;

   String title;
   int titleLine;
   int titleSlot = -1;
   int titleWidth;
   int titleHeight;

   NoteStatement note;
   double noteY;
   final List<String> noteText = new ArrayList<>();

   boolean messageSeen;
   int line;

   public LayoutState(LayoutSettings settings) {
      this.settings = settings;
      this.cursor = new Cursor(settings.laneHeaderHeight() + 2 * settings.statementOffset());
      this.registry = new ParticipantRegistry(settings.edgeMargin());
      this.activations = new ActivationTracker(settings.activationStackOffset());
      this.frames = new FrameStack(registry, settings.framePadding());
      this.participantWidth = settings.participantWidth();
      this.participantSpacing = settings.participantSpacing();
      this.titleWidth = settings.titleWidth();
      this.titleHeight = settings.titleHeight();
   }

   public LayoutSettings settings() {
      return settings;
   }

   public Cursor cursor() {
      return cursor;
   }

   public ParticipantRegistry registry() {
      return registry;
   }

   public ActivationTracker activations() {
      return activations;
   }

   public FrameStack frames() {
      return frames;
   }

   /**
    * @return line of the statement being processed, or of the last processed one.
    */
   public int line() {
      return line;
   }

   public boolean hasOpenNote() {
      return note != null;
   }
}
