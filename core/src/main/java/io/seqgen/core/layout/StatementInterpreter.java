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
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.seqgen.api.config.DiagramDefinitionException;
import io.seqgen.api.config.ErrorKind;
import io.seqgen.api.config.LayoutSettings;
import io.seqgen.api.scene.ActivationBar;
import io.seqgen.api.scene.BranchDivider;
import io.seqgen.api.scene.FrameBox;
import io.seqgen.api.scene.LaneHeader;
import io.seqgen.api.scene.MessageArrow;
import io.seqgen.api.scene.NoteBox;
import io.seqgen.api.scene.Point;
import io.seqgen.api.scene.SceneGraph;
import io.seqgen.api.scene.TitleBox;
import io.seqgen.api.statement.ActivateStatement;
import io.seqgen.api.statement.ArrowStyle;
import io.seqgen.api.statement.DeactivateStatement;
import io.seqgen.api.statement.ElseStatement;
import io.seqgen.api.statement.EndStatement;
import io.seqgen.api.statement.FrameExtendStatement;
import io.seqgen.api.statement.FrameOpenStatement;
import io.seqgen.api.statement.LineStyle;
import io.seqgen.api.statement.MessageActivation;
import io.seqgen.api.statement.MessageStatement;
import io.seqgen.api.statement.NoteEndStatement;
import io.seqgen.api.statement.NoteStatement;
import io.seqgen.api.statement.NoteTextStatement;
import io.seqgen.api.statement.OffsetStatement;
import io.seqgen.api.statement.ParticipantSpacingStatement;
import io.seqgen.api.statement.ParticipantStatement;
import io.seqgen.api.statement.ParticipantWidthStatement;
import io.seqgen.api.statement.SelfCallStatement;
import io.seqgen.api.statement.Statement;
import io.seqgen.api.statement.StatementVisitor;
import io.seqgen.api.statement.TitleHeightStatement;
import io.seqgen.api.statement.TitleStatement;
import io.seqgen.api.statement.TitleWidthStatement;

/**
 * Lays out a sequence of statements in a single pass, producing the {@link SceneGraph}.
 * <p>
 * The interpreter itself holds only the settings; all mutable state lives in {@link LayoutState}
 * so the same instance can lay out any number of documents, concurrently as well.
 */
public class StatementInterpreter implements StatementVisitor<Void, LayoutState> {
   private static final Logger log = LogManager.getLogger(StatementInterpreter.class);
   private static final boolean trace = log.isTraceEnabled();

   private final LayoutSettings settings;

   public StatementInterpreter() {
      this(LayoutSettings.DEFAULT);
   }

   public StatementInterpreter(LayoutSettings settings) {
      this.settings = settings;
   }

   public LayoutSettings settings() {
      return settings;
   }

   public SceneGraph interpret(List<? extends Statement> statements) {
      log.debug("Laying out {} statements", statements.size());
      LayoutState state = new LayoutState(settings);
      for (Statement statement : statements) {
         process(state, statement);
      }
      return finish(state);
   }

   public void process(LayoutState state, Statement statement) {
      if (trace) {
         log.trace("Line {}: {} at y={}", statement.line(), statement, state.cursor.current());
      }
      state.line = statement.line();
      try {
         statement.accept(this, state);
      } catch (DiagramDefinitionException e) {
         throw e.atLine(statement.line());
      }
   }

   /**
    * Checks that everything opened was closed, sizes the lanes and the title and returns the scene.
    */
   public SceneGraph finish(LayoutState state) {
      if (state.note != null) {
         throw new DiagramDefinitionException(ErrorKind.UNTERMINATED_NOTE, state.note.line(),
               "note for '" + state.note.target() + "' is missing 'end note'");
      }
      if (!state.activations.allInactive()) {
         List<Activation> open = state.activations.openActivations();
         int line = open.stream().mapToInt(Activation::line).min().orElse(DiagramDefinitionException.UNKNOWN_LINE);
         String names = open.stream().sorted(Comparator.comparingInt(Activation::line))
               .map(a -> a.participant().name()).collect(Collectors.joining(", "));
         throw new DiagramDefinitionException(ErrorKind.UNBALANCED_ACTIVATION, line, "participants still active at the end: " + names);
      }
      if (!state.frames.isEmpty()) {
         String open = state.frames.openFrames().stream().map(Frame::toString).collect(Collectors.joining(", "));
         throw new DiagramDefinitionException(ErrorKind.UNCLOSED_FRAME, state.frames.innermost().line(), "frames not closed: " + open);
      }
      Cursor cursor = state.cursor;
      cursor.advance(settings.endOffset());
      for (Map.Entry<Participant, Integer> entry : state.laneSlots.entrySet()) {
         Participant p = entry.getKey();
         state.scene.fill(entry.getValue(), new LaneHeader(p.name(), p.label(), p.index(), p.x(), 0, p.width(),
               cursor.current(), settings.laneHeaderHeight()));
      }
      if (state.title != null) {
         double padding = settings.titlePadding();
         double minX = state.extent.isEmpty() ? 0 : state.extent.min();
         double maxX = state.extent.isEmpty() ? 0 : state.extent.max();
         double x = minX - padding;
         double y = -padding - state.titleHeight;
         state.scene.fill(state.titleSlot, new TitleBox(state.title, x, y, maxX + padding - x, cursor.current() - y + padding,
               state.titleWidth, state.titleHeight));
      }
      SceneGraph graph = state.scene.build();
      log.debug("Layout finished with {} nodes, diagram height {}", graph.size(), cursor.current());
      return graph;
   }

   @Override
   public Void visitTitle(TitleStatement statement, LayoutState state) {
      checkNoOpenNote(state);
      if (state.title != null) {
         throw new DiagramDefinitionException(ErrorKind.DUPLICATE_TITLE, "title was already set on line " + state.titleLine);
      }
      state.title = statement.text();
      state.titleLine = statement.line();
      state.titleSlot = state.scene.reserve();
      return null;
   }

   @Override
   public Void visitTitleWidth(TitleWidthStatement statement, LayoutState state) {
      checkNoOpenNote(state);
      state.titleWidth = positive("title width", statement.width());
      return null;
   }

   @Override
   public Void visitTitleHeight(TitleHeightStatement statement, LayoutState state) {
      checkNoOpenNote(state);
      state.titleHeight = positive("title height", statement.height());
      return null;
   }

   @Override
   public Void visitParticipant(ParticipantStatement statement, LayoutState state) {
      checkNoOpenNote(state);
      Participant participant = state.registry.declare(statement.name(), statement.alias(), state.participantWidth, state.participantSpacing);
      state.laneSlots.put(participant, state.scene.reserve());
      state.extent.include(state.registry.laneSpan(participant));
      log.debug("Declared {} at x={}", participant, participant.x());
      return null;
   }

   @Override
   public Void visitParticipantWidth(ParticipantWidthStatement statement, LayoutState state) {
      checkNoOpenNote(state);
      state.participantWidth = positive("participant width", statement.width());
      return null;
   }

   @Override
   public Void visitParticipantSpacing(ParticipantSpacingStatement statement, LayoutState state) {
      checkNoOpenNote(state);
      if (statement.spacing() < 0) {
         throw new DiagramDefinitionException(ErrorKind.INVALID_SETTING, "participant spacing must not be negative: " + statement.spacing());
      }
      state.participantSpacing = statement.spacing();
      return null;
   }

   @Override
   public Void visitActivate(ActivateStatement statement, LayoutState state) {
      checkNoOpenNote(state);
      List<Participant> participants = resolveLanes(state, statement.targets());
      double y = state.cursor.current();
      for (Participant participant : participants) {
         state.activations.activate(participant, null, y, statement.line());
         state.frames.referenceParticipant(participant);
      }
      state.cursor.advance(settings.statementOffset());
      return null;
   }

   @Override
   public Void visitDeactivate(DeactivateStatement statement, LayoutState state) {
      checkNoOpenNote(state);
      List<Participant> participants = resolveLanes(state, statement.targets());
      double y = state.cursor.current();
      for (Participant participant : participants) {
         addBar(state, state.activations.deactivate(participant), y);
         state.frames.referenceParticipant(participant);
      }
      state.cursor.advance(settings.statementOffset());
      return null;
   }

   @Override
   public Void visitMessage(MessageStatement statement, LayoutState state) {
      checkNoOpenNote(state);
      ParticipantRegistry registry = state.registry;
      Participant sender = registry.resolveSender(statement.sender());
      Participant receiver = registry.resolveReceiver(statement.receiver());
      MessageActivation activation = statement.activation();
      boolean found = sender.isEdge();
      boolean lost = receiver.isEdge();
      if (found && lost) {
         throw new DiagramDefinitionException(ErrorKind.INVALID_ACTIVATION_FOR_FOUND_LOST, "message cannot go from one diagram edge to another");
      } else if (found && activation != MessageActivation.NONE && activation != MessageActivation.ACTIVATE) {
         throw new DiagramDefinitionException(ErrorKind.INVALID_ACTIVATION_FOR_FOUND_LOST,
               "found message can only activate the receiver, got '" + activation.marker() + "'");
      } else if (lost && activation != MessageActivation.NONE && activation != MessageActivation.DEACTIVATE) {
         throw new DiagramDefinitionException(ErrorKind.INVALID_ACTIVATION_FOR_FOUND_LOST,
               "lost message can only deactivate the sender, got '" + activation.marker() + "'");
      }
      if (sender == receiver) {
         if (activation != MessageActivation.NONE) {
            throw new DiagramDefinitionException(ErrorKind.INVALID_ACTIVATION_FOR_SELF_CALL,
                  "message to self cannot carry activation marker '" + activation.marker() + "'");
         }
         selfCall(state, sender, statement.text(), statement.lineStyle(), statement.arrowStyle());
         return null;
      }
      if (!found && !state.activations.isActive(sender)) {
         boolean opening = !state.messageSeen && (activation == MessageActivation.ACTIVATE || activation == MessageActivation.FIRE_AND_FORGET);
         if (!opening) {
            throw new DiagramDefinitionException(ErrorKind.SENDER_NOT_ACTIVE, "'" + sender.name() + "' is not active");
         }
      }

      Cursor cursor = state.cursor;
      double anchor = settings.messageAnchorOffset();
      double extra = extraLinesHeight(statement.text());
      double y;
      switch (activation) {
         case ACTIVATE:
            ensureSpacing(state, sender, receiver, anchor, extra);
            state.activations.activate(receiver, sender, cursor.current(), statement.line());
            y = cursor.current() + anchor;
            addArrow(state, statement, sender, receiver, y);
            break;
         case DEACTIVATE:
            ensureSpacing(state, sender, receiver, -anchor, extra);
            y = cursor.current() - anchor;
            addArrow(state, statement, sender, receiver, y);
            addBar(state, state.activations.deactivate(sender), cursor.current());
            break;
         case FIRE_AND_FORGET:
            state.activations.activate(receiver, sender, cursor.current(), statement.line());
            cursor.advance(settings.statementOffset());
            ensureSpacing(state, sender, receiver, settings.statementOffset(), extra);
            addArrow(state, statement, sender, receiver, cursor.current());
            cursor.advance(settings.statementOffset());
            addBar(state, state.activations.deactivate(receiver), cursor.current());
            break;
         case NONE:
         default:
            ensureSpacing(state, sender, receiver, 0, extra);
            addArrow(state, statement, sender, receiver, cursor.current());
            break;
      }
      state.frames.referenceParticipant(sender);
      state.frames.referenceParticipant(receiver);
      cursor.advance(settings.statementOffset());
      state.messageSeen = true;
      return null;
   }

   @Override
   public Void visitSelfCall(SelfCallStatement statement, LayoutState state) {
      checkNoOpenNote(state);
      Participant participant = state.registry.resolveLane(statement.target());
      selfCall(state, participant, statement.text(), LineStyle.SOLID, ArrowStyle.CLOSED);
      return null;
   }

   private void selfCall(LayoutState state, Participant participant, List<String> text, LineStyle lineStyle, ArrowStyle arrowStyle) {
      ActivationTracker activations = state.activations;
      if (!activations.isActive(participant)) {
         throw new DiagramDefinitionException(ErrorKind.SENDER_NOT_ACTIVE, "'" + participant.name() + "' must be active to call itself");
      }
      Cursor cursor = state.cursor;
      int offset = settings.statementOffset();
      double half = settings.activationWidth() / 2.0;
      cursor.advance(offset);
      Activation caller = activations.top(participant);
      activations.activate(participant, null, cursor.current(), state.line);
      Activation callee = activations.top(participant);

      double center = participant.centerX();
      double loopX = center + callee.dx() + settings.selfCallWidth() - half;
      double y = cursor.current();
      List<Point> waypoints = Arrays.asList(new Point(loopX, y - offset), new Point(loopX, y + offset));
      state.scene.add(new MessageArrow(MessageArrow.Kind.SELF, participant.name(), participant.name(), text, lineStyle, arrowStyle,
            new Point(center + caller.dx() + half, y - offset), new Point(center + callee.dx() + half, y + offset), waypoints));

      cursor.advance(2 * offset + extraLinesHeight(text));
      addBar(state, activations.deactivate(participant), cursor.current());
      state.frames.referenceParticipant(participant);
      state.frames.include(center, loopX);
      state.extent.include(center, loopX);
      cursor.advance(offset);
      state.messageSeen = true;
   }

   @Override
   public Void visitFrameOpen(FrameOpenStatement statement, LayoutState state) {
      checkNoOpenNote(state);
      Cursor cursor = state.cursor;
      cursor.advance(settings.statementOffset());
      Frame frame = state.frames.open(statement.kind(), statement.label(), cursor.current(), statement.line(), state.scene.reserve());
      cursor.advance(settings.frameTabHeight() + settings.frameLabelHeight());
      state.registry.resetGaps(cursor.current());
      cursor.advance(settings.statementOffset());
      log.debug("Opened {} at depth {}", frame, frame.depth());
      return null;
   }

   @Override
   public Void visitElse(ElseStatement statement, LayoutState state) {
      checkNoOpenNote(state);
      Cursor cursor = state.cursor;
      state.frames.addBranch(statement.label(), cursor.offset(settings.statementOffset()));
      cursor.advance(settings.statementOffset() + settings.branchLabelHeight());
      state.registry.resetGaps(cursor.current());
      cursor.advance(settings.statementOffset());
      return null;
   }

   @Override
   public Void visitEnd(EndStatement statement, LayoutState state) {
      checkNoOpenNote(state);
      Cursor cursor = state.cursor;
      FrameStack frames = state.frames;
      Frame frame = frames.closeInnermost(cursor.offset(settings.statementOffset()));
      cursor.advance(settings.statementOffset());

      double x = frames.boxMinX(frame);
      double width = frames.boxMaxX(frame) - x;
      state.scene.fill(frame.slot(), new FrameBox(frame.kind(), frame.label(), frame.depth(), frame.branchCount(),
            x, frame.yStart(), width, frame.yEnd() - frame.yStart(), settings.frameTabWidth(), settings.frameTabHeight()));
      for (Frame.Branch branch : frame.branches()) {
         state.scene.add(new BranchDivider(branch.label(), x, branch.y(), width));
      }
      state.extent.include(x, x + width);
      log.debug("Closed {}: x={}, width={}, y=[{}, {})", frame, x, width, frame.yStart(), frame.yEnd());

      state.registry.resetGaps(cursor.current());
      cursor.advance(settings.statementOffset());
      return null;
   }

   @Override
   public Void visitFrameExtend(FrameExtendStatement statement, LayoutState state) {
      checkNoOpenNote(state);
      state.frames.extend(statement.delta());
      return null;
   }

   @Override
   public Void visitNote(NoteStatement statement, LayoutState state) {
      checkNoOpenNote(state);
      Participant participant = state.registry.resolveLane(statement.target());
      state.frames.referenceParticipant(participant);
      state.note = statement;
      state.noteY = state.cursor.offset(statement.dy());
      state.noteText.clear();
      return null;
   }

   @Override
   public Void visitNoteText(NoteTextStatement statement, LayoutState state) {
      if (state.note == null) {
         throw new IllegalStateException("Note text on line " + statement.line() + " outside of a note");
      }
      state.noteText.add(statement.text());
      return null;
   }

   @Override
   public Void visitNoteEnd(NoteEndStatement statement, LayoutState state) {
      NoteStatement note = state.note;
      if (note == null) {
         throw new IllegalStateException("'end note' on line " + statement.line() + " without a note");
      }
      Participant participant = state.registry.resolveLane(note.target());
      double x = participant.centerX() + note.dx();
      double width = note.width() != null ? note.width() : settings.noteWidth();
      double height = note.height() != null ? note.height() : settings.noteHeight();
      state.scene.add(new NoteBox(participant.name(), new ArrayList<>(state.noteText), x, state.noteY, width, height));
      state.frames.include(x, x + width);
      state.extent.include(x, x + width);
      state.note = null;
      state.noteText.clear();
      return null;
   }

   @Override
   public Void visitOffset(OffsetStatement statement, LayoutState state) {
      checkNoOpenNote(state);
      state.cursor.advance(statement.dy());
      return null;
   }

   private void checkNoOpenNote(LayoutState state) {
      if (state.note != null) {
         throw new DiagramDefinitionException(ErrorKind.UNTERMINATED_NOTE, state.note.line(),
               "note for '" + state.note.target() + "' must be closed with 'end note' first");
      }
   }

   private static List<Participant> resolveLanes(LayoutState state, List<String> references) {
      List<Participant> participants = new ArrayList<>(references.size());
      for (String reference : references) {
         participants.add(state.registry.resolveLane(reference));
      }
      return participants;
   }

   private static int positive(String what, int value) {
      if (value <= 0) {
         throw new DiagramDefinitionException(ErrorKind.INVALID_SETTING, what + " must be positive: " + value);
      }
      return value;
   }

   private double extraLinesHeight(List<String> text) {
      return Math.max(0, text.size() - 1) * settings.textLineHeight();
   }

   /**
    * Pushes the cursor down so that the message keeps minimal spacing to the previous message
    * crossing any of the gaps between the two participants.
    */
   private void ensureSpacing(LayoutState state, Participant a, Participant b, double messageDy, double extra) {
      Cursor cursor = state.cursor;
      double last = state.registry.lastMessageY(a, b);
      if (last != Double.NEGATIVE_INFINITY) {
         double spacing = cursor.current() - last;
         double required = settings.messageMinSpacing() - messageDy + extra;
         if (spacing < required) {
            int step = settings.statementOffset();
            cursor.advance(Math.ceil((required - spacing) / step) * step);
         }
      }
      state.registry.markMessage(a, b, cursor.current() + messageDy);
   }

   private void addArrow(LayoutState state, MessageStatement statement, Participant sender, Participant receiver, double y) {
      MessageArrow.Kind kind = sender.isEdge() ? MessageArrow.Kind.FOUND : receiver.isEdge() ? MessageArrow.Kind.LOST : MessageArrow.Kind.REGULAR;
      double senderX = state.registry.anchorX(sender);
      double receiverX = state.registry.anchorX(receiver);
      Point source = new Point(attachX(state, sender, receiverX), y);
      Point target = new Point(attachX(state, receiver, senderX), y);
      state.scene.add(new MessageArrow(kind, displayName(sender, statement.sender()), displayName(receiver, statement.receiver()),
            statement.text(), statement.lineStyle(), statement.arrowStyle(), source, target, Collections.emptyList()));
      state.extent.include(source.x(), target.x());
   }

   private static String displayName(Participant participant, String reference) {
      return participant.isEdge() ? reference : participant.name();
   }

   // side of the innermost activation bar facing the other end, or the lane centre when inactive
   private double attachX(LayoutState state, Participant participant, double towardsX) {
      if (participant.isEdge()) {
         return state.registry.anchorX(participant);
      }
      Activation top = state.activations.top(participant);
      if (top == null) {
         return participant.centerX();
      }
      double center = participant.centerX() + top.dx();
      double half = settings.activationWidth() / 2.0;
      return towardsX >= center ? center + half : center - half;
   }

   private void addBar(LayoutState state, Activation activation, double endY) {
      Participant participant = activation.participant();
      double x = participant.centerX() + activation.dx() - settings.activationWidth() / 2.0;
      state.scene.add(new ActivationBar(participant.name(), activation.depth(), x, activation.startY(),
            settings.activationWidth(), endY - activation.startY()));
      state.extent.include(x, x + settings.activationWidth());
   }
}
