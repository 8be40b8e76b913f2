package io.seqgen.api.statement;

public interface StatementVisitor<R, P> {
   R visitTitle(TitleStatement statement, P param);

   R visitTitleWidth(TitleWidthStatement statement, P param);

   R visitTitleHeight(TitleHeightStatement statement, P param);

   R visitParticipant(ParticipantStatement statement, P param);

   R visitParticipantWidth(ParticipantWidthStatement statement, P param);

   R visitParticipantSpacing(ParticipantSpacingStatement statement, P param);

   R visitActivate(ActivateStatement statement, P param);

   R visitDeactivate(DeactivateStatement statement, P param);

   R visitMessage(MessageStatement statement, P param);

   R visitSelfCall(SelfCallStatement statement, P param);

   R visitFrameOpen(FrameOpenStatement statement, P param);

   R visitElse(ElseStatement statement, P param);

   R visitEnd(EndStatement statement, P param);

   R visitFrameExtend(FrameExtendStatement statement, P param);

   R visitNote(NoteStatement statement, P param);

   R visitNoteText(NoteTextStatement statement, P param);

   R visitNoteEnd(NoteEndStatement statement, P param);

   R visitOffset(OffsetStatement statement, P param);
}
