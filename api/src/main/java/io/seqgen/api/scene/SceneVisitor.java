package io.seqgen.api.scene;

public interface SceneVisitor<R> {
   R visitLaneHeader(LaneHeader lane);

   R visitActivationBar(ActivationBar bar);

   R visitMessageArrow(MessageArrow message);

   R visitFrameBox(FrameBox frame);

   R visitBranchDivider(BranchDivider divider);

   R visitNoteBox(NoteBox note);

   R visitTitleBox(TitleBox title);
}
