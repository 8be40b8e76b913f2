package io.seqgen.api.statement;

public enum FrameKind {
   OPT("opt"),
   ALT("alt"),
   LOOP("loop"),
   GROUP("group");

   private final String keyword;

   FrameKind(String keyword) {
      this.keyword = keyword;
   }

   public String keyword() {
      return keyword;
   }

   public static FrameKind fromKeyword(String keyword) {
      for (FrameKind kind : values()) {
         if (kind.keyword.equals(keyword)) {
            return kind;
         }
      }
      return null;
   }
}
