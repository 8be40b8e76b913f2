package io.seqgen.api.statement;

public enum LineStyle {
   SOLID,
   DASHED
}
