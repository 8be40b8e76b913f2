package io.seqgen.api.statement;

public enum ArrowStyle {
   CLOSED,
   OPEN
}
