package io.seqgen.api.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

public class DiagramDefinitionExceptionTest {
   @Test
   public void testMessageWithoutLine() {
      DiagramDefinitionException e = new DiagramDefinitionException(ErrorKind.OVER_DEACTIVATION, "'A' is not active");
      assertThat(e.line()).isEqualTo(DiagramDefinitionException.UNKNOWN_LINE);
      assertThat(e.getMessage()).isEqualTo("OverDeactivation: 'A' is not active");
   }

   @Test
   public void testAtLine() {
      DiagramDefinitionException e = new DiagramDefinitionException(ErrorKind.EMPTY_FRAME, "nothing inside");
      DiagramDefinitionException located = e.atLine(7);
      assertThat(located.line()).isEqualTo(7);
      assertThat(located.kind()).isEqualTo(ErrorKind.EMPTY_FRAME);
      assertThat(located.detail()).isEqualTo("nothing inside");
      assertThat(located.getMessage()).isEqualTo("line 7: EmptyFrame: nothing inside");
      assertThat(located.getCause()).isSameAs(e);
      // the first line wins
      assertThat(located.atLine(9)).isSameAs(located);
   }
}
