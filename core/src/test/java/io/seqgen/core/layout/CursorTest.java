package io.seqgen.core.layout;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

public class CursorTest {
   @Test
   public void testOffsetIsOneShot() {
      Cursor cursor = new Cursor(60);
      assertThat(cursor.offset(-15)).isEqualTo(45);
      assertThat(cursor.current()).isEqualTo(60);
      assertThat(cursor.advance(10)).isEqualTo(70);
      assertThat(cursor.advance(25)).isEqualTo(95);
      assertThat(cursor.current()).isEqualTo(95);
   }
}
