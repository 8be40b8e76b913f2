package io.seqgen.core.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Random;

import org.junit.jupiter.api.Test;

import io.seqgen.api.config.DiagramDefinitionException;
import io.seqgen.api.config.ErrorKind;

public class ParticipantRegistryTest {
   private static ErrorKind kindOf(Throwable t) {
      return ((DiagramDefinitionException) t).kind();
   }

   @Test
   public void testLanePositions() {
      ParticipantRegistry registry = new ParticipantRegistry(40);
      Participant a = registry.declare("A", null, 160, 40);
      Participant b = registry.declare("B", "b", 100, 20);
      Participant c = registry.declare("C", null, 160, 40);

      assertThat(a.index()).isZero();
      assertThat(a.x()).isZero();
      assertThat(b.index()).isEqualTo(1);
      assertThat(b.x()).isEqualTo(180);
      assertThat(c.x()).isEqualTo(320);
      assertThat(c.centerX()).isEqualTo(400);
      assertThat(registry.resolve("b")).isSameAs(b);
      assertThat(registry.resolve("B")).isSameAs(b);
      assertThat(b.reference()).isEqualTo("b");
      assertThat(registry.lanes()).containsExactly(a, b, c);
   }

   @Test
   public void testLanesAreMonotonic() {
      Random random = new Random(42);
      ParticipantRegistry registry = new ParticipantRegistry(40);
      double previousX = Double.NEGATIVE_INFINITY;
      for (int i = 0; i < 50; ++i) {
         Participant p = registry.declare("p" + i, null, 1 + random.nextInt(300), random.nextInt(100));
         assertThat(p.index()).isEqualTo(i);
         assertThat(p.x()).isGreaterThan(previousX);
         previousX = p.x();
      }
      // earlier declarations never move
      assertThat(registry.resolve("p0").x()).isZero();
   }

   @Test
   public void testDuplicates() {
      ParticipantRegistry registry = new ParticipantRegistry(40);
      registry.declare("Alice", "A", 160, 40);
      assertThatThrownBy(() -> registry.declare("Alice", null, 160, 40))
            .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.DUPLICATE_PARTICIPANT));
      assertThatThrownBy(() -> registry.declare("Bob", "A", 160, 40))
            .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.DUPLICATE_PARTICIPANT));
      assertThatThrownBy(() -> registry.declare("A", null, 160, 40))
            .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.DUPLICATE_PARTICIPANT));
      assertThatThrownBy(() -> registry.declare(Participant.FOUND_LEFT, null, 160, 40))
            .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.DUPLICATE_PARTICIPANT));
      assertThat(registry.size()).isEqualTo(1);
   }

   @Test
   public void testEdges() {
      ParticipantRegistry registry = new ParticipantRegistry(40);
      registry.declare("A", null, 160, 40);
      registry.declare("B", null, 160, 40);

      Participant left = registry.resolve(Participant.FOUND_LEFT);
      assertThat(registry.resolve(Participant.LOST_LEFT)).isSameAs(left);
      Participant right = registry.resolve(Participant.LOST_RIGHT);
      assertThat(registry.resolve(Participant.FOUND_RIGHT)).isSameAs(right);
      assertThat(left.isEdge()).isTrue();
      assertThat(registry.anchorX(left)).isEqualTo(-40);
      assertThat(registry.anchorX(right)).isEqualTo(400);

      // the right edge follows lanes declared later
      registry.declare("C", null, 160, 40);
      assertThat(registry.anchorX(right)).isEqualTo(600);

      assertThatThrownBy(() -> registry.resolveLane(Participant.FOUND_LEFT))
            .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.UNKNOWN_PARTICIPANT));
      assertThatThrownBy(() -> registry.resolveSender(Participant.LOST_RIGHT))
            .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.UNKNOWN_PARTICIPANT));
      assertThatThrownBy(() -> registry.resolveReceiver(Participant.FOUND_RIGHT))
            .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.UNKNOWN_PARTICIPANT));
   }

   @Test
   public void testUnknown() {
      ParticipantRegistry registry = new ParticipantRegistry(40);
      assertThatThrownBy(() -> registry.resolve("nobody"))
            .isInstanceOf(DiagramDefinitionException.class)
            .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ErrorKind.UNKNOWN_PARTICIPANT))
            .hasMessageContaining("nobody");
   }

   @Test
   public void testGapBookkeeping() {
      ParticipantRegistry registry = new ParticipantRegistry(40);
      Participant a = registry.declare("A", null, 160, 40);
      Participant b = registry.declare("B", null, 160, 40);
      Participant c = registry.declare("C", null, 160, 40);

      registry.markMessage(a, b, 100);
      assertThat(registry.lastMessageY(a, b)).isEqualTo(100);
      assertThat(registry.lastMessageY(b, c)).isZero();
      assertThat(registry.lastMessageY(c, a)).isEqualTo(100);
      assertThat(registry.lastMessageY(a, a)).isEqualTo(Double.NEGATIVE_INFINITY);

      registry.resetGaps(150);
      assertThat(registry.lastMessageY(a, c)).isEqualTo(150);

      Participant right = registry.resolve(Participant.LOST_RIGHT);
      registry.markMessage(c, right, 170);
      assertThat(registry.lastMessageY(right, c)).isEqualTo(170);
      assertThat(registry.lastMessageY(a, b)).isEqualTo(150);
   }

   @Test
   public void testLeftEdgeGapBookkeeping() {
      ParticipantRegistry registry = new ParticipantRegistry(40);
      Participant a = registry.declare("A", null, 160, 40);
      Participant b = registry.declare("B", null, 160, 40);
      Participant left = registry.resolve(Participant.FOUND_LEFT);

      assertThat(registry.lastMessageY(left, a)).isZero();
      registry.markMessage(left, a, 80);
      assertThat(registry.lastMessageY(a, left)).isEqualTo(80);
      assertThat(registry.lastMessageY(a, b)).isZero();
      assertThat(registry.lastMessageY(left, b)).isEqualTo(80);

      registry.markMessage(a, b, 95);
      assertThat(registry.lastMessageY(left, a)).isEqualTo(80);
      assertThat(registry.lastMessageY(b, left)).isEqualTo(95);

      registry.resetGaps(120);
      assertThat(registry.lastMessageY(left, a)).isEqualTo(120);
   }
}
