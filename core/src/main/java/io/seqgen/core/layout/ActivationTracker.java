package io.seqgen.core.layout;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.seqgen.api.config.DiagramDefinitionException;
import io.seqgen.api.config.ErrorKind;

/**
 * Per-participant stacks of active calls.
 * <p>
 * The first activation of a participant is centred on its lane. The second one is shifted by the stack offset
 * towards the activating participant (right when there is none); any further activation keeps shifting in the
 * same direction, so nested calls form a staircase.
 */
public class ActivationTracker {
   private final Map<Participant, Deque<Activation>> stacks = new LinkedHashMap<>();
   private final double stackOffset;

   public ActivationTracker(double stackOffset) {
      this.stackOffset = stackOffset;
   }

   /**
    * @param activator participant whose message caused the activation, or <code>null</code>.
    * @return depth of the participant's stack after the activation.
    */
   public int activate(Participant participant, Participant activator, double y, int line) {
      Deque<Activation> stack = stacks.computeIfAbsent(participant, p -> new ArrayDeque<>());
      double dx;
      if (stack.isEmpty()) {
         dx = 0;
      } else if (stack.size() == 1) {
         dx = activator == null || activator.index() > participant.index() ? stackOffset : -stackOffset;
      } else {
         Iterator<Activation> it = stack.iterator();
         Activation top = it.next();
         Activation below = it.next();
         dx = top.dx() + (top.dx() > below.dx() ? stackOffset : -stackOffset);
      }
      stack.push(new Activation(participant, stack.size() + 1, dx, y, line));
      return stack.size();
   }

   public Activation deactivate(Participant participant) {
      Deque<Activation> stack = stacks.get(participant);
      if (stack == null || stack.isEmpty()) {
         throw new DiagramDefinitionException(ErrorKind.OVER_DEACTIVATION, "'" + participant.name() + "' is not active");
      }
      return stack.pop();
   }

   /**
    * @return innermost activation of the participant or <code>null</code> if it is not active.
    */
   public Activation top(Participant participant) {
      Deque<Activation> stack = stacks.get(participant);
      return stack == null ? null : stack.peek();
   }

   public int depth(Participant participant) {
      Deque<Activation> stack = stacks.get(participant);
      return stack == null ? 0 : stack.size();
   }

   public boolean isActive(Participant participant) {
      return depth(participant) > 0;
   }

   public boolean allInactive() {
      return stacks.values().stream().allMatch(Deque::isEmpty);
   }

   /**
    * @return still open activations, the oldest (bottom-most) activation of each active participant.
    */
   public List<Activation> openActivations() {
      List<Activation> open = new ArrayList<>();
      for (Deque<Activation> stack : stacks.values()) {
         if (!stack.isEmpty()) {
            open.add(stack.peekLast());
         }
      }
      return open;
   }
}
