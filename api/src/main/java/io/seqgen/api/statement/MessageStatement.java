package io.seqgen.api.statement;

import java.util.Collections;
import java.util.List;

/**
 * Arrow between two participants. Either end may also be one of the diagram edges ({@code found-left},
 * {@code found-right} as sender, {@code lost-left}, {@code lost-right} as receiver).
 */
public class MessageStatement extends Statement {
   private final String sender;
   private final String receiver;
   private final List<String> text;
   private final MessageActivation activation;
   private final LineStyle lineStyle;
   private final ArrowStyle arrowStyle;

   public MessageStatement(int line, String sender, String receiver, List<String> text, MessageActivation activation,
                           LineStyle lineStyle, ArrowStyle arrowStyle) {
      super(line);
      this.sender = sender;
      this.receiver = receiver;
      this.text = Collections.unmodifiableList(text);
      this.activation = activation;
      this.lineStyle = lineStyle;
      this.arrowStyle = arrowStyle;
   }

   public String sender() {
      return sender;
   }

   public String receiver() {
      return receiver;
   }

   public List<String> text() {
      return text;
   }

   public MessageActivation activation() {
      return activation;
   }

   public LineStyle lineStyle() {
      return lineStyle;
   }

   public ArrowStyle arrowStyle() {
      return arrowStyle;
   }

   @Override
   public <R, P> R accept(StatementVisitor<R, P> visitor, P param) {
      return visitor.visitMessage(this, param);
   }
}
