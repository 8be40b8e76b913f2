package io.seqgen.drawio;

import java.util.List;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import io.seqgen.api.scene.ActivationBar;
import io.seqgen.api.scene.BranchDivider;
import io.seqgen.api.scene.FrameBox;
import io.seqgen.api.scene.LaneHeader;
import io.seqgen.api.scene.MessageArrow;
import io.seqgen.api.scene.NoteBox;
import io.seqgen.api.scene.Point;
import io.seqgen.api.scene.SceneVisitor;
import io.seqgen.api.scene.TitleBox;
import io.seqgen.api.statement.ArrowStyle;
import io.seqgen.api.statement.LineStyle;

/**
 * Appends one or more <code>mxCell</code> elements per scene node to the page root. All geometry is absolute.
 */
class DrawioWriter implements SceneVisitor<Void> {
   static final String LAYER = "1";
   private static final int LABEL_INSET = 10;
   private static final int LABEL_WIDTH = 100;
   private static final int LABEL_HEIGHT = 20;

   private final Document document;
   private final Element root;
   private final CellIds ids;

   DrawioWriter(Document document, Element root, CellIds ids) {
      this.document = document;
      this.root = root;
      this.ids = ids;
   }

   static String number(double value) {
      if (value == Math.rint(value) && !Double.isInfinite(value)) {
         return String.valueOf((long) value);
      }
      return String.valueOf(value);
   }

   static String join(List<String> lines) {
      StringBuilder sb = new StringBuilder();
      for (String line : lines) {
         if (sb.length() > 0) {
            sb.append("<br>");
         }
         sb.append(escape(line));
      }
      return sb.toString();
   }

   // cell values are rendered as HTML
   static String escape(String text) {
      StringBuilder sb = new StringBuilder(text.length());
      for (int i = 0; i < text.length(); ++i) {
         char c = text.charAt(i);
         switch (c) {
            case '&':
               sb.append("&amp;");
               break;
            case '<':
               sb.append("&lt;");
               break;
            case '>':
               sb.append("&gt;");
               break;
            default:
               sb.append(c);
         }
      }
      return sb.toString();
   }

   @Override
   public Void visitLaneHeader(LaneHeader lane) {
      Style style = new Style().set("shape", "umlLifeline").set("perimeter", "lifelinePerimeter")
            .set("whiteSpace", "wrap").set("html", "1").set("container", "1").set("dropTarget", "0")
            .set("collapsible", "0").set("recursiveResize", "0").set("outlineConnect", "0")
            .set("portConstraint", "eastwest").set("size", lane.headerHeight());
      vertex(escape(lane.label()), style, lane.x(), lane.y(), lane.width(), lane.height());
      return null;
   }

   @Override
   public Void visitActivationBar(ActivationBar bar) {
      Style style = new Style().set("html", "1").set("perimeter", "orthogonalPerimeter")
            .set("outlineConnect", "0").set("targetShapes", "umlLifeline").set("portConstraint", "eastwest");
      vertex("", style, bar.x(), bar.y(), bar.width(), bar.height());
      return null;
   }

   @Override
   public Void visitMessageArrow(MessageArrow message) {
      Style style = new Style().set("html", "1").set("curved", "0").set("rounded", "0");
      if (message.kind() == MessageArrow.Kind.SELF) {
         style.set("align", "left").set("spacingLeft", "2");
      } else {
         style.set("verticalAlign", "bottom");
      }
      style.set("endArrow", message.arrowStyle() == ArrowStyle.OPEN ? "open" : "block");
      style.set("dashed", message.lineStyle() == LineStyle.DASHED ? "1" : "0");
      Element geometry = edge(join(message.text()), style);
      point(geometry, message.source(), "sourcePoint");
      point(geometry, message.target(), "targetPoint");
      if (!message.waypoints().isEmpty()) {
         Element array = document.createElement("Array");
         array.setAttribute("as", "points");
         for (Point waypoint : message.waypoints()) {
            point(array, waypoint, null);
         }
         geometry.appendChild(array);
      }
      return null;
   }

   @Override
   public Void visitFrameBox(FrameBox frame) {
      vertex(frame.kind().keyword(), frameStyle(frame.tabWidth(), frame.tabHeight()), frame.x(), frame.y(), frame.width(), frame.height());
      label("[" + escape(frame.label()) + "]", frame.x() + LABEL_INSET, frame.y() + frame.tabHeight() + 5);
      return null;
   }

   @Override
   public Void visitBranchDivider(BranchDivider divider) {
      Style style = new Style().set("html", "1").set("endArrow", "none").set("dashed", "1").set("rounded", "0");
      Element geometry = edge("", style);
      point(geometry, new Point(divider.x(), divider.y()), "sourcePoint");
      point(geometry, new Point(divider.x() + divider.width(), divider.y()), "targetPoint");
      label("[" + escape(divider.label()) + "]", divider.x() + LABEL_INSET, divider.y() + 5);
      return null;
   }

   @Override
   public Void visitNoteBox(NoteBox note) {
      Style style = new Style().set("shape", "note").set("whiteSpace", "wrap").set("html", "1")
            .set("backgroundOutline", "1").set("darkOpacity", "0.05").set("size", "10").set("align", "left").set("spacing", "8");
      vertex(join(note.text()), style, note.x(), note.y(), note.width(), note.height());
      return null;
   }

   @Override
   public Void visitTitleBox(TitleBox title) {
      vertex(escape(title.text()), frameStyle(title.tabWidth(), title.tabHeight()), title.x(), title.y(), title.width(), title.height());
      return null;
   }

   private static Style frameStyle(double tabWidth, double tabHeight) {
      return new Style().set("shape", "umlFrame").set("whiteSpace", "wrap").set("html", "1").set("pointerEvents", "0")
            .set("width", tabWidth).set("height", tabHeight);
   }

   private void label(String text, double x, double y) {
      Style style = new Style().flag("text").set("html", "1").set("align", "left").set("verticalAlign", "middle")
            .set("rounded", "0").set("labelPosition", "center").set("verticalLabelPosition", "middle")
            .set("labelBackgroundColor", "default");
      vertex(text, style, x, y, LABEL_WIDTH, LABEL_HEIGHT);
   }

   private Element cell(String value, Style style) {
      Element cell = document.createElement("mxCell");
      cell.setAttribute("id", ids.next());
      cell.setAttribute("value", value);
      cell.setAttribute("parent", LAYER);
      cell.setAttribute("style", style.toString());
      root.appendChild(cell);
      return cell;
   }

   private void vertex(String value, Style style, double x, double y, double width, double height) {
      Element cell = cell(value, style);
      cell.setAttribute("vertex", "1");
      Element geometry = document.createElement("mxGeometry");
      geometry.setAttribute("x", number(x));
      geometry.setAttribute("y", number(y));
      geometry.setAttribute("width", number(width));
      geometry.setAttribute("height", number(height));
      geometry.setAttribute("as", "geometry");
      cell.appendChild(geometry);
   }

   private Element edge(String value, Style style) {
      Element cell = cell(value, style);
      cell.setAttribute("edge", "1");
      Element geometry = document.createElement("mxGeometry");
      geometry.setAttribute("relative", "1");
      geometry.setAttribute("as", "geometry");
      cell.appendChild(geometry);
      return geometry;
   }

   private void point(Element parent, Point point, String as) {
      Element element = document.createElement("mxPoint");
      element.setAttribute("x", number(point.x()));
      element.setAttribute("y", number(point.y()));
      if (as != null) {
         element.setAttribute("as", as);
      }
      parent.appendChild(element);
   }
}
