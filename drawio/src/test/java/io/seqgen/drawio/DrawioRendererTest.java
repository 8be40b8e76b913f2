package io.seqgen.drawio;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

import javax.xml.parsers.DocumentBuilderFactory;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import io.seqgen.api.render.SceneRenderer;
import io.seqgen.api.scene.ActivationBar;
import io.seqgen.api.scene.BranchDivider;
import io.seqgen.api.scene.FrameBox;
import io.seqgen.api.scene.LaneHeader;
import io.seqgen.api.scene.MessageArrow;
import io.seqgen.api.scene.NoteBox;
import io.seqgen.api.scene.Point;
import io.seqgen.api.scene.SceneGraph;
import io.seqgen.api.scene.TitleBox;
import io.seqgen.api.statement.ArrowStyle;
import io.seqgen.api.statement.FrameKind;
import io.seqgen.api.statement.LineStyle;
import io.seqgen.api.statement.Statement;
import io.seqgen.core.layout.StatementInterpreter;
import io.seqgen.core.parser.ParserException;
import io.seqgen.core.parser.StatementParser;

public class DrawioRendererTest {
   private static Map<String, String> options() {
      Map<String, String> options = new HashMap<>();
      options.put(CellIds.OPTION, "t-");
      return options;
   }

   private static Document render(SceneGraph graph, Map<String, String> options) throws Exception {
      ByteArrayOutputStream output = new ByteArrayOutputStream();
      new DrawioRenderer().render(graph, output, options);
      return DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(new ByteArrayInputStream(output.toByteArray()));
   }

   private static List<Element> cells(Document document) {
      NodeList list = document.getElementsByTagName("mxCell");
      List<Element> cells = new ArrayList<>();
      for (int i = 0; i < list.getLength(); ++i) {
         cells.add((Element) list.item(i));
      }
      return cells;
   }

   private static Element child(Element parent, String tag) {
      return (Element) parent.getElementsByTagName(tag).item(0);
   }

   private static Element point(Element geometry, String as) {
      NodeList points = geometry.getElementsByTagName("mxPoint");
      for (int i = 0; i < points.getLength(); ++i) {
         Element point = (Element) points.item(i);
         if (as.equals(point.getAttribute("as"))) {
            return point;
         }
      }
      throw new AssertionError("No point " + as);
   }

   @Test
   public void testDocumentStructure() throws Exception {
      SceneGraph graph = SceneGraph.builder()
            .add(new LaneHeader("Alice", "Alice", 0, 0, 0, 160, 120, 40))
            .add(new ActivationBar("Alice", 1, 75, 60, 10, 30.5))
            .build();
      Map<String, String> options = options();
      options.put(DrawioRenderer.PAGE_NAME, "Flow");
      Document document = render(graph, options);

      Element file = document.getDocumentElement();
      assertThat(file.getTagName()).isEqualTo("mxfile");
      assertThat(file.getAttribute("host")).isEqualTo("seqgen");
      Element diagram = child(file, "diagram");
      assertThat(diagram.getAttribute("name")).isEqualTo("Flow");
      assertThat(diagram.getAttribute("id")).isEqualTo("t-1");
      assertThat(child(diagram, "mxGraphModel").getAttribute("gridSize")).isEqualTo("10");

      List<Element> cells = cells(document);
      assertThat(cells).extracting(c -> c.getAttribute("id")).containsExactly("0", "1", "t-2", "t-3");
      assertThat(cells.get(1).getAttribute("parent")).isEqualTo("0");

      Element lane = cells.get(2);
      assertThat(lane.getAttribute("value")).isEqualTo("Alice");
      assertThat(lane.getAttribute("parent")).isEqualTo("1");
      assertThat(lane.getAttribute("vertex")).isEqualTo("1");
      assertThat(lane.getAttribute("style")).startsWith("shape=umlLifeline;").contains("size=40;");
      Element geometry = child(lane, "mxGeometry");
      assertThat(geometry.getAttribute("x")).isEqualTo("0");
      assertThat(geometry.getAttribute("width")).isEqualTo("160");
      assertThat(geometry.getAttribute("height")).isEqualTo("120");

      Element bar = cells.get(3);
      assertThat(bar.getAttribute("value")).isEmpty();
      assertThat(bar.getAttribute("style")).contains("targetShapes=umlLifeline;");
      assertThat(child(bar, "mxGeometry").getAttribute("height")).isEqualTo("30.5");
   }

   @Test
   public void testMessages() throws Exception {
      SceneGraph graph = SceneGraph.builder()
            .add(new MessageArrow(MessageArrow.Kind.REGULAR, "A", "B", Arrays.asList("first", "second"), LineStyle.DASHED, ArrowStyle.OPEN,
                  new Point(275, 85), new Point(80, 85), Collections.emptyList()))
            .add(new MessageArrow(MessageArrow.Kind.SELF, "A", "A", Collections.emptyList(), LineStyle.SOLID, ArrowStyle.CLOSED,
                  new Point(85, 70), new Point(95, 90), Arrays.asList(new Point(115, 70), new Point(115, 90))))
            .build();
      List<Element> cells = cells(render(graph, options()));

      Element reply = cells.get(2);
      assertThat(reply.getAttribute("edge")).isEqualTo("1");
      assertThat(reply.getAttribute("value")).isEqualTo("first<br>second");
      assertThat(reply.getAttribute("style")).contains("verticalAlign=bottom;", "endArrow=open;", "dashed=1;");
      Element geometry = child(reply, "mxGeometry");
      assertThat(geometry.getAttribute("relative")).isEqualTo("1");
      assertThat(point(geometry, "sourcePoint").getAttribute("x")).isEqualTo("275");
      assertThat(point(geometry, "targetPoint").getAttribute("x")).isEqualTo("80");
      assertThat(geometry.getElementsByTagName("Array").getLength()).isZero();

      Element self = cells.get(3);
      assertThat(self.getAttribute("style")).contains("align=left;", "endArrow=block;", "dashed=0;");
      Element array = child(child(self, "mxGeometry"), "Array");
      assertThat(array.getAttribute("as")).isEqualTo("points");
      NodeList waypoints = array.getElementsByTagName("mxPoint");
      assertThat(waypoints.getLength()).isEqualTo(2);
      assertThat(((Element) waypoints.item(1)).getAttribute("x")).isEqualTo("115");
      assertThat(((Element) waypoints.item(1)).getAttribute("y")).isEqualTo("90");
   }

   @Test
   public void testFramesNotesAndTitle() throws Exception {
      SceneGraph graph = SceneGraph.builder()
            .add(new TitleBox("Checkout", -30, -70, 400, 300, 160, 40))
            .add(new FrameBox(FrameKind.ALT, "paid", 1, 2, -10, 80, 380, 90, 60, 20))
            .add(new BranchDivider("declined", -10, 130, 380))
            .add(new NoteBox("A", Arrays.asList("remember", "this"), 90, 55, 50, 30))
            .build();
      List<Element> cells = cells(render(graph, options()));
      // background, layer, title, frame + label, divider + label, note
      assertThat(cells).hasSize(8);

      Element title = cells.get(2);
      assertThat(title.getAttribute("value")).isEqualTo("Checkout");
      assertThat(title.getAttribute("style")).contains("shape=umlFrame;", "width=160;", "height=40;");
      assertThat(child(title, "mxGeometry").getAttribute("y")).isEqualTo("-70");

      Element frame = cells.get(3);
      assertThat(frame.getAttribute("value")).isEqualTo("alt");
      assertThat(frame.getAttribute("style")).contains("shape=umlFrame;", "width=60;", "height=20;");
      Element frameLabel = cells.get(4);
      assertThat(frameLabel.getAttribute("value")).isEqualTo("[paid]");
      assertThat(frameLabel.getAttribute("style")).startsWith("text;");
      assertThat(child(frameLabel, "mxGeometry").getAttribute("x")).isEqualTo("0");
      assertThat(child(frameLabel, "mxGeometry").getAttribute("y")).isEqualTo("105");

      Element divider = cells.get(5);
      assertThat(divider.getAttribute("style")).contains("endArrow=none;", "dashed=1;");
      Element dividerGeometry = child(divider, "mxGeometry");
      assertThat(point(dividerGeometry, "sourcePoint").getAttribute("x")).isEqualTo("-10");
      assertThat(point(dividerGeometry, "targetPoint").getAttribute("x")).isEqualTo("370");
      assertThat(point(dividerGeometry, "targetPoint").getAttribute("y")).isEqualTo("130");
      assertThat(cells.get(6).getAttribute("value")).isEqualTo("[declined]");

      Element note = cells.get(7);
      assertThat(note.getAttribute("value")).isEqualTo("remember<br>this");
      assertThat(note.getAttribute("style")).startsWith("shape=note;");
   }

   @Test
   public void testLabelsAreEscaped() throws Exception {
      SceneGraph graph = SceneGraph.builder()
            .add(new TitleBox("Q&A", -30, -70, 400, 300, 160, 40))
            .add(new LaneHeader("Cache<K>", "Cache<K>", 0, 0, 0, 160, 120, 40))
            .add(new FrameBox(FrameKind.OPT, "size > 0", 1, 1, -10, 80, 380, 90, 60, 20))
            .add(new BranchDivider("a < b", -10, 130, 380))
            .add(new NoteBox("Cache<K>", Arrays.asList("<b>not bold</b>", "x & y"), 90, 55, 50, 30))
            .build();
      List<Element> cells = cells(render(graph, options()));
      assertThat(cells).extracting(c -> c.getAttribute("value"))
            .contains("Q&amp;A", "Cache&lt;K&gt;", "[size &gt; 0]", "[a &lt; b]", "&lt;b&gt;not bold&lt;/b&gt;<br>x &amp; y");

      assertThat(DrawioWriter.escape("plain")).isEqualTo("plain");
      assertThat(DrawioWriter.join(Arrays.asList("List<String>", "a & b"))).isEqualTo("List&lt;String&gt;<br>a &amp; b");
   }

   @Test
   public void testRenderLayout() throws Exception {
      SceneGraph graph = new StatementInterpreter().interpret(parse(
            "title Order",
            "participant Client",
            "participant Server",
            "Client ->+ Server: GET /order",
            "opt cached",
            "  Server -> Server: lookup",
            "end",
            "Server -->>- Client: 200"));
      Document document = render(graph, options());
      List<Element> cells = cells(document);
      // scene nodes plus the frame label, background and layer
      assertThat(cells).hasSize(graph.size() + 3);
      assertThat(cells).filteredOn(c -> c.getAttribute("style").startsWith("shape=umlLifeline;"))
            .extracting(c -> c.getAttribute("value")).containsExactly("Client", "Server");
      assertThat(cells).extracting(c -> c.getAttribute("id")).doesNotHaveDuplicates();
   }

   @Test
   public void testDefaultPageName() throws Exception {
      Document document = render(SceneGraph.builder().build(), options());
      assertThat(child(document.getDocumentElement(), "diagram").getAttribute("name")).isEqualTo("Diagram");
      assertThat(cells(document)).hasSize(2);
   }

   @Test
   public void testServiceLoader() {
      List<String> names = new ArrayList<>();
      for (SceneRenderer renderer : ServiceLoader.load(SceneRenderer.class)) {
         names.add(renderer.name());
      }
      assertThat(names).contains(DrawioRenderer.NAME);
      assertThat(new DrawioRenderer().extension()).isEqualTo("drawio");
   }

   @Test
   public void testNumberFormat() {
      assertThat(DrawioWriter.number(80.0)).isEqualTo("80");
      assertThat(DrawioWriter.number(-40)).isEqualTo("-40");
      assertThat(DrawioWriter.number(12.5)).isEqualTo("12.5");
      assertThat(DrawioWriter.join(Arrays.asList("a", "b", "c"))).isEqualTo("a<br>b<br>c");
      assertThat(DrawioWriter.join(Collections.emptyList())).isEmpty();
   }

   @Test
   public void testCellIds() {
      CellIds ids = new CellIds("p-");
      assertThat(ids.next()).isEqualTo("p-1");
      assertThat(ids.next()).isEqualTo("p-2");
      assertThat(CellIds.resolvePrefix("given-")).isEqualTo("given-");
      assertThat(CellIds.resolvePrefix(null)).isNotEmpty();
   }

   private static List<Statement> parse(String... lines) throws IOException {
      try {
         return StatementParser.instance().parse(String.join("\n", lines));
      } catch (ParserException e) {
         throw new IOException(e);
      }
   }
}
