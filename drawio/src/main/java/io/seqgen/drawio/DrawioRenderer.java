package io.seqgen.drawio;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.kohsuke.MetaInfServices;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import io.seqgen.api.render.SceneRenderer;
import io.seqgen.api.scene.SceneGraph;

/**
 * Writes the scene as an uncompressed draw.io file with a single page.
 * <p>
 * Options: {@value CellIds#OPTION} sets the cell id prefix, {@value #PAGE_NAME} the page name.
 */
@MetaInfServices(SceneRenderer.class)
public class DrawioRenderer implements SceneRenderer {
   private static final Logger log = LogManager.getLogger(DrawioRenderer.class);
   public static final String NAME = "drawio";
   public static final String PAGE_NAME = "pageName";

   @Override
   public String name() {
      return NAME;
   }

   @Override
   public String extension() {
      return "drawio";
   }

   @Override
   public void render(SceneGraph graph, OutputStream output, Map<String, String> options) throws IOException {
      Document document = toDocument(graph, options);
      try {
         Transformer transformer = TransformerFactory.newInstance().newTransformer();
         transformer.setOutputProperty(OutputKeys.INDENT, "yes");
         transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
         transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
         transformer.transform(new DOMSource(document), new StreamResult(output));
      } catch (TransformerException e) {
         throw new IOException("Cannot write draw.io document", e);
      }
   }

   Document toDocument(SceneGraph graph, Map<String, String> options) throws IOException {
      Document document;
      try {
         document = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
      } catch (ParserConfigurationException e) {
         throw new IOException("Cannot create XML document", e);
      }
      CellIds ids = new CellIds(CellIds.resolvePrefix(options.get(CellIds.OPTION)));

      Element file = document.createElement("mxfile");
      file.setAttribute("host", "seqgen");
      file.setAttribute("agent", "seqgen");
      document.appendChild(file);

      Element diagram = document.createElement("diagram");
      diagram.setAttribute("name", options.getOrDefault(PAGE_NAME, "Diagram"));
      diagram.setAttribute("id", ids.next());
      file.appendChild(diagram);

      Element model = document.createElement("mxGraphModel");
      String[][] modelAttributes = {
            { "dx", "0" }, { "dy", "0" }, { "grid", "1" }, { "gridSize", "10" }, { "guides", "1" },
            { "tooltips", "1" }, { "connect", "1" }, { "arrows", "1" }, { "fold", "1" }, { "page", "0" },
            { "pageScale", "1" }, { "pageWidth", "851" }, { "pageHeight", "1100" }, { "background", "#ffffff" },
            { "math", "0" }, { "shadow", "0" } };
      for (String[] attribute : modelAttributes) {
         model.setAttribute(attribute[0], attribute[1]);
      }
      diagram.appendChild(model);

      Element root = document.createElement("root");
      model.appendChild(root);
      Element background = document.createElement("mxCell");
      background.setAttribute("id", "0");
      root.appendChild(background);
      Element layer = document.createElement("mxCell");
      layer.setAttribute("id", DrawioWriter.LAYER);
      layer.setAttribute("parent", "0");
      root.appendChild(layer);

      graph.visit(new DrawioWriter(document, root, ids));
      log.debug("Rendered {} scene nodes into {} cells", graph.size(), root.getChildNodes().getLength());
      return document;
   }
}
