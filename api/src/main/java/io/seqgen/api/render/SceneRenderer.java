package io.seqgen.api.render;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;

import io.seqgen.api.scene.SceneGraph;

/**
 * Serializes a finished scene into a concrete file format. Renderers map nodes to drawing primitives; they must not
 * move or resize anything.
 * <p>
 * Implementations are discovered through {@link java.util.ServiceLoader} and selected by {@link #name()}.
 */
public interface SceneRenderer {
   String name();

   /**
    * @return file extension (without the dot) conventionally used for the output.
    */
   String extension();

   void render(SceneGraph graph, OutputStream output, Map<String, String> options) throws IOException;
}
