package io.seqgen.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

import io.seqgen.api.render.SceneRenderer;

public final class Renderers {
   private Renderers() {}

   public static List<SceneRenderer> all() {
      List<SceneRenderer> renderers = new ArrayList<>();
      ServiceLoader.load(SceneRenderer.class).forEach(renderers::add);
      return renderers;
   }

   /**
    * @return renderer registered under given name or <code>null</code>.
    */
   public static SceneRenderer byName(String name) {
      for (SceneRenderer renderer : ServiceLoader.load(SceneRenderer.class)) {
         if (renderer.name().equals(name)) {
            return renderer;
         }
      }
      return null;
   }

   /**
    * @return renderer whose extension matches the file name, or <code>null</code>.
    */
   public static SceneRenderer byFileName(String fileName) {
      int dot = fileName.lastIndexOf('.');
      if (dot < 0) {
         return null;
      }
      String extension = fileName.substring(dot + 1);
      for (SceneRenderer renderer : ServiceLoader.load(SceneRenderer.class)) {
         if (renderer.extension().equalsIgnoreCase(extension)) {
            return renderer;
         }
      }
      return null;
   }
}
