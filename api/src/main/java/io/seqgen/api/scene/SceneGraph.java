/*
 * Copyright 2018 Red Hat Inc. and/or its affiliates and other contributors
 * as indicated by the @authors tag. All rights reserved.
 * See the copyright.txt in the distribution for a
 * full listing of individual contributors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.seqgen.api.scene;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable, ordered result of the layout. Nodes are listed in drawing order: earlier nodes are drawn below
 * later ones.
 */
public class SceneGraph {
   private final List<SceneNode> nodes;

   private SceneGraph(List<SceneNode> nodes) {
      this.nodes = Collections.unmodifiableList(nodes);
   }

   public static Builder builder() {
      return new Builder();
   }

   public List<SceneNode> nodes() {
      return nodes;
   }

   public <T extends SceneNode> List<T> nodes(Class<T> type) {
      return nodes.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
   }

   public int size() {
      return nodes.size();
   }

   public <R> List<R> visit(SceneVisitor<R> visitor) {
      List<R> results = new ArrayList<>(nodes.size());
      for (SceneNode node : nodes) {
         results.add(node.accept(visitor));
      }
      return results;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (o == null || getClass() != o.getClass()) {
         return false;
      }
      return nodes.equals(((SceneGraph) o).nodes);
   }

   @Override
   public int hashCode() {
      return nodes.hashCode();
   }

   @Override
   public String toString() {
      return nodes.stream().map(String::valueOf).collect(Collectors.joining("\n", "SceneGraph{\n", "\n}"));
   }

   /**
    * Collects nodes in drawing order. Nodes whose geometry is known only later (lanes, frames) can reserve their
    * position with {@link #reserve()} and {@link #fill(int, SceneNode) fill} it when complete.
    */
   public static class Builder {
      private final List<SceneNode> nodes = new ArrayList<>();

      private Builder() {
      }

      public Builder add(SceneNode node) {
         nodes.add(node);
         return this;
      }

      public int reserve() {
         nodes.add(null);
         return nodes.size() - 1;
      }

      public Builder fill(int slot, SceneNode node) {
         if (nodes.get(slot) != null) {
            throw new IllegalStateException("Slot " + slot + " is already filled with " + nodes.get(slot));
         }
         nodes.set(slot, node);
         return this;
      }

      public SceneGraph build() {
         for (int i = 0; i < nodes.size(); ++i) {
            if (nodes.get(i) == null) {
               throw new IllegalStateException("Slot " + i + " was reserved but never filled.");
            }
         }
         return new SceneGraph(new ArrayList<>(nodes));
      }
   }
}
