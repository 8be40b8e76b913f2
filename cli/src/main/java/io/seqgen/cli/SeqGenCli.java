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
package io.seqgen.cli;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.aesh.command.AeshCommandRuntimeBuilder;
import org.aesh.command.CommandResult;
import org.aesh.command.CommandRuntime;
import org.aesh.command.impl.registry.AeshCommandRegistryBuilder;
import org.aesh.command.invocation.CommandInvocation;

import io.seqgen.api.internal.Properties;
import io.seqgen.cli.commands.Generate;

/**
 * Command line entry point: runs the {@link Generate} command once with the program arguments.
 */
public class SeqGenCli {

   //ignore logging when running in the console below severe
   static {
      Handler[] handlers = Logger.getLogger("").getHandlers();
      for (int index = 0; index < handlers.length; index++) {
         handlers[index].setLevel(Level.SEVERE);
      }
   }

   public static void main(String[] args) {
      int result = new SeqGenCli().mainMethod(args);
      if (result != CommandResult.SUCCESS.getResultValue()) {
         System.exit(1);
      }
   }

   public int mainMethod(String[] args) {
      CommandRuntime<CommandInvocation> cr;
      CommandResult result = null;
      try {
         AeshCommandRuntimeBuilder<CommandInvocation> runtime = AeshCommandRuntimeBuilder.builder();
         @SuppressWarnings("unchecked")
         AeshCommandRegistryBuilder<CommandInvocation> registry =
               AeshCommandRegistryBuilder.<CommandInvocation>builder().commands(Generate.class);
         runtime.commandRegistry(registry.create());
         cr = runtime.build();
         // paths may contain whitespace
         String optionsCollected = Stream.of(args).map(arg -> arg.replaceAll(" ", "\\\\ ")).collect(Collectors.joining(" "));
         result = cr.executeCommand(Generate.NAME + " " + optionsCollected);
      } catch (Exception e) {
         System.out.println("Failed to execute command: " + e.getMessage());
         if (Properties.getBoolean(Properties.STACKTRACE)) {
            e.printStackTrace();
         }
      }
      return result == null ? CommandResult.FAILURE.getResultValue() : result.getResultValue();
   }
}
