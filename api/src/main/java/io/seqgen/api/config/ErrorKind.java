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
package io.seqgen.api.config;

/**
 * Classification of the sequencing rules a diagram definition can violate.
 */
public enum ErrorKind {
   DUPLICATE_PARTICIPANT("DuplicateParticipant"),
   UNKNOWN_PARTICIPANT("UnknownParticipant"),
   SENDER_NOT_ACTIVE("SenderNotActive"),
   OVER_DEACTIVATION("OverDeactivation"),
   UNBALANCED_ACTIVATION("UnbalancedActivation"),
   NO_OPEN_FRAME("NoOpenFrame"),
   INVALID_BRANCH("InvalidBranch"),
   EMPTY_FRAME("EmptyFrame"),
   UNCLOSED_FRAME("UnclosedFrame"),
   UNTERMINATED_NOTE("UnterminatedNote"),
   INVALID_ACTIVATION_FOR_FOUND_LOST("InvalidActivationForFoundLost"),
   INVALID_ACTIVATION_FOR_SELF_CALL("InvalidActivationForSelfCall"),
   DUPLICATE_TITLE("DuplicateTitle"),
   INVALID_SETTING("InvalidSetting");

   private final String displayName;

   ErrorKind(String displayName) {
      this.displayName = displayName;
   }

   public String displayName() {
      return displayName;
   }

   @Override
   public String toString() {
      return displayName;
   }
}
