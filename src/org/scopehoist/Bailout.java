/*
 * Copyright 2026 The Scope Hoist Authors.
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
package org.scopehoist;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** A recorded reason, at a location, for skipping an optimization. Never fatal. */
@AutoValue
public abstract class Bailout {

  public abstract SourceLocation loc();

  public abstract BailoutReason reason();

  public static Bailout create(SourceLocation loc, BailoutReason reason) {
    return new AutoValue_Bailout(loc, reason);
  }

  public HoistDiagnostic toDiagnostic() {
    return HoistDiagnostic.create(
        reason().diagnosticType(),
        reason().message(),
        ImmutableList.of(HoistDiagnostic.CodeHighlight.create(loc(), null)));
  }
}
