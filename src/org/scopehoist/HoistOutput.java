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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.javascript.rhino.Node;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of hoisting one module: the rewritten script and its {@link HoistResult}, or the errors
 * that prevented the rewrite. Bailouts are reported either way when tracing is enabled.
 */
@AutoValue
public abstract class HoistOutput {

  /** The rewritten copy of the input script, null on failure. */
  public abstract @Nullable Node root();

  public abstract @Nullable HoistResult result();

  public abstract ImmutableList<HoistDiagnostic> errors();

  public abstract ImmutableList<Bailout> bailouts();

  static HoistOutput success(Node root, HoistResult result, ImmutableList<Bailout> bailouts) {
    return new AutoValue_HoistOutput(root, result, ImmutableList.of(), bailouts);
  }

  static HoistOutput failure(
      ImmutableList<HoistDiagnostic> errors, ImmutableList<Bailout> bailouts) {
    checkArgument(!errors.isEmpty());
    return new AutoValue_HoistOutput(null, null, errors, bailouts);
  }

  public boolean isSuccessful() {
    return errors().isEmpty();
  }

  /** Errors followed by one warning per bailout. */
  public ImmutableList<HoistDiagnostic> diagnostics() {
    ImmutableList.Builder<HoistDiagnostic> diagnostics = ImmutableList.builder();
    diagnostics.addAll(errors());
    for (Bailout bailout : bailouts()) {
      diagnostics.add(bailout.toDiagnostic());
    }
    return diagnostics.build();
  }
}
