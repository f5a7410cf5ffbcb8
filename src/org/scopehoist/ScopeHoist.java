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
import com.google.javascript.rhino.Node;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the scope hoisting transform for a single module.
 *
 * <pre>{@code
 * HoistOutput output = ScopeHoist.builder().setModuleId("a1b2").build().hoist(script);
 * }</pre>
 *
 * <p>The input script is not modified. The module id must only contain identifier characters, as
 * it becomes part of every synthesized name.
 */
@AutoValue
public abstract class ScopeHoist {

  private static final Logger logger = Logger.getLogger(ScopeHoist.class.getName());

  public abstract String moduleId();

  /** Whether every skipped optimization is reported as a {@link Bailout}. */
  public abstract boolean traceBailouts();

  public static Builder builder() {
    return new AutoValue_ScopeHoist.Builder().setTraceBailouts(false);
  }

  /** Builder for {@link ScopeHoist}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setModuleId(String moduleId);

    public abstract Builder setTraceBailouts(boolean traceBailouts);

    abstract ScopeHoist autoBuild();

    public ScopeHoist build() {
      ScopeHoist hoist = autoBuild();
      checkArgument(
          SymbolNames.isValidModuleId(hoist.moduleId()),
          "Invalid module id: %s",
          hoist.moduleId());
      return hoist;
    }
  }

  public HoistOutput hoist(Node script) {
    return hoist(script, ModuleBindings.collect(script));
  }

  /**
   * Hoists {@code script} using precomputed bindings, e.g. ones where a synthetic {@code require}
   * was marked as ignored.
   */
  public HoistOutput hoist(Node script, ModuleBindings bindings) {
    checkArgument(script.isScript(), script);
    ModuleFacts facts = ImportExportAnalyzer.analyze(script, bindings, traceBailouts());
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          "Hoisting " + script.getSourceFileName() + " as " + moduleId() + ": "
              + facts.imports().size() + " imports, " + facts.exports().size() + " exports, "
              + "wrap=" + facts.shouldWrap() + ", esm=" + facts.isEsm()
              + ", staticCjsExports=" + facts.staticCjsExports());
    }

    Node copy = script.cloneTree();
    ScopeHoistRewriter rewriter =
        new ScopeHoistRewriter(
            facts, bindings.copyOnto(script, copy), SymbolNames.forModule(moduleId()));
    rewriter.rewrite(copy);

    if (!rewriter.errors().isEmpty()) {
      logger.fine(rewriter.errors().size() + " errors in " + script.getSourceFileName());
      return HoistOutput.failure(rewriter.errors(), facts.bailouts());
    }
    for (Bailout bailout : facts.bailouts()) {
      logger.finest("Bailout at " + bailout.loc() + ": " + bailout.reason());
    }
    return HoistOutput.success(copy, rewriter.result(), facts.bailouts());
  }
}
