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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import com.google.javascript.jscomp.AbstractCompiler;
import com.google.javascript.jscomp.CompilerPass;
import com.google.javascript.rhino.Node;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Hoists every script of a compilation, each as its own module.
 *
 * <p>Scripts that fail to hoist are reported through the compiler and left unchanged. Bailouts are
 * reported as warnings when tracing is enabled. The {@link HoistResult} of every hoisted script is
 * kept, keyed by source file name, for the bundler that links the modules afterwards.
 */
public final class ScopeHoistPass implements CompilerPass {

  private static final Logger logger = Logger.getLogger(ScopeHoistPass.class.getName());

  private final AbstractCompiler compiler;
  private final ModuleIdGenerator moduleIds;
  private final boolean traceBailouts;
  private final Map<String, HoistResult> results = new LinkedHashMap<>();

  public ScopeHoistPass(
      AbstractCompiler compiler, ModuleIdGenerator moduleIds, boolean traceBailouts) {
    this.compiler = compiler;
    this.moduleIds = moduleIds;
    this.traceBailouts = traceBailouts;
  }

  public ScopeHoistPass(AbstractCompiler compiler) {
    this(compiler, ModuleIdGenerator.hashed(), false);
  }

  @Override
  public void process(Node externs, Node root) {
    for (Node script = root.getFirstChild(); script != null; script = script.getNext()) {
      checkState(script.isScript(), script);
      hoistScript(script);
    }
  }

  private void hoistScript(Node script) {
    String sourceName = script.getSourceFileName();
    ScopeHoist hoist =
        ScopeHoist.builder()
            .setModuleId(moduleIds.moduleIdFor(sourceName))
            .setTraceBailouts(traceBailouts)
            .build();
    HoistOutput output = hoist.hoist(script);

    for (HoistDiagnostic diagnostic : output.diagnostics()) {
      compiler.report(diagnostic.toJSError());
    }
    if (!output.isSuccessful()) {
      logger.finest("Leaving " + sourceName + " unchanged");
      return;
    }

    Node hoisted = output.root();
    script.removeChildren();
    if (hoisted.hasChildren()) {
      script.addChildrenToBack(hoisted.removeChildren());
    }
    script.putProp(Node.FEATURE_SET, hoisted.getProp(Node.FEATURE_SET));
    compiler.reportChangeToChangeScope(script);
    logger.fine("Hoisted " + sourceName + " as " + hoist.moduleId());
    results.put(sourceName, output.result());
  }

  /** Results of the scripts hoisted so far, in input order. */
  public ImmutableMap<String, HoistResult> results() {
    return ImmutableMap.copyOf(results);
  }
}
