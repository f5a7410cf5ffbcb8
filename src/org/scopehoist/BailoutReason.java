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

import com.google.javascript.jscomp.DiagnosticType;

/** Why an optimization was skipped for a module or one of its dependencies. */
public enum BailoutReason {
  NON_TOP_LEVEL_REQUIRE(
      "JSC_HOIST_NON_TOP_LEVEL_REQUIRE",
      "Conditional or non-top-level `require()` call. This causes the resolved module and all"
          + " dependencies to be wrapped."),
  NON_STATIC_DESTRUCTURING(
      "JSC_HOIST_NON_STATIC_DESTRUCTURING",
      "Non-static destructuring of `require` or dynamic `import()`. This causes all exports of"
          + " the resolved module to be included."),
  TOP_LEVEL_RETURN(
      "JSC_HOIST_TOP_LEVEL_RETURN",
      "Module contains a top-level `return` statement. This causes the module to be wrapped in a"
          + " function and tree shaking to be disabled."),
  EVAL(
      "JSC_HOIST_EVAL",
      "Module contains usage of `eval`. This causes the module to be wrapped in a function and"
          + " minification to be disabled."),
  NON_STATIC_EXPORTS(
      "JSC_HOIST_NON_STATIC_EXPORTS",
      "Non-static access of CommonJS `exports` object. This causes tree shaking to be disabled"
          + " for the module."),
  FREE_MODULE(
      "JSC_HOIST_FREE_MODULE",
      "Unknown usage of CommonJS `module` object. This causes the module to be wrapped, and tree"
          + " shaking to be disabled."),
  FREE_EXPORTS(
      "JSC_HOIST_FREE_EXPORTS",
      "Unknown usage of CommonJS `exports` object. This causes tree shaking to be disabled."),
  EXPORTS_REASSIGNMENT(
      "JSC_HOIST_EXPORTS_REASSIGNMENT",
      "Module contains a reassignment of the CommonJS `exports` object. This causes the module to"
          + " be wrapped and tree shaking to be disabled."),
  MODULE_REASSIGNMENT(
      "JSC_HOIST_MODULE_REASSIGNMENT",
      "Module contains a reassignment of the CommonJS `module` object. This causes the module to"
          + " be wrapped and tree shaking to be disabled."),
  NON_STATIC_DYNAMIC_IMPORT(
      "JSC_HOIST_NON_STATIC_DYNAMIC_IMPORT",
      "Unknown dynamic import usage. This causes tree shaking to be disabled for the resolved"
          + " module."),
  NON_STATIC_ACCESS(
      "JSC_HOIST_NON_STATIC_ACCESS",
      "Non-static access of an `import` or `require`. This causes tree shaking to be disabled for"
          + " the resolved module.");

  private final DiagnosticType diagnosticType;

  BailoutReason(String key, String message) {
    this.diagnosticType = DiagnosticType.warning(key, message);
  }

  public DiagnosticType diagnosticType() {
    return diagnosticType;
  }

  public String message() {
    return diagnosticType.format;
  }
}
