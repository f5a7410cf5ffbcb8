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

/**
 * Module-wide facts that only ever move toward the conservative value.
 *
 * <p>{@code staticCjsExports} starts true and the others start false; the mutators can only
 * flip them once, so a flag never reverts during a traversal.
 */
public final class ModuleFlags {
  private boolean esm;
  private boolean hasCjsExports;
  private boolean staticCjsExports = true;
  private boolean shouldWrap;

  void markEsm() {
    esm = true;
  }

  void markCjsExports() {
    hasCjsExports = true;
  }

  void markNonStaticCjsExports() {
    staticCjsExports = false;
  }

  void markShouldWrap() {
    shouldWrap = true;
  }

  public boolean isEsm() {
    return esm;
  }

  public boolean hasCjsExports() {
    return hasCjsExports;
  }

  public boolean staticCjsExports() {
    return staticCjsExports;
  }

  public boolean shouldWrap() {
    return shouldWrap;
  }

  @Override
  public String toString() {
    return "ModuleFlags{esm="
        + esm
        + ", hasCjsExports="
        + hasCjsExports
        + ", staticCjsExports="
        + staticCjsExports
        + ", shouldWrap="
        + shouldWrap
        + "}";
  }
}
