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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.jspecify.annotations.Nullable;

/**
 * What {@link ImportExportAnalyzer} learned about one module. Read-only; the rewriter consults it
 * but never changes it.
 */
public final class ModuleFacts {
  private final ImmutableMap<BindingId, ImportRecord> imports;
  private final ImmutableMap<BindingId, String> exports;
  private final ImmutableListMultimap<BindingId, SourceLocation> nonStaticAccess;
  private final ImmutableListMultimap<BindingId, SourceLocation> nonConstBindings;
  private final ImmutableSet<String> nonStaticRequires;
  private final ImmutableSet<String> wrappedRequires;
  private final boolean isEsm;
  private final boolean hasCjsExports;
  private final boolean staticCjsExports;
  private final boolean shouldWrap;
  private final ImmutableList<Bailout> bailouts;

  ModuleFacts(
      ImmutableMap<BindingId, ImportRecord> imports,
      ImmutableMap<BindingId, String> exports,
      ImmutableListMultimap<BindingId, SourceLocation> nonStaticAccess,
      ImmutableListMultimap<BindingId, SourceLocation> nonConstBindings,
      ImmutableSet<String> nonStaticRequires,
      ImmutableSet<String> wrappedRequires,
      ModuleFlags flags,
      ImmutableList<Bailout> bailouts) {
    this.imports = imports;
    this.exports = exports;
    this.nonStaticAccess = nonStaticAccess;
    this.nonConstBindings = nonConstBindings;
    this.nonStaticRequires = nonStaticRequires;
    this.wrappedRequires = wrappedRequires;
    this.isEsm = flags.isEsm();
    this.hasCjsExports = flags.hasCjsExports();
    this.staticCjsExports = flags.staticCjsExports();
    this.shouldWrap = flags.shouldWrap();
    this.bailouts = bailouts;
  }

  /** Import records keyed by the local binding. */
  public ImmutableMap<BindingId, ImportRecord> imports() {
    return imports;
  }

  public @Nullable ImportRecord importOf(@Nullable BindingId id) {
    return id == null ? null : imports.get(id);
  }

  /** Exported name of each locally exported binding. The first export of a binding wins. */
  public ImmutableMap<BindingId, String> exports() {
    return exports;
  }

  public @Nullable String exportOf(@Nullable BindingId id) {
    return id == null ? null : exports.get(id);
  }

  /** Locations where a binding was used in a way that needs the whole object. */
  public ImmutableListMultimap<BindingId, SourceLocation> nonStaticAccess() {
    return nonStaticAccess;
  }

  public boolean hasNonStaticAccess(@Nullable BindingId id) {
    return id != null && nonStaticAccess.containsKey(id);
  }

  /** Locations where a binding is (re)assigned after being bound to an imported value. */
  public ImmutableListMultimap<BindingId, SourceLocation> nonConstBindings() {
    return nonConstBindings;
  }

  public boolean isNonConst(@Nullable BindingId id) {
    return id != null && nonConstBindings.containsKey(id);
  }

  /** Specifiers whose namespace has to be kept as an object at runtime. */
  public ImmutableSet<String> nonStaticRequires() {
    return nonStaticRequires;
  }

  /** Specifiers whose evaluation can't be hoisted and must stay lazy. */
  public ImmutableSet<String> wrappedRequires() {
    return wrappedRequires;
  }

  public boolean isEsm() {
    return isEsm;
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

  /** Bailouts sorted by location; empty unless tracing was requested. */
  public ImmutableList<Bailout> bailouts() {
    return bailouts;
  }
}
