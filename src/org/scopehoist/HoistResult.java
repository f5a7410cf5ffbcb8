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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Map;

/** What a bundler needs to link a hoisted module against its dependencies and dependents. */
@AutoValue
public abstract class HoistResult {

  /** Synthesized names referring to dependency exports, one per distinct local. */
  public abstract ImmutableList<ImportedSymbol> importedSymbols();

  /** Top-level names that hold this module's exports. */
  public abstract ImmutableList<ExportedSymbol> exportedSymbols();

  /** Exports forwarded from a dependency; {@code local} is the name exported by this module. */
  public abstract ImmutableList<ImportedSymbol> reExports();

  /** Export keys this module reads back through {@code exports} or {@code module.exports}. */
  public abstract ImmutableSet<String> selfReferences();

  /** Specifiers that are required lazily and must remain wrapped. */
  public abstract ImmutableSet<String> wrappedRequires();

  /** Async namespace name to specifier. */
  public abstract ImmutableMap<String, String> dynamicImports();

  public abstract boolean staticCjsExports();

  public abstract boolean hasCjsExports();

  public abstract boolean isEsm();

  public abstract boolean shouldWrap();

  public static Builder builder() {
    return new AutoValue_HoistResult.Builder()
        .setImportedSymbols(ImmutableList.of())
        .setExportedSymbols(ImmutableList.of())
        .setReExports(ImmutableList.of())
        .setSelfReferences(ImmutableSet.of())
        .setWrappedRequires(ImmutableSet.of())
        .setDynamicImports(ImmutableMap.of())
        .setStaticCjsExports(true)
        .setHasCjsExports(false)
        .setIsEsm(false)
        .setShouldWrap(false);
  }

  /** Builder for {@link HoistResult}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setImportedSymbols(Iterable<ImportedSymbol> symbols);

    public abstract Builder setExportedSymbols(Iterable<ExportedSymbol> symbols);

    public abstract Builder setReExports(Iterable<ImportedSymbol> symbols);

    public abstract Builder setSelfReferences(Iterable<String> keys);

    public abstract Builder setWrappedRequires(Iterable<String> specifiers);

    public abstract Builder setDynamicImports(Map<String, String> dynamicImports);

    public abstract Builder setStaticCjsExports(boolean value);

    public abstract Builder setHasCjsExports(boolean value);

    public abstract Builder setIsEsm(boolean value);

    public abstract Builder setShouldWrap(boolean value);

    public abstract HoistResult build();
  }
}
