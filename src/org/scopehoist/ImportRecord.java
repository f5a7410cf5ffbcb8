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

/** A local binding that refers to a dependency's export, or to its whole namespace. */
@AutoValue
public abstract class ImportRecord {

  public abstract String source();

  /** The imported key, or {@link SymbolNames#NAMESPACE}. */
  public abstract String specifier();

  public abstract ImportKind kind();

  public abstract SourceLocation loc();

  public static ImportRecord create(
      String source, String specifier, ImportKind kind, SourceLocation loc) {
    return new AutoValue_ImportRecord(source, specifier, kind, loc);
  }

  public boolean isNamespace() {
    return SymbolNames.NAMESPACE.equals(specifier());
  }
}
