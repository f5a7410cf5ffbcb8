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

/**
 * A synthesized name bound to a dependency's export. Re-exports use the same shape, with
 * {@code local} being the name this module exports it under.
 */
@AutoValue
public abstract class ImportedSymbol {

  public abstract String source();

  public abstract String local();

  public abstract String imported();

  public abstract SourceLocation loc();

  public static ImportedSymbol create(
      String source, String local, String imported, SourceLocation loc) {
    return new AutoValue_ImportedSymbol(source, local, imported, loc);
  }
}
