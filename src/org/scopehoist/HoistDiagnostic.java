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
import com.google.javascript.jscomp.CheckLevel;
import com.google.javascript.jscomp.DiagnosticType;
import com.google.javascript.jscomp.JSError;
import org.jspecify.annotations.Nullable;

/** A diagnostic with the source ranges it refers to. */
@AutoValue
public abstract class HoistDiagnostic {

  /** Reassigning an ES import binding. */
  public static final DiagnosticType IMPORT_ASSIGNMENT =
      DiagnosticType.error(
          "JSC_HOIST_IMPORT_ASSIGNMENT", "Assignment to an import specifier is not allowed");

  /** A highlighted range, with an optional note. */
  @AutoValue
  public abstract static class CodeHighlight {
    public abstract SourceLocation loc();

    public abstract @Nullable String message();

    public static CodeHighlight create(SourceLocation loc, @Nullable String message) {
      return new AutoValue_HoistDiagnostic_CodeHighlight(loc, message);
    }
  }

  public abstract DiagnosticType type();

  public abstract String message();

  public abstract ImmutableList<CodeHighlight> highlights();

  public static HoistDiagnostic create(
      DiagnosticType type, String message, ImmutableList<CodeHighlight> highlights) {
    checkArgument(!highlights.isEmpty(), "A diagnostic needs at least one location");
    return new AutoValue_HoistDiagnostic(type, message, highlights);
  }

  public boolean isError() {
    return type().level == CheckLevel.ERROR;
  }

  /** Converts to a compiler error, located at the first highlight. */
  public JSError toJSError() {
    SourceLocation loc = highlights().get(0).loc();
    return JSError.make(loc.sourceName(), loc.line(), loc.column(), type());
  }
}
