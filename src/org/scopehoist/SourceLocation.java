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
import com.google.common.collect.ComparisonChain;
import com.google.javascript.rhino.Node;

/** A span of source text, identified by file, 1-based line, 0-based column and length. */
@AutoValue
public abstract class SourceLocation implements Comparable<SourceLocation> {

  public abstract String sourceName();

  public abstract int line();

  public abstract int column();

  public abstract int length();

  public static SourceLocation create(String sourceName, int line, int column, int length) {
    return new AutoValue_SourceLocation(sourceName, line, column, length);
  }

  public static SourceLocation of(Node n) {
    String sourceName = n.getSourceFileName();
    return create(
        sourceName == null ? "" : sourceName, n.getLineno(), n.getCharno(), n.getLength());
  }

  @Override
  public int compareTo(SourceLocation other) {
    return ComparisonChain.start()
        .compare(sourceName(), other.sourceName())
        .compare(line(), other.line())
        .compare(column(), other.column())
        .compare(length(), other.length())
        .result();
  }

  @Override
  public final String toString() {
    return sourceName() + ":" + line() + ":" + column();
  }
}
