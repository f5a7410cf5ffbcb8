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

/** How a module's dependency was introduced. */
public enum ImportKind {
  /** An ES {@code import} declaration. */
  IMPORT,
  /** A CommonJS {@code require()} call. */
  REQUIRE,
  /** A dynamic {@code import()} expression. */
  DYNAMIC_IMPORT
}
