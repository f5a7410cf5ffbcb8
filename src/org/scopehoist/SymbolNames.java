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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.CharMatcher;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Synthesizes the names that hoisted bindings are renamed to.
 *
 * <p>Every name is prefixed with the module id and, where a specifier or key is involved, a
 * 64-bit fingerprint of it. The fingerprint has a fixed seed so two transforms of the same module
 * always produce the same names, regardless of the order in which bindings are visited.
 */
public final class SymbolNames {

  /** Name that free references to {@code global} are rewritten to. */
  public static final String GLOBAL_ALIAS = "$bundle$global";

  /** Imported key (and exported key) standing for the whole namespace object. */
  public static final String NAMESPACE = "*";

  private static final HashFunction FINGERPRINT = Hashing.farmHashFingerprint64();

  private static final CharMatcher ID_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("_$"))
          .precomputed();

  private final String moduleId;

  private SymbolNames(String moduleId) {
    this.moduleId = moduleId;
  }

  public static SymbolNames forModule(String moduleId) {
    checkArgument(isValidModuleId(moduleId), "Invalid module id: %s", moduleId);
    return new SymbolNames(moduleId);
  }

  static boolean isValidModuleId(String moduleId) {
    return !moduleId.isEmpty() && ID_CHARS.matchesAllOf(moduleId);
  }

  /** Lowercase hex of the 64-bit fingerprint of {@code s}. */
  public static String hash(String s) {
    return Long.toHexString(FINGERPRINT.hashString(s, UTF_8).asLong());
  }

  public String moduleId() {
    return moduleId;
  }

  /** {@code $<id>$import$<h(source)>}, followed by {@code $<h(imported)>} unless a namespace. */
  public String importName(String source, String imported) {
    String base = "$" + moduleId + "$import$" + hash(source);
    return NAMESPACE.equals(imported) ? base : base + "$" + hash(imported);
  }

  public String asyncImportName(String source) {
    return "$" + moduleId + "$importAsync$" + hash(source);
  }

  public String asyncImportName(String source, String imported) {
    String base = asyncImportName(source);
    return NAMESPACE.equals(imported) ? base : base + "$" + hash(imported);
  }

  /** The per-key export name, or the exports object name for {@link #NAMESPACE}. */
  public String exportName(String exported) {
    if (NAMESPACE.equals(exported)) {
      return exportsObjectName();
    }
    return "$" + moduleId + "$export$" + hash(exported);
  }

  public String exportsObjectName() {
    return "$" + moduleId + "$exports";
  }

  /** Indirection variable for a required binding that is reassigned locally. */
  public String requireName(String local) {
    return "$" + moduleId + "$require$" + local;
  }

  public String topLevelName(String name) {
    return "$" + moduleId + "$var$" + name;
  }

  /** Specifier used by the side-effect imports this transform synthesizes. */
  public String hoistedSpecifier(String source) {
    return moduleId + ":" + source;
  }
}
