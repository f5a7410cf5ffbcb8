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

import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;
import org.jspecify.annotations.Nullable;

/** Recognizers for the CommonJS and dynamic import shapes that scope hoisting cares about. */
final class CommonJsPatterns {

  static final String MODULE = "module";
  static final String EXPORTS = "exports";
  static final String REQUIRE = "require";

  private CommonJsPatterns() {}

  /**
   * Returns the specifier of a {@code require('x')} or {@code module.require('x')} call, or null.
   * {@code require} has to be free and not marked as ignored.
   */
  static @Nullable String matchRequire(Node n, ModuleBindings bindings) {
    if (!n.isCall()) {
      return null;
    }
    Node callee = n.getFirstChild();
    boolean isRequire =
        (callee.isName() && bindings.isFree(callee, REQUIRE))
            || matchMember(callee, bindings, MODULE, REQUIRE);
    if (!isRequire) {
      return null;
    }
    return stringValue(callee.getNext());
  }

  /** Returns the specifier of an {@code import('x')} expression, or null. */
  static @Nullable String matchDynamicImport(Node n) {
    if (n.getToken() != Token.DYNAMIC_IMPORT) {
      return null;
    }
    return stringValue(n.getFirstChild());
  }

  /**
   * Whether {@code n} is the static property chain {@code parts[0].parts[1]...} rooted at a free
   * name.
   */
  static boolean matchMember(Node n, ModuleBindings bindings, String... parts) {
    Node current = n;
    for (int i = parts.length - 1; i > 0; i--) {
      if (!parts[i].equals(staticKey(current))) {
        return false;
      }
      current = current.getFirstChild();
    }
    return current.isName() && bindings.isFree(current, parts[0]);
  }

  /**
   * The key of a member access if it is known statically: the property of {@code a.b}, or the
   * string literal of {@code a['b']}. Returns null otherwise, including for non-members.
   */
  static @Nullable String staticKey(Node member) {
    if (member.isGetProp()) {
      return member.getString();
    }
    if (member.isGetElem() && member.getSecondChild().isStringLit()) {
      return member.getSecondChild().getString();
    }
    return null;
  }

  static boolean isMember(Node n) {
    return n.isGetProp() || n.isGetElem();
  }

  private static @Nullable String stringValue(@Nullable Node arg) {
    if (arg == null) {
      return null;
    }
    if (arg.isStringLit()) {
      return arg.getString();
    }
    if (arg.isTemplateLit() && arg.hasOneChild() && arg.getFirstChild().isTemplateLitString()) {
      return arg.getFirstChild().getCookedString();
    }
    return null;
  }
}
