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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.CompilerOptions;
import com.google.javascript.jscomp.CompilerOptions.LanguageMode;
import com.google.javascript.jscomp.SourceFile;
import com.google.javascript.rhino.Node;
import java.util.ArrayList;
import java.util.List;

/** Parses test code and compares rewritten trees. */
final class ParseHelper {

  static final String SOURCE_NAME = "test.js";

  private ParseHelper() {}

  static Compiler newCompiler() {
    CompilerOptions options = new CompilerOptions();
    options.setLanguageIn(LanguageMode.ECMASCRIPT_NEXT);
    // CommonJS modules are sloppy mode code.
    options.setStrictModeInput(false);
    Compiler compiler = new Compiler();
    compiler.initOptions(options);
    return compiler;
  }

  static Node parse(String js) {
    Compiler compiler = newCompiler();
    Node script = compiler.parse(SourceFile.fromCode(SOURCE_NAME, js));
    assertThat(compiler.getErrors()).isEmpty();
    return script;
  }

  /** Top-level statements, looking through the module body. */
  static List<Node> statements(Node script) {
    Node body = script.hasChildren() && script.getFirstChild().isModuleBody()
        ? script.getFirstChild()
        : script;
    List<Node> statements = new ArrayList<>();
    for (Node n = body.getFirstChild(); n != null; n = n.getNext()) {
      statements.add(n);
    }
    return statements;
  }

  static void assertSameStatements(Node actual, Node expected) {
    String message = "Expected:\n" + toSource(expected) + "\nbut was:\n" + toSource(actual);
    List<Node> actualStatements = statements(actual);
    List<Node> expectedStatements = statements(expected);
    assertWithMessage(message).that(actualStatements).hasSize(expectedStatements.size());
    for (int i = 0; i < actualStatements.size(); i++) {
      assertWithMessage(message)
          .that(actualStatements.get(i).isEquivalentTo(expectedStatements.get(i)))
          .isTrue();
    }
  }

  static String toSource(Node n) {
    return newCompiler().toSource(n);
  }
}
