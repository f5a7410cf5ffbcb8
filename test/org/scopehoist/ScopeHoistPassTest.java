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
import static org.scopehoist.ParseHelper.assertSameStatements;
import static org.scopehoist.ParseHelper.newCompiler;
import static org.scopehoist.ParseHelper.parse;
import static org.scopehoist.ParseHelper.toSource;

import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.jscomp.SourceFile;
import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.Node;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ScopeHoistPass}. */
@RunWith(JUnit4.class)
public final class ScopeHoistPassTest {

  private static final ModuleIdGenerator BY_FILE_NAME = name -> name.replace(".js", "");

  private Compiler compiler;

  @Before
  public void setUp() {
    compiler = newCompiler();
  }

  @Test
  public void testHoistsEveryScript() {
    Node a = parseScript("a.js", "exports.foo = 1;");
    Node b = parseScript("b.js", "const a = require('./a'); a.foo;");

    ScopeHoistPass pass = new ScopeHoistPass(compiler, BY_FILE_NAME, false);
    pass.process(IR.root(), IR.root(a, b));

    SymbolNames namesA = SymbolNames.forModule("a");
    SymbolNames namesB = SymbolNames.forModule("b");
    assertSameStatements(
        a,
        parse(
            "var " + namesA.exportName("foo") + ";" + namesA.exportName("foo") + " = 1;"));
    assertSameStatements(
        b, parse("import 'b:./a';" + namesB.importName("./a", "foo") + ";"));
    assertThat(b.getFirstChild().isModuleBody()).isTrue();

    assertThat(pass.results().keySet()).containsExactly("a.js", "b.js").inOrder();
    assertThat(pass.results().get("a.js").selfReferences()).isEmpty();
    assertThat(pass.results().get("b.js").importedSymbols()).hasSize(1);
    assertThat(compiler.getErrors()).isEmpty();
  }

  @Test
  public void testFailedScriptIsLeftUnchanged() {
    Node script = parseScript("a.js", "import {a} from 'x'; a = 1;");
    String before = toSource(script);

    ScopeHoistPass pass = new ScopeHoistPass(compiler, BY_FILE_NAME, false);
    pass.process(IR.root(), IR.root(script));

    assertThat(toSource(script)).isEqualTo(before);
    assertThat(pass.results()).isEmpty();
    assertThat(compiler.getErrors()).hasSize(1);
    JSError error = compiler.getErrors().get(0);
    assertThat(error.getType()).isEqualTo(HoistDiagnostic.IMPORT_ASSIGNMENT);
    assertThat(error.getSourceName()).isEqualTo("a.js");
    assertThat(error.getLineno()).isEqualTo(1);
  }

  @Test
  public void testBailoutsAreWarningsWhenTracing() {
    Node script = parseScript("a.js", "eval('1');");

    new ScopeHoistPass(compiler, BY_FILE_NAME, true).process(IR.root(), IR.root(script));

    assertThat(compiler.getErrors()).isEmpty();
    assertThat(compiler.getWarnings()).hasSize(1);
    assertThat(compiler.getWarnings().get(0).getType())
        .isEqualTo(BailoutReason.EVAL.diagnosticType());
  }

  @Test
  public void testNoWarningsWithoutTracing() {
    Node script = parseScript("a.js", "eval('1');");

    new ScopeHoistPass(compiler, BY_FILE_NAME, false).process(IR.root(), IR.root(script));

    assertThat(compiler.getWarnings()).isEmpty();
  }

  @Test
  public void testDefaultModuleIdsAreHashedFileNames() {
    Node script = parseScript("a.js", "var x = 1;");

    new ScopeHoistPass(compiler).process(IR.root(), IR.root(script));

    assertThat(toSource(script)).contains("$" + SymbolNames.hash("a.js") + "$var$x");
  }

  private Node parseScript(String name, String js) {
    Node script = compiler.parse(SourceFile.fromCode(name, js));
    assertThat(compiler.getErrors()).isEmpty();
    return script;
  }
}
