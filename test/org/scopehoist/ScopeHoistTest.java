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
import static org.junit.Assert.assertThrows;
import static org.scopehoist.ParseHelper.assertSameStatements;
import static org.scopehoist.ParseHelper.parse;
import static org.scopehoist.ParseHelper.statements;
import static org.scopehoist.ParseHelper.toSource;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.javascript.jscomp.parsing.parser.FeatureSet;
import com.google.javascript.jscomp.parsing.parser.FeatureSet.Feature;
import com.google.javascript.rhino.Node;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ScopeHoist}, which runs the analysis and the rewrite. */
@RunWith(JUnit4.class)
public final class ScopeHoistTest {

  private static final SymbolNames NAMES = SymbolNames.forModule("m");

  @Test
  public void testNamedImport() {
    HoistResult result =
        assertHoisted(
            "import {a} from 'x'; foo(a);",
            "import 'm:x'; foo(" + imp("x", "a") + ");");

    assertThat(result.importedSymbols()).hasSize(1);
    ImportedSymbol symbol = result.importedSymbols().get(0);
    assertThat(symbol.source()).isEqualTo("x");
    assertThat(symbol.local()).isEqualTo(imp("x", "a"));
    assertThat(symbol.imported()).isEqualTo("a");
    assertThat(symbol.loc().line()).isEqualTo(1);
    assertThat(result.isEsm()).isTrue();
    assertThat(result.exportedSymbols()).isEmpty();
  }

  @Test
  public void testDefaultImport() {
    assertHoisted("import d from 'x'; d();", "import 'm:x'; " + imp("x", "default") + "();");
  }

  @Test
  public void testNamespaceStaticMembersAreImportedIndividually() {
    HoistResult result =
        assertHoisted(
            "import * as ns from 'x'; ns.foo(); ns['bar'];",
            "import 'm:x'; " + imp("x", "foo") + "(); " + imp("x", "bar") + ";");

    assertThat(importedKeys(result)).containsExactly("foo", "bar").inOrder();
  }

  @Test
  public void testNonStaticAccessKeepsNamespace() {
    HoistResult result =
        assertHoisted(
            "import * as ns from 'x'; ns.foo; ns[k];",
            "import 'm:x'; " + imp("x") + ".foo; " + imp("x") + "[k];");

    assertThat(importedKeys(result)).containsExactly("*");
  }

  @Test
  public void testRequireNamespace() {
    HoistResult result =
        assertHoisted(
            "const x = require('x'); x.foo();", "import 'm:x'; " + imp("x", "foo") + "();");

    assertThat(result.isEsm()).isFalse();
    assertThat(result.wrappedRequires()).isEmpty();
  }

  @Test
  public void testStatementRequireAddsNoSymbol() {
    HoistResult result = assertHoisted("require('x'); foo();", "import 'm:x'; foo();");

    assertThat(result.importedSymbols()).isEmpty();
  }

  @Test
  public void testDestructuredRequireGetsIndirection() {
    assertHoisted(
        "let {a} = require('x'); a(); a = 2;",
        "import 'm:x';"
            + "var " + req("a") + " = " + imp("x", "a") + ";"
            + req("a") + "();"
            + req("a") + " = 2;");
  }

  @Test
  public void testMemberOfRequire() {
    assertHoisted(
        "const b = require('x').b; b;",
        "import 'm:x'; var " + req("b") + " = " + imp("x", "b") + "; " + req("b") + ";");
  }

  @Test
  public void testReassignedRequireNamespace() {
    assertHoisted(
        "let x = require('x'); x = 1;",
        "import 'm:x'; var " + req("x") + " = " + imp("x") + "; " + req("x") + " = 1;");
  }

  @Test
  public void testNonStaticDestructuringKeepsDeclaration() {
    assertHoisted(
        "const {a, ...rest} = require('x'); a;",
        "import 'm:x';"
            + "const {a: " + var("a") + ", ..." + var("rest") + "} = " + imp("x") + ";"
            + var("a") + ";");
  }

  @Test
  public void testDeclarationIsSplitAroundRequires() {
    assertHoisted(
        "var a = 1, b = require('b'), c = 2; b.x;",
        "var " + var("a") + " = 1;"
            + "import 'm:b';"
            + "var " + var("c") + " = 2;"
            + imp("b", "x") + ";");
  }

  @Test
  public void testNestedRequireSplitsDeclaration() {
    HoistResult result =
        assertHoisted(
            "var a = 1, b = foo(require('y'));",
            "var " + var("a") + " = 1;"
                + "import 'm:y';"
                + "var " + var("b") + " = foo(" + imp("y") + ");");

    assertThat(result.wrappedRequires()).containsExactly("y");
  }

  @Test
  public void testRequireInRejectionHandlerIsWrapped() {
    HoistResult result =
        assertHoisted(
            "import('x').then(function(m) { return m; }, function() { return require('y'); });",
            "import 'm:x'; import 'm:y';"
                + NAMES.asyncImportName("x")
                + ".then(function(m) { return m; }, function() { return " + imp("y") + "; });");

    assertThat(result.wrappedRequires()).containsExactly("x", "y").inOrder();
  }

  @Test
  public void testRequireInDestructuringDefaultIsWrapped() {
    HoistResult result =
        assertHoisted(
            "const {a = require('z')} = require('x'); a;",
            "import 'm:z'; import 'm:x';"
                + "const {a: " + var("a") + " = " + imp("z") + "} = " + imp("x") + ";"
                + var("a") + ";");

    assertThat(result.wrappedRequires()).containsExactly("z");
  }

  @Test
  public void testComputedExportInRejectionHandler() {
    HoistResult result =
        assertHoisted(
            "exports.a = 1; import('x').then(function(m) {}, function(e) { exports[k] = e; });",
            NAMES.exportsObjectName() + ".a = 1;"
                + "import 'm:x';"
                + NAMES.asyncImportName("x")
                + ".then(function(m) {}, function(e) { "
                + NAMES.exportsObjectName() + "[k] = e; });");

    assertThat(result.staticCjsExports()).isFalse();
  }

  @Test
  public void testComputedExportKeyFallsBackToExportsObject() {
    // Facts that claim static exports although one write has a computed key.
    ModuleFlags flags = new ModuleFlags();
    flags.markCjsExports();
    ModuleFacts facts =
        new ModuleFacts(
            ImmutableMap.of(),
            ImmutableMap.of(),
            ImmutableListMultimap.of(),
            ImmutableListMultimap.of(),
            ImmutableSet.of(),
            ImmutableSet.of(),
            flags,
            ImmutableList.of());
    Node script = parse("exports.a = 1; exports[k] = 2;");

    new ScopeHoistRewriter(facts, ModuleBindings.collect(script), NAMES).rewrite(script);

    assertSameStatements(
        script,
        parse(
            "var " + exp("a") + ";"
                + exp("a") + " = 1;"
                + NAMES.exportsObjectName() + "[k] = 2;"));
  }

  @Test
  public void testRequireInFunctionIsHoistedAndWrapped() {
    HoistResult result =
        assertHoisted(
            "function f() { return require('x').a; }",
            "import 'm:x'; function " + var("f") + "() { return " + imp("x", "a") + "; }");

    assertThat(result.wrappedRequires()).containsExactly("x");
  }

  @Test
  public void testSequencedRequiresAreGuarded() {
    HoistResult result =
        assertHoisted(
            "require('a'), require('b'), foo();",
            "import 'm:a'; import 'm:b'; !" + imp("a") + ", !" + imp("b") + ", foo();");

    assertThat(result.wrappedRequires()).containsExactly("a", "b").inOrder();
  }

  @Test
  public void testTypeofRequireAndModule() {
    HoistResult result =
        assertHoisted(
            "foo(typeof require, typeof module);", "foo('function', 'object');");

    assertThat(result.shouldWrap()).isFalse();
  }

  @Test
  public void testHotModuleReplacement() {
    HoistResult result =
        assertHoisted("if (module.hot) module.hot.accept();", "if (null) null.accept();");

    assertThat(result.shouldWrap()).isFalse();
    assertThat(result.hasCjsExports()).isFalse();
  }

  @Test
  public void testExportsReadBackUseOneDeclaredName() {
    HoistResult result =
        assertHoisted(
            "exports.foo = 1; exports.foo = 2; console.log(exports.foo, module.exports.foo);",
            "var " + exp("foo") + ";"
                + exp("foo") + " = 1;"
                + exp("foo") + " = 2;"
                + "console.log(" + exp("foo") + ", " + exp("foo") + ");");

    assertThat(result.selfReferences()).containsExactly("foo");
    assertThat(result.exportedSymbols()).hasSize(1);
    assertThat(result.exportedSymbols().get(0).local()).isEqualTo(exp("foo"));
    assertThat(result.exportedSymbols().get(0).exported()).isEqualTo("foo");
    assertThat(result.staticCjsExports()).isTrue();
    assertThat(result.hasCjsExports()).isTrue();
  }

  @Test
  public void testNonStaticExportsUseExportsObject() {
    HoistResult result =
        assertHoisted(
            "exports.a = 1; exports[k] = 2;",
            NAMES.exportsObjectName() + ".a = 1; " + NAMES.exportsObjectName() + "[k] = 2;");

    assertThat(result.staticCjsExports()).isFalse();
    assertThat(result.exportedSymbols()).hasSize(1);
    assertThat(result.exportedSymbols().get(0).exported()).isEqualTo("*");
  }

  @Test
  public void testModuleExportsAssignment() {
    assertHoisted(
        "module.exports = function() {};", NAMES.exportsObjectName() + " = function() {};");
  }

  @Test
  public void testTopLevelThisAssignmentIsAnExport() {
    assertHoisted("this.a = 1;", "var " + exp("a") + "; " + exp("a") + " = 1;");
  }

  @Test
  public void testTopLevelThisIsTheExportsObject() {
    HoistResult result = assertHoisted("foo(this);", "foo(" + NAMES.exportsObjectName() + ");");

    assertThat(result.selfReferences()).containsExactly("*");
  }

  @Test
  public void testThisInEsModuleIsUndefined() {
    assertHoisted("export const a = this;", "const " + exp("a") + " = undefined;");
  }

  @Test
  public void testThisInFunctionIsUntouched() {
    assertHoisted(
        "function f() { return this; }", "function " + var("f") + "() { return this; }");
  }

  @Test
  public void testWrappedModuleKeepsNames() {
    HoistResult result =
        assertHoisted(
            "var x = 1; eval('x'); exports.a = x;", "var x = 1; eval('x'); exports.a = x;");

    assertThat(result.shouldWrap()).isTrue();
  }

  @Test
  public void testGlobalIsAliased() {
    assertHoisted("global.foo = 1;", SymbolNames.GLOBAL_ALIAS + ".foo = 1;");
  }

  @Test
  public void testTopLevelNamesAreRenamed() {
    assertHoisted(
        "var a = 1; function f() { var b = a; return b; } f();",
        "var " + var("a") + " = 1;"
            + "function " + var("f") + "() { var b = " + var("a") + "; return b; }"
            + var("f") + "();");
  }

  @Test
  public void testEsExportsAreRenamed() {
    HoistResult result =
        assertHoisted(
            "export const a = 1; export function f() { return a; }",
            "const " + exp("a") + " = 1; function " + exp("f") + "() { return " + exp("a") + "; }");

    assertThat(exportedKeys(result)).containsExactly("a", "f").inOrder();
  }

  @Test
  public void testExportSpecifier() {
    HoistResult result = assertHoisted("var x = 1; export {x as y};", "var " + exp("y") + " = 1;");

    assertThat(exportedKeys(result)).containsExactly("y");
  }

  @Test
  public void testExportDefaultExpression() {
    assertHoisted("export default 1 + 2;", "var " + exp("default") + " = 1 + 2;");
  }

  @Test
  public void testExportDefaultAnonymousFunction() {
    assertHoisted("export default function() {}", "function " + exp("default") + "() {}");
  }

  @Test
  public void testExportDefaultNamedFunction() {
    assertHoisted(
        "export default function foo() {} foo();",
        "function " + exp("default") + "() {} " + exp("default") + "();");
  }

  @Test
  public void testExportDefaultAnonymousClass() {
    assertHoisted("export default class {}", "class " + exp("default") + " {}");
  }

  @Test
  public void testReExports() {
    HoistResult result =
        assertHoisted(
            "export * from 'x'; export {a as b} from 'y'; import {c} from 'z'; export {c as d};",
            "import 'm:x'; import 'm:y'; import 'm:z';");

    ImmutableList<ImportedSymbol> reExports = result.reExports();
    assertThat(reExports).hasSize(3);
    assertReExport(reExports.get(0), "x", "*", "*");
    assertReExport(reExports.get(1), "y", "b", "a");
    assertReExport(reExports.get(2), "z", "d", "c");
    assertThat(result.importedSymbols()).isEmpty();
  }

  @Test
  public void testExportedRequire() {
    HoistResult result =
        assertHoisted(
            "export const a = require('x');",
            "import 'm:x'; const " + exp("a") + " = " + imp("x") + ";");

    assertThat(result.wrappedRequires()).containsExactly("x");
  }

  @Test
  public void testShorthandPropertyIsExpanded() {
    HoistOutput output = hoist("import {a} from 'x'; foo({a});");

    Node call = statements(output.root()).get(1).getFirstChild();
    Node key = call.getSecondChild().getFirstChild();
    assertThat(key.isStringKey()).isTrue();
    assertThat(key.isShorthandProperty()).isFalse();
    assertThat(key.getFirstChild().getString()).isEqualTo(imp("x", "a"));
  }

  @Test
  public void testImportAssignmentIsFatal() {
    HoistOutput output = hoist("import {a} from 'x';\na = 1;");

    assertThat(output.isSuccessful()).isFalse();
    assertThat(output.root()).isNull();
    assertThat(output.result()).isNull();
    assertThat(output.errors()).hasSize(1);
    HoistDiagnostic error = output.errors().get(0);
    assertThat(error.type()).isEqualTo(HoistDiagnostic.IMPORT_ASSIGNMENT);
    assertThat(error.isError()).isTrue();
    assertThat(error.highlights()).hasSize(2);
    assertThat(error.highlights().get(0).loc().line()).isEqualTo(2);
    assertThat(error.highlights().get(0).message()).isNull();
    assertThat(error.highlights().get(1).loc().line()).isEqualTo(1);
    assertThat(error.highlights().get(1).message()).isEqualTo("Originally imported here");
  }

  @Test
  public void testDestructuredDynamicImport() {
    HoistResult result =
        assertHoisted(
            "async function f() { const {foo} = await import('x'); return foo; }",
            "import 'm:x';"
                + "async function " + var("f") + "() {"
                + "  const {foo} = await " + NAMES.asyncImportName("x") + ";"
                + "  return foo;"
                + "}");

    assertThat(result.importedSymbols()).hasSize(1);
    ImportedSymbol symbol = result.importedSymbols().get(0);
    assertThat(symbol.local()).isEqualTo(NAMES.asyncImportName("x", "foo"));
    assertThat(symbol.imported()).isEqualTo("foo");
    assertThat(result.dynamicImports()).containsExactly(NAMES.asyncImportName("x"), "x");
  }

  @Test
  public void testDynamicImportNamespaceMember() {
    HoistResult result =
        assertHoisted(
            "async function f() { const ns = await import('x'); return ns.foo; }",
            "import 'm:x';"
                + "async function " + var("f") + "() {"
                + "  const ns = await " + NAMES.asyncImportName("x") + ";"
                + "  return ns.foo;"
                + "}");

    assertThat(importedKeys(result)).containsExactly("foo");
  }

  @Test
  public void testNonStaticDynamicImport() {
    HoistResult result =
        assertHoisted(
            "foo(import('x'));", "import 'm:x'; foo(" + NAMES.asyncImportName("x") + ");");

    assertThat(importedKeys(result)).containsExactly("*");
    assertThat(result.dynamicImports()).containsExactly(NAMES.asyncImportName("x"), "x");
    assertThat(result.wrappedRequires()).containsExactly("x");
  }

  @Test
  public void testOutputWithImportsIsAModule() {
    HoistOutput output = hoist("require('x');");

    Node root = output.root();
    assertThat(root.getFirstChild().isModuleBody()).isTrue();
    FeatureSet features = (FeatureSet) root.getProp(Node.FEATURE_SET);
    assertThat(features.has(Feature.MODULES)).isTrue();
  }

  @Test
  public void testInputIsNotModified() {
    String js = "const x = require('x'); exports.a = x.b;";
    Node script = parse(js);
    String before = toSource(script);

    ScopeHoist.builder().setModuleId("m").build().hoist(script);

    assertThat(toSource(script)).isEqualTo(before);
  }

  @Test
  public void testNamesAreDeterministic() {
    String js =
        "import {a} from 'x'; const y = require('y'); exports.b = a + y.c;"
            + "export default function() {}";

    HoistOutput first = hoist(js);
    HoistOutput second = hoist(js);

    assertThat(toSource(first.root())).isEqualTo(toSource(second.root()));
    assertThat(first.result()).isEqualTo(second.result());
  }

  @Test
  public void testBailoutsAreReportedAsWarnings() {
    HoistOutput output = hoist("eval('1');");

    assertThat(output.isSuccessful()).isTrue();
    assertThat(output.bailouts()).hasSize(1);
    HoistDiagnostic warning = output.diagnostics().get(0);
    assertThat(warning.type()).isEqualTo(BailoutReason.EVAL.diagnosticType());
    assertThat(warning.isError()).isFalse();
  }

  @Test
  public void testInvalidModuleId() {
    assertThrows(
        IllegalArgumentException.class, () -> ScopeHoist.builder().setModuleId("a.b").build());
  }

  private static HoistOutput hoist(String js) {
    return ScopeHoist.builder().setModuleId("m").setTraceBailouts(true).build().hoist(parse(js));
  }

  private static HoistResult assertHoisted(String js, String expected) {
    HoistOutput output = hoist(js);
    assertThat(output.errors()).isEmpty();
    assertSameStatements(output.root(), parse(expected));
    return output.result();
  }

  private static void assertReExport(
      ImportedSymbol reExport, String source, String exported, String imported) {
    assertThat(reExport.source()).isEqualTo(source);
    assertThat(reExport.local()).isEqualTo(exported);
    assertThat(reExport.imported()).isEqualTo(imported);
  }

  private static List<String> importedKeys(HoistResult result) {
    ImmutableList.Builder<String> keys = ImmutableList.builder();
    for (ImportedSymbol symbol : result.importedSymbols()) {
      keys.add(symbol.imported());
    }
    return keys.build();
  }

  private static List<String> exportedKeys(HoistResult result) {
    ImmutableList.Builder<String> keys = ImmutableList.builder();
    for (ExportedSymbol symbol : result.exportedSymbols()) {
      keys.add(symbol.exported());
    }
    return keys.build();
  }

  private static String imp(String source) {
    return NAMES.importName(source, SymbolNames.NAMESPACE);
  }

  private static String imp(String source, String key) {
    return NAMES.importName(source, key);
  }

  private static String exp(String key) {
    return NAMES.exportName(key);
  }

  private static String var(String name) {
    return NAMES.topLevelName(name);
  }

  private static String req(String name) {
    return NAMES.requireName(name);
  }
}
