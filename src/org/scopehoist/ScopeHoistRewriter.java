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

import static com.google.common.base.Preconditions.checkState;
import static org.scopehoist.CommonJsPatterns.EXPORTS;
import static org.scopehoist.CommonJsPatterns.MODULE;
import static org.scopehoist.CommonJsPatterns.REQUIRE;
import static org.scopehoist.CommonJsPatterns.isMember;
import static org.scopehoist.CommonJsPatterns.matchDynamicImport;
import static org.scopehoist.CommonJsPatterns.matchMember;
import static org.scopehoist.CommonJsPatterns.staticKey;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.jscomp.parsing.parser.FeatureSet;
import com.google.javascript.jscomp.parsing.parser.FeatureSet.Feature;
import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.scopehoist.HoistDiagnostic.CodeHighlight;

/**
 * Rewrites one module so that it can share a scope with the other modules of a bundle.
 *
 * <p>Import and export declarations are removed in favor of hoisted side-effect imports of
 * {@code <moduleId>:<source>}; references to imported and exported bindings are renamed to the
 * names synthesized by {@link SymbolNames}. Unless the module has to stay wrapped, CommonJS
 * {@code exports} accesses become top-level variables as well. The tree is modified in place, so
 * callers that still need the original should pass a copy.
 */
final class ScopeHoistRewriter {

  private final ModuleFacts facts;
  private final ModuleBindings bindings;
  private final SymbolNames names;

  private final List<Node> hoistedImports = new ArrayList<>();
  private final List<Node> moduleItems = new ArrayList<>();
  private final Set<String> exportDecls = new LinkedHashSet<>();
  private final Map<String, ImportedSymbol> importedSymbols = new LinkedHashMap<>();
  private final List<ExportedSymbol> exportedSymbols = new ArrayList<>();
  private final Set<Map.Entry<String, String>> seenExports = new HashSet<>();
  private final List<ImportedSymbol> reExports = new ArrayList<>();
  private final Set<String> selfReferences = new LinkedHashSet<>();
  private final Map<String, String> dynamicImports = new LinkedHashMap<>();
  private final List<HoistDiagnostic> errors = new ArrayList<>();

  private boolean inFunctionScope = false;

  ScopeHoistRewriter(ModuleFacts facts, ModuleBindings bindings, SymbolNames names) {
    this.facts = facts;
    this.bindings = bindings;
    this.names = names;
  }

  void rewrite(Node script) {
    checkState(script.isScript(), script);
    Node body = script.hasChildren() && script.getFirstChild().isModuleBody()
        ? script.getFirstChild()
        : script;

    for (Node item = body.getFirstChild(); item != null; ) {
      Node next = item.getNext();
      rewriteModuleItem(item);
      item = next;
    }

    body.removeChildren();
    for (Node hoisted : hoistedImports) {
      body.addChildToBack(hoisted);
    }
    for (String name : exportDecls) {
      body.addChildToBack(IR.var(IR.name(name)));
    }
    boolean hasImports = !hoistedImports.isEmpty();
    for (Node item : moduleItems) {
      hasImports |= item.isImport();
      body.addChildToBack(item);
    }

    if (hasImports && body == script) {
      // Imports are only allowed in a module body.
      Node moduleBody = new Node(Token.MODULE_BODY).srcref(script);
      moduleBody.addChildrenToBack(script.removeChildren());
      script.addChildToBack(moduleBody);
      FeatureSet features = (FeatureSet) script.getProp(Node.FEATURE_SET);
      script.putProp(
          Node.FEATURE_SET,
          (features == null ? FeatureSet.BARE_MINIMUM : features).with(Feature.MODULES));
    }
  }

  ImmutableList<HoistDiagnostic> errors() {
    return ImmutableList.copyOf(errors);
  }

  HoistResult result() {
    return HoistResult.builder()
        .setImportedSymbols(importedSymbols.values())
        .setExportedSymbols(exportedSymbols)
        .setReExports(reExports)
        .setSelfReferences(selfReferences)
        .setWrappedRequires(facts.wrappedRequires())
        .setDynamicImports(dynamicImports)
        .setStaticCjsExports(facts.staticCjsExports())
        .setHasCjsExports(facts.hasCjsExports())
        .setIsEsm(facts.isEsm())
        .setShouldWrap(facts.shouldWrap())
        .build();
  }

  private void rewriteModuleItem(Node item) {
    switch (item.getToken()) {
      case IMPORT:
        rewriteImport(item);
        return;
      case EXPORT:
        rewriteExport(item);
        return;
      case VAR:
      case LET:
      case CONST:
        rewriteDeclaration(item);
        return;
      case EXPR_RESULT: {
        String source = matchRequire(item.getFirstChild());
        if (source != null) {
          addRequire(source);
          return;
        }
        break;
      }
      default:
        break;
    }

    visit(item);
    addModuleItem(item);
  }

  private void rewriteImport(Node item) {
    hoistedImports.add(hoistedImport(item.getLastChild().getString(), item));

    List<Node> locals = new ArrayList<>();
    ModuleBindings.collectLhs(item, locals);
    for (Node local : locals) {
      BindingId id = bindings.get(local);
      if (!facts.isNonConst(id)) {
        continue;
      }
      ImmutableList.Builder<CodeHighlight> highlights = ImmutableList.builder();
      for (SourceLocation loc : facts.nonConstBindings().get(id)) {
        highlights.add(CodeHighlight.create(loc, null));
      }
      highlights.add(CodeHighlight.create(SourceLocation.of(local), "Originally imported here"));
      errors.add(
          HoistDiagnostic.create(
              HoistDiagnostic.IMPORT_ASSIGNMENT,
              HoistDiagnostic.IMPORT_ASSIGNMENT.format,
              highlights.build()));
    }
  }

  private void rewriteExport(Node item) {
    if (item.getBooleanProp(Node.EXPORT_ALL_FROM)) {
      String source = item.getLastChild().getString();
      hoistedImports.add(hoistedImport(source, item));
      reExports.add(
          ImportedSymbol.create(
              source, SymbolNames.NAMESPACE, SymbolNames.NAMESPACE, SourceLocation.of(item)));
      return;
    }
    if (item.getBooleanProp(Node.EXPORT_DEFAULT)) {
      rewriteExportDefault(item);
      return;
    }

    Node declaration = item.getFirstChild();
    if (!declaration.isExportSpecs()) {
      visit(declaration);
      addModuleItem(declaration);
      return;
    }

    if (item.hasTwoChildren()) {
      String source = item.getLastChild().getString();
      hoistedImports.add(hoistedImport(source, item));
      for (Node spec = declaration.getFirstChild(); spec != null; spec = spec.getNext()) {
        reExports.add(
            ImportedSymbol.create(
                source,
                spec.getSecondChild().getString(),
                spec.getFirstChild().getString(),
                SourceLocation.of(spec)));
      }
      return;
    }

    for (Node spec = declaration.getFirstChild(); spec != null; spec = spec.getNext()) {
      Node local = spec.getFirstChild();
      String exported = spec.getSecondChild().getString();
      BindingId id = bindings.get(local);
      ImportRecord imported = facts.importOf(id);
      if (imported != null) {
        // Exporting an import forwards the dependency's binding.
        reExports.add(
            ImportedSymbol.create(
                imported.source(), exported, imported.specifier(), SourceLocation.of(spec)));
        continue;
      }

      String recorded = facts.exportOf(id);
      String hoistedLocal = facts.shouldWrap()
          ? local.getString()
          : names.exportName(recorded != null ? recorded : exported);
      addExportedSymbol(hoistedLocal, exported, SourceLocation.of(spec));
    }
  }

  private void rewriteExportDefault(Node item) {
    Node child = item.getFirstChild();
    if (ImportExportAnalyzer.isDefaultDeclaration(child)) {
      Node name = child.getFirstChild();
      boolean named = name.isName() && !name.getString().isEmpty();
      if (!facts.shouldWrap() || !named) {
        String exportName = exportIdent("default", item);
        if (name.isName()) {
          setName(name, exportName);
        } else {
          name.replaceWith(IR.name(exportName).srcref(name));
        }
      }
      visit(child);
      addModuleItem(child);
      return;
    }

    String exportName = exportIdent("default", item);
    visit(child);
    Node value = item.getFirstChild().detach();
    addModuleItem(IR.var(IR.name(exportName).srcref(item), value).srcref(item));
  }

  /**
   * Splits a top-level declaration around its hoistable requires. Each such declarator is dropped,
   * so the remaining declarators are grouped into declarations placed before the side-effect
   * import of the next require, which keeps the original evaluation order.
   */
  private void rewriteDeclaration(Node declaration) {
    List<Node> pending = new ArrayList<>();
    for (Node declarator = declaration.getFirstChild(); declarator != null; ) {
      Node next = declarator.getNext();
      Node target = declarator.isDestructuringLhs() ? declarator.getFirstChild() : declarator;
      Node init = declarator.isDestructuringLhs()
          ? declarator.getSecondChild()
          : declarator.getFirstChild();
      String source = init == null ? null : hoistableRequire(init);

      if (source != null && !facts.nonStaticRequires().contains(source)) {
        flushDeclarators(declaration, pending, moduleItems.size());
        addRequire(source);
        declareReassignedRequires(target, source, declarator);
      } else {
        int itemCount = moduleItems.size();
        visit(declarator);
        if (moduleItems.size() > itemCount) {
          // Requires nested in the initializer were hoisted, earlier declarators go first.
          flushDeclarators(declaration, pending, itemCount);
        }
        pending.add(declarator);
      }
      declarator = next;
    }
    flushDeclarators(declaration, pending, moduleItems.size());
  }

  private @Nullable String hoistableRequire(Node init) {
    String source = matchRequire(init);
    if (source == null && isMember(init) && staticKey(init) != null) {
      source = matchRequire(init.getFirstChild());
    }
    return source;
  }

  private void flushDeclarators(Node declaration, List<Node> pending, int index) {
    if (pending.isEmpty()) {
      return;
    }
    Node split = new Node(declaration.getToken()).srcref(declaration);
    for (Node declarator : pending) {
      split.addChildToBack(declarator.detach());
    }
    pending.clear();
    moduleItems.add(index, split);
  }

  /**
   * A required binding that is reassigned later gets its own variable, initialized from the
   * import.
   */
  private void declareReassignedRequires(Node target, String source, Node declarator) {
    List<Node> locals = new ArrayList<>();
    ModuleBindings.collectLhs(target, locals);
    for (Node local : locals) {
      BindingId id = bindings.get(local);
      ImportRecord imported = facts.importOf(id);
      if (imported == null || !facts.isNonConst(id)) {
        continue;
      }
      String importName =
          importIdent(source, imported.specifier(), SourceLocation.of(declarator));
      moduleItems.add(
          IR.var(
                  IR.name(names.requireName(local.getString())).srcref(local),
                  IR.name(importName).srcref(declarator))
              .srcref(declarator));
    }
  }

  private void visit(Node n) {
    switch (n.getToken()) {
      case FUNCTION:
        if (!n.isArrowFunction()) {
          visitInFunctionScope(n);
          return;
        }
        break;
      case CLASS:
        visitInFunctionScope(n);
        return;
      case GETPROP:
      case GETELEM:
        visitMember(n);
        return;
      case CALL: {
        String source = matchRequire(n);
        if (source != null) {
          addRequire(source);
          replace(n, IR.name(importIdent(source, SymbolNames.NAMESPACE, SourceLocation.of(n))));
          return;
        }
        break;
      }
      case DYNAMIC_IMPORT:
        visitDynamicImport(n);
        return;
      case THIS:
        visitThis(n);
        return;
      case TYPEOF:
        if (visitTypeof(n)) {
          return;
        }
        break;
      case COMMA:
        guardSequencedRequires(n);
        break;
      case NAME:
        renameReference(n);
        break;
      case STRING_KEY:
        visitChildren(n);
        expandShorthand(n);
        return;
      default:
        if (NodeUtil.isAssignmentOp(n) && visitExportAssignment(n)) {
          return;
        }
        break;
    }

    visitChildren(n);
  }

  private void visitChildren(Node n) {
    for (Node child = n.getFirstChild(); child != null; ) {
      Node next = child.getNext();
      visit(child);
      child = next;
    }
  }

  private void visitInFunctionScope(Node n) {
    boolean wasInFunctionScope = inFunctionScope;
    inFunctionScope = true;
    visitChildren(n);
    inFunctionScope = wasInFunctionScope;
  }

  private void visitMember(Node n) {
    if (!facts.shouldWrap()) {
      if (matchMember(n, bindings, MODULE, EXPORTS)) {
        selfReferences.add(SymbolNames.NAMESPACE);
        replace(n, IR.name(exportIdent(SymbolNames.NAMESPACE, n)));
        return;
      }
      if (matchMember(n, bindings, MODULE, "hot")) {
        replace(n, IR.nullNode());
        return;
      }
    }

    String key = staticKey(n);
    if (key == null) {
      visitChildren(n);
      return;
    }

    Node object = n.getFirstChild();
    boolean hoistsExports = facts.staticCjsExports() && !facts.shouldWrap();
    switch (object.getToken()) {
      case NAME: {
        BindingId id = bindings.get(object);
        ImportRecord imported = facts.importOf(id);
        if (imported != null
            && imported.isNamespace()
            && !facts.hasNonStaticAccess(id)
            && !facts.isNonConst(id)
            && !facts.nonStaticRequires().contains(imported.source())) {
          if (imported.kind() == ImportKind.DYNAMIC_IMPORT) {
            // The member access stays, the linker resolves it through the async namespace.
            addImportedSymbol(
                imported.source(),
                names.asyncImportName(imported.source(), key),
                key,
                SourceLocation.of(n));
          } else {
            replace(n, IR.name(importIdent(imported.source(), key, SourceLocation.of(n))));
            return;
          }
        }
        if (hoistsExports && bindings.isFree(object, EXPORTS)) {
          selfReferences.add(key);
          replace(n, IR.name(exportIdent(key, n)));
          return;
        }
        break;
      }
      case CALL: {
        String source = matchRequire(object);
        if (source != null) {
          addRequire(source);
          replace(n, IR.name(importIdent(source, key, SourceLocation.of(n))));
          return;
        }
        break;
      }
      case GETPROP:
      case GETELEM:
        if (hoistsExports && matchMember(object, bindings, MODULE, EXPORTS)) {
          selfReferences.add(key);
          replace(n, IR.name(exportIdent(key, n)));
          return;
        }
        break;
      case THIS:
        if (hoistsExports && !inFunctionScope && !facts.isEsm()) {
          selfReferences.add(key);
          replace(n, IR.name(exportIdent(key, n)));
          return;
        }
        break;
      default:
        break;
    }

    visit(object);
  }

  private void visitDynamicImport(Node n) {
    String source = matchDynamicImport(n);
    if (source == null) {
      visitChildren(n);
      return;
    }
    addRequire(source);
    String name = names.asyncImportName(source);
    dynamicImports.put(name, source);
    if (facts.nonStaticRequires().contains(source) || facts.shouldWrap()) {
      addImportedSymbol(source, name, SymbolNames.NAMESPACE, SourceLocation.of(n));
    }
    replace(n, IR.name(name));
  }

  private void visitThis(Node n) {
    if (inFunctionScope) {
      return;
    }
    if (facts.isEsm()) {
      replace(n, IR.name("undefined"));
    } else if (!facts.shouldWrap()) {
      selfReferences.add(SymbolNames.NAMESPACE);
      replace(n, IR.name(exportIdent(SymbolNames.NAMESPACE, n)));
    }
  }

  /** Folds {@code typeof require} and {@code typeof module}. */
  private boolean visitTypeof(Node n) {
    Node operand = n.getFirstChild();
    if (!operand.isName()) {
      return false;
    }
    if (bindings.isFree(operand, REQUIRE)) {
      replace(n, IR.string("function"));
      return true;
    }
    if (bindings.isFree(operand, MODULE)) {
      replace(n, IR.string("object"));
      return true;
    }
    return false;
  }

  /**
   * A require in a non-final position of a sequence is replaced by an identifier, which minifiers
   * would drop as side-effect free. Negating it keeps it in place.
   */
  private void guardSequencedRequires(Node comma) {
    Node left = comma.getFirstChild();
    if (matchRequire(left) != null) {
      negate(left);
    }
    Node parent = comma.getParent();
    Node right = comma.getLastChild();
    if (parent != null && parent.isComma() && parent.getFirstChild() == comma
        && matchRequire(right) != null) {
      negate(right);
    }
  }

  private static void negate(Node n) {
    Node not = new Node(Token.NOT).srcref(n);
    n.replaceWith(not);
    not.addChildToFront(n);
  }

  private void renameReference(Node n) {
    BindingId id = bindings.get(n);
    if (id == null) {
      return;
    }

    ImportRecord imported = facts.importOf(id);
    if (imported != null && !facts.nonStaticRequires().contains(imported.source())) {
      String source = imported.source();
      if (imported.kind() != ImportKind.DYNAMIC_IMPORT) {
        if (facts.isNonConst(id)) {
          setName(n, names.requireName(n.getString()));
        } else {
          setName(n, importIdent(source, imported.specifier(), imported.loc()));
        }
        return;
      }
      if (!imported.isNamespace()) {
        addImportedSymbol(
            source,
            names.asyncImportName(source, imported.specifier()),
            imported.specifier(),
            imported.loc());
      } else if (facts.hasNonStaticAccess(id)) {
        addImportedSymbol(
            source, names.asyncImportName(source), SymbolNames.NAMESPACE, imported.loc());
      }
    }

    String exported = facts.exportOf(id);
    if (exported != null) {
      if (facts.shouldWrap()) {
        addExportedSymbol(n.getString(), exported, SourceLocation.of(n));
      } else {
        setName(n, exportIdent(exported, n));
      }
      return;
    }

    if (bindings.isFree(n, EXPORTS) && !facts.shouldWrap()) {
      selfReferences.add(SymbolNames.NAMESPACE);
      setName(n, exportIdent(SymbolNames.NAMESPACE, n));
    } else if (bindings.isFree(n, "global")) {
      setName(n, SymbolNames.GLOBAL_ALIAS);
    } else if (bindings.isTopLevel(n) && !facts.shouldWrap()) {
      setName(n, names.topLevelName(n.getString()));
    }
  }

  /** A renamed shorthand property has to be written out as {@code key: value}. */
  private static void expandShorthand(Node key) {
    if (!key.isShorthandProperty()) {
      return;
    }
    Node value = key.getFirstChild();
    if (value.isDefaultValue()) {
      value = value.getFirstChild();
    }
    if (!value.isName() || !value.getString().equals(key.getString())) {
      key.setShorthandProperty(false);
    }
  }

  /** Rewrites assignments to CommonJS export members. Returns whether {@code n} was handled. */
  private boolean visitExportAssignment(Node n) {
    if (facts.shouldWrap()) {
      return false;
    }
    Node target = n.getFirstChild();
    if (!isMember(target)) {
      return false;
    }

    if (matchMember(target, bindings, MODULE, EXPORTS)) {
      replace(target, IR.name(exportIdent(SymbolNames.NAMESPACE, target)));
      visit(n.getLastChild());
      return true;
    }

    Node object = target.getFirstChild();
    boolean isExportsObject =
        (isMember(object) && matchMember(object, bindings, MODULE, EXPORTS))
            || (object.isName() && bindings.isFree(object, EXPORTS))
            || (object.isThis() && !inFunctionScope && !facts.isEsm());
    if (!isExportsObject) {
      return false;
    }

    String key = facts.staticCjsExports() ? staticKey(target) : null;
    if (key != null) {
      String name = exportIdent(key, target);
      exportDecls.add(name);
      replace(target, IR.name(name));
    } else {
      replace(object, IR.name(exportIdent(SymbolNames.NAMESPACE, object)));
      if (target.isGetElem()) {
        visit(target.getLastChild());
      }
    }
    visit(n.getLastChild());
    return true;
  }

  private void addRequire(String source) {
    moduleItems.add(hoistedImport(source, null));
  }

  private Node hoistedImport(String source, @Nullable Node srcref) {
    Node importNode =
        IR.importNode(IR.empty(), IR.empty(), IR.string(names.hoistedSpecifier(source)));
    return srcref == null ? importNode : importNode.srcrefTree(srcref);
  }

  private void addModuleItem(Node item) {
    if (item.getParent() != null) {
      item.detach();
    }
    moduleItems.add(item);
  }

  private String importIdent(String source, String imported, SourceLocation loc) {
    String name = names.importName(source, imported);
    addImportedSymbol(source, name, imported, loc);
    return name;
  }

  private void addImportedSymbol(
      String source, String local, String imported, SourceLocation loc) {
    importedSymbols.putIfAbsent(local, ImportedSymbol.create(source, local, imported, loc));
  }

  private String exportIdent(String exported, Node at) {
    String name = names.exportName(exported);
    addExportedSymbol(name, exported, SourceLocation.of(at));
    return name;
  }

  private void addExportedSymbol(String local, String exported, SourceLocation loc) {
    if (seenExports.add(Maps.immutableEntry(local, exported))) {
      exportedSymbols.add(ExportedSymbol.create(local, exported, loc));
    }
  }

  private static void replace(Node original, Node replacement) {
    replacement.srcrefIfMissing(original);
    original.replaceWith(replacement);
    Node parent = replacement.getParent();
    if (replacement.isName() && parent.isCall() && parent.getFirstChild() == replacement) {
      // A method call on the namespace became a plain function call.
      parent.putBooleanProp(Node.FREE_CALL, true);
    }
  }

  private static void setName(Node name, String newName) {
    if (!newName.equals(name.getString())) {
      if (name.getOriginalName() == null) {
        name.setOriginalName(name.getString());
      }
      name.setString(newName);
    }
  }

  private @Nullable String matchRequire(Node n) {
    return CommonJsPatterns.matchRequire(n, bindings);
  }
}
