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

import static org.scopehoist.CommonJsPatterns.EXPORTS;
import static org.scopehoist.CommonJsPatterns.MODULE;
import static org.scopehoist.CommonJsPatterns.REQUIRE;
import static org.scopehoist.CommonJsPatterns.isMember;
import static org.scopehoist.CommonJsPatterns.matchDynamicImport;
import static org.scopehoist.CommonJsPatterns.matchMember;
import static org.scopehoist.CommonJsPatterns.staticKey;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.Node;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Read-only pass that collects the import, export and CommonJS facts of one module.
 *
 * <p>A {@code require} call is hoistable only as the whole initializer of a top-level declarator,
 * as the object of a static member access initializing one, or as a bare top-level statement.
 * Anything else records the specifier as wrapped. Destructuring that can't be expanded into
 * individual keys records it as non-static, meaning its namespace object has to be kept.
 */
final class ImportExportAnalyzer {

  private final ModuleBindings bindings;
  private final ModuleFlags flags = new ModuleFlags();
  private final Map<BindingId, ImportRecord> imports = new LinkedHashMap<>();
  private final Map<BindingId, String> exports = new LinkedHashMap<>();
  private final ListMultimap<BindingId, SourceLocation> nonStaticAccess =
      MultimapBuilder.linkedHashKeys().arrayListValues().build();
  private final ListMultimap<BindingId, SourceLocation> nonConstBindings =
      MultimapBuilder.linkedHashKeys().arrayListValues().build();
  private final Set<String> nonStaticRequires = new LinkedHashSet<>();
  private final Set<String> wrappedRequires = new LinkedHashSet<>();
  private final @Nullable List<Bailout> bailouts;

  // Traversal context.
  private boolean inModuleThis = true;
  private boolean inTopLevel = true;
  private boolean inExportDecl = false;
  private boolean inFunction = false;
  private boolean inAssign = false;

  private ImportExportAnalyzer(ModuleBindings bindings, boolean traceBailouts) {
    this.bindings = bindings;
    this.bailouts = traceBailouts ? new ArrayList<>() : null;
  }

  static ModuleFacts analyze(Node script, ModuleBindings bindings, boolean traceBailouts) {
    ImportExportAnalyzer analyzer = new ImportExportAnalyzer(bindings, traceBailouts);
    analyzer.visitModule(script);
    return analyzer.toFacts();
  }

  private void visitModule(Node script) {
    Node body = script.hasChildren() && script.getFirstChild().isModuleBody()
        ? script.getFirstChild()
        : script;
    for (Node item = body.getFirstChild(); item != null; item = item.getNext()) {
      visitModuleItem(item);
    }
    inModuleThis = false;

    if (bailouts != null) {
      for (Map.Entry<BindingId, ImportRecord> entry : imports.entrySet()) {
        // Reading a named import as a value still uses only that export.
        if (!entry.getValue().isNamespace()) {
          continue;
        }
        for (SourceLocation loc : nonStaticAccess.get(entry.getKey())) {
          bailouts.add(Bailout.create(loc, BailoutReason.NON_STATIC_ACCESS));
        }
      }
      bailouts.sort(Comparator.comparing(Bailout::loc));
    }
  }

  private void visitModuleItem(Node item) {
    switch (item.getToken()) {
      case IMPORT:
      case EXPORT:
        flags.markEsm();
        break;
      case VAR:
      case LET:
      case CONST:
        visit(item);
        return;
      case EXPR_RESULT:
        // A bare top-level require() is hoistable, so it is not marked as wrapped.
        if (matchRequire(item.getFirstChild()) != null) {
          return;
        }
        break;
      default:
        break;
    }

    inTopLevel = false;
    visit(item);
    inTopLevel = true;
  }

  private void visit(Node n) {
    switch (n.getToken()) {
      case FUNCTION:
        visitFunction(n);
        return;
      case CLASS:
        visitClass(n);
        return;
      case IMPORT:
        visitImport(n);
        return;
      case EXPORT:
        visitExport(n);
        return;
      case RETURN:
        if (!inFunction) {
          flags.markShouldWrap();
          addBailout(n, BailoutReason.TOP_LEVEL_RETURN);
        }
        break;
      case GETPROP:
      case GETELEM:
        visitMember(n);
        return;
      case TYPEOF: {
        // `typeof module` and `typeof require` are folded to constants.
        Node operand = n.getFirstChild();
        if (operand.isName()
            && (bindings.isFree(operand, MODULE) || bindings.isFree(operand, REQUIRE))) {
          return;
        }
        break;
      }
      case CALL:
        visitCall(n);
        return;
      case DYNAMIC_IMPORT: {
        // Any dynamic import that reaches here is not consumed in an analyzable way.
        String source = matchDynamicImport(n);
        if (source != null) {
          nonStaticRequires.add(source);
          wrappedRequires.add(source);
          addBailout(n, BailoutReason.NON_STATIC_DYNAMIC_IMPORT);
        }
        break;
      }
      case NAME:
        visitNameReference(n);
        return;
      case THIS:
        if (inModuleThis) {
          flags.markCjsExports();
          flags.markNonStaticCjsExports();
          addBailout(n, BailoutReason.FREE_EXPORTS);
        }
        return;
      case VAR:
      case LET:
      case CONST:
        for (Node declarator = n.getFirstChild();
            declarator != null;
            declarator = declarator.getNext()) {
          visitDeclarator(declarator);
        }
        return;
      case INC:
      case DEC:
        if (n.getFirstChild().isName()) {
          markReassigned(n.getFirstChild());
        }
        break;
      case FOR_IN:
      case FOR_OF:
      case FOR_AWAIT_OF:
        visitForInOrOf(n);
        return;
      case CATCH:
        visitPattern(n.getFirstChild());
        visit(n.getSecondChild());
        return;
      case PARAM_LIST:
      case OBJECT_PATTERN:
      case ARRAY_PATTERN:
      case DEFAULT_VALUE:
        visitPattern(n);
        return;
      default:
        if (NodeUtil.isAssignmentOp(n)) {
          visitAssign(n);
          return;
        }
        break;
    }

    visitChildren(n);
  }

  private void visitChildren(Node n) {
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      visit(child);
    }
  }

  private void visitFunction(Node n) {
    boolean wasInModuleThis = inModuleThis;
    boolean wasInFunction = inFunction;
    boolean wasInAssign = inAssign;
    inFunction = true;
    inAssign = false;
    if (!n.isArrowFunction()) {
      inModuleThis = false;
    }

    visitPattern(n.getSecondChild());
    visit(n.getLastChild());

    inModuleThis = wasInModuleThis;
    inFunction = wasInFunction;
    inAssign = wasInAssign;
  }

  private void visitClass(Node n) {
    boolean wasInModuleThis = inModuleThis;
    boolean wasInFunction = inFunction;
    inFunction = true;
    inModuleThis = false;

    // The class name is a declaration, not a reference.
    visit(n.getSecondChild());
    visit(n.getLastChild());

    inModuleThis = wasInModuleThis;
    inFunction = wasInFunction;
  }

  private void visitImport(Node n) {
    String source = n.getLastChild().getString();
    Node defaultName = n.getFirstChild();
    if (defaultName.isName()) {
      recordImport(defaultName, source, "default", ImportKind.IMPORT);
    }
    Node specs = n.getSecondChild();
    if (specs.isImportStar()) {
      recordImport(specs, source, SymbolNames.NAMESPACE, ImportKind.IMPORT);
    } else if (specs.isImportSpecs()) {
      for (Node spec = specs.getFirstChild(); spec != null; spec = spec.getNext()) {
        recordImport(
            spec.getSecondChild(), source, spec.getFirstChild().getString(), ImportKind.IMPORT);
      }
    }
  }

  private void visitExport(Node n) {
    if (n.getBooleanProp(Node.EXPORT_ALL_FROM)) {
      return;
    }

    Node declaration = n.getFirstChild();
    if (n.getBooleanProp(Node.EXPORT_DEFAULT)) {
      if (isDefaultDeclaration(declaration)) {
        Node name = declaration.getFirstChild();
        if (name.isName() && !name.getString().isEmpty()) {
          putExport(name, "default");
        }
      }
      visit(declaration);
      return;
    }

    if (declaration.isExportSpecs()) {
      if (n.hasTwoChildren()) {
        // Re-exports are resolved against the source module.
        return;
      }
      for (Node spec = declaration.getFirstChild(); spec != null; spec = spec.getNext()) {
        BindingId id = bindings.get(spec.getFirstChild());
        if (id != null) {
          exports.putIfAbsent(id, spec.getSecondChild().getString());
        }
      }
      return;
    }

    switch (declaration.getToken()) {
      case FUNCTION:
      case CLASS:
        putExport(declaration.getFirstChild(), declaration.getFirstChild().getString());
        visit(declaration);
        break;
      case VAR:
      case LET:
      case CONST:
        inExportDecl = true;
        visit(declaration);
        inExportDecl = false;
        break;
      default:
        visit(declaration);
        break;
    }
  }

  /** {@code export default function/class}, as opposed to an exported expression. */
  static boolean isDefaultDeclaration(Node n) {
    return (n.isFunction() && !n.isArrowFunction()) || n.isClass();
  }

  private void visitMember(Node n) {
    if (matchMember(n, bindings, MODULE, EXPORTS)) {
      flags.markNonStaticCjsExports();
      flags.markCjsExports();
      return;
    }
    if (matchMember(n, bindings, MODULE, "hot") || matchMember(n, bindings, MODULE, REQUIRE)) {
      return;
    }

    boolean isStatic = staticKey(n) != null;
    Node object = n.getFirstChild();
    if (isMember(object) && matchMember(object, bindings, MODULE, EXPORTS)) {
      flags.markCjsExports();
      if (!isStatic) {
        flags.markNonStaticCjsExports();
        addBailout(n, BailoutReason.NON_STATIC_EXPORTS);
      }
      visitComputedKey(n);
      return;
    }

    if (object.isName()) {
      if (bindings.isFree(object, EXPORTS)) {
        flags.markCjsExports();
        if (!isStatic) {
          flags.markNonStaticCjsExports();
          addBailout(n, BailoutReason.NON_STATIC_EXPORTS);
        }
      }
      if (bindings.isFree(object, MODULE)) {
        flags.markCjsExports();
        flags.markNonStaticCjsExports();
        flags.markShouldWrap();
        addBailout(n, BailoutReason.FREE_MODULE);
      }
      if (!isStatic) {
        addNonStaticAccess(object, n);
      }
      visitComputedKey(n);
      return;
    }

    if (object.isThis()) {
      if (inModuleThis) {
        flags.markCjsExports();
        if (!isStatic) {
          flags.markNonStaticCjsExports();
          addBailout(n, BailoutReason.NON_STATIC_EXPORTS);
        }
      }
      visitComputedKey(n);
      return;
    }

    visitChildren(n);
  }

  private void visitComputedKey(Node member) {
    if (member.isGetElem() && staticKey(member) == null) {
      visit(member.getSecondChild());
    }
  }

  private void visitCall(Node n) {
    // Any require() reaching here is in a position that can't be hoisted.
    String required = matchRequire(n);
    if (required != null) {
      wrappedRequires.add(required);
      addBailout(n, BailoutReason.NON_TOP_LEVEL_REQUIRE);
    }

    Node callee = n.getFirstChild();
    if (callee.isName() && bindings.isFree(callee, "eval")) {
      flags.markShouldWrap();
      addBailout(n, BailoutReason.EVAL);
    } else if (isMember(callee) && "then".equals(staticKey(callee))) {
      // import('x').then(x => ...)
      String source = matchDynamicImport(callee.getFirstChild());
      Node callback = callee.getNext();
      if (source != null && callback != null) {
        Node param = callback.isFunction() ? callback.getSecondChild().getFirstChild() : null;
        if (param != null) {
          addPatternImports(param, source, ImportKind.DYNAMIC_IMPORT);
        } else {
          nonStaticRequires.add(source);
          wrappedRequires.add(source);
          addBailout(n, BailoutReason.NON_STATIC_DYNAMIC_IMPORT);
        }
        // The rejection handler and any other argument are plain expressions.
        for (Node arg = callback; arg != null; arg = arg.getNext()) {
          visit(arg);
        }
        return;
      }
    }

    visitChildren(n);
  }

  private void visitNameReference(Node n) {
    boolean isModule = bindings.isFree(n, MODULE);
    if (isModule || bindings.isFree(n, EXPORTS)) {
      flags.markCjsExports();
      flags.markNonStaticCjsExports();
      if (isModule) {
        flags.markShouldWrap();
        addBailout(n, BailoutReason.FREE_MODULE);
      } else {
        addBailout(n, BailoutReason.FREE_EXPORTS);
      }
    }
    addNonStaticAccess(n, n);
    // A declarator's NAME carries its initializer.
    visitChildren(n);
  }

  private void visitDeclarator(Node declarator) {
    Node target = declarator.isDestructuringLhs() ? declarator.getFirstChild() : declarator;
    Node init = declarator.isDestructuringLhs()
        ? declarator.getSecondChild()
        : declarator.getFirstChild();

    if (inExportDecl) {
      List<Node> names = new ArrayList<>();
      ModuleBindings.collectLhs(target, names);
      for (Node name : names) {
        putExport(name, name.getString());
      }
    }

    boolean wasInExportDecl = inExportDecl;
    inExportDecl = false;
    boolean importing = visitImportingInitializer(target, init);
    boolean wasInTopLevel = inTopLevel;
    inTopLevel = false;
    // Default values and computed keys of the pattern are evaluated in either case.
    visitPattern(target);
    if (!importing && init != null) {
      visit(init);
    }
    inTopLevel = wasInTopLevel;
    inExportDecl = wasInExportDecl;
  }

  /**
   * Records the imports of {@code target = init} when {@code init} is a require, a static member
   * of one, or an awaited dynamic import. Returns whether it was one of those.
   */
  private boolean visitImportingInitializer(Node target, @Nullable Node init) {
    if (init == null) {
      return false;
    }

    String source = matchRequire(init);
    if (source != null) {
      addPatternImports(target, source, ImportKind.REQUIRE);
      return true;
    }

    if (isMember(init)) {
      source = matchRequire(init.getFirstChild());
      if (source != null) {
        // const yx = require('y').x is handled as const {x: yx} = require('y')
        checkTopLevel(target, source, ImportKind.REQUIRE);
        String key = staticKey(init);
        if (key == null) {
          nonStaticRequires.add(source);
          addBailout(init, BailoutReason.NON_STATIC_DESTRUCTURING);
          visit(init.getSecondChild());
        } else {
          addPropertyImport(key, target, target, source, ImportKind.REQUIRE);
        }
        return true;
      }
    }

    if (init.isAwait()) {
      source = matchDynamicImport(init.getFirstChild());
      if (source != null) {
        addPatternImports(target, source, ImportKind.DYNAMIC_IMPORT);
        return true;
      }
    }
    return false;
  }

  private void addPatternImports(Node target, String source, ImportKind kind) {
    checkTopLevel(target, source, kind);

    switch (target.getToken()) {
      case NAME:
        recordImport(target, source, SymbolNames.NAMESPACE, kind);
        break;
      case OBJECT_PATTERN:
        for (Node prop = target.getFirstChild(); prop != null; prop = prop.getNext()) {
          if (prop.isStringKey()) {
            addPropertyImport(prop.getString(), prop.getFirstChild(), target, source, kind);
          } else {
            // Computed keys and rest elements need the whole namespace.
            nonStaticRequires.add(source);
            addBailout(target, BailoutReason.NON_STATIC_DESTRUCTURING);
          }
        }
        break;
      default:
        nonStaticRequires.add(source);
        addBailout(target, BailoutReason.NON_STATIC_DESTRUCTURING);
        break;
    }
  }

  private void addPropertyImport(
      String key, Node value, Node pattern, String source, ImportKind kind) {
    if (value.isName()) {
      recordImport(value, source, key, kind);
      // Another module can still mutate a CommonJS export, so the local can't alias it directly.
      BindingId id = bindings.get(value);
      if (id != null) {
        nonConstBindings.put(id, SourceLocation.of(value));
      }
    } else {
      // Nested patterns and default values.
      nonStaticRequires.add(source);
      addBailout(pattern, BailoutReason.NON_STATIC_DESTRUCTURING);
    }
  }

  private void checkTopLevel(Node target, String source, ImportKind kind) {
    if (inTopLevel) {
      return;
    }
    wrappedRequires.add(source);
    if (kind != ImportKind.DYNAMIC_IMPORT) {
      nonStaticRequires.add(source);
      addBailout(target, BailoutReason.NON_TOP_LEVEL_REQUIRE);
    }
  }

  private void visitAssign(Node n) {
    Node target = n.getFirstChild();
    boolean wasInAssign = inAssign;
    inAssign = true;
    visitPattern(target);
    inAssign = false;
    visit(n.getSecondChild());
    inAssign = wasInAssign;

    if (assignsFree(target, EXPORTS)) {
      flags.markNonStaticCjsExports();
      flags.markCjsExports();
      flags.markShouldWrap();
      addBailout(n, BailoutReason.EXPORTS_REASSIGNMENT);
    } else if (assignsFree(target, MODULE)) {
      flags.markNonStaticCjsExports();
      flags.markCjsExports();
      flags.markShouldWrap();
      addBailout(n, BailoutReason.MODULE_REASSIGNMENT);
    }
  }

  private boolean assignsFree(Node target, String globalName) {
    List<Node> names = new ArrayList<>();
    ModuleBindings.collectLhs(target, names);
    for (Node name : names) {
      if (bindings.isFree(name, globalName)) {
        return true;
      }
    }
    return false;
  }

  private void visitForInOrOf(Node n) {
    Node target = n.getFirstChild();
    if (NodeUtil.isNameDeclaration(target)) {
      visit(target);
    } else {
      boolean wasInAssign = inAssign;
      inAssign = true;
      visitPattern(target);
      inAssign = wasInAssign;
    }
    for (Node child = target.getNext(); child != null; child = child.getNext()) {
      visit(child);
    }
  }

  /** Visits a binding position: declarator targets, parameters and assignment targets. */
  private void visitPattern(Node n) {
    switch (n.getToken()) {
      case NAME:
        if (inAssign) {
          markReassigned(n);
        }
        return;
      case EMPTY:
        return;
      case PARAM_LIST:
      case ARRAY_PATTERN:
      case ITER_REST:
      case OBJECT_REST:
      case STRING_KEY:
        for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
          visitPattern(child);
        }
        return;
      case OBJECT_PATTERN:
        for (Node prop = n.getFirstChild(); prop != null; prop = prop.getNext()) {
          if (prop.isComputedProp()) {
            visitExpressionInPattern(prop.getFirstChild());
            visitPattern(prop.getSecondChild());
          } else {
            visitPattern(prop);
          }
        }
        return;
      case DEFAULT_VALUE:
        visitPattern(n.getFirstChild());
        visitExpressionInPattern(n.getSecondChild());
        return;
      default:
        // Member expression targets, e.g. exports.foo = ...
        visitExpressionInPattern(n);
        return;
    }
  }

  private void visitExpressionInPattern(Node n) {
    boolean wasInAssign = inAssign;
    inAssign = false;
    visit(n);
    inAssign = wasInAssign;
  }

  private void markReassigned(Node name) {
    if (bindings.isTopLevel(name)) {
      nonConstBindings.put(bindings.get(name), SourceLocation.of(name));
    }
  }

  private void recordImport(Node local, String source, String specifier, ImportKind kind) {
    BindingId id = bindings.get(local);
    if (id != null) {
      imports.put(id, ImportRecord.create(source, specifier, kind, SourceLocation.of(local)));
    }
  }

  private void putExport(Node name, String exported) {
    BindingId id = bindings.get(name);
    if (id != null) {
      exports.put(id, exported);
    }
  }

  private void addNonStaticAccess(Node name, Node at) {
    BindingId id = bindings.get(name);
    if (id != null) {
      nonStaticAccess.put(id, SourceLocation.of(at));
    }
  }

  private @Nullable String matchRequire(Node n) {
    return CommonJsPatterns.matchRequire(n, bindings);
  }

  private void addBailout(Node n, BailoutReason reason) {
    if (bailouts != null) {
      bailouts.add(Bailout.create(SourceLocation.of(n), reason));
    }
  }

  private ModuleFacts toFacts() {
    return new ModuleFacts(
        ImmutableMap.copyOf(imports),
        ImmutableMap.copyOf(exports),
        ImmutableListMultimap.copyOf(nonStaticAccess),
        ImmutableListMultimap.copyOf(nonConstBindings),
        ImmutableSet.copyOf(nonStaticRequires),
        ImmutableSet.copyOf(wrappedRequires),
        flags,
        bailouts == null ? ImmutableList.of() : ImmutableList.copyOf(bailouts));
  }
}
