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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableSet;
import com.google.javascript.rhino.Node;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Binding identities for the names of one module.
 *
 * <p>Maps every {@code NAME} and {@code IMPORT_STAR} node to a {@link BindingId} whose scope is
 * the root node of the scope declaring it. Names that no scope declares are free and share the
 * {@link #FREE} scope. Nodes can be marked as ignored, which takes them out of both the free and
 * the declared sets; this is used for synthetic bindings (e.g. a {@code require} introduced by an
 * earlier pass) that must not be treated as the CommonJS globals.
 */
public final class ModuleBindings {

  /** Scope shared by all unresolved names. */
  public static final Object FREE = new Object() {
    @Override
    public String toString() {
      return "<free>";
    }
  };

  /** Scope of names that are neither declared nor free. */
  public static final Object IGNORED = new Object() {
    @Override
    public String toString() {
      return "<ignored>";
    }
  };

  private final Map<Node, BindingId> bindings;
  private final Node topLevelScope;

  private ModuleBindings(Map<Node, BindingId> bindings, Node topLevelScope) {
    this.bindings = bindings;
    this.topLevelScope = topLevelScope;
  }

  /**
   * Resolves every name in {@code script}. The top-level scope is the {@code MODULE_BODY} for ES
   * modules and the {@code SCRIPT} otherwise.
   */
  public static ModuleBindings collect(Node script) {
    checkArgument(script.isScript(), script);
    Node topLevel =
        script.hasChildren() && script.getFirstChild().isModuleBody()
            ? script.getFirstChild()
            : script;
    ScopeScanner scanner = new ScopeScanner(topLevel);
    scanner.scanVars(script);
    Map<Node, BindingId> bindings = new IdentityHashMap<>();
    scanner.resolve(script, bindings);
    return new ModuleBindings(bindings, topLevel);
  }

  /** Returns the same bindings keyed by the corresponding nodes of {@code copy}. */
  ModuleBindings copyOnto(Node original, Node copy) {
    Map<Node, BindingId> copied = new IdentityHashMap<>();
    zip(original, copy, copied);
    return new ModuleBindings(copied, topLevelScope);
  }

  private void zip(Node original, Node copy, Map<Node, BindingId> copied) {
    checkState(original.getToken() == copy.getToken(), "%s != %s", original, copy);
    BindingId id = bindings.get(original);
    if (id != null) {
      copied.put(copy, id);
    }
    Node c = copy.getFirstChild();
    for (Node o = original.getFirstChild(); o != null; o = o.getNext()) {
      zip(o, c, copied);
      c = c.getNext();
    }
  }

  /** Marks a name node as synthetic. */
  public void markIgnored(Node name) {
    BindingId id = bindings.get(name);
    checkArgument(id != null, "Not a resolved name: %s", name);
    bindings.put(name, BindingId.create(id.name(), IGNORED));
  }

  public @Nullable BindingId get(Node name) {
    return bindings.get(name);
  }

  /** The identity of the top-level scope. */
  public Node topLevelScope() {
    return topLevelScope;
  }

  /** Whether {@code name} is an unresolved reference to a global named {@code globalName}. */
  public boolean isFree(Node name, String globalName) {
    BindingId id = bindings.get(name);
    return id != null && id.scope() == FREE && id.name().equals(globalName);
  }

  public boolean isFree(Node name) {
    BindingId id = bindings.get(name);
    return id != null && id.scope() == FREE;
  }

  /** Whether {@code name} refers to a binding declared in the top-level scope. */
  public boolean isTopLevel(Node name) {
    BindingId id = bindings.get(name);
    return id != null && id.scope() == topLevelScope;
  }

  /** All declared bindings, in no particular order. */
  public ImmutableSet<BindingId> declared() {
    ImmutableSet.Builder<BindingId> declared = ImmutableSet.builder();
    for (BindingId id : bindings.values()) {
      if (id.scope() != FREE && id.scope() != IGNORED) {
        declared.add(id);
      }
    }
    return declared.build();
  }

  /** Top-level declared bindings. */
  public ImmutableSet<BindingId> topLevelDeclared() {
    ImmutableSet.Builder<BindingId> declared = ImmutableSet.builder();
    for (BindingId id : bindings.values()) {
      if (id.scope() == topLevelScope) {
        declared.add(id);
      }
    }
    return declared.build();
  }

  /**
   * Finds declarations and the scope root each one belongs to. {@code var} hoists to the closest
   * function or top-level scope; block-scoped declarations stay in the closest block.
   */
  private static final class ScopeScanner {
    private final Node topLevel;
    private final Map<Node, Set<String>> declared = new IdentityHashMap<>();

    ScopeScanner(Node topLevel) {
      this.topLevel = topLevel;
    }

    void scanVars(Node n) {
      switch (n.getToken()) {
        case VAR:
          declareLhs(hoistScope(n), n);
          break;

        case LET:
        case CONST:
          declareLhs(blockScope(n), n);
          break;

        case FUNCTION: {
          Node fnName = n.getFirstChild();
          if (!fnName.getString().isEmpty()) {
            declare(isDeclaration(n) ? blockScope(n) : n, fnName);
          }
          declareLhs(n, fnName.getNext());
          break;
        }

        case CLASS: {
          Node className = n.getFirstChild();
          if (className.isName()) {
            declare(isDeclaration(n) ? blockScope(n) : n, className);
          }
          break;
        }

        case CATCH:
          declareLhs(n, n.getFirstChild());
          break;

        case IMPORT:
          declareLhs(topLevel, n);
          break;

        default:
          break;
      }

      for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
        scanVars(child);
      }
    }

    void resolve(Node n, Map<Node, BindingId> bindings) {
      if ((n.isName() && !n.getString().isEmpty()) || n.isImportStar()) {
        bindings.put(n, lookup(n.getString(), lookupStart(n)));
      }
      for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
        resolve(child, bindings);
      }
    }

    private BindingId lookup(String name, @Nullable Node start) {
      for (Node s = start; s != null; s = s.getParent()) {
        Set<String> names = declared.get(s);
        if (names != null && names.contains(name)) {
          return BindingId.create(name, s);
        }
      }
      return BindingId.create(name, FREE);
    }

    /** Function and class names resolve outside the node they name, unless it's an expression. */
    private static Node lookupStart(Node name) {
      Node parent = name.getParent();
      if ((parent.isFunction() || parent.isClass())
          && parent.getFirstChild() == name
          && isDeclaration(parent)) {
        return parent.getParent();
      }
      return parent;
    }

    private void declareLhs(Node scope, Node n) {
      List<Node> lhs = new ArrayList<>();
      collectLhs(n, lhs);
      for (Node name : lhs) {
        declare(scope, name);
      }
    }

    private void declare(Node scope, Node name) {
      declared.computeIfAbsent(scope, k -> new HashSet<>()).add(name.getString());
    }

    private Node hoistScope(Node n) {
      for (Node p = n.getParent(); p != null; p = p.getParent()) {
        if (p.isFunction() || p == topLevel) {
          return p;
        }
      }
      return topLevel;
    }

    private Node blockScope(Node n) {
      for (Node p = n.getParent(); p != null; p = p.getParent()) {
        switch (p.getToken()) {
          case BLOCK:
            return p.getParent() != null && p.getParent().isFunction() ? p.getParent() : p;
          case FOR:
          case FOR_IN:
          case FOR_OF:
          case FOR_AWAIT_OF:
          case SWITCH:
          case FUNCTION:
            return p;
          default:
            if (p == topLevel) {
              return p;
            }
        }
      }
      return topLevel;
    }

    private static boolean isDeclaration(Node fnOrClass) {
      if (fnOrClass.isFunction() && fnOrClass.isArrowFunction()) {
        return false;
      }
      Node parent = fnOrClass.getParent();
      if (parent == null) {
        return false;
      }
      switch (parent.getToken()) {
        case SCRIPT:
        case MODULE_BODY:
        case BLOCK:
        case LABEL:
          return true;
        case EXPORT:
          Node name = fnOrClass.getFirstChild();
          return name.isName() && !name.getString().isEmpty();
        default:
          return false;
      }
    }
  }

  /** Adds the binding name nodes declared by a declaration, pattern or import to {@code out}. */
  static void collectLhs(Node n, List<Node> out) {
    switch (n.getToken()) {
      case NAME:
        if (!n.getString().isEmpty()) {
          out.add(n);
        }
        break;
      case IMPORT_STAR:
        out.add(n);
        break;
      case IMPORT:
        collectLhs(n.getFirstChild(), out);
        collectLhs(n.getSecondChild(), out);
        break;
      case IMPORT_SPECS:
        for (Node spec = n.getFirstChild(); spec != null; spec = spec.getNext()) {
          out.add(spec.getSecondChild());
        }
        break;
      case STRING_KEY:
      case DESTRUCTURING_LHS:
      case DEFAULT_VALUE:
      case ITER_REST:
      case OBJECT_REST:
        collectLhs(n.getFirstChild(), out);
        break;
      case COMPUTED_PROP:
        collectLhs(n.getSecondChild(), out);
        break;
      case VAR:
      case LET:
      case CONST:
      case PARAM_LIST:
      case OBJECT_PATTERN:
      case ARRAY_PATTERN:
        for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
          collectLhs(child, out);
        }
        break;
      default:
        break;
    }
  }
}
