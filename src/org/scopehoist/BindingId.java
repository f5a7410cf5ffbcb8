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

/**
 * Identity of a binding: its name plus an opaque value identifying the lexical scope that
 * declares it. Two bindings with the same name in different scopes are different keys.
 *
 * <p>The scope value is compared by {@code equals}; scope roots are AST nodes, which use identity
 * equality.
 */
@AutoValue
public abstract class BindingId {

  public abstract String name();

  public abstract Object scope();

  public static BindingId create(String name, Object scope) {
    return new AutoValue_BindingId(name, scope);
  }

  @Override
  public final String toString() {
    return name() + "@" + System.identityHashCode(scope());
  }
}
