/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.calor.binding;

import java.util.HashMap;
import java.util.Map;

/**
 * Nested symbol scope.  Lookups fall through to enclosing scopes;
 * declarations only go into the innermost one.
 */
public class Scope {
  private final Map<String, VariableSymbol> symbols =
                        new HashMap<String, VariableSymbol>();
  private final Scope parent;

  public Scope() {
    this(null);
  }

  private Scope(Scope parent) {
    this.parent = parent;
  }

  public Scope makeChildScope() {
    return new Scope(this);
  }

  public Scope getParent() {
    return parent;
  }

  /**
   * @return false if the name is already declared in this scope
   */
  public boolean declare(VariableSymbol symbol) {
    if (symbols.containsKey(symbol.getName())) {
      return false;
    }
    symbols.put(symbol.getName(), symbol);
    return true;
  }

  /**
   * @return the innermost symbol with this name, or null
   */
  public VariableSymbol lookup(String name) {
    Scope curr = this;
    while (curr != null) {
      VariableSymbol sym = curr.symbols.get(name);
      if (sym != null) {
        return sym;
      }
      curr = curr.parent;
    }
    return null;
  }

  /**
   * @return the depth at which the name is declared, 0 for this scope,
   *         or -1 if not declared
   */
  public int getDepth(String name) {
    int depth = 0;
    Scope curr = this;
    while (curr != null) {
      if (curr.symbols.containsKey(name)) {
        return depth;
      }
      depth++;
      curr = curr.parent;
    }
    return -1;
  }

  @Override
  public String toString() {
    return symbols.keySet() + (parent == null ? "" : " <- " + parent);
  }
}
