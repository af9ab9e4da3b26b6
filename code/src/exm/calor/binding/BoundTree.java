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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exm.calor.ast.SourceSpan;

/**
 * Output of the binder: functions with resolved symbols.  Read-only
 * once built; analyses must not modify it.
 */
public class BoundTree {

  public static class BoundModule {
    private final String name;
    private final List<BoundFunction> functions;

    public BoundModule(String name, List<BoundFunction> functions) {
      this.name = name;
      this.functions = Collections.unmodifiableList(
                              new ArrayList<BoundFunction>(functions));
    }

    public String getName() {
      return name;
    }

    public List<BoundFunction> getFunctions() {
      return functions;
    }
  }

  public static class BoundFunction {
    private final FunctionSymbol symbol;
    private final List<BoundStatement> body;
    private final SourceSpan span;

    public BoundFunction(SourceSpan span, FunctionSymbol symbol,
                         List<BoundStatement> body) {
      this.span = span;
      this.symbol = symbol;
      this.body = Collections.unmodifiableList(
                              new ArrayList<BoundStatement>(body));
    }

    public FunctionSymbol getSymbol() {
      return symbol;
    }

    public String getName() {
      return symbol.getName();
    }

    public List<BoundStatement> getBody() {
      return body;
    }

    public SourceSpan getSpan() {
      return span;
    }

    public Set<String> getParameterNames() {
      Set<String> names = new HashSet<String>();
      for (VariableSymbol p: symbol.getParameters()) {
        names.add(p.getName());
      }
      return names;
    }
  }
}
