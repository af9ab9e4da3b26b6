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
package exm.calor.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top level of the structured tree handed over by the parser: modules,
 * functions and their contracts.
 */
public class SyntaxTree {

  public static class Module {
    private final String id;
    private final String name;
    private final List<Function> functions;

    public Module(String id, String name, List<Function> functions) {
      this.id = id;
      this.name = name;
      this.functions = Collections.unmodifiableList(
                                  new ArrayList<Function>(functions));
    }

    public String id() {
      return id;
    }

    public String name() {
      return name;
    }

    public List<Function> functions() {
      return functions;
    }
  }

  public static class Parameter {
    private final String name;
    private final String typeName;
    private final SourceSpan span;

    public Parameter(SourceSpan span, String name, String typeName) {
      this.span = span;
      this.name = name;
      this.typeName = typeName;
    }

    public Parameter(String name, String typeName) {
      this(SourceSpan.UNKNOWN, name, typeName);
    }

    public String name() {
      return name;
    }

    public String typeName() {
      return typeName;
    }

    public SourceSpan span() {
      return span;
    }
  }

  /**
   * Base of requires/ensures clauses
   */
  public static abstract class Contract {
    private final Expression condition;
    private final String message;
    private final SourceSpan span;

    protected Contract(SourceSpan span, Expression condition,
                       String message) {
      this.span = span;
      this.condition = condition;
      this.message = message;
    }

    public Expression condition() {
      return condition;
    }

    /** @return user message, or null */
    public String message() {
      return message;
    }

    public SourceSpan span() {
      return span;
    }
  }

  public static class Requires extends Contract {
    public Requires(SourceSpan span, Expression condition, String message) {
      super(span, condition, message);
    }

    public Requires(Expression condition) {
      this(SourceSpan.UNKNOWN, condition, null);
    }
  }

  public static class Ensures extends Contract {
    public Ensures(SourceSpan span, Expression condition, String message) {
      super(span, condition, message);
    }

    public Ensures(Expression condition) {
      this(SourceSpan.UNKNOWN, condition, null);
    }
  }

  public static class Function {
    private final String id;
    private final String name;
    private final List<Parameter> parameters;
    private final String outputTypeName;
    private final List<Requires> preconditions;
    private final List<Ensures> postconditions;
    private final List<Statement> body;
    private final SourceSpan span;

    /**
     * @param outputTypeName declared return type, or null if the function
     *                       has no output
     */
    public Function(SourceSpan span, String id, String name,
                    List<Parameter> parameters, String outputTypeName,
                    List<Requires> preconditions,
                    List<Ensures> postconditions, List<Statement> body) {
      this.span = span;
      this.id = id;
      this.name = name;
      this.parameters = Collections.unmodifiableList(
                                  new ArrayList<Parameter>(parameters));
      this.outputTypeName = outputTypeName;
      this.preconditions = Collections.unmodifiableList(
                                  new ArrayList<Requires>(preconditions));
      this.postconditions = Collections.unmodifiableList(
                                  new ArrayList<Ensures>(postconditions));
      this.body = Collections.unmodifiableList(
                                  new ArrayList<Statement>(body));
    }

    public String id() {
      return id;
    }

    public String name() {
      return name;
    }

    public List<Parameter> parameters() {
      return parameters;
    }

    public String outputTypeName() {
      return outputTypeName;
    }

    /**
     * @return true if the function produces a value
     */
    public boolean hasOutput() {
      return outputTypeName != null &&
             !outputTypeName.trim().equalsIgnoreCase("VOID");
    }

    public List<Requires> preconditions() {
      return preconditions;
    }

    public List<Ensures> postconditions() {
      return postconditions;
    }

    public List<Statement> body() {
      return body;
    }

    public SourceSpan span() {
      return span;
    }
  }
}
