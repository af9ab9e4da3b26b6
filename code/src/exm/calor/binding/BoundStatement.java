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
import java.util.List;

import exm.calor.ast.SourceSpan;

/**
 * Statements after name resolution.
 */
public abstract class BoundStatement {

  public static enum BoundStatementKind {
    BIND,
    ASSIGN,
    CALL,
    RETURN,
    IF,
    WHILE,
    FOR,
    BREAK,
    CONTINUE,
  }

  public final BoundStatementKind kind;
  private final SourceSpan span;

  protected BoundStatement(BoundStatementKind kind, SourceSpan span) {
    this.kind = kind;
    this.span = span;
  }

  public BoundStatementKind kind() {
    return kind;
  }

  public SourceSpan span() {
    return span;
  }

  private static List<BoundStatement> copy(List<BoundStatement> stmts) {
    if (stmts == null) {
      return null;
    }
    return Collections.unmodifiableList(new ArrayList<BoundStatement>(stmts));
  }

  /**
   * Declaration of a variable, initialized if initializer is non-null
   */
  public static class Bind extends BoundStatement {
    private final VariableSymbol variable;
    private final BoundExpression initializer;

    public Bind(SourceSpan span, VariableSymbol variable,
                BoundExpression initializer) {
      super(BoundStatementKind.BIND, span);
      this.variable = variable;
      this.initializer = initializer;
    }

    public VariableSymbol variable() {
      return variable;
    }

    public BoundExpression initializer() {
      return initializer;
    }
  }

  public static class Assign extends BoundStatement {
    private final VariableSymbol variable;
    private final BoundExpression value;

    public Assign(SourceSpan span, VariableSymbol variable,
                  BoundExpression value) {
      super(BoundStatementKind.ASSIGN, span);
      this.variable = variable;
      this.value = value;
    }

    public VariableSymbol variable() {
      return variable;
    }

    public BoundExpression value() {
      return value;
    }
  }

  public static class Call extends BoundStatement {
    private final String target;
    private final List<BoundExpression> args;

    public Call(SourceSpan span, String target, List<BoundExpression> args) {
      super(BoundStatementKind.CALL, span);
      this.target = target;
      this.args = Collections.unmodifiableList(
                              new ArrayList<BoundExpression>(args));
    }

    public String target() {
      return target;
    }

    public List<BoundExpression> args() {
      return args;
    }
  }

  public static class Return extends BoundStatement {
    private final BoundExpression value;

    public Return(SourceSpan span, BoundExpression value) {
      super(BoundStatementKind.RETURN, span);
      this.value = value;
    }

    /** @return value, or null */
    public BoundExpression value() {
      return value;
    }
  }

  public static class ElseIf {
    public final BoundExpression condition;
    public final List<BoundStatement> body;

    public ElseIf(BoundExpression condition, List<BoundStatement> body) {
      this.condition = condition;
      this.body = copy(body);
    }
  }

  public static class If extends BoundStatement {
    private final BoundExpression condition;
    private final List<BoundStatement> thenBody;
    private final List<ElseIf> elseIfs;
    private final List<BoundStatement> elseBody;

    public If(SourceSpan span, BoundExpression condition,
              List<BoundStatement> thenBody, List<ElseIf> elseIfs,
              List<BoundStatement> elseBody) {
      super(BoundStatementKind.IF, span);
      this.condition = condition;
      this.thenBody = copy(thenBody);
      this.elseIfs = Collections.unmodifiableList(elseIfs == null ?
            new ArrayList<ElseIf>() : new ArrayList<ElseIf>(elseIfs));
      this.elseBody = copy(elseBody);
    }

    public BoundExpression condition() {
      return condition;
    }

    public List<BoundStatement> thenBody() {
      return thenBody;
    }

    public List<ElseIf> elseIfs() {
      return elseIfs;
    }

    /** @return else body, or null */
    public List<BoundStatement> elseBody() {
      return elseBody;
    }
  }

  public static class While extends BoundStatement {
    private final BoundExpression condition;
    private final List<BoundStatement> body;

    public While(SourceSpan span, BoundExpression condition,
                 List<BoundStatement> body) {
      super(BoundStatementKind.WHILE, span);
      this.condition = condition;
      this.body = copy(body);
    }

    public BoundExpression condition() {
      return condition;
    }

    public List<BoundStatement> body() {
      return body;
    }
  }

  public static class For extends BoundStatement {
    private final VariableSymbol loopVariable;
    private final BoundExpression from;
    private final BoundExpression to;
    private final BoundExpression step;
    private final List<BoundStatement> body;

    public For(SourceSpan span, VariableSymbol loopVariable,
               BoundExpression from, BoundExpression to,
               BoundExpression step, List<BoundStatement> body) {
      super(BoundStatementKind.FOR, span);
      this.loopVariable = loopVariable;
      this.from = from;
      this.to = to;
      this.step = step;
      this.body = copy(body);
    }

    public VariableSymbol loopVariable() {
      return loopVariable;
    }

    public BoundExpression from() {
      return from;
    }

    public BoundExpression to() {
      return to;
    }

    /** @return step, or null for 1 */
    public BoundExpression step() {
      return step;
    }

    public List<BoundStatement> body() {
      return body;
    }
  }

  public static class Break extends BoundStatement {
    public Break(SourceSpan span) {
      super(BoundStatementKind.BREAK, span);
    }
  }

  public static class Continue extends BoundStatement {
    public Continue(SourceSpan span) {
      super(BoundStatementKind.CONTINUE, span);
    }
  }
}
