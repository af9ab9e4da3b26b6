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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Statements of the structured tree, identified by {@link StatementKind}.
 */
public abstract class Statement {

  public static enum StatementKind {
    BIND,
    ASSIGN,
    CALL,
    PRINT,
    RETURN,
    IF,
    WHILE,
    FOR,
    BREAK,
    CONTINUE,
    THROW,
    TRY,
  }

  public final StatementKind kind;
  private final SourceSpan span;

  protected Statement(StatementKind kind, SourceSpan span) {
    this.kind = kind;
    this.span = span;
  }

  public StatementKind kind() {
    return kind;
  }

  public SourceSpan span() {
    return span;
  }

  private static List<Statement> copy(List<Statement> stmts) {
    if (stmts == null) {
      return null;
    }
    return Collections.unmodifiableList(new ArrayList<Statement>(stmts));
  }

  /**
   * Variable declaration, optionally typed and initialized
   */
  public static class Bind extends Statement {
    private final String name;
    private final String typeName;
    private final boolean mutable;
    private final Expression initializer;

    public Bind(SourceSpan span, String name, String typeName,
                boolean mutable, Expression initializer) {
      super(StatementKind.BIND, span);
      this.name = name;
      this.typeName = typeName;
      this.mutable = mutable;
      this.initializer = initializer;
    }

    public Bind(String name, String typeName, Expression initializer) {
      this(SourceSpan.UNKNOWN, name, typeName, true, initializer);
    }

    public String name() {
      return name;
    }

    /** @return declared type name, or null if inferred */
    public String typeName() {
      return typeName;
    }

    public boolean isMutable() {
      return mutable;
    }

    /** @return initializer, or null */
    public Expression initializer() {
      return initializer;
    }
  }

  public static class Assign extends Statement {
    private final Expression target;
    private final Expression value;

    public Assign(SourceSpan span, Expression target, Expression value) {
      super(StatementKind.ASSIGN, span);
      this.target = target;
      this.value = value;
    }

    public Assign(String target, Expression value) {
      this(SourceSpan.UNKNOWN, Expression.ref(target), value);
    }

    public Expression target() {
      return target;
    }

    public Expression value() {
      return value;
    }
  }

  public static class CallStatement extends Statement {
    private final String target;
    private final List<Expression> args;

    public CallStatement(SourceSpan span, String target,
                         List<Expression> args) {
      super(StatementKind.CALL, span);
      this.target = target;
      this.args = Collections.unmodifiableList(
                                    new ArrayList<Expression>(args));
    }

    public CallStatement(String target, Expression ...args) {
      this(SourceSpan.UNKNOWN, target, Arrays.asList(args));
    }

    public String target() {
      return target;
    }

    public List<Expression> args() {
      return args;
    }
  }

  public static class Print extends Statement {
    private final Expression value;
    private final boolean newline;

    public Print(SourceSpan span, Expression value, boolean newline) {
      super(StatementKind.PRINT, span);
      this.value = value;
      this.newline = newline;
    }

    public Expression value() {
      return value;
    }

    public boolean isNewline() {
      return newline;
    }
  }

  public static class Return extends Statement {
    private final Expression value;

    public Return(SourceSpan span, Expression value) {
      super(StatementKind.RETURN, span);
      this.value = value;
    }

    public Return(Expression value) {
      this(SourceSpan.UNKNOWN, value);
    }

    /** @return returned value, or null for a bare return */
    public Expression value() {
      return value;
    }
  }

  public static class ElseIf {
    public final Expression condition;
    public final List<Statement> body;

    public ElseIf(Expression condition, List<Statement> body) {
      this.condition = condition;
      this.body = copy(body);
    }
  }

  public static class If extends Statement {
    private final Expression condition;
    private final List<Statement> thenBody;
    private final List<ElseIf> elseIfs;
    private final List<Statement> elseBody;

    public If(SourceSpan span, Expression condition, List<Statement> thenBody,
              List<ElseIf> elseIfs, List<Statement> elseBody) {
      super(StatementKind.IF, span);
      this.condition = condition;
      this.thenBody = copy(thenBody);
      this.elseIfs = Collections.unmodifiableList(elseIfs == null ?
                new ArrayList<ElseIf>() : new ArrayList<ElseIf>(elseIfs));
      this.elseBody = copy(elseBody);
    }

    public If(Expression condition, List<Statement> thenBody,
              List<Statement> elseBody) {
      this(SourceSpan.UNKNOWN, condition, thenBody, null, elseBody);
    }

    public Expression condition() {
      return condition;
    }

    public List<Statement> thenBody() {
      return thenBody;
    }

    public List<ElseIf> elseIfs() {
      return elseIfs;
    }

    /** @return else body, or null if there is no else clause */
    public List<Statement> elseBody() {
      return elseBody;
    }
  }

  public static class While extends Statement {
    private final Expression condition;
    private final List<Statement> body;

    public While(SourceSpan span, Expression condition, List<Statement> body) {
      super(StatementKind.WHILE, span);
      this.condition = condition;
      this.body = copy(body);
    }

    public Expression condition() {
      return condition;
    }

    public List<Statement> body() {
      return body;
    }
  }

  /**
   * Counted loop: variable runs from {@code from} while it is less than
   * {@code to}, advancing by {@code step} (1 if absent).
   */
  public static class For extends Statement {
    private final String variable;
    private final Expression from;
    private final Expression to;
    private final Expression step;
    private final List<Statement> body;

    public For(SourceSpan span, String variable, Expression from,
               Expression to, Expression step, List<Statement> body) {
      super(StatementKind.FOR, span);
      this.variable = variable;
      this.from = from;
      this.to = to;
      this.step = step;
      this.body = copy(body);
    }

    public String variable() {
      return variable;
    }

    public Expression from() {
      return from;
    }

    public Expression to() {
      return to;
    }

    /** @return step, or null for the default of 1 */
    public Expression step() {
      return step;
    }

    public List<Statement> body() {
      return body;
    }
  }

  public static class Break extends Statement {
    public Break(SourceSpan span) {
      super(StatementKind.BREAK, span);
    }
  }

  public static class Continue extends Statement {
    public Continue(SourceSpan span) {
      super(StatementKind.CONTINUE, span);
    }
  }

  public static class Throw extends Statement {
    private final Expression value;

    public Throw(SourceSpan span, Expression value) {
      super(StatementKind.THROW, span);
      this.value = value;
    }

    public Expression value() {
      return value;
    }
  }

  public static class CatchClause {
    public final String exceptionType;
    /** may be null if the exception is not bound */
    public final String variableName;
    public final List<Statement> body;

    public CatchClause(String exceptionType, String variableName,
                       List<Statement> body) {
      this.exceptionType = exceptionType;
      this.variableName = variableName;
      this.body = copy(body);
    }
  }

  public static class Try extends Statement {
    private final List<Statement> body;
    private final List<CatchClause> catchClauses;
    private final List<Statement> finallyBody;

    public Try(SourceSpan span, List<Statement> body,
               List<CatchClause> catchClauses, List<Statement> finallyBody) {
      super(StatementKind.TRY, span);
      this.body = copy(body);
      this.catchClauses = Collections.unmodifiableList(
                              new ArrayList<CatchClause>(catchClauses));
      this.finallyBody = copy(finallyBody);
    }

    public List<Statement> body() {
      return body;
    }

    public List<CatchClause> catchClauses() {
      return catchClauses;
    }

    /** @return finally body, or null */
    public List<Statement> finallyBody() {
      return finallyBody;
    }
  }
}
