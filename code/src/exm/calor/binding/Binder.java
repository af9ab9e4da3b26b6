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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.calor.ast.Expression;
import exm.calor.ast.Expression.Binary;
import exm.calor.ast.Expression.Conditional;
import exm.calor.ast.Expression.Unary;
import exm.calor.ast.SourceSpan;
import exm.calor.ast.Statement;
import exm.calor.ast.Statement.Assign;
import exm.calor.ast.Statement.Bind;
import exm.calor.ast.Statement.CallStatement;
import exm.calor.ast.Statement.For;
import exm.calor.ast.Statement.If;
import exm.calor.ast.Statement.Print;
import exm.calor.ast.Statement.While;
import exm.calor.ast.SyntaxTree;
import exm.calor.ast.SyntaxTree.Parameter;
import exm.calor.ast.UnaryOperator;
import exm.calor.binding.BoundTree.BoundFunction;
import exm.calor.binding.BoundTree.BoundModule;
import exm.calor.cnf.lowering.CnfLowering;
import exm.calor.common.Logging;
import exm.calor.diagnostics.DiagnosticBag;
import exm.calor.diagnostics.DiagnosticCode;

/**
 * Resolves names in the structured tree and computes type names.
 *
 * This is a reference binder: it gives the verification passes something
 * to analyse, it does not type check.  Undefined names are reported and
 * replaced by a fresh INT variable so binding always produces a module.
 */
public class Binder {

  private static final String DEFAULT_TYPE = "INT";

  private final DiagnosticBag diagnostics;
  private final Logger logger;
  private final Map<String, FunctionSymbol> functions =
                            new HashMap<String, FunctionSymbol>();
  private Scope scope;

  public Binder(DiagnosticBag diagnostics, Logger logger) {
    this.diagnostics = diagnostics;
    this.logger = logger;
  }

  public Binder(DiagnosticBag diagnostics) {
    this(diagnostics, Logging.getCalorLogger());
  }

  public BoundModule bind(SyntaxTree.Module module) {
    functions.clear();
    // Declare all functions first so calls can be resolved in any order
    for (SyntaxTree.Function f: module.functions()) {
      List<VariableSymbol> params = new ArrayList<VariableSymbol>();
      for (Parameter p: f.parameters()) {
        params.add(new VariableSymbol(p.name(), p.typeName(), false, true));
      }
      FunctionSymbol sym = new FunctionSymbol(f.name(),
                                  returnTypeName(f), params);
      if (functions.containsKey(f.name())) {
        diagnostics.reportError(f.span(), DiagnosticCode.DUPLICATE_DEFINITION,
            "Function '" + f.name() + "' is already defined");
      } else {
        functions.put(f.name(), sym);
      }
    }

    List<BoundFunction> bound = new ArrayList<BoundFunction>();
    for (SyntaxTree.Function f: module.functions()) {
      bound.add(bindFunction(f));
    }
    logger.debug("Bound module " + module.name() + ": " + bound.size() +
                 " functions");
    return new BoundModule(module.name(), bound);
  }

  private static String returnTypeName(SyntaxTree.Function f) {
    return f.outputTypeName() == null ? "VOID" : f.outputTypeName();
  }

  private BoundFunction bindFunction(SyntaxTree.Function f) {
    scope = new Scope();
    List<VariableSymbol> params = new ArrayList<VariableSymbol>();
    for (Parameter p: f.parameters()) {
      VariableSymbol sym = new VariableSymbol(p.name(), p.typeName(),
                                              false, true);
      if (!scope.declare(sym)) {
        diagnostics.reportError(p.span(), DiagnosticCode.DUPLICATE_DEFINITION,
            "Parameter '" + p.name() + "' is already defined");
      }
      params.add(sym);
    }
    FunctionSymbol symbol = new FunctionSymbol(f.name(), returnTypeName(f),
                                               params);
    List<BoundStatement> body = bindStatements(f.body());
    scope = null;
    return new BoundFunction(f.span(), symbol, body);
  }

  /**
   * Bind statements in a new child scope
   */
  private List<BoundStatement> bindBlock(List<Statement> stmts) {
    Scope outer = scope;
    scope = scope.makeChildScope();
    try {
      return bindStatements(stmts);
    } finally {
      scope = outer;
    }
  }

  private List<BoundStatement> bindStatements(List<Statement> stmts) {
    List<BoundStatement> res = new ArrayList<BoundStatement>();
    for (Statement stmt: stmts) {
      BoundStatement b = bindStatement(stmt);
      if (b != null) {
        res.add(b);
      }
    }
    return res;
  }

  /**
   * @return bound statement, or null if the statement has no bound form
   */
  private BoundStatement bindStatement(Statement stmt) {
    switch (stmt.kind()) {
      case BIND:
        return bindBind((Bind) stmt);
      case ASSIGN:
        return bindAssign((Assign) stmt);
      case CALL: {
        CallStatement call = (CallStatement) stmt;
        return new BoundStatement.Call(stmt.span(), call.target(),
                                       bindExpressions(call.args()));
      }
      case PRINT: {
        Print print = (Print) stmt;
        List<BoundExpression> args = new ArrayList<BoundExpression>();
        args.add(bindExpression(print.value()));
        return new BoundStatement.Call(stmt.span(), print.isNewline() ?
            CnfLowering.PRINT_LINE_TARGET : CnfLowering.PRINT_TARGET, args);
      }
      case RETURN: {
        Expression value = ((Statement.Return) stmt).value();
        return new BoundStatement.Return(stmt.span(),
                  value == null ? null : bindExpression(value));
      }
      case IF:
        return bindIf((If) stmt);
      case WHILE: {
        While w = (While) stmt;
        BoundExpression cond = bindExpression(w.condition());
        return new BoundStatement.While(stmt.span(), cond,
                                        bindBlock(w.body()));
      }
      case FOR:
        return bindFor((For) stmt);
      case BREAK:
        return new BoundStatement.Break(stmt.span());
      case CONTINUE:
        return new BoundStatement.Continue(stmt.span());
      case THROW:
      case TRY:
        diagnostics.reportError(stmt.span(), DiagnosticCode.TYPE_MISMATCH,
            "Unsupported statement type in binding: " + stmt.kind());
        return null;
      default:
        diagnostics.reportError(stmt.span(), DiagnosticCode.TYPE_MISMATCH,
            "Unknown statement type in binding: " + stmt.kind());
        return null;
    }
  }

  private BoundStatement bindBind(Bind bind) {
    String typeName = bind.typeName() == null ? DEFAULT_TYPE
                                              : bind.typeName();
    BoundExpression init = null;
    if (bind.initializer() != null) {
      init = bindExpression(bind.initializer());
      if (bind.typeName() == null) {
        typeName = init.typeName();
      }
    }
    VariableSymbol var = new VariableSymbol(bind.name(), typeName,
                                            bind.isMutable(), false);
    if (!scope.declare(var)) {
      diagnostics.reportError(bind.span(), DiagnosticCode.DUPLICATE_DEFINITION,
          "Variable '" + bind.name() + "' is already defined");
    }
    return new BoundStatement.Bind(bind.span(), var, init);
  }

  private BoundStatement bindAssign(Assign assign) {
    BoundExpression value = bindExpression(assign.value());
    if (assign.target().kind() != Expression.ExpressionKind.REFERENCE) {
      diagnostics.reportError(assign.span(), DiagnosticCode.TYPE_MISMATCH,
          "Unsupported assignment target: " + assign.target());
      return null;
    }
    String name = ((Expression.Reference) assign.target()).name();
    VariableSymbol var = lookupVariable(name, assign.target().span());
    return new BoundStatement.Assign(assign.span(), var, value);
  }

  private BoundStatement bindIf(If stmt) {
    BoundExpression cond = bindExpression(stmt.condition());
    List<BoundStatement> thenBody = bindBlock(stmt.thenBody());
    List<BoundStatement.ElseIf> elseIfs =
                              new ArrayList<BoundStatement.ElseIf>();
    for (Statement.ElseIf elseIf: stmt.elseIfs()) {
      BoundExpression c = bindExpression(elseIf.condition);
      elseIfs.add(new BoundStatement.ElseIf(c, bindBlock(elseIf.body)));
    }
    List<BoundStatement> elseBody = stmt.elseBody() == null ? null
                                          : bindBlock(stmt.elseBody());
    return new BoundStatement.If(stmt.span(), cond, thenBody, elseIfs,
                                 elseBody);
  }

  private BoundStatement bindFor(For stmt) {
    // Bounds are evaluated outside the loop scope
    BoundExpression from = bindExpression(stmt.from());
    BoundExpression to = bindExpression(stmt.to());
    BoundExpression step = stmt.step() == null ? null
                                               : bindExpression(stmt.step());
    Scope outer = scope;
    scope = scope.makeChildScope();
    try {
      VariableSymbol loopVar = new VariableSymbol(stmt.variable(), "INT",
                                                  true, false);
      scope.declare(loopVar);
      if (outer.lookup(stmt.variable()) != null) {
        diagnostics.reportError(stmt.span(),
            DiagnosticCode.DUPLICATE_DEFINITION,
            "Variable '" + stmt.variable() + "' is already defined");
      }
      List<BoundStatement> body = bindStatements(stmt.body());
      return new BoundStatement.For(stmt.span(), loopVar, from, to, step,
                                    body);
    } finally {
      scope = outer;
    }
  }

  private VariableSymbol lookupVariable(String name, SourceSpan span) {
    VariableSymbol sym = scope.lookup(name);
    if (sym == null) {
      diagnostics.reportError(span, DiagnosticCode.UNDEFINED_REFERENCE,
                              "Undefined variable '" + name + "'");
      return new VariableSymbol(name, DEFAULT_TYPE, false, false);
    }
    return sym;
  }

  private List<BoundExpression> bindExpressions(List<Expression> exprs) {
    List<BoundExpression> res = new ArrayList<BoundExpression>();
    for (Expression e: exprs) {
      res.add(bindExpression(e));
    }
    return res;
  }

  private BoundExpression bindExpression(Expression e) {
    switch (e.kind()) {
      case INT_LITERAL:
        return new BoundExpression.IntLiteral(e.span(),
                          ((Expression.IntLiteral) e).value());
      case FLOAT_LITERAL:
        return new BoundExpression.FloatLiteral(e.span(),
                          ((Expression.FloatLiteral) e).value());
      case BOOL_LITERAL:
        return new BoundExpression.BoolLiteral(e.span(),
                          ((Expression.BoolLiteral) e).value());
      case STRING_LITERAL:
        return new BoundExpression.StringLiteral(e.span(),
                          ((Expression.StringLiteral) e).value());
      case REFERENCE: {
        String name = ((Expression.Reference) e).name();
        return new BoundExpression.Variable(e.span(),
                                            lookupVariable(name, e.span()));
      }
      case BINARY: {
        Binary b = (Binary) e;
        BoundExpression left = bindExpression(b.left());
        BoundExpression right = bindExpression(b.right());
        String type;
        if (b.op().isBoolean()) {
          type = "BOOL";
        } else if ("FLOAT".equals(left.typeName()) ||
                   "FLOAT".equals(right.typeName())) {
          type = "FLOAT";
        } else {
          type = left.typeName();
        }
        return new BoundExpression.Binary(e.span(), b.op(), left, right,
                                          type);
      }
      case UNARY: {
        Unary u = (Unary) e;
        BoundExpression operand = bindExpression(u.operand());
        String type = u.op() == UnaryOperator.NOT ? "BOOL"
                                                  : operand.typeName();
        return new BoundExpression.Unary(e.span(), u.op(), operand, type);
      }
      case CALL: {
        Expression.Call call = (Expression.Call) e;
        List<BoundExpression> args = bindExpressions(call.args());
        FunctionSymbol fn = functions.get(call.target());
        String type = fn == null ? DEFAULT_TYPE : fn.getReturnTypeName();
        return new BoundExpression.Call(e.span(), call.target(), args, type);
      }
      case CONDITIONAL: {
        // Bound form keeps only the true arm; the others are still
        // checked for undefined names
        Conditional c = (Conditional) e;
        bindExpression(c.condition());
        BoundExpression whenTrue = bindExpression(c.whenTrue());
        bindExpression(c.whenFalse());
        return whenTrue;
      }
      default:
        diagnostics.reportError(e.span(), DiagnosticCode.TYPE_MISMATCH,
            "Unsupported expression type in binding: " + e.kind());
        return new BoundExpression.IntLiteral(e.span(), 0);
    }
  }
}
