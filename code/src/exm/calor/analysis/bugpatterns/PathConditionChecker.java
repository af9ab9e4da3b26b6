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
package exm.calor.analysis.bugpatterns;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.calor.analysis.dataflow.BoundNodes;
import exm.calor.analysis.dataflow.ControlFlowGraph;
import exm.calor.ast.SourceSpan;
import exm.calor.binding.BoundExpression;
import exm.calor.binding.BoundStatement;
import exm.calor.binding.BoundTree.BoundFunction;
import exm.calor.binding.VariableSymbol;
import exm.calor.diagnostics.DiagnosticBag;
import exm.calor.solver.Formula;
import exm.calor.solver.FormulaTranslator;
import exm.calor.solver.Solver;
import exm.calor.solver.SolverResult;
import exm.calor.solver.Solvers;

/**
 * Base for checkers that walk a function body pre-order, knowing the
 * conditions guarding the current statement.
 *
 * If, else-if and while conditions guard their bodies, and a for loop
 * guards its body with {@code var < to}.  Else bodies get no extra
 * condition.  Subclasses override the visit methods they need.
 */
public abstract class PathConditionChecker implements BugPatternChecker {

  protected final BugPatternOptions options;
  protected final Solver solver;
  protected final Logger logger;

  /** Set for duration of check() */
  protected BoundFunction function;
  protected DiagnosticBag diagnostics;

  protected PathConditionChecker(BugPatternOptions options, Solver solver,
                                 Logger logger) {
    this.options = options;
    this.solver = solver;
    this.logger = logger;
  }

  @Override
  public void check(BoundFunction function, DiagnosticBag diagnostics) {
    this.function = function;
    this.diagnostics = diagnostics;
    try {
      walkStatements(function.getBody(),
                     Collections.<BoundExpression>emptyList());
    } finally {
      this.function = null;
      this.diagnostics = null;
    }
  }

  /**
   * Called for every expression node, parents before children.
   */
  protected void visitExpression(BoundExpression expr,
                                 List<BoundExpression> path) {
    // Nothing
  }

  /**
   * Called for call expressions and call statements, before their
   * arguments are visited.
   */
  protected void visitCall(String target, List<BoundExpression> args,
                           SourceSpan span, List<BoundExpression> path) {
    // Nothing
  }

  private void walkStatements(List<BoundStatement> stmts,
                              List<BoundExpression> path) {
    for (BoundStatement stmt: stmts) {
      walkStatement(stmt, path);
    }
  }

  private static List<BoundExpression> extend(List<BoundExpression> path,
                                              BoundExpression cond) {
    List<BoundExpression> res = new ArrayList<BoundExpression>(path);
    res.add(cond);
    return Collections.unmodifiableList(res);
  }

  private void walkStatement(BoundStatement stmt,
                             List<BoundExpression> path) {
    switch (stmt.kind()) {
      case BIND:
        walkExpression(((BoundStatement.Bind) stmt).initializer(), path);
        break;
      case ASSIGN:
        walkExpression(((BoundStatement.Assign) stmt).value(), path);
        break;
      case RETURN:
        walkExpression(((BoundStatement.Return) stmt).value(), path);
        break;
      case CALL: {
        BoundStatement.Call call = (BoundStatement.Call) stmt;
        visitCall(call.target(), call.args(), call.span(), path);
        for (BoundExpression arg: call.args()) {
          walkExpression(arg, path);
        }
        break;
      }
      case IF: {
        BoundStatement.If ifStmt = (BoundStatement.If) stmt;
        walkExpression(ifStmt.condition(), path);
        walkStatements(ifStmt.thenBody(), extend(path, ifStmt.condition()));
        for (BoundStatement.ElseIf elseIf: ifStmt.elseIfs()) {
          walkExpression(elseIf.condition, path);
          walkStatements(elseIf.body, extend(path, elseIf.condition));
        }
        if (ifStmt.elseBody() != null) {
          walkStatements(ifStmt.elseBody(), path);
        }
        break;
      }
      case WHILE: {
        BoundStatement.While w = (BoundStatement.While) stmt;
        walkExpression(w.condition(), path);
        walkStatements(w.body(), extend(path, w.condition()));
        break;
      }
      case FOR: {
        BoundStatement.For f = (BoundStatement.For) stmt;
        walkExpression(f.from(), path);
        walkExpression(f.to(), path);
        walkExpression(f.step(), path);
        walkStatements(f.body(),
                       extend(path, ControlFlowGraph.loopCondition(f)));
        break;
      }
      default:
        // Break and continue have no expressions
        break;
    }
  }

  private void walkExpression(BoundExpression expr,
                              List<BoundExpression> path) {
    if (expr == null) {
      return;
    }
    visitExpression(expr, path);
    switch (expr.kind()) {
      case BINARY:
        walkExpression(((BoundExpression.Binary) expr).left(), path);
        walkExpression(((BoundExpression.Binary) expr).right(), path);
        break;
      case UNARY:
        walkExpression(((BoundExpression.Unary) expr).operand(), path);
        break;
      case CALL: {
        BoundExpression.Call call = (BoundExpression.Call) expr;
        visitCall(call.target(), call.args(), call.span(), path);
        for (BoundExpression arg: call.args()) {
          walkExpression(arg, path);
        }
        break;
      }
      default:
        break;
    }
  }

  /**
   * Conjoin the translatable path conditions.  Untranslatable conditions
   * are dropped, which only weakens the constraint.
   */
  protected static List<Formula> translatePath(List<BoundExpression> path) {
    List<Formula> res = new ArrayList<Formula>();
    for (BoundExpression cond: path) {
      Formula f = FormulaTranslator.translateCondition(cond);
      if (f != null) {
        res.add(f);
      }
    }
    return res;
  }

  /**
   * @return constraints bounding each integer variable in exprs by its type
   */
  protected static List<Formula> rangeConstraints(BoundExpression... exprs) {
    Map<String, String> vars = new LinkedHashMap<String, String>();
    for (BoundExpression e: exprs) {
      for (VariableSymbol v: BoundNodes.usedVariables(e)) {
        vars.put(v.getName(), v.getTypeName());
      }
    }
    List<Formula> res = new ArrayList<Formula>();
    for (Map.Entry<String, String> e: vars.entrySet()) {
      Formula c = FormulaTranslator.rangeConstraint(e.getValue(),
                                              Formula.intVar(e.getKey()));
      if (c != null) {
        res.add(c);
      }
    }
    return res;
  }

  protected SolverResult checkSat(List<Formula> conjuncts) {
    return Solvers.check(logger, solver, Formula.and(conjuncts),
                         options.solverTimeoutMs());
  }

  protected static boolean isVariableNamed(BoundExpression e, String name) {
    return e.kind() == BoundExpression.BoundExpressionKind.VARIABLE &&
           ((BoundExpression.Variable) e).name().equals(name);
  }

  protected static boolean isIntLiteral(BoundExpression e, long value) {
    return e.kind() == BoundExpression.BoundExpressionKind.INT_LITERAL &&
           ((BoundExpression.IntLiteral) e).value() == value;
  }
}
