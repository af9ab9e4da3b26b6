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

import java.util.List;

import org.apache.log4j.Logger;

import exm.calor.ast.BinaryOperator;
import exm.calor.binding.BoundExpression;
import exm.calor.binding.BoundExpression.Binary;
import exm.calor.binding.BoundExpression.BoundExpressionKind;
import exm.calor.diagnostics.DiagnosticCode;
import exm.calor.solver.Formula;
import exm.calor.solver.FormulaTranslator;
import exm.calor.solver.Solver;
import exm.calor.solver.SolverResult;

/**
 * Division or modulo whose divisor may be zero.
 */
public class DivisionByZeroChecker extends PathConditionChecker {

  public DivisionByZeroChecker(BugPatternOptions options, Solver solver,
                               Logger logger) {
    super(options, solver, logger);
  }

  @Override
  public String getName() {
    return "DIV_ZERO";
  }

  @Override
  protected void visitExpression(BoundExpression expr,
                                 List<BoundExpression> path) {
    if (expr.kind() != BoundExpressionKind.BINARY) {
      return;
    }
    Binary b = (Binary) expr;
    if (b.op() == BinaryOperator.DIVIDE || b.op() == BinaryOperator.MODULO) {
      checkDivisor(b, b.right(), path);
    }
  }

  private void checkDivisor(Binary division, BoundExpression divisor,
                            List<BoundExpression> path) {
    if (divisor.kind() == BoundExpressionKind.INT_LITERAL) {
      if (((BoundExpression.IntLiteral) divisor).value() == 0) {
        diagnostics.reportError(division.span(),
            DiagnosticCode.DIVISION_BY_ZERO, "Division by literal zero");
      }
      return;
    } else if (divisor.kind() == BoundExpressionKind.FLOAT_LITERAL) {
      if (((BoundExpression.FloatLiteral) divisor).value() == 0.0) {
        diagnostics.reportError(division.span(),
            DiagnosticCode.DIVISION_BY_ZERO, "Division by literal zero");
      }
      return;
    }

    if (options.useSolverVerification()) {
      SolverResult canBeZero = canBeZero(divisor, path);
      if (canBeZero == SolverResult.SAT) {
        diagnostics.reportWarning(division.span(),
            DiagnosticCode.DIVISION_BY_ZERO,
            "Potential division by zero: divisor can be zero under some " +
            "conditions");
      } else if (canBeZero == SolverResult.UNKNOWN) {
        diagnostics.reportInfo(division.span(),
            DiagnosticCode.DIVISION_BY_ZERO,
            "Division by zero check inconclusive (complex expression)");
      }
    } else if (divisor.kind() == BoundExpressionKind.VARIABLE) {
      String name = ((BoundExpression.Variable) divisor).name();
      if (!hasZeroGuard(name, path)) {
        diagnostics.reportWarning(division.span(),
            DiagnosticCode.DIVISION_BY_ZERO,
            "Potential division by zero: '" + name + "' may be zero");
      }
    }
  }

  /**
   * @return SAT if some path can reach the division with divisor zero,
   *    UNKNOWN if the divisor can't be translated or the solver gave up
   */
  private SolverResult canBeZero(BoundExpression divisor,
                                 List<BoundExpression> path) {
    Formula d = FormulaTranslator.translate(divisor);
    if (d == null || d.getSort() != Formula.Sort.INT) {
      return SolverResult.UNKNOWN;
    }
    List<Formula> query = translatePath(path);
    query.add(Formula.eq(d, Formula.intConst(0)));
    return checkSat(query);
  }

  /**
   * Guards of form x != 0, x > 0 or x < 0, either way round
   */
  private static boolean hasZeroGuard(String var, List<BoundExpression> path) {
    for (BoundExpression cond: path) {
      if (cond.kind() != BoundExpressionKind.BINARY) {
        continue;
      }
      Binary b = (Binary) cond;
      switch (b.op()) {
        case NOT_EQUAL:
        case GREATER_THAN:
        case LESS_THAN:
          if ((isVariableNamed(b.left(), var) && isIntLiteral(b.right(), 0)) ||
              (isVariableNamed(b.right(), var) && isIntLiteral(b.left(), 0))) {
            return true;
          }
          break;
        default:
          break;
      }
    }
    return false;
  }
}
