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
import exm.calor.ast.UnaryOperator;
import exm.calor.binding.BoundExpression;
import exm.calor.binding.BoundExpression.Binary;
import exm.calor.binding.BoundExpression.BoundExpressionKind;
import exm.calor.binding.BoundExpression.Unary;
import exm.calor.diagnostics.DiagnosticCode;
import exm.calor.solver.Formula;
import exm.calor.solver.FormulaTranslator;
import exm.calor.solver.Solver;
import exm.calor.solver.SolverResult;

/**
 * Integer arithmetic whose result may not fit in the operand type.
 */
public class OverflowChecker extends PathConditionChecker {

  /** Pairs of literals below this magnitude are not checked */
  private static final long SMALL_CONSTANT = 10000;

  public OverflowChecker(BugPatternOptions options, Solver solver,
                         Logger logger) {
    super(options, solver, logger);
  }

  @Override
  public String getName() {
    return "OVERFLOW";
  }

  private static String opName(BinaryOperator op) {
    switch (op) {
      case ADD:
        return "addition";
      case SUBTRACT:
        return "subtraction";
      case MULTIPLY:
        return "multiplication";
      case LEFT_SHIFT:
        return "left shift";
      default:
        return "operation";
    }
  }

  @Override
  protected void visitExpression(BoundExpression expr,
                                 List<BoundExpression> path) {
    if (expr.kind() == BoundExpressionKind.BINARY) {
      Binary b = (Binary) expr;
      switch (b.op()) {
        case ADD:
        case SUBTRACT:
        case MULTIPLY:
        case LEFT_SHIFT:
          if (FormulaTranslator.integerRange(b.typeName()) != null) {
            checkBinary(b, path);
          }
          break;
        default:
          break;
      }
    } else if (expr.kind() == BoundExpressionKind.UNARY) {
      Unary u = (Unary) expr;
      if (u.op() == UnaryOperator.NEGATE &&
          FormulaTranslator.integerRange(u.typeName()) != null) {
        checkNegation(u, path);
      }
    }
  }

  private void checkBinary(Binary b, List<BoundExpression> path) {
    long[] range = FormulaTranslator.integerRange(b.typeName());
    if (b.left().kind() == BoundExpressionKind.INT_LITERAL &&
        b.right().kind() == BoundExpressionKind.INT_LITERAL) {
      long l = ((BoundExpression.IntLiteral) b.left()).value();
      long r = ((BoundExpression.IntLiteral) b.right()).value();
      if (Math.abs(l) < SMALL_CONSTANT && Math.abs(r) < SMALL_CONSTANT) {
        return;
      }
      if (constantOverflows(b.op(), l, r, range)) {
        diagnostics.reportWarning(b.span(), DiagnosticCode.INTEGER_OVERFLOW,
            "Potential integer overflow in " + opName(b.op()));
      }
      return;
    }

    if (!options.useSolverVerification() ||
        b.op() == BinaryOperator.LEFT_SHIFT) {
      return;
    }
    Formula l = FormulaTranslator.translate(b.left());
    Formula r = FormulaTranslator.translate(b.right());
    if (l == null || r == null ||
        l.getSort() != Formula.Sort.INT || r.getSort() != Formula.Sort.INT) {
      return;
    }
    Formula result;
    switch (b.op()) {
      case ADD:
        result = Formula.add(l, r);
        break;
      case SUBTRACT:
        result = Formula.sub(l, r);
        break;
      default:
        result = Formula.mul(l, r);
        break;
    }
    List<Formula> query = translatePath(path);
    query.addAll(rangeConstraints(b.left(), b.right()));
    query.add(Formula.or(Formula.lt(result, Formula.intConst(range[0])),
                         Formula.gt(result, Formula.intConst(range[1]))));
    if (checkSat(query) == SolverResult.SAT) {
      diagnostics.reportWarning(b.span(), DiagnosticCode.INTEGER_OVERFLOW,
          "Potential integer overflow in " + opName(b.op()));
    }
  }

  /**
   * Exact check of an operation on two constants
   */
  static boolean constantOverflows(BinaryOperator op, long l, long r,
                                   long[] range) {
    long res;
    try {
      switch (op) {
        case ADD:
          res = Math.addExact(l, r);
          break;
        case SUBTRACT:
          res = Math.subtractExact(l, r);
          break;
        case MULTIPLY:
          res = Math.multiplyExact(l, r);
          break;
        case LEFT_SHIFT:
          if (r < 0 || r >= 63) {
            return true;
          }
          res = l << r;
          if ((res >> r) != l) {
            return true;
          }
          break;
        default:
          return false;
      }
    } catch (ArithmeticException e) {
      // Outside even the 64 bit range
      return true;
    }
    return res < range[0] || res > range[1];
  }

  private void checkNegation(Unary u, List<BoundExpression> path) {
    long[] range = FormulaTranslator.integerRange(u.typeName());
    if (u.operand().kind() == BoundExpressionKind.INT_LITERAL) {
      if (((BoundExpression.IntLiteral) u.operand()).value() == range[0] &&
          range[0] < 0) {
        diagnostics.reportWarning(u.span(), DiagnosticCode.INTEGER_OVERFLOW,
            "Negation of INT_MIN causes overflow");
      }
      return;
    }
    if (!options.useSolverVerification() || range[0] == 0) {
      return;
    }
    Formula operand = FormulaTranslator.translate(u.operand());
    if (operand == null || operand.getSort() != Formula.Sort.INT) {
      return;
    }
    List<Formula> query = translatePath(path);
    query.addAll(rangeConstraints(u.operand()));
    query.add(Formula.eq(operand, Formula.intConst(range[0])));
    if (checkSat(query) == SolverResult.SAT) {
      diagnostics.reportWarning(u.span(), DiagnosticCode.INTEGER_OVERFLOW,
          "Potential overflow in negation (value may be INT_MIN)");
    }
  }
}
