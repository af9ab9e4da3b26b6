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

import exm.calor.ast.SourceSpan;
import exm.calor.binding.BoundExpression;
import exm.calor.binding.BoundExpression.Binary;
import exm.calor.binding.BoundExpression.BoundExpressionKind;
import exm.calor.diagnostics.DiagnosticCode;
import exm.calor.solver.Formula;
import exm.calor.solver.FormulaTranslator;
import exm.calor.solver.Solver;
import exm.calor.solver.SolverResult;

/**
 * Indexed access through calls such as {@code arr.get(i)}, where the
 * first argument is the index.  Only the lower bound is checked: the
 * length of the collection is not known.
 */
public class IndexOutOfBoundsChecker extends PathConditionChecker {

  public IndexOutOfBoundsChecker(BugPatternOptions options, Solver solver,
                                 Logger logger) {
    super(options, solver, logger);
  }

  @Override
  public String getName() {
    return "INDEX_BOUNDS";
  }

  static boolean isIndexedAccess(String target) {
    String t = target.toLowerCase();
    return t.endsWith(".get") || t.endsWith(".at") || t.endsWith("[]") ||
           t.contains("array_get") || t.contains("list_get");
  }

  @Override
  protected void visitCall(String target, List<BoundExpression> args,
                           SourceSpan span, List<BoundExpression> path) {
    if (!isIndexedAccess(target) || args.isEmpty()) {
      return;
    }
    BoundExpression index = args.get(0);
    if (index.kind() == BoundExpressionKind.INT_LITERAL) {
      long v = ((BoundExpression.IntLiteral) index).value();
      if (v < 0) {
        diagnostics.reportError(span, DiagnosticCode.INDEX_OUT_OF_BOUNDS,
            "Array access with negative literal index: " + v);
      }
      return;
    }

    if (hasBoundsCheck(index, path)) {
      return;
    }

    if (options.useSolverVerification()) {
      Formula idx = FormulaTranslator.translate(index);
      if (idx == null || idx.getSort() != Formula.Sort.INT) {
        return;
      }
      List<Formula> query = translatePath(path);
      query.addAll(rangeConstraints(index));
      query.add(Formula.lt(idx, Formula.intConst(0)));
      if (checkSat(query) == SolverResult.SAT) {
        diagnostics.reportWarning(span, DiagnosticCode.INDEX_OUT_OF_BOUNDS,
            "Potential array access with negative index");
      }
    } else if (index.kind() == BoundExpressionKind.VARIABLE) {
      diagnostics.reportWarning(span, DiagnosticCode.INDEX_OUT_OF_BOUNDS,
          "Array access with '" + ((BoundExpression.Variable) index).name() +
          "' may be out of bounds");
    }
  }

  /**
   * A guard {@code i >= 0}, or {@code i < n} / {@code i <= n} taken as a
   * comparison with the length.
   */
  private static boolean hasBoundsCheck(BoundExpression index,
                                        List<BoundExpression> path) {
    if (index.kind() != BoundExpressionKind.VARIABLE) {
      return false;
    }
    String name = ((BoundExpression.Variable) index).name();
    for (BoundExpression cond: path) {
      if (cond.kind() != BoundExpressionKind.BINARY) {
        continue;
      }
      Binary b = (Binary) cond;
      switch (b.op()) {
        case GREATER_OR_EQUAL:
          if (isVariableNamed(b.left(), name) && isIntLiteral(b.right(), 0)) {
            return true;
          }
          break;
        case LESS_THAN:
        case LESS_OR_EQUAL:
          if (isVariableNamed(b.left(), name)) {
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
