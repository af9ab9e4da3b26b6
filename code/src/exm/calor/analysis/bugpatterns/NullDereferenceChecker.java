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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.calor.ast.BinaryOperator;
import exm.calor.ast.SourceSpan;
import exm.calor.binding.BoundExpression;
import exm.calor.binding.BoundExpression.Binary;
import exm.calor.binding.BoundExpression.BoundExpressionKind;
import exm.calor.diagnostics.DiagnosticCode;
import exm.calor.solver.Solver;

/**
 * Unwrapping an option or result without first checking it holds a
 * value.  The receiver is the part of the call target before the last dot.
 */
public class NullDereferenceChecker extends PathConditionChecker {

  private static final String[] UNSAFE_SUFFIXES = {
    ".unwrap", ".unwrap_unchecked", ".expect", ".get_unchecked"
  };

  private static final String[] SAFE_SUFFIXES = {
    ".unwrap_or", ".unwrap_or_default", ".unwrap_or_else",
    ".get_or_insert", ".map_or", ".map_or_else"
  };

  private static final String[] CHECK_SUFFIXES = {
    ".is_some", ".is_ok", ".has_value", ".is_present"
  };

  private static final Set<String> NULL_NAMES = new HashSet<String>();
  static {
    NULL_NAMES.add("null");
    NULL_NAMES.add("None");
    NULL_NAMES.add("none");
    NULL_NAMES.add("nil");
  }

  public NullDereferenceChecker(BugPatternOptions options, Solver solver,
                                Logger logger) {
    super(options, solver, logger);
  }

  @Override
  public String getName() {
    return "NULL_DEREF";
  }

  private static boolean endsWithAny(String s, String[] suffixes) {
    for (String suffix: suffixes) {
      if (s.endsWith(suffix)) {
        return true;
      }
    }
    return false;
  }

  static boolean isUnsafeUnwrap(String target) {
    String t = target.toLowerCase();
    if (endsWithAny(t, SAFE_SUFFIXES)) {
      return false;
    }
    return endsWithAny(t, UNSAFE_SUFFIXES) || t.contains("unwrap");
  }

  /**
   * @return receiver name, or null if target has no receiver
   */
  static String receiverName(String target) {
    int dot = target.lastIndexOf('.');
    return dot > 0 ? target.substring(0, dot) : null;
  }

  @Override
  protected void visitCall(String target, List<BoundExpression> args,
                           SourceSpan span, List<BoundExpression> path) {
    if (!isUnsafeUnwrap(target)) {
      return;
    }
    String receiver = receiverName(target);
    if (receiver == null) {
      diagnostics.reportWarning(span, DiagnosticCode.NULL_DEREFERENCE,
          "Potential unsafe unwrap without prior Option/Result check");
    } else if (!checkedReceivers(path).contains(receiver)) {
      diagnostics.reportWarning(span, DiagnosticCode.NULL_DEREFERENCE,
          "Unsafe unwrap on '" + receiver + "' without prior Some/Ok check");
    }
  }

  /**
   * Receivers known to hold a value given the enclosing conditions
   */
  private static Set<String> checkedReceivers(List<BoundExpression> path) {
    Set<String> checked = new HashSet<String>();
    for (BoundExpression cond: path) {
      addChecks(cond, checked);
    }
    return checked;
  }

  private static void addChecks(BoundExpression cond, Set<String> checked) {
    if (cond.kind() == BoundExpressionKind.CALL) {
      String target = ((BoundExpression.Call) cond).target();
      if (endsWithAny(target.toLowerCase(), CHECK_SUFFIXES)) {
        String receiver = receiverName(target);
        if (receiver != null) {
          checked.add(receiver);
        }
      }
    } else if (cond.kind() == BoundExpressionKind.BINARY) {
      Binary b = (Binary) cond;
      if (b.op() == BinaryOperator.AND) {
        addChecks(b.left(), checked);
        addChecks(b.right(), checked);
      } else if (b.op() == BinaryOperator.NOT_EQUAL) {
        if (b.left().kind() == BoundExpressionKind.VARIABLE &&
            isNull(b.right())) {
          checked.add(((BoundExpression.Variable) b.left()).name());
        } else if (b.right().kind() == BoundExpressionKind.VARIABLE &&
                   isNull(b.left())) {
          checked.add(((BoundExpression.Variable) b.right()).name());
        }
      }
    }
  }

  private static boolean isNull(BoundExpression e) {
    return e.kind() == BoundExpressionKind.VARIABLE &&
           NULL_NAMES.contains(((BoundExpression.Variable) e).name());
  }
}
