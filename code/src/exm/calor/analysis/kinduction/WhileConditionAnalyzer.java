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
package exm.calor.analysis.kinduction;

import java.util.List;

import exm.calor.ast.BinaryOperator;
import exm.calor.binding.BoundExpression;
import exm.calor.binding.BoundExpression.BoundExpressionKind;
import exm.calor.binding.BoundStatement;
import exm.calor.solver.Formula;

/**
 * Recovers a counter variable, its bounds and its per-iteration change
 * from a while loop, so the loop can be treated like a counted loop.
 */
public class WhileConditionAnalyzer {

  public static class WhileLoopInfo {
    public final String loopVariable;
    /** Smallest value for which the condition holds, if known */
    public final Long lowerBound;
    /** Bound the variable is compared against from above, if known */
    public final Long upperBound;
    public final boolean decrementing;
    public final String operator;
    /** Condition restricted to the loop variable; null if unknown */
    public final Formula guard;

    public WhileLoopInfo(String loopVariable, Long lowerBound,
        Long upperBound, boolean decrementing, String operator,
        Formula guard) {
      this.loopVariable = loopVariable;
      this.lowerBound = lowerBound;
      this.upperBound = upperBound;
      this.decrementing = decrementing;
      this.operator = operator;
      this.guard = guard;
    }

    public boolean isAnalyzable() {
      return loopVariable != null &&
             (lowerBound != null || upperBound != null);
    }

    @Override
    public String toString() {
      return loopVariable + " " + operator + " [" + lowerBound + ", " +
             upperBound + "]" + (decrementing ? " decrementing" : "");
    }
  }

  public static enum TransitionKind {
    INCREMENT, DECREMENT, ADD_CONSTANT, SUB_CONSTANT;
  }

  public static class Transition {
    public final String variable;
    public final TransitionKind kind;
    /** Magnitude of the change */
    public final long delta;

    public Transition(String variable, TransitionKind kind, long delta) {
      this.variable = variable;
      this.kind = kind;
      this.delta = delta;
    }

    /**
     * @return signed change applied each iteration
     */
    public long step() {
      switch (kind) {
        case DECREMENT:
        case SUB_CONSTANT:
          return -delta;
        default:
          return delta;
      }
    }

    @Override
    public String toString() {
      return variable + " " + kind + " " + delta;
    }
  }

  /**
   * @return null if the condition has no recognisable counter shape
   */
  public static WhileLoopInfo analyze(BoundExpression condition) {
    if (condition.kind() != BoundExpressionKind.BINARY) {
      return null;
    }
    BoundExpression.Binary bin = (BoundExpression.Binary) condition;
    switch (bin.op()) {
      case AND:
        return analyzeConjunction(bin);
      case LESS_THAN:
      case LESS_OR_EQUAL:
      case GREATER_THAN:
      case GREATER_OR_EQUAL:
        return analyzeComparison(bin);
      case NOT_EQUAL:
        return analyzeNotEqual(bin);
      default:
        return null;
    }
  }

  private static WhileLoopInfo analyzeConjunction(BoundExpression.Binary bin) {
    WhileLoopInfo left = analyze(bin.left());
    WhileLoopInfo right = analyze(bin.right());
    if (left != null && right != null &&
        left.loopVariable.equals(right.loopVariable)) {
      Formula guard;
      if (left.guard != null && right.guard != null) {
        guard = Formula.and(left.guard, right.guard);
      } else {
        guard = left.guard != null ? left.guard : right.guard;
      }
      return new WhileLoopInfo(left.loopVariable,
          left.lowerBound != null ? left.lowerBound : right.lowerBound,
          left.upperBound != null ? left.upperBound : right.upperBound,
          left.decrementing || right.decrementing, left.operator, guard);
    }
    return left != null ? left : right;
  }

  private static WhileLoopInfo analyzeComparison(BoundExpression.Binary bin) {
    String var = variableName(bin.left());
    Long c = intValue(bin.right());
    BinaryOperator op = bin.op();
    if (var == null) {
      // Normalise "c < i" to "i > c" and so on
      var = variableName(bin.right());
      c = intValue(bin.left());
      if (var == null || c == null) {
        return null;
      }
      op = flip(op);
    }

    Formula v = Formula.intVar(var);
    Formula guard = null;
    Long lower = null, upper = null;
    boolean decrementing;
    switch (op) {
      case LESS_THAN:
        upper = c;
        decrementing = false;
        if (c != null) {
          guard = Formula.lt(v, Formula.intConst(c));
        }
        break;
      case LESS_OR_EQUAL:
        upper = c;
        decrementing = false;
        if (c != null) {
          guard = Formula.le(v, Formula.intConst(c));
        }
        break;
      case GREATER_THAN:
        lower = c != null ? c + 1 : null;
        decrementing = true;
        if (c != null) {
          guard = Formula.gt(v, Formula.intConst(c));
        }
        break;
      case GREATER_OR_EQUAL:
        lower = c;
        decrementing = true;
        if (c != null) {
          guard = Formula.ge(v, Formula.intConst(c));
        }
        break;
      default:
        return null;
    }
    return new WhileLoopInfo(var, lower, upper, decrementing, op.symbol(),
                             guard);
  }

  private static BinaryOperator flip(BinaryOperator op) {
    switch (op) {
      case LESS_THAN:
        return BinaryOperator.GREATER_THAN;
      case LESS_OR_EQUAL:
        return BinaryOperator.GREATER_OR_EQUAL;
      case GREATER_THAN:
        return BinaryOperator.LESS_THAN;
      case GREATER_OR_EQUAL:
        return BinaryOperator.LESS_OR_EQUAL;
      default:
        return op;
    }
  }

  private static WhileLoopInfo analyzeNotEqual(BoundExpression.Binary bin) {
    String var = variableName(bin.left());
    Long c = intValue(bin.right());
    if (var == null) {
      var = variableName(bin.right());
      c = intValue(bin.left());
    }
    if (var == null) {
      return null;
    }
    Formula guard = c == null ? null :
          Formula.ne(Formula.intVar(var), Formula.intConst(c));
    return new WhileLoopInfo(var, null, c, false, "!=", guard);
  }

  /**
   * Find the first update of the loop variable of the form
   * {@code v = v + c}, {@code v = c + v} or {@code v = v - c}, looking
   * into nested blocks.
   *
   * Only that first update is modelled: later updates of the variable,
   * or updates on other branches, are ignored, so an invariant proven
   * for a body with several updates may not hold.
   * @return null if none found
   */
  public static Transition analyzeTransition(List<BoundStatement> body,
                                             String loopVariable) {
    for (BoundStatement stmt: body) {
      Transition t = statementTransition(stmt, loopVariable);
      if (t != null) {
        return t;
      }
    }
    return null;
  }

  private static Transition statementTransition(BoundStatement stmt,
                                                String loopVariable) {
    switch (stmt.kind()) {
      case BIND: {
        BoundStatement.Bind bind = (BoundStatement.Bind) stmt;
        if (bind.variable().getName().equals(loopVariable) &&
            bind.initializer() != null) {
          return updateTransition(bind.initializer(), loopVariable);
        }
        return null;
      }
      case ASSIGN: {
        BoundStatement.Assign assign = (BoundStatement.Assign) stmt;
        if (assign.variable().getName().equals(loopVariable)) {
          return updateTransition(assign.value(), loopVariable);
        }
        return null;
      }
      case IF: {
        BoundStatement.If ifStmt = (BoundStatement.If) stmt;
        Transition t = analyzeTransition(ifStmt.thenBody(), loopVariable);
        for (BoundStatement.ElseIf elseIf: ifStmt.elseIfs()) {
          if (t == null) {
            t = analyzeTransition(elseIf.body, loopVariable);
          }
        }
        if (t == null && ifStmt.elseBody() != null) {
          t = analyzeTransition(ifStmt.elseBody(), loopVariable);
        }
        return t;
      }
      case WHILE:
        return analyzeTransition(((BoundStatement.While) stmt).body(),
                                 loopVariable);
      case FOR:
        return analyzeTransition(((BoundStatement.For) stmt).body(),
                                 loopVariable);
      default:
        return null;
    }
  }

  private static Transition updateTransition(BoundExpression value,
                                             String loopVariable) {
    if (value.kind() != BoundExpressionKind.BINARY) {
      return null;
    }
    BoundExpression.Binary bin = (BoundExpression.Binary) value;
    Long delta;
    if (loopVariable.equals(variableName(bin.left()))) {
      delta = intValue(bin.right());
    } else if (loopVariable.equals(variableName(bin.right())) &&
               bin.op() == BinaryOperator.ADD) {
      delta = intValue(bin.left());
    } else {
      return null;
    }
    if (delta == null) {
      return null;
    }
    if (bin.op() == BinaryOperator.ADD) {
      return new Transition(loopVariable, delta == 1 ?
          TransitionKind.INCREMENT : TransitionKind.ADD_CONSTANT, delta);
    } else if (bin.op() == BinaryOperator.SUBTRACT) {
      return new Transition(loopVariable, delta == 1 ?
          TransitionKind.DECREMENT : TransitionKind.SUB_CONSTANT, delta);
    }
    return null;
  }

  /**
   * Render a condition over variables and integer literals, e.g.
   * "i < 10 && i >= 0".
   * @return null for other shapes
   */
  public static String conditionText(BoundExpression e) {
    switch (e.kind()) {
      case VARIABLE:
        return ((BoundExpression.Variable) e).name();
      case INT_LITERAL:
        return Long.toString(((BoundExpression.IntLiteral) e).value());
      case BINARY: {
        BoundExpression.Binary bin = (BoundExpression.Binary) e;
        String left = conditionText(bin.left());
        String right = conditionText(bin.right());
        if (left == null || right == null) {
          return null;
        }
        return left + " " + bin.op().symbol() + " " + right;
      }
      default:
        return null;
    }
  }

  static String variableName(BoundExpression e) {
    if (e.kind() == BoundExpressionKind.VARIABLE) {
      return ((BoundExpression.Variable) e).name();
    }
    return null;
  }

  static Long intValue(BoundExpression e) {
    if (e.kind() == BoundExpressionKind.INT_LITERAL) {
      return ((BoundExpression.IntLiteral) e).value();
    }
    return null;
  }
}
