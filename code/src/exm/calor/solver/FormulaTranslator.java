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
package exm.calor.solver;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import exm.calor.ast.BinaryOperator;
import exm.calor.binding.BoundExpression;
import exm.calor.binding.BoundExpression.Binary;
import exm.calor.binding.BoundExpression.Unary;
import exm.calor.solver.Formula.Sort;

/**
 * Translates bound expressions into solver formulas.
 *
 * Only integer and boolean shapes are translated: floats, strings, calls
 * and bitwise operators give null, and so does any expression containing
 * one of them.
 */
public class FormulaTranslator {

  private static final Set<String> INTEGER_TYPES = new HashSet<String>(
      Arrays.asList("INT", "I8", "I16", "I32", "I64",
                    "U8", "U16", "U32", "U64", "LONG"));

  public static boolean isIntegerType(String typeName) {
    return typeName != null &&
           INTEGER_TYPES.contains(typeName.trim().toUpperCase());
  }

  /**
   * @return [min, max] of a fixed width integer type, or null if unknown.
   *    U64 is clipped to the signed range.
   */
  public static long[] integerRange(String typeName) {
    if (typeName == null) {
      return null;
    }
    String t = typeName.trim().toUpperCase();
    if (t.equals("INT") || t.equals("I32")) {
      return new long[] {Integer.MIN_VALUE, Integer.MAX_VALUE};
    } else if (t.equals("I8")) {
      return new long[] {Byte.MIN_VALUE, Byte.MAX_VALUE};
    } else if (t.equals("I16")) {
      return new long[] {Short.MIN_VALUE, Short.MAX_VALUE};
    } else if (t.equals("I64") || t.equals("LONG")) {
      return new long[] {Long.MIN_VALUE, Long.MAX_VALUE};
    } else if (t.equals("U8")) {
      return new long[] {0, 0xffL};
    } else if (t.equals("U16")) {
      return new long[] {0, 0xffffL};
    } else if (t.equals("U32")) {
      return new long[] {0, 0xffffffffL};
    } else if (t.equals("U64")) {
      return new long[] {0, Long.MAX_VALUE};
    }
    return null;
  }

  /**
   * @return constraint that var lies in the range of its type, or null
   */
  public static Formula rangeConstraint(String typeName, Formula var) {
    long[] range = integerRange(typeName);
    if (range == null) {
      return null;
    }
    return Formula.and(Formula.le(Formula.intConst(range[0]), var),
                       Formula.le(var, Formula.intConst(range[1])));
  }

  /**
   * @return formula, or null if not translatable
   */
  public static Formula translate(BoundExpression e) {
    switch (e.kind()) {
      case INT_LITERAL:
        return Formula.intConst(((BoundExpression.IntLiteral) e).value());
      case BOOL_LITERAL:
        return Formula.boolConst(((BoundExpression.BoolLiteral) e).value());
      case VARIABLE: {
        String type = e.typeName();
        String name = ((BoundExpression.Variable) e).name();
        if ("BOOL".equals(type)) {
          return Formula.boolVar(name);
        } else if (isIntegerType(type)) {
          return Formula.intVar(name);
        }
        return null;
      }
      case BINARY:
        return translateBinary((Binary) e);
      case UNARY:
        return translateUnary((Unary) e);
      default:
        return null;
    }
  }

  /**
   * @return formula of boolean sort, or null
   */
  public static Formula translateCondition(BoundExpression e) {
    Formula f = translate(e);
    if (f == null || f.getSort() != Sort.BOOL) {
      return null;
    }
    return f;
  }

  private static Formula translateBinary(Binary b) {
    Formula l = translate(b.left());
    Formula r = translate(b.right());
    if (l == null || r == null) {
      return null;
    }
    switch (b.op()) {
      case EQUAL:
        return l.getSort() == r.getSort() ? Formula.eq(l, r) : null;
      case NOT_EQUAL:
        return l.getSort() == r.getSort() ? Formula.ne(l, r) : null;
      case AND:
      case OR:
        if (l.getSort() != Sort.BOOL || r.getSort() != Sort.BOOL) {
          return null;
        }
        return b.op() == BinaryOperator.AND ?
                          Formula.and(l, r) : Formula.or(l, r);
      default:
        break;
    }

    if (l.getSort() != Sort.INT || r.getSort() != Sort.INT) {
      return null;
    }
    switch (b.op()) {
      case ADD:
        return Formula.add(l, r);
      case SUBTRACT:
        return Formula.sub(l, r);
      case MULTIPLY:
        return Formula.mul(l, r);
      case DIVIDE:
        return Formula.div(l, r);
      case MODULO:
        return Formula.mod(l, r);
      case LESS_THAN:
        return Formula.lt(l, r);
      case LESS_OR_EQUAL:
        return Formula.le(l, r);
      case GREATER_THAN:
        return Formula.gt(l, r);
      case GREATER_OR_EQUAL:
        return Formula.ge(l, r);
      default:
        return null;
    }
  }

  private static Formula translateUnary(Unary u) {
    Formula operand = translate(u.operand());
    if (operand == null) {
      return null;
    }
    switch (u.op()) {
      case NEGATE:
        return operand.getSort() == Sort.INT ? Formula.neg(operand) : null;
      case NOT:
        return operand.getSort() == Sort.BOOL ? Formula.not(operand) : null;
      default:
        return null;
    }
  }
}
