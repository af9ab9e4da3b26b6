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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.calor.common.exceptions.CalorRuntimeError;

/**
 * Immutable term for solver queries over integers and booleans.
 *
 * Variables carry a sort.  Terms print as S-expressions, e.g.
 * {@code (and (>= i 0) (< i n))}.
 */
public class Formula {

  public static enum Sort {
    INT,
    BOOL,
  }

  public static enum Op {
    VAR(null),
    INT_CONST(null),
    BOOL_CONST(null),
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("div"),
    MOD("mod"),
    NEG("-"),
    EQ("="),
    NE("distinct"),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    NOT("not"),
    AND("and"),
    OR("or"),
    IMPLIES("=>");

    private final String symbol;

    private Op(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  public static final Formula TRUE = new Formula(Op.BOOL_CONST, Sort.BOOL,
                                                 null, 1, null);
  public static final Formula FALSE = new Formula(Op.BOOL_CONST, Sort.BOOL,
                                                  null, 0, null);

  public final Op op;
  private final Sort sort;
  private final String name;
  private final long value;
  private final List<Formula> args;

  private Formula(Op op, Sort sort, String name, long value,
                  List<Formula> args) {
    this.op = op;
    this.sort = sort;
    this.name = name;
    this.value = value;
    this.args = args == null ? Collections.<Formula>emptyList()
                  : Collections.unmodifiableList(new ArrayList<Formula>(args));
  }

  public static Formula intVar(String name) {
    return new Formula(Op.VAR, Sort.INT, name, 0, null);
  }

  public static Formula boolVar(String name) {
    return new Formula(Op.VAR, Sort.BOOL, name, 0, null);
  }

  public static Formula intConst(long value) {
    return new Formula(Op.INT_CONST, Sort.INT, null, value, null);
  }

  public static Formula boolConst(boolean value) {
    return value ? TRUE : FALSE;
  }

  private static Formula arith(Op op, Formula... args) {
    for (Formula arg: args) {
      checkSort(op, arg, Sort.INT);
    }
    return new Formula(op, Sort.INT, null, 0, Arrays.asList(args));
  }

  private static Formula compare(Op op, Formula left, Formula right) {
    if (op != Op.EQ && op != Op.NE) {
      checkSort(op, left, Sort.INT);
      checkSort(op, right, Sort.INT);
    } else if (left.sort != right.sort) {
      throw new CalorRuntimeError("Mismatched sorts for " + op + ": "
                                  + left + ", " + right);
    }
    return new Formula(op, Sort.BOOL, null, 0, Arrays.asList(left, right));
  }

  private static void checkSort(Op op, Formula arg, Sort expected) {
    if (arg.sort != expected) {
      throw new CalorRuntimeError("Operand of " + op + " must be " +
                                  expected + ": " + arg);
    }
  }

  public static Formula add(Formula left, Formula right) {
    return arith(Op.ADD, left, right);
  }

  public static Formula sub(Formula left, Formula right) {
    return arith(Op.SUB, left, right);
  }

  public static Formula mul(Formula left, Formula right) {
    return arith(Op.MUL, left, right);
  }

  public static Formula div(Formula left, Formula right) {
    return arith(Op.DIV, left, right);
  }

  public static Formula mod(Formula left, Formula right) {
    return arith(Op.MOD, left, right);
  }

  public static Formula neg(Formula operand) {
    return arith(Op.NEG, operand);
  }

  public static Formula eq(Formula left, Formula right) {
    return compare(Op.EQ, left, right);
  }

  public static Formula ne(Formula left, Formula right) {
    return compare(Op.NE, left, right);
  }

  public static Formula lt(Formula left, Formula right) {
    return compare(Op.LT, left, right);
  }

  public static Formula le(Formula left, Formula right) {
    return compare(Op.LE, left, right);
  }

  public static Formula gt(Formula left, Formula right) {
    return compare(Op.GT, left, right);
  }

  public static Formula ge(Formula left, Formula right) {
    return compare(Op.GE, left, right);
  }

  public static Formula not(Formula operand) {
    checkSort(Op.NOT, operand, Sort.BOOL);
    return new Formula(Op.NOT, Sort.BOOL, null, 0, Arrays.asList(operand));
  }

  public static Formula implies(Formula antecedent, Formula consequent) {
    checkSort(Op.IMPLIES, antecedent, Sort.BOOL);
    checkSort(Op.IMPLIES, consequent, Sort.BOOL);
    return new Formula(Op.IMPLIES, Sort.BOOL, null, 0,
                       Arrays.asList(antecedent, consequent));
  }

  public static Formula and(Formula... conjuncts) {
    return and(Arrays.asList(conjuncts));
  }

  /**
   * @return conjunction, TRUE if empty, the single element if only one
   */
  public static Formula and(List<Formula> conjuncts) {
    return junction(Op.AND, conjuncts, TRUE);
  }

  public static Formula or(Formula... disjuncts) {
    return or(Arrays.asList(disjuncts));
  }

  public static Formula or(List<Formula> disjuncts) {
    return junction(Op.OR, disjuncts, FALSE);
  }

  private static Formula junction(Op op, List<Formula> parts, Formula empty) {
    if (parts.isEmpty()) {
      return empty;
    } else if (parts.size() == 1) {
      return parts.get(0);
    }
    for (Formula part: parts) {
      checkSort(op, part, Sort.BOOL);
    }
    return new Formula(op, Sort.BOOL, null, 0, parts);
  }

  public Op getOp() {
    return op;
  }

  public Sort getSort() {
    return sort;
  }

  public boolean isVar() {
    return op == Op.VAR;
  }

  public boolean isConst() {
    return op == Op.INT_CONST || op == Op.BOOL_CONST;
  }

  public String getName() {
    if (op != Op.VAR) {
      throw new CalorRuntimeError("Not a variable: " + this);
    }
    return name;
  }

  public long getIntValue() {
    if (op != Op.INT_CONST) {
      throw new CalorRuntimeError("Not an integer constant: " + this);
    }
    return value;
  }

  public boolean getBoolValue() {
    if (op != Op.BOOL_CONST) {
      throw new CalorRuntimeError("Not a boolean constant: " + this);
    }
    return value != 0;
  }

  public List<Formula> getArgs() {
    return args;
  }

  /**
   * @return names of variables in this term, in order of appearance
   */
  public Set<String> freeVariables() {
    Set<String> res = new LinkedHashSet<String>();
    collectVariables(res);
    return res;
  }

  private void collectVariables(Set<String> acc) {
    if (op == Op.VAR) {
      acc.add(name);
    }
    for (Formula arg: args) {
      arg.collectVariables(acc);
    }
  }

  /**
   * Replace variables by name.  Variables not in the map are kept.
   */
  public Formula substitute(Map<String, Formula> replacements) {
    if (op == Op.VAR) {
      Formula repl = replacements.get(name);
      if (repl == null) {
        return this;
      }
      if (repl.sort != sort) {
        throw new CalorRuntimeError("Substituting " + repl + " of sort " +
                    repl.sort + " for " + name + " of sort " + sort);
      }
      return repl;
    } else if (args.isEmpty()) {
      return this;
    }
    List<Formula> newArgs = new ArrayList<Formula>(args.size());
    for (Formula arg: args) {
      newArgs.add(arg.substitute(replacements));
    }
    return new Formula(op, sort, name, value, newArgs);
  }

  @Override
  public String toString() {
    switch (op) {
      case VAR:
        return name;
      case INT_CONST:
        return value < 0 ? "(- " + (-value) + ")" : Long.toString(value);
      case BOOL_CONST:
        return value != 0 ? "true" : "false";
      default:
        StringBuilder sb = new StringBuilder();
        sb.append('(').append(op.symbol());
        for (Formula arg: args) {
          sb.append(' ').append(arg);
        }
        sb.append(')');
        return sb.toString();
    }
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Formula)) {
      return false;
    }
    Formula f = (Formula) other;
    if (op != f.op || sort != f.sort || value != f.value) {
      return false;
    }
    if (name == null ? f.name != null : !name.equals(f.name)) {
      return false;
    }
    return args.equals(f.args);
  }

  @Override
  public int hashCode() {
    int h = op.hashCode();
    h = 31 * h + sort.hashCode();
    h = 31 * h + (name == null ? 0 : name.hashCode());
    h = 31 * h + (int) (value ^ (value >>> 32));
    return 31 * h + args.hashCode();
  }
}
