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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides queries by trying every assignment of integer variables in
 * [-RADIUS, RADIUS].  Only good for the small queries tests make:
 * UNSAT means no model in that range.
 */
public class BoundedSearchSolver implements Solver {
  public static final int RADIUS = 25;
  public static final int MAX_INT_VARS = 3;

  private int queries = 0;

  @Override
  public SolverResult checkSat(Formula query, int timeoutMs) {
    queries++;
    Map<String, Formula.Sort> vars = new LinkedHashMap<String, Formula.Sort>();
    collectVars(query, vars);
    List<String> names = new ArrayList<String>(vars.keySet());
    int intVars = 0;
    for (Formula.Sort s: vars.values()) {
      if (s == Formula.Sort.INT) {
        intVars++;
      }
    }
    if (intVars > MAX_INT_VARS) {
      return SolverResult.UNKNOWN;
    }
    return search(query, names, vars, 0, new HashMap<String, Object>()) ?
           SolverResult.SAT : SolverResult.UNSAT;
  }

  @Override
  public String getSolverName() {
    return "bounded-search";
  }

  public int getQueryCount() {
    return queries;
  }

  private static void collectVars(Formula f, Map<String, Formula.Sort> acc) {
    if (f.isVar()) {
      acc.put(f.getName(), f.getSort());
    }
    for (Formula arg: f.getArgs()) {
      collectVars(arg, acc);
    }
  }

  private static boolean search(Formula query, List<String> names,
      Map<String, Formula.Sort> sorts, int i, Map<String, Object> env) {
    if (i == names.size()) {
      try {
        return (Boolean) eval(query, env);
      } catch (ArithmeticException e) {
        // Division by zero: not a model
        return false;
      }
    }
    String name = names.get(i);
    if (sorts.get(name) == Formula.Sort.BOOL) {
      for (boolean b: new boolean[] {false, true}) {
        env.put(name, b);
        if (search(query, names, sorts, i + 1, env)) {
          return true;
        }
      }
    } else {
      for (long v = -RADIUS; v <= RADIUS; v++) {
        env.put(name, v);
        if (search(query, names, sorts, i + 1, env)) {
          return true;
        }
      }
    }
    return false;
  }

  static Object eval(Formula f, Map<String, Object> env) {
    List<Formula> a = f.getArgs();
    switch (f.getOp()) {
      case VAR:
        return env.get(f.getName());
      case INT_CONST:
        return f.getIntValue();
      case BOOL_CONST:
        return f.getBoolValue();
      case ADD:
        return num(a.get(0), env) + num(a.get(1), env);
      case SUB:
        return num(a.get(0), env) - num(a.get(1), env);
      case MUL:
        return num(a.get(0), env) * num(a.get(1), env);
      case DIV:
        return num(a.get(0), env) / num(a.get(1), env);
      case MOD:
        return num(a.get(0), env) % num(a.get(1), env);
      case NEG:
        return -num(a.get(0), env);
      case EQ:
        return eval(a.get(0), env).equals(eval(a.get(1), env));
      case NE:
        return !eval(a.get(0), env).equals(eval(a.get(1), env));
      case LT:
        return num(a.get(0), env) < num(a.get(1), env);
      case LE:
        return num(a.get(0), env) <= num(a.get(1), env);
      case GT:
        return num(a.get(0), env) > num(a.get(1), env);
      case GE:
        return num(a.get(0), env) >= num(a.get(1), env);
      case NOT:
        return !bool(a.get(0), env);
      case AND:
        for (Formula arg: a) {
          if (!bool(arg, env)) {
            return false;
          }
        }
        return true;
      case OR:
        for (Formula arg: a) {
          if (bool(arg, env)) {
            return true;
          }
        }
        return false;
      case IMPLIES:
        return !bool(a.get(0), env) || bool(a.get(1), env);
      default:
        throw new IllegalArgumentException("Unexpected op " + f.getOp());
    }
  }

  private static long num(Formula f, Map<String, Object> env) {
    return (Long) eval(f, env);
  }

  private static boolean bool(Formula f, Map<String, Object> env) {
    return (Boolean) eval(f, env);
  }
}
