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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import exm.calor.analysis.dataflow.BoundNodes;
import exm.calor.analysis.dataflow.ControlFlowGraph;
import exm.calor.binding.BoundExpression;
import exm.calor.binding.BoundStatement;
import exm.calor.binding.VariableSymbol;
import exm.calor.solver.Formula;
import exm.calor.solver.FormulaTranslator;

/**
 * What is known about a loop for invariant generation and proof:
 * its counter variable, the counter's value on entry, the guard and the
 * per-iteration step.  All formulas are over the counter variable only.
 */
public class LoopContext {

  private final boolean forLoop;
  private final String loopVariable;
  private final Long lowerBound;
  private final Long upperBound;
  private final Long step;
  private final boolean decrementing;
  private final Formula entry;
  private final Formula guard;
  private final Formula condition;
  private final String conditionText;
  private final List<String> modifiedVariables;
  private final List<String> readVariables;
  private final boolean supported;

  private LoopContext(boolean forLoop, String loopVariable, Long lowerBound,
      Long upperBound, Long step, boolean decrementing, Formula entry,
      Formula guard, Formula condition, String conditionText,
      List<String> modifiedVariables, List<String> readVariables,
      boolean supported) {
    this.forLoop = forLoop;
    this.loopVariable = loopVariable;
    this.lowerBound = lowerBound;
    this.upperBound = upperBound;
    this.step = step;
    this.decrementing = decrementing;
    this.entry = entry;
    this.guard = guard;
    this.condition = condition;
    this.conditionText = conditionText;
    this.modifiedVariables = modifiedVariables;
    this.readVariables = readVariables;
    this.supported = supported;
  }

  /**
   * Counted loop: entry is {@code i == from}, guard {@code i < to}.
   * Supported only if both bounds and any step are integer literals.
   * The transition is always {@code i' = i + step}: assignments to the
   * loop variable inside the body are not modelled.
   */
  public static LoopContext forLoop(BoundStatement.For loop) {
    String var = loop.loopVariable().getName();
    Long from = WhileConditionAnalyzer.intValue(loop.from());
    Long to = WhileConditionAnalyzer.intValue(loop.to());
    Long step = loop.step() == null ? Long.valueOf(1) :
                WhileConditionAnalyzer.intValue(loop.step());
    boolean supported = from != null && to != null && step != null;

    Formula v = Formula.intVar(var);
    Formula entry = from == null ? null :
                    Formula.eq(v, Formula.intConst(from));
    Formula guard = to == null ? null : Formula.lt(v, Formula.intConst(to));

    BoundExpression cond = ControlFlowGraph.loopCondition(loop);
    List<String> modified = new ArrayList<String>();
    List<String> read = new ArrayList<String>();
    collect(loop.body(), modified, read);

    return new LoopContext(true, var, from, to, step,
        step != null && step < 0, entry, guard,
        FormulaTranslator.translateCondition(cond),
        WhileConditionAnalyzer.conditionText(cond),
        distinct(modified), distinct(read), supported);
  }

  /**
   * @param initialValue literal value of the counter just before the
   *        loop, or null if unknown
   */
  public static LoopContext whileLoop(BoundStatement.While loop,
                                      Long initialValue) {
    List<String> modified = new ArrayList<String>();
    List<String> read = new ArrayList<String>();
    for (VariableSymbol sym: BoundNodes.usedVariables(loop.condition())) {
      read.add(sym.getName());
    }
    collect(loop.body(), modified, read);
    Formula condition = FormulaTranslator.translateCondition(
                                                loop.condition());
    String conditionText = WhileConditionAnalyzer.conditionText(
                                                loop.condition());

    WhileConditionAnalyzer.WhileLoopInfo info =
                  WhileConditionAnalyzer.analyze(loop.condition());
    if (info == null || !info.isAnalyzable()) {
      return new LoopContext(false, info == null ? null : info.loopVariable,
          null, null, null, false, null, null, condition, conditionText,
          distinct(modified), distinct(read), false);
    }

    String var = info.loopVariable;
    WhileConditionAnalyzer.Transition transition =
          WhileConditionAnalyzer.analyzeTransition(loop.body(), var);
    Long step = transition == null ? null : transition.step();
    boolean decrementing = step != null ? step < 0 : info.decrementing;

    Long lower = info.lowerBound;
    Long upper = info.upperBound;
    if (initialValue != null) {
      if (!decrementing && lower == null) {
        lower = initialValue;
      } else if (decrementing && upper == null) {
        upper = initialValue;
      }
    }

    Formula v = Formula.intVar(var);
    Formula entry;
    if (initialValue != null) {
      entry = Formula.eq(v, Formula.intConst(initialValue));
    } else {
      List<Formula> bounds = new ArrayList<Formula>();
      if (info.lowerBound != null) {
        bounds.add(Formula.ge(v, Formula.intConst(info.lowerBound)));
      }
      if (info.upperBound != null) {
        bounds.add(Formula.le(v, Formula.intConst(info.upperBound)));
      }
      entry = Formula.and(bounds);
    }

    return new LoopContext(false, var, lower, upper, step, decrementing,
        entry, info.guard, condition, conditionText, distinct(modified),
        distinct(read), true);
  }

  private static List<String> distinct(List<String> names) {
    return Collections.unmodifiableList(
            new ArrayList<String>(new LinkedHashSet<String>(names)));
  }

  private static void collect(List<BoundStatement> stmts,
                              List<String> modified, List<String> read) {
    for (BoundStatement stmt: stmts) {
      for (VariableSymbol sym: BoundNodes.usedVariables(stmt)) {
        read.add(sym.getName());
      }
      switch (stmt.kind()) {
        case BIND:
          modified.add(((BoundStatement.Bind) stmt).variable().getName());
          break;
        case ASSIGN:
          modified.add(((BoundStatement.Assign) stmt).variable().getName());
          break;
        case IF: {
          BoundStatement.If ifStmt = (BoundStatement.If) stmt;
          collect(ifStmt.thenBody(), modified, read);
          for (BoundStatement.ElseIf elseIf: ifStmt.elseIfs()) {
            for (VariableSymbol sym: BoundNodes.usedVariables(
                                                  elseIf.condition)) {
              read.add(sym.getName());
            }
            collect(elseIf.body, modified, read);
          }
          if (ifStmt.elseBody() != null) {
            collect(ifStmt.elseBody(), modified, read);
          }
          break;
        }
        case WHILE:
          collect(((BoundStatement.While) stmt).body(), modified, read);
          break;
        case FOR: {
          BoundStatement.For f = (BoundStatement.For) stmt;
          modified.add(f.loopVariable().getName());
          collect(f.body(), modified, read);
          break;
        }
        default:
          break;
      }
    }
  }

  /**
   * @return names of variables assigned anywhere in the statements
   */
  public static Set<String> modifiedIn(List<BoundStatement> stmts) {
    List<String> modified = new ArrayList<String>();
    collect(stmts, modified, new ArrayList<String>());
    return new LinkedHashSet<String>(modified);
  }

  public boolean isForLoop() {
    return forLoop;
  }

  /** Null if no counter was recognised */
  public String getLoopVariable() {
    return loopVariable;
  }

  public Long getLowerBound() {
    return lowerBound;
  }

  public Long getUpperBound() {
    return upperBound;
  }

  public boolean hasKnownBounds() {
    return lowerBound != null && upperBound != null;
  }

  /** Signed change per iteration; null if unknown */
  public Long getStep() {
    return step;
  }

  public boolean isDecrementing() {
    return decrementing;
  }

  /** What holds for the counter on entry; null if nothing */
  public Formula getEntry() {
    return entry;
  }

  /** Loop condition restricted to the counter; null if unknown */
  public Formula getGuard() {
    return guard;
  }

  /** Whole loop condition; null if untranslatable */
  public Formula getCondition() {
    return condition;
  }

  public String getConditionText() {
    return conditionText;
  }

  public List<String> getModifiedVariables() {
    return modifiedVariables;
  }

  public List<String> getReadVariables() {
    return readVariables;
  }

  public boolean isSupported() {
    return supported;
  }

  @Override
  public String toString() {
    return (forLoop ? "for " : "while ") + loopVariable + " [" +
           lowerBound + ", " + upperBound + "] step " + step;
  }
}
