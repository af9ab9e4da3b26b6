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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import exm.calor.solver.Formula;

/**
 * Shapes of loop invariant commonly worth trying.  Each template turns a
 * {@link LoopContext} into a candidate, or null where it does not apply.
 */
public class InvariantTemplates {

  public static abstract class Template {
    private final String name;
    private final String description;

    public Template(String name, String description) {
      this.name = name;
      this.description = description;
    }

    public String getName() {
      return name;
    }

    public String getDescription() {
      return description;
    }

    public abstract InvariantCandidate generate(LoopContext ctx);

    protected InvariantCandidate candidate(String text, Formula formula) {
      return new InvariantCandidate(name, text, formula);
    }
  }

  private static final String[] ACCUMULATOR_NAMES = {
    "sum", "total", "count", "acc"
  };

  /** lo <= i && i <= hi */
  public static final Template BOUNDED_LOOP_VARIABLE =
        new Template("BoundedLoopVariable",
                     "Loop variable is within loop bounds") {
    @Override
    public InvariantCandidate generate(LoopContext ctx) {
      String i = ctx.getLoopVariable();
      if (i == null || !ctx.hasKnownBounds()) {
        return null;
      }
      long lo = ctx.getLowerBound(), hi = ctx.getUpperBound();
      Formula v = Formula.intVar(i);
      return candidate(lo + " <= " + i + " && " + i + " <= " + hi,
          Formula.and(Formula.le(Formula.intConst(lo), v),
                      Formula.le(v, Formula.intConst(hi))));
    }
  };

  /** i >= lo for a counter that only grows */
  public static final Template MONOTONICALLY_INCREASING =
        new Template("MonotonicallyIncreasing",
                     "Loop variable never drops below its start") {
    @Override
    public InvariantCandidate generate(LoopContext ctx) {
      String i = ctx.getLoopVariable();
      Long step = ctx.getStep();
      if (i == null || ctx.getLowerBound() == null || step == null ||
          step <= 0) {
        return null;
      }
      long lo = ctx.getLowerBound();
      return candidate(i + " >= " + lo,
          Formula.ge(Formula.intVar(i), Formula.intConst(lo)));
    }
  };

  public static final Template ACCUMULATOR_NON_NEGATIVE =
        new Template("AccumulatorNonNegative",
                     "Accumulator variable remains non-negative") {
    @Override
    public InvariantCandidate generate(LoopContext ctx) {
      for (String v: ctx.getModifiedVariables()) {
        if (v.equals(ctx.getLoopVariable())) {
          continue;
        }
        for (String acc: ACCUMULATOR_NAMES) {
          if (StringUtils.containsIgnoreCase(v, acc)) {
            return candidate(v + " >= 0",
                Formula.ge(Formula.intVar(v), Formula.intConst(0)));
          }
        }
      }
      return null;
    }
  };

  /** hi - i >= 0: the distance to the bound is a variant */
  public static final Template TERMINATION_DECREASING =
        new Template("TerminationDecreasing",
                     "Distance to the upper bound stays non-negative") {
    @Override
    public InvariantCandidate generate(LoopContext ctx) {
      String i = ctx.getLoopVariable();
      if (i == null || ctx.getUpperBound() == null) {
        return null;
      }
      long hi = ctx.getUpperBound();
      return candidate(hi + " - " + i + " >= 0",
          Formula.ge(Formula.sub(Formula.intConst(hi), Formula.intVar(i)),
                     Formula.intConst(0)));
    }
  };

  public static final Template WHILE_INCREMENTING =
        new Template("WhileIncrementing",
                     "While loop variable stays above its lower bound") {
    @Override
    public InvariantCandidate generate(LoopContext ctx) {
      String i = ctx.getLoopVariable();
      if (ctx.isForLoop() || i == null) {
        return null;
      }
      long lo = ctx.getLowerBound() != null ? ctx.getLowerBound() : 0;
      return candidate(i + " >= " + lo,
          Formula.ge(Formula.intVar(i), Formula.intConst(lo)));
    }
  };

  public static final Template WHILE_DECREMENTING =
        new Template("WhileDecrementing",
                     "While loop variable stays non-negative counting down") {
    @Override
    public InvariantCandidate generate(LoopContext ctx) {
      String i = ctx.getLoopVariable();
      if (ctx.isForLoop() || i == null || !ctx.isDecrementing()) {
        return null;
      }
      long lo = ctx.getLowerBound() != null ? ctx.getLowerBound() - 1 : 0;
      return candidate(i + " >= " + lo,
          Formula.ge(Formula.intVar(i), Formula.intConst(lo)));
    }
  };

  public static final Template WHILE_CONDITION =
        new Template("WhileConditionAsInvariant",
                     "Loop condition itself") {
    @Override
    public InvariantCandidate generate(LoopContext ctx) {
      if (ctx.isForLoop() || ctx.getCondition() == null ||
          ctx.getConditionText() == null) {
        return null;
      }
      return candidate(ctx.getConditionText(), ctx.getCondition());
    }
  };

  public static final List<Template> ALL = Collections.unmodifiableList(
      Arrays.asList(BOUNDED_LOOP_VARIABLE, MONOTONICALLY_INCREASING,
                    ACCUMULATOR_NON_NEGATIVE, TERMINATION_DECREASING,
                    WHILE_INCREMENTING, WHILE_DECREMENTING, WHILE_CONDITION));

  /** Templates that only restate the loop's own range */
  public static final List<Template> BASIC = Collections.unmodifiableList(
      Arrays.asList(BOUNDED_LOOP_VARIABLE, WHILE_CONDITION));

  /**
   * @return distinct candidates in template order
   */
  public static List<InvariantCandidate> candidates(LoopContext ctx,
                                                    boolean useAll) {
    Map<String, InvariantCandidate> res =
                        new LinkedHashMap<String, InvariantCandidate>();
    for (Template t: useAll ? ALL : BASIC) {
      InvariantCandidate c = t.generate(ctx);
      if (c != null && !res.containsKey(c.getText())) {
        res.put(c.getText(), c);
      }
    }
    return new ArrayList<InvariantCandidate>(res.values());
  }

  /**
   * Conjoin the candidates that mention only the loop variable.
   * @return null if fewer than two such candidates
   */
  public static InvariantCandidate combine(LoopContext ctx,
                                           List<InvariantCandidate> cands) {
    List<String> texts = new ArrayList<String>();
    List<Formula> formulas = new ArrayList<Formula>();
    for (InvariantCandidate c: cands) {
      if (mentionsOnly(c.getFormula(), ctx.getLoopVariable())) {
        texts.add(c.getText());
        formulas.add(c.getFormula());
      }
    }
    if (formulas.size() < 2) {
      return null;
    }
    return new InvariantCandidate("Combined", StringUtils.join(texts, " && "),
                                  Formula.and(formulas));
  }

  static boolean mentionsOnly(Formula f, String var) {
    for (String name: f.freeVariables()) {
      if (!name.equals(var)) {
        return false;
      }
    }
    return true;
  }
}
