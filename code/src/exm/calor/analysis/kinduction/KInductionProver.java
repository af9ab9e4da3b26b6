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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.calor.solver.Formula;
import exm.calor.solver.Solver;
import exm.calor.solver.SolverResult;
import exm.calor.solver.Solvers;

/**
 * Proves loop invariants by k-induction over the loop counter.
 *
 * Base case: the invariant holds whenever the entry condition does.
 * Inductive step: if the guard and invariant hold for k consecutive
 * iterations, the invariant holds after the k-th.  Both are checked by
 * asking the solver for a counterexample; UNSAT means the case holds.
 */
public class KInductionProver {

  private final KInductionOptions options;
  private final Solver solver;
  private final Logger logger;

  public KInductionProver(KInductionOptions options, Solver solver,
                          Logger logger) {
    this.options = options;
    this.solver = solver;
    this.logger = logger;
  }

  public KInductionResult tryProve(LoopContext loop,
                                   InvariantCandidate candidate) {
    long start = System.currentTimeMillis();
    String var = loop.getLoopVariable();
    Formula inv = candidate.getFormula();
    if (!loop.isSupported() || inv == null || loop.getEntry() == null ||
        !InvariantTemplates.mentionsOnly(inv, var)) {
      return result(KInductionStatus.UNSUPPORTED, 0, candidate, null, start);
    }
    if (loop.getStep() == null || loop.getGuard() == null) {
      // Counter update not understood
      return result(KInductionStatus.UNKNOWN, 0, candidate, null, start);
    }

    Formula base = Formula.and(loop.getEntry(), Formula.not(inv));
    SolverResult baseRes = check(base);
    if (baseRes == SolverResult.SAT) {
      return result(KInductionStatus.DISPROVEN, 1, candidate,
                    "Invariant fails at loop entry: " + loop.getEntry(),
                    start);
    } else if (baseRes == SolverResult.UNKNOWN) {
      return result(KInductionStatus.UNKNOWN, 0, candidate, null, start);
    }

    int k;
    for (k = 1; k <= options.maxK(); k++) {
      if (System.currentTimeMillis() - start > options.timeoutMs()) {
        logger.debug("k-induction budget exhausted at k=" + k + " for " +
                     candidate);
        break;
      }
      SolverResult stepRes = check(inductiveStep(loop, inv, k));
      if (stepRes == SolverResult.UNSAT) {
        return result(KInductionStatus.PROVEN, k, candidate, null, start);
      }
    }
    return result(KInductionStatus.UNKNOWN, Math.min(k, options.maxK()),
                  candidate, null, start);
  }

  /**
   * guard(i_0) ∧ inv(i_0) ∧ i_1 = i_0 + step ∧ ... ∧ ¬inv(i_k)
   */
  Formula inductiveStep(LoopContext loop, Formula inv, int k) {
    String var = loop.getLoopVariable();
    Formula step = Formula.intConst(loop.getStep());
    List<Formula> conjuncts = new ArrayList<Formula>();
    for (int j = 0; j < k; j++) {
      Formula cur = iterationVar(var, j);
      conjuncts.add(atIteration(loop.getGuard(), var, j));
      conjuncts.add(atIteration(inv, var, j));
      conjuncts.add(Formula.eq(iterationVar(var, j + 1),
                               Formula.add(cur, step)));
    }
    conjuncts.add(Formula.not(atIteration(inv, var, k)));
    return Formula.and(conjuncts);
  }

  /**
   * Copies of the counter are named var@j, which no source variable
   * can be.  Iteration 0 uses the plain name.
   */
  static Formula iterationVar(String var, int j) {
    return Formula.intVar(j == 0 ? var : var + "@" + j);
  }

  private static Formula atIteration(Formula f, String var, int j) {
    if (j == 0) {
      return f;
    }
    Map<String, Formula> subst = new HashMap<String, Formula>();
    subst.put(var, iterationVar(var, j));
    return f.substitute(subst);
  }

  private SolverResult check(Formula query) {
    return Solvers.check(logger, solver, query, options.timeoutMs());
  }

  private KInductionResult result(KInductionStatus status, int k,
      InvariantCandidate candidate, String counterexample, long start) {
    KInductionResult res = new KInductionResult(status, k, candidate,
        counterexample, System.currentTimeMillis() - start);
    if (logger.isTraceEnabled()) {
      logger.trace("k-induction: " + res);
    }
    return res;
  }
}
