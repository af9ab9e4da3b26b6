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

import org.apache.log4j.Logger;

import exm.calor.solver.Solver;

/**
 * Tries candidate invariants for a loop, most specific first, then
 * their conjunction, and keeps the first one proven.
 */
public class LoopInvariantSynthesizer {

  private final KInductionOptions options;
  private final KInductionProver prover;
  private final Logger logger;

  public LoopInvariantSynthesizer(KInductionOptions options, Solver solver,
                                  Logger logger) {
    this.options = options;
    this.prover = new KInductionProver(options, solver, logger);
    this.logger = logger;
  }

  public LoopInvariantResult synthesize(LoopContext loop) {
    if (!loop.isSupported()) {
      return LoopInvariantResult.unsupported(loop.isForLoop() ?
          "Loop bounds are not constant, unsupported" :
          "While loop condition could not be analyzed, unsupported");
    }

    List<InvariantCandidate> candidates =
          InvariantTemplates.candidates(loop, options.useInvariantTemplates());
    if (logger.isTraceEnabled()) {
      logger.trace("Candidates for " + loop + ": " + candidates);
    }
    for (InvariantCandidate c: candidates) {
      KInductionResult r = prover.tryProve(loop, c);
      if (r.isProven()) {
        return LoopInvariantResult.synthesized(r);
      }
    }

    InvariantCandidate combined = InvariantTemplates.combine(loop, candidates);
    if (combined != null) {
      KInductionResult r = prover.tryProve(loop, combined);
      if (r.isProven()) {
        return LoopInvariantResult.synthesized(r);
      }
    }

    if (loop.isForLoop()) {
      return LoopInvariantResult.failed(
          "Could not synthesize invariant for loop variable '" +
          loop.getLoopVariable() + "'");
    } else {
      return LoopInvariantResult.failed(
          "Could not synthesize invariant for while loop with variable '" +
          loop.getLoopVariable() + "'");
    }
  }
}
