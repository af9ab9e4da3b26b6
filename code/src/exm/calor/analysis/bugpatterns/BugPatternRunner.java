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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.calor.binding.BoundTree.BoundFunction;
import exm.calor.diagnostics.DiagnosticBag;
import exm.calor.solver.Solver;

/**
 * Runs the enabled bug pattern checkers over functions.
 */
public class BugPatternRunner {

  private final Logger logger;
  private final List<BugPatternChecker> checkers;

  public BugPatternRunner(BugPatternOptions options, Solver solver,
                          Logger logger) {
    this.logger = logger;
    List<BugPatternChecker> cs = new ArrayList<BugPatternChecker>();
    if (options.checkDivisionByZero()) {
      cs.add(new DivisionByZeroChecker(options, solver, logger));
    }
    if (options.checkIndexOutOfBounds()) {
      cs.add(new IndexOutOfBoundsChecker(options, solver, logger));
    }
    if (options.checkNullDereference()) {
      cs.add(new NullDereferenceChecker(options, solver, logger));
    }
    if (options.checkOverflow()) {
      cs.add(new OverflowChecker(options, solver, logger));
    }
    this.checkers = Collections.unmodifiableList(cs);
  }

  public List<BugPatternChecker> getCheckers() {
    return checkers;
  }

  /**
   * @return number of diagnostics added
   */
  public int run(BoundFunction function, DiagnosticBag diagnostics) {
    int before = diagnostics.size();
    for (BugPatternChecker checker: checkers) {
      if (logger.isTraceEnabled()) {
        logger.trace("Running " + checker.getName() + " on " +
                     function.getName());
      }
      checker.check(function, diagnostics);
    }
    return diagnostics.size() - before;
  }
}
