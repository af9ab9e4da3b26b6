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

import org.apache.log4j.Logger;

public class Solvers {

  /**
   * Run a query, treating any failure of the solver as UNKNOWN.
   */
  public static SolverResult check(Logger logger, Solver solver,
                                   Formula query, int timeoutMs) {
    SolverResult res;
    try {
      res = solver.checkSat(query, timeoutMs);
    } catch (RuntimeException e) {
      logger.debug("Solver " + solver.getSolverName() + " failed on " +
                   query + ": " + e, e);
      return SolverResult.UNKNOWN;
    }
    if (res == null) {
      return SolverResult.UNKNOWN;
    }
    if (logger.isTraceEnabled()) {
      logger.trace("checkSat " + query + " => " + res);
    }
    return res;
  }
}
