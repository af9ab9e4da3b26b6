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

/**
 * Which bug pattern checkers run, and how.  Immutable.
 */
public class BugPatternOptions {
  public static final int DEFAULT_SOLVER_TIMEOUT_MS = 5000;

  public static final BugPatternOptions DEFAULT = new BugPatternOptions();

  private final boolean useSolverVerification;
  private final int solverTimeoutMs;
  private final boolean checkDivisionByZero;
  private final boolean checkIndexOutOfBounds;
  private final boolean checkNullDereference;
  private final boolean checkOverflow;

  public BugPatternOptions(boolean useSolverVerification, int solverTimeoutMs,
      boolean checkDivisionByZero, boolean checkIndexOutOfBounds,
      boolean checkNullDereference, boolean checkOverflow) {
    this.useSolverVerification = useSolverVerification;
    this.solverTimeoutMs = solverTimeoutMs;
    this.checkDivisionByZero = checkDivisionByZero;
    this.checkIndexOutOfBounds = checkIndexOutOfBounds;
    this.checkNullDereference = checkNullDereference;
    this.checkOverflow = checkOverflow;
  }

  public BugPatternOptions() {
    this(true, DEFAULT_SOLVER_TIMEOUT_MS, true, true, true, true);
  }

  public BugPatternOptions withSolver(boolean useSolver, int timeoutMs) {
    return new BugPatternOptions(useSolver, timeoutMs, checkDivisionByZero,
        checkIndexOutOfBounds, checkNullDereference, checkOverflow);
  }

  public boolean useSolverVerification() {
    return useSolverVerification;
  }

  public int solverTimeoutMs() {
    return solverTimeoutMs;
  }

  public boolean checkDivisionByZero() {
    return checkDivisionByZero;
  }

  public boolean checkIndexOutOfBounds() {
    return checkIndexOutOfBounds;
  }

  public boolean checkNullDereference() {
    return checkNullDereference;
  }

  public boolean checkOverflow() {
    return checkOverflow;
  }

  @Override
  public String toString() {
    return "solver=" + useSolverVerification + " timeout=" + solverTimeoutMs +
           " divzero=" + checkDivisionByZero + " bounds=" +
           checkIndexOutOfBounds + " null=" + checkNullDereference +
           " overflow=" + checkOverflow;
  }
}
