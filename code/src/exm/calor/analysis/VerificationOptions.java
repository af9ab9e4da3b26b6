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
package exm.calor.analysis;

import exm.calor.analysis.bugpatterns.BugPatternOptions;
import exm.calor.analysis.kinduction.KInductionOptions;
import exm.calor.analysis.taint.TaintAnalysisOptions;
import exm.calor.common.Settings;
import exm.calor.common.exceptions.InvalidOptionException;

/**
 * Which verification analyses run, and with what solver budget.
 * Immutable.
 */
public class VerificationOptions {

  public static final int DEFAULT_SOLVER_TIMEOUT_MS = 5000;
  public static final int THOROUGH_SOLVER_TIMEOUT_MS = 10000;

  public static final VerificationOptions DEFAULT =
      new VerificationOptions(true, true, true, false, true,
                              DEFAULT_SOLVER_TIMEOUT_MS, null, null, null);

  /** No solver queries, no loop invariant synthesis */
  public static final VerificationOptions FAST =
      new VerificationOptions(true, true, true, false, false,
                              DEFAULT_SOLVER_TIMEOUT_MS, null, null, null);

  public static final VerificationOptions THOROUGH =
      new VerificationOptions(true, true, true, true, true,
                              THOROUGH_SOLVER_TIMEOUT_MS, null, null, null);

  private final boolean enableDataflow;
  private final boolean enableBugPatterns;
  private final boolean enableTaintAnalysis;
  private final boolean enableKInduction;
  private final boolean useSolverVerification;
  private final int solverTimeoutMs;
  private final BugPatternOptions bugPatternOptions;
  private final TaintAnalysisOptions taintOptions;
  private final KInductionOptions kInductionOptions;

  /**
   * @param bugPatternOptions null for defaults; solver settings here
   *        override its own
   * @param taintOptions null for defaults
   * @param kInductionOptions null for defaults with solverTimeoutMs
   */
  public VerificationOptions(boolean enableDataflow,
      boolean enableBugPatterns, boolean enableTaintAnalysis,
      boolean enableKInduction, boolean useSolverVerification,
      int solverTimeoutMs, BugPatternOptions bugPatternOptions,
      TaintAnalysisOptions taintOptions,
      KInductionOptions kInductionOptions) {
    this.enableDataflow = enableDataflow;
    this.enableBugPatterns = enableBugPatterns;
    this.enableTaintAnalysis = enableTaintAnalysis;
    this.enableKInduction = enableKInduction;
    this.useSolverVerification = useSolverVerification;
    this.solverTimeoutMs = solverTimeoutMs;
    this.bugPatternOptions = bugPatternOptions;
    this.taintOptions = taintOptions;
    this.kInductionOptions = kInductionOptions;
  }

  /**
   * Build options from the calor.verify.* settings
   */
  public static VerificationOptions fromSettings()
                                    throws InvalidOptionException {
    KInductionOptions kOpts = new KInductionOptions(
        Settings.getInt(Settings.K_INDUCTION_MAX_K),
        Settings.getInt(Settings.K_INDUCTION_TIMEOUT_MS), true);
    return new VerificationOptions(
        Settings.getBoolean(Settings.VERIFY_DATAFLOW),
        Settings.getBoolean(Settings.VERIFY_BUG_PATTERNS),
        Settings.getBoolean(Settings.VERIFY_TAINT),
        Settings.getBoolean(Settings.VERIFY_K_INDUCTION),
        Settings.getBoolean(Settings.VERIFY_SOLVER),
        Settings.getInt(Settings.VERIFY_SOLVER_TIMEOUT_MS),
        null, null, kOpts);
  }

  public boolean enableDataflow() {
    return enableDataflow;
  }

  public boolean enableBugPatterns() {
    return enableBugPatterns;
  }

  public boolean enableTaintAnalysis() {
    return enableTaintAnalysis;
  }

  public boolean enableKInduction() {
    return enableKInduction;
  }

  public boolean useSolverVerification() {
    return useSolverVerification;
  }

  public int solverTimeoutMs() {
    return solverTimeoutMs;
  }

  /**
   * @return bug pattern options with this object's solver settings
   */
  public BugPatternOptions bugPatternOptions() {
    BugPatternOptions base = bugPatternOptions != null ?
                      bugPatternOptions : BugPatternOptions.DEFAULT;
    return base.withSolver(useSolverVerification, solverTimeoutMs);
  }

  public TaintAnalysisOptions taintOptions() {
    return taintOptions != null ? taintOptions : TaintAnalysisOptions.DEFAULT;
  }

  public KInductionOptions kInductionOptions() {
    if (kInductionOptions != null) {
      return kInductionOptions;
    }
    return KInductionOptions.DEFAULT.withTimeout(solverTimeoutMs);
  }

  @Override
  public String toString() {
    return "dataflow=" + enableDataflow + " bugPatterns=" + enableBugPatterns
        + " taint=" + enableTaintAnalysis + " kInduction=" + enableKInduction
        + " solver=" + useSolverVerification + " timeoutMs=" + solverTimeoutMs;
  }
}
