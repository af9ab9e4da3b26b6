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

import org.apache.log4j.Logger;

import exm.calor.analysis.bugpatterns.BugPatternRunner;
import exm.calor.analysis.kinduction.LoopAnalysisRunner;
import exm.calor.analysis.taint.TaintAnalysis;
import exm.calor.ast.SyntaxTree;
import exm.calor.binding.Binder;
import exm.calor.binding.BoundTree.BoundFunction;
import exm.calor.binding.BoundTree.BoundModule;
import exm.calor.common.Logging;
import exm.calor.common.Settings;
import exm.calor.common.exceptions.InvalidOptionException;
import exm.calor.diagnostics.DiagnosticBag;
import exm.calor.solver.Solver;
import exm.calor.solver.UnknownSolver;

/**
 * Runs the enabled verification analyses over every function of a
 * module.  Functions are analysed independently; per-function counts
 * are summed once all functions are done.
 */
public class VerificationAnalysisPass {

  private final DiagnosticBag diagnostics;
  private final VerificationOptions options;
  private final Solver solver;
  private final Logger logger;

  public VerificationAnalysisPass(DiagnosticBag diagnostics,
      VerificationOptions options, Solver solver, Logger logger) {
    this.diagnostics = diagnostics;
    this.options = options;
    this.solver = solver;
    this.logger = logger;
  }

  public VerificationAnalysisPass(DiagnosticBag diagnostics,
      VerificationOptions options, Solver solver) {
    this(diagnostics, options, solver, Logging.getCalorLogger());
  }

  public VerificationAnalysisPass(DiagnosticBag diagnostics,
                                  VerificationOptions options) {
    this(diagnostics, options, UnknownSolver.INSTANCE);
  }

  public VerificationAnalysisPass(DiagnosticBag diagnostics) {
    this(diagnostics, VerificationOptions.DEFAULT);
  }

  /**
   * Configure from calor.* system properties: logging first, then the
   * analysis options.
   */
  public static VerificationAnalysisPass fromSettings(
        DiagnosticBag diagnostics, Solver solver)
        throws InvalidOptionException {
    Settings.initCalorProperties();
    Logger logger = setupLogging();
    return new VerificationAnalysisPass(diagnostics,
        VerificationOptions.fromSettings(), solver, logger);
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  public VerificationOptions getOptions() {
    return options;
  }

  /**
   * Bind then analyse.  Binding errors go to the same bag and do not
   * stop analysis of whatever was bound.
   */
  public VerificationResult analyze(SyntaxTree.Module module) {
    long start = System.currentTimeMillis();
    BoundModule bound = new Binder(diagnostics, logger).bind(module);
    VerificationResult res = analyze(bound);
    return new VerificationResult(res.getFunctionsAnalyzed(),
        res.getDataflowIssues(), res.getBugPatternsFound(),
        res.getTaintVulnerabilities(), res.getLoopInvariantsSynthesized(),
        System.currentTimeMillis() - start);
  }

  public VerificationResult analyze(BoundModule module) {
    long start = System.currentTimeMillis();
    logger.debug("Verifying module " + module.getName() + " with " +
                 options);

    FunctionAnalysis dataflow = options.enableDataflow() ?
        dataflowAnalysis() : null;
    FunctionAnalysis bugPatterns = options.enableBugPatterns() ?
        bugPatternAnalysis() : null;
    FunctionAnalysis taint = options.enableTaintAnalysis() ?
        taintAnalysis() : null;
    FunctionAnalysis loops = options.enableKInduction() ?
        loopInvariantAnalysis() : null;

    int n = module.getFunctions().size();
    int[] dataflowCounts = new int[n];
    int[] bugCounts = new int[n];
    int[] taintCounts = new int[n];
    int[] loopCounts = new int[n];
    for (int i = 0; i < n; i++) {
      BoundFunction f = module.getFunctions().get(i);
      dataflowCounts[i] = run(dataflow, f);
      bugCounts[i] = run(bugPatterns, f);
      taintCounts[i] = run(taint, f);
      loopCounts[i] = run(loops, f);
    }

    VerificationResult res = new VerificationResult(n, sum(dataflowCounts),
        sum(bugCounts), sum(taintCounts), sum(loopCounts),
        System.currentTimeMillis() - start);
    logger.debug("Verification of " + module.getName() + ": " + res);
    return res;
  }

  /**
   * A failure inside an analysis skips that analysis for this function
   * only; the other analyses and functions still run.
   */
  private int run(FunctionAnalysis analysis, BoundFunction f) {
    if (analysis == null) {
      return 0;
    }
    int count;
    try {
      count = analysis.analyze(logger, f);
    } catch (RuntimeException e) {
      logger.debug(analysis.getAnalysisName() + " analysis of " +
                   f.getName() + " failed, skipping: " + e, e);
      return 0;
    }
    if (logger.isTraceEnabled()) {
      logger.trace(analysis.getAnalysisName() + " on " + f.getName() +
                   ": " + count);
    }
    return count;
  }

  protected FunctionAnalysis dataflowAnalysis() {
    return new DataflowChecks(diagnostics);
  }

  protected FunctionAnalysis bugPatternAnalysis() {
    return new BugPatterns();
  }

  protected FunctionAnalysis taintAnalysis() {
    return new Taint();
  }

  protected FunctionAnalysis loopInvariantAnalysis() {
    return new LoopInvariants();
  }

  private static int sum(int[] counts) {
    int total = 0;
    for (int c: counts) {
      total += c;
    }
    return total;
  }

  private class BugPatterns implements FunctionAnalysis {
    private final BugPatternRunner runner =
        new BugPatternRunner(options.bugPatternOptions(), solver, logger);

    @Override
    public String getAnalysisName() {
      return "BugPatterns";
    }

    @Override
    public int analyze(Logger logger, BoundFunction function) {
      return runner.run(function, diagnostics);
    }
  }

  private class Taint implements FunctionAnalysis {
    private final TaintAnalysis taint =
        new TaintAnalysis(options.taintOptions(), logger);

    @Override
    public String getAnalysisName() {
      return "Taint";
    }

    @Override
    public int analyze(Logger logger, BoundFunction function) {
      return taint.analyze(function, diagnostics);
    }
  }

  private class LoopInvariants implements FunctionAnalysis {
    private final LoopAnalysisRunner runner = new LoopAnalysisRunner(
        diagnostics, options.kInductionOptions(), solver, logger);

    @Override
    public String getAnalysisName() {
      return "KInduction";
    }

    @Override
    public int analyze(Logger logger, BoundFunction function) {
      return runner.analyze(function);
    }
  }
}
