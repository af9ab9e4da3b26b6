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

import static exm.calor.binding.BoundBuilders.*;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.calor.ast.BinaryOperator;
import exm.calor.ast.Expression;
import exm.calor.ast.SourceSpan;
import exm.calor.ast.Statement;
import exm.calor.ast.SyntaxTree;
import exm.calor.binding.BoundTree.BoundFunction;
import exm.calor.binding.BoundTree.BoundModule;
import exm.calor.binding.VariableSymbol;
import exm.calor.common.Logging;
import exm.calor.common.Settings;
import exm.calor.common.exceptions.InvalidOptionException;
import exm.calor.diagnostics.DiagnosticBag;
import exm.calor.diagnostics.DiagnosticCode;
import exm.calor.diagnostics.Severity;
import exm.calor.solver.BoundedSearchSolver;

public class VerificationAnalysisPassTest {

  @BeforeClass
  public static void setupLogging() {
    Logging.setupLogging(null, false);
  }

  private static BoundModule module(BoundFunction... fns) {
    return new BoundModule("Test", Arrays.asList(fns));
  }

  private static BoundFunction divide(String name) {
    VariableSymbol x = param("x");
    VariableSymbol y = param("y");
    return function(name, params(x, y),
        ret(bin(BinaryOperator.DIVIDE, ref(x), ref(y))));
  }

  private static BoundFunction countUp() {
    VariableSymbol i = local("i");
    return function("countUp",
        bind(i, lit(0)),
        whileLoop(bin(BinaryOperator.LESS_THAN, ref(i), lit(10)),
            assign(i, bin(BinaryOperator.ADD, ref(i), lit(1)))),
        ret(ref(i)));
  }

  @Test
  public void testCountsSummedOverFunctions() {
    DiagnosticBag bag = new DiagnosticBag();
    VerificationResult res = new VerificationAnalysisPass(bag,
        VerificationOptions.FAST).analyze(module(divide("a"), divide("b")));
    assertEquals(2, res.getFunctionsAnalyzed());
    assertEquals(2, res.getBugPatternsFound());
    assertEquals(0, res.getDataflowIssues());
    assertEquals(0, res.getTaintVulnerabilities());
    assertEquals(0, res.getLoopInvariantsSynthesized());
    assertEquals(2, bag.count(DiagnosticCode.DIVISION_BY_ZERO));
    assertEquals("Potential division by zero: 'y' may be zero",
        bag.withCode(DiagnosticCode.DIVISION_BY_ZERO).get(0).getMessage());
  }

  @Test
  public void testSolverBackedChecks() {
    // No solver available: the division can't be decided
    DiagnosticBag bag = new DiagnosticBag();
    new VerificationAnalysisPass(bag, VerificationOptions.DEFAULT)
                                        .analyze(module(divide("f")));
    assertEquals(1, bag.count(DiagnosticCode.DIVISION_BY_ZERO));
    assertEquals(Severity.INFO, bag.withCode(DiagnosticCode.DIVISION_BY_ZERO)
                                   .get(0).getSeverity());

    bag = new DiagnosticBag();
    new VerificationAnalysisPass(bag, VerificationOptions.DEFAULT,
        new BoundedSearchSolver()).analyze(module(divide("f")));
    assertEquals(Severity.WARNING, bag.withCode(DiagnosticCode.DIVISION_BY_ZERO)
                                      .get(0).getSeverity());
  }

  @Test
  public void testLoopInvariantsOnlyWhenEnabled() {
    DiagnosticBag bag = new DiagnosticBag();
    VerificationResult res = new VerificationAnalysisPass(bag,
        VerificationOptions.DEFAULT, new BoundedSearchSolver())
                                                  .analyze(module(countUp()));
    assertEquals(0, res.getLoopInvariantsSynthesized());
    assertEquals(0, bag.count(DiagnosticCode.LOOP_INVARIANT_SYNTHESIZED));

    bag = new DiagnosticBag();
    res = new VerificationAnalysisPass(bag, VerificationOptions.THOROUGH,
        new BoundedSearchSolver()).analyze(module(countUp(), countUp()));
    assertEquals(2, res.getLoopInvariantsSynthesized());
    assertEquals(2, bag.count(DiagnosticCode.LOOP_INVARIANT_SYNTHESIZED));
    assertEquals(0, res.getBugPatternsFound());
  }

  @Test
  public void testDeadStoreAndTaint() {
    VariableSymbol x = local("x");
    BoundFunction deadStore = function("deadStore",
        bind(x, lit(1)),
        assign(x, lit(2)),
        ret(ref(x)));
    VariableSymbol userInput = param("userInput", "STRING");
    BoundFunction injection = function("injection", params(userInput),
        callStmt("db.query", ref(userInput)));

    DiagnosticBag bag = new DiagnosticBag();
    VerificationResult res = new VerificationAnalysisPass(bag,
        VerificationOptions.FAST).analyze(module(deadStore, injection));
    assertEquals(1, res.getDataflowIssues());
    assertEquals(1, res.getTaintVulnerabilities());
    assertEquals(1, bag.count(DiagnosticCode.DEAD_STORE));
    assertEquals(1, bag.count(DiagnosticCode.SQL_INJECTION));
  }

  @Test
  public void testDisabledAnalyses() {
    VerificationOptions nothing = new VerificationOptions(false, false, false,
        false, false, 1000, null, null, null);
    DiagnosticBag bag = new DiagnosticBag();
    VerificationResult res = new VerificationAnalysisPass(bag, nothing)
                                    .analyze(module(divide("f"), countUp()));
    assertEquals(2, res.getFunctionsAnalyzed());
    assertEquals(0, bag.size());
  }

  @Test
  public void testBindingErrorsDoNotStopAnalysis() {
    SyntaxTree.Function broken = new SyntaxTree.Function(SourceSpan.UNKNOWN,
        "f001", "broken", Collections.<SyntaxTree.Parameter>emptyList(),
        "INT", Collections.<SyntaxTree.Requires>emptyList(),
        Collections.<SyntaxTree.Ensures>emptyList(),
        Arrays.<Statement>asList(
            new Statement.Return(Expression.ref("nowhere"))));
    SyntaxTree.Function divZero = new SyntaxTree.Function(SourceSpan.UNKNOWN,
        "f002", "divZero",
        Arrays.asList(new SyntaxTree.Parameter("x", "INT")), "INT",
        Collections.<SyntaxTree.Requires>emptyList(),
        Collections.<SyntaxTree.Ensures>emptyList(),
        Arrays.<Statement>asList(new Statement.Return(Expression.binary(
            BinaryOperator.DIVIDE, Expression.ref("x"),
            Expression.intLit(0)))));

    DiagnosticBag bag = new DiagnosticBag();
    VerificationResult res = new VerificationAnalysisPass(bag,
        VerificationOptions.FAST).analyze(new SyntaxTree.Module("m001",
                                  "Test", Arrays.asList(broken, divZero)));
    assertEquals(2, res.getFunctionsAnalyzed());
    assertTrue(bag.hasErrors());
    assertEquals(1, bag.count(DiagnosticCode.UNDEFINED_REFERENCE));
    assertEquals(1, bag.count(DiagnosticCode.DIVISION_BY_ZERO));
    assertTrue(res.getBugPatternsFound() >= 1);
  }

  private static BoundFunction uninitializedUse() {
    VariableSymbol x = local("x");
    return function("uninit", bind(x, null), ret(ref(x)));
  }

  @Test
  public void testDataflowOnlyOverThreeFunctions() {
    VerificationOptions dataflowOnly = new VerificationOptions(true, false,
        false, false, false, 1000, null, null, null);
    DiagnosticBag bag = new DiagnosticBag();
    VerificationResult res = new VerificationAnalysisPass(bag, dataflowOnly)
        .analyze(module(divide("f"), uninitializedUse(), countUp()));
    assertEquals(3, res.getFunctionsAnalyzed());
    assertTrue(res.getDataflowIssues() >= 1);
    assertEquals(1, bag.count(DiagnosticCode.UNINITIALIZED_VARIABLE));
    assertEquals(0, res.getBugPatternsFound());
  }

  /**
   * Fails on the named function, otherwise delegates
   */
  private static FunctionAnalysis failingOn(final String name,
                                            final FunctionAnalysis inner) {
    return new FunctionAnalysis() {
      @Override
      public String getAnalysisName() {
        return "Failing" + inner.getAnalysisName();
      }

      @Override
      public int analyze(Logger logger, BoundFunction function) {
        if (function.getName().equals(name)) {
          throw new IllegalStateException("cannot analyze " + name);
        }
        return inner.analyze(logger, function);
      }
    };
  }

  @Test
  public void testFailingAnalysisSkipsOnlyThatFunction() {
    VariableSymbol x = local("x");
    BoundFunction deadStore = function("deadStore",
        bind(x, lit(1)),
        assign(x, lit(2)),
        ret(ref(x)));
    final DiagnosticBag bag = new DiagnosticBag();
    VerificationAnalysisPass pass = new VerificationAnalysisPass(bag,
                                              VerificationOptions.FAST) {
      @Override
      protected FunctionAnalysis dataflowAnalysis() {
        return failingOn("broken", super.dataflowAnalysis());
      }

      @Override
      protected FunctionAnalysis taintAnalysis() {
        return failingOn("broken", super.taintAnalysis());
      }
    };
    BoundFunction broken = function("broken", bind(x, lit(1)),
        assign(x, lit(2)), ret(ref(x)));
    VerificationResult res = pass.analyze(module(divide("broken"),
                                                 deadStore));

    assertEquals(2, res.getFunctionsAnalyzed());
    // Dataflow still ran on the other function
    assertEquals(1, res.getDataflowIssues());
    assertEquals(1, bag.count(DiagnosticCode.DEAD_STORE));
    // Bug patterns still ran on the failing function
    assertEquals(1, res.getBugPatternsFound());
    assertEquals(1, bag.count(DiagnosticCode.DIVISION_BY_ZERO));

    res = pass.analyze(module(broken));
    assertEquals(0, res.getDataflowIssues());
  }

  @Test
  public void testFromSettings() throws InvalidOptionException {
    System.setProperty(Settings.VERIFY_K_INDUCTION, "true");
    System.setProperty(Settings.VERIFY_BUG_PATTERNS, "false");
    try {
      DiagnosticBag bag = new DiagnosticBag();
      VerificationAnalysisPass pass = VerificationAnalysisPass.fromSettings(
                                            bag, new BoundedSearchSolver());
      assertTrue(pass.getOptions().enableKInduction());
      assertFalse(pass.getOptions().enableBugPatterns());
      assertEquals(10, pass.getOptions().kInductionOptions().maxK());

      VerificationResult res = pass.analyze(module(countUp(), divide("f")));
      assertEquals(1, res.getLoopInvariantsSynthesized());
      assertEquals(0, bag.count(DiagnosticCode.DIVISION_BY_ZERO));
    } finally {
      System.clearProperty(Settings.VERIFY_K_INDUCTION);
      System.clearProperty(Settings.VERIFY_BUG_PATTERNS);
      Settings.reset(Settings.VERIFY_K_INDUCTION);
      Settings.reset(Settings.VERIFY_BUG_PATTERNS);
    }
  }

  @Test(expected=InvalidOptionException.class)
  public void testFromSettingsRejectsBadValue()
                                          throws InvalidOptionException {
    System.setProperty(Settings.LOG_TRACE, "sometimes");
    try {
      VerificationAnalysisPass.fromSettings(new DiagnosticBag(),
                                            new BoundedSearchSolver());
    } finally {
      System.clearProperty(Settings.LOG_TRACE);
      Settings.reset(Settings.LOG_TRACE);
    }
  }
}
