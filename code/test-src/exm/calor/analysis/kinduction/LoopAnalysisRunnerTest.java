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

import static exm.calor.binding.BoundBuilders.*;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

import exm.calor.ast.BinaryOperator;
import exm.calor.binding.BoundTree.BoundFunction;
import exm.calor.binding.VariableSymbol;
import exm.calor.common.Logging;
import exm.calor.diagnostics.Diagnostic;
import exm.calor.diagnostics.DiagnosticBag;
import exm.calor.diagnostics.DiagnosticCode;
import exm.calor.diagnostics.Severity;
import exm.calor.solver.BoundedSearchSolver;
import exm.calor.solver.Solver;
import exm.calor.solver.UnknownSolver;

public class LoopAnalysisRunnerTest {

  private static int run(BoundFunction f, DiagnosticBag bag, Solver solver) {
    return new LoopAnalysisRunner(bag, KInductionOptions.DEFAULT, solver,
                                  Logging.getCalorLogger()).analyze(f);
  }

  private static BoundFunction countUp(VariableSymbol i) {
    return function("countUp",
        bind(i, lit(0)),
        whileLoop(bin(BinaryOperator.LESS_THAN, ref(i), lit(10)),
            assign(i, bin(BinaryOperator.ADD, ref(i), lit(1)))),
        ret(ref(i)));
  }

  @Test
  public void testWhileLoopSynthesized() {
    DiagnosticBag bag = new DiagnosticBag();
    assertEquals(1, run(countUp(local("i")), bag,
                        new BoundedSearchSolver()));
    assertEquals(1, bag.size());
    Diagnostic d = bag.getDiagnostics().get(0);
    assertEquals(DiagnosticCode.LOOP_INVARIANT_SYNTHESIZED, d.getCode());
    assertEquals(Severity.INFO, d.getSeverity());
    assertEquals("Invariant synthesized and proven: 0 <= i && i <= 10",
                 d.getMessage());
  }

  @Test
  public void testCountdown() {
    VariableSymbol n = local("n");
    BoundFunction f = function("countdown",
        bind(n, lit(10)),
        whileLoop(bin(BinaryOperator.GREATER_THAN, ref(n), lit(0)),
            assign(n, bin(BinaryOperator.SUBTRACT, ref(n), lit(1)))),
        ret(ref(n)));
    DiagnosticBag bag = new DiagnosticBag();
    assertEquals(1, run(f, bag, new BoundedSearchSolver()));
    assertEquals("Invariant synthesized and proven: 10 - n >= 0",
                 bag.getDiagnostics().get(0).getMessage());
  }

  @Test
  public void testForLoopInsideIf() {
    VariableSymbol i = local("i");
    VariableSymbol p = param("p");
    BoundFunction f = function("f", params(p),
        ifThen(bin(BinaryOperator.GREATER_THAN, ref(p), lit(0)),
            block(forLoop(i, lit(0), lit(10),
                          callStmt("print", ref(i))))),
        ret(lit(0)));
    DiagnosticBag bag = new DiagnosticBag();
    assertEquals(1, run(f, bag, new BoundedSearchSolver()));
    assertEquals(1, bag.count(DiagnosticCode.LOOP_INVARIANT_SYNTHESIZED));
  }

  @Test
  public void testSymbolicBoundNotReported() {
    VariableSymbol i = local("i");
    VariableSymbol n = param("n");
    BoundFunction f = function("f", params(n),
        forLoop(i, lit(0), ref(n), callStmt("print", ref(i))),
        ret(lit(0)));
    DiagnosticBag bag = new DiagnosticBag();
    assertEquals(0, run(f, bag, new BoundedSearchSolver()));
    assertEquals(0, bag.size());
  }

  @Test
  public void testUnknownSolverWarns() {
    DiagnosticBag bag = new DiagnosticBag();
    assertEquals(0, run(countUp(local("i")), bag, UnknownSolver.INSTANCE));
    assertEquals(1, bag.size());
    Diagnostic d = bag.getDiagnostics().get(0);
    assertEquals(DiagnosticCode.LOOP_INVARIANT_UNKNOWN, d.getCode());
    assertEquals(Severity.WARNING, d.getSeverity());
    assertEquals("Could not synthesize invariant for while loop with " +
                 "variable 'i'", d.getMessage());
  }
}
