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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import exm.calor.ast.BinaryOperator;
import exm.calor.binding.BoundStatement;
import exm.calor.binding.VariableSymbol;
import exm.calor.common.Logging;
import exm.calor.solver.BoundedSearchSolver;
import exm.calor.solver.Formula;
import exm.calor.solver.Solver;
import exm.calor.solver.UnknownSolver;

public class KInductionProverTest {

  private final VariableSymbol i = local("i");

  private static KInductionProver prover(Solver solver) {
    return new KInductionProver(KInductionOptions.DEFAULT, solver,
                                Logging.getCalorLogger());
  }

  private LoopContext countToTen(BoundStatement... body) {
    return LoopContext.forLoop(
        (BoundStatement.For) forLoop(i, lit(0), lit(10), body));
  }

  private static InvariantCandidate candidate(String text, Formula f) {
    return new InvariantCandidate("test", text, f);
  }

  private static InvariantCandidate first(List<InvariantCandidate> cands) {
    return cands.get(0);
  }

  @Test
  public void testBoundedCounterProven() {
    LoopContext loop = countToTen();
    InvariantCandidate bounded =
        InvariantTemplates.BOUNDED_LOOP_VARIABLE.generate(loop);
    assertEquals("0 <= i && i <= 10", bounded.getText());

    KInductionResult r = prover(new BoundedSearchSolver())
                                            .tryProve(loop, bounded);
    assertEquals(KInductionStatus.PROVEN, r.getStatus());
    assertEquals(1, r.getK());
    assertTrue(r.isProven());
  }

  @Test
  public void testFalseAtEntry() {
    KInductionResult r = prover(new BoundedSearchSolver()).tryProve(
        countToTen(), candidate("i >= 5",
            Formula.ge(Formula.intVar("i"), Formula.intConst(5))));
    assertEquals(KInductionStatus.DISPROVEN, r.getStatus());
    assertTrue(r.getCounterexample().startsWith(
                                    "Invariant fails at loop entry"));
  }

  @Test
  public void testNotInductive() {
    // Holds on entry, but not preserved by the step
    KInductionResult r = prover(new BoundedSearchSolver()).tryProve(
        countToTen(), candidate("i <= 3",
            Formula.le(Formula.intVar("i"), Formula.intConst(3))));
    assertEquals(KInductionStatus.UNKNOWN, r.getStatus());
  }

  @Test
  public void testSymbolicBoundUnsupported() {
    VariableSymbol n = param("n");
    LoopContext loop = LoopContext.forLoop(
        (BoundStatement.For) forLoop(i, lit(0), ref(n)));
    KInductionResult r = prover(new BoundedSearchSolver()).tryProve(loop,
        candidate("i >= 0",
            Formula.ge(Formula.intVar("i"), Formula.intConst(0))));
    assertEquals(KInductionStatus.UNSUPPORTED, r.getStatus());
  }

  @Test
  public void testOtherVariablesUnsupported() {
    KInductionResult r = prover(new BoundedSearchSolver()).tryProve(
        countToTen(), candidate("i <= n",
            Formula.le(Formula.intVar("i"), Formula.intVar("n"))));
    assertEquals(KInductionStatus.UNSUPPORTED, r.getStatus());
  }

  @Test
  public void testUnknownSolver() {
    LoopContext loop = countToTen();
    KInductionResult r = prover(UnknownSolver.INSTANCE).tryProve(loop,
        InvariantTemplates.BOUNDED_LOOP_VARIABLE.generate(loop));
    assertEquals(KInductionStatus.UNKNOWN, r.getStatus());
  }

  @Test
  public void testIterationVariables() {
    assertEquals("i", KInductionProver.iterationVar("i", 0).getName());
    assertEquals("i@2", KInductionProver.iterationVar("i", 2).getName());

    LoopContext loop = countToTen();
    Formula step = prover(UnknownSolver.INSTANCE).inductiveStep(loop,
        Formula.ge(Formula.intVar("i"), Formula.intConst(0)), 2);
    assertTrue(step.freeVariables().contains("i@1"));
    assertTrue(step.freeVariables().contains("i@2"));
  }

  @Test
  public void testTemplateCandidates() {
    VariableSymbol sum = local("sum");
    LoopContext loop = countToTen(
        assign(sum, bin(BinaryOperator.ADD, ref(sum), ref(i))));

    List<String> texts = new ArrayList<String>();
    for (InvariantCandidate c: InvariantTemplates.candidates(loop, true)) {
      texts.add(c.getText());
    }
    assertEquals(4, texts.size());
    assertEquals("0 <= i && i <= 10", texts.get(0));
    assertTrue(texts.contains("i >= 0"));
    assertTrue(texts.contains("sum >= 0"));
    assertTrue(texts.contains("10 - i >= 0"));

    // Only the loop's own range without the full template set
    List<InvariantCandidate> basic = InvariantTemplates.candidates(loop,
                                                                   false);
    assertEquals(1, basic.size());
    assertEquals("0 <= i && i <= 10", first(basic).getText());
  }

  @Test
  public void testCombineSkipsOtherVariables() {
    VariableSymbol sum = local("sum");
    LoopContext loop = countToTen(
        assign(sum, bin(BinaryOperator.ADD, ref(sum), ref(i))));
    InvariantCandidate combined = InvariantTemplates.combine(loop,
                              InvariantTemplates.candidates(loop, true));
    assertEquals("0 <= i && i <= 10 && i >= 0 && 10 - i >= 0",
                 combined.getText());

    assertNull(InvariantTemplates.combine(loop,
                              InvariantTemplates.candidates(loop, false)));
  }
}
