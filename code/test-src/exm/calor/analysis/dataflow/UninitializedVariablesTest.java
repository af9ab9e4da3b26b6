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
package exm.calor.analysis.dataflow;

import static exm.calor.binding.BoundBuilders.*;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.calor.analysis.dataflow.UninitializedVariables.InitState;
import exm.calor.analysis.dataflow.UninitializedVariables.UninitializedUse;
import exm.calor.ast.BinaryOperator;
import exm.calor.binding.BoundTree.BoundFunction;
import exm.calor.binding.VariableSymbol;
import exm.calor.diagnostics.DiagnosticBag;
import exm.calor.diagnostics.DiagnosticCode;
import exm.calor.diagnostics.Severity;

public class UninitializedVariablesTest {

  private static List<UninitializedUse> uses(BoundFunction f,
                                             String... params) {
    return new UninitializedVariables(ControlFlowGraph.build(f),
                          Arrays.asList(params)).findUninitializedUses();
  }

  @Test
  public void testDeclaredButNeverAssigned() {
    VariableSymbol x = local("x");
    BoundFunction f = function("f", bind(x, null), ret(ref(x)));

    List<UninitializedUse> uses = uses(f);
    assertEquals(1, uses.size());
    assertEquals("x", uses.get(0).variable);
    assertEquals(InitState.UNINITIALIZED, uses.get(0).state);

    DiagnosticBag bag = new DiagnosticBag();
    int n = new UninitializedVariables(ControlFlowGraph.build(f),
                  Collections.<String>emptyList()).reportDiagnostics(bag);
    assertEquals(1, n);
    assertEquals(Severity.ERROR, bag.getDiagnostics().get(0).getSeverity());
    assertEquals("Variable 'x' is used before initialization",
                 bag.getDiagnostics().get(0).getMessage());
  }

  @Test
  public void testParametersInitialized() {
    VariableSymbol p = param("p");
    BoundFunction f = function("f", params(p), ret(ref(p)));
    assertTrue(uses(f, "p").isEmpty());
  }

  @Test
  public void testInitializedOnOneBranch() {
    VariableSymbol x = local("x");
    VariableSymbol p = param("p");
    BoundFunction f = function("f", params(p),
        bind(x, null),
        ifThen(bin(BinaryOperator.GREATER_THAN, ref(p), lit(0)),
               block(assign(x, lit(1)))),
        ret(ref(x)));

    List<UninitializedUse> uses = uses(f, "p");
    assertEquals(1, uses.size());
    assertEquals(InitState.MAYBE_INITIALIZED, uses.get(0).state);

    DiagnosticBag bag = new DiagnosticBag();
    new UninitializedVariables(ControlFlowGraph.build(f),
                               Arrays.asList("p")).reportDiagnostics(bag);
    assertEquals(1, bag.count(DiagnosticCode.UNINITIALIZED_VARIABLE));
    assertEquals("Variable 'x' may not be initialized on all paths",
                 bag.getDiagnostics().get(0).getMessage());

    ControlFlowGraph cfg = ControlFlowGraph.build(f);
    UninitializedVariables uninit = new UninitializedVariables(cfg,
                                                       Arrays.asList("p"));
    assertEquals(InitState.INITIALIZED,
                 uninit.getStateAtEntry(cfg.getEntry(), "p"));
    assertEquals(InitState.UNINITIALIZED,
                 uninit.getStateAtEntry(cfg.getEntry(), "x"));
    assertEquals(InitState.MAYBE_INITIALIZED,
                 uninit.getStateAtEntry(cfg.getExit(), "x"));
  }

  @Test
  public void testInitializedOnBothBranches() {
    VariableSymbol x = local("x");
    VariableSymbol p = param("p");
    BoundFunction f = function("f", params(p),
        bind(x, null),
        ifElse(bin(BinaryOperator.GREATER_THAN, ref(p), lit(0)),
               block(assign(x, lit(1))), block(assign(x, lit(2)))),
        ret(ref(x)));
    assertTrue(uses(f, "p").isEmpty());

    ControlFlowGraph cfg = ControlFlowGraph.build(f);
    assertEquals(InitState.INITIALIZED, new UninitializedVariables(cfg,
        Arrays.asList("p")).getStateAtEntry(cfg.getExit(), "x"));
  }

  @Test
  public void testUseInLoopCondition() {
    VariableSymbol i = local("i");
    BoundFunction f = function("f",
        bind(i, null),
        whileLoop(bin(BinaryOperator.LESS_THAN, ref(i), lit(10)),
                  assign(i, lit(0))));

    // Uninitialized on first entry, initialized around the back edge
    List<UninitializedUse> uses = uses(f);
    assertEquals(1, uses.size());
    assertEquals(InitState.MAYBE_INITIALIZED, uses.get(0).state);
  }

  @Test
  public void testForLoopVariableInitialized() {
    VariableSymbol i = local("i");
    BoundFunction f = function("f",
        forLoop(i, lit(0), lit(3), callStmt("log", ref(i))));
    assertTrue(uses(f).isEmpty());
  }
}
