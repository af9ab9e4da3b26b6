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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import exm.calor.analysis.dataflow.LiveVariables.DeadAssignment;
import exm.calor.ast.BinaryOperator;
import exm.calor.binding.BoundStatement;
import exm.calor.binding.BoundTree.BoundFunction;
import exm.calor.binding.VariableSymbol;

public class LiveVariablesTest {

  @Test
  public void testOverwrittenBeforeRead() {
    VariableSymbol x = local("x");
    BoundStatement first = bind(x, lit(1));
    BoundFunction f = function("f", first, assign(x, lit(2)), ret(ref(x)));

    List<DeadAssignment> dead =
        new LiveVariables(ControlFlowGraph.build(f)).findDeadAssignments();
    assertEquals(1, dead.size());
    assertEquals("x", dead.get(0).variable);
    assertEquals(first, dead.get(0).statement);
  }

  @Test
  public void testNeverRead() {
    VariableSymbol x = local("x");
    BoundFunction f = function("f", bind(x, lit(1)), ret(lit(0)));
    assertEquals(1, new LiveVariables(ControlFlowGraph.build(f))
                          .findDeadAssignments().size());
  }

  @Test
  public void testSelfUpdateLive() {
    // x = x + 1 reads x before defining it
    VariableSymbol x = local("x");
    BoundFunction f = function("f", bind(x, lit(1)),
        assign(x, bin(BinaryOperator.ADD, ref(x), lit(1))), ret(ref(x)));
    assertTrue(new LiveVariables(ControlFlowGraph.build(f))
                          .findDeadAssignments().isEmpty());
  }

  @Test
  public void testLiveAroundLoop() {
    VariableSymbol sum = local("sum");
    VariableSymbol i = local("i");
    BoundFunction f = function("f",
        bind(sum, lit(0)),
        forLoop(i, lit(0), lit(10),
                assign(sum, bin(BinaryOperator.ADD, ref(sum), ref(i)))),
        ret(ref(sum)));

    ControlFlowGraph cfg = ControlFlowGraph.build(f);
    LiveVariables live = new LiveVariables(cfg);
    assertTrue(live.findDeadAssignments().isEmpty());

    BasicBlock header = cfg.getEntry().getSuccessors().get(0);
    assertTrue(live.isLiveAtEntry(header, "sum"));
    assertTrue(live.isLiveAtEntry(header, "i"));
    assertFalse(live.getLiveAtExit(cfg.getExit()).contains("sum"));
  }
}
