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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.calor.binding.BoundStatement;
import exm.calor.common.Logging;

/**
 * Worklist solver for monotone dataflow problems over a control flow
 * graph.
 *
 * A block's branch condition is evaluated after its statements.  Forward:
 * in = join of predecessors' out.  Backward: out = join of successors' in.
 * Blocks not reachable from entry keep bottom.
 */
public class DataflowAnalysis<T> {
  public static final int DEFAULT_MAX_ITERATIONS = 1000;

  private final DataflowLattice<T> lattice;
  private final TransferFunction<T> transfer;
  private final DataflowDirection direction;
  private final int maxIterations;

  public DataflowAnalysis(DataflowLattice<T> lattice,
      TransferFunction<T> transfer, DataflowDirection direction,
      int maxIterations) {
    this.lattice = lattice;
    this.transfer = transfer;
    this.direction = direction;
    this.maxIterations = maxIterations;
  }

  public DataflowAnalysis(DataflowLattice<T> lattice,
      TransferFunction<T> transfer, DataflowDirection direction) {
    this(lattice, transfer, direction, DEFAULT_MAX_ITERATIONS);
  }

  public Map<BasicBlock, BlockFacts<T>> analyze(ControlFlowGraph cfg) {
    Map<BasicBlock, BlockFacts<T>> results =
                      new HashMap<BasicBlock, BlockFacts<T>>();
    for (BasicBlock b: cfg.getBlocks()) {
      results.put(b, new BlockFacts<T>(lattice.bottom()));
    }

    boolean forward = direction == DataflowDirection.FORWARD;
    List<BasicBlock> order;
    if (forward) {
      results.get(cfg.getEntry()).setIn(lattice.top());
      order = cfg.getReversePostOrder();
    } else {
      results.get(cfg.getExit()).setOut(lattice.top());
      order = cfg.getPostOrder();
    }

    Deque<BasicBlock> worklist = new ArrayDeque<BasicBlock>(order);
    Set<BasicBlock> queued = new HashSet<BasicBlock>(order);
    int iterations = 0;
    while (!worklist.isEmpty() && iterations < maxIterations) {
      iterations++;
      BasicBlock block = worklist.removeFirst();
      queued.remove(block);

      boolean changed = forward ? stepForward(block, results)
                                : stepBackward(block, results);
      if (changed) {
        List<BasicBlock> next = forward ? block.getSuccessors()
                                        : block.getPredecessors();
        for (BasicBlock b: next) {
          if (queued.add(b)) {
            worklist.addLast(b);
          }
        }
      }
    }

    Logger logger = Logging.getCalorLogger();
    if (!worklist.isEmpty()) {
      logger.debug("Dataflow on " + cfg.getFunction().getName() +
                   " stopped after " + iterations + " iterations");
    } else if (logger.isTraceEnabled()) {
      logger.trace("Dataflow on " + cfg.getFunction().getName() +
                   " converged after " + iterations + " iterations");
    }
    return results;
  }

  private boolean stepForward(BasicBlock block,
                              Map<BasicBlock, BlockFacts<T>> results) {
    BlockFacts<T> facts = results.get(block);
    boolean changed = false;

    if (!block.getPredecessors().isEmpty()) {
      T newIn = lattice.bottom();
      for (BasicBlock pred: block.getPredecessors()) {
        newIn = lattice.join(newIn, results.get(pred).getOut());
      }
      if (!newIn.equals(facts.getIn())) {
        facts.setIn(newIn);
        changed = true;
      }
    }

    T curr = facts.getIn();
    for (BoundStatement stmt: block.getStatements()) {
      curr = transfer.transfer(stmt, curr);
    }
    if (block.getBranchCondition() != null) {
      curr = transfer.transferCondition(block.getBranchCondition(), curr);
    }
    if (!curr.equals(facts.getOut())) {
      facts.setOut(curr);
      changed = true;
    }
    return changed;
  }

  private boolean stepBackward(BasicBlock block,
                               Map<BasicBlock, BlockFacts<T>> results) {
    BlockFacts<T> facts = results.get(block);
    boolean changed = false;

    if (!block.getSuccessors().isEmpty()) {
      T newOut = lattice.bottom();
      for (BasicBlock succ: block.getSuccessors()) {
        newOut = lattice.join(newOut, results.get(succ).getIn());
      }
      if (!newOut.equals(facts.getOut())) {
        facts.setOut(newOut);
        changed = true;
      }
    }

    T curr = facts.getOut();
    if (block.getBranchCondition() != null) {
      curr = transfer.transferCondition(block.getBranchCondition(), curr);
    }
    List<BoundStatement> stmts = block.getStatements();
    for (int i = stmts.size() - 1; i >= 0; i--) {
      curr = transfer.transfer(stmts.get(i), curr);
    }
    if (!curr.equals(facts.getIn())) {
      facts.setIn(curr);
      changed = true;
    }
    return changed;
  }
}
