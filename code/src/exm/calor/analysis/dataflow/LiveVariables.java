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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.calor.binding.BoundExpression;
import exm.calor.binding.BoundStatement;
import exm.calor.binding.VariableSymbol;

/**
 * Backward analysis of which variables may be read before being
 * redefined.  Nothing is live after the function exits.
 */
public class LiveVariables {

  public static class DeadAssignment {
    public final BasicBlock block;
    public final BoundStatement statement;
    public final String variable;

    public DeadAssignment(BasicBlock block, BoundStatement statement,
                          String variable) {
      this.block = block;
      this.statement = statement;
      this.variable = variable;
    }

    @Override
    public String toString() {
      return variable + " in " + block;
    }
  }

  private static class Lattice implements DataflowLattice<Set<String>> {
    @Override
    public Set<String> bottom() {
      return Collections.emptySet();
    }

    @Override
    public Set<String> top() {
      return Collections.emptySet();
    }

    @Override
    public Set<String> join(Set<String> a, Set<String> b) {
      if (a.isEmpty()) {
        return b;
      } else if (b.isEmpty()) {
        return a;
      }
      Set<String> res = new HashSet<String>(a);
      res.addAll(b);
      return Collections.unmodifiableSet(res);
    }

    @Override
    public boolean lessOrEqual(Set<String> a, Set<String> b) {
      return b.containsAll(a);
    }
  }

  private static class Transfer implements TransferFunction<Set<String>> {
    @Override
    public Set<String> transfer(BoundStatement stmt, Set<String> out) {
      Set<String> in = new HashSet<String>(out);
      // Kill before gen: x = x + 1 reads x
      VariableSymbol def = BoundNodes.definedVariable(stmt);
      if (def != null) {
        in.remove(def.getName());
      }
      for (VariableSymbol v: BoundNodes.usedVariables(stmt)) {
        in.add(v.getName());
      }
      return Collections.unmodifiableSet(in);
    }

    @Override
    public Set<String> transferCondition(BoundExpression condition,
                                         Set<String> out) {
      List<VariableSymbol> used = BoundNodes.usedVariables(condition);
      if (used.isEmpty()) {
        return out;
      }
      Set<String> in = new HashSet<String>(out);
      for (VariableSymbol v: used) {
        in.add(v.getName());
      }
      return Collections.unmodifiableSet(in);
    }
  }

  private final ControlFlowGraph cfg;
  private final Map<BasicBlock, BlockFacts<Set<String>>> results;

  public LiveVariables(ControlFlowGraph cfg) {
    this.cfg = cfg;
    DataflowAnalysis<Set<String>> analysis = new DataflowAnalysis<Set<String>>(
        new Lattice(), new Transfer(), DataflowDirection.BACKWARD);
    this.results = analysis.analyze(cfg);
  }

  public Set<String> getLiveAtEntry(BasicBlock block) {
    return results.get(block).getIn();
  }

  public Set<String> getLiveAtExit(BasicBlock block) {
    return results.get(block).getOut();
  }

  public boolean isLiveAtEntry(BasicBlock block, String var) {
    return getLiveAtEntry(block).contains(var);
  }

  /**
   * Definitions whose value no path reads.  Unreachable blocks are
   * skipped.
   */
  public List<DeadAssignment> findDeadAssignments() {
    List<DeadAssignment> dead = new ArrayList<DeadAssignment>();
    Transfer transfer = new Transfer();
    for (BasicBlock block: cfg.getReversePostOrder()) {
      Set<String> live = results.get(block).getOut();
      if (block.getBranchCondition() != null) {
        live = transfer.transferCondition(block.getBranchCondition(), live);
      }
      List<BoundStatement> stmts = block.getStatements();
      // Walk backwards, collecting in reverse
      List<DeadAssignment> blockDead = new ArrayList<DeadAssignment>();
      for (int i = stmts.size() - 1; i >= 0; i--) {
        BoundStatement stmt = stmts.get(i);
        VariableSymbol def = BoundNodes.definedVariable(stmt);
        if (def != null && !live.contains(def.getName())) {
          blockDead.add(new DeadAssignment(block, stmt, def.getName()));
        }
        live = transfer.transfer(stmt, live);
      }
      Collections.reverse(blockDead);
      dead.addAll(blockDead);
    }
    return dead;
  }
}
