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
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.calor.ast.SourceSpan;
import exm.calor.binding.BoundExpression;
import exm.calor.binding.BoundStatement;
import exm.calor.binding.VariableSymbol;
import exm.calor.diagnostics.DiagnosticBag;
import exm.calor.diagnostics.DiagnosticCode;

/**
 * Forward analysis finding reads of variables that may not have been
 * given a value.  Parameters are initialized on entry.
 */
public class UninitializedVariables {

  public static enum InitState {
    UNINITIALIZED,
    MAYBE_INITIALIZED,
    INITIALIZED,
  }

  public static class UninitializedUse {
    public final String variable;
    public final SourceSpan span;
    public final InitState state;

    public UninitializedUse(String variable, SourceSpan span,
                            InitState state) {
      this.variable = variable;
      this.span = span;
      this.state = state;
    }

    @Override
    public String toString() {
      return variable + "@" + span + ": " + state;
    }
  }

  /**
   * Immutable map from variable name to state.  Absent variables are
   * uninitialized.  The unreached value is the identity for join.
   */
  public static class InitFacts {
    private static final InitFacts UNREACHED = new InitFacts(null);

    /** null if unreached */
    private final Map<String, InitState> states;

    private InitFacts(Map<String, InitState> states) {
      this.states = states;
    }

    public static InitFacts initial(Collection<String> initialized) {
      Map<String, InitState> states = new HashMap<String, InitState>();
      for (String v: initialized) {
        states.put(v, InitState.INITIALIZED);
      }
      return new InitFacts(states);
    }

    public boolean isReached() {
      return states != null;
    }

    public InitState getState(String var) {
      InitState s = states == null ? null : states.get(var);
      return s == null ? InitState.UNINITIALIZED : s;
    }

    public InitFacts setInitialized(String var) {
      if (getState(var) == InitState.INITIALIZED) {
        return this;
      }
      Map<String, InitState> newStates = states == null ?
          new HashMap<String, InitState>() :
          new HashMap<String, InitState>(states);
      newStates.put(var, InitState.INITIALIZED);
      return new InitFacts(newStates);
    }

    public InitFacts join(InitFacts other) {
      if (!this.isReached()) {
        return other;
      } else if (!other.isReached()) {
        return this;
      }
      Set<String> vars = new HashSet<String>(states.keySet());
      vars.addAll(other.states.keySet());
      Map<String, InitState> joined = new HashMap<String, InitState>();
      for (String v: vars) {
        InitState a = getState(v);
        InitState b = other.getState(v);
        if (a == InitState.INITIALIZED && b == InitState.INITIALIZED) {
          joined.put(v, InitState.INITIALIZED);
        } else {
          // at least one side initialized on some path
          joined.put(v, InitState.MAYBE_INITIALIZED);
        }
      }
      return new InitFacts(joined);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof InitFacts)) {
        return false;
      }
      Map<String, InitState> os = ((InitFacts) o).states;
      return states == null ? os == null : states.equals(os);
    }

    @Override
    public int hashCode() {
      return states == null ? 0 : states.hashCode();
    }

    @Override
    public String toString() {
      return states == null ? "<unreached>" : states.toString();
    }
  }

  private static class Lattice implements DataflowLattice<InitFacts> {
    private final InitFacts top;

    Lattice(Collection<String> parameters) {
      this.top = InitFacts.initial(parameters);
    }

    @Override
    public InitFacts bottom() {
      return InitFacts.UNREACHED;
    }

    @Override
    public InitFacts top() {
      return top;
    }

    @Override
    public InitFacts join(InitFacts a, InitFacts b) {
      return a.join(b);
    }

    @Override
    public boolean lessOrEqual(InitFacts a, InitFacts b) {
      return a.join(b).equals(b);
    }
  }

  private static class Transfer implements TransferFunction<InitFacts> {
    @Override
    public InitFacts transfer(BoundStatement stmt, InitFacts in) {
      VariableSymbol def = BoundNodes.definedVariable(stmt);
      if (def == null || !in.isReached()) {
        return in;
      }
      return in.setInitialized(def.getName());
    }

    @Override
    public InitFacts transferCondition(BoundExpression condition,
                                       InitFacts in) {
      return in;
    }
  }

  private final ControlFlowGraph cfg;
  private final Map<BasicBlock, BlockFacts<InitFacts>> results;

  public UninitializedVariables(ControlFlowGraph cfg,
                                Collection<String> parameters) {
    this.cfg = cfg;
    DataflowAnalysis<InitFacts> analysis = new DataflowAnalysis<InitFacts>(
        new Lattice(parameters), new Transfer(), DataflowDirection.FORWARD);
    this.results = analysis.analyze(cfg);
  }

  public InitState getStateAtEntry(BasicBlock block, String var) {
    return results.get(block).getIn().getState(var);
  }

  /**
   * @return uses of variables not initialized on every path, in block order
   */
  public List<UninitializedUse> findUninitializedUses() {
    List<UninitializedUse> uses = new ArrayList<UninitializedUse>();
    Transfer transfer = new Transfer();
    for (BasicBlock block: cfg.getReversePostOrder()) {
      InitFacts curr = results.get(block).getIn();
      if (!curr.isReached()) {
        continue;
      }
      for (BoundStatement stmt: block.getStatements()) {
        checkUses(BoundNodes.usedVariables(stmt), stmt.span(), curr, uses);
        curr = transfer.transfer(stmt, curr);
      }
      BoundExpression cond = block.getBranchCondition();
      if (cond != null) {
        checkUses(BoundNodes.usedVariables(cond), cond.span(), curr, uses);
      }
    }
    return Collections.unmodifiableList(uses);
  }

  private static void checkUses(List<VariableSymbol> used, SourceSpan span,
                       InitFacts facts, List<UninitializedUse> acc) {
    Set<String> seen = new LinkedHashSet<String>();
    for (VariableSymbol v: used) {
      if (!seen.add(v.getName())) {
        continue;
      }
      InitState state = facts.getState(v.getName());
      if (state != InitState.INITIALIZED) {
        acc.add(new UninitializedUse(v.getName(), span, state));
      }
    }
  }

  /**
   * Report each use as an error if never initialized, or a warning if
   * initialized only on some paths.
   * @return number reported
   */
  public int reportDiagnostics(DiagnosticBag diagnostics) {
    List<UninitializedUse> uses = findUninitializedUses();
    for (UninitializedUse use: uses) {
      if (use.state == InitState.UNINITIALIZED) {
        diagnostics.reportError(use.span,
            DiagnosticCode.UNINITIALIZED_VARIABLE,
            "Variable '" + use.variable + "' is used before initialization");
      } else {
        diagnostics.reportWarning(use.span,
            DiagnosticCode.UNINITIALIZED_VARIABLE,
            "Variable '" + use.variable +
            "' may not be initialized on all paths");
      }
    }
    return uses.size();
  }
}
