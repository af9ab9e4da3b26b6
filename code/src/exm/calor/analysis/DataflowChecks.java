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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.calor.analysis.dataflow.ControlFlowGraph;
import exm.calor.analysis.dataflow.LiveVariables;
import exm.calor.analysis.dataflow.LiveVariables.DeadAssignment;
import exm.calor.analysis.dataflow.UninitializedVariables;
import exm.calor.binding.BoundStatement;
import exm.calor.binding.BoundTree.BoundFunction;
import exm.calor.diagnostics.DiagnosticBag;
import exm.calor.diagnostics.DiagnosticCode;

/**
 * Uninitialized uses and dead stores, from dataflow over the control
 * flow graph.
 */
public class DataflowChecks implements FunctionAnalysis {

  private final DiagnosticBag diagnostics;

  public DataflowChecks(DiagnosticBag diagnostics) {
    this.diagnostics = diagnostics;
  }

  @Override
  public String getAnalysisName() {
    return "Dataflow";
  }

  @Override
  public int analyze(Logger logger, BoundFunction function) {
    ControlFlowGraph cfg = ControlFlowGraph.build(function);
    if (logger.isTraceEnabled()) {
      logger.trace("CFG for " + function.getName() + ":\n" + cfg.toDot());
    }
    int issues = new UninitializedVariables(cfg,
            function.getParameterNames()).reportDiagnostics(diagnostics);
    issues += reportDeadStores(cfg, function);
    return issues;
  }

  private int reportDeadStores(ControlFlowGraph cfg, BoundFunction function) {
    Set<String> excluded = new HashSet<String>(function.getParameterNames());
    addLoopVariables(function.getBody(), excluded);

    int count = 0;
    for (DeadAssignment dead: new LiveVariables(cfg).findDeadAssignments()) {
      if (excluded.contains(dead.variable)) {
        continue;
      }
      diagnostics.reportWarning(dead.statement.span(),
          DiagnosticCode.DEAD_STORE,
          "Assignment to '" + dead.variable + "' is never read (dead store)");
      count++;
    }
    return count;
  }

  private static void addLoopVariables(List<BoundStatement> stmts,
                                       Set<String> acc) {
    for (BoundStatement stmt: stmts) {
      switch (stmt.kind()) {
        case FOR: {
          BoundStatement.For f = (BoundStatement.For) stmt;
          acc.add(f.loopVariable().getName());
          addLoopVariables(f.body(), acc);
          break;
        }
        case WHILE:
          addLoopVariables(((BoundStatement.While) stmt).body(), acc);
          break;
        case IF: {
          BoundStatement.If ifStmt = (BoundStatement.If) stmt;
          addLoopVariables(ifStmt.thenBody(), acc);
          for (BoundStatement.ElseIf elseIf: ifStmt.elseIfs()) {
            addLoopVariables(elseIf.body, acc);
          }
          if (ifStmt.elseBody() != null) {
            addLoopVariables(ifStmt.elseBody(), acc);
          }
          break;
        }
        default:
          break;
      }
    }
  }
}
