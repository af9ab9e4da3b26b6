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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.calor.binding.BoundExpression;
import exm.calor.binding.BoundStatement;
import exm.calor.binding.BoundTree.BoundFunction;
import exm.calor.diagnostics.DiagnosticBag;
import exm.calor.diagnostics.DiagnosticCode;
import exm.calor.solver.Solver;

/**
 * Synthesizes invariants for every loop in a function, including loops
 * nested in loops and conditionals, and reports each outcome.
 */
public class LoopAnalysisRunner {

  private final DiagnosticBag diagnostics;
  private final LoopInvariantSynthesizer synthesizer;
  private final Logger logger;

  public LoopAnalysisRunner(DiagnosticBag diagnostics,
      KInductionOptions options, Solver solver, Logger logger) {
    this.diagnostics = diagnostics;
    this.synthesizer = new LoopInvariantSynthesizer(options, solver, logger);
    this.logger = logger;
  }

  /**
   * @return number of invariants synthesized
   */
  public int analyze(BoundFunction function) {
    logger.debug("Loop invariant synthesis for " + function.getName());
    return analyzeBlock(function.getBody(), new HashMap<String, Long>());
  }

  /**
   * @param known literal values of variables on entry to the block;
   *        updated as statements assign them
   */
  private int analyzeBlock(List<BoundStatement> stmts,
                           Map<String, Long> known) {
    int count = 0;
    for (BoundStatement stmt: stmts) {
      switch (stmt.kind()) {
        case BIND: {
          BoundStatement.Bind bind = (BoundStatement.Bind) stmt;
          update(known, bind.variable().getName(), bind.initializer());
          break;
        }
        case ASSIGN: {
          BoundStatement.Assign assign = (BoundStatement.Assign) stmt;
          update(known, assign.variable().getName(), assign.value());
          break;
        }
        case FOR: {
          BoundStatement.For f = (BoundStatement.For) stmt;
          count += report(stmt, LoopContext.forLoop(f));
          count += analyzeLoopBody(f.body(), known);
          known.remove(f.loopVariable().getName());
          break;
        }
        case WHILE: {
          BoundStatement.While w = (BoundStatement.While) stmt;
          WhileConditionAnalyzer.WhileLoopInfo info =
                          WhileConditionAnalyzer.analyze(w.condition());
          Long initial = info == null ? null : known.get(info.loopVariable);
          count += report(stmt, LoopContext.whileLoop(w, initial));
          count += analyzeLoopBody(w.body(), known);
          break;
        }
        case IF: {
          BoundStatement.If ifStmt = (BoundStatement.If) stmt;
          count += analyzeBlock(ifStmt.thenBody(),
                                new HashMap<String, Long>(known));
          for (BoundStatement.ElseIf elseIf: ifStmt.elseIfs()) {
            count += analyzeBlock(elseIf.body,
                                  new HashMap<String, Long>(known));
          }
          if (ifStmt.elseBody() != null) {
            count += analyzeBlock(ifStmt.elseBody(),
                                  new HashMap<String, Long>(known));
          }
          forget(known, LoopContext.modifiedIn(ifStmt.thenBody()));
          for (BoundStatement.ElseIf elseIf: ifStmt.elseIfs()) {
            forget(known, LoopContext.modifiedIn(elseIf.body));
          }
          if (ifStmt.elseBody() != null) {
            forget(known, LoopContext.modifiedIn(ifStmt.elseBody()));
          }
          break;
        }
        default:
          break;
      }
    }
    return count;
  }

  /**
   * Values assigned in the body are unknown on every iteration but the
   * first, and after the loop.
   */
  private int analyzeLoopBody(List<BoundStatement> body,
                              Map<String, Long> known) {
    forget(known, LoopContext.modifiedIn(body));
    return analyzeBlock(body, new HashMap<String, Long>(known));
  }

  private static void update(Map<String, Long> known, String var,
                             BoundExpression value) {
    Long v = value == null ? null : WhileConditionAnalyzer.intValue(value);
    if (v != null) {
      known.put(var, v);
    } else {
      known.remove(var);
    }
  }

  private static void forget(Map<String, Long> known,
                             Iterable<String> vars) {
    for (String var: vars) {
      known.remove(var);
    }
  }

  /**
   * @return 1 if an invariant was synthesized, else 0
   */
  private int report(BoundStatement loop, LoopContext ctx) {
    LoopInvariantResult res = synthesizer.synthesize(ctx);
    if (logger.isTraceEnabled()) {
      logger.trace(ctx + ": " + res);
    }
    switch (res.getOutcome()) {
      case SYNTHESIZED:
        diagnostics.reportInfo(loop.span(),
            DiagnosticCode.LOOP_INVARIANT_SYNTHESIZED, res.getMessage());
        return 1;
      case FAILED:
        diagnostics.reportWarning(loop.span(),
            DiagnosticCode.LOOP_INVARIANT_UNKNOWN, res.getMessage());
        return 0;
      default:
        // Unsupported loops are too common to report
        return 0;
    }
  }
}
