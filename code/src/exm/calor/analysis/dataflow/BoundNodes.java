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
import java.util.List;

import exm.calor.binding.BoundExpression;
import exm.calor.binding.BoundStatement;
import exm.calor.binding.VariableSymbol;

/**
 * Uses and definitions of variables in bound statements, as seen by a
 * basic block.  Nested bodies are not searched: the control flow graph
 * puts them in their own blocks.
 */
public class BoundNodes {

  public static List<VariableSymbol> usedVariables(BoundExpression e) {
    List<VariableSymbol> res = new ArrayList<VariableSymbol>();
    addUsedVariables(e, res);
    return res;
  }

  private static void addUsedVariables(BoundExpression e,
                                       List<VariableSymbol> acc) {
    if (e == null) {
      return;
    }
    switch (e.kind()) {
      case VARIABLE:
        acc.add(((BoundExpression.Variable) e).variable());
        break;
      case BINARY:
        addUsedVariables(((BoundExpression.Binary) e).left(), acc);
        addUsedVariables(((BoundExpression.Binary) e).right(), acc);
        break;
      case UNARY:
        addUsedVariables(((BoundExpression.Unary) e).operand(), acc);
        break;
      case CALL:
        for (BoundExpression arg: ((BoundExpression.Call) e).args()) {
          addUsedVariables(arg, acc);
        }
        break;
      default:
        // Literals
        break;
    }
  }

  public static List<VariableSymbol> usedVariables(BoundStatement stmt) {
    List<VariableSymbol> res = new ArrayList<VariableSymbol>();
    switch (stmt.kind()) {
      case BIND:
        addUsedVariables(((BoundStatement.Bind) stmt).initializer(), res);
        break;
      case ASSIGN:
        addUsedVariables(((BoundStatement.Assign) stmt).value(), res);
        break;
      case CALL:
        for (BoundExpression arg: ((BoundStatement.Call) stmt).args()) {
          addUsedVariables(arg, res);
        }
        break;
      case RETURN:
        addUsedVariables(((BoundStatement.Return) stmt).value(), res);
        break;
      case IF:
        addUsedVariables(((BoundStatement.If) stmt).condition(), res);
        break;
      case WHILE:
        addUsedVariables(((BoundStatement.While) stmt).condition(), res);
        break;
      case FOR: {
        BoundStatement.For f = (BoundStatement.For) stmt;
        addUsedVariables(f.from(), res);
        addUsedVariables(f.to(), res);
        addUsedVariables(f.step(), res);
        break;
      }
      default:
        break;
    }
    return res;
  }

  /**
   * @return variable given a value by the statement, or null.  A
   *    declaration without initializer defines nothing.
   */
  public static VariableSymbol definedVariable(BoundStatement stmt) {
    switch (stmt.kind()) {
      case BIND: {
        BoundStatement.Bind bind = (BoundStatement.Bind) stmt;
        return bind.initializer() == null ? null : bind.variable();
      }
      case ASSIGN:
        return ((BoundStatement.Assign) stmt).variable();
      case FOR:
        return ((BoundStatement.For) stmt).loopVariable();
      default:
        return null;
    }
  }
}
