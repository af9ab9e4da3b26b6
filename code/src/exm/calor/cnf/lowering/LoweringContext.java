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
package exm.calor.cnf.lowering;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Stack;

import exm.calor.cnf.CnfStatement;
import exm.calor.cnf.SemanticType;
import exm.calor.common.exceptions.CalorRuntimeError;

/**
 * Mutable state for lowering a single function: name counters, known
 * variable types, the statement list being filled and enclosing loops.
 * A fresh context is created for every function, so numbering restarts
 * at 1 each time.
 */
class LoweringContext {

  /**
   * Jump targets for break/continue in the innermost loop
   */
  static class LoopTargets {
    final String exitLabel;
    /** Continue target, or null if allocated on first use */
    private String continueLabel;
    private final String continuePrefix;

    LoopTargets(String exitLabel, String continueLabel,
                String continuePrefix) {
      this.exitLabel = exitLabel;
      this.continueLabel = continueLabel;
      this.continuePrefix = continuePrefix;
    }

    /**
     * @return continue label if some continue statement jumped to it
     */
    String usedContinueLabel() {
      return continuePrefix == null ? null : continueLabel;
    }
  }

  private final String functionId;
  private int tempCounter = 0;
  private int labelCounter = 0;
  private final Map<String, SemanticType> varTypes =
                        new HashMap<String, SemanticType>();
  private final Stack<List<CnfStatement>> output =
                        new Stack<List<CnfStatement>>();
  private final Stack<LoopTargets> loops = new Stack<LoopTargets>();

  LoweringContext(String functionId) {
    this.functionId = functionId;
    output.push(new ArrayList<CnfStatement>());
  }

  String functionId() {
    return functionId;
  }

  String newTemp() {
    return "t" + (++tempCounter);
  }

  String newLabel(String prefix) {
    return prefix + "_" + (++labelCounter);
  }

  void declare(String name, SemanticType type) {
    varTypes.put(name, type);
  }

  /**
   * @return the known type of the variable, or OBJECT
   */
  SemanticType lookupType(String name) {
    SemanticType t = varTypes.get(name);
    return t == null ? SemanticType.OBJECT : t;
  }

  boolean isDeclared(String name) {
    return varTypes.containsKey(name);
  }

  void emit(CnfStatement stmt) {
    output.peek().add(stmt);
  }

  /**
   * Start collecting statements into a nested list, e.g. for a try body
   */
  void beginNested() {
    output.push(new ArrayList<CnfStatement>());
  }

  List<CnfStatement> endNested() {
    if (output.size() <= 1) {
      throw new CalorRuntimeError("endNested without beginNested");
    }
    return output.pop();
  }

  List<CnfStatement> statements() {
    assert(output.size() == 1) : "Unclosed nested statement list";
    return output.peek();
  }

  /**
   * @param continueLabel label to continue at, or null to allocate one
   *                      with continuePrefix when first needed
   */
  void pushLoop(String exitLabel, String continueLabel,
                String continuePrefix) {
    loops.push(new LoopTargets(exitLabel, continueLabel, continuePrefix));
  }

  LoopTargets popLoop() {
    return loops.pop();
  }

  /** @return innermost loop, or null if not in a loop */
  LoopTargets currentLoop() {
    return loops.isEmpty() ? null : loops.peek();
  }

  String continueTarget(LoopTargets loop) {
    if (loop.continueLabel == null) {
      loop.continueLabel = newLabel(loop.continuePrefix);
    }
    return loop.continueLabel;
  }
}
