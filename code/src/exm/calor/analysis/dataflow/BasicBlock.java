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
import java.util.List;

import exm.calor.ast.SourceSpan;
import exm.calor.binding.BoundExpression;
import exm.calor.binding.BoundStatement;

/**
 * Straight-line sequence of bound statements, optionally ending in a
 * conditional branch.
 */
public class BasicBlock {
  private final int id;
  private final List<BoundStatement> statements =
                                    new ArrayList<BoundStatement>();
  private final List<BasicBlock> predecessors = new ArrayList<BasicBlock>();
  private final List<BasicBlock> successors = new ArrayList<BasicBlock>();

  /** Condition evaluated at end of block, null if unconditional */
  private BoundExpression branchCondition = null;
  private boolean entry = false;
  private boolean exit = false;

  BasicBlock(int id) {
    this.id = id;
  }

  public int getId() {
    return id;
  }

  public List<BoundStatement> getStatements() {
    return Collections.unmodifiableList(statements);
  }

  void addStatement(BoundStatement stmt) {
    statements.add(stmt);
  }

  public List<BasicBlock> getPredecessors() {
    return Collections.unmodifiableList(predecessors);
  }

  public List<BasicBlock> getSuccessors() {
    return Collections.unmodifiableList(successors);
  }

  /**
   * Add edge, ignoring duplicates
   */
  void addSuccessor(BasicBlock succ) {
    if (!successors.contains(succ)) {
      successors.add(succ);
      succ.predecessors.add(this);
    }
  }

  public BoundExpression getBranchCondition() {
    return branchCondition;
  }

  void setBranchCondition(BoundExpression branchCondition) {
    this.branchCondition = branchCondition;
  }

  public boolean isEntry() {
    return entry;
  }

  void setEntry(boolean entry) {
    this.entry = entry;
  }

  public boolean isExit() {
    return exit;
  }

  void setExit(boolean exit) {
    this.exit = exit;
  }

  /**
   * @return location of first statement or condition, or null if empty
   */
  public SourceSpan getSpan() {
    if (!statements.isEmpty()) {
      return statements.get(0).span();
    } else if (branchCondition != null) {
      return branchCondition.span();
    }
    return null;
  }

  @Override
  public String toString() {
    return "BB" + id + " (" + statements.size() + " stmts)";
  }
}
