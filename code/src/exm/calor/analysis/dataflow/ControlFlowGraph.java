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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exm.calor.ast.BinaryOperator;
import exm.calor.binding.BoundExpression;
import exm.calor.binding.BoundStatement;
import exm.calor.binding.BoundTree.BoundFunction;

/**
 * Control flow graph of a single bound function.
 *
 * Loops are represented with a condition block that branches to the body
 * and to the block after the loop.  A for loop keeps its FOR statement,
 * which defines the loop variable, at the end of the block before the
 * condition block, and the condition block tests {@code var < to}.
 */
public class ControlFlowGraph {
  private final BoundFunction function;
  private final BasicBlock entry;
  private final BasicBlock exit;
  private final List<BasicBlock> blocks;

  private ControlFlowGraph(BoundFunction function, BasicBlock entry,
                           BasicBlock exit, List<BasicBlock> blocks) {
    this.function = function;
    this.entry = entry;
    this.exit = exit;
    this.blocks = Collections.unmodifiableList(blocks);
  }

  public static ControlFlowGraph build(BoundFunction function) {
    return new Builder().build(function);
  }

  public BoundFunction getFunction() {
    return function;
  }

  public BasicBlock getEntry() {
    return entry;
  }

  public BasicBlock getExit() {
    return exit;
  }

  /**
   * @return all blocks, including unreachable ones, in creation order
   */
  public List<BasicBlock> getBlocks() {
    return blocks;
  }

  /**
   * @return blocks reachable from entry in reverse post-order
   */
  public List<BasicBlock> getReversePostOrder() {
    List<BasicBlock> order = getPostOrder();
    Collections.reverse(order);
    return order;
  }

  /**
   * @return blocks reachable from entry in post-order
   */
  public List<BasicBlock> getPostOrder() {
    List<BasicBlock> postOrder = new ArrayList<BasicBlock>();
    Set<BasicBlock> visited = new HashSet<BasicBlock>();
    // Iterative DFS: stack holds block and index of next successor
    Deque<BasicBlock> stack = new ArrayDeque<BasicBlock>();
    Deque<Integer> nextSucc = new ArrayDeque<Integer>();
    visited.add(entry);
    stack.push(entry);
    nextSucc.push(0);
    while (!stack.isEmpty()) {
      BasicBlock curr = stack.peek();
      int i = nextSucc.pop();
      if (i < curr.getSuccessors().size()) {
        nextSucc.push(i + 1);
        BasicBlock succ = curr.getSuccessors().get(i);
        if (visited.add(succ)) {
          stack.push(succ);
          nextSucc.push(0);
        }
      } else {
        stack.pop();
        postOrder.add(curr);
      }
    }
    return postOrder;
  }

  /**
   * Render in graphviz format
   */
  public String toDot() {
    StringBuilder sb = new StringBuilder();
    sb.append("digraph \"").append(function.getName()).append("\" {\n");
    for (BasicBlock b: blocks) {
      sb.append("  BB").append(b.getId()).append(" [label=\"BB")
        .append(b.getId());
      if (b.isEntry()) {
        sb.append(" (entry)");
      } else if (b.isExit()) {
        sb.append(" (exit)");
      }
      for (BoundStatement stmt: b.getStatements()) {
        sb.append("\\n").append(stmt.kind());
      }
      if (b.getBranchCondition() != null) {
        sb.append("\\nif ").append(escape(b.getBranchCondition().toString()));
      }
      sb.append("\"];\n");
    }
    for (BasicBlock b: blocks) {
      for (BasicBlock succ: b.getSuccessors()) {
        sb.append("  BB").append(b.getId()).append(" -> BB")
          .append(succ.getId()).append(";\n");
      }
    }
    sb.append("}\n");
    return sb.toString();
  }

  private static String escape(String s) {
    return s.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  @Override
  public String toString() {
    return "CFG " + function.getName() + ": " + blocks.size() + " blocks";
  }

  private static class Builder {
    private final List<BasicBlock> blocks = new ArrayList<BasicBlock>();
    private int nextId = 0;
    private BasicBlock current;
    private BasicBlock exit;

    private final Deque<BasicBlock> loopExits = new ArrayDeque<BasicBlock>();
    private final Deque<BasicBlock> loopConditions =
                                        new ArrayDeque<BasicBlock>();

    ControlFlowGraph build(BoundFunction function) {
      BasicBlock entry = newBlock();
      entry.setEntry(true);
      exit = newBlock();
      exit.setExit(true);

      current = entry;
      processStatements(function.getBody());

      if (current != exit && current.getSuccessors().isEmpty()) {
        current.addSuccessor(exit);
      }
      return new ControlFlowGraph(function, entry, exit, blocks);
    }

    private BasicBlock newBlock() {
      BasicBlock b = new BasicBlock(nextId++);
      blocks.add(b);
      return b;
    }

    private void processStatements(List<BoundStatement> stmts) {
      for (BoundStatement stmt: stmts) {
        processStatement(stmt);
      }
    }

    private void processStatement(BoundStatement stmt) {
      switch (stmt.kind()) {
        case RETURN:
          current.addStatement(stmt);
          current.addSuccessor(exit);
          // Anything after return is unreachable
          current = newBlock();
          break;
        case IF:
          processIf((BoundStatement.If) stmt);
          break;
        case WHILE:
          processWhile((BoundStatement.While) stmt);
          break;
        case FOR:
          processFor((BoundStatement.For) stmt);
          break;
        case BREAK:
          current.addStatement(stmt);
          if (!loopExits.isEmpty()) {
            current.addSuccessor(loopExits.peek());
          }
          current = newBlock();
          break;
        case CONTINUE:
          current.addStatement(stmt);
          if (!loopConditions.isEmpty()) {
            current.addSuccessor(loopConditions.peek());
          }
          current = newBlock();
          break;
        default:
          current.addStatement(stmt);
          break;
      }
    }

    /** Link current block to target unless it already jumped elsewhere */
    private void fallThrough(BasicBlock target) {
      if (current.getSuccessors().isEmpty()) {
        current.addSuccessor(target);
      }
    }

    private void processIf(BoundStatement.If stmt) {
      BasicBlock condBlock = current;
      condBlock.setBranchCondition(stmt.condition());

      BasicBlock thenBlock = newBlock();
      BasicBlock merge = newBlock();

      condBlock.addSuccessor(thenBlock);
      current = thenBlock;
      processStatements(stmt.thenBody());
      fallThrough(merge);

      // False edge of each test leads to the next test
      BasicBlock prevTest = condBlock;
      for (BoundStatement.ElseIf elseIf: stmt.elseIfs()) {
        BasicBlock test = newBlock();
        prevTest.addSuccessor(test);
        test.setBranchCondition(elseIf.condition);

        BasicBlock body = newBlock();
        test.addSuccessor(body);
        current = body;
        processStatements(elseIf.body);
        fallThrough(merge);
        prevTest = test;
      }

      if (stmt.elseBody() != null && !stmt.elseBody().isEmpty()) {
        BasicBlock elseBlock = newBlock();
        prevTest.addSuccessor(elseBlock);
        current = elseBlock;
        processStatements(stmt.elseBody());
        fallThrough(merge);
      } else {
        prevTest.addSuccessor(merge);
      }
      current = merge;
    }

    private void processWhile(BoundStatement.While stmt) {
      BasicBlock cond = newBlock();
      BasicBlock body = newBlock();
      BasicBlock after = newBlock();

      current.addSuccessor(cond);
      cond.setBranchCondition(stmt.condition());
      cond.addSuccessor(body);
      cond.addSuccessor(after);

      processLoopBody(stmt.body(), cond, body, after);
    }

    private void processFor(BoundStatement.For stmt) {
      // Pre-header defines the loop variable
      current.addStatement(stmt);

      BasicBlock header = newBlock();
      BasicBlock body = newBlock();
      BasicBlock after = newBlock();

      current.addSuccessor(header);
      header.setBranchCondition(loopCondition(stmt));
      header.addSuccessor(body);
      header.addSuccessor(after);

      processLoopBody(stmt.body(), header, body, after);
    }

    private void processLoopBody(List<BoundStatement> stmts,
        BasicBlock cond, BasicBlock body, BasicBlock after) {
      loopConditions.push(cond);
      loopExits.push(after);
      current = body;
      processStatements(stmts);
      fallThrough(cond);
      loopConditions.pop();
      loopExits.pop();
      current = after;
    }
  }

  /**
   * @return the condition {@code var < to} tested before each iteration
   */
  public static BoundExpression loopCondition(BoundStatement.For stmt) {
    return new BoundExpression.Binary(stmt.span(), BinaryOperator.LESS_THAN,
        new BoundExpression.Variable(stmt.span(), stmt.loopVariable()),
        stmt.to(), "BOOL");
  }
}
