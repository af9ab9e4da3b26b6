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
import java.util.List;

import org.apache.log4j.Logger;

import exm.calor.ast.BinaryOperator;
import exm.calor.ast.Expression;
import exm.calor.ast.Expression.Binary;
import exm.calor.ast.Expression.Call;
import exm.calor.ast.Expression.Conditional;
import exm.calor.ast.Expression.Unary;
import exm.calor.ast.Statement;
import exm.calor.ast.Statement.Assign;
import exm.calor.ast.Statement.Bind;
import exm.calor.ast.Statement.CallStatement;
import exm.calor.ast.Statement.CatchClause;
import exm.calor.ast.Statement.ElseIf;
import exm.calor.ast.Statement.For;
import exm.calor.ast.Statement.If;
import exm.calor.ast.Statement.Print;
import exm.calor.ast.Statement.Return;
import exm.calor.ast.Statement.Throw;
import exm.calor.ast.Statement.Try;
import exm.calor.ast.Statement.While;
import exm.calor.ast.SyntaxTree;
import exm.calor.ast.SyntaxTree.Parameter;
import exm.calor.ast.SyntaxTree.Requires;
import exm.calor.cnf.CnfBinaryOp;
import exm.calor.cnf.CnfExpression;
import exm.calor.cnf.CnfStatement;
import exm.calor.cnf.CnfStatement.Sequence;
import exm.calor.cnf.CnfTree;
import exm.calor.cnf.CnfUnaryOp;
import exm.calor.cnf.SemanticType;
import exm.calor.cnf.lowering.LoweringContext.LoopTargets;
import exm.calor.common.Logging;
import exm.calor.common.exceptions.CalorRuntimeError;

/**
 * Translate the structured tree into normal form.
 *
 * Evaluation order is made explicit: every compound sub-expression is
 * evaluated into a fresh temporary, left operand before right, and
 * structured control flow becomes labels, branches and gotos.  Functions
 * are lowered independently; temporaries and labels are numbered from 1
 * in each function, so lowering the same function twice gives the same
 * result.
 *
 * Preconditions become runtime checks that throw a contract violation.
 * Postconditions are only checked statically and are not lowered.
 */
public class CnfLowering {

  public static final String CONTRACT_VIOLATION_FACTORY =
                      "Calor.Runtime.ContractViolationException.Create";
  public static final String REQUIRES_TAG = "Requires";
  public static final String PRINT_LINE_TARGET = "Console.WriteLine";
  public static final String PRINT_TARGET = "Console.Write";

  /** Assignment target when the left hand side is not a plain name */
  public static final String UNKNOWN_TARGET = "_unknown_";

  private final Logger logger;

  public CnfLowering(Logger logger) {
    this.logger = logger;
  }

  public CnfLowering() {
    this(Logging.getCalorLogger());
  }

  public CnfTree.Module lowerModule(SyntaxTree.Module module) {
    logger.debug("Lowering module " + module.name() + ": " +
                 module.functions().size() + " functions");
    List<CnfTree.Function> functions = new ArrayList<CnfTree.Function>();
    for (SyntaxTree.Function f: module.functions()) {
      functions.add(lowerFunction(f));
    }
    return new CnfTree.Module(module.id(), module.name(),
                          CnfTree.DEFAULT_SEMANTICS_VERSION, functions);
  }

  public CnfTree.Function lowerFunction(SyntaxTree.Function function) {
    LoweringContext ctx = new LoweringContext(function.id());

    List<CnfTree.Parameter> params = new ArrayList<CnfTree.Parameter>();
    for (Parameter p: function.parameters()) {
      SemanticType t = SemanticType.fromTypeName(p.typeName());
      ctx.declare(p.name(), t);
      params.add(new CnfTree.Parameter(p.name(), t));
    }

    for (Requires pre: function.preconditions()) {
      lowerPrecondition(ctx, pre);
    }

    lowerStatements(ctx, function.body());

    SemanticType returnType = function.outputTypeName() == null ?
              SemanticType.VOID :
              SemanticType.fromTypeName(function.outputTypeName());
    CnfTree.Function result = new CnfTree.Function(function.id(),
            function.name(), params, returnType, ctx.statements());
    if (logger.isTraceEnabled()) {
      logger.trace("Lowered " + function.name() + ":\n" + result);
    }
    return result;
  }

  /**
   * requires C  ==>
   *    branch C -> ok, fail
   *  fail:
   *    t = ContractViolationException.Create(fnId, msg, "Requires")
   *    throw t
   *  ok:
   */
  private void lowerPrecondition(LoweringContext ctx, Requires pre) {
    CnfExpression cond = lowerExpression(ctx, pre.condition());
    String okLabel = ctx.newLabel("precond_ok");
    String failLabel = ctx.newLabel("precond_fail");
    ctx.emit(new CnfStatement.Branch(cond, okLabel, failLabel));
    ctx.emit(new CnfStatement.Label(failLabel));

    List<CnfExpression> args = new ArrayList<CnfExpression>();
    args.add(CnfExpression.createStringLit(ctx.functionId()));
    args.add(CnfExpression.createStringLit(
                      pre.message() == null ? "" : pre.message()));
    args.add(CnfExpression.createStringLit(REQUIRES_TAG));
    String violation = ctx.newTemp();
    ctx.emit(new CnfStatement.Assign(violation,
          CnfExpression.createCall(CONTRACT_VIOLATION_FACTORY, args,
                                   SemanticType.OBJECT),
          SemanticType.OBJECT));
    ctx.emit(new CnfStatement.Throw(
          CnfExpression.createVar(violation, SemanticType.OBJECT)));
    ctx.emit(new CnfStatement.Label(okLabel));
  }

  private void lowerStatements(LoweringContext ctx, List<Statement> stmts) {
    for (Statement stmt: stmts) {
      lowerStatement(ctx, stmt);
    }
  }

  private void lowerStatement(LoweringContext ctx, Statement stmt) {
    switch (stmt.kind()) {
      case BIND:
        lowerBind(ctx, (Bind) stmt);
        break;
      case ASSIGN:
        lowerAssign(ctx, (Assign) stmt);
        break;
      case CALL: {
        CallStatement call = (CallStatement) stmt;
        emitCall(ctx, call.target(), lowerArgs(ctx, call.args()));
        break;
      }
      case PRINT: {
        Print print = (Print) stmt;
        List<CnfExpression> args = new ArrayList<CnfExpression>();
        args.add(lowerExpression(ctx, print.value()));
        emitCall(ctx, print.isNewline() ? PRINT_LINE_TARGET : PRINT_TARGET,
                 args);
        break;
      }
      case RETURN: {
        Expression value = ((Return) stmt).value();
        ctx.emit(new CnfStatement.Return(
                value == null ? null : lowerExpression(ctx, value)));
        break;
      }
      case IF:
        lowerIf(ctx, (If) stmt);
        break;
      case WHILE:
        lowerWhile(ctx, (While) stmt);
        break;
      case FOR:
        lowerFor(ctx, (For) stmt);
        break;
      case BREAK:
      case CONTINUE:
        lowerLoopJump(ctx, stmt);
        break;
      case THROW:
        ctx.emit(new CnfStatement.Throw(
                lowerExpression(ctx, ((Throw) stmt).value())));
        break;
      case TRY:
        lowerTry(ctx, (Try) stmt);
        break;
      default:
        throw new CalorRuntimeError("Unexpected statement kind " +
                                    stmt.kind());
    }
  }

  private void lowerBind(LoweringContext ctx, Bind bind) {
    CnfExpression value;
    SemanticType type;
    if (bind.initializer() != null) {
      value = lowerExpression(ctx, bind.initializer());
      type = bind.typeName() != null ?
             SemanticType.fromTypeName(bind.typeName()) : value.getType();
    } else {
      type = SemanticType.fromTypeName(bind.typeName());
      value = type.defaultValue();
    }
    ctx.declare(bind.name(), type);
    ctx.emit(new CnfStatement.Assign(bind.name(), value, type));
  }

  private void lowerAssign(LoweringContext ctx, Assign assign) {
    String target;
    if (assign.target().kind() == Expression.ExpressionKind.REFERENCE) {
      target = ((Expression.Reference) assign.target()).name();
    } else {
      Logging.uniqueWarn("Assignment to " + assign.target().kind() +
                         " is lowered to " + UNKNOWN_TARGET);
      target = UNKNOWN_TARGET;
    }
    CnfExpression value = lowerExpression(ctx, assign.value());
    SemanticType type = ctx.isDeclared(target) ?
                        ctx.lookupType(target) : value.getType();
    ctx.emit(new CnfStatement.Assign(target, value, type));
  }

  private void emitCall(LoweringContext ctx, String target,
                        List<CnfExpression> args) {
    ctx.emit(new CnfStatement.Assign(ctx.newTemp(),
        CnfExpression.createCall(target, args, SemanticType.VOID),
        SemanticType.VOID));
  }

  /**
   * if c1 {A} elseif c2 {B} else {C}  ==>
   *    branch c1 -> then, else
   *  then:  A; goto endif
   *  else:  branch c2 -> elseif_then, elseif_next
   *  elseif_then:  B; goto endif
   *  elseif_next:  C
   *  endif:
   *
   * Labels are only created for blocks that exist, so every label is
   * jumped to.
   */
  private void lowerIf(LoweringContext ctx, If stmt) {
    boolean hasElseIfs = !stmt.elseIfs().isEmpty();
    boolean hasElse = stmt.elseBody() != null;

    CnfExpression cond = lowerExpression(ctx, stmt.condition());
    String thenLabel = ctx.newLabel("then");
    String elseLabel = (hasElseIfs || hasElse) ? ctx.newLabel("else") : null;
    String endLabel = ctx.newLabel("endif");

    ctx.emit(new CnfStatement.Branch(cond, thenLabel,
                        elseLabel != null ? elseLabel : endLabel));
    ctx.emit(new CnfStatement.Label(thenLabel));
    lowerStatements(ctx, stmt.thenBody());
    ctx.emit(new CnfStatement.Goto(endLabel));

    String pending = elseLabel;
    List<ElseIf> elseIfs = stmt.elseIfs();
    for (int i = 0; i < elseIfs.size(); i++) {
      ElseIf elseIf = elseIfs.get(i);
      boolean more = i < elseIfs.size() - 1 || hasElse;
      ctx.emit(new CnfStatement.Label(pending));
      CnfExpression c = lowerExpression(ctx, elseIf.condition);
      String branchThen = ctx.newLabel("elseif_then");
      String next = more ? ctx.newLabel("elseif_next") : endLabel;
      ctx.emit(new CnfStatement.Branch(c, branchThen, next));
      ctx.emit(new CnfStatement.Label(branchThen));
      lowerStatements(ctx, elseIf.body);
      ctx.emit(new CnfStatement.Goto(endLabel));
      pending = more ? next : null;
    }

    if (hasElse) {
      ctx.emit(new CnfStatement.Label(pending));
      lowerStatements(ctx, stmt.elseBody());
    }
    ctx.emit(new CnfStatement.Label(endLabel));
  }

  private void lowerWhile(LoweringContext ctx, While stmt) {
    String header = ctx.newLabel("while_header");
    String body = ctx.newLabel("while_body");
    String exit = ctx.newLabel("while_exit");

    ctx.emit(new CnfStatement.Label(header));
    CnfExpression cond = lowerExpression(ctx, stmt.condition());
    ctx.emit(new CnfStatement.Branch(cond, body, exit));
    ctx.emit(new CnfStatement.Label(body));
    ctx.pushLoop(exit, header, null);
    lowerStatements(ctx, stmt.body());
    ctx.popLoop();
    ctx.emit(new CnfStatement.Goto(header));
    ctx.emit(new CnfStatement.Label(exit));
  }

  /**
   * for i = from to bound step s {A}  ==>
   *    i = from
   *  for_header:
   *    tc = i < bound
   *    branch tc -> for_body, for_exit
   *  for_body:
   *    A
   *    ti = i + s
   *    i = ti
   *    goto for_header
   *  for_exit:
   */
  private void lowerFor(LoweringContext ctx, For stmt) {
    CnfExpression from = lowerExpression(ctx, stmt.from());
    ctx.declare(stmt.variable(), SemanticType.INT);
    ctx.emit(new CnfStatement.Assign(stmt.variable(), from,
                                     SemanticType.INT));
    CnfExpression loopVar = CnfExpression.createVar(stmt.variable(),
                                                    SemanticType.INT);

    String header = ctx.newLabel("for_header");
    String body = ctx.newLabel("for_body");
    String exit = ctx.newLabel("for_exit");

    ctx.emit(new CnfStatement.Label(header));
    CnfExpression bound = lowerExpression(ctx, stmt.to());
    String cond = ctx.newTemp();
    ctx.emit(new CnfStatement.Assign(cond,
        CnfExpression.createBinaryOp(CnfBinaryOp.LESS_THAN, loopVar, bound,
                                     SemanticType.BOOL),
        SemanticType.BOOL));
    ctx.emit(new CnfStatement.Branch(
        CnfExpression.createVar(cond, SemanticType.BOOL), body, exit));
    ctx.emit(new CnfStatement.Label(body));

    ctx.pushLoop(exit, null, "for_continue");
    lowerStatements(ctx, stmt.body());
    LoopTargets loop = ctx.popLoop();
    if (loop.usedContinueLabel() != null) {
      ctx.emit(new CnfStatement.Label(loop.usedContinueLabel()));
    }

    CnfExpression step = stmt.step() == null ? CnfExpression.createIntLit(1)
                                             : lowerExpression(ctx, stmt.step());
    String next = ctx.newTemp();
    ctx.emit(new CnfStatement.Assign(next,
        CnfExpression.createBinaryOp(CnfBinaryOp.ADD, loopVar, step,
                                     SemanticType.INT),
        SemanticType.INT));
    ctx.emit(new CnfStatement.Assign(stmt.variable(),
        CnfExpression.createVar(next, SemanticType.INT), SemanticType.INT));
    ctx.emit(new CnfStatement.Goto(header));
    ctx.emit(new CnfStatement.Label(exit));
  }

  private void lowerLoopJump(LoweringContext ctx, Statement stmt) {
    LoopTargets loop = ctx.currentLoop();
    if (loop == null) {
      Logging.uniqueWarn(stmt.kind().name().toLowerCase() +
                         " outside of a loop at " + stmt.span() +
                         " was dropped");
      return;
    }
    if (stmt.kind() == Statement.StatementKind.BREAK) {
      ctx.emit(new CnfStatement.Goto(loop.exitLabel));
    } else {
      ctx.emit(new CnfStatement.Goto(ctx.continueTarget(loop)));
    }
  }

  private void lowerTry(LoweringContext ctx, Try stmt) {
    ctx.beginNested();
    lowerStatements(ctx, stmt.body());
    Sequence body = new Sequence(ctx.endNested());

    List<CnfStatement.CatchClause> catches =
                        new ArrayList<CnfStatement.CatchClause>();
    for (CatchClause c: stmt.catchClauses()) {
      if (c.variableName != null) {
        ctx.declare(c.variableName, SemanticType.OBJECT);
      }
      ctx.beginNested();
      lowerStatements(ctx, c.body);
      catches.add(new CnfStatement.CatchClause(c.exceptionType,
                      c.variableName, new Sequence(ctx.endNested())));
    }

    Sequence finallyBody = null;
    if (stmt.finallyBody() != null) {
      ctx.beginNested();
      lowerStatements(ctx, stmt.finallyBody());
      finallyBody = new Sequence(ctx.endNested());
    }
    ctx.emit(new CnfStatement.Try(body, catches, finallyBody));
  }

  private List<CnfExpression> lowerArgs(LoweringContext ctx,
                                        List<Expression> args) {
    List<CnfExpression> res = new ArrayList<CnfExpression>(args.size());
    for (Expression arg: args) {
      res.add(lowerExpression(ctx, arg));
    }
    return res;
  }

  /**
   * Lower an expression, emitting any statements needed to compute it.
   * @return an atomic expression holding the value
   */
  private CnfExpression lowerExpression(LoweringContext ctx, Expression e) {
    switch (e.kind()) {
      case INT_LITERAL:
        return CnfExpression.createIntLit(
                    ((Expression.IntLiteral) e).value());
      case FLOAT_LITERAL:
        return CnfExpression.createDoubleLit(
                    ((Expression.FloatLiteral) e).value());
      case BOOL_LITERAL:
        return CnfExpression.createBoolLit(
                    ((Expression.BoolLiteral) e).value());
      case STRING_LITERAL:
        return CnfExpression.createStringLit(
                    ((Expression.StringLiteral) e).value());
      case REFERENCE: {
        String name = ((Expression.Reference) e).name();
        return CnfExpression.createVar(name, ctx.lookupType(name));
      }
      case BINARY:
        return lowerBinary(ctx, (Binary) e);
      case UNARY:
        return lowerUnary(ctx, (Unary) e);
      case CALL: {
        Call call = (Call) e;
        List<CnfExpression> args = lowerArgs(ctx, call.args());
        return assignTemp(ctx, CnfExpression.createCall(call.target(), args,
                                                 SemanticType.OBJECT));
      }
      case CONDITIONAL:
        return lowerConditional(ctx, (Conditional) e);
      case SOME:
      case NONE:
      case OK:
      case ERR:
      case FIELD_ACCESS:
      case RECORD_CREATION:
      case ARRAY_ACCESS:
      case FORALL:
      case EXISTS:
      case IMPLICATION:
        // No normal form counterpart yet
        Logging.uniqueWarn("Expression kind " + e.kind() +
            " is not supported by lowering, replaced with 0");
        return CnfExpression.createIntLit(0);
      default:
        throw new CalorRuntimeError("Unexpected expression kind " +
                                    e.kind());
    }
  }

  private CnfExpression assignTemp(LoweringContext ctx,
                                   CnfExpression value) {
    String temp = ctx.newTemp();
    ctx.emit(new CnfStatement.Assign(temp, value, value.getType()));
    return CnfExpression.createVar(temp, value.getType());
  }

  private CnfExpression lowerBinary(LoweringContext ctx, Binary e) {
    if (e.op() == BinaryOperator.AND) {
      return lowerShortCircuit(ctx, e, true);
    } else if (e.op() == BinaryOperator.OR) {
      return lowerShortCircuit(ctx, e, false);
    }
    CnfExpression left = lowerExpression(ctx, e.left());
    CnfExpression right = lowerExpression(ctx, e.right());
    SemanticType type = SemanticType.binaryResultType(e.op(),
                                    left.getType(), right.getType());
    return assignTemp(ctx, CnfExpression.createBinaryOp(
                   CnfBinaryOp.fromSource(e.op()), left, right, type));
  }

  /**
   * a && b  ==>
   *    t = false
   *    branch a -> and_then, and_end
   *  and_then:
   *    t = b
   *    goto and_end
   *  and_end:
   *
   * a || b starts from true and evaluates b only when a is false.
   */
  private CnfExpression lowerShortCircuit(LoweringContext ctx, Binary e,
                                          boolean isAnd) {
    String result = ctx.newTemp();
    ctx.emit(new CnfStatement.Assign(result,
                  CnfExpression.createBoolLit(!isAnd), SemanticType.BOOL));
    CnfExpression left = lowerExpression(ctx, e.left());

    String evalRight = ctx.newLabel(isAnd ? "and_then" : "or_else");
    String end = ctx.newLabel(isAnd ? "and_end" : "or_end");
    if (isAnd) {
      ctx.emit(new CnfStatement.Branch(left, evalRight, end));
    } else {
      ctx.emit(new CnfStatement.Branch(left, end, evalRight));
    }
    ctx.emit(new CnfStatement.Label(evalRight));
    CnfExpression right = lowerExpression(ctx, e.right());
    ctx.emit(new CnfStatement.Assign(result, right, SemanticType.BOOL));
    ctx.emit(new CnfStatement.Goto(end));
    ctx.emit(new CnfStatement.Label(end));
    return CnfExpression.createVar(result, SemanticType.BOOL);
  }

  private CnfExpression lowerUnary(LoweringContext ctx, Unary e) {
    CnfExpression operand = lowerExpression(ctx, e.operand());
    return assignTemp(ctx, CnfExpression.createUnaryOp(
          CnfUnaryOp.fromSource(e.op()), operand, operand.getType()));
  }

  /**
   * The result temporary takes the type of the true arm; each arm's
   * assignment carries that arm's own type.
   */
  private CnfExpression lowerConditional(LoweringContext ctx,
                                         Conditional e) {
    String result = ctx.newTemp();
    String trueLabel = ctx.newLabel("cond_true");
    String falseLabel = ctx.newLabel("cond_false");
    String endLabel = ctx.newLabel("cond_end");

    CnfExpression cond = lowerExpression(ctx, e.condition());
    ctx.emit(new CnfStatement.Branch(cond, trueLabel, falseLabel));

    ctx.emit(new CnfStatement.Label(trueLabel));
    CnfExpression whenTrue = lowerExpression(ctx, e.whenTrue());
    SemanticType type = whenTrue.getType();
    ctx.emit(new CnfStatement.Assign(result, whenTrue, type));
    ctx.emit(new CnfStatement.Goto(endLabel));

    ctx.emit(new CnfStatement.Label(falseLabel));
    CnfExpression whenFalse = lowerExpression(ctx, e.whenFalse());
    ctx.emit(new CnfStatement.Assign(result, whenFalse,
                                     whenFalse.getType()));
    ctx.emit(new CnfStatement.Goto(endLabel));

    ctx.emit(new CnfStatement.Label(endLabel));
    return CnfExpression.createVar(result, type);
  }
}
