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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.calor.ast.BinaryOperator;
import exm.calor.ast.Expression;
import exm.calor.ast.SourceSpan;
import exm.calor.ast.Statement;
import exm.calor.ast.SyntaxTree;
import exm.calor.ast.SyntaxTree.Parameter;
import exm.calor.ast.SyntaxTree.Requires;
import exm.calor.cnf.CnfBinaryOp;
import exm.calor.cnf.CnfExpression;
import exm.calor.cnf.CnfExpression.ExprKind;
import exm.calor.cnf.CnfStatement;
import exm.calor.cnf.CnfStatement.StatementType;
import exm.calor.cnf.CnfTree;
import exm.calor.cnf.CnfValidator;
import exm.calor.cnf.SemanticType;
import exm.calor.common.Logging;

public class CnfLoweringTest {

  private static Logger logger;

  @BeforeClass
  public static void setupLogging() {
    logger = Logging.setupLogging(null, false);
  }

  private static List<Parameter> intParams(String... names) {
    List<Parameter> res = new ArrayList<Parameter>();
    for (String name: names) {
      res.add(new Parameter(name, "INT"));
    }
    return res;
  }

  private static SyntaxTree.Function fn(String name, List<Parameter> params,
      List<Requires> pre, Statement... body) {
    return new SyntaxTree.Function(SourceSpan.UNKNOWN, "f_" + name, name,
        params, "INT", pre, Collections.<SyntaxTree.Ensures>emptyList(),
        Arrays.asList(body));
  }

  private static SyntaxTree.Function fn(String name, List<Parameter> params,
                                        Statement... body) {
    return fn(name, params, Collections.<Requires>emptyList(), body);
  }

  /** Lower, check the result is well formed, return its statements */
  private static List<CnfStatement> lower(SyntaxTree.Function f) {
    CnfTree.Function lowered = new CnfLowering(logger).lowerFunction(f);
    CnfValidator.validate(logger, lowered);
    return lowered.body();
  }

  private static List<String> labels(List<CnfStatement> stmts) {
    List<String> res = new ArrayList<String>();
    for (CnfStatement stmt: CnfStatement.flatten(stmts)) {
      if (stmt.type() == StatementType.LABEL) {
        res.add(((CnfStatement.Label) stmt).name());
      }
    }
    return res;
  }

  @Test
  public void testOperandsEvaluatedIntoTemporaries() {
    // return a + b * c
    List<CnfStatement> body = lower(fn("calc", intParams("a", "b", "c"),
        new Statement.Return(Expression.binary(BinaryOperator.ADD,
            Expression.ref("a"),
            Expression.binary(BinaryOperator.MULTIPLY, Expression.ref("b"),
                              Expression.ref("c"))))));
    assertEquals(3, body.size());

    CnfStatement.Assign t1 = (CnfStatement.Assign) body.get(0);
    assertEquals("t1", t1.target());
    assertEquals(CnfBinaryOp.MULTIPLY, t1.value().getBinaryOp());
    assertEquals(SemanticType.INT, t1.targetType());

    CnfStatement.Assign t2 = (CnfStatement.Assign) body.get(1);
    assertEquals("t2", t2.target());
    assertEquals(CnfBinaryOp.ADD, t2.value().getBinaryOp());
    assertEquals("a", t2.value().getLeft().getVarName());
    assertEquals("t1", t2.value().getRight().getVarName());

    CnfStatement.Return ret = (CnfStatement.Return) body.get(2);
    assertEquals("t2", ret.value().getVarName());
  }

  @Test
  public void testNumberingRestartsPerFunction() {
    SyntaxTree.Function f = fn("f", intParams("x"),
        new Statement.Return(Expression.binary(BinaryOperator.ADD,
            Expression.ref("x"), Expression.intLit(1))));
    SyntaxTree.Function g = fn("g", intParams("x"),
        new Statement.Return(Expression.binary(BinaryOperator.SUBTRACT,
            Expression.ref("x"), Expression.intLit(1))));
    CnfTree.Module m = new CnfLowering(logger).lowerModule(
        new SyntaxTree.Module("m001", "Test", Arrays.asList(f, g)));
    CnfValidator.validate(logger, m);

    assertEquals(CnfTree.DEFAULT_SEMANTICS_VERSION, m.semanticsVersion());
    assertEquals("t1", ((CnfStatement.Assign)
        m.lookupFunction("g").body().get(0)).target());
    // Same input, same output
    assertEquals(new CnfLowering(logger).lowerFunction(f),
                 m.lookupFunction("f"));
  }

  @Test
  public void testPrecondition() {
    Requires pre = new Requires(SourceSpan.UNKNOWN,
        Expression.binary(BinaryOperator.GREATER_THAN, Expression.ref("x"),
                          Expression.intLit(0)), "x must be positive");
    List<CnfStatement> body = lower(fn("checked", intParams("x"),
        Arrays.asList(pre), new Statement.Return(Expression.ref("x"))));

    // t1 = x > 0; branch; fail label; t2 = create(...); throw; ok label
    assertEquals(StatementType.BRANCH, body.get(1).type());
    CnfStatement.Branch branch = (CnfStatement.Branch) body.get(1);
    assertEquals("precond_ok_1", branch.trueLabel());
    assertEquals("precond_fail_2", branch.falseLabel());

    CnfExpression create = ((CnfStatement.Assign) body.get(3)).value();
    assertEquals(ExprKind.CALL, create.getKind());
    assertEquals(CnfLowering.CONTRACT_VIOLATION_FACTORY,
                 create.getCallTarget());
    assertEquals("f_checked", create.getArgs().get(0).getLiteralValue());
    assertEquals("x must be positive",
                 create.getArgs().get(1).getLiteralValue());
    assertEquals(CnfLowering.REQUIRES_TAG,
                 create.getArgs().get(2).getLiteralValue());
    assertEquals(StatementType.THROW, body.get(4).type());
    assertEquals("precond_ok_1",
                 ((CnfStatement.Label) body.get(5)).name());
  }

  @Test
  public void testIfElseIfElse() {
    Statement.If stmt = new Statement.If(SourceSpan.UNKNOWN,
        Expression.binary(BinaryOperator.LESS_THAN, Expression.ref("x"),
                          Expression.intLit(0)),
        Arrays.<Statement>asList(new Statement.Return(Expression.intLit(-1))),
        Arrays.asList(new Statement.ElseIf(
            Expression.binary(BinaryOperator.EQUAL, Expression.ref("x"),
                              Expression.intLit(0)),
            Arrays.<Statement>asList(
                new Statement.Return(Expression.intLit(0))))),
        Arrays.<Statement>asList(new Statement.Return(Expression.intLit(1))));
    List<CnfStatement> body = lower(fn("sign", intParams("x"), stmt));
    assertEquals(Arrays.asList("then_1", "else_2", "elseif_then_4",
                               "elseif_next_5", "endif_3"), labels(body));
  }

  @Test
  public void testIfWithoutElse() {
    List<CnfStatement> body = lower(fn("f", intParams("x"),
        new Statement.If(Expression.ref("x"),
            Arrays.<Statement>asList(new Statement.Assign("x",
                                                Expression.intLit(1))),
            null),
        new Statement.Return(Expression.ref("x"))));
    assertEquals(Arrays.asList("then_1", "endif_2"), labels(body));
  }

  @Test
  public void testWhileWithBreakAndContinue() {
    Statement.While loop = new Statement.While(SourceSpan.UNKNOWN,
        Expression.binary(BinaryOperator.GREATER_THAN, Expression.ref("n"),
                          Expression.intLit(0)),
        Arrays.<Statement>asList(
            new Statement.Assign("n", Expression.binary(
                BinaryOperator.SUBTRACT, Expression.ref("n"),
                Expression.intLit(1))),
            new Statement.If(Expression.binary(BinaryOperator.EQUAL,
                    Expression.ref("n"), Expression.intLit(5)),
                Arrays.<Statement>asList(new Statement.Break(
                                                  SourceSpan.UNKNOWN)),
                Arrays.<Statement>asList(new Statement.Continue(
                                                  SourceSpan.UNKNOWN)))));
    List<CnfStatement> body = lower(fn("loop", intParams("n"), loop,
        new Statement.Return(Expression.ref("n"))));

    List<String> gotos = new ArrayList<String>();
    for (CnfStatement stmt: body) {
      if (stmt.type() == StatementType.GOTO) {
        gotos.add(((CnfStatement.Goto) stmt).label());
      }
    }
    assertTrue(gotos.contains("while_exit_3"));
    assertTrue(gotos.contains("while_header_1"));
  }

  @Test
  public void testForLoop() {
    Statement.For loop = new Statement.For(SourceSpan.UNKNOWN, "i",
        Expression.intLit(0), Expression.ref("n"), Expression.intLit(2),
        Arrays.<Statement>asList(
            new Statement.Continue(SourceSpan.UNKNOWN)));
    List<CnfStatement> body = lower(fn("count", intParams("n"), loop,
        new Statement.Return(Expression.intLit(0))));

    CnfStatement.Assign init = (CnfStatement.Assign) body.get(0);
    assertEquals("i", init.target());
    assertEquals(0L, init.value().getLiteralValue());

    CnfStatement.Assign cond = (CnfStatement.Assign) body.get(2);
    assertEquals(CnfBinaryOp.LESS_THAN, cond.value().getBinaryOp());
    assertEquals(SemanticType.BOOL, cond.targetType());

    assertEquals(Arrays.asList("for_header_1", "for_body_2",
        "for_continue_4", "for_exit_3"), labels(body));
  }

  @Test
  public void testShortCircuitAnd() {
    List<CnfStatement> body = lower(fn("both", intParams("a", "b"),
        new Statement.Return(Expression.binary(BinaryOperator.AND,
            Expression.ref("a"), Expression.ref("b")))));
    CnfStatement.Assign init = (CnfStatement.Assign) body.get(0);
    assertEquals(Boolean.FALSE, init.value().getLiteralValue());
    CnfStatement.Branch branch = (CnfStatement.Branch) body.get(1);
    assertEquals("a", branch.condition().getVarName());
    assertEquals("and_then_1", branch.trueLabel());
    assertEquals("and_end_2", branch.falseLabel());
    CnfStatement.Return ret = (CnfStatement.Return)
                                          body.get(body.size() - 1);
    assertEquals(init.target(), ret.value().getVarName());
  }

  @Test
  public void testShortCircuitOr() {
    List<CnfStatement> body = lower(fn("either", intParams("a", "b"),
        new Statement.Return(Expression.binary(BinaryOperator.OR,
            Expression.ref("a"), Expression.ref("b")))));
    assertEquals(7, body.size());
    CnfStatement.Assign init = (CnfStatement.Assign) body.get(0);
    assertEquals(Boolean.TRUE, init.value().getLiteralValue());
    assertEquals(SemanticType.BOOL, init.targetType());

    // b is only evaluated when a is false
    CnfStatement.Branch branch = (CnfStatement.Branch) body.get(1);
    assertEquals("a", branch.condition().getVarName());
    assertEquals("or_end_2", branch.trueLabel());
    assertEquals("or_else_1", branch.falseLabel());
    assertEquals(Arrays.asList("or_else_1", "or_end_2"), labels(body));

    CnfStatement.Assign fromRight = (CnfStatement.Assign) body.get(3);
    assertEquals(init.target(), fromRight.target());
    assertEquals("b", fromRight.value().getVarName());
    CnfStatement.Return ret = (CnfStatement.Return) body.get(6);
    assertEquals(init.target(), ret.value().getVarName());
  }

  @Test
  public void testConditionalExpression() {
    // return a > 0 ? 1 : "none"
    List<CnfStatement> body = lower(fn("pick", intParams("a"),
        new Statement.Return(new Expression.Conditional(SourceSpan.UNKNOWN,
            Expression.binary(BinaryOperator.GREATER_THAN,
                Expression.ref("a"), Expression.intLit(0)),
            Expression.intLit(1), Expression.stringLit("none")))));
    assertEquals(Arrays.asList("cond_true_1", "cond_false_2", "cond_end_3"),
                 labels(body));

    CnfStatement.Assign cond = (CnfStatement.Assign) body.get(0);
    assertEquals("t2", cond.target());
    assertEquals(CnfBinaryOp.GREATER_THAN, cond.value().getBinaryOp());
    CnfStatement.Branch branch = (CnfStatement.Branch) body.get(1);
    assertEquals("t2", branch.condition().getVarName());
    assertEquals("cond_true_1", branch.trueLabel());
    assertEquals("cond_false_2", branch.falseLabel());

    CnfStatement.Assign whenTrue = (CnfStatement.Assign) body.get(3);
    assertEquals("t1", whenTrue.target());
    assertEquals(SemanticType.INT, whenTrue.targetType());
    CnfStatement.Assign whenFalse = (CnfStatement.Assign) body.get(6);
    assertEquals("t1", whenFalse.target());
    assertEquals("none", whenFalse.value().getLiteralValue());
    assertEquals(SemanticType.STRING, whenFalse.targetType());

    CnfStatement.Return ret = (CnfStatement.Return) body.get(9);
    assertEquals("t1", ret.value().getVarName());
    assertEquals(SemanticType.INT, ret.value().getType());
  }

  @Test
  public void testBindDefaultsAndPrint() {
    List<CnfStatement> body = lower(fn("f", intParams(),
        new Statement.Bind("s", "STRING", null),
        new Statement.Print(SourceSpan.UNKNOWN, Expression.ref("s"), true),
        new Statement.Return(null)));
    CnfStatement.Assign bind = (CnfStatement.Assign) body.get(0);
    assertEquals(SemanticType.STRING, bind.targetType());
    assertEquals("", bind.value().getLiteralValue());

    CnfExpression print = ((CnfStatement.Assign) body.get(1)).value();
    assertEquals(CnfLowering.PRINT_LINE_TARGET, print.getCallTarget());
    assertEquals(SemanticType.STRING, print.getArgs().get(0).getType());
    assertNull(((CnfStatement.Return) body.get(2)).value());
  }

  @Test
  public void testUnsupportedExpressionBecomesZero() {
    List<CnfStatement> body = lower(fn("f", intParams(),
        new Statement.Return(new Expression.NoneLiteral(SourceSpan.UNKNOWN))));
    assertEquals(0L, ((CnfStatement.Return) body.get(0)).value()
                                                        .getLiteralValue());
  }

  @Test
  public void testTryCatchFinally() {
    Statement.Try stmt = new Statement.Try(SourceSpan.UNKNOWN,
        Arrays.<Statement>asList(new Statement.CallStatement("risky")),
        Arrays.asList(new Statement.CatchClause("IOException", "e",
            Arrays.<Statement>asList(new Statement.Return(
                                                Expression.intLit(1))))),
        Arrays.<Statement>asList(new Statement.CallStatement("cleanup")));
    CnfTree.Function lowered = new CnfLowering(logger).lowerFunction(
        fn("guarded", intParams(), stmt,
           new Statement.Return(Expression.intLit(0))));
    CnfValidator.validate(logger, lowered);

    assertEquals(2, lowered.body().size());
    CnfStatement.Try t = (CnfStatement.Try) lowered.body().get(0);
    assertEquals(1, t.catchClauses().size());
    assertEquals("e", t.catchClauses().get(0).variableName);
    assertEquals(3, t.nestedSequences().size());
    assertTrue(lowered.allStatements().size() > lowered.body().size());
  }
}
