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
package exm.calor.binding;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.calor.ast.BinaryOperator;
import exm.calor.ast.Expression;
import exm.calor.ast.SourceSpan;
import exm.calor.ast.Statement;
import exm.calor.ast.SyntaxTree;
import exm.calor.ast.SyntaxTree.Parameter;
import exm.calor.binding.BoundTree.BoundFunction;
import exm.calor.binding.BoundTree.BoundModule;
import exm.calor.cnf.lowering.CnfLowering;
import exm.calor.diagnostics.DiagnosticBag;
import exm.calor.diagnostics.DiagnosticCode;

public class BinderTest {

  static SyntaxTree.Function fn(String name, List<Parameter> params,
                                String output, Statement... body) {
    return new SyntaxTree.Function(SourceSpan.UNKNOWN, "f_" + name, name,
        params, output, Collections.<SyntaxTree.Requires>emptyList(),
        Collections.<SyntaxTree.Ensures>emptyList(), Arrays.asList(body));
  }

  static SyntaxTree.Module module(SyntaxTree.Function... fns) {
    return new SyntaxTree.Module("m001", "Test", Arrays.asList(fns));
  }

  private static List<Parameter> noParams() {
    return new ArrayList<Parameter>();
  }

  @Test
  public void testParameterReference() {
    DiagnosticBag bag = new DiagnosticBag();
    BoundModule m = new Binder(bag).bind(module(
        fn("inc", Arrays.asList(new Parameter("x", "INT")), "INT",
           new Statement.Return(Expression.binary(BinaryOperator.ADD,
                  Expression.ref("x"), Expression.intLit(1))))));
    assertFalse(bag.hasErrors());

    BoundFunction f = m.getFunctions().get(0);
    assertEquals("inc", f.getName());
    assertTrue(f.getParameterNames().contains("x"));
    BoundStatement.Return ret = (BoundStatement.Return) f.getBody().get(0);
    BoundExpression.Binary sum = (BoundExpression.Binary) ret.value();
    assertEquals("INT", sum.typeName());
    BoundExpression.Variable x = (BoundExpression.Variable) sum.left();
    assertTrue(x.variable().isParameter());
  }

  @Test
  public void testUndefinedVariable() {
    DiagnosticBag bag = new DiagnosticBag();
    BoundModule m = new Binder(bag).bind(module(
        fn("f", noParams(), "INT",
           new Statement.Return(Expression.ref("y")))));
    assertEquals(1, bag.count(DiagnosticCode.UNDEFINED_REFERENCE));
    assertEquals("Undefined variable 'y'",
        bag.withCode(DiagnosticCode.UNDEFINED_REFERENCE).get(0).getMessage());
    // Still bound, so later passes can run
    assertEquals(1, m.getFunctions().get(0).getBody().size());
  }

  @Test
  public void testDuplicateDefinitions() {
    DiagnosticBag bag = new DiagnosticBag();
    new Binder(bag).bind(module(
        fn("f", noParams(), null,
           new Statement.Bind("x", "INT", Expression.intLit(1)),
           new Statement.Bind("x", "INT", Expression.intLit(2))),
        fn("f", noParams(), null)));
    assertEquals(2, bag.count(DiagnosticCode.DUPLICATE_DEFINITION));
  }

  @Test
  public void testInnerScope() {
    // A name bound inside an if is not visible after it
    DiagnosticBag bag = new DiagnosticBag();
    new Binder(bag).bind(module(
        fn("f", noParams(), "INT",
           new Statement.If(Expression.boolLit(true),
               Arrays.<Statement>asList(
                   new Statement.Bind("t", "INT", Expression.intLit(1))),
               null),
           new Statement.Return(Expression.ref("t")))));
    assertEquals(1, bag.count(DiagnosticCode.UNDEFINED_REFERENCE));
  }

  @Test
  public void testForwardCallType() {
    DiagnosticBag bag = new DiagnosticBag();
    BoundModule m = new Binder(bag).bind(module(
        fn("caller", noParams(), "STRING",
           new Statement.Return(Expression.call("callee"))),
        fn("callee", noParams(), "STRING",
           new Statement.Return(Expression.stringLit("x")))));
    assertFalse(bag.hasErrors());
    BoundStatement.Return ret = (BoundStatement.Return)
                      m.getFunctions().get(0).getBody().get(0);
    assertEquals("STRING", ret.value().typeName());
  }

  @Test
  public void testUnsupportedStatementsDropped() {
    DiagnosticBag bag = new DiagnosticBag();
    BoundModule m = new Binder(bag).bind(module(
        fn("f", noParams(), null,
           new Statement.Throw(SourceSpan.UNKNOWN,
                               Expression.stringLit("boom")),
           new Statement.Print(SourceSpan.UNKNOWN,
                               Expression.stringLit("hi"), true))));
    assertEquals(1, bag.count(DiagnosticCode.TYPE_MISMATCH));
    List<BoundStatement> body = m.getFunctions().get(0).getBody();
    assertEquals(1, body.size());
    assertEquals(CnfLowering.PRINT_LINE_TARGET,
                 ((BoundStatement.Call) body.get(0)).target());
  }

  @Test
  public void testConditionalKeepsTrueArm() {
    DiagnosticBag bag = new DiagnosticBag();
    BoundModule m = new Binder(bag).bind(module(
        fn("f", noParams(), "INT",
           new Statement.Return(new Expression.Conditional(
               SourceSpan.UNKNOWN, Expression.boolLit(true),
               Expression.intLit(1), Expression.ref("missing"))))));
    // False arm is still resolved
    assertEquals(1, bag.count(DiagnosticCode.UNDEFINED_REFERENCE));
    BoundStatement.Return ret = (BoundStatement.Return)
                      m.getFunctions().get(0).getBody().get(0);
    assertEquals(BoundExpression.BoundExpressionKind.INT_LITERAL,
                 ret.value().kind());
    assertEquals(1, ((BoundExpression.IntLiteral) ret.value()).value());
  }
}
