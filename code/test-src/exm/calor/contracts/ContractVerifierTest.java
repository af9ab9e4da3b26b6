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
package exm.calor.contracts;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.calor.ast.BinaryOperator;
import exm.calor.ast.Expression;
import exm.calor.ast.Expression.ExpressionKind;
import exm.calor.ast.Expression.QuantifierVariable;
import exm.calor.ast.SourceSpan;
import exm.calor.ast.Statement;
import exm.calor.ast.SyntaxTree;
import exm.calor.ast.SyntaxTree.Ensures;
import exm.calor.ast.SyntaxTree.Parameter;
import exm.calor.ast.SyntaxTree.Requires;
import exm.calor.cnf.SemanticType;
import exm.calor.diagnostics.DiagnosticBag;
import exm.calor.diagnostics.DiagnosticCode;
import exm.calor.diagnostics.Severity;

public class ContractVerifierTest {

  private static SyntaxTree.Function fn(String output, List<Requires> pre,
                                        List<Ensures> post) {
    return new SyntaxTree.Function(SourceSpan.UNKNOWN, "f001", "f",
        Arrays.asList(new Parameter("x", "INT"), new Parameter("y", "INT")),
        output, pre, post, Collections.<Statement>emptyList());
  }

  private static DiagnosticBag verifyPre(Expression cond) {
    DiagnosticBag bag = new DiagnosticBag();
    new ContractVerifier(bag).verifyFunction(fn("INT",
        Arrays.asList(new Requires(cond)), Collections.<Ensures>emptyList()));
    return bag;
  }

  private static DiagnosticBag verifyPost(String output, Expression cond) {
    DiagnosticBag bag = new DiagnosticBag();
    new ContractVerifier(bag).verifyFunction(fn(output,
        Collections.<Requires>emptyList(), Arrays.asList(new Ensures(cond))));
    return bag;
  }

  private static Expression forall(String var, String type, Expression body) {
    return new Expression.Quantifier(SourceSpan.UNKNOWN, ExpressionKind.FORALL,
        Arrays.asList(new QuantifierVariable(var, type)), body);
  }

  @Test
  public void testValidContracts() {
    DiagnosticBag bag = new DiagnosticBag();
    new ContractVerifier(bag).verify(new SyntaxTree.Module("m001", "Test",
        Arrays.asList(fn("INT",
            Arrays.asList(new Requires(Expression.binary(
                BinaryOperator.GREATER_THAN, Expression.ref("x"),
                Expression.ref("y")))),
            Arrays.asList(new Ensures(Expression.binary(
                BinaryOperator.GREATER_OR_EQUAL, Expression.ref("result"),
                Expression.intLit(0))))))));
    assertEquals(0, bag.size());
  }

  @Test
  public void testPreconditionUnknownName() {
    DiagnosticBag bag = verifyPre(Expression.binary(BinaryOperator.LESS_THAN,
        Expression.ref("x"), Expression.ref("limit")));
    assertEquals(1, bag.count(DiagnosticCode.UNDEFINED_REFERENCE));
    assertEquals("Precondition can only reference parameters. " +
                 "Unknown identifier: 'limit'",
                 bag.getDiagnostics().get(0).getMessage());
  }

  @Test
  public void testResultNotAllowedInPrecondition() {
    DiagnosticBag bag = verifyPre(Expression.binary(BinaryOperator.EQUAL,
        Expression.ref("result"), Expression.intLit(0)));
    assertEquals(1, bag.count(DiagnosticCode.UNDEFINED_REFERENCE));
  }

  @Test
  public void testNonBooleanCondition() {
    DiagnosticBag bag = verifyPre(Expression.binary(BinaryOperator.ADD,
        Expression.ref("x"), Expression.intLit(1)));
    assertEquals(1, bag.count(DiagnosticCode.TYPE_MISMATCH));
    assertEquals("Precondition must be a boolean expression, got INT",
                 bag.getDiagnostics().get(0).getMessage());

    // A bare reference can't be typed before binding
    assertEquals(0, verifyPre(Expression.ref("x")).size());
  }

  @Test
  public void testResultInVoidFunction() {
    DiagnosticBag bag = verifyPost(null, Expression.binary(
        BinaryOperator.GREATER_THAN, Expression.ref("result"),
        Expression.intLit(0)));
    assertEquals(1, bag.count(DiagnosticCode.INVALID_REFERENCE));
    assertEquals(
        "Cannot reference 'result' in postcondition of void function",
        bag.getDiagnostics().get(0).getMessage());
  }

  @Test
  public void testPostconditionUnknownName() {
    DiagnosticBag bag = verifyPost("INT", Expression.binary(
        BinaryOperator.GREATER_THAN, Expression.ref("result"),
        Expression.ref("z")));
    assertEquals(1, bag.count(DiagnosticCode.UNDEFINED_REFERENCE));
    assertTrue(bag.getDiagnostics().get(0).getMessage().endsWith("'z'"));
  }

  @Test
  public void testQuantifierChecks() {
    Expression body = Expression.binary(BinaryOperator.GREATER_OR_EQUAL,
        Expression.ref("k"), Expression.intLit(0));
    assertEquals(0, verifyPre(forall("k", "i32", body)).size());

    DiagnosticBag bag = verifyPre(forall("s", "STRING", body));
    assertEquals(1, bag.count(DiagnosticCode.QUANTIFIER_NON_INTEGER_TYPE));
    assertEquals(Severity.WARNING, bag.getDiagnostics().get(0).getSeverity());

    bag = verifyPre(new Expression.Implication(SourceSpan.UNKNOWN,
        Expression.boolLit(true),
        forall("a", "INT", forall("b", "INT", body))));
    assertEquals(1, bag.count(DiagnosticCode.QUANTIFIER_NESTED_COMPLEXITY));
    assertFalse(bag.hasErrors());
  }

  @Test
  public void testIntegerQuantifierDomains() {
    Expression body = Expression.binary(BinaryOperator.GREATER_OR_EQUAL,
        Expression.ref("k"), Expression.intLit(0));
    for (String type: Arrays.asList("short", "byte", "ushort", "uint",
                                    "ulong", "sbyte", "Long", "u16")) {
      assertEquals(type, 0, verifyPre(forall("k", type, body)).size());
    }
    assertEquals(1, verifyPre(forall("k", "float", body))
                      .count(DiagnosticCode.QUANTIFIER_NON_INTEGER_TYPE));
  }

  @Test
  public void testMultipleBoundVariablesCountAsNested() {
    Expression body = Expression.binary(BinaryOperator.LESS_THAN,
        Expression.ref("i"), Expression.ref("j"));
    DiagnosticBag bag = verifyPre(new Expression.Quantifier(
        SourceSpan.UNKNOWN, ExpressionKind.EXISTS,
        Arrays.asList(new QuantifierVariable("i", "INT"),
                      new QuantifierVariable("j", "INT")), body));
    assertEquals(1, bag.size());
    assertEquals(DiagnosticCode.QUANTIFIER_NESTED_COMPLEXITY,
                 bag.getDiagnostics().get(0).getCode());
    assertEquals("Nested quantifier with 2 bound variables may result " +
                 "in O(n^2) runtime checks",
                 bag.getDiagnostics().get(0).getMessage());
    assertEquals(Severity.INFO, bag.getDiagnostics().get(0).getSeverity());
  }

  @Test
  public void testQuantifierInsideConditional() {
    Expression body = Expression.binary(BinaryOperator.EQUAL,
        Expression.ref("s"), Expression.ref("s"));
    DiagnosticBag bag = verifyPre(new Expression.Conditional(
        SourceSpan.UNKNOWN, Expression.boolLit(true),
        forall("s", "STRING", body), Expression.boolLit(false)));
    assertEquals(1, bag.count(DiagnosticCode.QUANTIFIER_NON_INTEGER_TYPE));
    assertFalse(bag.hasErrors());
  }

  @Test
  public void testCollectReferences() {
    Expression e = Expression.binary(BinaryOperator.AND,
        Expression.binary(BinaryOperator.LESS_THAN, Expression.ref("b"),
                          Expression.ref("a")),
        Expression.binary(BinaryOperator.EQUAL, Expression.ref("b"),
                          Expression.intLit(0)));
    assertEquals(Arrays.asList("b", "a"),
        Arrays.asList(ContractVerifier.collectReferences(e)
                                      .toArray(new String[0])));
    assertEquals(SemanticType.BOOL, ContractVerifier.inferType(e));
  }
}
