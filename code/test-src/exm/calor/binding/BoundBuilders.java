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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import exm.calor.ast.BinaryOperator;
import exm.calor.ast.SourceSpan;
import exm.calor.ast.UnaryOperator;
import exm.calor.binding.BoundTree.BoundFunction;

/**
 * Shorthand for building bound trees in tests.  Each statement gets a
 * distinct line number so diagnostics can be told apart.
 */
public class BoundBuilders {

  private static int nextLine = 1;

  public static SourceSpan span() {
    return new SourceSpan("test.calr", nextLine++, 1);
  }

  public static VariableSymbol local(String name) {
    return new VariableSymbol(name, "INT", true, false);
  }

  public static VariableSymbol local(String name, String type) {
    return new VariableSymbol(name, type, true, false);
  }

  public static VariableSymbol param(String name) {
    return new VariableSymbol(name, "INT", false, true);
  }

  public static VariableSymbol param(String name, String type) {
    return new VariableSymbol(name, type, false, true);
  }

  public static BoundExpression ref(VariableSymbol v) {
    return new BoundExpression.Variable(span(), v);
  }

  public static BoundExpression lit(long value) {
    return new BoundExpression.IntLiteral(span(), value);
  }

  public static BoundExpression str(String value) {
    return new BoundExpression.StringLiteral(span(), value);
  }

  public static BoundExpression bin(BinaryOperator op, BoundExpression left,
                                    BoundExpression right) {
    String type = op.isBoolean() ? "BOOL" : left.typeName();
    return new BoundExpression.Binary(span(), op, left, right, type);
  }

  public static BoundExpression neg(BoundExpression operand) {
    return new BoundExpression.Unary(span(), UnaryOperator.NEGATE, operand,
                                     operand.typeName());
  }

  public static BoundExpression call(String target, BoundExpression... args) {
    return new BoundExpression.Call(span(), target, Arrays.asList(args),
                                    "INT");
  }

  public static BoundStatement bind(VariableSymbol v, BoundExpression init) {
    return new BoundStatement.Bind(span(), v, init);
  }

  public static BoundStatement assign(VariableSymbol v,
                                      BoundExpression value) {
    return new BoundStatement.Assign(span(), v, value);
  }

  public static BoundStatement callStmt(String target,
                                        BoundExpression... args) {
    return new BoundStatement.Call(span(), target, Arrays.asList(args));
  }

  public static BoundStatement ret(BoundExpression value) {
    return new BoundStatement.Return(span(), value);
  }

  public static BoundStatement ifThen(BoundExpression cond,
                                      List<BoundStatement> thenBody) {
    return new BoundStatement.If(span(), cond, thenBody, null, null);
  }

  public static BoundStatement ifElse(BoundExpression cond,
      List<BoundStatement> thenBody, List<BoundStatement> elseBody) {
    return new BoundStatement.If(span(), cond, thenBody, null, elseBody);
  }

  public static BoundStatement whileLoop(BoundExpression cond,
                                         BoundStatement... body) {
    return new BoundStatement.While(span(), cond, Arrays.asList(body));
  }

  public static BoundStatement forLoop(VariableSymbol v, BoundExpression from,
      BoundExpression to, BoundStatement... body) {
    return new BoundStatement.For(span(), v, from, to, null,
                                  Arrays.asList(body));
  }

  public static List<BoundStatement> block(BoundStatement... stmts) {
    return new ArrayList<BoundStatement>(Arrays.asList(stmts));
  }

  public static BoundFunction function(String name,
      List<VariableSymbol> params, BoundStatement... body) {
    FunctionSymbol sym = new FunctionSymbol(name, "INT", params);
    return new BoundFunction(span(), sym, Arrays.asList(body));
  }

  public static BoundFunction function(String name, BoundStatement... body) {
    return function(name, new ArrayList<VariableSymbol>(), body);
  }

  public static List<VariableSymbol> params(VariableSymbol... ps) {
    return Arrays.asList(ps);
  }
}
