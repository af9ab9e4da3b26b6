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
package exm.calor.cnf;

import java.util.Arrays;
import java.util.Collections;

import org.apache.log4j.Logger;
import org.junit.Test;

import exm.calor.common.Logging;
import exm.calor.common.exceptions.CalorRuntimeError;

public class CnfValidatorTest {

  private static final Logger logger = Logging.getCalorLogger();

  private static CnfTree.Function fn(CnfStatement... body) {
    return new CnfTree.Function("f001", "f",
        Collections.<CnfTree.Parameter>emptyList(), SemanticType.VOID,
        Arrays.asList(body));
  }

  private static CnfExpression var(String name) {
    return CnfExpression.createVar(name, SemanticType.INT);
  }

  @Test
  public void testWellFormed() {
    CnfValidator.validate(logger, fn(
        new CnfStatement.Assign("x", CnfExpression.createBinaryOp(
            CnfBinaryOp.ADD, var("a"), CnfExpression.createIntLit(1),
            SemanticType.INT), SemanticType.INT),
        new CnfStatement.Branch(var("x"), "yes_1", "no_2"),
        new CnfStatement.Label("yes_1"),
        new CnfStatement.Goto("no_2"),
        new CnfStatement.Label("no_2"),
        new CnfStatement.Return(var("x"))));
  }

  @Test(expected=CalorRuntimeError.class)
  public void testUndefinedTarget() {
    CnfValidator.validate(logger, fn(new CnfStatement.Goto("nowhere")));
  }

  @Test(expected=CalorRuntimeError.class)
  public void testDuplicateLabel() {
    CnfValidator.validate(logger, fn(
        new CnfStatement.Goto("l_1"),
        new CnfStatement.Label("l_1"),
        new CnfStatement.Label("l_1")));
  }

  @Test(expected=CalorRuntimeError.class)
  public void testUnreferencedLabel() {
    CnfValidator.validate(logger, fn(new CnfStatement.Label("orphan_1")));
  }

  @Test(expected=CalorRuntimeError.class)
  public void testNestedCompoundExpression() {
    CnfExpression inner = CnfExpression.createBinaryOp(CnfBinaryOp.MULTIPLY,
        var("b"), var("c"), SemanticType.INT);
    CnfValidator.validate(logger, fn(
        new CnfStatement.Assign("x", CnfExpression.createBinaryOp(
            CnfBinaryOp.ADD, var("a"), inner, SemanticType.INT),
            SemanticType.INT)));
  }

  @Test(expected=CalorRuntimeError.class)
  public void testCompoundReturn() {
    CnfValidator.validate(logger, fn(new CnfStatement.Return(
        CnfExpression.createCall("g",
            Collections.<CnfExpression>emptyList(), SemanticType.INT))));
  }
}
