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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.calor.ast.BinaryOperator;

public class SemanticTypeTest {

  @Test
  public void testFromTypeName() {
    assertEquals(SemanticType.INT, SemanticType.fromTypeName("i32"));
    assertEquals(SemanticType.INT, SemanticType.fromTypeName(" INT "));
    assertEquals(SemanticType.LONG, SemanticType.fromTypeName("i64"));
    assertEquals(SemanticType.FLOAT, SemanticType.fromTypeName("f32"));
    assertEquals(SemanticType.DOUBLE, SemanticType.fromTypeName("f64"));
    assertEquals(SemanticType.STRING, SemanticType.fromTypeName("string"));
    assertEquals(SemanticType.OBJECT, SemanticType.fromTypeName("Widget"));
    assertEquals(SemanticType.OBJECT, SemanticType.fromTypeName(null));
  }

  @Test
  public void testBinaryResultType() {
    assertEquals(SemanticType.BOOL, SemanticType.binaryResultType(
        BinaryOperator.LESS_THAN, SemanticType.DOUBLE, SemanticType.INT));
    assertEquals(SemanticType.LONG, SemanticType.binaryResultType(
        BinaryOperator.ADD, SemanticType.INT, SemanticType.LONG));
    assertEquals(SemanticType.DOUBLE, SemanticType.binaryResultType(
        BinaryOperator.MULTIPLY, SemanticType.FLOAT, SemanticType.DOUBLE));
    assertEquals(SemanticType.INT, SemanticType.binaryResultType(
        BinaryOperator.ADD, SemanticType.OBJECT, SemanticType.INT));
  }

  @Test
  public void testDefaultValues() {
    assertEquals(0L, SemanticType.INT.defaultValue().getLiteralValue());
    assertEquals(Boolean.FALSE,
                 SemanticType.BOOL.defaultValue().getLiteralValue());
    assertEquals("", SemanticType.STRING.defaultValue().getLiteralValue());
    assertEquals(SemanticType.LONG, SemanticType.LONG.defaultValue().getType());
    assertTrue(SemanticType.FLOAT.isNumeric());
    assertFalse(SemanticType.OBJECT.isNumeric());
  }
}
