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

import exm.calor.ast.BinaryOperator;

/**
 * Closed set of types known to the normal form.
 */
public enum SemanticType {
  INT,
  LONG,
  FLOAT,
  DOUBLE,
  BOOL,
  STRING,
  VOID,
  OBJECT;

  /**
   * Map a source type name onto a semantic type.  Names are matched
   * case-insensitively; unrecognised or missing names are OBJECT.
   */
  public static SemanticType fromTypeName(String typeName) {
    if (typeName == null) {
      return OBJECT;
    }
    String n = typeName.trim().toUpperCase();
    if (n.equals("INT") || n.equals("I32")) {
      return INT;
    } else if (n.equals("I64") || n.equals("LONG")) {
      return LONG;
    } else if (n.equals("F32") || n.equals("FLOAT")) {
      return FLOAT;
    } else if (n.equals("F64") || n.equals("DOUBLE")) {
      return DOUBLE;
    } else if (n.equals("BOOL")) {
      return BOOL;
    } else if (n.equals("STRING")) {
      return STRING;
    } else if (n.equals("VOID")) {
      return VOID;
    } else {
      return OBJECT;
    }
  }

  /**
   * Result type of a binary operation: booleans for comparisons and
   * logical operators, otherwise the wider numeric operand type.
   */
  public static SemanticType binaryResultType(BinaryOperator op,
                          SemanticType left, SemanticType right) {
    if (op.isBoolean()) {
      return BOOL;
    }
    if (left == DOUBLE || right == DOUBLE) {
      return DOUBLE;
    } else if (left == FLOAT || right == FLOAT) {
      return FLOAT;
    } else if (left == LONG || right == LONG) {
      return LONG;
    } else {
      return INT;
    }
  }

  /**
   * @return the zero value of this type.  Types without a canonical zero
   *         get an integer 0.
   */
  public CnfExpression defaultValue() {
    switch (this) {
      case INT:
        return CnfExpression.createIntLit(0);
      case LONG:
        return CnfExpression.createLongLit(0L);
      case FLOAT:
        return CnfExpression.createFloatLit(0.0f);
      case DOUBLE:
        return CnfExpression.createDoubleLit(0.0);
      case BOOL:
        return CnfExpression.createBoolLit(false);
      case STRING:
        return CnfExpression.createStringLit("");
      default:
        return CnfExpression.createIntLit(0);
    }
  }

  public boolean isNumeric() {
    return this == INT || this == LONG || this == FLOAT || this == DOUBLE;
  }
}
